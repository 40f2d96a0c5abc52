package com.pagelens.core.service;

import com.pagelens.core.http.CollectionException;
import com.pagelens.core.model.AnalysisResult;
import com.pagelens.core.model.AnalysisStatus;
import com.pagelens.core.model.AnalyzerResult;
import com.pagelens.core.model.Finding;
import com.pagelens.core.model.Recommendation;
import com.pagelens.core.model.Recommendation.Effort;
import com.pagelens.core.model.Severity;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 분석기 결과 병합기.
 *  - 종합 점수 = COMPLETED 분석기만의 가중 평균(기본 가중치 1.0), 소수 둘째 자리 반올림
 *  - 발견 항목은 분석기 순서대로 평탄화, 심각도별 개수
 *  - 권고: 심각도 내림차순 → 난이도 오름차순 → 같은 카테고리 빈도 내림차순 → 분석기 → 메시지
 */
public final class ResultAggregator {

    public static final String ANALYZER_ERROR = "ANALYZER_ERROR";

    private static final Set<String> EASY = Set.of(
            "TITLE_MISSING", "TITLE_DUPLICATE", "TITLE_LENGTH", "TITLE_FORMAT", "TITLE_BRAND", "TITLE_KEYWORDS",
            "META_REQUIRED", "META_DESCRIPTION", "META_KEYWORDS", "META_ROBOTS", "META_CHARSET",
            "H1_MISSING", "H1_MULTIPLE", "HEADING_EMPTY", "HEADING_LENGTH",
            "ALT_TEXT", "IMAGE_ALT", "IMAGE_DIMENSIONS", "IMAGE_LAZY", "LAZY_LOADING",
            "LANGUAGE", "VIEWPORT", "ZOOM", "TOUCH_ICON", "FONT_DISPLAY",
            "OPEN_GRAPH", "TWITTER_CARD", "SOCIAL_LINKS",
            "HSTS", "SECURITY_HEADERS", "COOKIES", "TABNABBING", "COMPRESSION", "CACHING",
            "ANCHOR_TEXT", "LINK_TEXT", "EXTERNAL_NOFOLLOW", "BROKEN_FRAGMENT", "JSON_LD_CONTEXT", "PARAGRAPH_LENGTH");
    private static final Set<String> HARD = Set.of(
            "HTTPS", "MIXED_CONTENT", "CSP", "XSS", "OUTDATED_LIBRARY", "SENSITIVE_DATA",
            "PAGE_SIZE", "RESOURCE_COUNT", "RENDER_BLOCKING", "FIXED_WIDTH", "RESPONSIVE", "PLUGINS",
            "KEYBOARD", "LANDMARKS", "SCHEMA_MISSING", "CONTENT_EMPTY", "THIN_CONTENT");

    private final Map<String, Double> weights;

    public ResultAggregator() {
        this(Map.of());
    }

    /** @param weights 분석기 이름 → 가중치(없는 이름은 1.0) */
    public ResultAggregator(Map<String, Double> weights) {
        this.weights = Map.copyOf(Objects.requireNonNull(weights, "weights"));
    }

    public double weightOf(String analyzer) {
        return weights.getOrDefault(analyzer, 1.0);
    }

    public AnalysisResult merge(URI url, Map<String, AnalyzerResult> results, Instant startedAt, Instant completedAt) {
        Objects.requireNonNull(results, "results");
        List<Finding> findings = new ArrayList<>();
        double sum = 0;
        double weightSum = 0;
        double plainSum = 0;
        int completed = 0;
        for (AnalyzerResult r : results.values()) {
            findings.addAll(r.getFindings());
            if (!r.isCompleted()) continue;
            double w = weightOf(r.getAnalyzer());
            sum += w * r.getScore();
            weightSum += w;
            plainSum += r.getScore();
            completed++;
        }

        AnalysisStatus status;
        double overall;
        if (completed == 0) {
            status = AnalysisStatus.FAILED;
            overall = 0.0;
        } else {
            status = (completed == results.size()) ? AnalysisStatus.COMPLETED : AnalysisStatus.PARTIAL;
            // 가중치가 전부 0이면 단순 평균
            overall = round2(weightSum > 0 ? sum / weightSum : plainSum / completed);
        }

        AnalysisResult.Builder b = AnalysisResult.builder()
                .url(url.toString())
                .overallScore(overall)
                .analyzers(new LinkedHashMap<>(results))
                .findings(findings)
                .severityCounts(countBySeverity(findings))
                .recommendations(recommend(findings))
                .startedAt(startedAt)
                .completedAt(completedAt)
                .duration(Duration.between(startedAt, completedAt))
                .status(status);
        if (status == AnalysisStatus.FAILED) {
            b.errorKind(ANALYZER_ERROR).errorMessage("no analyzer completed");
        }
        return b.build();
    }

    /** 수집 단계 실패 → 분석기 없는 FAILED 결과(에러 종류 보존) */
    public AnalysisResult failure(URI url, CollectionException e, Instant startedAt, Instant completedAt) {
        return AnalysisResult.builder()
                .url(url.toString())
                .overallScore(0.0)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .status(AnalysisStatus.FAILED)
                .errorKind(e.getKind().name())
                .httpStatus(e.getKind() == CollectionException.Kind.HTTP_STATUS ? e.getStatusCode() : null)
                .errorMessage(e.getMessage())
                .build();
    }

    public static Map<Severity, Integer> countBySeverity(List<Finding> findings) {
        EnumMap<Severity, Integer> m = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) m.put(s, 0);
        for (Finding f : findings) m.merge(f.getSeverity(), 1, Integer::sum);
        return m;
    }

    /** 발견 항목 → 우선순위 정렬된 권고 목록 */
    public static List<Recommendation> recommend(List<Finding> findings) {
        Map<String, Integer> freq = new HashMap<>();
        for (Finding f : findings) freq.merge(f.getCategory(), 1, Integer::sum);

        List<Recommendation> out = new ArrayList<>(findings.size());
        for (Finding f : findings) {
            Effort effort = effortOf(f.getCategory());
            boolean quickWin = effort == Effort.EASY && f.getSeverity().rank() >= Severity.HIGH.rank();
            out.add(new Recommendation(priorityOf(f.getSeverity()), f.getSeverity(), f.getAnalyzer(), f.getCategory(),
                    f.getMessage(), f.getRemediation(), f.getLocation(), effort, quickWin));
        }
        out.sort(Comparator
                .comparingInt((Recommendation r) -> -r.severity().rank())
                .thenComparing(Recommendation::effort)
                .thenComparingInt(r -> -freq.getOrDefault(r.category(), 0))
                .thenComparing(Recommendation::analyzer)
                .thenComparing(Recommendation::message));
        return out;
    }

    static Effort effortOf(String category) {
        String c = (category == null) ? "" : category.toUpperCase(Locale.ROOT);
        if (EASY.contains(c)) return Effort.EASY;
        if (HARD.contains(c)) return Effort.HARD;
        return Effort.MEDIUM;
    }

    /** CRITICAL=P0 … INFO=P4 */
    static String priorityOf(Severity s) {
        return "P" + (Severity.CRITICAL.rank() - s.rank());
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}

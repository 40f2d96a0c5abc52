package com.pagelens.core.analyzer;

import com.pagelens.core.api.IAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.AnalyzerResult;
import com.pagelens.core.model.Finding;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.ScoringWeights;
import com.pagelens.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 공통 점수 정책: 100에서 시작, 발견 항목마다 심각도별 감점, 0 바닥.
 * 하위 클래스는 생성자에서 옵션을 읽고(1회 검증), inspect()에서 발견 항목만 쌓는다.
 */
public abstract class AbstractAnalyzer implements IAnalyzer {

    private final String name;
    private final ScoringWeights weights;

    protected AbstractAnalyzer(String name, AnalyzerConfig config) {
        this.name = Objects.requireNonNull(name, "name");
        this.weights = Objects.requireNonNull(config, "config").getWeights();
    }

    @Override
    public final String name() { return name; }

    @Override
    public final AnalyzerResult analyze(ParsedDocument doc) {
        Findings out = new Findings(name);
        inspect(doc, out);
        List<Finding> findings = out.list();
        return new AnalyzerResult(name, weights.score(findings), findings);
    }

    protected abstract void inspect(ParsedDocument doc, Findings out);

    /** 발견 항목 누적기(분석 1회용) */
    protected static final class Findings {
        private final String analyzer;
        private final List<Finding> items = new ArrayList<>();

        Findings(String analyzer) { this.analyzer = analyzer; }

        public Findings add(String category, Severity severity, String message, String location, String remediation) {
            items.add(Finding.builder()
                    .analyzer(analyzer)
                    .category(category)
                    .severity(severity)
                    .message(message)
                    .location(location)
                    .remediation(remediation)
                    .build());
            return this;
        }

        public Findings add(String category, Severity severity, String message, String remediation) {
            return add(category, severity, message, null, remediation);
        }

        public int size() { return items.size(); }

        List<Finding> list() { return List.copyOf(items); }
    }

    // ---- 하위 클래스 공용 헬퍼 ----

    protected static boolean isBlank(String s) { return s == null || s.isBlank(); }

    protected static String elide(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "…";
    }

    protected static int parsePx(String v) {
        if (v == null) return -1;
        String s = v.trim().toLowerCase(Locale.ROOT);
        if (s.endsWith("px")) s = s.substring(0, s.length() - 2).trim();
        try {
            return (int) Math.round(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}

package com.pagelens.core.service.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pagelens.core.model.AnalysisResult;
import com.pagelens.core.model.AnalysisStatus;
import com.pagelens.core.model.AnalyzerResult;
import com.pagelens.core.model.BatchResult;
import com.pagelens.core.model.Finding;
import com.pagelens.core.model.Recommendation;
import com.pagelens.core.model.Severity;
import com.pagelens.core.model.UrlOutcome;
import com.pagelens.core.service.ResultAggregator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AnalysisResult ⇄ JSON.
 * 형태: {url, overall_score, status, started_at, completed_at, duration(초),
 *        analyzers: {name: {score, status, duration, findings:[{severity, category, message, location, remediation}]}},
 *        severity_counts, recommendations, error_kind?, http_status?, error_message?}
 * 읽을 때 findings는 analyzers에서 평탄화하고 recommendations는 다시 계산한다.
 */
public final class AnalysisJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private AnalysisJson() {}

    public static ObjectMapper mapper() { return MAPPER; }

    public static String toJson(AnalysisResult r) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toDto(r));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("failed to serialize result for " + r.getUrl(), e);
        }
    }

    public static AnalysisResult fromJson(String json) throws IOException {
        return fromDto(MAPPER.readValue(json, ResultDto.class));
    }

    /** 배치 결과: {elapsed, stats, counts, outcomes:[{url, status, error_kind?, result?}]} */
    public static String batchToJson(BatchResult batch) {
        BatchDto dto = new BatchDto();
        dto.elapsed = seconds(batch.getElapsed());
        dto.stats = batch.getStats();
        batch.countsByStatus().forEach((k, v) -> dto.counts.put(k.name(), v));
        for (UrlOutcome o : batch.getOutcomes().values()) {
            OutcomeDto od = new OutcomeDto();
            od.url = o.url();
            od.status = o.status().name();
            od.errorKind = o.errorKind();
            od.httpStatus = o.httpStatus();
            od.message = o.message();
            od.result = (o.result() == null) ? null : toDto(o.result());
            dto.outcomes.add(od);
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(dto);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("failed to serialize batch result", e);
        }
    }

    /** 임시 파일에 쓰고 원자적으로 교체 */
    public static Path write(Path file, AnalysisResult r) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, toJson(r), StandardCharsets.UTF_8);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return file;
    }

    public static AnalysisResult read(Path file) throws IOException {
        return fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    // ---------------- DTO 변환 ----------------

    static ResultDto toDto(AnalysisResult r) {
        ResultDto d = new ResultDto();
        d.url = r.getUrl();
        d.overallScore = r.getOverallScore();
        d.status = r.getStatus().name();
        d.startedAt = r.getStartedAt();
        d.completedAt = r.getCompletedAt();
        d.duration = seconds(r.getDuration());
        d.errorKind = r.getErrorKind();
        d.httpStatus = r.getHttpStatus();
        d.errorMessage = r.getErrorMessage();
        r.getSeverityCounts().forEach((k, v) -> d.severityCounts.put(k.name(), v));
        r.getAnalyzers().forEach((name, ar) -> {
            AnalyzerDto a = new AnalyzerDto();
            a.score = ar.getScore();
            a.status = ar.getStatus().name();
            a.duration = seconds(ar.getDuration());
            for (Finding f : ar.getFindings()) a.findings.add(FindingDto.of(f));
            d.analyzers.put(name, a);
        });
        for (Recommendation rec : r.getRecommendations()) d.recommendations.add(rec);
        return d;
    }

    static AnalysisResult fromDto(ResultDto d) {
        if (d.url == null || d.status == null || d.startedAt == null || d.completedAt == null) {
            throw new IllegalArgumentException("url, status, started_at and completed_at are required");
        }
        Map<String, AnalyzerResult> analyzers = new LinkedHashMap<>();
        List<Finding> all = new ArrayList<>();
        d.analyzers.forEach((name, a) -> {
            List<Finding> fs = new ArrayList<>();
            for (FindingDto f : a.findings) fs.add(f.toFinding(name));
            AnalyzerResult.Status st = (a.status == null) ? AnalyzerResult.Status.COMPLETED : AnalyzerResult.Status.valueOf(a.status);
            analyzers.put(name, new AnalyzerResult(name, a.score, fs, duration(a.duration), st));
            all.addAll(fs);
        });
        EnumMap<Severity, Integer> counts = new EnumMap<>(ResultAggregator.countBySeverity(all));
        return AnalysisResult.builder()
                .url(d.url)
                .overallScore(d.overallScore)
                .analyzers(analyzers)
                .findings(all)
                .severityCounts(counts)
                .recommendations(ResultAggregator.recommend(all))
                .startedAt(d.startedAt)
                .completedAt(d.completedAt)
                .duration(duration(d.duration))
                .status(AnalysisStatus.valueOf(d.status))
                .errorKind(d.errorKind)
                .httpStatus(d.httpStatus)
                .errorMessage(d.errorMessage)
                .build();
    }

    static double seconds(Duration d) {
        return (d == null) ? 0.0 : d.toNanos() / 1_000_000_000.0;
    }

    static Duration duration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000.0));
    }

    // Jackson 바인딩용(필드 공개, 스네이크 케이스는 매퍼 전략으로)
    static final class ResultDto {
        public String url;
        public double overallScore;
        public String status;
        public Instant startedAt;
        public Instant completedAt;
        public double duration;
        public String errorKind;
        public Integer httpStatus;
        public String errorMessage;
        public Map<String, Integer> severityCounts = new LinkedHashMap<>();
        public Map<String, AnalyzerDto> analyzers = new LinkedHashMap<>();
        @JsonProperty(access = JsonProperty.Access.READ_ONLY)
        public List<Recommendation> recommendations = new ArrayList<>();
    }

    static final class AnalyzerDto {
        public double score;
        public String status;
        public double duration;
        public List<FindingDto> findings = new ArrayList<>();
    }

    static final class FindingDto {
        public String severity;
        public String category;
        public String message;
        @JsonInclude(JsonInclude.Include.ALWAYS)
        public String location;
        public String remediation;

        static FindingDto of(Finding f) {
            FindingDto d = new FindingDto();
            d.severity = f.getSeverity().name();
            d.category = f.getCategory();
            d.message = f.getMessage();
            d.location = f.getLocation();
            d.remediation = f.getRemediation();
            return d;
        }

        Finding toFinding(String analyzer) {
            return Finding.builder()
                    .analyzer(analyzer)
                    .category(category)
                    .severity(Severity.parse(severity))
                    .message(message)
                    .location(location)
                    .remediation(remediation)
                    .build();
        }
    }

    static final class BatchDto {
        public double elapsed;
        public Object stats;
        public Map<String, Integer> counts = new LinkedHashMap<>();
        public List<OutcomeDto> outcomes = new ArrayList<>();
    }

    static final class OutcomeDto {
        public String url;
        public String status;
        public String errorKind;
        public Integer httpStatus;
        public String message;
        public ResultDto result;
    }
}

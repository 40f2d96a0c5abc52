package com.pagelens.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * URL 하나에 대한 최종 결과(불변). ResultAggregator가 한 번 조립한다.
 * 수집 실패 시에는 analyzers가 비어 있고 errorKind/errorMessage가 채워진다.
 */
public final class AnalysisResult {
    private final String url;
    private final double overallScore;
    private final Map<String, AnalyzerResult> analyzers;
    private final List<Finding> findings;
    private final Map<Severity, Integer> severityCounts;
    private final List<Recommendation> recommendations;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Duration duration;
    private final AnalysisStatus status;
    private final String errorKind;
    private final Integer httpStatus;
    private final String errorMessage;

    private AnalysisResult(Builder b) {
        this.url = b.url;
        this.overallScore = AnalyzerResult.clamp(b.overallScore);
        this.analyzers = Collections.unmodifiableMap(new LinkedHashMap<>(b.analyzers));
        this.findings = List.copyOf(b.findings);
        EnumMap<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) counts.put(s, 0);
        if (b.severityCounts != null) counts.putAll(b.severityCounts);
        this.severityCounts = Collections.unmodifiableMap(counts);
        this.recommendations = List.copyOf(b.recommendations);
        this.startedAt = b.startedAt;
        this.completedAt = b.completedAt;
        this.duration = (b.duration != null) ? b.duration : Duration.between(b.startedAt, b.completedAt);
        this.status = b.status;
        this.errorKind = b.errorKind;
        this.httpStatus = b.httpStatus;
        this.errorMessage = b.errorMessage;
    }

    public String getUrl() { return url; }
    public double getOverallScore() { return overallScore; }
    public Map<String, AnalyzerResult> getAnalyzers() { return analyzers; }
    public List<Finding> getFindings() { return findings; }
    public Map<Severity, Integer> getSeverityCounts() { return severityCounts; }
    public List<Recommendation> getRecommendations() { return recommendations; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Duration getDuration() { return duration; }
    public AnalysisStatus getStatus() { return status; }
    public String getErrorKind() { return errorKind; }
    public Integer getHttpStatus() { return httpStatus; }
    public String getErrorMessage() { return errorMessage; }

    public int totalFindings() { return findings.size(); }

    @Override public String toString() {
        return "AnalysisResult{" + url + " " + status + " overall=" + overallScore
                + " analyzers=" + analyzers.keySet() + " findings=" + findings.size() + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private double overallScore;
        private Map<String, AnalyzerResult> analyzers = Map.of();
        private List<Finding> findings = List.of();
        private Map<Severity, Integer> severityCounts;
        private List<Recommendation> recommendations = List.of();
        private Instant startedAt;
        private Instant completedAt;
        private Duration duration;
        private AnalysisStatus status;
        private String errorKind;
        private Integer httpStatus;
        private String errorMessage;

        public Builder url(String v) { this.url = v; return this; }
        public Builder overallScore(double v) { this.overallScore = v; return this; }
        public Builder analyzers(Map<String, AnalyzerResult> v) { this.analyzers = (v == null ? Map.of() : v); return this; }
        public Builder findings(List<Finding> v) { this.findings = (v == null ? List.of() : v); return this; }
        public Builder severityCounts(Map<Severity, Integer> v) { this.severityCounts = v; return this; }
        public Builder recommendations(List<Recommendation> v) { this.recommendations = (v == null ? List.of() : v); return this; }
        public Builder startedAt(Instant v) { this.startedAt = v; return this; }
        public Builder completedAt(Instant v) { this.completedAt = v; return this; }
        public Builder duration(Duration v) { this.duration = v; return this; }
        public Builder status(AnalysisStatus v) { this.status = v; return this; }
        public Builder errorKind(String v) { this.errorKind = v; return this; }
        public Builder httpStatus(Integer v) { this.httpStatus = v; return this; }
        public Builder errorMessage(String v) { this.errorMessage = v; return this; }

        public AnalysisResult build() {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(startedAt, "startedAt");
            Objects.requireNonNull(completedAt, "completedAt");
            Objects.requireNonNull(status, "status");
            if (status == AnalysisStatus.SKIPPED) {
                throw new IllegalArgumentException("status SKIPPED is reserved for batch outcomes");
            }
            return new AnalysisResult(this);
        }
    }
}

package com.pagelens.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 분석기 1회 실행 결과(불변).
 * score는 생성 시 [0,100]으로 클램프된다. duration은 실행 메타데이터라 equals에서 제외.
 */
public final class AnalyzerResult {

    /** 분석기 실행 상태. COMPLETED만 종합 점수 가중평균에 참여한다. */
    public enum Status { COMPLETED, FAILED, TIMED_OUT }

    private final String analyzer;
    private final double score;
    private final List<Finding> findings;
    private final Duration duration;
    private final Status status;

    public AnalyzerResult(String analyzer, double score, List<Finding> findings) {
        this(analyzer, score, findings, Duration.ZERO, Status.COMPLETED);
    }

    public AnalyzerResult(String analyzer, double score, List<Finding> findings, Duration duration, Status status) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.score = clamp(score);
        this.findings = List.copyOf(Objects.requireNonNull(findings, "findings"));
        this.duration = (duration == null || duration.isNegative()) ? Duration.ZERO : duration;
        this.status = Objects.requireNonNull(status, "status");
    }

    /** 실패/타임아웃한 분석기를 대체하는 결과(점수 0, 가중평균 제외). */
    public static AnalyzerResult failed(String analyzer, Status status, Finding synthetic, Duration duration) {
        if (status == Status.COMPLETED) throw new IllegalArgumentException("status must not be COMPLETED");
        return new AnalyzerResult(analyzer, 0.0, List.of(synthetic), duration, status);
    }

    public AnalyzerResult withDuration(Duration d) {
        return new AnalyzerResult(analyzer, score, findings, d, status);
    }

    public String getAnalyzer() { return analyzer; }
    public double getScore() { return score; }
    public List<Finding> getFindings() { return findings; }
    public Duration getDuration() { return duration; }
    public Status getStatus() { return status; }
    public boolean isCompleted() { return status == Status.COMPLETED; }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(100.0, v));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalyzerResult r)) return false;
        return analyzer.equals(r.analyzer)
                && Double.compare(score, r.score) == 0
                && findings.equals(r.findings)
                && status == r.status;
    }

    @Override public int hashCode() {
        return Objects.hash(analyzer, score, findings, status);
    }

    @Override public String toString() {
        return "AnalyzerResult{" + analyzer + " score=" + score + " findings=" + findings.size() + " " + status + "}";
    }
}

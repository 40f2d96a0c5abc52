package com.pagelens.core.model;

import java.util.Objects;

/** 우선순위가 매겨진 개선 권고 1건. Finding에서 파생된다. */
public record Recommendation(
        String priority,       // P0..P4
        Severity severity,
        String analyzer,
        String category,
        String message,
        String remediation,
        String location,
        Effort effort,
        boolean quickWin
) {
    /** 조치 난이도 추정치 */
    public enum Effort { EASY, MEDIUM, HARD }

    public Recommendation {
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(analyzer, "analyzer");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(effort, "effort");
        remediation = (remediation == null) ? "" : remediation;
    }
}

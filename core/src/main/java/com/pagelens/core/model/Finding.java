package com.pagelens.core.model;

import java.util.Objects;

/** 분석기 하나가 보고한 개별 이슈(불변). */
public final class Finding {
    private final String analyzer;
    private final String category;
    private final Severity severity;
    private final String message;
    private final String location;      // 선택(없으면 null)
    private final String remediation;

    private Finding(Builder b) {
        this.analyzer = b.analyzer;
        this.category = b.category;
        this.severity = b.severity;
        this.message = b.message;
        this.location = b.location;
        this.remediation = (b.remediation == null) ? "" : b.remediation;
    }

    public String getAnalyzer() { return analyzer; }
    public String getCategory() { return category; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public String getLocation() { return location; }
    public String getRemediation() { return remediation; }

    public Builder toBuilder() {
        return builder()
                .analyzer(analyzer)
                .category(category)
                .severity(severity)
                .message(message)
                .location(location)
                .remediation(remediation);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding f)) return false;
        return analyzer.equals(f.analyzer)
                && category.equals(f.category)
                && severity == f.severity
                && message.equals(f.message)
                && Objects.equals(location, f.location)
                && remediation.equals(f.remediation);
    }

    @Override public int hashCode() {
        return Objects.hash(analyzer, category, severity, message, location, remediation);
    }

    @Override public String toString() {
        return "Finding{" + severity + " " + analyzer + "/" + category + ": " + message
                + (location == null ? "" : " @" + location) + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String analyzer;
        private String category;
        private Severity severity;
        private String message;
        private String location;
        private String remediation;

        public Builder analyzer(String v) { this.analyzer = v; return this; }
        public Builder category(String v) { this.category = v; return this; }
        public Builder severity(Severity v) { this.severity = v; return this; }
        public Builder message(String v) { this.message = v; return this; }
        public Builder location(String v) { this.location = v; return this; }
        public Builder remediation(String v) { this.remediation = v; return this; }

        public Finding build() {
            Objects.requireNonNull(analyzer, "analyzer");
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(severity, "severity");
            Objects.requireNonNull(message, "message");
            return new Finding(this);
        }
    }
}

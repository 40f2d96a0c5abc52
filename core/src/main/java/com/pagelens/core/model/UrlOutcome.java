package com.pagelens.core.model;

import java.util.Objects;

/** 배치 내 URL 1건의 결과. SKIPPED/FAILED는 result가 없을 수 있다. */
public record UrlOutcome(String url, AnalysisStatus status, AnalysisResult result,
                         String errorKind, Integer httpStatus, String message) {

    public UrlOutcome {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(status, "status");
    }

    public static UrlOutcome of(AnalysisResult r) {
        return new UrlOutcome(r.getUrl(), r.getStatus(), r, r.getErrorKind(), r.getHttpStatus(), r.getErrorMessage());
    }

    public static UrlOutcome skipped(String url, String reason) {
        return new UrlOutcome(url, AnalysisStatus.SKIPPED, null, null, null, reason);
    }

    public static UrlOutcome failed(String url, String errorKind, String message) {
        return new UrlOutcome(url, AnalysisStatus.FAILED, null, errorKind, null, message);
    }
}

package com.pagelens.core.http;

import java.net.URI;
import java.util.Objects;

/** 수집 실패. 정책상 재시도 후에도 실패한 경우 호출자에게 URL 단위 실패로 올라간다. */
public final class CollectionException extends Exception {

    public enum Kind { TIMEOUT, CONNECTION_ERROR, HTTP_STATUS, ROBOTS_DISALLOWED }

    private final Kind kind;
    private final URI url;
    private final int statusCode;   // HTTP_STATUS일 때만 의미, 그 외 -1

    public CollectionException(Kind kind, URI url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.url = url;
        this.statusCode = statusCode;
    }

    public static CollectionException timeout(URI url, Throwable cause) {
        return new CollectionException(Kind.TIMEOUT, url, -1, "Timed out fetching " + url, cause);
    }

    public static CollectionException connection(URI url, Throwable cause) {
        String why = (cause == null || cause.getMessage() == null) ? String.valueOf(cause) : cause.getMessage();
        return new CollectionException(Kind.CONNECTION_ERROR, url, -1, "Connection error fetching " + url + ": " + why, cause);
    }

    public static CollectionException httpStatus(URI url, int status) {
        return new CollectionException(Kind.HTTP_STATUS, url, status, "HTTP " + status + " for " + url, null);
    }

    public static CollectionException robotsDisallowed(URI url) {
        return new CollectionException(Kind.ROBOTS_DISALLOWED, url, -1, "Disallowed by robots.txt: " + url, null);
    }

    public Kind getKind() { return kind; }
    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }

    /** 일시적 실패(재시도 대상) 여부 */
    public boolean isTransient() {
        return switch (kind) {
            case TIMEOUT, CONNECTION_ERROR -> true;
            case HTTP_STATUS -> statusCode == 429 || statusCode >= 500;
            case ROBOTS_DISALLOWED -> false;
        };
    }
}

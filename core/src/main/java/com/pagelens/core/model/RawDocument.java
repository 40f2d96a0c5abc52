package com.pagelens.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** 수집 결과 원본(바이트 기준). Collector 호출 하나가 소유하고 Processor가 한 번 소비한다. */
public final class RawDocument {
    private final URI url;
    private final URI finalUrl;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final String contentType;
    private final Instant fetchedAt;
    private final long responseTimeMs;
    private final boolean truncated;

    private RawDocument(Builder b) {
        this.url = b.url;
        this.finalUrl = (b.finalUrl == null) ? b.url : b.finalUrl;
        this.statusCode = b.statusCode;
        // 대소문자 무시 조회를 위해 정렬 맵에 복사
        TreeMap<String, List<String>> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (b.headers != null) {
            b.headers.forEach((k, v) -> { if (k != null) h.put(k, List.copyOf(v == null ? List.of() : v)); });
        }
        this.headers = Collections.unmodifiableMap(h);
        this.body = (b.body == null) ? new byte[0] : b.body.clone();
        this.contentType = b.contentType;
        this.fetchedAt = (b.fetchedAt == null) ? Instant.now() : b.fetchedAt;
        this.responseTimeMs = b.responseTimeMs;
        this.truncated = b.truncated;
    }

    public URI getUrl() { return url; }
    public URI getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public byte[] getBody() { return body.clone(); }
    public int getBodyLength() { return body.length; }
    public String getContentType() { return contentType; }
    public Instant getFetchedAt() { return fetchedAt; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public boolean isTruncated() { return truncated; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        List<String> vs = headers(name);
        return vs.isEmpty() ? null : vs.get(0);
    }

    /** 모든 헤더 값(대소문자 무시). 없으면 빈 리스트. */
    public List<String> headers(String name) {
        if (name == null) return List.of();
        List<String> vs = headers.get(name);
        return (vs == null) ? List.of() : vs;
    }

    /** Content-Type의 charset 파라미터. 없거나 알 수 없으면 null(파서가 감지). */
    public Charset declaredCharset() {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return null;
                }
            }
        }
        return null;
    }

    /** 본문 텍스트(charset 없으면 UTF-8) */
    public String text() {
        Charset cs = declaredCharset();
        return new String(body, cs == null ? StandardCharsets.UTF_8 : cs);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private URI finalUrl;
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private String contentType;
        private Instant fetchedAt;
        private long responseTimeMs;
        private boolean truncated;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder finalUrl(URI v) { this.finalUrl = v; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder body(String text) { this.body = (text == null) ? null : text.getBytes(StandardCharsets.UTF_8); return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder fetchedAt(Instant v) { this.fetchedAt = v; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder truncated(boolean v) { this.truncated = v; return this; }

        public RawDocument build() {
            Objects.requireNonNull(url, "url");
            return new RawDocument(this);
        }
    }
}

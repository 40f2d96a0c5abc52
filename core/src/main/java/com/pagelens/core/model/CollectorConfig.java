package com.pagelens.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** 수집기 설정(불변). build() 시점에 한 번만 검증한다. */
public final class CollectorConfig {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; PageLens/1.0; +https://pagelens.dev/bot)";

    private final double requestsPerSecond;
    private final int burst;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Map<String, String> headers;
    private final boolean verifySsl;
    private final boolean followRedirects;
    private final boolean respectRobots;
    private final String userAgent;
    private final long maxBodyBytes;
    private final Duration robotsCacheTtl;

    private CollectorConfig(Builder b) {
        this.requestsPerSecond = b.requestsPerSecond;
        this.burst = b.burst;
        this.timeout = b.timeout;
        this.maxRetries = b.maxRetries;
        this.retryDelay = b.retryDelay;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.verifySsl = b.verifySsl;
        this.followRedirects = b.followRedirects;
        this.respectRobots = b.respectRobots;
        this.userAgent = b.userAgent;
        this.maxBodyBytes = b.maxBodyBytes;
        this.robotsCacheTtl = b.robotsCacheTtl;
    }

    public static CollectorConfig defaults() { return builder().build(); }

    public double getRequestsPerSecond() { return requestsPerSecond; }
    public int getBurst() { return burst; }
    public Duration getTimeout() { return timeout; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRetryDelay() { return retryDelay; }
    public Map<String, String> getHeaders() { return headers; }
    public boolean isVerifySsl() { return verifySsl; }
    public boolean isFollowRedirects() { return followRedirects; }
    public boolean isRespectRobots() { return respectRobots; }
    public String getUserAgent() { return userAgent; }
    public long getMaxBodyBytes() { return maxBodyBytes; }
    public Duration getRobotsCacheTtl() { return robotsCacheTtl; }

    public Builder toBuilder() {
        return builder()
                .requestsPerSecond(requestsPerSecond)
                .burst(burst)
                .timeout(timeout)
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .headers(headers)
                .verifySsl(verifySsl)
                .followRedirects(followRedirects)
                .respectRobots(respectRobots)
                .userAgent(userAgent)
                .maxBodyBytes(maxBodyBytes)
                .robotsCacheTtl(robotsCacheTtl);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private double requestsPerSecond = 2.0;
        private int burst = 1;
        private Duration timeout = Duration.ofSeconds(10);
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Map<String, String> headers = new LinkedHashMap<>();
        private boolean verifySsl = true;
        private boolean followRedirects = true;
        private boolean respectRobots = true;
        private String userAgent = DEFAULT_USER_AGENT;
        private long maxBodyBytes = 5L * 1024 * 1024;
        private Duration robotsCacheTtl = Duration.ofMinutes(30);

        public Builder requestsPerSecond(double v) { this.requestsPerSecond = v; return this; }
        public Builder burst(int v) { this.burst = v; return this; }
        public Builder timeout(Duration v) { this.timeout = v; return this; }
        public Builder maxRetries(int v) { this.maxRetries = v; return this; }
        public Builder retryDelay(Duration v) { this.retryDelay = v; return this; }
        public Builder headers(Map<String, String> v) { this.headers = new LinkedHashMap<>(v == null ? Map.of() : v); return this; }
        public Builder header(String name, String value) { this.headers.put(name, value); return this; }
        public Builder verifySsl(boolean v) { this.verifySsl = v; return this; }
        public Builder followRedirects(boolean v) { this.followRedirects = v; return this; }
        public Builder respectRobots(boolean v) { this.respectRobots = v; return this; }
        public Builder userAgent(String v) { this.userAgent = v; return this; }
        public Builder maxBodyBytes(long v) { this.maxBodyBytes = v; return this; }
        public Builder robotsCacheTtl(Duration v) { this.robotsCacheTtl = v; return this; }

        public CollectorConfig build() {
            if (!(requestsPerSecond > 0)) throw new IllegalArgumentException("requestsPerSecond must be > 0");
            if (burst < 1) throw new IllegalArgumentException("burst must be >= 1");
            if (timeout == null || timeout.isNegative() || timeout.isZero())
                throw new IllegalArgumentException("timeout must be > 0");
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            if (retryDelay == null || retryDelay.isNegative())
                throw new IllegalArgumentException("retryDelay must be >= 0");
            if (maxBodyBytes < 1) throw new IllegalArgumentException("maxBodyBytes must be >= 1");
            if (robotsCacheTtl == null || robotsCacheTtl.isNegative())
                throw new IllegalArgumentException("robotsCacheTtl must be >= 0");
            if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
            Objects.requireNonNull(headers, "headers");
            return new CollectorConfig(this);
        }
    }
}

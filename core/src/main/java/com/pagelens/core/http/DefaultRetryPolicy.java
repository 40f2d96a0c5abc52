package com.pagelens.core.http;

import com.pagelens.core.model.CollectorConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 일시적 실패(429/5xx/타임아웃/연결 오류)에서만 재시도. robots 거부와 4xx는 즉시 실패.
 * 지연 = base × 2^(attempt-1) × U(0.9, 1.1), 상한 30초.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    static final Duration MAX_DELAY = Duration.ofSeconds(30);

    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 250); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
    }

    /** max_retries=N → 최대 N+1회 시도, base = retry_delay */
    public static DefaultRetryPolicy from(CollectorConfig cfg) {
        return new DefaultRetryPolicy(cfg.getMaxRetries() + 1, cfg.getRetryDelay().toMillis());
    }

    @Override public boolean shouldRetry(CollectionException failure, int attempt) {
        return attempt < maxAttempts && failure.isTransient();
    }

    @Override public Duration nextDelay(int attempt) {
        int shift = Math.min(Math.max(0, attempt - 1), 20);
        long raw = baseMillis * (1L << shift);
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2); // ±10%
        long ms = Math.min((long) (raw * jitter), MAX_DELAY.toMillis());
        return Duration.ofMillis(ms);
    }

    @Override public int maxAttempts() { return maxAttempts; }
}

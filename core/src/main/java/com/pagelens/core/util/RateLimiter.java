package com.pagelens.core.util;

/**
 * 토큰 버킷. 모든 워커가 하나를 공유해 "합산" 요청률을 제한한다.
 * capacity = 버스트 허용량, refillPerSecond = 초당 보충 토큰(소수 허용).
 */
public final class RateLimiter {
    private final int capacity;
    private final double refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(int capacity, double refillPerSecond) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        if (!(refillPerSecond > 0)) throw new IllegalArgumentException("refillPerSecond must be > 0");
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
        this.lastNs = System.nanoTime();
    }

    /** 토큰 1개를 얻을 때까지 대기(인터럽트 가능) */
    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            // 부족분이 채워질 시간만큼 대기(wait는 모니터를 놓는다)
            long waitMs = (long) Math.ceil((1.0 - tokens) / refillPerSecond * 1000.0);
            this.wait(Math.max(1, waitMs));
        }
    }

    /** 대기 없이 시도 */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) { tokens -= 1.0; return true; }
        return false;
    }

    public int getCapacity() { return capacity; }
    public double getRefillPerSecond() { return refillPerSecond; }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}

package com.pagelens.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class BatchStats {
    private final AtomicLong fetchAttempts = new AtomicLong(0);   // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retries = new AtomicLong(0);         // 재시도 횟수 총합
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong pipelines = new AtomicLong(0);       // 실제 실행된 URL 파이프라인 수
    private final AtomicLong sumWallMs = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addFetch(long attempts, long retriesThisCall) {
        fetchAttempts.addAndGet(attempts);
        retries.addAndGet(retriesThisCall);
    }
    public void addCacheHit() { cacheHits.incrementAndGet(); }
    public void addPipeline(long wallMs) {
        pipelines.incrementAndGet();
        sumWallMs.addAndGet(wallMs);
    }
    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long p = pipelines.get();
        long avg = (p == 0) ? 0 : sumWallMs.get() / p;
        return new Snapshot(fetchAttempts.get(), retries.get(), cacheHits.get(), p,
                maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 */
    public record Snapshot(long fetchAttempts, long retries, long cacheHits, long pipelines,
                           int maxObservedConcurrency, long avgPipelineMs) {}
}

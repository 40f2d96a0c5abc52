package com.pagelens.core.cache;

import com.pagelens.core.model.AnalysisResult;
import com.pagelens.core.model.AnalysisStatus;
import com.pagelens.core.model.CacheEntry;
import com.pagelens.core.util.NamedThreadFactory;
import com.pagelens.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 결과 캐시 프런트.
 *  - TTL: 읽을 때 만료 검사(lazy) + 선택적 백그라운드 스윕
 *  - single-flight: fingerprint당 계산은 동시에 하나, 나머지는 같은 future를 기다린다
 *  - 백엔드 예외 → 바이패스 모드(항상 재계산, 호출자에게 에러 없음)
 *  - COMPLETED 결과만 저장
 */
public final class AnalysisCache implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisCache.class);
    private static final StructuredLog SLOG = StructuredLog.get(AnalysisCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    /** getOrCompute 결과의 출처 */
    public enum Source { HIT, JOINED, COMPUTED }

    public record Lookup(AnalysisResult result, Source source) {}

    public record Stats(long hits, long misses, long joins, long bypasses, long stores) {}

    private final ResultCache backend;
    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentHashMap<String, CompletableFuture<AnalysisResult>> inFlight = new ConcurrentHashMap<>();
    private volatile boolean bypass;
    private volatile ScheduledExecutorService sweeper;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong joins = new AtomicLong();
    private final AtomicLong bypasses = new AtomicLong();
    private final AtomicLong stores = new AtomicLong();

    public AnalysisCache(ResultCache backend, Duration ttl) {
        this(backend, ttl, Clock.systemUTC());
    }

    public AnalysisCache(ResultCache backend, Duration ttl, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
    }

    public static AnalysisCache inMemory(int maxEntries, Duration ttl) {
        return new AnalysisCache(new InMemoryResultCache(maxEntries), ttl);
    }

    /** 만료 전 엔트리만 반환. 만료된 것은 읽는 김에 지운다. */
    public Optional<AnalysisResult> get(String fingerprint) {
        Optional<AnalysisResult> r = peek(fingerprint);
        if (r.isPresent()) hits.incrementAndGet(); else misses.incrementAndGet();
        return r;
    }

    /** COMPLETED가 아니거나 TTL이 0이면 저장하지 않는다 */
    public boolean set(String fingerprint, AnalysisResult result) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(result, "result");
        if (result.getStatus() != AnalysisStatus.COMPLETED || ttl.isZero()) return false;
        if (bypass) {
            bypasses.incrementAndGet();
            return false;
        }
        Instant now = clock.instant();
        try {
            backend.put(new CacheEntry(fingerprint, result, now, now.plus(ttl)));
            stores.incrementAndGet();
            return true;
        } catch (CacheBackendException e) {
            enterBypass("put", e);
            return false;
        }
    }

    public boolean invalidate(String fingerprint) {
        if (bypass) return false;
        try {
            return backend.remove(fingerprint);
        } catch (CacheBackendException e) {
            enterBypass("remove", e);
            return false;
        }
    }

    public void clear() {
        if (bypass) return;
        try {
            backend.clear();
        } catch (CacheBackendException e) {
            enterBypass("clear", e);
        }
    }

    public int evictExpired() {
        if (bypass) return 0;
        try {
            int n = backend.evictExpired(clock.instant());
            if (n > 0) LOG.debug("Evicted {} expired cache entries", n);
            return n;
        } catch (CacheBackendException e) {
            enterBypass("sweep", e);
            return 0;
        }
    }

    /**
     * 캐시 히트면 즉시 반환, 같은 fingerprint 계산이 진행 중이면 그 결과를 기다리고,
     * 아니면 직접 loader를 실행해 저장한다. loader 예외는 기다리던 호출자 모두에게 전파된다.
     */
    public Lookup getOrCompute(String fingerprint, Supplier<AnalysisResult> loader) {
        Objects.requireNonNull(loader, "loader");
        Optional<AnalysisResult> hit = get(fingerprint);
        if (hit.isPresent()) return new Lookup(hit.get(), Source.HIT);

        CompletableFuture<AnalysisResult> mine = new CompletableFuture<>();
        CompletableFuture<AnalysisResult> running = inFlight.putIfAbsent(fingerprint, mine);
        if (running != null) {
            joins.incrementAndGet();
            return new Lookup(await(running), Source.JOINED);
        }

        try {
            // get()과 putIfAbsent 사이에 다른 계산이 끝나 저장됐을 수 있다
            Optional<AnalysisResult> late = peek(fingerprint);
            AnalysisResult result;
            Source source;
            if (late.isPresent()) {
                result = late.get();
                source = Source.HIT;
            } else {
                result = Objects.requireNonNull(loader.get(), "loader returned null");
                set(fingerprint, result);
                source = Source.COMPUTED;
            }
            mine.complete(result);
            return new Lookup(result, source);
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint, mine);
        }
    }

    /** interval마다 만료 엔트리 스윕(데몬 스레드). 중복 호출은 무시. */
    public synchronized void startSweeper(Duration interval) {
        if (sweeper != null) return;
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        ScheduledExecutorService s = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("cache-sweeper"));
        long ms = interval.toMillis();
        s.scheduleWithFixedDelay(this::sweepSafely, ms, ms, TimeUnit.MILLISECONDS);
        sweeper = s;
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }

    public boolean isBypass() { return bypass; }

    public int inFlightCount() { return inFlight.size(); }

    public Duration getTtl() { return ttl; }

    public Stats stats() {
        return new Stats(hits.get(), misses.get(), joins.get(), bypasses.get(), stores.get());
    }

    // ---------------- 내부 ----------------

    private Optional<AnalysisResult> peek(String fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        if (bypass) {
            bypasses.incrementAndGet();
            return Optional.empty();
        }
        try {
            Optional<CacheEntry> e = backend.get(fingerprint);
            if (e.isEmpty()) return Optional.empty();
            if (e.get().isExpired(clock.instant())) {
                // 그 사이 set()이 새 엔트리를 넣었으면 지우지 않는다
                backend.removeIfUnchanged(e.get());
                return Optional.empty();
            }
            return Optional.of(e.get().payload());
        } catch (CacheBackendException ex) {
            enterBypass("get", ex);
            return Optional.empty();
        }
    }

    private void sweepSafely() {
        try {
            evictExpired();
        } catch (RuntimeException e) {
            // 스케줄러 스레드에서 던지면 이후 실행이 멈춘다
            LOG.warn("Cache sweep failed: {}", e.toString());
        }
    }

    private void enterBypass(String op, CacheBackendException e) {
        if (!bypass) {
            bypass = true;
            LOG.warn("Cache backend failed on {}; switching to bypass mode: {}", op, e.toString());
            SLOG.warn("cache-bypass", "op", op, "cause", e.toString());
        }
        bypasses.incrementAndGet();
    }

    private static AnalysisResult await(CompletableFuture<AnalysisResult> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            Throwable c = (e.getCause() != null) ? e.getCause() : e;
            if (c instanceof RuntimeException re) throw re;
            if (c instanceof Error err) throw err;
            throw e;
        }
    }
}

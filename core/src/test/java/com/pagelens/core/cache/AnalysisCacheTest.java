package com.pagelens.core.cache;

import com.pagelens.core.model.AnalysisResult;
import com.pagelens.core.model.AnalysisStatus;
import com.pagelens.core.model.CacheEntry;
import com.pagelens.core.testutil.MutableClock;
import com.pagelens.core.testutil.Results;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisCacheTest {

    private static final String FP = "f".repeat(64);

    private final MutableClock clock = new MutableClock(Results.T0);

    @Test
    void set_then_get_is_idempotent() {
        InMemoryResultCache backend = new InMemoryResultCache(10);
        AnalysisCache cache = new AnalysisCache(backend, Duration.ofMinutes(10), clock);
        AnalysisResult r = Results.completed("https://c.example/");

        assertThat(cache.set(FP, r)).isTrue();
        assertThat(cache.set(FP, r)).isTrue();

        assertThat(cache.get(FP)).containsSame(r);
        assertThat(cache.get(FP)).containsSame(r);
        assertThat(backend.size()).isEqualTo(1);
        assertThat(cache.stats().hits()).isEqualTo(2);
    }

    @Test
    void entries_expire_at_ttl() {
        InMemoryResultCache backend = new InMemoryResultCache(10);
        AnalysisCache cache = new AnalysisCache(backend, Duration.ofMinutes(10), clock);
        cache.set(FP, Results.completed("https://c.example/"));

        clock.advance(Duration.ofMinutes(9));
        assertThat(cache.get(FP)).isPresent();

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get(FP)).isEmpty();
        assertThat(backend.size()).isZero();
    }

    @Test
    void expired_read_does_not_drop_an_entry_stored_meanwhile() {
        InMemoryResultCache store = new InMemoryResultCache(10);
        AnalysisCache cache = new AnalysisCache(new SetDuringGetBackend(store, clock), Duration.ofMinutes(10), clock);
        cache.set(FP, Results.completed("https://c.example/old"));
        clock.advance(Duration.ofMinutes(11));

        // 만료 엔트리를 읽는 사이 다른 스레드가 새 결과를 저장한 상황
        assertThat(cache.get(FP)).isEmpty();

        assertThat(store.size()).isEqualTo(1);
        assertThat(cache.get(FP)).hasValueSatisfying(r -> assertThat(r.getUrl()).isEqualTo("https://c.example/new"));
    }

    @Test
    void only_completed_results_are_stored() {
        AnalysisCache cache = new AnalysisCache(new InMemoryResultCache(10), Duration.ofMinutes(10), clock);

        assertThat(cache.set(FP, Results.withStatus("https://c.example/", AnalysisStatus.PARTIAL))).isFalse();
        assertThat(cache.set(FP, Results.withStatus("https://c.example/", AnalysisStatus.FAILED))).isFalse();
        assertThat(cache.get(FP)).isEmpty();
    }

    @Test
    void zero_ttl_never_stores() {
        AnalysisCache cache = new AnalysisCache(new InMemoryResultCache(10), Duration.ZERO, clock);

        assertThat(cache.set(FP, Results.completed("https://c.example/"))).isFalse();
        assertThat(cache.get(FP)).isEmpty();
        assertThatThrownBy(() -> new AnalysisCache(new InMemoryResultCache(1), Duration.ofSeconds(-1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrent_misses_share_one_computation() throws Exception {
        AnalysisCache cache = new AnalysisCache(new InMemoryResultCache(10), Duration.ofMinutes(10), clock);
        AtomicInteger computations = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        AnalysisResult computed = Results.completed("https://c.example/");
        int callers = 8;

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<AnalysisCache.Lookup>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> cache.getOrCompute(FP, () -> {
                computations.incrementAndGet();
                await(release);
                return computed;
            })));
            waitUntil(() -> cache.inFlightCount() == 1);
            for (int i = 1; i < callers; i++) {
                futures.add(pool.submit(() -> cache.getOrCompute(FP, () -> {
                    computations.incrementAndGet();
                    return computed;
                })));
            }
            waitUntil(() -> cache.stats().joins() == callers - 1);
            release.countDown();

            List<AnalysisCache.Source> sources = new ArrayList<>();
            for (Future<AnalysisCache.Lookup> f : futures) {
                AnalysisCache.Lookup l = f.get(5, TimeUnit.SECONDS);
                assertThat(l.result()).isSameAs(computed);
                sources.add(l.source());
            }
            assertThat(computations).hasValue(1);
            assertThat(sources).containsOnlyOnce(AnalysisCache.Source.COMPUTED);
            assertThat(sources).filteredOn(s -> s == AnalysisCache.Source.JOINED).hasSize(callers - 1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(cache.inFlightCount()).isZero();
        assertThat(cache.getOrCompute(FP, () -> { throw new AssertionError("should hit"); }).source())
                .isEqualTo(AnalysisCache.Source.HIT);
    }

    @Test
    void loader_failure_reaches_every_waiter_and_is_not_cached() throws Exception {
        AnalysisCache cache = new AnalysisCache(new InMemoryResultCache(10), Duration.ofMinutes(10), clock);
        CountDownLatch release = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<AnalysisCache.Lookup> first = pool.submit(() -> cache.getOrCompute(FP, () -> {
                await(release);
                throw new IllegalStateException("boom");
            }));
            waitUntil(() -> cache.inFlightCount() == 1);
            Future<AnalysisCache.Lookup> second = pool.submit(() -> cache.getOrCompute(FP, () -> Results.completed("https://x/")));
            waitUntil(() -> cache.stats().joins() == 1);
            release.countDown();

            assertThatThrownBy(() -> first.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> second.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(IllegalStateException.class);
        } finally {
            pool.shutdownNow();
        }

        AnalysisCache.Lookup retry = cache.getOrCompute(FP, () -> Results.completed("https://c.example/"));
        assertThat(retry.source()).isEqualTo(AnalysisCache.Source.COMPUTED);
    }

    @Test
    void backend_failure_switches_to_bypass() {
        FailingBackend backend = new FailingBackend();
        AnalysisCache cache = new AnalysisCache(backend, Duration.ofMinutes(10), clock);
        AtomicInteger computations = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            AnalysisCache.Lookup l = cache.getOrCompute(FP, () -> {
                computations.incrementAndGet();
                return Results.completed("https://c.example/");
            });
            assertThat(l.source()).isEqualTo(AnalysisCache.Source.COMPUTED);
        }

        assertThat(cache.isBypass()).isTrue();
        assertThat(computations).hasValue(3);
        assertThat(backend.calls).hasValue(1);
        assertThat(cache.stats().bypasses()).isPositive();
    }

    @Test
    void sweep_removes_expired_entries() {
        InMemoryResultCache backend = new InMemoryResultCache(10);
        AnalysisCache cache = new AnalysisCache(backend, Duration.ofMinutes(1), clock);
        cache.set("a", Results.completed("https://c.example/a"));
        clock.advance(Duration.ofSeconds(30));
        cache.set("b", Results.completed("https://c.example/b"));
        clock.advance(Duration.ofSeconds(45));

        assertThat(cache.evictExpired()).isEqualTo(1);
        assertThat(backend.get("b")).isPresent();
        assertThatThrownBy(() -> cache.startSweeper(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("latch timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void waitUntil(BooleanSupplier cond) throws InterruptedException {
        long end = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!cond.getAsBoolean()) {
            if (System.nanoTime() > end) throw new AssertionError("condition not reached");
            Thread.sleep(5);
        }
    }

    /** 첫 get() 직후 새 엔트리를 끼워 넣는 백엔드 */
    private static final class SetDuringGetBackend implements ResultCache {
        private final InMemoryResultCache delegate;
        private final MutableClock clock;
        private boolean raced;

        SetDuringGetBackend(InMemoryResultCache delegate, MutableClock clock) {
            this.delegate = delegate;
            this.clock = clock;
        }

        @Override public Optional<CacheEntry> get(String fingerprint) {
            Optional<CacheEntry> e = delegate.get(fingerprint);
            if (!raced && e.isPresent()) {
                raced = true;
                delegate.put(new CacheEntry(fingerprint, Results.completed("https://c.example/new"),
                        clock.instant(), clock.instant().plus(Duration.ofMinutes(10))));
            }
            return e;
        }

        @Override public void put(CacheEntry entry) { delegate.put(entry); }
        @Override public boolean remove(String fingerprint) { return delegate.remove(fingerprint); }
        @Override public boolean removeIfUnchanged(CacheEntry expected) { return delegate.removeIfUnchanged(expected); }
        @Override public void clear() { delegate.clear(); }
        @Override public int evictExpired(Instant now) { return delegate.evictExpired(now); }
        @Override public int size() { return delegate.size(); }
    }

    private static final class FailingBackend implements ResultCache {
        final AtomicInteger calls = new AtomicInteger();

        private CacheBackendException fail() {
            calls.incrementAndGet();
            return new CacheBackendException("disk gone", null);
        }

        @Override public Optional<CacheEntry> get(String fingerprint) { throw fail(); }
        @Override public void put(CacheEntry entry) { throw fail(); }
        @Override public boolean remove(String fingerprint) { throw fail(); }
        @Override public boolean removeIfUnchanged(CacheEntry expected) { throw fail(); }
        @Override public void clear() { throw fail(); }
        @Override public int evictExpired(Instant now) { throw fail(); }
        @Override public int size() { throw fail(); }
    }
}

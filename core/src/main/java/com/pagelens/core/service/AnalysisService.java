package com.pagelens.core.service;

import com.pagelens.core.analyzer.AnalyzerException;
import com.pagelens.core.analyzer.AnalyzerRegistry;
import com.pagelens.core.api.IAnalyzer;
import com.pagelens.core.api.ICollector;
import com.pagelens.core.api.IProcessor;
import com.pagelens.core.cache.AnalysisCache;
import com.pagelens.core.cache.FileResultCache;
import com.pagelens.core.cache.Fingerprint;
import com.pagelens.core.cache.InMemoryResultCache;
import com.pagelens.core.cache.ResultCache;
import com.pagelens.core.crawler.SiteCrawler;
import com.pagelens.core.http.CollectionException;
import com.pagelens.core.http.PageCollector;
import com.pagelens.core.model.AnalysisRequest;
import com.pagelens.core.model.AnalysisResult;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.AnalyzerResult;
import com.pagelens.core.model.BatchResult;
import com.pagelens.core.model.BatchStats;
import com.pagelens.core.model.CollectorConfig;
import com.pagelens.core.model.EngineConfig;
import com.pagelens.core.model.Finding;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.RawDocument;
import com.pagelens.core.model.Severity;
import com.pagelens.core.model.UrlOutcome;
import com.pagelens.core.processor.HtmlProcessor;
import com.pagelens.core.util.NamedThreadFactory;
import com.pagelens.core.util.ProgressListener;
import com.pagelens.core.util.StructuredLog;
import com.pagelens.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 분석 오케스트레이터:
 *  - 단일 URL: 캐시(single-flight) → 수집 → 파싱 → 분석기 병렬 실행 → 병합 → 저장
 *  - 배치: 고정 워커 풀(동시성=concurrency)이 큐에서 URL을 꺼내 단일 경로를 실행
 *  - 수집기의 RateLimiter는 모든 워커가 공유하므로 전체 요청 속도가 requestsPerSecond를 지킨다
 *  - 한 URL의 실패는 배치를 멈추지 않는다. 데드라인/취소 이후 스케줄되지 않은 URL은 SKIPPED
 *  - DI 생성자는 테스트/플러그인 주입용
 */
public final class AnalysisService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisService.class);
    private static final StructuredLog SLOG = StructuredLog.get(AnalysisService.class);

    private final EngineConfig config;
    private final AnalyzerRegistry registry;
    private final ICollector collector;
    private final IProcessor processor;
    private final AnalysisCache cache;
    private final ResultAggregator aggregator;
    private final ExecutorService analyzerPool;
    private final Clock clock;

    // (이름 + 설정) → 인스턴스. 옵션 검증은 설정 조합당 한 번
    private final ConcurrentHashMap<String, IAnalyzer> analyzers = new ConcurrentHashMap<>();

    /** 기본 구현(PageCollector/HtmlProcessor/기본 레지스트리/설정 기반 캐시) */
    public AnalysisService(EngineConfig config) {
        this(config, AnalyzerRegistry.defaults(), new PageCollector(config.getCollector()),
                new HtmlProcessor(), defaultCache(config));
    }

    /** DI/테스트/플러그인용 */
    public AnalysisService(EngineConfig config, AnalyzerRegistry registry, ICollector collector,
                           IProcessor processor, AnalysisCache cache) {
        this(config, registry, collector, processor, cache, Clock.systemUTC());
    }

    public AnalysisService(EngineConfig config, AnalyzerRegistry registry, ICollector collector,
                           IProcessor processor, AnalysisCache cache, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.registry = Objects.requireNonNull(registry, "registry");
        this.collector = Objects.requireNonNull(collector, "collector");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.aggregator = new ResultAggregator(config.getAnalyzerWeights());

        int n = Math.max(1, Math.min(config.getAnalyzerParallelism(), Runtime.getRuntime().availableProcessors()));
        this.analyzerPool = new ThreadPoolExecutor(n, n, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new NamedThreadFactory("analyzer"));
    }

    static AnalysisCache defaultCache(EngineConfig config) {
        EngineConfig.CacheCfg c = config.getCache();
        ResultCache backend = (c.getDir() != null)
                ? new FileResultCache(c.getDir())
                : new InMemoryResultCache(c.getMaxEntries());
        AnalysisCache cache = new AnalysisCache(backend, c.ttl());
        if (c.getSweepIntervalSeconds() > 0) cache.startSweeper(Duration.ofSeconds(c.getSweepIntervalSeconds()));
        return cache;
    }

    /* =========================
       단일 URL
       ========================= */

    /** 설정 기본값으로 요청 생성. 모르는 분석기 이름이면 UnknownAnalyzerException(네트워크 작업 전). */
    public AnalysisRequest newRequest(URI url) {
        return config.newRequest(url, registry);
    }

    public AnalysisResult analyze(URI url) {
        return analyze(newRequest(url));
    }

    public AnalysisResult analyze(AnalysisRequest req) {
        return analyzeTracked(req).result();
    }

    private AnalysisCache.Lookup analyzeTracked(AnalysisRequest req) {
        Objects.requireNonNull(req, "req");
        // 분석기 옵션 오류는 수집 전에 드러나야 한다
        Map<String, IAnalyzer> bound = instantiate(req);
        String fp = Fingerprint.of(req);
        AnalysisCache.Lookup lookup = cache.getOrCompute(fp, () -> runPipeline(req, bound));
        if (lookup.source() == AnalysisCache.Source.HIT) {
            SLOG.info("cache-hit", "url", req.getUrl(), "fingerprint", fp);
        } else if (lookup.source() == AnalysisCache.Source.JOINED) {
            SLOG.info("cache-join", "url", req.getUrl(), "fingerprint", fp);
        }
        return lookup;
    }

    private Map<String, IAnalyzer> instantiate(AnalysisRequest req) {
        return instantiate(req.getAnalyzers(), req::configFor);
    }

    private Map<String, IAnalyzer> instantiate(Collection<String> names, Function<String, AnalyzerConfig> configs) {
        Map<String, IAnalyzer> out = new LinkedHashMap<>();
        for (String name : names) {
            AnalyzerConfig cfg = configs.apply(name);
            String key = name + '\n' + cfg.canonical();
            out.put(name, analyzers.computeIfAbsent(key, k -> registry.create(name, cfg)));
        }
        return out;
    }

    private AnalysisResult runPipeline(AnalysisRequest req, Map<String, IAnalyzer> bound) {
        URI url = req.getUrl();
        Instant started = clock.instant();
        SLOG.info("analysis-start", "url", url, "analyzers", bound.size());

        RawDocument raw;
        try {
            raw = collector.fetch(url, req.getCollector());
        } catch (CollectionException e) {
            LOG.warn("Collect failed: {} -> {}", url, e.getMessage());
            AnalysisResult failed = aggregator.failure(url, e, started, clock.instant());
            SLOG.info("analysis-done", "url", url, "status", failed.getStatus().name(),
                    "errorKind", failed.getErrorKind());
            return failed;
        }

        ParsedDocument doc = processor.parse(raw, req.getProcessor());
        if (!doc.getWarnings().isEmpty()) {
            LOG.debug("Parse warnings for {}: {}", url, doc.getWarnings());
        }

        Map<String, AnalyzerResult> results = runAnalyzers(doc, bound);
        AnalysisResult result = aggregator.merge(url, results, started, clock.instant());
        LOG.info("Analyzed {} -> score={}, findings={}, status={}",
                url, result.getOverallScore(), result.totalFindings(), result.getStatus());
        SLOG.info("analysis-done",
                "url", url,
                "status", result.getStatus().name(),
                "score", result.getOverallScore(),
                "findings", result.totalFindings(),
                "ms", result.getDuration().toMillis());
        return result;
    }

    /** 분석기별 타임아웃은 제출 시점부터 잰다. 실패/타임아웃은 합성 INFO 발견 항목으로 대체. */
    private Map<String, AnalyzerResult> runAnalyzers(ParsedDocument doc, Map<String, IAnalyzer> bound) {
        Map<String, Future<AnalyzerResult>> futures = new LinkedHashMap<>();
        long submittedAt = System.nanoTime();
        for (Map.Entry<String, IAnalyzer> e : bound.entrySet()) {
            String name = e.getKey();
            IAnalyzer analyzer = e.getValue();
            futures.put(name, analyzerPool.submit(() -> {
                long t0 = System.nanoTime();
                try {
                    AnalyzerResult r = analyzer.analyze(doc);
                    return r.withDuration(Duration.ofNanos(System.nanoTime() - t0));
                } catch (RuntimeException ex) {
                    throw new AnalyzerException(name, ex.toString(), ex);
                }
            }));
        }

        long timeoutNanos = config.getAnalyzerTimeout().toNanos();
        Map<String, AnalyzerResult> out = new LinkedHashMap<>();
        boolean interrupted = false;
        for (Map.Entry<String, Future<AnalyzerResult>> e : futures.entrySet()) {
            String name = e.getKey();
            Future<AnalyzerResult> f = e.getValue();
            if (interrupted) {
                f.cancel(true);
                out.put(name, failedAnalyzer(name, AnalyzerResult.Status.FAILED, "interrupted", submittedAt));
                continue;
            }
            long remaining = Math.max(0L, submittedAt + timeoutNanos - System.nanoTime());
            try {
                out.put(name, f.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException te) {
                f.cancel(true);
                LOG.warn("Analyzer {} timed out after {}", name, config.getAnalyzerTimeout());
                SLOG.warn("analyzer-timeout", "url", doc.getUrl(), "analyzer", name,
                        "timeoutMs", config.getAnalyzerTimeout().toMillis());
                out.put(name, failedAnalyzer(name, AnalyzerResult.Status.TIMED_OUT,
                        "timed out after " + config.getAnalyzerTimeout().toMillis() + " ms", submittedAt));
            } catch (ExecutionException ee) {
                Throwable cause = (ee.getCause() instanceof AnalyzerException ae && ae.getCause() != null)
                        ? ae.getCause() : ee.getCause();
                LOG.warn("Analyzer {} failed: {}", name, String.valueOf(cause));
                SLOG.error("analyzer-failed", cause, "url", doc.getUrl(), "analyzer", name);
                out.put(name, failedAnalyzer(name, AnalyzerResult.Status.FAILED, String.valueOf(cause), submittedAt));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                interrupted = true;
                f.cancel(true);
                out.put(name, failedAnalyzer(name, AnalyzerResult.Status.FAILED, "interrupted", submittedAt));
            }
        }
        return out;
    }

    private static AnalyzerResult failedAnalyzer(String name, AnalyzerResult.Status status, String reason, long submittedAt) {
        Finding synthetic = Finding.builder()
                .analyzer(name)
                .category(ResultAggregator.ANALYZER_ERROR)
                .severity(Severity.INFO)
                .message("Analyzer '" + name + "' did not complete: " + reason)
                .remediation("Check the analyzer options; the rest of the report is unaffected.")
                .build();
        return AnalyzerResult.failed(name, status, synthetic, Duration.ofNanos(System.nanoTime() - submittedAt));
    }

    /* =========================
       배치 (오버로드 3종)
       ========================= */

    public BatchResult analyzeBatch(List<URI> urls) {
        return analyzeBatch(urls, null, null, ProgressListener.NONE, null);
    }

    public BatchResult analyzeBatch(List<URI> urls, Instant deadline) {
        return analyzeBatch(urls, null, deadline, ProgressListener.NONE, null);
    }

    /**
     * @param template 분석기/설정 템플릿(null이면 EngineConfig 기본값). URL만 바꿔 재사용한다.
     * @param deadline 이후로는 새 URL을 시작하지 않는다(null이면 무제한). 진행 중인 것은 끝까지 돈다.
     * @param cancel   true가 되면 deadline과 같은 방식으로 멈춘다(옵션)
     */
    public BatchResult analyzeBatch(List<URI> urls, AnalysisRequest template, Instant deadline,
                                    ProgressListener listener, AtomicBoolean cancel) {
        Objects.requireNonNull(urls, "urls");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final long t0 = System.nanoTime();
        final BatchStats stats = new BatchStats();

        // 중복 제거(정규화 기준, 입력 순서 유지)
        Map<String, URI> unique = new LinkedHashMap<>();
        for (URI u : urls) {
            if (u == null) continue;
            URI n = UrlUtils.normalize(u);
            unique.putIfAbsent(n.toString(), n);
        }
        Map<String, UrlOutcome> outcomes = new ConcurrentHashMap<>();
        if (unique.isEmpty()) {
            pl.onProgress(1.0, ProgressListener.Phase.DONE, 0, 0);
            return new BatchResult(Map.of(), Duration.ZERO, stats.snapshot());
        }

        // 템플릿 검증 + 분석기 인스턴스화는 어떤 작업보다 먼저. 템플릿이 없으면 URL마다 설정 기본값으로 요청 생성
        final AnalysisRequest tmpl = template;
        if (tmpl != null) {
            instantiate(tmpl);
        } else {
            registry.requireKnown(config.getAnalyzers());
            instantiate(config.getAnalyzers(), config::analyzerConfig);
        }
        final CollectorConfig collectorCfg = (tmpl != null) ? tmpl.getCollector() : config.getCollector();

        final int total = unique.size();
        final int cc = Math.max(1, Math.min(config.getConcurrency(), total));
        LOG.info("Batch start: urls={}, cc={}, rps={}, deadline={}",
                total, cc, collectorCfg.getRequestsPerSecond(), deadline);
        SLOG.info("batch-start", "urls", total, "cc", cc,
                "rps", collectorCfg.getRequestsPerSecond(),
                "deadline", String.valueOf(deadline));
        pl.onProgress(0.0, ProgressListener.Phase.ANALYZE, 0, total);

        final Queue<Map.Entry<String, URI>> queue = new ConcurrentLinkedQueue<>(unique.entrySet());
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger done = new AtomicInteger();
        final AtomicBoolean stop = new AtomicBoolean(false);
        final long attemptsBefore = (collector instanceof PageCollector pc) ? pc.attemptCount() : 0L;
        final long retriesBefore = (collector instanceof PageCollector pc) ? pc.retryCount() : 0L;

        ExecutorService exec = new ThreadPoolExecutor(cc, cc, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new NamedThreadFactory("analysis-worker"));

        Runnable worker = () -> {
            while (true) {
                // 협조적 취소: URL을 꺼내기 전에만 검사
                if (stop.get() || shouldStop(deadline, cancel)) {
                    stop.set(true);
                    return;
                }
                Map.Entry<String, URI> next = queue.poll();
                if (next == null) return;
                String key = next.getKey();

                int cur = inFlight.incrementAndGet();
                stats.observeConcurrency(cur);
                long started = System.nanoTime();
                UrlOutcome outcome;
                try {
                    URI u = next.getValue();
                    AnalysisCache.Lookup l = analyzeTracked((tmpl != null) ? tmpl.withUrl(u) : newRequest(u));
                    if (l.source() == AnalysisCache.Source.HIT) stats.addCacheHit();
                    outcome = UrlOutcome.of(l.result());
                } catch (IllegalArgumentException e) {
                    LOG.warn("Batch item rejected: {} -> {}", key, e.getMessage());
                    outcome = UrlOutcome.failed(key, "INVALID_URL", e.getMessage());
                } catch (RuntimeException e) {
                    LOG.warn("Batch item failed: {} -> {}", key, e.toString());
                    SLOG.error("batch-url-failed", e, "url", key);
                    outcome = UrlOutcome.failed(key, e.getClass().getSimpleName(), e.getMessage());
                } finally {
                    inFlight.decrementAndGet();
                    stats.addPipeline(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
                }
                outcomes.put(key, outcome);
                int d = done.incrementAndGet();
                SLOG.info("batch-url-done", "url", key, "status", outcome.status().name(), "done", d, "total", total);
                pl.onProgress((double) d / total, ProgressListener.Phase.ANALYZE, d, total);
            }
        };

        List<Future<?>> futures = new ArrayList<>(cc);
        for (int i = 0; i < cc; i++) futures.add(exec.submit(worker));
        try {
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    // 워커 루프는 예외를 삼키지 않고 outcome으로 바꾸므로 여기 오면 버그
                    LOG.error("Batch worker crashed", e.getCause());
                    SLOG.error("batch-worker-crashed", e.getCause());
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            stop.set(true);
        } finally {
            exec.shutdown();
            try {
                if (!exec.awaitTermination(30, TimeUnit.SECONDS)) exec.shutdownNow();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                exec.shutdownNow();
            }
        }

        // 남은 URL → SKIPPED
        String reason = (cancel != null && cancel.get()) ? "cancelled" : "deadline exceeded";
        int skipped = 0;
        for (Map.Entry<String, URI> left; (left = queue.poll()) != null; ) {
            outcomes.put(left.getKey(), UrlOutcome.skipped(left.getKey(), reason));
            skipped++;
        }
        if (skipped > 0) {
            LOG.info("Batch stopped early ({}): skipped={}", reason, skipped);
            SLOG.info("batch-deadline", "reason", reason, "skipped", skipped);
        }

        if (collector instanceof PageCollector pc) {
            stats.addFetch(pc.attemptCount() - attemptsBefore, pc.retryCount() - retriesBefore);
        }

        // 입력 순서대로 정렬
        Map<String, UrlOutcome> ordered = new LinkedHashMap<>();
        for (String key : unique.keySet()) {
            UrlOutcome o = outcomes.get(key);
            ordered.put(key, (o != null) ? o : UrlOutcome.skipped(key, reason));
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
        BatchResult result = new BatchResult(ordered, elapsed, stats.snapshot());
        pl.onProgress(1.0, ProgressListener.Phase.DONE, done.get(), total);

        LOG.info("Batch done. urls={}, counts={}, elapsedMs={}, maxObservedCC={}",
                total, result.countsByStatus(), elapsed.toMillis(), result.getStats().maxObservedConcurrency());
        SLOG.info("batch-done",
                "urls", total,
                "completed", done.get(),
                "skipped", skipped,
                "elapsedMs", elapsed.toMillis(),
                "maxObservedCC", result.getStats().maxObservedConcurrency());
        return result;
    }

    /* =========================
       사이트 단위
       ========================= */

    /** 시드에서 BFS로 URL을 모은 뒤 배치 분석 */
    public BatchResult analyzeSite(URI seed, Instant deadline, ProgressListener listener, AtomicBoolean cancel) {
        ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        AnalysisRequest template = newRequest(seed);
        instantiate(template);
        pl.onProgress(0.0, ProgressListener.Phase.CRAWL, 0, -1);
        SiteCrawler crawler = new SiteCrawler(collector, processor, config.getCrawl());
        List<URI> pages = crawler.crawl(seed, template.getCollector(), template.getProcessor(), deadline, cancel);
        return analyzeBatch(pages, template, deadline, pl, cancel);
    }

    /* =========================
       공용 유틸 / 게터
       ========================= */

    private boolean shouldStop(Instant deadline, AtomicBoolean cancel) {
        if (Thread.currentThread().isInterrupted()) return true;
        if (cancel != null && cancel.get()) return true;
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public AnalysisCache getCache() { return cache; }

    public AnalyzerRegistry getRegistry() { return registry; }

    public EngineConfig getConfig() { return config; }

    @Override
    public void close() {
        analyzerPool.shutdownNow();
        cache.close();
    }
}

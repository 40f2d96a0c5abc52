package com.pagelens.core.model;

import com.pagelens.core.analyzer.AnalyzerRegistry;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 엔진 전체 설정 (pagelens.yml 매핑 대상).
 * 하위 컴포넌트 설정(Collector/Processor/Scoring)은 불변 객체로 보관하고, 여기서는 조립만 한다.
 */
public final class EngineConfig {

    public static final List<String> DEFAULT_ANALYZERS = List.of(
            "security", "performance", "schema", "accessibility", "mobile_friendly", "social_media");

    /** 캐시 관련 하위 설정: YAML의 `cache:` 섹션과 매핑 */
    public static final class CacheCfg {
        /** 엔트리 TTL(분). 기본 60 */
        private int ttlMinutes = 60;
        /** 메모리 백엔드 최대 엔트리 수(LRU) */
        private int maxEntries = 1000;
        /** 지정 시 파일 백엔드 사용 */
        private Path dir;
        /** 0이면 백그라운드 스윕 없음(읽기 시 지연 만료만) */
        private int sweepIntervalSeconds = 0;

        public int getTtlMinutes() { return ttlMinutes; }
        public CacheCfg setTtlMinutes(int v) { this.ttlMinutes = v; return this; }
        public int getMaxEntries() { return maxEntries; }
        public CacheCfg setMaxEntries(int v) { this.maxEntries = v; return this; }
        public Path getDir() { return dir; }
        public CacheCfg setDir(Path v) { this.dir = v; return this; }
        public int getSweepIntervalSeconds() { return sweepIntervalSeconds; }
        public CacheCfg setSweepIntervalSeconds(int v) { this.sweepIntervalSeconds = v; return this; }
        public Duration ttl() { return Duration.ofMinutes(ttlMinutes); }
    }

    /** 사이트 탐색(BFS) 하위 설정: YAML의 `crawl:` 섹션 */
    public static final class CrawlCfg {
        private int maxDepth = 2;
        private int maxPages = 50;
        private boolean sameDomainOnly = true;
        private List<String> excludePaths = List.of();

        public int getMaxDepth() { return maxDepth; }
        public CrawlCfg setMaxDepth(int v) { this.maxDepth = v; return this; }
        public int getMaxPages() { return maxPages; }
        public CrawlCfg setMaxPages(int v) { this.maxPages = v; return this; }
        public boolean isSameDomainOnly() { return sameDomainOnly; }
        public CrawlCfg setSameDomainOnly(boolean v) { this.sameDomainOnly = v; return this; }
        public List<String> getExcludePaths() { return excludePaths; }
        public CrawlCfg setExcludePaths(List<String> v) { this.excludePaths = (v == null ? List.of() : List.copyOf(v)); return this; }
    }

    private int concurrency = 4;
    private int analyzerParallelism = Runtime.getRuntime().availableProcessors();
    private Duration analyzerTimeout = Duration.ofSeconds(30);
    private List<String> analyzers = DEFAULT_ANALYZERS;
    private CollectorConfig collector = CollectorConfig.defaults();
    private ProcessorConfig processor = ProcessorConfig.defaults();
    private ScoringWeights scoring = ScoringWeights.defaults();
    private final Map<String, Double> analyzerWeights = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> analyzerOptions = new LinkedHashMap<>();
    private final CacheCfg cache = new CacheCfg();
    private final CrawlCfg crawl = new CrawlCfg();

    // ---------- getters ----------
    public int getConcurrency() { return concurrency; }
    public int getAnalyzerParallelism() { return analyzerParallelism; }
    public Duration getAnalyzerTimeout() { return analyzerTimeout; }
    public List<String> getAnalyzers() { return analyzers; }
    public CollectorConfig getCollector() { return collector; }
    public ProcessorConfig getProcessor() { return processor; }
    public ScoringWeights getScoring() { return scoring; }
    /** 분석기 이름 → 종합 점수 가중치(없으면 1.0) */
    public Map<String, Double> getAnalyzerWeights() { return analyzerWeights; }
    public Map<String, Map<String, Object>> getAnalyzerOptions() { return analyzerOptions; }
    public CacheCfg getCache() { return cache; }
    public CrawlCfg getCrawl() { return crawl; }

    // ---------- fluent setters ----------
    public EngineConfig setConcurrency(int v) { this.concurrency = v; return this; }
    public EngineConfig setAnalyzerParallelism(int v) { this.analyzerParallelism = v; return this; }
    public EngineConfig setAnalyzerTimeout(Duration v) { this.analyzerTimeout = v; return this; }
    public EngineConfig setAnalyzers(List<String> v) { if (v != null && !v.isEmpty()) this.analyzers = List.copyOf(v); return this; }
    public EngineConfig setCollector(CollectorConfig v) { this.collector = Objects.requireNonNull(v, "collector"); return this; }
    public EngineConfig setProcessor(ProcessorConfig v) { this.processor = Objects.requireNonNull(v, "processor"); return this; }
    public EngineConfig setScoring(ScoringWeights v) { this.scoring = Objects.requireNonNull(v, "scoring"); return this; }
    public EngineConfig setAnalyzerWeight(String analyzer, double w) { analyzerWeights.put(analyzer, w); return this; }
    public EngineConfig setAnalyzerOptions(String analyzer, Map<String, Object> opts) {
        analyzerOptions.put(analyzer, new LinkedHashMap<>(opts == null ? Map.of() : opts));
        return this;
    }

    /**
     * 분석기별 설정 조립. 옵션 맵의 `scoring` 하위 맵은 해당 분석기만의 감점 테이블 덮어쓰기로 해석한다.
     */
    public AnalyzerConfig analyzerConfig(String analyzer) {
        Map<String, Object> opts = new LinkedHashMap<>(analyzerOptions.getOrDefault(analyzer, Map.of()));
        ScoringWeights w = scoring;
        Object sc = opts.remove("scoring");
        if (sc instanceof Map<?, ?> m) {
            EnumMap<Severity, Double> overrides = new EnumMap<>(Severity.class);
            m.forEach((k, v) -> overrides.put(Severity.parse(String.valueOf(k)), toDouble(v, "scoring." + k)));
            w = scoring.override(overrides);
        }
        return new AnalyzerConfig(opts, w);
    }

    /** 설정 기본값으로 요청 생성(분석기 이름은 즉시 검증) */
    public AnalysisRequest newRequest(URI url, AnalyzerRegistry registry) {
        AnalysisRequest.Builder b = AnalysisRequest.builder(url)
                .collector(collector)
                .processor(processor)
                .analyzers(analyzers);
        for (String a : analyzers) b.analyzerConfig(a, analyzerConfig(a));
        return b.build(registry);
    }

    // ---------- validate ----------
    public void validate() {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (analyzerParallelism < 1) throw new IllegalArgumentException("analyzerParallelism must be >= 1");
        if (analyzerTimeout == null || analyzerTimeout.isNegative() || analyzerTimeout.isZero())
            throw new IllegalArgumentException("analyzerTimeout must be > 0");
        if (analyzers == null || analyzers.isEmpty()) throw new IllegalArgumentException("analyzers must not be empty");
        Objects.requireNonNull(collector, "collector");
        Objects.requireNonNull(processor, "processor");
        Objects.requireNonNull(scoring, "scoring");
        analyzerWeights.forEach((k, v) -> {
            if (v == null || v.isNaN() || v < 0) throw new IllegalArgumentException("weights." + k + " must be >= 0");
        });
        if (cache.getTtlMinutes() < 0) throw new IllegalArgumentException("cache.ttlMinutes must be >= 0");
        if (cache.getMaxEntries() < 1) throw new IllegalArgumentException("cache.maxEntries must be >= 1");
        if (cache.getSweepIntervalSeconds() < 0) throw new IllegalArgumentException("cache.sweepIntervalSeconds must be >= 0");
        if (crawl.getMaxDepth() < 0) throw new IllegalArgumentException("crawl.maxDepth must be >= 0");
        if (crawl.getMaxPages() < 1) throw new IllegalArgumentException("crawl.maxPages must be >= 1");
        // 분석기 옵션의 scoring 덮어쓰기도 여기서 한 번 검증
        for (String a : analyzerOptions.keySet()) analyzerConfig(a);
    }

    // ---------- helpers ----------
    public static EngineConfig defaults() { return new EngineConfig(); }

    private static double toDouble(Object v, String key) {
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key.toLowerCase(Locale.ROOT) + " must be a number", e);
        }
    }
}

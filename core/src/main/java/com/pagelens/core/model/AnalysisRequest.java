package com.pagelens.core.model;

import com.pagelens.core.analyzer.AnalyzerRegistry;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 분석 요청(제출 후 불변).
 * 분석기 이름은 build(registry)에서 즉시 검증된다. 모르는 이름이면 네트워크 작업 전에 UnknownAnalyzerException.
 */
public final class AnalysisRequest {
    private final URI url;
    private final CollectorConfig collector;
    private final ProcessorConfig processor;
    private final Set<String> analyzers;
    private final Map<String, AnalyzerConfig> analyzerConfigs;

    private AnalysisRequest(URI url, CollectorConfig collector, ProcessorConfig processor,
                            Set<String> analyzers, Map<String, AnalyzerConfig> analyzerConfigs) {
        this.url = url;
        this.collector = collector;
        this.processor = processor;
        this.analyzers = analyzers;
        this.analyzerConfigs = analyzerConfigs;
    }

    public URI getUrl() { return url; }
    public CollectorConfig getCollector() { return collector; }
    public ProcessorConfig getProcessor() { return processor; }
    /** 요청 순서 유지 */
    public Set<String> getAnalyzers() { return analyzers; }
    public Map<String, AnalyzerConfig> getAnalyzerConfigs() { return analyzerConfigs; }

    /** 분석기 설정(없으면 기본값) */
    public AnalyzerConfig configFor(String analyzer) {
        return analyzerConfigs.getOrDefault(analyzer, AnalyzerConfig.defaults());
    }

    /** 배치용: 같은 설정으로 URL만 바꾼 사본(이미 검증된 분석기 집합을 공유) */
    public AnalysisRequest withUrl(URI other) {
        return new AnalysisRequest(checkUrl(other), collector, processor, analyzers, analyzerConfigs);
    }

    static URI checkUrl(URI u) {
        Objects.requireNonNull(u, "url");
        String scheme = (u.getScheme() == null) ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("url must be absolute http(s): " + u);
        }
        if (u.getHost() == null || u.getHost().isBlank()) {
            throw new IllegalArgumentException("url must have a host: " + u);
        }
        return u;
    }

    @Override public String toString() {
        return "AnalysisRequest{" + url + " analyzers=" + analyzers + "}";
    }

    public static Builder builder(URI url) { return new Builder(url); }

    public static Builder builder(String url) { return new Builder(URI.create(url)); }

    public static final class Builder {
        private final URI url;
        private CollectorConfig collector = CollectorConfig.defaults();
        private ProcessorConfig processor = ProcessorConfig.defaults();
        private final Set<String> analyzers = new LinkedHashSet<>();
        private final Map<String, AnalyzerConfig> analyzerConfigs = new LinkedHashMap<>();

        private Builder(URI url) { this.url = url; }

        public Builder collector(CollectorConfig v) { this.collector = Objects.requireNonNull(v, "collector"); return this; }
        public Builder processor(ProcessorConfig v) { this.processor = Objects.requireNonNull(v, "processor"); return this; }

        public Builder analyzer(String name) {
            analyzers.add(Objects.requireNonNull(name, "analyzer").trim());
            return this;
        }

        public Builder analyzers(List<String> names) {
            for (String n : names) analyzer(n);
            return this;
        }

        public Builder analyzerConfig(String name, AnalyzerConfig cfg) {
            analyzerConfigs.put(name, Objects.requireNonNull(cfg, "cfg"));
            return this;
        }

        public Builder analyzerConfigs(Map<String, AnalyzerConfig> cfgs) {
            if (cfgs != null) analyzerConfigs.putAll(cfgs);
            return this;
        }

        /** 분석기 이름을 레지스트리로 즉시 검증한 뒤 요청을 확정 */
        public AnalysisRequest build(AnalyzerRegistry registry) {
            Objects.requireNonNull(registry, "registry");
            URI checked = checkUrl(url);
            if (analyzers.isEmpty()) throw new IllegalArgumentException("analyzers must not be empty");
            registry.requireKnown(analyzers);
            return new AnalysisRequest(
                    checked,
                    collector,
                    processor,
                    Collections.unmodifiableSet(new LinkedHashSet<>(analyzers)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(analyzerConfigs)));
        }
    }
}

package com.pagelens.core.util;

import com.pagelens.core.model.CollectorConfig;
import com.pagelens.core.model.EngineConfig;
import com.pagelens.core.model.ProcessorConfig;
import com.pagelens.core.model.ScoringWeights;
import com.pagelens.core.model.Severity;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * pagelens.yml을 읽어 EngineConfig로 변환.
 *
 * 예상 YAML 키:
 * concurrency: 4
 * analyzerParallelism: 4
 * analyzerTimeoutMs: 30000
 * analyzers: [security, performance, schema]
 * collector:
 *   requestsPerSecond: 2.0
 *   burst: 1
 *   timeoutMs: 10000
 *   maxRetries: 3
 *   retryDelayMs: 1000
 *   headers: { Accept-Language: "en" }
 *   verifySsl: true
 *   followRedirects: true
 *   respectRobots: true
 *   userAgent: "..."
 *   maxBodyBytes: 5242880
 *   robotsCacheTtlMinutes: 30
 * processor:
 *   parser: html | xml
 *   cleanWhitespace: true
 *   normalizeUrls: true
 *   removeComments: true
 *   extractMetadata: true
 * scoring: { critical: 25, high: 15, medium: 8, low: 3, info: 0 }
 * weights: { security: 2.0 }
 * cache: { ttlMinutes: 60, maxEntries: 1000, dir: ".cache", sweepIntervalSeconds: 0 }
 * crawl: { maxDepth: 2, maxPages: 50, sameDomainOnly: true, excludePaths: ["/admin"] }
 * analyzerOptions:
 *   title: { min_length: 30, max_length: 60 }
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 pagelens.yml, 없으면 클래스패스 기본값 */
    public static EngineConfig loadDefault() throws IOException {
        Path local = Path.of("pagelens.yml");
        if (Files.exists(local)) return load(local);
        return loadResource("pagelens.yml");
    }

    public static EngineConfig loadResource(String name) throws IOException {
        try (InputStream in = YamlConfigLoader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) throw new IOException("resource not found on classpath: " + name);
            return load(in);
        }
    }

    public static EngineConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("pagelens.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 클래스패스 리소스 등 스트림에서 로드 */
    public static EngineConfig load(InputStream in) {
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        EngineConfig cfg = EngineConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setInt(map, "concurrency", cfg::setConcurrency);
        setInt(map, "analyzerParallelism", cfg::setAnalyzerParallelism);
        setDurationMs(map, "analyzerTimeoutMs", cfg::setAnalyzerTimeout);
        setStringList(map, "analyzers", cfg::setAnalyzers);

        // 2) collector.*
        Map<String, Object> col = getMap(map, "collector");
        if (col != null) {
            CollectorConfig.Builder b = cfg.getCollector().toBuilder();
            setDouble(col, "requestsPerSecond", b::requestsPerSecond);
            setInt(col, "burst", b::burst);
            setDurationMs(col, "timeoutMs", b::timeout);
            setInt(col, "maxRetries", b::maxRetries);
            setDurationMs(col, "retryDelayMs", b::retryDelay);
            Map<String, Object> headers = getMap(col, "headers");
            if (headers != null) {
                Map<String, String> h = new LinkedHashMap<>();
                headers.forEach((k, v) -> { if (v != null) h.put(k, String.valueOf(v)); });
                b.headers(h);
            }
            setBoolean(col, "verifySsl", b::verifySsl);
            setBoolean(col, "followRedirects", b::followRedirects);
            setBoolean(col, "respectRobots", b::respectRobots);
            setString(col, "userAgent", b::userAgent);
            setInt(col, "maxBodyBytes", b::maxBodyBytes);
            setInt(col, "robotsCacheTtlMinutes", m -> b.robotsCacheTtl(Duration.ofMinutes(m)));
            cfg.setCollector(b.build());
        }

        // 3) processor.*
        Map<String, Object> proc = getMap(map, "processor");
        if (proc != null) {
            ProcessorConfig.Builder b = ProcessorConfig.builder();
            ProcessorConfig cur = cfg.getProcessor();
            b.parser(cur.getParser())
             .cleanWhitespace(cur.isCleanWhitespace())
             .normalizeUrls(cur.isNormalizeUrls())
             .removeComments(cur.isRemoveComments())
             .extractMetadata(cur.isExtractMetadata());
            setString(proc, "parser", s -> b.parser(ProcessorConfig.ParserKind.parse(s)));
            setBoolean(proc, "cleanWhitespace", b::cleanWhitespace);
            setBoolean(proc, "normalizeUrls", b::normalizeUrls);
            setBoolean(proc, "removeComments", b::removeComments);
            setBoolean(proc, "extractMetadata", b::extractMetadata);
            cfg.setProcessor(b.build());
        }

        // 4) scoring.* (심각도별 감점)
        Map<String, Object> scoring = getMap(map, "scoring");
        if (scoring != null) {
            ScoringWeights.Builder b = ScoringWeights.builder();
            for (Severity s : Severity.values()) {
                setDouble(scoring, s.name().toLowerCase(Locale.ROOT), v -> b.penalty(s, v));
            }
            cfg.setScoring(b.build());
        }

        // 5) weights.<analyzer>
        Map<String, Object> weights = getMap(map, "weights");
        if (weights != null) {
            for (String k : weights.keySet()) {
                setDouble(weights, k, v -> cfg.setAnalyzerWeight(k, v));
            }
        }

        // 6) cache.*
        Map<String, Object> cache = getMap(map, "cache");
        if (cache != null) {
            var c = cfg.getCache();
            setInt(cache, "ttlMinutes", c::setTtlMinutes);
            setInt(cache, "maxEntries", c::setMaxEntries);
            setString(cache, "dir", s -> c.setDir(Path.of(s)));
            setInt(cache, "sweepIntervalSeconds", c::setSweepIntervalSeconds);
        }

        // 7) crawl.*
        Map<String, Object> crawl = getMap(map, "crawl");
        if (crawl != null) {
            var c = cfg.getCrawl();
            setInt(crawl, "maxDepth", c::setMaxDepth);
            setInt(crawl, "maxPages", c::setMaxPages);
            setBoolean(crawl, "sameDomainOnly", c::setSameDomainOnly);
            setStringList(crawl, "excludePaths", c::setExcludePaths);
        }

        // 8) analyzerOptions.<analyzer>.*
        Map<String, Object> ao = getMap(map, "analyzerOptions");
        if (ao != null) {
            for (String name : ao.keySet()) {
                Map<String, Object> options = getMap(ao, name);
                if (options != null) cfg.setAnalyzerOptions(name, options);
            }
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, v));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) {
            try {
                setter.accept(Double.parseDouble(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number", e);
            }
        }
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parseInt(key, v);
        setter.accept(Duration.ofMillis(ms));
    }

    private static int parseInt(String key, Object v) {
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer", e);
        }
    }
}

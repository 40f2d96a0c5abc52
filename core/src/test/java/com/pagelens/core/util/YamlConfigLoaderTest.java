package com.pagelens.core.util;

import com.pagelens.core.model.EngineConfig;
import com.pagelens.core.model.ProcessorConfig;
import com.pagelens.core.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class YamlConfigLoaderTest {

    private static EngineConfig load(String yaml) {
        return YamlConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void bundled_defaults_load() throws IOException {
        EngineConfig cfg = YamlConfigLoader.loadResource("pagelens.yml");

        assertEquals(4, cfg.getConcurrency());
        assertEquals(Duration.ofSeconds(30), cfg.getAnalyzerTimeout());
        assertThat(cfg.getAnalyzers()).startsWith("security", "performance");
        assertEquals(2.0, cfg.getCollector().getRequestsPerSecond());
        assertEquals(Duration.ofMinutes(30), cfg.getCollector().getRobotsCacheTtl());
        assertThat(cfg.getCollector().getHeaders()).containsEntry("Accept-Language", "en");
        assertEquals(60, cfg.getCache().getTtlMinutes());
        assertEquals(30, cfg.analyzerConfig("title").getInt("min_length", 0));
        assertEquals(300, cfg.analyzerConfig("content").getInt("min_word_count", 0));
    }

    @Test
    void empty_document_keeps_defaults() {
        EngineConfig cfg = load("");

        assertEquals(EngineConfig.defaults().getConcurrency(), cfg.getConcurrency());
        assertEquals(EngineConfig.DEFAULT_ANALYZERS, cfg.getAnalyzers());
    }

    @Test
    void sections_override_defaults() {
        EngineConfig cfg = load(String.join("\n",
                "concurrency: 8",
                "analyzers: security, title",
                "collector:",
                "  burst: 3",
                "  retryDelayMs: 250",
                "  respectRobots: false",
                "processor:",
                "  parser: xml",
                "  removeComments: false",
                "weights: { security: 2.5 }",
                "crawl: { maxDepth: 0, excludePaths: [/admin, /tmp] }",
                "analyzerOptions:",
                "  security:",
                "    scoring: { high: 20 }",
                "  content:",
                "    min_word_count: 50",
                "    target_keywords: [lens, camera]",
                ""));

        assertEquals(8, cfg.getConcurrency());
        assertEquals(List.of("security", "title"), cfg.getAnalyzers());
        assertEquals(3, cfg.getCollector().getBurst());
        assertEquals(Duration.ofMillis(250), cfg.getCollector().getRetryDelay());
        assertFalse(cfg.getCollector().isRespectRobots());
        assertEquals(ProcessorConfig.ParserKind.XML, cfg.getProcessor().getParser());
        assertFalse(cfg.getProcessor().isRemoveComments());
        assertEquals(Double.valueOf(2.5), cfg.getAnalyzerWeights().get("security"));
        assertEquals(0, cfg.getCrawl().getMaxDepth());
        assertEquals(List.of("/admin", "/tmp"), cfg.getCrawl().getExcludePaths());
        assertEquals(20.0, cfg.analyzerConfig("security").getWeights().penalty(Severity.HIGH));
        assertEquals(15.0, cfg.analyzerConfig("title").getWeights().penalty(Severity.HIGH));
        assertEquals(50, cfg.analyzerConfig("content").getInt("min_word_count", 0));
        assertEquals(List.of("lens", "camera"), cfg.analyzerConfig("content").getStringList("target_keywords", List.of()));
    }

    @Test
    void invalid_values_are_rejected() {
        assertThatThrownBy(() -> load("concurrency: 0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> load("collector: { maxRetries: lots }"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maxRetries must be an integer");
        assertThatThrownBy(() -> load("processor: { parser: regex }"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown parser");
    }

    @Test
    void file_loading(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pagelens.yml");
        Files.writeString(file, "cache: { ttlMinutes: 0, dir: results }\n");

        EngineConfig cfg = YamlConfigLoader.load(file);

        assertEquals(0, cfg.getCache().getTtlMinutes());
        assertEquals(Path.of("results"), cfg.getCache().getDir());
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("missing.yml")))
                .isInstanceOf(IOException.class);
    }
}

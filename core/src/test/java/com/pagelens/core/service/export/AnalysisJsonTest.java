package com.pagelens.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.pagelens.core.model.AnalysisResult;
import com.pagelens.core.model.AnalysisStatus;
import com.pagelens.core.model.AnalyzerResult;
import com.pagelens.core.model.BatchResult;
import com.pagelens.core.model.BatchStats;
import com.pagelens.core.model.UrlOutcome;
import com.pagelens.core.testutil.Pages;
import com.pagelens.core.testutil.Results;
import com.pagelens.core.analyzer.analyzers.SecurityAnalyzer;
import com.pagelens.core.analyzer.analyzers.TitleAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.service.ResultAggregator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisJsonTest {

    private static AnalysisResult realResult() {
        ParsedDocument doc = Pages.parse("http://json.example/", "<html><head><title>x</title></head>"
                + "<body><a href=\"https://other.example/\" target=\"_blank\">out</a></body></html>");
        Map<String, AnalyzerResult> m = new LinkedHashMap<>();
        m.put("security", new SecurityAnalyzer(AnalyzerConfig.defaults()).analyze(doc));
        m.put("title", new TitleAnalyzer(AnalyzerConfig.defaults()).analyze(doc));
        return new ResultAggregator().merge(URI.create("http://json.example/"), m,
                Results.T0, Results.T0.plusMillis(1234));
    }

    @Test
    void round_trip_preserves_score_and_findings() throws Exception {
        AnalysisResult original = realResult();

        AnalysisResult back = AnalysisJson.fromJson(AnalysisJson.toJson(original));

        assertThat(back.getOverallScore()).isEqualTo(original.getOverallScore());
        assertThat(back.totalFindings()).isEqualTo(original.totalFindings());
        assertThat(back.getFindings()).isEqualTo(original.getFindings());
        assertThat(back.getSeverityCounts()).isEqualTo(original.getSeverityCounts());
        assertThat(back.getRecommendations()).isEqualTo(original.getRecommendations());
        assertThat(back.getAnalyzers()).isEqualTo(original.getAnalyzers());
        assertThat(back.getStatus()).isEqualTo(original.getStatus());
        assertThat(back.getStartedAt()).isEqualTo(Results.T0);
        assertThat(back.getDuration()).isEqualTo(Duration.ofMillis(1234));
    }

    @Test
    void json_uses_snake_case_and_seconds() throws Exception {
        JsonNode root = AnalysisJson.mapper().readTree(AnalysisJson.toJson(realResult()));

        assertThat(root.has("overall_score")).isTrue();
        assertThat(root.get("started_at").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(root.get("duration").asDouble()).isEqualTo(1.234);
        assertThat(root.path("analyzers").path("security").path("findings").isArray()).isTrue();
        assertThat(root.path("severity_counts").has("CRITICAL")).isTrue();
        assertThat(root.has("error_kind")).isFalse();
    }

    @Test
    void finding_shape_keeps_a_null_location() throws Exception {
        JsonNode finding = AnalysisJson.mapper().readTree(AnalysisJson.toJson(Results.completed("https://json.example/")))
                .path("analyzers").path("security").path("findings").get(0);

        assertThat(finding.has("location")).isTrue();
        assertThat(finding.get("location").isNull()).isTrue();
        assertThat(finding.get("category").asText()).isEqualTo("HTTPS");
        assertThat(AnalysisJson.fromJson(AnalysisJson.toJson(Results.completed("https://json.example/")))
                .getFindings().get(0).getLocation()).isNull();
    }

    @Test
    void failed_result_keeps_error_fields() throws Exception {
        AnalysisResult failed = AnalysisResult.builder()
                .url("https://json.example/gone")
                .startedAt(Results.T0)
                .completedAt(Results.T0.plusSeconds(2))
                .status(AnalysisStatus.FAILED)
                .errorKind("HTTP_STATUS")
                .httpStatus(404)
                .errorMessage("HTTP 404 for https://json.example/gone")
                .build();

        AnalysisResult back = AnalysisJson.fromJson(AnalysisJson.toJson(failed));

        assertThat(back.getErrorKind()).isEqualTo("HTTP_STATUS");
        assertThat(back.getHttpStatus()).isEqualTo(404);
        assertThat(back.getAnalyzers()).isEmpty();
    }

    @Test
    void missing_required_fields_are_rejected() {
        assertThatThrownBy(() -> AnalysisJson.fromJson("{\"url\":\"https://x.example/\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("started_at");
    }

    @Test
    void write_and_read_file(@TempDir Path dir) throws Exception {
        AnalysisResult original = realResult();

        Path file = AnalysisJson.write(dir.resolve("out/result.json"), original);

        assertThat(file).exists();
        assertThat(AnalysisJson.read(file).getOverallScore()).isEqualTo(original.getOverallScore());
    }

    @Test
    void batch_json_lists_outcomes_in_order() throws Exception {
        Map<String, UrlOutcome> outcomes = new LinkedHashMap<>();
        outcomes.put("https://json.example/", UrlOutcome.of(Results.completed("https://json.example/")));
        outcomes.put("https://json.example/late", UrlOutcome.skipped("https://json.example/late", "deadline exceeded"));
        BatchResult batch = new BatchResult(outcomes, Duration.ofSeconds(3), new BatchStats().snapshot());

        JsonNode root = AnalysisJson.mapper().readTree(AnalysisJson.batchToJson(batch));

        assertThat(root.get("elapsed").asDouble()).isEqualTo(3.0);
        assertThat(root.path("counts").path("SKIPPED").asInt()).isEqualTo(1);
        assertThat(root.path("outcomes").get(0).path("status").asText()).isEqualTo("COMPLETED");
        assertThat(root.path("outcomes").get(1).path("message").asText()).isEqualTo("deadline exceeded");
        assertThat(root.path("outcomes").get(1).has("result")).isFalse();
        assertThat(root.path("stats").has("fetch_attempts")).isTrue();
    }
}

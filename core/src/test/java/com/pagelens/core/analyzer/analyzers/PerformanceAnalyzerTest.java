package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.AnalyzerResult;
import com.pagelens.core.model.Finding;
import com.pagelens.core.testutil.Pages;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PerformanceAnalyzerTest {

    private static final Map<String, String> FAST_HEADERS = Map.of(
            "Content-Encoding", "br",
            "Cache-Control", "max-age=600");

    @Test
    void lean_page_with_compression_and_caching_is_clean() {
        String html = "<html><head><link rel=\"stylesheet\" href=\"https://cdn.example/s.min.css\"></head>"
                + "<body><img src=\"/a.png\" width=\"10\" height=\"10\"></body></html>";
        AnalyzerResult r = new PerformanceAnalyzer(AnalyzerConfig.defaults())
                .analyze(Pages.parse("https://fast.example/", html, FAST_HEADERS));

        assertThat(r.getFindings()).isEmpty();
        assertThat(r.getScore()).isEqualTo(100.0);
    }

    @Test
    void missing_compression_caching_and_blocking_head() {
        StringBuilder head = new StringBuilder("<html><head>");
        for (int i = 0; i < 4; i++) head.append("<script src=\"https://slow.example/js/app").append(i).append(".js\"></script>");
        head.append("<style>@font-face { font-family: X; src: url(x.woff2); }</style>");
        head.append("</head><body>");
        for (int i = 0; i < 7; i++) head.append("<img src=\"/i").append(i).append(".png\">");
        head.append("</body></html>");

        AnalyzerResult r = new PerformanceAnalyzer(AnalyzerConfig.defaults())
                .analyze(Pages.parse("https://slow.example/", head.toString()));

        assertThat(r.getFindings()).extracting(Finding::getCategory).contains(
                "COMPRESSION", "CACHING", "RENDER_BLOCKING", "IMAGE_DIMENSIONS", "LAZY_LOADING",
                "MINIFICATION", "FONT_DISPLAY");
        assertThat(r.getFindings()).filteredOn(f -> f.getCategory().equals("LAZY_LOADING"))
                .singleElement().satisfies(f -> assertThat(f.getMessage()).startsWith("2 "));
    }

    @Test
    void page_size_and_resource_limits_follow_options() {
        AnalyzerConfig tight = AnalyzerConfig.of(Map.of("max_page_size_kb", 1, "max_resource_count", 2));
        String big = "<html><body>" + "x".repeat(4096)
                + "<img src=\"/a.png\" width=\"1\" height=\"1\"><img src=\"/b.png\" width=\"1\" height=\"1\">"
                + "<img src=\"/c.png\" width=\"1\" height=\"1\"></body></html>";

        AnalyzerResult r = new PerformanceAnalyzer(tight).analyze(Pages.parse("https://big.example/", big, FAST_HEADERS));

        assertThat(r.getFindings()).extracting(Finding::getCategory).contains("PAGE_SIZE", "RESOURCE_COUNT");
        assertThatThrownBy(() -> new PerformanceAnalyzer(AnalyzerConfig.of(Map.of("max_page_size_kb", 0))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

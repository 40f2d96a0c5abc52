package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.AnalyzerResult;
import com.pagelens.core.model.Finding;
import com.pagelens.core.model.Severity;
import com.pagelens.core.testutil.Pages;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MobileFriendlyAnalyzerTest {

    private static AnalyzerResult run(String html) {
        return new MobileFriendlyAnalyzer(AnalyzerConfig.defaults()).analyze(Pages.parse("https://m.example/", html));
    }

    @Test
    void responsive_page_passes() {
        AnalyzerResult r = run("<html><head><meta name=\"viewport\" content=\"width=device-width, initial-scale=1\">"
                + "<link rel=\"apple-touch-icon\" href=\"/icon.png\"></head><body><p>Hello</p></body></html>");

        assertThat(r.getFindings()).isEmpty();
    }

    @Test
    void desktop_only_page_collects_every_problem() {
        AnalyzerResult r = run("<html><head><meta name=\"viewport\" content=\"width=1024, user-scalable=no\">"
                + "<style>body { color: red }</style></head><body>"
                + "<div style=\"width: 980px\">wide</div>"
                + "<p style=\"font-size: 9px\">tiny</p>"
                + "<a href=\"/x\" style=\"width: 20px; height: 20px\">x</a>"
                + "<embed src=\"/movie.swf\"></body></html>");

        assertThat(r.getFindings()).extracting(Finding::getCategory).containsExactly(
                "VIEWPORT", "ZOOM", "FIXED_WIDTH", "FONT_SIZE", "TOUCH_TARGETS", "PLUGINS", "RESPONSIVE", "TOUCH_ICON");
        assertThat(r.getFindings().get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void missing_viewport_is_high() {
        AnalyzerResult r = run("<html><body><p>Hello</p></body></html>");

        assertThat(r.getFindings()).filteredOn(f -> f.getCategory().equals("VIEWPORT"))
                .singleElement().extracting(Finding::getSeverity).isEqualTo(Severity.HIGH);
    }

    @Test
    void low_maximum_scale_limits_zoom() {
        AnalyzerResult r = run("<html><head><meta name=\"viewport\" content=\"width=device-width, maximum-scale=1.0\"></head>"
                + "<body></body></html>");

        assertThat(r.getFindings()).extracting(Finding::getCategory).contains("ZOOM").doesNotContain("VIEWPORT");
    }

    @Test
    void viewport_content_parsing() {
        assertThat(MobileFriendlyAnalyzer.parseViewport("Width=device-width; initial-scale=1, bogus"))
                .containsEntry("width", "device-width")
                .containsEntry("initial-scale", "1")
                .hasSize(2);
    }

    @Test
    void invalid_font_size_option_is_rejected() {
        assertThatThrownBy(() -> new MobileFriendlyAnalyzer(AnalyzerConfig.of(Map.of("min_font_size", 0))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

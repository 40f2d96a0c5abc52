package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.AnalyzerResult;
import com.pagelens.core.model.Finding;
import com.pagelens.core.model.Severity;
import com.pagelens.core.testutil.Pages;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TitleAnalyzerTest {

    private static AnalyzerResult run(String head, AnalyzerConfig cfg) {
        return new TitleAnalyzer(cfg).analyze(Pages.parse("https://t.example/", "<html><head>" + head + "</head><body></body></html>"));
    }

    private static AnalyzerResult run(String head) {
        return run(head, AnalyzerConfig.defaults());
    }

    @Test
    void good_title_passes() {
        assertThat(run("<title>Widgets for every workshop and garage</title>").getFindings()).isEmpty();
    }

    @Test
    void missing_title_stops_further_checks() {
        AnalyzerResult r = run("");

        assertThat(r.getFindings()).singleElement().satisfies(f -> {
            assertThat(f.getCategory()).isEqualTo("TITLE_MISSING");
            assertThat(f.getSeverity()).isEqualTo(Severity.HIGH);
        });
        assertThat(r.getScore()).isEqualTo(85.0);
    }

    @Test
    void short_duplicate_and_shouting_titles() {
        assertThat(run("<title>Short</title>").getFindings()).extracting(Finding::getCategory).containsExactly("TITLE_LENGTH");
        assertThat(run("<title>Widgets for every workshop and garage</title><title>Other</title>").getFindings())
                .extracting(Finding::getCategory).containsExactly("TITLE_DUPLICATE");
        assertThat(run("<title>BUY THE BEST WIDGETS ONLINE TODAY AT ACME</title>").getFindings())
                .extracting(Finding::getCategory).containsExactly("TITLE_FORMAT");
    }

    @Test
    void brand_and_keywords_come_from_options() {
        AnalyzerConfig cfg = AnalyzerConfig.of(Map.of("brand_name", "Acme", "target_keywords", List.of("gadget", "gizmo")));

        AnalyzerResult r = run("<title>Widgets for every workshop and garage</title>", cfg);

        assertThat(r.getFindings()).extracting(Finding::getCategory).containsExactly("TITLE_BRAND", "TITLE_KEYWORDS");
        assertThat(run("<title>Acme gadget store for every garage</title>", cfg).getFindings()).isEmpty();
    }

    @Test
    void inconsistent_length_bounds_are_rejected() {
        assertThatThrownBy(() -> new TitleAnalyzer(AnalyzerConfig.of(Map.of("min_length", 40, "max_length", 20))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max_length");
    }
}

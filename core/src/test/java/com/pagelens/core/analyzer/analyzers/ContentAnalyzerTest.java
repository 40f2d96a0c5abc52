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
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class ContentAnalyzerTest {

    private static AnalyzerResult run(Map<String, ?> options, String body) {
        return new ContentAnalyzer(AnalyzerConfig.of(options))
                .analyze(Pages.parse("https://content.example/", "<html><head><title>t</title></head><body>" + body + "</body></html>"));
    }

    /** "Camera itemNa ... itemNe." 문장 n개: 단어 6n개 중 camera가 n번 */
    private static String cameraSentences(int n) {
        StringBuilder sb = new StringBuilder("<p>");
        for (int i = 0; i < n; i++) {
            sb.append("Camera item").append(i).append("a item").append(i).append("b item").append(i)
                    .append("c item").append(i).append("d item").append(i).append("e. ");
        }
        return sb.append("</p>").toString();
    }

    @Test
    void empty_body_is_reported() {
        AnalyzerResult r = run(Map.of(), "");

        assertThat(r.getFindings()).singleElement().satisfies(f -> {
            assertThat(f.getCategory()).isEqualTo("CONTENT_EMPTY");
            assertThat(f.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(f.getAnalyzer()).isEqualTo("content");
        });
        assertThat(r.getScore()).isEqualTo(85.0);
    }

    @Test
    void short_page_is_thin_content() {
        AnalyzerResult r = run(Map.of(), "<p>Short page about cameras.</p>");

        assertThat(r.getFindings()).extracting(Finding::getCategory).containsExactly("THIN_CONTENT");
        assertThat(r.getFindings().get(0).getMessage()).isEqualTo("Content has 4 words (minimum 300)");
        assertThat(r.getScore()).isEqualTo(92.0);
    }

    @Test
    void repeated_word_above_max_density_is_stuffing() {
        AnalyzerResult r = run(Map.of("min_word_count", 0), cameraSentences(10));

        assertThat(r.getFindings()).filteredOn(f -> f.getCategory().equals("KEYWORD_DENSITY"))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.getSeverity()).isEqualTo(Severity.MEDIUM);
                    assertThat(f.getMessage()).startsWith("Word 'camera' density 16.7%");
                });
    }

    @Test
    void density_is_not_judged_on_short_text() {
        AnalyzerResult r = run(Map.of("min_word_count", 0), cameraSentences(5));

        assertThat(r.getFindings()).extracting(Finding::getCategory).doesNotContain("KEYWORD_DENSITY");
    }

    @Test
    void target_keywords_missing_or_sparse() {
        Map<String, Object> options = Map.of(
                "min_word_count", 0,
                "min_keyword_density", 0.05,
                "max_keyword_density", 0.5,
                "target_keywords", List.of("camera", "tripod stand", "lens"));
        AnalyzerResult r = run(options, cameraSentences(10) + "<p>A lens.</p>");

        assertThat(r.getFindings()).filteredOn(f -> f.getCategory().startsWith("KEYWORD"))
                .extracting(Finding::getCategory, Finding::getSeverity)
                .containsExactly(
                        tuple("KEYWORD_MISSING", Severity.MEDIUM),
                        tuple("KEYWORD_DENSITY", Severity.LOW));
        assertThat(r.getFindings()).filteredOn(f -> f.getCategory().equals("KEYWORD_MISSING"))
                .singleElement()
                .satisfies(f -> assertThat(f.getLocation()).isEqualTo("tripod stand"));
    }

    @Test
    void long_paragraphs_and_repeated_sentences() {
        StringBuilder longParagraph = new StringBuilder("<p>");
        for (int i = 0; i < 160; i++) longParagraph.append("word").append(i).append(' ');
        longParagraph.append("</p>");
        String repeated = "<p>Same sentence here.</p><p>Same sentence here.</p><p>Same sentence here.</p>"
                + "<p>Another line entirely.</p><p>Closing remark today.</p>";

        AnalyzerResult r = run(Map.of("min_word_count", 0, "max_grade_level", 100.0), longParagraph + repeated);

        assertThat(r.getFindings()).extracting(Finding::getCategory)
                .contains("PARAGRAPH_LENGTH", "DUPLICATE_CONTENT");
        assertThat(r.getFindings()).filteredOn(f -> f.getCategory().equals("PARAGRAPH_LENGTH"))
                .singleElement()
                .satisfies(f -> assertThat(f.getMessage()).isEqualTo("1 paragraph(s) longer than 150 words"));
    }

    @Test
    void readability_helpers() {
        assertThat(ContentAnalyzer.syllables("table")).isEqualTo(2);
        assertThat(ContentAnalyzer.syllables("camera")).isEqualTo(3);
        assertThat(ContentAnalyzer.syllables("the")).isEqualTo(1);
        assertThat(ContentAnalyzer.words("The cat's 'hat' a, b!")).containsExactly("the", "cat's", "hat");
        assertThat(ContentAnalyzer.gradeLevel(1, List.of("the", "cat", "sat"))).isCloseTo(-2.62, within(0.001));
        assertThat(ContentAnalyzer.gradeLevel(0, List.of("cat"))).isZero();
    }

    @Test
    void bad_options_rejected() {
        assertThatThrownBy(() -> new ContentAnalyzer(AnalyzerConfig.of(Map.of("min_keyword_density", 0.1, "max_keyword_density", 0.05))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("min_keyword_density");
        assertThatThrownBy(() -> new ContentAnalyzer(AnalyzerConfig.of(Map.of("max_paragraph_words", 0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ContentAnalyzer(AnalyzerConfig.of(Map.of("min_grade_level", 14.0))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("min_grade_level");
    }
}

package com.pagelens.core.processor;

import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.ProcessorConfig;
import com.pagelens.core.model.RawDocument;
import com.pagelens.core.testutil.Pages;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlProcessorTest {

    private static final String PAGE = """
            <!DOCTYPE html>
            <html lang="en">
            <head>
              <meta charset="utf-8">
              <title>  Hello   World  </title>
              <meta name="description" content="A page">
              <meta property="og:title" content="OG Hello">
              <link rel="canonical" href="/canonical">
              <link rel="stylesheet" href="/app.css">
              <script src="/app.js" defer></script>
              <script type="application/ld+json">{"@context":"https://schema.org","@type":"Thing","name":"x"}</script>
              <!-- secret comment -->
            </head>
            <body>
              <h1>Main</h1><h2>Sub</h2><h4>Deep</h4>
              <a href="/about#team">About us</a>
              <a href="https://other.example/x" target="_blank" rel="nofollow">Other</a>
              <a href="#top">Top</a>
              <img src="/logo.png" alt="Logo" width="10" height="10">
              <img src="/decor.png" alt="">
              <img src="/noalt.png">
              <form action="/login" method="POST">
                <label for="u">User</label><input id="u" name="user">
                <input type="password" name="pw">
                <input type="hidden" name="csrf">
              </form>
              <div itemscope itemtype="https://schema.org/Person"><span itemprop="name">Ann</span></div>
            </body>
            </html>
            """;

    private final HtmlProcessor processor = new HtmlProcessor();

    @Test
    void extracts_document_model() {
        ParsedDocument doc = Pages.parse("https://www.example.com/start", PAGE);

        assertThat(doc.hasDoctype()).isTrue();
        assertThat(doc.getTitle()).isEqualTo("Hello World");
        assertThat(doc.getTitleCount()).isEqualTo(1);
        assertThat(doc.getLanguage()).isEqualTo("en");
        assertThat(doc.meta("description")).isEqualTo("A page");
        assertThat(doc.meta("og:title")).isEqualTo("OG Hello");
        assertThat(doc.getCanonical()).isEqualTo("https://www.example.com/canonical");

        assertThat(doc.getHeadings()).extracting(ParsedDocument.Heading::level).containsExactly(1, 2, 4);
        assertThat(doc.headingTree()).hasSize(1);
        assertThat(doc.headingTree().get(0).children()).hasSize(1);

        assertThat(doc.getLinks()).hasSize(3);
        ParsedDocument.Link about = doc.getLinks().get(0);
        assertThat(about.href()).isEqualTo("https://www.example.com/about");
        assertThat(about.rawHref()).isEqualTo("/about#team");
        assertThat(about.internal()).isTrue();
        ParsedDocument.Link other = doc.getLinks().get(1);
        assertThat(other.internal()).isFalse();
        assertThat(other.nofollow()).isTrue();
        assertThat(other.targetBlank()).isTrue();

        assertThat(doc.getImages()).extracting(ParsedDocument.Image::alt).containsExactly("Logo", "", null);
        assertThat(doc.getImages().get(0).hasDimensions()).isTrue();

        assertThat(doc.getScripts()).hasSize(2);
        assertThat(doc.getScripts().get(0).isExternal()).isTrue();
        assertThat(doc.getScripts().get(0).defer()).isTrue();
        assertThat(doc.getScripts().get(0).inHead()).isTrue();
        assertThat(doc.getStylesheets()).extracting(ParsedDocument.Stylesheet::href)
                .containsExactly("https://www.example.com/app.css");

        assertThat(doc.getForms()).hasSize(1);
        ParsedDocument.Form form = doc.getForms().get(0);
        assertThat(form.method()).isEqualTo("post");
        assertThat(form.fields()).extracting(ParsedDocument.FormField::type).containsExactly("text", "password");
        assertThat(form.fields().get(0).labelled()).isTrue();
        assertThat(form.fields().get(1).labelled()).isFalse();

        assertThat(doc.getStructuredData()).extracting(ParsedDocument.StructuredData::format)
                .containsExactly(ParsedDocument.DataFormat.JSON_LD, ParsedDocument.DataFormat.MICRODATA);
        assertThat(doc.getStructuredData().get(1).properties()).containsExactly("name");

        assertThat(doc.getHtml()).doesNotContain("secret comment");
        assertThat(doc.getMetadata()).containsEntry("parser", "html").containsEntry("requested_url", "https://www.example.com/start");
    }

    @Test
    void malformed_markup_never_throws_and_records_warnings() {
        ParsedDocument doc = Pages.parse("https://example.com/", "<html><body><div><p>unclosed<span></table></b>");

        assertThat(doc.getText()).contains("unclosed");
        assertThat(doc.getWarnings()).anyMatch(w -> w.startsWith("malformed markup"));
        assertThat(Integer.parseInt(doc.getMetadata().get("parse_errors"))).isPositive();
    }

    @Test
    void empty_and_truncated_bodies_are_flagged() {
        RawDocument empty = Pages.raw("https://example.com/", "");
        assertThat(processor.parse(empty, null).getWarnings()).contains("empty body");

        RawDocument truncated = RawDocument.builder()
                .url(URI.create("https://example.com/"))
                .statusCode(200)
                .headers(Map.of("Content-Type", List.of("text/html")))
                .body("<html><body>partial")
                .contentType("text/html")
                .truncated(true)
                .build();
        ParsedDocument doc = processor.parse(truncated, ProcessorConfig.defaults());
        assertThat(doc.getMetadata()).containsEntry("truncated", "true");
        assertThat(doc.getWarnings()).anyMatch(w -> w.startsWith("body truncated"));
    }

    @Test
    void unexpected_content_type_is_a_warning() {
        ParsedDocument doc = Pages.parse("https://example.com/data", "{\"a\":1}", Map.of("Content-Type", "application/json"));
        assertThat(doc.getWarnings()).contains("unexpected content type: application/json");
    }

    @Test
    void comments_kept_and_urls_left_raw_when_disabled() {
        ProcessorConfig cfg = ProcessorConfig.builder().removeComments(false).normalizeUrls(false).build();
        ParsedDocument doc = processor.parse(Pages.raw("https://example.com/",
                "<html><body><!-- keep --><a href=\"/a#frag\">x</a></body></html>"), cfg);

        assertThat(doc.getHtml()).contains("keep");
        assertThat(doc.getLinks().get(0).href()).isEqualTo("https://example.com/a#frag");
    }

    @Test
    void wrapping_label_marks_only_its_own_field() {
        ParsedDocument doc = Pages.parse("https://example.com/", "<html><body><form>"
                + "<label>Name <input type=\"text\" name=\"name\"></label>"
                + "<input type=\"email\" name=\"email\">"
                + "<div><label for=\"other\">Other</label><textarea name=\"note\"></textarea></div>"
                + "</form></body></html>");

        List<ParsedDocument.FormField> fields = doc.getForms().get(0).fields();
        assertThat(fields).extracting(ParsedDocument.FormField::name).containsExactly("name", "email", "note");
        assertThat(fields).extracting(ParsedDocument.FormField::labelled).containsExactly(true, false, false);
    }
}

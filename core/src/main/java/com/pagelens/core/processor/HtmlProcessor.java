package com.pagelens.core.processor;

import com.pagelens.core.api.IProcessor;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.ParsedDocument.DataFormat;
import com.pagelens.core.model.ProcessorConfig;
import com.pagelens.core.model.RawDocument;
import com.pagelens.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * jsoup 기반 처리기. 깨진 마크업에서도 예외를 던지지 않는다.
 * 파싱 오류는 최대 MAX_TRACKED_ERRORS개까지 추적해 warnings/metadata에 남긴다.
 */
public class HtmlProcessor implements IProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(HtmlProcessor.class);

    static final int MAX_TRACKED_ERRORS = 50;
    private static final int MAX_REPORTED_ERRORS = 5;
    private static final Set<String> NON_FIELD_INPUTS = Set.of("hidden", "submit", "button", "image", "reset");

    @Override
    public ParsedDocument parse(RawDocument raw, ProcessorConfig config) {
        ProcessorConfig cfg = (config == null) ? ProcessorConfig.defaults() : config;
        URI base = raw.getFinalUrl();
        try {
            return doParse(raw, cfg, base);
        } catch (IOException | RuntimeException e) {
            LOG.warn("processing failed for {}: {}", base, e.toString());
            return ParsedDocument.builder(base)
                    .statusCode(raw.getStatusCode())
                    .headers(raw.getHeaders())
                    .fetchedAt(raw.getFetchedAt())
                    .byteSize(raw.getBodyLength())
                    .warning("processing-failed: " + e.getClass().getSimpleName()
                            + (e.getMessage() == null ? "" : ": " + e.getMessage()))
                    .metadata("requested_url", String.valueOf(raw.getUrl()))
                    .metadata("processing_error", e.getClass().getName())
                    .build();
        }
    }

    private ParsedDocument doParse(RawDocument raw, ProcessorConfig cfg, URI base) throws IOException {
        Parser parser = (cfg.getParser() == ProcessorConfig.ParserKind.XML) ? Parser.xmlParser() : Parser.htmlParser();
        parser.setTrackErrors(MAX_TRACKED_ERRORS);

        Charset declared = raw.declaredCharset();
        Document doc = Jsoup.parse(new ByteArrayInputStream(raw.getBody()),
                declared == null ? null : declared.name(), base.toString(), parser);

        ParsedDocument.Builder b = ParsedDocument.builder(base)
                .statusCode(raw.getStatusCode())
                .headers(raw.getHeaders())
                .fetchedAt(raw.getFetchedAt())
                .byteSize(raw.getBodyLength());

        if (cfg.isRemoveComments()) removeComments(doc);

        b.doctype(doc.documentType() != null);
        Elements titles = doc.select("title");
        b.titleCount(titles.size());
        if (!titles.isEmpty()) b.title(clean(titles.first().text(), cfg));

        Element html = doc.selectFirst("html");
        if (html != null && html.hasAttr("lang")) b.language(html.attr("lang").trim());

        if (cfg.isExtractMetadata()) {
            extractMeta(doc, b);
            extractStructuredData(doc, b);
        }
        Element canonical = doc.selectFirst("link[rel=canonical]");
        if (canonical != null) b.canonical(url(canonical, "href", cfg));

        for (Element h : doc.select("h1, h2, h3, h4, h5, h6")) {
            int level = h.tagName().charAt(1) - '0';
            b.heading(new ParsedDocument.Heading(level, clean(h.text(), cfg)));
        }

        extractLinks(doc, base, b, cfg);
        for (Element img : doc.select("img")) {
            b.image(new ParsedDocument.Image(
                    url(img, "src", cfg),
                    img.hasAttr("alt") ? img.attr("alt") : null,
                    attrOrNull(img, "width"), attrOrNull(img, "height"),
                    attrOrNull(img, "loading"), attrOrNull(img, "srcset")));
        }
        for (Element s : doc.select("script")) {
            boolean external = s.hasAttr("src");
            b.script(new ParsedDocument.Script(
                    external ? url(s, "src", cfg) : null,
                    external ? 0 : s.data().length(),
                    s.hasAttr("async"), s.hasAttr("defer"),
                    attrOrNull(s, "type"), inHead(s)));
        }
        for (Element l : doc.select("link[rel~=(?i)stylesheet]")) {
            b.stylesheet(new ParsedDocument.Stylesheet(url(l, "href", cfg), attrOrNull(l, "media"), inHead(l)));
        }
        for (Element st : doc.select("style")) b.inlineStyle(st.data());
        for (Element f : doc.select("iframe")) b.iframe(url(f, "src", cfg));
        for (Element p : doc.select("p")) {
            String t = clean(p.text(), cfg);
            if (!t.isBlank()) b.paragraph(t.trim());
        }
        extractForms(doc, b, cfg);

        for (Element e : doc.getAllElements()) {
            if (e == doc) continue;
            Map<String, String> attrs = new LinkedHashMap<>();
            for (Attribute a : e.attributes()) attrs.put(a.getKey().toLowerCase(Locale.ROOT), a.getValue());
            List<String> ancestors = new ArrayList<>();
            for (Element p : e.parents()) ancestors.add(p.normalName());
            b.element(new ParsedDocument.Element(e.normalName(), attrs, clean(e.ownText(), cfg), ancestors));
        }

        Element body = doc.body();
        if (cfg.isCleanWhitespace()) {
            b.text(body != null ? body.text() : doc.text());
        } else {
            b.text(body != null ? body.wholeText() : doc.wholeText());
        }
        b.html(doc.outerHtml());

        // 경고/메타데이터
        List<ParseError> errors = parser.getErrors();
        b.metadata("requested_url", String.valueOf(raw.getUrl()));
        b.metadata("parser", cfg.getParser().name().toLowerCase(Locale.ROOT));
        b.metadata("charset", doc.charset().name());
        b.metadata("parse_errors", String.valueOf(errors.size()));
        if (raw.getContentType() != null) b.metadata("content_type", raw.getContentType());
        b.metadata("response_time_ms", String.valueOf(raw.getResponseTimeMs()));
        if (!errors.isEmpty()) {
            b.warning("malformed markup: " + errors.size()
                    + (errors.size() >= MAX_TRACKED_ERRORS ? "+" : "") + " parse errors");
            for (int i = 0; i < Math.min(MAX_REPORTED_ERRORS, errors.size()); i++) {
                b.warning("parse-error: " + errors.get(i));
            }
        }
        if (raw.getBodyLength() == 0) b.warning("empty body");
        if (raw.isTruncated()) {
            b.warning("body truncated at " + raw.getBodyLength() + " bytes");
            b.metadata("truncated", "true");
        }
        String ct = raw.getContentType();
        if (ct != null && !ct.toLowerCase(Locale.ROOT).contains("html") && !ct.toLowerCase(Locale.ROOT).contains("xml")) {
            b.warning("unexpected content type: " + ct);
        }
        return b.build();
    }

    private static void extractMeta(Document doc, ParsedDocument.Builder b) {
        for (Element m : doc.select("meta")) {
            b.metaTag(new ParsedDocument.MetaTag(
                    attrOrNull(m, "name"), attrOrNull(m, "property"), attrOrNull(m, "http-equiv"),
                    attrOrNull(m, "charset"), attrOrNull(m, "content")));
        }
    }

    private static void extractStructuredData(Document doc, ParsedDocument.Builder b) {
        for (Element s : doc.select("script[type]")) {
            if (s.attr("type").trim().equalsIgnoreCase("application/ld+json")) {
                b.structuredData(new ParsedDocument.StructuredData(DataFormat.JSON_LD, null, s.data().trim(), List.of()));
            }
        }
        for (Element scope : doc.select("[itemscope]")) {
            List<String> props = new ArrayList<>();
            for (Element p : scope.select("[itemprop]")) {
                if (p != scope) props.add(p.attr("itemprop"));
            }
            b.structuredData(new ParsedDocument.StructuredData(DataFormat.MICRODATA, attrOrNull(scope, "itemtype"), null, props));
        }
        for (Element scope : doc.select("[typeof]")) {
            List<String> props = new ArrayList<>();
            for (Element p : scope.select("[property]")) {
                if (p != scope) props.add(p.attr("property"));
            }
            b.structuredData(new ParsedDocument.StructuredData(DataFormat.RDFA, scope.attr("typeof"), null, props));
        }
    }

    private static void extractLinks(Document doc, URI base, ParsedDocument.Builder b, ProcessorConfig cfg) {
        for (Element a : doc.select("a[href]")) {
            String rawHref = a.attr("href");
            String href = url(a, "href", cfg);
            URI target = UrlUtils.parseHttp(href);
            boolean internal = target != null && UrlUtils.sameDomain(base, target);
            String rel = attrOrNull(a, "rel");
            boolean nofollow = rel != null && rel.toLowerCase(Locale.ROOT).contains("nofollow");
            boolean blank = a.attr("target").trim().equalsIgnoreCase("_blank");
            b.link(new ParsedDocument.Link(href, rawHref, clean(a.text(), cfg), rel, internal, nofollow, blank));
        }
    }

    private static void extractForms(Document doc, ParsedDocument.Builder b, ProcessorConfig cfg) {
        Set<String> labelledIds = new LinkedHashSet<>();
        for (Element l : doc.select("label[for]")) labelledIds.add(l.attr("for"));

        for (Element form : doc.select("form")) {
            List<ParsedDocument.FormField> fields = new ArrayList<>();
            for (Element f : form.select("input, select, textarea")) {
                String type = f.normalName().equals("input")
                        ? f.attr("type").trim().toLowerCase(Locale.ROOT) : f.normalName();
                if (f.normalName().equals("input") && type.isEmpty()) type = "text";
                if (NON_FIELD_INPUTS.contains(type)) continue;
                String id = attrOrNull(f, "id");
                boolean labelled = (id != null && labelledIds.contains(id))
                        || insideLabel(f)
                        || !f.attr("aria-label").isBlank()
                        || !f.attr("aria-labelledby").isBlank()
                        || !f.attr("title").isBlank();
                fields.add(new ParsedDocument.FormField(f.normalName(), type, attrOrNull(f, "name"), id,
                        labelled, attrOrNull(f, "placeholder")));
            }
            String action = form.hasAttr("action") ? url(form, "action", cfg) : null;
            String method = form.attr("method").isBlank() ? "get" : form.attr("method").trim().toLowerCase(Locale.ROOT);
            b.form(new ParsedDocument.Form(action, method, fields));
        }
    }

    private static boolean insideLabel(Element field) {
        for (Element p : field.parents()) {
            if (p.normalName().equals("label")) return true;
        }
        return false;
    }

    private static void removeComments(Document doc) {
        List<Node> comments = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override public void head(Node node, int depth) {
                if (node instanceof Comment) comments.add(node);
            }
            @Override public void tail(Node node, int depth) { }
        }, doc);
        comments.forEach(Node::remove);
    }

    /** 절대 URL(설정 시 정규화). 해석 불가면 원문 값 */
    private static String url(Element e, String attr, ProcessorConfig cfg) {
        String abs = e.absUrl(attr);
        if (abs == null || abs.isBlank()) return e.attr(attr).trim();
        if (cfg.isNormalizeUrls()) {
            URI u = UrlUtils.parseHttp(abs);
            if (u != null) return u.toString();
        }
        return abs;
    }

    private static boolean inHead(Element e) {
        for (Element p : e.parents()) if (p.normalName().equals("head")) return true;
        return false;
    }

    private static String attrOrNull(Element e, String name) {
        return e.hasAttr(name) ? e.attr(name) : null;
    }

    private static String clean(String s, ProcessorConfig cfg) {
        if (s == null) return "";
        return cfg.isCleanWhitespace() ? s.replaceAll("\\s+", " ").trim() : s;
    }
}

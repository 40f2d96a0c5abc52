package com.pagelens.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 정규화된 문서 구조 뷰(불변). 한 요청의 모든 분석기가 읽기 전용으로 공유한다.
 * 모든 컬렉션은 수정 불가 사본이다.
 */
public final class ParsedDocument {

    public record MetaTag(String name, String property, String httpEquiv, String charset, String content) {
        /** name 또는 property(대소문자 무시) 일치 여부 */
        public boolean is(String key) {
            return (name != null && name.equalsIgnoreCase(key)) || (property != null && property.equalsIgnoreCase(key));
        }
    }

    public record Heading(int level, String text) {}

    /** 헤딩 트리 노드. 상위 레벨 헤딩 아래로 하위 레벨이 중첩된다. */
    public record HeadingNode(Heading heading, List<HeadingNode> children) {}

    public record Link(String href, String rawHref, String text, String rel, boolean internal,
                       boolean nofollow, boolean targetBlank) {}

    /** alt는 속성이 없으면 null, 빈 문자열은 장식 이미지 표시로 유지 */
    public record Image(String src, String alt, String width, String height, String loading, String srcset) {
        public boolean hasDimensions() {
            return width != null && !width.isBlank() && height != null && !height.isBlank();
        }
    }

    public record Script(String src, int inlineLength, boolean async, boolean defer, String type, boolean inHead) {
        public boolean isExternal() { return src != null && !src.isBlank(); }
    }

    public record Stylesheet(String href, String media, boolean inHead) {}

    public record FormField(String tag, String type, String name, String id, boolean labelled, String placeholder) {}

    public record Form(String action, String method, List<FormField> fields) {
        public Form { fields = List.copyOf(fields); }
    }

    public enum DataFormat { JSON_LD, MICRODATA, RDFA }

    /** 구조화 데이터 블록. JSON-LD는 raw에 원문, Microdata/RDFa는 type/properties만. */
    public record StructuredData(DataFormat format, String type, String raw, List<String> properties) {
        public StructuredData { properties = List.copyOf(properties); }
    }

    /** 요소 스냅샷: 태그, 속성(소문자 키), 자체 텍스트, 조상 태그(가까운 순) */
    public record Element(String tag, Map<String, String> attributes, String text, List<String> ancestors) {
        public Element {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            ancestors = List.copyOf(ancestors);
        }
        public String attr(String name) { return attributes.get(name.toLowerCase(Locale.ROOT)); }
        public boolean hasAttr(String name) { return attributes.containsKey(name.toLowerCase(Locale.ROOT)); }
        public boolean inside(String tagName) { return ancestors.contains(tagName); }
    }

    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final Instant fetchedAt;
    private final long byteSize;

    private final String title;
    private final int titleCount;
    private final String language;
    private final boolean doctype;
    private final List<MetaTag> metaTags;
    private final String canonical;
    private final List<Heading> headings;
    private final List<Link> links;
    private final List<Image> images;
    private final List<Script> scripts;
    private final List<Stylesheet> stylesheets;
    private final List<String> inlineStyles;
    private final List<String> iframes;
    private final List<String> paragraphs;
    private final List<Form> forms;
    private final List<StructuredData> structuredData;
    private final List<Element> elements;
    private final String text;
    private final String html;
    private final List<String> warnings;
    private final Map<String, String> metadata;

    private ParsedDocument(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        TreeMap<String, List<String>> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (b.headers != null) b.headers.forEach((k, v) -> { if (k != null) h.put(k, List.copyOf(v)); });
        this.headers = Collections.unmodifiableMap(h);
        this.fetchedAt = b.fetchedAt;
        this.byteSize = b.byteSize;
        this.title = b.title;
        this.titleCount = b.titleCount;
        this.language = b.language;
        this.doctype = b.doctype;
        this.metaTags = List.copyOf(b.metaTags);
        this.canonical = b.canonical;
        this.headings = List.copyOf(b.headings);
        this.links = List.copyOf(b.links);
        this.images = List.copyOf(b.images);
        this.scripts = List.copyOf(b.scripts);
        this.stylesheets = List.copyOf(b.stylesheets);
        this.inlineStyles = List.copyOf(b.inlineStyles);
        this.iframes = List.copyOf(b.iframes);
        this.paragraphs = List.copyOf(b.paragraphs);
        this.forms = List.copyOf(b.forms);
        this.structuredData = List.copyOf(b.structuredData);
        this.elements = List.copyOf(b.elements);
        this.text = (b.text == null) ? "" : b.text;
        this.html = (b.html == null) ? "" : b.html;
        this.warnings = List.copyOf(b.warnings);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public Instant getFetchedAt() { return fetchedAt; }
    public long getByteSize() { return byteSize; }
    public String getTitle() { return title; }
    public int getTitleCount() { return titleCount; }
    public String getLanguage() { return language; }
    public boolean hasDoctype() { return doctype; }
    public List<MetaTag> getMetaTags() { return metaTags; }
    public String getCanonical() { return canonical; }
    public List<Heading> getHeadings() { return headings; }
    public List<Link> getLinks() { return links; }
    public List<Image> getImages() { return images; }
    public List<Script> getScripts() { return scripts; }
    public List<Stylesheet> getStylesheets() { return stylesheets; }
    public List<String> getInlineStyles() { return inlineStyles; }
    public List<String> getIframes() { return iframes; }
    /** 비어 있지 않은 p 요소 텍스트(하위 요소 포함), 문서 순서 */
    public List<String> getParagraphs() { return paragraphs; }
    public List<Form> getForms() { return forms; }
    public List<StructuredData> getStructuredData() { return structuredData; }
    public List<Element> getElements() { return elements; }
    public String getText() { return text; }
    public String getHtml() { return html; }
    public List<String> getWarnings() { return warnings; }
    public Map<String, String> getMetadata() { return metadata; }

    public boolean isHttps() {
        return url.getScheme() != null && url.getScheme().equalsIgnoreCase("https");
    }

    public String header(String name) {
        List<String> vs = headers(name);
        return vs.isEmpty() ? null : vs.get(0);
    }

    public List<String> headers(String name) {
        if (name == null) return List.of();
        List<String> vs = headers.get(name);
        return (vs == null) ? List.of() : vs;
    }

    /** name/property가 key인 첫 메타 content. 없으면 null. */
    public String meta(String key) {
        for (MetaTag m : metaTags) {
            if (m.is(key)) return m.content();
        }
        return null;
    }

    /** http-equiv가 key인 첫 메타 content */
    public String metaHttpEquiv(String key) {
        for (MetaTag m : metaTags) {
            if (m.httpEquiv() != null && m.httpEquiv().equalsIgnoreCase(key)) return m.content();
        }
        return null;
    }

    /** 주어진 태그들의 요소 스냅샷(문서 순서) */
    public List<Element> elements(String... tags) {
        Set<String> wanted = Arrays.stream(tags).map(t -> t.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
        List<Element> out = new ArrayList<>();
        for (Element e : elements) if (wanted.contains(e.tag())) out.add(e);
        return out;
    }

    public List<Element> elementsWithAttr(String attr) {
        List<Element> out = new ArrayList<>();
        for (Element e : elements) if (e.hasAttr(attr)) out.add(e);
        return out;
    }

    /** 헤딩 평면 목록을 트리로 변환 */
    public List<HeadingNode> headingTree() {
        List<HeadingNode> roots = new ArrayList<>();
        Deque<Map.Entry<Heading, List<HeadingNode>>> stack = new ArrayDeque<>();
        for (Heading h : headings) {
            while (!stack.isEmpty() && stack.peek().getKey().level() >= h.level()) stack.pop();
            List<HeadingNode> parent = stack.isEmpty() ? roots : stack.peek().getValue();
            List<HeadingNode> children = new ArrayList<>();
            parent.add(new HeadingNode(h, Collections.unmodifiableList(children)));
            stack.push(Map.entry(h, children));
        }
        return Collections.unmodifiableList(roots);
    }

    public static Builder builder(URI url) { return new Builder(url); }

    public static final class Builder {
        private final URI url;
        private int statusCode = 200;
        private Map<String, List<String>> headers = Map.of();
        private Instant fetchedAt = Instant.EPOCH;
        private long byteSize;
        private String title;
        private int titleCount;
        private String language;
        private boolean doctype;
        private final List<MetaTag> metaTags = new ArrayList<>();
        private String canonical;
        private final List<Heading> headings = new ArrayList<>();
        private final List<Link> links = new ArrayList<>();
        private final List<Image> images = new ArrayList<>();
        private final List<Script> scripts = new ArrayList<>();
        private final List<Stylesheet> stylesheets = new ArrayList<>();
        private final List<String> inlineStyles = new ArrayList<>();
        private final List<String> iframes = new ArrayList<>();
        private final List<String> paragraphs = new ArrayList<>();
        private final List<Form> forms = new ArrayList<>();
        private final List<StructuredData> structuredData = new ArrayList<>();
        private final List<Element> elements = new ArrayList<>();
        private String text;
        private String html;
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder(URI url) { this.url = Objects.requireNonNull(url, "url"); }

        public Builder statusCode(int v) { this.statusCode = v; return this; }
        public Builder headers(Map<String, List<String>> v) { this.headers = (v == null ? Map.of() : v); return this; }
        public Builder fetchedAt(Instant v) { this.fetchedAt = (v == null ? Instant.EPOCH : v); return this; }
        public Builder byteSize(long v) { this.byteSize = v; return this; }
        public Builder title(String v) { this.title = v; return this; }
        public Builder titleCount(int v) { this.titleCount = v; return this; }
        public Builder language(String v) { this.language = v; return this; }
        public Builder doctype(boolean v) { this.doctype = v; return this; }
        public Builder metaTag(MetaTag v) { this.metaTags.add(v); return this; }
        public Builder canonical(String v) { this.canonical = v; return this; }
        public Builder heading(Heading v) { this.headings.add(v); return this; }
        public Builder link(Link v) { this.links.add(v); return this; }
        public Builder image(Image v) { this.images.add(v); return this; }
        public Builder script(Script v) { this.scripts.add(v); return this; }
        public Builder stylesheet(Stylesheet v) { this.stylesheets.add(v); return this; }
        public Builder inlineStyle(String v) { this.inlineStyles.add(v); return this; }
        public Builder iframe(String v) { this.iframes.add(v); return this; }
        public Builder paragraph(String v) { this.paragraphs.add(v); return this; }
        public Builder form(Form v) { this.forms.add(v); return this; }
        public Builder structuredData(StructuredData v) { this.structuredData.add(v); return this; }
        public Builder element(Element v) { this.elements.add(v); return this; }
        public Builder text(String v) { this.text = v; return this; }
        public Builder html(String v) { this.html = v; return this; }
        public Builder warning(String v) { this.warnings.add(v); return this; }
        public Builder metadata(String k, String v) { this.metadata.put(k, v); return this; }

        public ParsedDocument build() { return new ParsedDocument(this); }
    }
}

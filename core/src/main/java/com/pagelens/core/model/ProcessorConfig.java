package com.pagelens.core.model;

import java.util.Locale;

/** 처리기(파서) 설정(불변). */
public final class ProcessorConfig {

    public enum ParserKind {
        HTML, XML;

        public static ParserKind parse(String s) {
            if (s == null) return HTML;
            return switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "html", "html.parser", "lxml", "html5lib" -> HTML;
                case "xml", "lxml-xml" -> XML;
                default -> throw new IllegalArgumentException("unknown parser: " + s);
            };
        }
    }

    private final ParserKind parser;
    private final boolean cleanWhitespace;
    private final boolean normalizeUrls;
    private final boolean removeComments;
    private final boolean extractMetadata;

    private ProcessorConfig(Builder b) {
        this.parser = b.parser;
        this.cleanWhitespace = b.cleanWhitespace;
        this.normalizeUrls = b.normalizeUrls;
        this.removeComments = b.removeComments;
        this.extractMetadata = b.extractMetadata;
    }

    public static ProcessorConfig defaults() { return builder().build(); }

    public ParserKind getParser() { return parser; }
    public boolean isCleanWhitespace() { return cleanWhitespace; }
    public boolean isNormalizeUrls() { return normalizeUrls; }
    public boolean isRemoveComments() { return removeComments; }
    public boolean isExtractMetadata() { return extractMetadata; }

    /** 지문 계산용 정규 문자열 */
    public String canonical() {
        return "parser=" + parser + ";ws=" + cleanWhitespace + ";urls=" + normalizeUrls
                + ";comments=" + removeComments + ";meta=" + extractMetadata;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private ParserKind parser = ParserKind.HTML;
        private boolean cleanWhitespace = true;
        private boolean normalizeUrls = true;
        private boolean removeComments = true;
        private boolean extractMetadata = true;

        public Builder parser(ParserKind v) { this.parser = v; return this; }
        public Builder cleanWhitespace(boolean v) { this.cleanWhitespace = v; return this; }
        public Builder normalizeUrls(boolean v) { this.normalizeUrls = v; return this; }
        public Builder removeComments(boolean v) { this.removeComments = v; return this; }
        public Builder extractMetadata(boolean v) { this.extractMetadata = v; return this; }

        public ProcessorConfig build() {
            if (parser == null) throw new IllegalArgumentException("parser must not be null");
            return new ProcessorConfig(this);
        }
    }
}

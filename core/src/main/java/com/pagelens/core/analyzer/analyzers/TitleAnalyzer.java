package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.List;
import java.util.Locale;

public final class TitleAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "title";

    private final int minLength;
    private final int maxLength;
    private final String brandName;
    private final List<String> targetKeywords;

    public TitleAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.minLength = config.getInt("min_length", 30);
        this.maxLength = config.getInt("max_length", 60);
        this.brandName = config.getString("brand_name", null);
        this.targetKeywords = config.getStringList("target_keywords", List.of());
        if (minLength < 0) throw new IllegalArgumentException("min_length must be >= 0");
        if (maxLength < minLength) throw new IllegalArgumentException("max_length must be >= min_length");
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        String title = doc.getTitle();
        if (isBlank(title)) {
            out.add("TITLE_MISSING", Severity.HIGH, "Page has no <title> or it is empty",
                    "Add a unique, descriptive <title> of " + minLength + "-" + maxLength + " characters.");
            return;
        }
        if (doc.getTitleCount() > 1) {
            out.add("TITLE_DUPLICATE", Severity.MEDIUM, "Page has " + doc.getTitleCount() + " <title> elements",
                    "Keep exactly one <title> in <head>.");
        }
        int len = title.length();
        if (len < minLength) {
            out.add("TITLE_LENGTH", Severity.MEDIUM, "Title is " + len + " characters (minimum " + minLength + ")", title,
                    "Expand the title to at least " + minLength + " characters.");
        } else if (len > maxLength) {
            out.add("TITLE_LENGTH", Severity.LOW, "Title is " + len + " characters (maximum " + maxLength + ")", title,
                    "Shorten the title to " + maxLength + " characters so it is not truncated in results.");
        }
        if (len > 10 && title.equals(title.toUpperCase(Locale.ROOT)) && !title.equals(title.toLowerCase(Locale.ROOT))) {
            out.add("TITLE_FORMAT", Severity.LOW, "Title is written in all caps", title, "Use sentence or title case.");
        }
        String lc = title.toLowerCase(Locale.ROOT);
        if (!isBlank(brandName) && !lc.contains(brandName.toLowerCase(Locale.ROOT))) {
            out.add("TITLE_BRAND", Severity.LOW, "Title does not contain the brand name '" + brandName + "'", title,
                    "Append the brand, e.g. \"Page topic | " + brandName + "\".");
        }
        if (!targetKeywords.isEmpty()
                && targetKeywords.stream().noneMatch(k -> lc.contains(k.toLowerCase(Locale.ROOT)))) {
            out.add("TITLE_KEYWORDS", Severity.MEDIUM, "Title contains none of the target keywords " + targetKeywords, title,
                    "Place the primary keyword near the start of the title.");
        }
    }
}

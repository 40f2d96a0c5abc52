package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** description 길이, 필수 메타, keywords 개수와 본문 키워드 밀도, robots, charset */
public final class MetaAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "meta";

    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int minDescription;
    private final int maxDescription;
    private final int keywordLimit;
    private final double maxKeywordDensity;
    private final List<String> requiredTags;

    public MetaAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.minDescription = config.getInt("min_description_length", 120);
        this.maxDescription = config.getInt("max_description_length", 160);
        this.keywordLimit = config.getInt("keyword_limit", 10);
        this.maxKeywordDensity = config.getDouble("max_keyword_density", 0.03);
        this.requiredTags = config.getStringList("required_tags", List.of("description", "viewport"));
        if (maxDescription < minDescription) throw new IllegalArgumentException("max_description_length must be >= min_description_length");
        if (maxKeywordDensity <= 0 || maxKeywordDensity > 1) throw new IllegalArgumentException("max_keyword_density must be in (0, 1]");
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        String description = doc.meta("description");
        for (String tag : requiredTags) {
            if (isBlank(doc.meta(tag))) {
                out.add("META_REQUIRED", tag.equals("description") ? Severity.HIGH : Severity.MEDIUM,
                        "Missing meta " + tag, "Add <meta name=\"" + tag + "\" content=\"...\">.");
            }
        }
        if (!isBlank(description)) {
            int len = description.trim().length();
            if (len < minDescription) {
                out.add("META_DESCRIPTION", Severity.LOW, "Meta description is " + len + " characters (minimum " + minDescription + ")",
                        "Write a description of " + minDescription + "-" + maxDescription + " characters.");
            } else if (len > maxDescription) {
                out.add("META_DESCRIPTION", Severity.LOW, "Meta description is " + len + " characters (maximum " + maxDescription + ")",
                        "Trim the description to " + maxDescription + " characters.");
            }
        }

        String keywords = doc.meta("keywords");
        if (!isBlank(keywords)) {
            List<String> list = new ArrayList<>();
            for (String k : keywords.split("[,;|]")) if (!k.isBlank()) list.add(k.trim().toLowerCase(Locale.ROOT));
            if (list.size() > keywordLimit) {
                out.add("META_KEYWORDS", Severity.LOW, "Meta keywords lists " + list.size() + " entries (limit " + keywordLimit + ")",
                        "Keep at most " + keywordLimit + " focused keywords.");
            }
            keywordDensity(doc.getText(), list, out);
        }

        String robots = doc.meta("robots");
        if (robots != null && robots.toLowerCase(Locale.ROOT).contains("noindex")) {
            out.add("META_ROBOTS", Severity.MEDIUM, "Page is marked noindex", robots,
                    "Remove noindex if the page should appear in search results.");
        }
        boolean charset = doc.getMetaTags().stream().anyMatch(m -> m.charset() != null)
                || doc.metaHttpEquiv("Content-Type") != null;
        if (!charset) {
            out.add("META_CHARSET", Severity.LOW, "No <meta charset> declaration", "Add <meta charset=\"utf-8\"> early in <head>.");
        }
    }

    private void keywordDensity(String text, List<String> keywords, Findings out) {
        String[] words = WORD_SPLIT.split(text.toLowerCase(Locale.ROOT).trim());
        int total = 0;
        for (String w : words) if (!w.isEmpty()) total++;
        if (total < 50) return; // 본문이 너무 짧으면 밀도가 무의미
        String joined = " " + String.join(" ", words) + " ";
        for (String k : keywords) {
            String needle = " " + String.join(" ", WORD_SPLIT.split(k)) + " ";
            if (needle.isBlank()) continue;
            int count = 0;
            for (int i = joined.indexOf(needle); i >= 0; i = joined.indexOf(needle, i + 1)) count++;
            double density = (double) count / total;
            if (density > maxKeywordDensity) {
                out.add("KEYWORD_DENSITY", Severity.MEDIUM,
                        String.format(Locale.ROOT, "Keyword '%s' density %.1f%% exceeds %.1f%%", k, density * 100, maxKeywordDensity * 100),
                        "Write naturally; repeated keywords read as stuffing.");
            }
        }
    }
}

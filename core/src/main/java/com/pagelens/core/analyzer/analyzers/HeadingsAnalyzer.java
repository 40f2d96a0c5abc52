package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.List;

public final class HeadingsAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "headings";

    private final boolean requireH1;
    private final boolean allowMultipleH1;
    private final int minLength;
    private final int maxLength;

    public HeadingsAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.requireH1 = config.getBoolean("require_h1", true);
        this.allowMultipleH1 = config.getBoolean("allow_multiple_h1", false);
        this.minLength = config.getInt("min_heading_length", 10);
        this.maxLength = config.getInt("max_heading_length", 60);
        if (maxLength < minLength) throw new IllegalArgumentException("max_heading_length must be >= min_heading_length");
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        List<ParsedDocument.Heading> hs = doc.getHeadings();
        long h1 = hs.stream().filter(h -> h.level() == 1).count();
        if (h1 == 0 && requireH1) {
            out.add("H1_MISSING", Severity.HIGH, "Page has no <h1>", "Add one <h1> describing the page topic.");
        } else if (h1 > 1 && !allowMultipleH1) {
            out.add("H1_MULTIPLE", Severity.MEDIUM, "Page has " + h1 + " <h1> elements", "Keep a single <h1>.");
        }
        if (!hs.isEmpty() && hs.get(0).level() != 1 && h1 > 0) {
            out.add("HEADING_HIERARCHY", Severity.LOW, "First heading is h" + hs.get(0).level() + ", not h1",
                    elide(hs.get(0).text(), 80), "Start the outline with the <h1>.");
        }
        int skipped = 0;
        for (int i = 1; i < hs.size(); i++) {
            if (hs.get(i).level() > hs.get(i - 1).level() + 1) skipped++;
        }
        if (skipped > 0) {
            out.add("HEADING_HIERARCHY", Severity.LOW, skipped + " skipped heading level(s) in the outline",
                    "Nest headings one level at a time.");
        }
        for (ParsedDocument.Heading h : hs) {
            String t = h.text();
            if (isBlank(t)) {
                out.add("HEADING_EMPTY", Severity.MEDIUM, "Empty <h" + h.level() + ">", "Remove empty headings or give them text.");
            } else if (h.level() == 1 && t.length() < minLength) {
                out.add("HEADING_LENGTH", Severity.INFO, "<h1> is only " + t.length() + " characters", t,
                        "Make the main heading descriptive.");
            } else if (t.length() > maxLength) {
                out.add("HEADING_LENGTH", Severity.INFO, "<h" + h.level() + "> is " + t.length() + " characters", elide(t, 80),
                        "Keep headings under " + maxLength + " characters.");
            }
        }
    }
}

package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class LinksAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "links";

    private static final Set<String> IGNORED_SCHEMES = Set.of("mailto", "tel", "sms");

    private final int maxLinks;
    private final int maxAnchorLength;
    private final boolean nofollowExternal;
    private final boolean checkFragments;
    private final List<String> allowedSchemes;

    public LinksAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.maxLinks = config.getInt("max_links_per_page", 100);
        this.maxAnchorLength = config.getInt("max_anchor_length", 60);
        this.nofollowExternal = config.getBoolean("nofollow_external", false);
        this.checkFragments = config.getBoolean("check_fragments", true);
        this.allowedSchemes = config.getStringList("allowed_schemes", List.of("http", "https"));
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        List<ParsedDocument.Link> links = doc.getLinks();
        if (links.size() > maxLinks) {
            out.add("LINK_COUNT", Severity.LOW, links.size() + " links on the page (limit " + maxLinks + ")",
                    "Trim navigation and footer links.");
        }
        long internal = links.stream().filter(ParsedDocument.Link::internal).count();
        if (internal == 0 && !links.isEmpty()) {
            out.add("INTERNAL_LINKS", Severity.MEDIUM, "No internal links", "Link to related pages on the same site.");
        }

        Set<String> ids = new HashSet<>();
        for (ParsedDocument.Element e : doc.getElements()) {
            if (e.attr("id") != null) ids.add(e.attr("id"));
            if ("a".equals(e.tag()) && e.attr("name") != null) ids.add(e.attr("name"));
        }

        int empty = 0, longText = 0, badScheme = 0, brokenFragment = 0, followedExternal = 0;
        String badExample = null;
        for (ParsedDocument.Link l : links) {
            String text = (l.text() == null) ? "" : l.text().trim();
            if (text.isEmpty()) empty++;
            else if (text.length() > maxAnchorLength) longText++;

            String raw = (l.rawHref() == null) ? "" : l.rawHref().trim();
            int colon = raw.indexOf(':');
            if (colon > 0 && raw.substring(0, colon).matches("[A-Za-z][A-Za-z0-9+.-]*")) {
                String scheme = raw.substring(0, colon).toLowerCase(Locale.ROOT);
                if (!IGNORED_SCHEMES.contains(scheme) && !allowedSchemes.contains(scheme)) {
                    badScheme++;
                    if (badExample == null) badExample = raw;
                }
            }
            if (checkFragments && raw.startsWith("#") && raw.length() > 1 && !ids.contains(raw.substring(1))) {
                brokenFragment++;
            }
            if (nofollowExternal && !l.internal() && raw.toLowerCase(Locale.ROOT).startsWith("http") && !l.nofollow()) {
                followedExternal++;
            }
        }
        if (empty > 0) out.add("ANCHOR_TEXT", Severity.MEDIUM, empty + " link(s) with empty anchor text", "Give links descriptive text.");
        if (longText > 0) out.add("ANCHOR_TEXT", Severity.INFO, longText + " link(s) with anchor text over " + maxAnchorLength + " characters",
                "Shorten long anchor text.");
        if (badScheme > 0) out.add("LINK_SCHEME", Severity.LOW, badScheme + " link(s) with a disallowed scheme", badExample,
                "Use http(s) links.");
        if (brokenFragment > 0) out.add("BROKEN_FRAGMENT", Severity.LOW, brokenFragment + " in-page link(s) to missing anchors",
                "Point fragment links at existing ids.");
        if (followedExternal > 0) out.add("EXTERNAL_NOFOLLOW", Severity.INFO, followedExternal + " external link(s) without rel=nofollow",
                "Add rel=\"nofollow\" to untrusted external links.");
    }
}

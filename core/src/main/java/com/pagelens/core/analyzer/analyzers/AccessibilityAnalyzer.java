package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/** 언어 선언, 대체 텍스트, 헤딩 순서, 폼 레이블, 랜드마크, tabindex, 클릭 핸들러, ARIA role, 링크 텍스트 */
public final class AccessibilityAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "accessibility";

    private static final Set<String> VALID_ROLES = Set.of(
            "alert", "alertdialog", "application", "article", "banner", "button", "cell", "checkbox",
            "columnheader", "combobox", "complementary", "contentinfo", "definition", "dialog", "directory",
            "document", "feed", "figure", "form", "grid", "gridcell", "group", "heading", "img", "link", "list",
            "listbox", "listitem", "log", "main", "marquee", "math", "menu", "menubar", "menuitem",
            "menuitemcheckbox", "menuitemradio", "navigation", "none", "note", "option", "presentation",
            "progressbar", "radio", "radiogroup", "region", "row", "rowgroup", "rowheader", "scrollbar",
            "search", "searchbox", "separator", "slider", "spinbutton", "status", "switch", "tab", "table",
            "tablist", "tabpanel", "term", "textbox", "timer", "toolbar", "tooltip", "tree", "treegrid", "treeitem");
    private static final Set<String> INTERACTIVE = Set.of("a", "button", "input", "select", "textarea", "summary", "details", "label", "option");
    private static final Set<String> VAGUE_LINK_TEXT = Set.of("click here", "here", "read more", "more", "link", "this");

    private final boolean checkLandmarks;
    private final boolean checkLinkText;

    public AccessibilityAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.checkLandmarks = config.getBoolean("check_landmarks", true);
        this.checkLinkText = config.getBoolean("check_link_text", true);
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        if (isBlank(doc.getLanguage())) {
            out.add("LANGUAGE", Severity.HIGH, "<html> has no lang attribute",
                    "Declare the page language, e.g. <html lang=\"en\">.");
        }

        int missingAlt = 0;
        String firstMissing = null;
        for (ParsedDocument.Image img : doc.getImages()) {
            if (img.alt() == null) {
                missingAlt++;
                if (firstMissing == null) firstMissing = img.src();
            }
        }
        if (missingAlt > 0) {
            out.add("ALT_TEXT", Severity.HIGH, missingAlt + " image(s) without alt attribute", firstMissing,
                    "Give every informative image a descriptive alt; use alt=\"\" for decorative images.");
        }

        List<ParsedDocument.Heading> hs = doc.getHeadings();
        for (int i = 1; i < hs.size(); i++) {
            if (hs.get(i).level() > hs.get(i - 1).level() + 1) {
                out.add("HEADING_ORDER", Severity.MEDIUM,
                        "Heading level skipped: h" + hs.get(i - 1).level() + " followed by h" + hs.get(i).level(),
                        elide(hs.get(i).text(), 80), "Do not skip heading levels; nest headings in order.");
                break;
            }
        }

        int unlabelled = 0;
        for (ParsedDocument.Form f : doc.getForms()) {
            for (ParsedDocument.FormField field : f.fields()) if (!field.labelled()) unlabelled++;
        }
        if (unlabelled > 0) {
            out.add("FORM_LABELS", Severity.HIGH, unlabelled + " form field(s) without an associated label",
                    "Associate each field with <label for>, a wrapping label or aria-label.");
        }

        if (checkLandmarks) {
            boolean main = !doc.elements("main").isEmpty()
                    || doc.getElements().stream().anyMatch(e -> "main".equalsIgnoreCase(e.attr("role")));
            if (!main) {
                out.add("LANDMARKS", Severity.MEDIUM, "No <main> landmark",
                        "Wrap the primary content in <main> so assistive technology can skip to it.");
            }
            if (doc.elements("nav").isEmpty() && doc.getLinks().size() > 10) {
                out.add("LANDMARKS", Severity.LOW, "No <nav> landmark on a page with many links",
                        "Wrap navigation links in <nav>.");
            }
        }

        int positiveTabindex = 0;
        int clickOnly = 0;
        int badRoles = 0;
        String badRole = null;
        for (ParsedDocument.Element e : doc.getElements()) {
            String tab = e.attr("tabindex");
            if (tab != null && parsePx(tab) > 0) positiveTabindex++;
            if (e.hasAttr("onclick") && !INTERACTIVE.contains(e.tag()) && e.attr("role") == null && tab == null) clickOnly++;
            String role = e.attr("role");
            if (role != null) {
                for (String r : role.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
                    if (!r.isEmpty() && !VALID_ROLES.contains(r)) {
                        badRoles++;
                        if (badRole == null) badRole = r;
                    }
                }
            }
        }
        if (positiveTabindex > 0) {
            out.add("KEYBOARD", Severity.MEDIUM, positiveTabindex + " element(s) with positive tabindex",
                    "Avoid tabindex > 0; rely on DOM order for focus order.");
        }
        if (clickOnly > 0) {
            out.add("KEYBOARD", Severity.MEDIUM, clickOnly + " non-interactive element(s) with click handlers",
                    "Use <button> or add role and tabindex plus key handlers.");
        }
        if (badRoles > 0) {
            out.add("ARIA", Severity.LOW, badRoles + " invalid ARIA role value(s)", badRole,
                    "Use only roles defined by WAI-ARIA.");
        }

        if (checkLinkText) {
            int empty = 0;
            int vague = 0;
            for (ParsedDocument.Link l : doc.getLinks()) {
                String t = (l.text() == null) ? "" : l.text().trim().toLowerCase(Locale.ROOT);
                if (t.isEmpty()) empty++;
                else if (VAGUE_LINK_TEXT.contains(t)) vague++;
            }
            // 이미지 링크(alt 텍스트)는 스냅샷 텍스트로 판별 불가하므로 aria-label 있는 a는 제외
            long ariaLabelled = doc.elements("a").stream()
                    .filter(a -> a.hasAttr("href") && a.text().isBlank() && (a.hasAttr("aria-label") || a.hasAttr("title")))
                    .count();
            empty = (int) Math.max(0, empty - ariaLabelled);
            if (empty > 0) {
                out.add("LINK_TEXT", Severity.MEDIUM, empty + " link(s) without accessible text",
                        "Give links visible text or aria-label.");
            }
            if (vague > 0) {
                out.add("LINK_TEXT", Severity.LOW, vague + " link(s) with non-descriptive text (\"click here\")",
                        "Describe the link destination in the link text.");
            }
        }
    }
}

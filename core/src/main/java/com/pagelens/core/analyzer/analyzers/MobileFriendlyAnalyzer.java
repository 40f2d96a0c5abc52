package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** viewport, 확대 제한, 고정 폭, 작은 글꼴, 터치 타깃, 플러그인, 미디어 쿼리, 터치 아이콘 */
public final class MobileFriendlyAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "mobile_friendly";

    private static final Pattern WIDTH_PX = Pattern.compile("(?<![-\\w])width\\s*:\\s*(\\d+(?:\\.\\d+)?)px", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEIGHT_PX = Pattern.compile("(?<![-\\w])height\\s*:\\s*(\\d+(?:\\.\\d+)?)px", Pattern.CASE_INSENSITIVE);
    private static final Pattern FONT_PX = Pattern.compile("font-size\\s*:\\s*(\\d+(?:\\.\\d+)?)px", Pattern.CASE_INSENSITIVE);

    private final int minFontSize;
    private final int minTouchTarget;
    private final int maxFixedWidth;

    public MobileFriendlyAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.minFontSize = config.getInt("min_font_size", 12);
        this.minTouchTarget = config.getInt("min_touch_target_size", 44);
        this.maxFixedWidth = config.getInt("max_fixed_width", 480);
        if (minFontSize < 1) throw new IllegalArgumentException("min_font_size must be >= 1");
        if (minTouchTarget < 1) throw new IllegalArgumentException("min_touch_target_size must be >= 1");
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        String viewport = doc.meta("viewport");
        if (viewport == null) {
            out.add("VIEWPORT", Severity.HIGH, "No viewport meta tag",
                    "Add <meta name=\"viewport\" content=\"width=device-width, initial-scale=1\">.");
        } else {
            Map<String, String> vp = parseViewport(viewport);
            if (!"device-width".equals(vp.get("width"))) {
                out.add("VIEWPORT", Severity.MEDIUM, "Viewport does not use width=device-width: " + elide(viewport, 80),
                        "Use width=device-width so the layout adapts to the screen.");
            }
            String scalable = vp.getOrDefault("user-scalable", "");
            double maxScale = parseScale(vp.get("maximum-scale"));
            if (scalable.equals("no") || scalable.equals("0") || (maxScale > 0 && maxScale < 2.0)) {
                out.add("ZOOM", Severity.MEDIUM, "Viewport disables or limits zoom",
                        "Remove user-scalable=no and maximum-scale below 2.");
            }
        }

        int fixed = 0;
        int smallFonts = 0;
        int smallTargets = 0;
        for (ParsedDocument.Element e : doc.getElements()) {
            String style = e.attr("style");
            if (style == null) continue;
            if (maxPx(WIDTH_PX, style) > maxFixedWidth) fixed++;
            double font = minPx(FONT_PX, style);
            if (font > 0 && font < minFontSize) smallFonts++;
            if (e.tag().equals("a") || e.tag().equals("button")) {
                double w = maxPx(WIDTH_PX, style);
                double h = maxPx(HEIGHT_PX, style);
                if ((w > 0 && w < minTouchTarget) || (h > 0 && h < minTouchTarget)) smallTargets++;
            }
        }
        for (String css : doc.getInlineStyles()) {
            if (maxPx(WIDTH_PX, css) > maxFixedWidth * 2) fixed++;
            double font = minPx(FONT_PX, css);
            if (font > 0 && font < minFontSize) smallFonts++;
        }
        if (fixed > 0) {
            out.add("FIXED_WIDTH", Severity.MEDIUM, fixed + " element(s)/rule(s) with fixed pixel width wider than "
                    + maxFixedWidth + "px", "Use relative widths (%, max-width) instead of fixed pixels.");
        }
        if (smallFonts > 0) {
            out.add("FONT_SIZE", Severity.LOW, smallFonts + " style(s) with font-size below " + minFontSize + "px",
                    "Use a base font size of at least " + minFontSize + "px.");
        }
        if (smallTargets > 0) {
            out.add("TOUCH_TARGETS", Severity.LOW, smallTargets + " link/button(s) smaller than " + minTouchTarget + "px",
                    "Make tap targets at least " + minTouchTarget + "x" + minTouchTarget + "px.");
        }

        int plugins = doc.elements("object", "embed", "applet").size();
        if (plugins > 0) {
            out.add("PLUGINS", Severity.HIGH, plugins + " plugin element(s) (object/embed/applet)",
                    "Replace plugin content with HTML5 equivalents.");
        }

        boolean mediaQueries = doc.getInlineStyles().stream().anyMatch(s -> s.toLowerCase(Locale.ROOT).contains("@media"))
                || doc.getStylesheets().stream().anyMatch(s -> s.media() != null && s.media().contains("("));
        if (!mediaQueries && doc.getStylesheets().isEmpty() && !doc.getInlineStyles().isEmpty()) {
            out.add("RESPONSIVE", Severity.LOW, "No media queries found in page styles",
                    "Add responsive breakpoints with @media rules.");
        }

        boolean touchIcon = doc.elements("link").stream().anyMatch(l -> {
            String rel = l.attr("rel");
            return rel != null && rel.toLowerCase(Locale.ROOT).contains("apple-touch-icon");
        });
        if (!touchIcon) {
            out.add("TOUCH_ICON", Severity.INFO, "No apple-touch-icon link",
                    "Provide an apple-touch-icon for home-screen bookmarks.");
        }
    }

    static Map<String, String> parseViewport(String content) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String part : content.split("[,;]")) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2) {
                out.put(kv[0].trim().toLowerCase(Locale.ROOT), kv[1].trim().toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    private static double parseScale(String v) {
        if (v == null) return -1;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static double maxPx(Pattern p, String css) {
        double max = -1;
        Matcher m = p.matcher(css);
        while (m.find()) max = Math.max(max, Double.parseDouble(m.group(1)));
        return max;
    }

    private static double minPx(Pattern p, String css) {
        double min = -1;
        Matcher m = p.matcher(css);
        while (m.find()) {
            double v = Double.parseDouble(m.group(1));
            min = (min < 0) ? v : Math.min(min, v);
        }
        return min;
    }
}

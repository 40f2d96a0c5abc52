package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 페이지 크기, 리소스 수, 렌더 블로킹, 압축/캐시 헤더, 이미지 치수/지연 로딩, 최소화, 폰트 표시 점검 */
public final class PerformanceAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "performance";

    private static final Pattern FONT_FACE = Pattern.compile("@font-face\\s*\\{([^}]*)}", Pattern.CASE_INSENSITIVE);

    private final int maxPageSizeKb;
    private final int maxResourceCount;
    private final int maxRenderBlocking;
    private final int maxInlineScriptKb;
    private final int lazyLoadThreshold;
    private final boolean checkCompression;
    private final boolean checkCaching;

    public PerformanceAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.maxPageSizeKb = config.getInt("max_page_size_kb", 3000);
        this.maxResourceCount = config.getInt("max_resource_count", 80);
        this.maxRenderBlocking = config.getInt("max_render_blocking", 3);
        this.maxInlineScriptKb = config.getInt("max_inline_script_kb", 50);
        this.lazyLoadThreshold = config.getInt("lazy_load_threshold", 5);
        this.checkCompression = config.getBoolean("check_compression", true);
        this.checkCaching = config.getBoolean("check_caching", true);
        if (maxPageSizeKb < 1) throw new IllegalArgumentException("max_page_size_kb must be >= 1");
        if (maxResourceCount < 1) throw new IllegalArgumentException("max_resource_count must be >= 1");
        if (maxRenderBlocking < 0) throw new IllegalArgumentException("max_render_blocking must be >= 0");
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        long kb = doc.getByteSize() / 1024;
        if (kb > maxPageSizeKb) {
            out.add("PAGE_SIZE", Severity.HIGH, "HTML document is " + kb + " KB (limit " + maxPageSizeKb + " KB)",
                    "Reduce markup size: paginate, remove inline data and unused markup.");
        } else if (kb > maxPageSizeKb / 2) {
            out.add("PAGE_SIZE", Severity.LOW, "HTML document is " + kb + " KB",
                    "Keep the HTML payload small so first paint is not delayed.");
        }

        int resources = doc.getScripts().stream().filter(ParsedDocument.Script::isExternal).mapToInt(s -> 1).sum()
                + doc.getStylesheets().size() + doc.getImages().size() + doc.getIframes().size();
        if (resources > maxResourceCount) {
            out.add("RESOURCE_COUNT", Severity.MEDIUM, resources + " subresources requested (limit " + maxResourceCount + ")",
                    "Bundle scripts and styles and remove unused resources.");
        }

        int blocking = 0;
        String firstBlocking = null;
        for (ParsedDocument.Script s : doc.getScripts()) {
            if (s.inHead() && s.isExternal() && !s.async() && !s.defer() && !"module".equalsIgnoreCase(s.type())) {
                blocking++;
                if (firstBlocking == null) firstBlocking = s.src();
            }
        }
        for (ParsedDocument.Stylesheet css : doc.getStylesheets()) {
            String media = (css.media() == null) ? "" : css.media().trim().toLowerCase(Locale.ROOT);
            if (css.inHead() && (media.isEmpty() || media.equals("all") || media.equals("screen"))) {
                blocking++;
                if (firstBlocking == null) firstBlocking = css.href();
            }
        }
        if (blocking > maxRenderBlocking) {
            out.add("RENDER_BLOCKING", Severity.MEDIUM, blocking + " render-blocking resources in <head>", firstBlocking,
                    "Add async/defer to scripts and inline critical CSS.");
        }

        int inlineBytes = doc.getScripts().stream().mapToInt(ParsedDocument.Script::inlineLength).sum();
        if (inlineBytes / 1024 > maxInlineScriptKb) {
            out.add("INLINE_SCRIPTS", Severity.LOW, "Inline scripts total " + (inlineBytes / 1024) + " KB",
                    "Move large inline scripts into cacheable external files.");
        }

        if (checkCompression) {
            String enc = doc.header("Content-Encoding");
            if (isBlank(enc) || !(enc.contains("gzip") || enc.contains("br") || enc.contains("deflate") || enc.contains("zstd"))) {
                out.add("COMPRESSION", Severity.MEDIUM, "Response is not compressed",
                        "Enable gzip or brotli compression for text responses.");
            }
        }
        if (checkCaching && isBlank(doc.header("Cache-Control")) && isBlank(doc.header("Expires"))
                && isBlank(doc.header("ETag")) && isBlank(doc.header("Last-Modified"))) {
            out.add("CACHING", Severity.LOW, "No caching headers (Cache-Control/Expires/ETag/Last-Modified)",
                    "Send Cache-Control and validators so repeat visits are cheap.");
        }

        int noDims = 0;
        int eager = 0;
        int index = 0;
        for (ParsedDocument.Image img : doc.getImages()) {
            if (!img.hasDimensions()) noDims++;
            if (index++ >= lazyLoadThreshold && !"lazy".equalsIgnoreCase(img.loading())) eager++;
        }
        if (noDims > 0) {
            out.add("IMAGE_DIMENSIONS", Severity.LOW, noDims + " image(s) without width/height (layout shift)",
                    "Set explicit width and height on images.");
        }
        if (eager > 0) {
            out.add("LAZY_LOADING", Severity.LOW, eager + " below-the-fold image(s) without loading=lazy",
                    "Add loading=\"lazy\" to images that are not in the first viewport.");
        }

        int unminified = 0;
        String firstUnminified = null;
        for (ParsedDocument.Script s : doc.getScripts()) {
            if (s.isExternal() && isOwnAsset(doc, s.src()) && s.src().endsWith(".js") && !s.src().contains(".min.")) {
                unminified++;
                if (firstUnminified == null) firstUnminified = s.src();
            }
        }
        for (ParsedDocument.Stylesheet css : doc.getStylesheets()) {
            String href = (css.href() == null) ? "" : css.href();
            if (isOwnAsset(doc, href) && href.endsWith(".css") && !href.contains(".min.")) {
                unminified++;
                if (firstUnminified == null) firstUnminified = href;
            }
        }
        if (unminified > 0) {
            out.add("MINIFICATION", Severity.INFO, unminified + " script/style file(s) do not look minified", firstUnminified,
                    "Serve minified bundles in production.");
        }

        int fontsWithoutDisplay = 0;
        for (String css : doc.getInlineStyles()) {
            Matcher m = FONT_FACE.matcher(css);
            while (m.find()) {
                if (!m.group(1).toLowerCase(Locale.ROOT).contains("font-display")) fontsWithoutDisplay++;
            }
        }
        if (fontsWithoutDisplay > 0) {
            out.add("FONT_DISPLAY", Severity.LOW, fontsWithoutDisplay + " @font-face rule(s) without font-display",
                    "Add font-display: swap so text renders while fonts load.");
        }
    }

    private static boolean isOwnAsset(ParsedDocument doc, String src) {
        if (src == null || src.isBlank()) return false;
        String host = doc.getUrl().getHost();
        return host != null && src.toLowerCase(Locale.ROOT).contains("//" + host.toLowerCase(Locale.ROOT) + "/");
    }
}

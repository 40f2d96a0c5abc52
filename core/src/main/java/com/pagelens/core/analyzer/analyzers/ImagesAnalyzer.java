package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.List;
import java.util.Locale;

public final class ImagesAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "images";

    private final int minAltLength;
    private final int maxAltLength;
    private final int maxImages;
    private final boolean requireLazyLoading;
    private final boolean requireWidthHeight;
    private final List<String> allowedFormats;

    public ImagesAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.minAltLength = config.getInt("min_alt_length", 5);
        this.maxAltLength = config.getInt("max_alt_length", 125);
        this.maxImages = config.getInt("max_images_per_page", 50);
        this.requireLazyLoading = config.getBoolean("require_lazy_loading", true);
        this.requireWidthHeight = config.getBoolean("require_width_height", true);
        this.allowedFormats = config.getStringList("allowed_formats", List.of("jpg", "jpeg", "png", "webp", "avif", "svg", "gif"));
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        List<ParsedDocument.Image> images = doc.getImages();
        if (images.size() > maxImages) {
            out.add("IMAGE_COUNT", Severity.LOW, images.size() + " images on the page (limit " + maxImages + ")",
                    "Reduce or paginate images.");
        }
        int noSrc = 0, noAlt = 0, shortAlt = 0, longAlt = 0, badFormat = 0, noDims = 0, notLazy = 0;
        String badExample = null;
        for (ParsedDocument.Image img : images) {
            if (isBlank(img.src()) && isBlank(img.srcset())) noSrc++;
            if (img.alt() == null) noAlt++;
            else if (!img.alt().isEmpty() && img.alt().trim().length() < minAltLength) shortAlt++;
            else if (img.alt().length() > maxAltLength) longAlt++;
            String ext = extension(img.src());
            if (ext != null && !allowedFormats.contains(ext)) {
                badFormat++;
                if (badExample == null) badExample = img.src();
            }
            if (requireWidthHeight && !img.hasDimensions()) noDims++;
            if (requireLazyLoading && !"lazy".equalsIgnoreCase(img.loading())) notLazy++;
        }
        if (noSrc > 0) out.add("IMAGE_SRC", Severity.MEDIUM, noSrc + " <img> without src", "Give every image a src.");
        if (noAlt > 0) out.add("IMAGE_ALT", Severity.MEDIUM, noAlt + " image(s) without alt", "Add descriptive alt text.");
        if (shortAlt > 0) out.add("IMAGE_ALT", Severity.LOW, shortAlt + " image(s) with alt shorter than " + minAltLength + " characters",
                "Describe the image content in the alt text.");
        if (longAlt > 0) out.add("IMAGE_ALT", Severity.LOW, longAlt + " image(s) with alt longer than " + maxAltLength + " characters",
                "Keep alt text concise.");
        if (badFormat > 0) out.add("IMAGE_FORMAT", Severity.LOW, badFormat + " image(s) in a non-web format", badExample,
                "Convert images to WebP, AVIF, JPEG or PNG.");
        if (noDims > 0) out.add("IMAGE_DIMENSIONS", Severity.LOW, noDims + " image(s) without width/height", "Set width and height attributes.");
        if (notLazy > 1) out.add("IMAGE_LAZY", Severity.INFO, notLazy + " image(s) without loading=lazy",
                "Lazy-load images below the fold.");
    }

    private static String extension(String src) {
        if (src == null || src.isBlank() || src.startsWith("data:")) return null;
        String s = src;
        int q = s.indexOf('?');
        if (q >= 0) s = s.substring(0, q);
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        int slash = s.lastIndexOf('/');
        int dot = s.lastIndexOf('.');
        if (dot < 0 || dot < slash) return null;
        return s.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

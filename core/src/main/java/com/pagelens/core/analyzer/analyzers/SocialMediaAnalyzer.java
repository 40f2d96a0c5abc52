package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.List;
import java.util.Locale;

/** Open Graph / Twitter Card 태그, 공유 이미지 크기, 소셜 프로필 링크 */
public final class SocialMediaAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "social_media";

    static final List<String> DEFAULT_REQUIRED_OG = List.of("og:title", "og:type", "og:image", "og:url");
    static final List<String> RECOMMENDED_OG = List.of("og:description", "og:site_name");
    static final List<String> TWITTER_TAGS = List.of("twitter:title", "twitter:description", "twitter:image");
    static final List<String> DEFAULT_PLATFORMS = List.of(
            "facebook.com", "twitter.com", "x.com", "linkedin.com", "instagram.com", "youtube.com", "pinterest.com", "tiktok.com");

    private final List<String> requiredOg;
    private final List<String> platforms;
    private final int imageMinWidth;
    private final int imageMinHeight;

    public SocialMediaAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.requiredOg = config.getStringList("required_og_tags", DEFAULT_REQUIRED_OG);
        this.platforms = config.getStringList("social_platforms", DEFAULT_PLATFORMS);
        this.imageMinWidth = config.getInt("image_min_width", 1200);
        this.imageMinHeight = config.getInt("image_min_height", 630);
        if (imageMinWidth < 0 || imageMinHeight < 0) throw new IllegalArgumentException("image_min_width/height must be >= 0");
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        for (String tag : requiredOg) {
            if (isBlank(doc.meta(tag))) {
                out.add("OPEN_GRAPH", Severity.MEDIUM, "Missing Open Graph tag " + tag,
                        "Add <meta property=\"" + tag + "\" content=\"...\">.");
            }
        }
        for (String tag : RECOMMENDED_OG) {
            if (isBlank(doc.meta(tag))) {
                out.add("OPEN_GRAPH", Severity.LOW, "Missing recommended Open Graph tag " + tag,
                        "Add <meta property=\"" + tag + "\" content=\"...\">.");
            }
        }

        if (isBlank(doc.meta("twitter:card"))) {
            out.add("TWITTER_CARD", Severity.MEDIUM, "Missing twitter:card",
                    "Add <meta name=\"twitter:card\" content=\"summary_large_image\">.");
        }
        for (String tag : TWITTER_TAGS) {
            String ogFallback = "og:" + tag.substring("twitter:".length());
            if (isBlank(doc.meta(tag)) && isBlank(doc.meta(ogFallback))) {
                out.add("TWITTER_CARD", Severity.LOW, "Missing " + tag + " (and no " + ogFallback + " fallback)",
                        "Add " + tag + " or the matching Open Graph tag.");
            }
        }

        if (!isBlank(doc.meta("og:image"))) {
            int w = parsePx(doc.meta("og:image:width"));
            int h = parsePx(doc.meta("og:image:height"));
            if (w < 0 || h < 0) {
                out.add("SOCIAL_IMAGE", Severity.INFO, "og:image has no declared width/height",
                        "Declare og:image:width and og:image:height so previews render immediately.");
            } else if (w < imageMinWidth || h < imageMinHeight) {
                out.add("SOCIAL_IMAGE", Severity.LOW, "og:image is " + w + "x" + h + ", below " + imageMinWidth + "x" + imageMinHeight,
                        doc.meta("og:image"), "Use a share image of at least " + imageMinWidth + "x" + imageMinHeight + ".");
            }
        }

        boolean profile = doc.getLinks().stream().anyMatch(l -> {
            String href = (l.href() == null) ? "" : l.href().toLowerCase(Locale.ROOT);
            return platforms.stream().anyMatch(p -> href.contains("//" + p) || href.contains("." + p));
        });
        if (!profile) {
            out.add("SOCIAL_LINKS", Severity.INFO, "No links to social media profiles",
                    "Link to the organisation's social profiles.");
        }
    }
}

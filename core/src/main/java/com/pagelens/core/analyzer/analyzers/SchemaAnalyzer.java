package com.pagelens.core.analyzer.analyzers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.ParsedDocument.DataFormat;
import com.pagelens.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * schema.org 구조화 데이터 점검.
 * JSON-LD는 Jackson으로 파싱(@graph/배열 지원), Microdata/RDFa는 type과 속성 이름만 본다.
 */
public final class SchemaAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "schema";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private record TypeRules(List<String> required, List<String> recommended) {}

    private static final Map<String, TypeRules> RULES = Map.ofEntries(
            Map.entry("Article", new TypeRules(List.of("headline", "author", "datePublished"), List.of("image", "dateModified", "publisher"))),
            Map.entry("BlogPosting", new TypeRules(List.of("headline", "author", "datePublished"), List.of("image", "dateModified", "publisher"))),
            Map.entry("NewsArticle", new TypeRules(List.of("headline", "author", "datePublished"), List.of("image", "dateModified", "publisher"))),
            Map.entry("Product", new TypeRules(List.of("name", "offers"), List.of("image", "description", "brand", "aggregateRating", "review"))),
            Map.entry("LocalBusiness", new TypeRules(List.of("name", "address"), List.of("telephone", "openingHours", "geo", "image", "priceRange"))),
            Map.entry("Organization", new TypeRules(List.of("name"), List.of("url", "logo", "sameAs"))),
            Map.entry("Person", new TypeRules(List.of("name"), List.of("url", "image"))),
            Map.entry("WebPage", new TypeRules(List.of("name"), List.of("description"))),
            Map.entry("WebSite", new TypeRules(List.of("name", "url"), List.of("potentialAction"))),
            Map.entry("Event", new TypeRules(List.of("name", "startDate"), List.of("location", "endDate", "offers"))),
            Map.entry("Recipe", new TypeRules(List.of("name", "recipeIngredient", "recipeInstructions"), List.of("image", "cookTime"))),
            Map.entry("Review", new TypeRules(List.of("reviewRating", "itemReviewed"), List.of("author"))),
            Map.entry("FAQPage", new TypeRules(List.of("mainEntity"), List.of())),
            Map.entry("HowTo", new TypeRules(List.of("name", "step"), List.of("image", "totalTime"))),
            Map.entry("BreadcrumbList", new TypeRules(List.of("itemListElement"), List.of()))
    );

    private final boolean requireStructuredData;
    private final boolean checkRecommended;
    private final boolean checkMicrodata;
    private final boolean checkRdfa;

    public SchemaAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.requireStructuredData = config.getBoolean("require_structured_data", true);
        this.checkRecommended = config.getBoolean("check_recommended_props", true);
        this.checkMicrodata = config.getBoolean("check_microdata", true);
        this.checkRdfa = config.getBoolean("check_rdfa", true);
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        List<ParsedDocument.StructuredData> blocks = doc.getStructuredData();
        if (blocks.isEmpty()) {
            if (requireStructuredData) {
                out.add("SCHEMA_MISSING", Severity.MEDIUM, "No structured data (JSON-LD, Microdata or RDFa) found",
                        "Describe the page with schema.org JSON-LD (for example Organization, Article or Product).");
            }
            return;
        }
        int index = 0;
        for (ParsedDocument.StructuredData sd : blocks) {
            index++;
            String where = sd.format().name().toLowerCase(Locale.ROOT) + "#" + index;
            switch (sd.format()) {
                case JSON_LD -> jsonLd(sd.raw(), where, out);
                case MICRODATA -> { if (checkMicrodata) typed(sd, where, out); }
                case RDFA -> { if (checkRdfa) typed(sd, where, out); }
            }
        }
    }

    private void jsonLd(String raw, String where, Findings out) {
        JsonNode root;
        try {
            root = MAPPER.readTree(raw == null ? "" : raw);
        } catch (JsonProcessingException e) {
            out.add("JSON_LD_INVALID", Severity.HIGH, "JSON-LD block is not valid JSON: " + elide(e.getOriginalMessage(), 120),
                    where, "Fix the JSON syntax of the ld+json script.");
            return;
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            out.add("JSON_LD_INVALID", Severity.HIGH, "JSON-LD block is empty", where, "Remove or fill the empty ld+json script.");
            return;
        }
        boolean rootContext = hasSchemaContext(root);
        List<JsonNode> items = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(items::add);
        } else if (root.has("@graph") && root.get("@graph").isArray()) {
            root.get("@graph").forEach(items::add);
        } else {
            items.add(root);
        }
        for (JsonNode item : items) {
            if (!item.isObject()) continue;
            if (!rootContext && !hasSchemaContext(item)) {
                out.add("JSON_LD_CONTEXT", Severity.MEDIUM, "JSON-LD item has no schema.org @context", where,
                        "Add \"@context\": \"https://schema.org\".");
            }
            JsonNode typeNode = item.get("@type");
            if (typeNode == null || typeNode.isNull()) {
                out.add("JSON_LD_TYPE", Severity.HIGH, "JSON-LD item has no @type", where, "Declare the schema.org @type of the item.");
                continue;
            }
            List<String> types = new ArrayList<>();
            if (typeNode.isArray()) typeNode.forEach(t -> types.add(t.asText()));
            else types.add(typeNode.asText());
            for (String type : types) {
                TypeRules rules = RULES.get(stripPrefix(type));
                if (rules == null) continue;
                checkProps(type, rules, item::hasNonNull, where, out);
            }
        }
    }

    private void typed(ParsedDocument.StructuredData sd, String where, Findings out) {
        if (isBlank(sd.type())) {
            if (sd.format() == DataFormat.MICRODATA) {
                out.add("MICRODATA_TYPE", Severity.MEDIUM, "itemscope without itemtype", where,
                        "Add an itemtype such as https://schema.org/Product.");
            }
            return;
        }
        String type = stripPrefix(sd.type().trim());
        if (sd.format() == DataFormat.MICRODATA && !sd.type().toLowerCase(Locale.ROOT).contains("schema.org")) {
            out.add("MICRODATA_TYPE", Severity.LOW, "itemtype is not a schema.org type: " + sd.type(), where,
                    "Use schema.org vocabulary for itemtype.");
        }
        TypeRules rules = RULES.get(type);
        if (rules != null) checkProps(type, rules, p -> sd.properties().contains(p), where, out);
    }

    private void checkProps(String type, TypeRules rules, Predicate<String> has, String where, Findings out) {
        for (String p : rules.required()) {
            if (!has.test(p)) {
                out.add("SCHEMA_REQUIRED", Severity.HIGH, type + " is missing required property '" + p + "'", where,
                        "Add '" + p + "' to the " + type + " item.");
            }
        }
        if (!checkRecommended) return;
        for (String p : rules.recommended()) {
            if (!has.test(p)) {
                out.add("SCHEMA_RECOMMENDED", Severity.LOW, type + " is missing recommended property '" + p + "'", where,
                        "Consider adding '" + p + "' for richer search results.");
            }
        }
    }

    private static boolean hasSchemaContext(JsonNode n) {
        JsonNode ctx = n.get("@context");
        if (ctx == null) return false;
        return ctx.toString().toLowerCase(Locale.ROOT).contains("schema.org");
    }

    /** "https://schema.org/Product", "schema:Product" → "Product" */
    private static String stripPrefix(String type) {
        String t = type;
        int slash = t.lastIndexOf('/');
        if (slash >= 0) t = t.substring(slash + 1);
        int colon = t.lastIndexOf(':');
        if (colon >= 0) t = t.substring(colon + 1);
        return t;
    }
}

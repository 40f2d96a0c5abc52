package com.pagelens.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 분석기별 옵션(불변). YAML `analyzerOptions.<name>` 맵을 그대로 받아 타입별 조회를 제공한다.
 * 값 타입이 틀리면 IllegalArgumentException(분석기 생성 시점에 1회 검증됨).
 */
public final class AnalyzerConfig {

    private static final AnalyzerConfig EMPTY = new AnalyzerConfig(Map.of(), ScoringWeights.defaults());

    private final Map<String, Object> options;
    private final ScoringWeights weights;

    public AnalyzerConfig(Map<String, ?> options, ScoringWeights weights) {
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options == null ? Map.of() : options));
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public static AnalyzerConfig defaults() { return EMPTY; }

    public static AnalyzerConfig of(Map<String, ?> options) {
        return new AnalyzerConfig(options, ScoringWeights.defaults());
    }

    public AnalyzerConfig withWeights(ScoringWeights w) { return new AnalyzerConfig(options, w); }

    public ScoringWeights getWeights() { return weights; }
    public Map<String, Object> asMap() { return options; }
    public boolean has(String key) { return options.containsKey(key); }

    public boolean getBoolean(String key, boolean def) {
        Object v = options.get(key);
        if (v == null) return def;
        if (v instanceof Boolean b) return b;
        String s = String.valueOf(v).trim();
        if (s.equalsIgnoreCase("true")) return true;
        if (s.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException(key + " must be a boolean");
    }

    public int getInt(String key, int def) {
        Object v = options.get(key);
        if (v == null) return def;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer", e);
        }
    }

    public double getDouble(String key, double def) {
        Object v = options.get(key);
        if (v == null) return def;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number", e);
        }
    }

    public String getString(String key, String def) {
        Object v = options.get(key);
        return (v == null) ? def : String.valueOf(v);
    }

    public List<String> getStringList(String key, List<String> def) {
        Object v = options.get(key);
        if (v == null) return def;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            for (String p : String.valueOf(v).split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        return List.copyOf(out);
    }

    /** 지문 계산용 정규 문자열(키 정렬) */
    public String canonical() {
        return canonicalValue(options) + "|" + weights.canonical();
    }

    private static String canonicalValue(Object v) {
        if (v instanceof Map<?, ?> m) {
            TreeMap<String, String> sorted = new TreeMap<>();
            m.forEach((k, val) -> sorted.put(String.valueOf(k), canonicalValue(val)));
            return sorted.toString();
        }
        if (v instanceof List<?> l) {
            List<String> out = new ArrayList<>();
            for (Object o : l) out.add(canonicalValue(o));
            return out.toString();
        }
        return String.valueOf(v);
    }

    @Override public boolean equals(Object o) {
        return o instanceof AnalyzerConfig c && c.options.equals(options) && c.weights.equals(weights);
    }

    @Override public int hashCode() { return Objects.hash(options, weights); }

    @Override public String toString() { return "AnalyzerConfig" + options; }
}

package com.pagelens.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * 심각도별 감점 테이블. 운영자가 엄격도를 조정할 수 있도록 설정값으로 둔다.
 * 기본: CRITICAL 25 / HIGH 15 / MEDIUM 8 / LOW 3 / INFO 0
 */
public final class ScoringWeights {

    private static final ScoringWeights DEFAULTS = builder().build();

    private final Map<Severity, Double> penalties;

    private ScoringWeights(EnumMap<Severity, Double> penalties) {
        this.penalties = Collections.unmodifiableMap(penalties);
    }

    public static ScoringWeights defaults() { return DEFAULTS; }

    public double penalty(Severity s) { return penalties.get(s); }

    public Map<Severity, Double> asMap() { return penalties; }

    /** 100에서 시작해 발견 항목마다 감점, [0,100] 클램프 */
    public double score(Iterable<Finding> findings) {
        double score = 100.0;
        for (Finding f : findings) score -= penalty(f.getSeverity());
        return Math.max(0.0, Math.min(100.0, score));
    }

    /** 일부 심각도만 덮어쓴 사본 */
    public ScoringWeights override(Map<Severity, Double> overrides) {
        Builder b = builder();
        penalties.forEach(b::penalty);
        if (overrides != null) overrides.forEach(b::penalty);
        return b.build();
    }

    public String canonical() {
        StringBuilder sb = new StringBuilder();
        for (Severity s : Severity.values()) sb.append(s.name()).append('=').append(penalties.get(s)).append(';');
        return sb.toString();
    }

    @Override public boolean equals(Object o) {
        return o instanceof ScoringWeights w && w.penalties.equals(penalties);
    }

    @Override public int hashCode() { return penalties.hashCode(); }

    @Override public String toString() { return "ScoringWeights" + penalties; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final EnumMap<Severity, Double> penalties = new EnumMap<>(Severity.class);

        private Builder() {
            penalties.put(Severity.CRITICAL, 25.0);
            penalties.put(Severity.HIGH, 15.0);
            penalties.put(Severity.MEDIUM, 8.0);
            penalties.put(Severity.LOW, 3.0);
            penalties.put(Severity.INFO, 0.0);
        }

        public Builder penalty(Severity s, double v) { penalties.put(s, v); return this; }

        public ScoringWeights build() {
            for (var e : penalties.entrySet()) {
                double v = e.getValue();
                if (Double.isNaN(v) || v < 0) {
                    throw new IllegalArgumentException("scoring." + e.getKey().name().toLowerCase(Locale.ROOT) + " must be >= 0");
                }
            }
            Severity[] order = Severity.values();
            for (int i = 1; i < order.length; i++) {
                if (penalties.get(order[i]) > penalties.get(order[i - 1])) {
                    throw new IllegalArgumentException("scoring." + order[i].name().toLowerCase(Locale.ROOT)
                            + " must be <= scoring." + order[i - 1].name().toLowerCase(Locale.ROOT));
                }
            }
            if (penalties.get(Severity.INFO) != 0.0) {
                throw new IllegalArgumentException("scoring.info must be 0");
            }
            return new ScoringWeights(new EnumMap<>(penalties));
        }
    }
}

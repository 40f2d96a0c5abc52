package com.pagelens.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** 배치 결과: 입력 순서대로 URL → 결과. 완료 순서와 무관하다. */
public final class BatchResult {
    private final Map<String, UrlOutcome> outcomes;
    private final Duration elapsed;
    private final BatchStats.Snapshot stats;

    public BatchResult(Map<String, UrlOutcome> outcomes, Duration elapsed, BatchStats.Snapshot stats) {
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.elapsed = elapsed;
        this.stats = stats;
    }

    public Map<String, UrlOutcome> getOutcomes() { return outcomes; }
    public UrlOutcome get(String url) { return outcomes.get(url); }
    public Duration getElapsed() { return elapsed; }
    public BatchStats.Snapshot getStats() { return stats; }

    public Map<AnalysisStatus, Integer> countsByStatus() {
        EnumMap<AnalysisStatus, Integer> m = new EnumMap<>(AnalysisStatus.class);
        for (AnalysisStatus s : AnalysisStatus.values()) m.put(s, 0);
        for (UrlOutcome o : outcomes.values()) m.merge(o.status(), 1, Integer::sum);
        return m;
    }

    public int size() { return outcomes.size(); }
}

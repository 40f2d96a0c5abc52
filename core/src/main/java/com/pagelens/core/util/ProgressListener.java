package com.pagelens.core.util;

import java.util.Locale;

/** 배치/사이트 분석 진행 콜백. 배치 워커 스레드에서 호출되므로 구현은 스레드 안전해야 한다. */
@FunctionalInterface
public interface ProgressListener {

    enum Phase {
        CRAWL, ANALYZE, DONE;

        @Override public String toString() { return name().toLowerCase(Locale.ROOT); }
    }

    /**
     * @param progress 0.0~1.0 (탐색 중엔 0.0)
     * @param done     끝난 URL 수
     * @param total    전체 URL 수, 탐색 중이라 모르면 -1
     */
    void onProgress(double progress, Phase phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}

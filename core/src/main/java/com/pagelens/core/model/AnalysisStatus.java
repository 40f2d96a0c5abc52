package com.pagelens.core.model;

/** URL 단위 결과 상태. SKIPPED는 배치 데드라인/취소로 스케줄되지 않은 URL. */
public enum AnalysisStatus {
    COMPLETED, PARTIAL, FAILED, SKIPPED
}

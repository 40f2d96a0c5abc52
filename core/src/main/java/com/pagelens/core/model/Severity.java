package com.pagelens.core.model;

/** 발견 항목 심각도(닫힌 5단계). 선언 순서 = 높은 것부터. */
public enum Severity {
    CRITICAL, HIGH, MEDIUM, LOW, INFO;

    /** 정렬용 가중 랭크: CRITICAL=4 … INFO=0 */
    public int rank() {
        return switch (this) {
            case CRITICAL -> 4;
            case HIGH -> 3;
            case MEDIUM -> 2;
            case LOW -> 1;
            case INFO -> 0;
        };
    }

    /** 대소문자 무시 파싱. 모르는 값이면 IllegalArgumentException. */
    public static Severity parse(String s) {
        if (s == null) throw new IllegalArgumentException("severity must not be null");
        for (Severity v : values()) {
            if (v.name().equalsIgnoreCase(s.trim())) return v;
        }
        throw new IllegalArgumentException("unknown severity: " + s);
    }
}

package com.pagelens.core.analyzer;

/** 분석기 하나의 실패. 오케스트레이터가 잡아서 ANALYZER_ERROR 합성 발견 항목으로 바꾼다. */
public class AnalyzerException extends RuntimeException {
    private final String analyzer;

    public AnalyzerException(String analyzer, String message, Throwable cause) {
        super(message, cause);
        this.analyzer = analyzer;
    }

    public String getAnalyzer() { return analyzer; }
}

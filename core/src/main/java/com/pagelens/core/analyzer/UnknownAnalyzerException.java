package com.pagelens.core.analyzer;

import java.util.Collection;
import java.util.List;

/** 등록되지 않은 분석기 이름. 요청 생성 시점에 던져져 네트워크 작업 전에 실패한다. */
public class UnknownAnalyzerException extends IllegalArgumentException {
    private final List<String> unknown;

    public UnknownAnalyzerException(Collection<String> unknown, Collection<String> known) {
        super("Unknown analyzer(s) " + unknown + "; registered: " + known);
        this.unknown = List.copyOf(unknown);
    }

    public List<String> getUnknown() { return unknown; }
}

package com.pagelens.core.api;

import com.pagelens.core.model.AnalyzerResult;
import com.pagelens.core.model.ParsedDocument;

/**
 * 순수 점수화 단위. 설정은 생성 시 바인딩되며(AnalyzerRegistry.create), 네트워크 I/O나 공유 상태 변경 금지.
 * 같은 문서와 설정이면 항상 같은 결과를 돌려줘야 한다.
 */
public interface IAnalyzer {
    String name();

    AnalyzerResult analyze(ParsedDocument doc);
}

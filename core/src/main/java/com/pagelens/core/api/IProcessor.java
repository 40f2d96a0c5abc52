package com.pagelens.core.api;

import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.ProcessorConfig;
import com.pagelens.core.model.RawDocument;

public interface IProcessor {
    /** 절대 예외를 던지지 않는다. 깨진 마크업은 경고를 남기고 최선 추출. */
    ParsedDocument parse(RawDocument raw, ProcessorConfig config);
}

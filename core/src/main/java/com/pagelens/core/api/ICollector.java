package com.pagelens.core.api;

import com.pagelens.core.http.CollectionException;
import com.pagelens.core.model.CollectorConfig;
import com.pagelens.core.model.RawDocument;

import java.net.URI;

public interface ICollector {
    /** robots/레이트리밋/재시도 정책 하에 원본 문서를 가져온다. */
    RawDocument fetch(URI url, CollectorConfig config) throws CollectionException;
}

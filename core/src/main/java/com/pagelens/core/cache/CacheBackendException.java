package com.pagelens.core.cache;

/** 캐시 백엔드(파일 등) 접근 실패. AnalysisCache가 잡아서 바이패스 모드로 전환한다. */
public class CacheBackendException extends RuntimeException {
    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}

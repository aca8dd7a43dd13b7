package com.newsenricher.core.error;

import com.newsenricher.core.model.ErrorKind;

/** 캐시 저장소(디스크/커넥션) 접근 실패 */
public class CacheUnavailableException extends EnrichmentException {
    public CacheUnavailableException(String message, Throwable cause) {
        super(ErrorKind.CACHE_UNAVAILABLE, message, cause);
    }
}

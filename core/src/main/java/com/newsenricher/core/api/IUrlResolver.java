package com.newsenricher.core.api;

import com.newsenricher.core.model.ResolvedUrl;

/** 간접 URL → (직접 URL, 방법 태그) */
public interface IUrlResolver {

    int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * 실패는 예외가 아니라 센티넬 method(invalid_input, no_resolution)로 돌려준다.
     * @throws com.newsenricher.core.error.DomainAbortedException 집계 도메인 차단기 작동
     */
    ResolvedUrl resolve(String indirectUrl, int maxAttempts) throws InterruptedException;

    default ResolvedUrl resolve(String indirectUrl) throws InterruptedException {
        return resolve(indirectUrl, DEFAULT_MAX_ATTEMPTS);
    }
}

package com.newsenricher.core.api;

import com.newsenricher.core.model.ContentRecord;

/** 직접 URL → 구조화된 기사 레코드 */
public interface IContentExtractor {

    /**
     * 모든 전략이 실패하면 예외 대신 extraction_method=failed, confidence=0 레코드를 돌려준다.
     * @throws com.newsenricher.core.error.DomainAbortedException 해당 도메인 차단기 작동
     */
    ContentRecord extract(String url) throws InterruptedException;
}

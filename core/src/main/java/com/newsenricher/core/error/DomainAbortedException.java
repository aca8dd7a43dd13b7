package com.newsenricher.core.error;

import com.newsenricher.core.model.ErrorKind;

/**
 * 도메인 차단기 작동 신호. 일반 네트워크 오류와 구분되며,
 * 해당 도메인에 대한 추가 작업만 멈추고 배치 전체는 계속된다.
 */
public class DomainAbortedException extends EnrichmentException {
    private final String domain;
    private final int consecutiveErrors;

    public DomainAbortedException(String domain, int consecutiveErrors) {
        super(ErrorKind.DOMAIN_ABORTED,
                "Domain aborted after " + consecutiveErrors + " consecutive errors: " + domain);
        this.domain = domain;
        this.consecutiveErrors = consecutiveErrors;
    }

    public String getDomain() { return domain; }
    public int getConsecutiveErrors() { return consecutiveErrors; }
}

package com.newsenricher.core.resolver;

import java.util.Optional;

/**
 * 해석 캐스케이드의 한 단계. 결과 URL은 아직 외부 URL 판정 전일 수 있다(해석기가 최종 판정).
 * 실패는 Optional.empty() 또는 예외. 예외는 해석기가 잡고 다음 전략으로 넘어간다
 * ({@link com.newsenricher.core.error.DomainAbortedException}만 예외).
 */
public interface ResolutionStrategy {

    /** 결과 method 태그 (예: extract_url_params) */
    String name();

    Optional<String> attempt(String indirectUrl) throws Exception;
}

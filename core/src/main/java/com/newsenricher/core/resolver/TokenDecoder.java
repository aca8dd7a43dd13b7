package com.newsenricher.core.resolver;

import java.util.Optional;

/**
 * 집계 서비스 전용 토큰 디코더(선택 구성 요소). 등록돼 있으면 캐스케이드보다 먼저,
 * 한 번의 resolve 호출 안에서 URL당 한 번만 시도된다.
 */
public interface TokenDecoder {

    /** 결과 method 태그 */
    String name();

    /** 이 디코더가 다룰 수 있는 URL인지(네트워크 없이 판정) */
    boolean supports(String indirectUrl);

    Optional<String> decode(String indirectUrl) throws Exception;
}

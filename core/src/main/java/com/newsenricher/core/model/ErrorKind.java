package com.newsenricher.core.model;

/** 처리 중 발생 가능한 오류 분류. 배치 결과 레코드에 그대로 실린다(성공 시 null). */
public enum ErrorKind {
    /** 비어 있거나 URL 모양이 아닌 입력 */
    INVALID_INPUT,
    /** 타임아웃/연결 실패/재시도 예산을 넘긴 비정상 상태코드 */
    NETWORK_ERROR,
    /** 전략별 디코딩·파싱 실패 */
    PARSE_ERROR,
    /** 모든 해석 전략 소진 */
    UNRESOLVED,
    /** 모든 추출 전략 소진 */
    EXTRACTION_FAILED,
    /** 일시적 백오프(자체 회복) */
    RATE_LIMIT_BACKOFF,
    /** 도메인 차단기 작동 */
    DOMAIN_ABORTED,
    /** 캐시 읽기/쓰기 실패 */
    CACHE_UNAVAILABLE
}

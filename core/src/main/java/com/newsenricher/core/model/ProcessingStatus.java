package com.newsenricher.core.model;

/** URL 한 건의 최종 처리 상태 */
public enum ProcessingStatus {
    SUCCESS,
    NO_CONTENT,
    UNRESOLVED,
    INVALID_INPUT,
    ERROR,
    ABORTED;

    /** 해석 방법 태그 + 추출 결과로부터 상태를 정한다. */
    public static ProcessingStatus of(String method, boolean hasContent) {
        if (method == null) return ERROR;
        switch (method) {
            case ResolvedUrl.INVALID_INPUT: return INVALID_INPUT;
            case ResolvedUrl.NO_RESOLUTION: return UNRESOLVED;
            case ResolvedUrl.ERROR:         return ERROR;
            case ResolvedUrl.DOMAIN_ABORTED: return ABORTED;
            default: return hasContent ? SUCCESS : NO_CONTENT;
        }
    }
}

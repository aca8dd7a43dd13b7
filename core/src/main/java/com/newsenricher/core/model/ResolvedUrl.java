package com.newsenricher.core.model;

import java.util.Objects;

/**
 * 해석 결과: 최종 URL + 성공한 전략 이름(또는 센티넬) + 사용한 라운드 수.
 * rounds는 캐시 적중/입력 오류 시 0.
 */
public record ResolvedUrl(String url, String method, int rounds) {

    public static final String INVALID_INPUT  = "invalid_input";
    public static final String NO_RESOLUTION  = "no_resolution";
    public static final String ERROR          = "error";
    public static final String DOMAIN_ABORTED = "domain_aborted";

    public ResolvedUrl {
        url = (url == null) ? "" : url;
        Objects.requireNonNull(method, "method");
    }

    public ResolvedUrl(String url, String method) {
        this(url, method, 0);
    }

    /** 실제 전략이 외부 URL을 찾아낸 경우만 true */
    public boolean resolved() {
        return !INVALID_INPUT.equals(method)
                && !NO_RESOLUTION.equals(method)
                && !ERROR.equals(method)
                && !DOMAIN_ABORTED.equals(method);
    }
}

package com.newsenricher.core.api;

import com.newsenricher.core.model.HttpResponseData;

import java.util.Map;

/**
 * HTTP 최소 계약. 전송 실패는 예외가 아니라 status -1 응답으로 돌려준다.
 * 리다이렉트는 자동으로 따라가며 최종 URL은 {@link HttpResponseData#getFinalUrl()}.
 */
public interface IHttpFetcher extends AutoCloseable {

    HttpResponseData get(String url, Map<String, String> extraHeaders) throws InterruptedException;

    default HttpResponseData get(String url) throws InterruptedException {
        return get(url, Map.of());
    }

    /** application/x-www-form-urlencoded POST */
    HttpResponseData postForm(String url, Map<String, String> form, Map<String, String> extraHeaders)
            throws InterruptedException;

    @Override default void close() {}
}

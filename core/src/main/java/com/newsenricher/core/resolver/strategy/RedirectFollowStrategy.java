package com.newsenricher.core.resolver.strategy;

import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.model.HttpResponseData;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.resolver.ExternalUrlPolicy;

import java.util.Optional;

/** 요청을 보내 리다이렉트가 끝난 최종 URL이 입력과 다르고 외부 URL이면 채택 */
public final class RedirectFollowStrategy extends NetworkStrategy {

    public static final String NAME = "follow_redirects";

    public RedirectFollowStrategy(IHttpFetcher http, RateLimiter limiter, ExternalUrlPolicy policy) {
        super(http, limiter, policy);
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<String> attempt(String indirectUrl) throws InterruptedException {
        HttpResponseData resp = fetch(indirectUrl);
        if (resp.isTransportFailure()) return Optional.empty();

        String finalUrl = resp.getFinalUrl();
        if (finalUrl != null && !finalUrl.equals(indirectUrl) && policy.isValidExternal(finalUrl)) {
            // 최종 상태가 발행처의 4xx여도 집계 서비스 쪽 리다이렉트는 성공
            limiter.recordSuccess(indirectUrl);
            return Optional.of(finalUrl);
        }
        return Optional.empty();
    }
}

package com.newsenricher.core.resolver.strategy;

import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.model.HttpResponseData;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.resolver.ExternalUrlPolicy;
import com.newsenricher.core.resolver.ResolutionStrategy;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 네트워크를 쓰는 전략의 공통 뼈대: 요청 전 RateLimiter 대기, 응답 후 결과 보고.
 * 오류 보고가 차단기를 작동시키면 DomainAbortedException이 그대로 올라간다.
 */
public abstract class NetworkStrategy implements ResolutionStrategy {

    /** /read/ 우선, 없으면 /articles/ 토큰 (쿼리 전까지) */
    static final Pattern READ_TOKEN = Pattern.compile("/read/([^?]+)");
    static final Pattern ARTICLES_TOKEN = Pattern.compile("/articles/([^?]+)");

    protected final IHttpFetcher http;
    protected final RateLimiter limiter;
    protected final ExternalUrlPolicy policy;

    protected NetworkStrategy(IHttpFetcher http, RateLimiter limiter, ExternalUrlPolicy policy) {
        this.http = Objects.requireNonNull(http, "http");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /** 2xx 응답만 돌려준다. 그 외는 null */
    protected HttpResponseData fetchOk(String url) throws InterruptedException {
        HttpResponseData r = fetch(url);
        return r.isOk() ? r : null;
    }

    /** 상태와 무관하게 응답을 돌려준다. 오류 집계는 {@link RateLimiter#recordResponse} */
    protected HttpResponseData fetch(String url) throws InterruptedException {
        limiter.waitIfNeeded(url);
        HttpResponseData r = http.get(url);
        limiter.recordResponse(url, r);
        return r;
    }

    /** 집계 서비스 기사 토큰(/read/ 또는 /articles/). 없으면 null */
    static String articleToken(String url) {
        Matcher m = READ_TOKEN.matcher(url);
        if (m.find()) return m.group(1);
        m = ARTICLES_TOKEN.matcher(url);
        return m.find() ? m.group(1) : null;
    }

    /** 토큰 경로 + 원래 쿼리 */
    static String withQuery(String base, String originalUrl) {
        int q = originalUrl.indexOf('?');
        return (q >= 0 && q < originalUrl.length() - 1) ? base + originalUrl.substring(q) : base;
    }
}

package com.newsenricher.core.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 브라우저처럼 보이는 요청 헤더 세트.
 * User-Agent는 요청 5건마다 풀에서 다시 고른다.
 * (HttpClient 제한 헤더인 Connection/Host 등은 넣지 않는다)
 */
public final class BrowserHeaders {

    static final List<String> USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:89.0) Gecko/20100101 Firefox/89.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:89.0) Gecko/20100101 Firefox/89.0",
            "Mozilla/5.0 (X11; Linux x86_64; rv:89.0) Gecko/20100101 Firefox/89.0");

    static final int ROTATE_EVERY = 5;
    static final String RSS_ACCEPT = "application/rss+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.5";
    static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8";

    private final String acceptLanguage;
    private final String aggregatorBaseUrl;
    private final Random random;
    private final AtomicLong requests = new AtomicLong();
    private volatile String userAgent;

    public BrowserHeaders(String acceptLanguage, String aggregatorBaseUrl) {
        this(acceptLanguage, aggregatorBaseUrl, null);
    }

    BrowserHeaders(String acceptLanguage, String aggregatorBaseUrl, Random random) {
        this.acceptLanguage = acceptLanguage;
        this.aggregatorBaseUrl = aggregatorBaseUrl;
        this.random = random;
        this.userAgent = pick();
    }

    /** 요청 1건 분량의 헤더(순서 유지). 피드 URL이면 RSS Accept + Referer. */
    public Map<String, String> next(String url) {
        if (requests.incrementAndGet() % ROTATE_EVERY == 0) {
            userAgent = pick();
        }
        Map<String, String> h = new LinkedHashMap<>();
        h.put("User-Agent", userAgent);
        h.put("Accept", HTML_ACCEPT);
        h.put("Accept-Language", acceptLanguage);
        h.put("DNT", "1");
        h.put("Upgrade-Insecure-Requests", "1");
        h.put("Sec-Fetch-Dest", "document");
        h.put("Sec-Fetch-Mode", "navigate");
        h.put("Sec-Fetch-Site", "none");
        h.put("Cache-Control", "max-age=0");
        if (isFeedUrl(url)) {
            h.put("Accept", RSS_ACCEPT);
            h.put("Referer", aggregatorBaseUrl + "/");
        }
        return h;
    }

    /** 현재 User-Agent (테스트/로그용) */
    public String currentUserAgent() { return userAgent; }

    boolean isFeedUrl(String url) {
        return url != null && url.startsWith(aggregatorBaseUrl + "/rss");
    }

    private String pick() {
        int i = (random != null) ? random.nextInt(USER_AGENTS.size())
                : ThreadLocalRandom.current().nextInt(USER_AGENTS.size());
        return USER_AGENTS.get(i);
    }
}

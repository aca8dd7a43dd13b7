package com.newsenricher.core.http;

import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.model.EnrichStats;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.HttpResponseData;
import com.newsenricher.core.util.DefaultSleeper;
import com.newsenricher.core.util.Sleeper;
import com.newsenricher.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * JDK HttpClient 기반 세션: 브라우저 헤더 + 리다이렉트 자동 추적 + 상태코드 재시도.
 * 예외는 밖으로 던지지 않고 status -1 응답으로 매핑한다(인터럽트는 예외).
 * <p>
 * 내부 재시도 간격은 {@link RetryPolicy}(와 Retry-After)만 따른다. RateLimiter는 호출 전 한 번 대기하고
 * 마지막 응답만 보고받으므로, 재시도 예산 안의 429/5xx는 도메인 차단기에 한 번만 들어간다.
 */
public class HttpFetcher implements IHttpFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(HttpFetcher.class);

    /** Retry-After 상한 */
    static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final EnricherConfig.HttpCfg cfg;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final BrowserHeaders headers;
    private final EnrichStats stats;

    public HttpFetcher(EnricherConfig config) {
        this(config, null, new DefaultSleeper(), null);
    }

    public HttpFetcher(EnricherConfig config, EnrichStats stats) {
        this(config, null, new DefaultSleeper(), stats);
    }

    /** 테스트용 생성자(송신 훅/슬리퍼 주입). testSender가 null이면 실제 HttpClient 사용 */
    public HttpFetcher(EnricherConfig config, HttpSender testSender, Sleeper sleeper, EnrichStats stats) {
        Objects.requireNonNull(config, "config");
        this.cfg = config.http();
        this.sender = testSender;
        this.client = (testSender != null) ? null : HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.ALWAYS)
                .connectTimeout(cfg.getConnectTimeout())
                .build();
        this.retryPolicy = DefaultRetryPolicy.from(cfg);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.headers = new BrowserHeaders(cfg.getAcceptLanguage(), config.resolver().getAggregatorBaseUrl());
        this.stats = (stats != null) ? stats : new EnrichStats();
    }

    @Override
    public HttpResponseData get(String url, Map<String, String> extraHeaders) throws InterruptedException {
        HttpRequest.Builder b = newRequest(url, extraHeaders);
        if (b == null) return HttpResponseData.failure(url, 0, "malformed url");
        return sendWithRetry(url, b.GET().build());
    }

    @Override
    public HttpResponseData postForm(String url, Map<String, String> form, Map<String, String> extraHeaders)
            throws InterruptedException {
        HttpRequest.Builder b = newRequest(url, extraHeaders);
        if (b == null) return HttpResponseData.failure(url, 0, "malformed url");
        b.header("Content-Type", "application/x-www-form-urlencoded;charset=UTF-8");
        return sendWithRetry(url, b.POST(HttpRequest.BodyPublishers.ofString(encodeForm(form))).build());
    }

    /** 통계 스냅샷 소스 */
    public EnrichStats stats() { return stats; }

    // ---------- internals ----------

    private HttpRequest.Builder newRequest(String url, Map<String, String> extraHeaders) {
        final URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException | NullPointerException e) {
            LOG.debug("Malformed URL skipped: {}", url);
            return null;
        }
        if (uri.getScheme() == null || uri.getHost() == null) return null;

        HttpRequest.Builder b = HttpRequest.newBuilder(uri).timeout(cfg.getTimeout());
        headers.next(url).forEach(b::setHeader);
        if (extraHeaders != null) extraHeaders.forEach(b::setHeader);
        return b;
    }

    private HttpResponseData sendWithRetry(String url, HttpRequest req) throws InterruptedException {
        long t0 = System.nanoTime();
        CountingRetryPolicy counting = new CountingRetryPolicy(retryPolicy);
        try {
            return Retry.call(counting, sleeper,
                    n -> sendOnce(url, req),
                    HttpResponseData::getStatusCode,
                    HttpFetcher::retryAfter);
        } finally {
            int retries = counting.getRetryCount();
            stats.addAttempts(1L + retries);
            stats.addRetries(retries);
            stats.addWallTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
            if (retries > 0) {
                SLOG.debug("http-retried", "url", url, "retries", retries);
            }
        }
    }

    /** 한 번 전송. 예외 시 -1 반환 */
    private HttpResponseData sendOnce(String url, HttpRequest req) throws InterruptedException {
        long start = System.nanoTime();
        try {
            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString());

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            HttpHeaders hh = resp.headers();
            String finalUrl = (resp.uri() != null) ? resp.uri().toString() : url;

            return HttpResponseData.builder()
                    .url(url)
                    .finalUrl(finalUrl)
                    .statusCode(resp.statusCode())
                    .headers(hh.map())
                    .body(resp.body() == null ? "" : resp.body())
                    .contentType(hh.firstValue("Content-Type").orElse(null))
                    .responseTimeMs(elapsedMs)
                    .build();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw ie;
        } catch (Exception e) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            LOG.debug("HTTP {} failed: {} ({})", req.method(), url, e.toString());
            return HttpResponseData.failure(url, elapsedMs, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** Retry-After(초)를 존중하되 과도한 대기는 30초로 상한 */
    static Optional<Duration> retryAfter(HttpResponseData data) {
        String v = data.header("Retry-After");
        if (v == null || v.isBlank()) return Optional.empty();
        try {
            long sec = Long.parseLong(v.trim());
            if (sec < 0) return Optional.empty();
            Duration d = Duration.ofSeconds(sec);
            return Optional.of(d.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : d);
        } catch (NumberFormatException ignore) {
            // HTTP-date 형태는 정책 지연으로 대체
            return Optional.empty();
        }
    }

    static String encodeForm(Map<String, String> form) {
        StringJoiner j = new StringJoiner("&");
        if (form != null) {
            form.forEach((k, v) -> j.add(URLEncoder.encode(k, StandardCharsets.UTF_8) + "="
                    + URLEncoder.encode(v == null ? "" : v, StandardCharsets.UTF_8)));
        }
        return j.toString();
    }
}

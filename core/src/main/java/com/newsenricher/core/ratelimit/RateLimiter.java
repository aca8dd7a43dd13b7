package com.newsenricher.core.ratelimit;

import com.newsenricher.core.error.DomainAbortedException;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.HttpResponseData;
import com.newsenricher.core.util.DefaultSleeper;
import com.newsenricher.core.util.MillisClock;
import com.newsenricher.core.util.Sleeper;
import com.newsenricher.core.util.StructuredLog;
import com.newsenricher.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 도메인별 요청 간격 + 백오프 + 차단기(fail-fast).
 *
 * <ul>
 *   <li>요청 시각은 도메인 락 안에서 "예약"하고 잠은 락 밖에서 잔다.
 *       같은 도메인을 노리는 워커끼리도 간격이 보장되고, 다른 도메인은 서로 막지 않는다.</li>
 *   <li>집계 도메인(google.)은 간격이 요청 수에 비례해 조금씩 늘고, N건마다 추가 휴식이 들어간다.</li>
 *   <li>연속 오류가 backoffAfterErrors를 넘으면 2^(n-backoffAfterErrors)초(상한 maxBackoffSeconds) 백오프,
 *       abortAfterErrors를 넘는 순간 {@link DomainAbortedException}을 한 번 던지고 도메인을 닫는다.</li>
 * </ul>
 * 상태는 프로세스 수명 동안만 유지되며 저장하지 않는다.
 */
public final class RateLimiter {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimiter.class);
    private static final StructuredLog SLOG = StructuredLog.get(RateLimiter.class);

    static final String AGGREGATOR_MARKER = "google.";
    static final long DAY_MS = 86_400_000L;

    /** 도메인 하나의 상태. 모든 필드는 this 락 아래에서만 읽고 쓴다. */
    static final class DomainState {
        long lastRequestAt = -1;     // 예약된 마지막 요청 시각(ms), 없으면 -1
        int consecutiveErrors;
        long backoffUntil;
        long requestCount;           // 집계 도메인 전용 카운터(24h 창)
        long windowStart = -1;
        boolean aborted;
    }

    private final EnricherConfig.RateCfg cfg;
    private final MillisClock clock;
    private final Sleeper sleeper;
    private final Random random;
    private final ConcurrentMap<String, DomainState> domains = new ConcurrentHashMap<>();
    private final AtomicLong totalRequests = new AtomicLong();

    public RateLimiter(EnricherConfig.RateCfg cfg) {
        this(cfg, MillisClock.SYSTEM, new DefaultSleeper(), null);
    }

    /** random이 null이면 ThreadLocalRandom 사용 */
    public RateLimiter(EnricherConfig.RateCfg cfg, MillisClock clock, Sleeper sleeper, Random random) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = random;
    }

    /**
     * 요청을 보내도 되는 시각까지 호출 스레드를 재운다.
     * @throws DomainAbortedException 차단기가 이미 작동한 도메인
     */
    public void waitIfNeeded(String url) throws InterruptedException {
        final String domain = domainKey(url);
        final boolean aggregator = isAggregator(domain);
        totalRequests.incrementAndGet();

        final DomainState st = domains.computeIfAbsent(domain, d -> new DomainState());
        final long now;
        final long target;
        long extraPause = 0;

        synchronized (st) {
            if (st.aborted) {
                throw new DomainAbortedException(domain, st.consecutiveErrors);
            }
            now = clock.nowMillis();

            if (aggregator) {
                extraPause += countAggregatorRequest(domain, st, now);
            }

            long start = Math.max(now, st.backoffUntil);
            if (st.backoffUntil > now) {
                LOG.debug("Backoff for {}: waiting {}ms", domain, st.backoffUntil - now);
            }

            long t;
            if (st.lastRequestAt >= 0) {
                long gap = aggregator ? aggregatorGap(st.requestCount) : uniform(cfg.getMinDelayMs(), cfg.getMaxDelayMs());
                t = Math.max(start, st.lastRequestAt + gap);
            } else {
                t = aggregator
                        ? start + uniform(cfg.getAggregatorInitialMinMs(), cfg.getAggregatorInitialMaxMs())
                        : start;
            }
            target = t + extraPause;
            st.lastRequestAt = target;
        }

        long waitMs = target - now;
        if (waitMs > 0) {
            sleeper.sleep(Duration.ofMillis(waitMs));
        }
    }

    /**
     * 도메인 연속 오류 +1. 임계치를 넘으면 백오프 창 설치,
     * 더 높은 임계치를 처음 넘는 호출에서만 {@link DomainAbortedException}.
     */
    public void recordError(String url) {
        final String domain = domainKey(url);
        final DomainState st = domains.computeIfAbsent(domain, d -> new DomainState());
        final int errors;
        final boolean trip;
        long backoffSec = 0;

        synchronized (st) {
            st.consecutiveErrors++;
            errors = st.consecutiveErrors;
            trip = !st.aborted && errors > cfg.getAbortAfterErrors();
            if (trip) {
                st.aborted = true;
            } else if (!st.aborted && errors > cfg.getBackoffAfterErrors()) {
                int exp = Math.min(30, errors - cfg.getBackoffAfterErrors());
                backoffSec = Math.min(cfg.getMaxBackoffSeconds(), 1L << exp);
                st.backoffUntil = clock.nowMillis() + backoffSec * 1000L;
            }
        }

        if (trip) {
            LOG.error("Fail-fast: {} consecutive errors for {}, domain aborted", errors, domain);
            SLOG.warn("domain-aborted", "domain", domain, "errors", errors);
            throw new DomainAbortedException(domain, errors);
        }
        if (backoffSec > 0) {
            LOG.warn("Backoff of {}s for {} ({} consecutive errors)", backoffSec, domain, errors);
            SLOG.info("rate-backoff", "domain", domain, "errors", errors, "backoffSec", backoffSec);
        }
    }

    /**
     * 응답 한 건을 도메인 상태에 반영한다.
     * 오류로 세는 것은 전송 실패, 그리고 요청한 호스트가 직접 돌려준 429/5xx뿐이다.
     * 리다이렉트 끝의 다른 호스트가 돌려준 상태나 일반 4xx(404, 403 등)는 중립, 2xx/3xx는 성공.
     */
    public void recordResponse(String url, HttpResponseData r) {
        if (r.isTransportFailure()) {
            recordError(url);
        } else if (isThrottling(r.getStatusCode())) {
            String finalDomain = UrlUtils.domainOf(r.getFinalUrl());
            if (finalDomain == null || finalDomain.equals(domainKey(url))) recordError(url);
        } else if (r.getStatusCode() < 400) {
            recordSuccess(url);
        }
    }

    /** 차단기/백오프 대상 상태 코드 */
    public static boolean isThrottling(int status) {
        return status == 429 || status >= 500;
    }

    /** 도메인 연속 오류 -1 (0 미만으로 내려가지 않음) */
    public void recordSuccess(String url) {
        final DomainState st = domains.get(domainKey(url));
        if (st == null) return;
        synchronized (st) {
            st.consecutiveErrors = Math.max(0, st.consecutiveErrors - 1);
        }
    }

    public boolean isAborted(String url) {
        final DomainState st = domains.get(domainKey(url));
        if (st == null) return false;
        synchronized (st) {
            return st.aborted;
        }
    }

    public int consecutiveErrors(String url) {
        final DomainState st = domains.get(domainKey(url));
        if (st == null) return 0;
        synchronized (st) {
            return st.consecutiveErrors;
        }
    }

    /** 예약된 마지막 요청 시각(ms). 요청 이력이 없으면 -1 */
    public long lastRequestAt(String url) {
        final DomainState st = domains.get(domainKey(url));
        if (st == null) return -1;
        synchronized (st) {
            return st.lastRequestAt;
        }
    }

    /** 백오프 종료 시각(ms). 과거일 수 있다 */
    public long backoffUntil(String url) {
        final DomainState st = domains.get(domainKey(url));
        if (st == null) return 0;
        synchronized (st) {
            return st.backoffUntil;
        }
    }

    /** 프로세스 전체 요청 수 */
    public long totalRequests() { return totalRequests.get(); }

    public static boolean isAggregator(String domain) {
        return domain != null && domain.contains(AGGREGATOR_MARKER);
    }

    // ---------- internals ----------

    /** 집계 도메인 카운터 갱신 + 이번 요청에 붙일 추가 휴식(ms) */
    private long countAggregatorRequest(String domain, DomainState st, long now) {
        if (st.windowStart < 0 || now - st.windowStart > DAY_MS) {
            if (st.windowStart >= 0) LOG.info("Daily request counter reset for {}", domain);
            st.requestCount = 0;
            st.windowStart = now;
        }
        st.requestCount++;

        long pause = 0;
        if (st.requestCount > cfg.getAggregatorDailyLimit()) {
            LOG.warn("Daily limit {} reached for {}, pausing {}ms", cfg.getAggregatorDailyLimit(), domain,
                    cfg.getDailyLimitPauseMs());
            SLOG.warn("daily-limit-pause", "domain", domain, "pauseMs", cfg.getDailyLimitPauseMs());
            pause += cfg.getDailyLimitPauseMs();
            st.requestCount = 0;
        }
        int every = cfg.getExtraPauseEvery();
        if (every > 0 && st.requestCount > 0 && st.requestCount % every == 0) {
            long extra = uniform(cfg.getExtraPauseMinMs(), cfg.getExtraPauseMaxMs());
            LOG.info("Anti-detection pause {}ms for {} (request #{})", extra, domain, st.requestCount);
            pause += extra;
        }
        return pause;
    }

    /** [base, base + jitter], base는 요청 growthPer건마다 1초씩 증가 */
    private long aggregatorGap(long count) {
        long base = cfg.getAggregatorBaseDelayMs() + (count * 1000L) / cfg.getAggregatorGrowthPer();
        if (cfg.getAggregatorBaseDelayMs() == 0 && cfg.getAggregatorJitterMs() == 0) return 0;
        return uniform(base, base + cfg.getAggregatorJitterMs());
    }

    private long uniform(long min, long max) {
        if (max <= min) return min;
        double r = (random != null) ? random.nextDouble() : ThreadLocalRandom.current().nextDouble();
        return min + (long) (r * (max - min));
    }

    private static String domainKey(String url) {
        String d = UrlUtils.domainOf(url);
        return d == null ? "" : d;
    }
}

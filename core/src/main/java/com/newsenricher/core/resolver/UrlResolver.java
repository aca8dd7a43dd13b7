package com.newsenricher.core.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.api.IUrlResolver;
import com.newsenricher.core.cache.CacheStore;
import com.newsenricher.core.error.CacheUnavailableException;
import com.newsenricher.core.error.DomainAbortedException;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.ResolutionRecord;
import com.newsenricher.core.model.ResolvedUrl;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.resolver.strategy.Base64ScanStrategy;
import com.newsenricher.core.resolver.strategy.FeedStrategy;
import com.newsenricher.core.resolver.strategy.HtmlRedirectStrategy;
import com.newsenricher.core.resolver.strategy.LandingPageStrategy;
import com.newsenricher.core.resolver.strategy.QueryParamStrategy;
import com.newsenricher.core.resolver.strategy.RedirectFollowStrategy;
import com.newsenricher.core.resolver.strategy.TokenDecodeStrategy;
import com.newsenricher.core.util.DefaultSleeper;
import com.newsenricher.core.util.Sleeper;
import com.newsenricher.core.util.StructuredLog;
import com.newsenricher.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 간접 URL 해석기.
 * <ol>
 *   <li>입력 검증(invalid_input)</li>
 *   <li>캐시 조회(적중 시 네트워크 없음)</li>
 *   <li>전용 토큰 디코더(등록돼 있으면 호출당 1회)</li>
 *   <li>고정 순서 전략 캐스케이드 × maxAttempts 라운드(라운드 사이 휴식)</li>
 *   <li>성공은 캐시에 기록, 전부 실패하면 no_resolution(success=false) 기록</li>
 * </ol>
 * 전략 안의 예외는 "그 전략 실패"로 취급한다. DomainAbortedException만 호출자에게 올라간다.
 */
public final class UrlResolver implements IUrlResolver {

    private static final Logger LOG = LoggerFactory.getLogger(UrlResolver.class);
    private static final StructuredLog SLOG = StructuredLog.get(UrlResolver.class);

    private final CacheStore cache;
    private final List<ResolutionStrategy> strategies;
    private final TokenDecoder decoder;          // null이면 단계 생략
    private final ExternalUrlPolicy policy;
    private final Sleeper sleeper;
    private final long roundPauseMinMs;
    private final long roundPauseMaxMs;

    public UrlResolver(CacheStore cache, List<ResolutionStrategy> strategies, TokenDecoder decoder,
                       ExternalUrlPolicy policy, Sleeper sleeper, long roundPauseMinMs, long roundPauseMaxMs) {
        this.cache = (cache != null) ? cache : CacheStore.none();
        this.strategies = List.copyOf(strategies);
        this.decoder = decoder;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.roundPauseMinMs = roundPauseMinMs;
        this.roundPauseMaxMs = Math.max(roundPauseMinMs, roundPauseMaxMs);
    }

    /** 기본 전략 구성 */
    public static UrlResolver create(EnricherConfig cfg, IHttpFetcher http, RateLimiter limiter,
                                     CacheStore cache, ObjectMapper json) {
        return create(cfg, http, limiter, cache, json, new DefaultSleeper());
    }

    public static UrlResolver create(EnricherConfig cfg, IHttpFetcher http, RateLimiter limiter,
                                     CacheStore cache, ObjectMapper json, Sleeper sleeper) {
        EnricherConfig.ResolverCfg rc = cfg.resolver();
        ExternalUrlPolicy policy = new ExternalUrlPolicy(rc.getBlockedDomainMarkers());
        String base = rc.getAggregatorBaseUrl();
        QueryParamStrategy params = new QueryParamStrategy(policy, rc.getRedirectParams());

        List<ResolutionStrategy> cascade = List.of(
                new TokenDecodeStrategy(policy),
                params,
                new FeedStrategy(http, limiter, policy, base),
                new LandingPageStrategy(http, limiter, policy, base, params, json),
                new RedirectFollowStrategy(http, limiter, policy),
                new HtmlRedirectStrategy(http, limiter, policy),
                new Base64ScanStrategy(policy));

        TokenDecoder decoder = (rc.getDecoder() == EnricherConfig.DecoderKind.BATCH_EXECUTE)
                ? new BatchExecuteTokenDecoder(http, limiter, policy, base, json)
                : null;

        return new UrlResolver(cache, cascade, decoder, policy, sleeper,
                rc.getRoundPauseMinMs(), rc.getRoundPauseMaxMs());
    }

    @Override
    public ResolvedUrl resolve(String indirectUrl, int maxAttempts) throws InterruptedException {
        // 1) 입력 검증
        if (!UrlUtils.isUrlShaped(indirectUrl)) {
            return new ResolvedUrl("", ResolvedUrl.INVALID_INPUT);
        }
        final String url = indirectUrl.trim();

        // 2) 캐시
        Optional<ResolutionRecord> cached = cachedResolution(url);
        if (cached.isPresent()) {
            ResolutionRecord r = cached.get();
            LOG.debug("Resolution cache hit: {}", url);
            SLOG.debug("resolve-hit", "url", url, "method", r.method());
            return new ResolvedUrl(r.directUrl(), r.method(), 0);
        }

        // 3~4) 디코더 + 캐스케이드
        final Set<String> decoderTried = new HashSet<>();
        final int rounds = Math.max(1, maxAttempts);
        for (int round = 1; round <= rounds; round++) {
            if (round > 1) {
                LOG.info("Attempt {}/{} for {}", round, rounds, url);
                pauseBetweenRounds();
            }

            if (decoder != null && decoder.supports(url) && decoderTried.add(url)) {
                Optional<String> hit = tryDecoder(url);
                if (hit.isPresent()) return success(url, hit.get(), decoder.name(), round);
            }

            for (ResolutionStrategy s : strategies) {
                Optional<String> hit = tryStrategy(s, url);
                if (hit.isPresent()) return success(url, hit.get(), s.name(), round);
            }
        }

        // 5) 전부 실패
        LOG.warn("Unresolved after {} attempts: {}", rounds, url);
        SLOG.info("resolve-miss", "url", url, "rounds", rounds);
        saveQuietly(url, url, ResolvedUrl.NO_RESOLUTION, false);
        return new ResolvedUrl(url, ResolvedUrl.NO_RESOLUTION, rounds);
    }

    public ExternalUrlPolicy policy() { return policy; }

    // ---------- internals ----------

    private Optional<String> tryDecoder(String url) throws InterruptedException {
        try {
            return decoder.decode(url).filter(policy::isValidExternal);
        } catch (DomainAbortedException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            LOG.debug("Decoder {} failed for {}: {}", decoder.name(), url, e.toString());
            return Optional.empty();
        }
    }

    private Optional<String> tryStrategy(ResolutionStrategy s, String url) throws InterruptedException {
        try {
            LOG.debug("Trying strategy {}", s.name());
            return s.attempt(url).filter(policy::isValidExternal);
        } catch (DomainAbortedException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            LOG.debug("Strategy {} failed for {}: {}", s.name(), url, e.toString());
            return Optional.empty();
        }
    }

    private ResolvedUrl success(String url, String direct, String method, int round) {
        LOG.info("Resolved with {}: {}", method, direct);
        SLOG.info("resolve-done", "url", url, "direct", direct, "method", method, "rounds", round);
        saveQuietly(url, direct, method, true);
        return new ResolvedUrl(direct, method, round);
    }

    private Optional<ResolutionRecord> cachedResolution(String url) {
        try {
            return cache.getResolution(url);
        } catch (CacheUnavailableException e) {
            LOG.warn("Cache read failed, treating as miss: {}", e.getMessage());
            SLOG.warn("cache-unavailable", "op", "get_resolution", "url", url);
            return Optional.empty();
        }
    }

    private void saveQuietly(String url, String direct, String method, boolean success) {
        try {
            cache.saveResolution(url, direct, method, success);
        } catch (CacheUnavailableException e) {
            LOG.warn("Cache write dropped for {}: {}", url, e.getMessage());
            SLOG.warn("cache-unavailable", "op", "save_resolution", "url", url);
        }
    }

    private void pauseBetweenRounds() throws InterruptedException {
        long span = roundPauseMaxMs - roundPauseMinMs;
        long ms = roundPauseMinMs + (span > 0 ? ThreadLocalRandom.current().nextLong(span + 1) : 0);
        if (ms > 0) sleeper.sleep(Duration.ofMillis(ms));
    }
}

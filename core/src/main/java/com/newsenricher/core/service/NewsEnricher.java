package com.newsenricher.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.cache.CacheStore;
import com.newsenricher.core.cache.SqliteCacheStore;
import com.newsenricher.core.error.CacheUnavailableException;
import com.newsenricher.core.extractor.ContentExtractor;
import com.newsenricher.core.http.HttpFetcher;
import com.newsenricher.core.model.CacheStats;
import com.newsenricher.core.model.ContentRecord;
import com.newsenricher.core.model.EnrichStats;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.EnrichmentResult;
import com.newsenricher.core.model.ResolutionRecord;
import com.newsenricher.core.model.ResolvedUrl;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.resolver.UrlResolver;
import com.newsenricher.core.util.DefaultSleeper;
import com.newsenricher.core.util.ProgressListener;
import com.newsenricher.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 프로세스 단위 진입점. 설정 한 번으로 공유 객체(HTTP 세션, RateLimiter, 캐시)를 만들고
 * 해석기/추출기/배치 처리기에 주입한다. 시작 시 오래된 캐시를 정리하고 close에서 자원을 닫는다.
 */
public final class NewsEnricher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(NewsEnricher.class);

    private final EnricherConfig config;
    private final EnrichStats stats;
    private final IHttpFetcher http;
    private final RateLimiter limiter;
    private final CacheStore cache;
    private final UrlResolver resolver;
    private final ContentExtractor extractor;
    private final BatchProcessor batch;

    /** 기본 구성(실제 네트워크 + 설정의 캐시 경로) */
    public NewsEnricher(EnricherConfig config) {
        this(config, new EnrichStats());
    }

    private NewsEnricher(EnricherConfig config, EnrichStats stats) {
        this(config, new HttpFetcher(config, stats), openCache(config),
                new RateLimiter(config.rate()), new DefaultSleeper(), stats);
    }

    /** DI/테스트용 */
    public NewsEnricher(EnricherConfig config, IHttpFetcher http, CacheStore cache,
                        RateLimiter limiter, Sleeper sleeper, EnrichStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.stats = (stats != null) ? stats : new EnrichStats();
        this.http = Objects.requireNonNull(http, "http");
        this.cache = (cache != null) ? cache : CacheStore.none();
        this.limiter = Objects.requireNonNull(limiter, "limiter");

        ObjectMapper json = new ObjectMapper();
        this.resolver = UrlResolver.create(config, http, limiter, this.cache, json, sleeper);
        this.extractor = ContentExtractor.create(config, http, limiter, this.cache, json);
        this.batch = new BatchProcessor(resolver, extractor,
                config.getMaxResolveAttempts(), config.getProgressEvery(), this.stats);

        evictOld();
    }

    /** cache.enabled=false 이거나 열 수 없으면 항상-미스 캐시 */
    static CacheStore openCache(EnricherConfig config) {
        EnricherConfig.CacheCfg cc = config.cache();
        if (!cc.isEnabled()) {
            LOG.info("Cache disabled.");
            return CacheStore.none();
        }
        try {
            return new SqliteCacheStore(cc.getPath());
        } catch (CacheUnavailableException e) {
            LOG.warn("Cache unavailable, continuing without it: {}", e.getMessage());
            return CacheStore.none();
        }
    }

    private void evictOld() {
        int days = config.cache().getEvictDays();
        if (days <= 0) return;
        try {
            int removed = cache.cleanup(days);
            if (removed > 0) LOG.info("Evicted {} cache rows older than {} days", removed, days);
        } catch (CacheUnavailableException e) {
            LOG.warn("Cache cleanup skipped: {}", e.getMessage());
        }
    }

    // ---------- API ----------

    public ResolvedUrl resolve(String indirectUrl) throws InterruptedException {
        return resolver.resolve(indirectUrl, config.getMaxResolveAttempts());
    }

    public ContentRecord extract(String directUrl) throws InterruptedException {
        return extractor.extract(directUrl);
    }

    /** 설정의 mode/workers로 배치 처리 */
    public List<EnrichmentResult> process(List<String> urls) {
        return run(urls, ProgressListener.NONE).results();
    }

    public BatchReport run(List<String> urls, ProgressListener listener) {
        return batch.run(urls, config.getMode(), config.getWorkers(), listener);
    }

    public CacheStats cacheStats() {
        try {
            return cache.stats();
        } catch (CacheUnavailableException e) {
            LOG.warn("Cache stats unavailable: {}", e.getMessage());
            return new CacheStats(0, 0, 0);
        }
    }

    /** 이전 실행에서 성공한 해석 기록(최신순). 캐시를 쓸 수 없으면 빈 목록 */
    public List<ResolutionRecord> cachedResolutions() {
        try {
            return cache.successfulResolutions();
        } catch (CacheUnavailableException e) {
            LOG.warn("Cached resolutions unavailable: {}", e.getMessage());
            return List.of();
        }
    }

    public CacheStore cache() { return cache; }
    public RateLimiter rateLimiter() { return limiter; }
    public EnrichStats.Snapshot stats() { return stats.snapshot(); }
    public EnricherConfig config() { return config; }

    @Override
    public void close() {
        try {
            cache.close();
        } finally {
            try {
                http.close();
            } catch (Exception e) {
                LOG.debug("HTTP close failed: {}", e.toString());
            }
        }
    }
}

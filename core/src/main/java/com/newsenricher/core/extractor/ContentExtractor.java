package com.newsenricher.core.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsenricher.core.api.IContentExtractor;
import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.cache.CacheStore;
import com.newsenricher.core.error.CacheUnavailableException;
import com.newsenricher.core.error.DomainAbortedException;
import com.newsenricher.core.extractor.strategy.ArticleParserStrategy;
import com.newsenricher.core.extractor.strategy.HeuristicHtmlStrategy;
import com.newsenricher.core.extractor.strategy.StructuredMetadataStrategy;
import com.newsenricher.core.model.ContentRecord;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.HttpResponseData;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.util.StructuredLog;
import com.newsenricher.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 직접 URL 본문 추출기.
 * <ol>
 *   <li>캐시 조회(본문이 있는 기록만 적중)</li>
 *   <li>페이지 1회 fetch (RateLimiter 경유, 성공/오류 보고)</li>
 *   <li>전략 캐스케이드: 본문 단어 수가 minContentWords 이상인 첫 결과 채택</li>
 *   <li>채택 결과는 캐시에 저장, 전부 실패하면 failed/0 레코드</li>
 * </ol>
 */
public final class ContentExtractor implements IContentExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ContentExtractor.class);
    private static final StructuredLog SLOG = StructuredLog.get(ContentExtractor.class);

    private final IHttpFetcher http;
    private final RateLimiter limiter;
    private final CacheStore cache;
    private final List<ExtractionStrategy> strategies;
    private final int minContentWords;

    public ContentExtractor(IHttpFetcher http, RateLimiter limiter, CacheStore cache,
                            List<ExtractionStrategy> strategies, int minContentWords) {
        this.http = Objects.requireNonNull(http, "http");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.cache = (cache != null) ? cache : CacheStore.none();
        this.strategies = List.copyOf(strategies);
        this.minContentWords = Math.max(0, minContentWords);
    }

    /** 기본 캐스케이드: structured_metadata → article_parser → heuristic_html */
    public static ContentExtractor create(EnricherConfig cfg, IHttpFetcher http, RateLimiter limiter,
                                          CacheStore cache, ObjectMapper json) {
        EnricherConfig.ExtractorCfg ec = cfg.extractor();
        ConfidenceScorer scorer = new ConfidenceScorer(ec.getWordNorm());
        List<ExtractionStrategy> cascade = List.of(
                new StructuredMetadataStrategy(json, scorer),
                new ArticleParserStrategy(scorer),
                new HeuristicHtmlStrategy(scorer));
        return new ContentExtractor(http, limiter, cache, cascade, ec.getMinContentWords());
    }

    @Override
    public ContentRecord extract(String url) throws InterruptedException {
        if (!UrlUtils.isUrlShaped(url)) {
            return ContentRecord.failed(url == null ? "" : url);
        }
        final String target = url.trim();

        Optional<ContentRecord> cached = cachedContent(target);
        if (cached.isPresent()) {
            LOG.debug("Content cache hit: {}", target);
            return cached.get();
        }

        Page page = load(target);
        if (!page.isOk()) {
            LOG.debug("Page not usable ({}): {}", page.status(), target);
            SLOG.info("extract-failed", "url", target, "status", page.status());
            return ContentRecord.failed(target).toBuilder().httpStatus(page.status()).build();
        }

        for (ExtractionStrategy s : strategies) {
            Optional<ContentRecord> hit = tryStrategy(s, page);
            if (hit.isEmpty()) continue;

            ContentRecord r = hit.get();
            if (r.getWordCount() < minContentWords) {
                LOG.debug("{} body too short ({} words) for {}", s.name(), r.getWordCount(), target);
                continue;
            }
            ContentRecord accepted = r.toBuilder().extractionMethod(s.name()).build();
            LOG.info("Extracted {} words with {}: {}", accepted.getWordCount(), s.name(), target);
            SLOG.info("extract-done", "url", target, "method", s.name(),
                    "words", accepted.getWordCount(), "confidence", accepted.getConfidence());
            saveQuietly(target, accepted);
            return accepted;
        }

        LOG.warn("All extraction strategies failed: {}", target);
        SLOG.info("extract-failed", "url", target, "status", page.status());
        return ContentRecord.failed(target).toBuilder().httpStatus(page.status()).build();
    }

    // ---------- internals ----------

    private Page load(String url) throws InterruptedException {
        limiter.waitIfNeeded(url);
        HttpResponseData r = http.get(url);
        limiter.recordResponse(url, r);
        return new Page(url, r.getFinalUrl(), r.getStatusCode(), r.getBody());
    }

    private Optional<ContentRecord> tryStrategy(ExtractionStrategy s, Page page) throws InterruptedException {
        try {
            return s.extract(page);
        } catch (DomainAbortedException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            LOG.debug("Extraction strategy {} failed for {}: {}", s.name(), page.url(), e.toString());
            return Optional.empty();
        }
    }

    private Optional<ContentRecord> cachedContent(String url) {
        try {
            return cache.getContent(url).filter(ContentRecord::hasContent);
        } catch (CacheUnavailableException e) {
            LOG.warn("Cache read failed, treating as miss: {}", e.getMessage());
            SLOG.warn("cache-unavailable", "op", "get_content", "url", url);
            return Optional.empty();
        }
    }

    private void saveQuietly(String url, ContentRecord record) {
        try {
            cache.saveContent(url, record);
        } catch (CacheUnavailableException e) {
            LOG.warn("Cache write dropped for {}: {}", url, e.getMessage());
            SLOG.warn("cache-unavailable", "op", "save_content", "url", url);
        }
    }
}

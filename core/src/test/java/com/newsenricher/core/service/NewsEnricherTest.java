package com.newsenricher.core.service;

import com.newsenricher.core.cache.CacheStore;
import com.newsenricher.core.cache.SqliteCacheStore;
import com.newsenricher.core.model.CacheStats;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.EnrichmentResult;
import com.newsenricher.core.model.ProcessingMode;
import com.newsenricher.core.model.ProcessingStatus;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.support.FakeHttpFetcher;
import com.newsenricher.core.support.ManualTime;
import com.newsenricher.core.support.Pages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("NewsEnricher: 해석 → 추출 → 캐시 전체 흐름")
class NewsEnricherTest {

    private static final String INDIRECT_A = "https://news.google.com/rd?url=https%3A%2F%2Fexample.com%2Fa";
    private static final String INDIRECT_B = "https://news.google.com/rd?url=https%3A%2F%2Fexample.org%2Fb";

    @TempDir Path dir;

    private FakeHttpFetcher http;
    private ManualTime time;
    private EnricherConfig cfg;

    @BeforeEach
    void setUp() {
        http = new FakeHttpFetcher()
                .on("https://example.com/a", 200, Pages.article("Primera", 3))
                .on("https://example.org/b", 200, Pages.article("Segunda", 3));
        time = new ManualTime(0);
        cfg = EnricherConfig.defaults().setMode(ProcessingMode.CONCURRENT).setWorkers(2);
        cfg.rate().setMinDelayMs(0).setMaxDelayMs(0)
                .setAggregatorBaseDelayMs(0).setAggregatorJitterMs(0)
                .setAggregatorInitialMinMs(0).setAggregatorInitialMaxMs(0)
                .setExtraPauseEvery(0);
        cfg.resolver().setDecoder(EnricherConfig.DecoderKind.NONE).setRoundPauseMinMs(0).setRoundPauseMaxMs(0);
        cfg.cache().setPath(dir.resolve("enricher.db"));
    }

    private NewsEnricher enricher() {
        return new NewsEnricher(cfg, http, new SqliteCacheStore(cfg.cache().getPath()),
                new RateLimiter(cfg.rate(), time, time, null), time, null);
    }

    @Test
    @DisplayName("배치: 입력 순서대로 성공 결과, 두 번째 실행은 전부 캐시에서")
    void batch_thenCachedRerun() {
        List<String> inputs = List.of(INDIRECT_A, "", INDIRECT_B);

        try (NewsEnricher ne = enricher()) {
            BatchReport report = ne.run(inputs, null);
            List<EnrichmentResult> out = report.results();

            assertEquals(3, report.total());
            assertEquals("https://example.com/a", out.get(0).directUrl());
            assertEquals("extract_url_params", out.get(0).method());
            assertEquals(ProcessingStatus.SUCCESS, out.get(0).status());
            assertThat(out.get(0).metadata()).containsEntry("title", "Primera");
            assertEquals(ProcessingStatus.INVALID_INPUT, out.get(1).status());
            assertEquals("https://example.org/b", out.get(2).directUrl());
            assertEquals(2, report.count(ProcessingStatus.SUCCESS));

            CacheStats cs = ne.cacheStats();
            assertEquals(2, cs.successfulResolutions());
            assertEquals(2, cs.contentRows());
            assertThat(ne.cachedResolutions()).extracting(r -> r.directUrl())
                    .containsExactlyInAnyOrder("https://example.com/a", "https://example.org/b");
        }

        http.clearRequests();
        try (NewsEnricher again = enricher()) {
            List<EnrichmentResult> out = again.process(inputs);

            assertThat(http.requestCount()).isZero();
            assertEquals(0, out.get(0).attempts());
            assertEquals("extract_url_params", out.get(0).method());
            assertThat(out.get(2).content()).isNotEmpty();
            assertEquals(2, again.stats().cacheHits);
        }
    }

    @Test
    @DisplayName("단건 API: resolve / extract")
    void singleCalls() throws Exception {
        try (NewsEnricher ne = enricher()) {
            assertEquals("https://example.com/a", ne.resolve(INDIRECT_A).url());
            assertEquals("article_parser", ne.extract("https://example.com/a").getExtractionMethod());
            assertThat(http.requests()).containsExactly("https://example.com/a");
        }
    }

    @Test
    @DisplayName("잘못된 설정은 생성 시점에 거부")
    void invalidConfig_isRejected() {
        cfg.rate().setMinDelayMs(5_000).setMaxDelayMs(100);

        assertThrows(IllegalArgumentException.class, this::enricher);
    }

    @Test
    @DisplayName("cache.enabled=false 이면 항상-미스 캐시")
    void disabledCache_isNoOp() {
        cfg.cache().setEnabled(false);

        assertSame(CacheStore.none(), NewsEnricher.openCache(cfg));
    }

    @Test
    @DisplayName("캐시 파일을 열 수 없으면 캐시 없이 계속")
    void unopenableCache_fallsBackToNone() throws Exception {
        Path notADir = dir.resolve("file.txt");
        Files.writeString(notADir, "x");
        cfg.cache().setPath(notADir.resolve("nested").resolve("cache.db"));

        assertSame(CacheStore.none(), NewsEnricher.openCache(cfg));
    }
}

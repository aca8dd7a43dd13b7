package com.newsenricher.core.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsenricher.core.cache.SqliteCacheStore;
import com.newsenricher.core.error.DomainAbortedException;
import com.newsenricher.core.model.ContentRecord;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.support.FakeHttpFetcher;
import com.newsenricher.core.support.ManualTime;
import com.newsenricher.core.support.Pages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ContentExtractor: 캐시 / 1회 fetch / 전략 캐스케이드")
class ContentExtractorTest {

    private static final String URL = "https://www.elpais.com/espana/noticia-1.html";

    @TempDir Path dir;

    private FakeHttpFetcher http;
    private SqliteCacheStore cache;
    private ContentExtractor extractor;

    @BeforeEach
    void setUp() {
        http = new FakeHttpFetcher();
        cache = new SqliteCacheStore(dir.resolve("cache.db"));
        ManualTime time = new ManualTime(0);
        EnricherConfig cfg = EnricherConfig.defaults();
        RateLimiter limiter = new RateLimiter(EnricherConfig.RateCfg.noDelay(), time, time, null);
        extractor = ContentExtractor.create(cfg, http, limiter, cache, new ObjectMapper());
    }

    @Test
    @DisplayName("일반 기사: article_parser로 본문/메타데이터 추출 후 캐시")
    void article_isExtractedAndCached() throws Exception {
        http.on(URL, 200, Pages.article("Sube el precio de la luz", 3));

        ContentRecord r = extractor.extract(URL);

        assertEquals("article_parser", r.getExtractionMethod());
        assertEquals("Sube el precio de la luz", r.getTitle());
        assertEquals("Ana García", r.getAuthor());
        assertEquals("Resumen del artículo", r.getDescription());
        assertEquals("2024-03-01T10:15:00+01:00", r.getDateRaw());
        assertEquals("2024-03-01T10:15:00+01:00", r.getDateIso());
        assertEquals(120, r.getWordCount());
        assertEquals(200, r.getHttpStatus());
        assertThat(r.getContent()).contains("\n\n").doesNotContain("Todos los derechos").doesNotContain("Inicio");
        assertThat(r.getConfidence()).isBetween(0.0, 1.0).isGreaterThan(0.4);

        ContentRecord stored = cache.getContent(URL).orElseThrow();
        assertEquals(r.getContentHash(), stored.getContentHash());
        assertEquals("article_parser", stored.getExtractionMethod());
    }

    @Test
    @DisplayName("캐시 적중 시 네트워크 요청 없음")
    void cacheHit_noRequest() throws Exception {
        http.on(URL, 200, Pages.article("Titular", 3));
        ContentRecord first = extractor.extract(URL);
        http.clearRequests();

        ContentRecord second = extractor.extract(URL);

        assertThat(http.requestCount()).isZero();
        assertEquals(first.getContent(), second.getContent());
        assertEquals(first.getExtractionMethod(), second.getExtractionMethod());
    }

    @Test
    @DisplayName("본문 100단어 미만이면 failed, 캐시에 남기지 않음")
    void shortBody_isFailed() throws Exception {
        http.on(URL, 200, Pages.article("Breve", 1));

        ContentRecord r = extractor.extract(URL);

        assertThat(r.isFailed()).isTrue();
        assertEquals(ContentRecord.FAILED, r.getExtractionMethod());
        assertEquals("", r.getContent());
        assertEquals(0.0, r.getConfidence());
        assertThat(cache.getContent(URL)).isEmpty();
    }

    @Test
    @DisplayName("HTTP 404는 상태코드를 담은 failed")
    void notFound_isFailed() throws Exception {
        ContentRecord r = extractor.extract(URL);

        assertThat(r.isFailed()).isTrue();
        assertEquals(404, r.getHttpStatus());
        assertThat(r.hasContent()).isFalse();
    }

    @Test
    @DisplayName("URL 모양이 아니면 요청 없이 failed")
    void invalidUrl() throws Exception {
        assertThat(extractor.extract("nada").isFailed()).isTrue();
        assertThat(extractor.extract(null).isFailed()).isTrue();
        assertThat(http.requestCount()).isZero();
    }

    @Test
    @DisplayName("JSON-LD articleBody가 있으면 structured_metadata가 먼저 채택")
    void jsonLd_winsFirst() throws Exception {
        String body = Pages.words(150);
        http.on(URL, 200, "<html><head><title>T</title>"
                + "<script type=\"application/ld+json\">{\"@context\":\"https://schema.org\",\"@type\":\"NewsArticle\","
                + "\"headline\":\"Titular estructurado\",\"datePublished\":\"2024-03-02T08:00:00Z\","
                + "\"author\":[{\"@type\":\"Person\",\"name\":\"Luis Pérez\"}],"
                + "\"articleBody\":\"" + body + "\"}</script></head><body><p>x</p></body></html>");

        ContentRecord r = extractor.extract(URL);

        assertEquals("structured_metadata", r.getExtractionMethod());
        assertEquals("Titular estructurado", r.getTitle());
        assertEquals("Luis Pérez", r.getAuthor());
        assertEquals("2024-03-02T08:00:00Z", r.getDateRaw());
        assertEquals("2024-03-02T08:00:00+00:00", r.getDateIso());
        assertEquals(150, r.getWordCount());
    }

    @Test
    @DisplayName("본문 없는 캐시 기록은 무시하고 다시 추출")
    void cachedFailure_isIgnored() throws Exception {
        cache.saveContent(URL, ContentRecord.failed(URL));
        http.on(URL, 200, Pages.article("Titular", 3));

        ContentRecord r = extractor.extract(URL);

        assertEquals("article_parser", r.getExtractionMethod());
        assertThat(http.requestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("같은 도메인 연속 503 5회째 추출에서 DomainAbortedException")
    void repeatedServerErrors_abortDomain() throws Exception {
        http.otherwise(503, "");
        for (int i = 0; i < 4; i++) {
            assertThat(extractor.extract("https://www.elpais.com/n/" + i).isFailed()).isTrue();
        }
        assertThrows(DomainAbortedException.class, () -> extractor.extract("https://www.elpais.com/n/4"));
        assertThrows(DomainAbortedException.class, () -> extractor.extract("https://www.elpais.com/n/5"));
        assertThat(http.requestCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("404/403 응답은 추출 실패일 뿐 도메인 차단기에 들어가지 않는다")
    void clientErrors_doNotAbortDomain() throws Exception {
        http.otherwise(404, "").on("https://www.elpais.com/n/muro", 403, "");
        for (int i = 0; i < 6; i++) {
            assertThat(extractor.extract("https://www.elpais.com/n/" + i).isFailed()).isTrue();
        }
        ContentRecord walled = extractor.extract("https://www.elpais.com/n/muro");

        assertThat(walled.isFailed()).isTrue();
        assertEquals(403, walled.getHttpStatus());
        assertThat(http.requestCount()).isEqualTo(7);
    }
}

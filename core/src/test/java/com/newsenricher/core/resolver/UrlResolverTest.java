package com.newsenricher.core.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsenricher.core.cache.CacheStore;
import com.newsenricher.core.cache.SqliteCacheStore;
import com.newsenricher.core.error.CacheUnavailableException;
import com.newsenricher.core.error.DomainAbortedException;
import com.newsenricher.core.model.CacheStats;
import com.newsenricher.core.model.ContentRecord;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.ResolutionRecord;
import com.newsenricher.core.model.ResolvedUrl;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.support.FakeHttpFetcher;
import com.newsenricher.core.support.ManualTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("UrlResolver: 캐시 / 디코더 / 전략 캐스케이드")
class UrlResolverTest {

    private static final String RSS = "<?xml version=\"1.0\"?><rss><channel><title>Feed</title>"
            + "<link>https://news.google.com/</link>"
            + "<item><title>Noticia</title><link>https://www.elpais.com/espana/noticia-1.html</link></item>"
            + "</channel></rss>";

    @TempDir Path dir;

    private FakeHttpFetcher http;
    private ManualTime time;
    private EnricherConfig cfg;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        http = new FakeHttpFetcher();
        time = new ManualTime(0);
        cfg = EnricherConfig.defaults();
        cfg.rate().setMinDelayMs(0).setMaxDelayMs(0)
                .setAggregatorBaseDelayMs(0).setAggregatorJitterMs(0)
                .setAggregatorInitialMinMs(0).setAggregatorInitialMaxMs(0)
                .setExtraPauseEvery(0);
        cfg.resolver().setDecoder(EnricherConfig.DecoderKind.NONE).setRoundPauseMinMs(0).setRoundPauseMaxMs(0);
    }

    private UrlResolver resolver(CacheStore cache) {
        limiter = new RateLimiter(cfg.rate(), time, time, null);
        return UrlResolver.create(cfg, http, limiter, cache, new ObjectMapper(), time);
    }

    @Test
    @DisplayName("URL 모양이 아니면 invalid_input, 네트워크 없음")
    void invalidInput() throws Exception {
        UrlResolver r = resolver(CacheStore.none());

        ResolvedUrl out = r.resolve("not a url");
        assertEquals(ResolvedUrl.INVALID_INPUT, out.method());
        assertEquals("", out.url());
        assertThat(r.resolve("").method()).isEqualTo(ResolvedUrl.INVALID_INPUT);
        assertThat(r.resolve(null).method()).isEqualTo(ResolvedUrl.INVALID_INPUT);
        assertThat(r.resolve("ftp://example.com/x").method()).isEqualTo(ResolvedUrl.INVALID_INPUT);
        assertThat(http.requestCount()).isZero();
    }

    @Test
    @DisplayName("리다이렉트 파라미터의 외부 URL을 네트워크 없이 추출")
    void queryParam_withoutNetwork() throws Exception {
        ResolvedUrl out = resolver(CacheStore.none())
                .resolve("https://news.google.com/rd?url=https%3A%2F%2Fexample.com%2Farticle");

        assertEquals("https://example.com/article", out.url());
        assertEquals("extract_url_params", out.method());
        assertEquals(1, out.rounds());
        assertThat(out.resolved()).isTrue();
        assertThat(http.requestCount()).isZero();
    }

    @Test
    @DisplayName("피드의 첫 item link 채택 후 캐시, 두 번째 호출은 요청 0건에 같은 결과")
    void feed_thenCacheHitIsIdempotent() throws Exception {
        http.on("https://news.google.com/rss/articles/XYZ", 200, RSS);
        UrlResolver r = resolver(new SqliteCacheStore(dir.resolve("cache.db")));

        ResolvedUrl first = r.resolve("https://news.google.com/articles/XYZ");
        assertEquals("https://www.elpais.com/espana/noticia-1.html", first.url());
        assertEquals("resolve_via_rss", first.method());
        assertThat(http.requestCount()).isEqualTo(1);

        http.clearRequests();
        ResolvedUrl second = r.resolve("https://news.google.com/articles/XYZ");
        assertEquals(first.url(), second.url());
        assertEquals(first.method(), second.method());
        assertEquals(0, second.rounds());
        assertThat(http.requestCount()).isZero();
    }

    @Test
    @DisplayName("리다이렉트가 집계 서비스로 돌아오면 no_resolution, 실패 기록은 캐시 미스")
    void redirectBackToAggregator_isUnresolved() throws Exception {
        String in = "https://news.google.com/articles/ABC";
        http.otherwise(200, "<html><body></body></html>")
                .redirect(in, "https://news.google.com/home", 200, "<html><body>Inicio</body></html>");
        SqliteCacheStore cache = new SqliteCacheStore(dir.resolve("cache.db"));

        ResolvedUrl out = resolver(cache).resolve(in, 2);

        assertEquals(ResolvedUrl.NO_RESOLUTION, out.method());
        assertEquals(in, out.url());
        assertEquals(2, out.rounds());
        assertThat(out.resolved()).isFalse();
        assertThat(cache.getResolution(in)).isEmpty();
        assertThat(cache.stats().totalResolutions()).isEqualTo(1);
    }

    @Test
    @DisplayName("집계 도메인 429 연속 5회째에 DomainAbortedException이 호출자까지 올라온다")
    void aggregatorThrottling_abortPropagates() {
        http.otherwise(429, "");
        UrlResolver r = resolver(CacheStore.none());

        DomainAbortedException ex = assertThrows(DomainAbortedException.class,
                () -> r.resolve("https://news.google.com/articles/ABC", 3));
        assertEquals("news.google.com", ex.getDomain());
        assertThat(http.requestCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("404뿐인 죽은 링크 하나는 여러 라운드를 돌아도 도메인을 닫지 않는다")
    void deadLink_doesNotTripBreaker() throws Exception {
        String in = "https://news.google.com/articles/ABC";
        UrlResolver r = resolver(CacheStore.none());

        ResolvedUrl out = r.resolve(in, 3);

        assertEquals(ResolvedUrl.NO_RESOLUTION, out.method());
        assertThat(http.requestCount()).isGreaterThan(5);
        assertThat(limiter.isAborted(in)).isFalse();
        assertEquals(0, limiter.consecutiveErrors(in));
    }

    @Test
    @DisplayName("발행처가 403을 돌려줘도 리다이렉트 해석은 성공이고 집계 도메인 오류는 남지 않는다")
    void publisherForbidden_afterRedirect_keepsAggregatorClean() throws Exception {
        for (int i = 0; i < 6; i++) {
            String in = "https://news.google.com/articles/CBMi" + i;
            http.redirect(in, "https://www.publisher.cl/nota-" + i, 403, "<html><body>Acceso denegado</body></html>");
        }
        UrlResolver r = resolver(CacheStore.none());

        for (int i = 0; i < 6; i++) {
            String in = "https://news.google.com/articles/CBMi" + i;
            ResolvedUrl out = r.resolve(in);
            assertEquals("follow_redirects", out.method());
            assertEquals("https://www.publisher.cl/nota-" + i, out.url());
            assertEquals(0, limiter.consecutiveErrors(in));
        }
        assertThat(limiter.isAborted("https://news.google.com/")).isFalse();
    }

    @Test
    @DisplayName("리다이렉트 끝 발행처의 5xx는 집계 도메인 오류로 세지 않는다")
    void publisherServerError_isNotChargedToAggregator() throws Exception {
        String in = "https://news.google.com/articles/XYZ";
        http.redirect(in, "https://www.publisher.cl/caida", 503, "");

        ResolvedUrl out = resolver(CacheStore.none()).resolve(in);

        assertEquals("follow_redirects", out.method());
        assertEquals(0, limiter.consecutiveErrors(in));
    }

    @Test
    @DisplayName("캐시가 읽기/쓰기 모두 실패해도 해석은 계속된다")
    void brokenCache_isTolerated() throws Exception {
        CacheStore broken = new CacheStore() {
            @Override public Optional<ResolutionRecord> getResolution(String u) { throw new CacheUnavailableException("down", null); }
            @Override public void saveResolution(String a, String b, String m, boolean s) { throw new CacheUnavailableException("down", null); }
            @Override public Optional<ContentRecord> getContent(String u) { throw new CacheUnavailableException("down", null); }
            @Override public void saveContent(String u, ContentRecord d) { throw new CacheUnavailableException("down", null); }
            @Override public int cleanup(int days) { return 0; }
            @Override public CacheStats stats() { return new CacheStats(0, 0, 0); }
            @Override public List<ResolutionRecord> successfulResolutions() { return List.of(); }
        };

        ResolvedUrl out = resolver(broken).resolve("https://t.co/x?u=https%3A%2F%2Fexample.org%2Fn");
        assertEquals("https://example.org/n", out.url());
        assertEquals("extract_url_params", out.method());
    }

    @Test
    @DisplayName("디코더는 캐스케이드보다 먼저, 호출당 한 번만 시도")
    void decoder_triedOncePerCall() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        TokenDecoder decoder = new TokenDecoder() {
            @Override public String name() { return "stub_decoder"; }
            @Override public boolean supports(String u) { return true; }
            @Override public Optional<String> decode(String u) {
                calls.incrementAndGet();
                return Optional.empty();
            }
        };
        ExternalUrlPolicy policy = new ExternalUrlPolicy(cfg.resolver().getBlockedDomainMarkers());
        UrlResolver r = new UrlResolver(CacheStore.none(), List.of(), decoder, policy, time, 0, 0);

        ResolvedUrl out = r.resolve("https://news.google.com/articles/ABC", 3);
        assertEquals(ResolvedUrl.NO_RESOLUTION, out.method());
        assertEquals(3, out.rounds());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("디코더 결과가 유효 외부 URL이면 디코더 이름으로 태그")
    void decoder_successTaggedWithItsName() throws Exception {
        TokenDecoder decoder = new TokenDecoder() {
            @Override public String name() { return "stub_decoder"; }
            @Override public boolean supports(String u) { return true; }
            @Override public Optional<String> decode(String u) { return Optional.of("https://elmundo.es/x"); }
        };
        ExternalUrlPolicy policy = new ExternalUrlPolicy(cfg.resolver().getBlockedDomainMarkers());
        UrlResolver r = new UrlResolver(CacheStore.none(), List.of(), decoder, policy, time, 0, 0);

        ResolvedUrl out = r.resolve("https://news.google.com/articles/ABC");
        assertEquals("https://elmundo.es/x", out.url());
        assertEquals("stub_decoder", out.method());
    }

    @Test
    @DisplayName("전략 예외는 그 전략 실패로 취급, 집계 서비스 URL 결과는 버리고 다음 전략으로")
    void strategyFailures_fallThrough() throws Exception {
        ResolutionStrategy boom = new ResolutionStrategy() {
            @Override public String name() { return "boom"; }
            @Override public Optional<String> attempt(String u) { throw new IllegalStateException("parse error"); }
        };
        ResolutionStrategy internal = new ResolutionStrategy() {
            @Override public String name() { return "internal"; }
            @Override public Optional<String> attempt(String u) { return Optional.of("https://news.google.com/other"); }
        };
        ResolutionStrategy good = new ResolutionStrategy() {
            @Override public String name() { return "good"; }
            @Override public Optional<String> attempt(String u) { return Optional.of("https://abc.es/n"); }
        };
        ExternalUrlPolicy policy = new ExternalUrlPolicy(cfg.resolver().getBlockedDomainMarkers());
        UrlResolver r = new UrlResolver(CacheStore.none(), List.of(boom, internal, good), null, policy, time, 0, 0);

        ResolvedUrl out = r.resolve("https://news.google.com/articles/ABC");
        assertEquals("good", out.method());
        assertEquals("https://abc.es/n", out.url());
    }

    @Test
    @DisplayName("라운드 사이 휴식은 설정 범위 안")
    void roundPause_withinRange() throws Exception {
        ExternalUrlPolicy policy = new ExternalUrlPolicy(cfg.resolver().getBlockedDomainMarkers());
        UrlResolver r = new UrlResolver(CacheStore.none(), List.of(), null, policy, time, 2000, 4000);

        r.resolve("https://news.google.com/articles/ABC", 3);
        assertThat(time.sleeps()).hasSize(2)
                .allSatisfy(d -> assertThat(d.toMillis()).isBetween(2000L, 4000L));
    }
}

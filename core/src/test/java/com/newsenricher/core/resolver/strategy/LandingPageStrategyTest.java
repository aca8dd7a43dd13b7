package com.newsenricher.core.resolver.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.resolver.ExternalUrlPolicy;
import com.newsenricher.core.support.FakeHttpFetcher;
import com.newsenricher.core.support.ManualTime;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LandingPageStrategyTest {

    private static final String BASE = "https://news.google.com/articles/T";

    private final FakeHttpFetcher http = new FakeHttpFetcher();
    private final ManualTime time = new ManualTime(0);
    private final ExternalUrlPolicy policy = new ExternalUrlPolicy(List.of("google.", "gstatic."));
    private final LandingPageStrategy s = new LandingPageStrategy(http,
            new RateLimiter(EnricherConfig.RateCfg.noDelay(), time, time, null),
            policy, "https://news.google.com",
            new QueryParamStrategy(policy, List.of("url", "q")), new ObjectMapper());

    private String find(String html) {
        return s.findDestination(Jsoup.parse(html, BASE)).orElse(null);
    }

    @Test
    @DisplayName("canonical이 외부 URL이면 최우선")
    void canonicalFirst() {
        assertThat(find("<html><head>"
                + "<meta property=\"og:url\" content=\"https://b.com/og\">"
                + "<link rel=\"canonical\" href=\"https://a.com/canon\"></head></html>"))
                .isEqualTo("https://a.com/canon");
    }

    @Test
    @DisplayName("canonical이 집계 서비스면 og:url로")
    void ogUrlWhenCanonicalInternal() {
        assertThat(find("<html><head><link rel=\"canonical\" href=\"https://news.google.com/articles/T\">"
                + "<meta property=\"og:url\" content=\"https://b.com/og\"></head></html>"))
                .isEqualTo("https://b.com/og");
    }

    @Test
    @DisplayName("JSON-LD의 url 키(배열 포함), 깨진 블록은 건너뜀")
    void jsonLd() {
        assertThat(find("<html><head>"
                + "<script type=\"application/ld+json\">{ broken</script>"
                + "<script type=\"application/ld+json\">[{\"@type\":\"NewsArticle\",\"mainEntityOfPage\":\"https://c.com/ld\"}]</script>"
                + "</head></html>"))
                .isEqualTo("https://c.com/ld");
    }

    @Test
    @DisplayName("집계 서비스 앵커는 쿼리 파라미터에서 다시 추출")
    void anchorThroughAggregatorRedirect() {
        assertThat(find("<html><body>"
                + "<a href=\"./topics/abc\">Tema</a>"
                + "<a href=\"https://www.google.com/url?q=https%3A%2F%2Fd.com%2Fa\">Leer</a>"
                + "</body></html>"))
                .isEqualTo("https://d.com/a");
    }

    @Test
    @DisplayName("랜딩 페이지를 받아 목적지 추출")
    void attempt_fetchesLandingPage() throws Exception {
        http.on("https://news.google.com/articles/CBMx?hl=es", 200,
                "<html><body><a href=\"https://www.20minutos.es/n/1\">Leer más</a></body></html>");

        assertThat(s.attempt("https://news.google.com/rss/articles/CBMx?hl=es")).contains("https://www.20minutos.es/n/1");
    }
}

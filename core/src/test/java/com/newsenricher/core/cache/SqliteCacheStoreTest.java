package com.newsenricher.core.cache;

import com.newsenricher.core.model.CacheStats;
import com.newsenricher.core.model.ContentRecord;
import com.newsenricher.core.model.ResolutionRecord;
import com.newsenricher.core.support.Pages;
import com.newsenricher.core.util.ContentHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SqliteCacheStore: 두 테이블 upsert/조회/정리")
class SqliteCacheStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir Path dir;

    private MutableClock clock;
    private SqliteCacheStore store;

    /** 테스트에서 앞으로 감을 수 있는 시계 */
    static final class MutableClock extends Clock {
        private Instant now;
        MutableClock(Instant start) { this.now = start; }
        void advance(Duration d) { now = now.plus(d); }
        @Override public ZoneOffset getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(java.time.ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new SqliteCacheStore(dir.resolve("sub/cache.db"), clock);
    }

    @Test
    @DisplayName("성공 기록 왕복: 모든 필드 일치, attempts=1")
    void resolution_roundTrip() {
        store.saveResolution("https://news.google.com/articles/X", "https://elpais.com/a", "resolve_via_rss", true);

        Optional<ResolutionRecord> r = store.getResolution("https://news.google.com/articles/X");
        assertThat(r).isPresent();
        assertThat(r.get().indirectUrl()).isEqualTo("https://news.google.com/articles/X");
        assertThat(r.get().directUrl()).isEqualTo("https://elpais.com/a");
        assertThat(r.get().method()).isEqualTo("resolve_via_rss");
        assertThat(r.get().resolvedAt()).isEqualTo(T0);
        assertThat(r.get().attempts()).isEqualTo(1);
        assertThat(r.get().success()).isTrue();
    }

    @Test
    @DisplayName("success=false 기록은 조회되지 않는다(미스)")
    void failedResolution_isMiss() {
        store.saveResolution("https://news.google.com/articles/Y", "https://news.google.com/articles/Y", "no_resolution", false);
        assertThat(store.getResolution("https://news.google.com/articles/Y")).isEmpty();
        assertThat(store.stats().totalResolutions()).isEqualTo(1);
        assertThat(store.stats().successfulResolutions()).isZero();
    }

    @Test
    @DisplayName("같은 키 재기록은 마지막 쓰기가 이긴다")
    void lastWriteWins() {
        store.saveResolution("k", "https://a.com/1", "follow_redirects", true);
        clock.advance(Duration.ofMinutes(1));
        store.saveResolution("k", "https://b.com/2", "resolve_via_articles", true);

        ResolutionRecord r = store.getResolution("k").orElseThrow();
        assertThat(r.directUrl()).isEqualTo("https://b.com/2");
        assertThat(r.method()).isEqualTo("resolve_via_articles");
        assertThat(store.stats().totalResolutions()).isEqualTo(1);

        // 성공 → 실패로 덮으면 미스
        store.saveResolution("k", "k", "no_resolution", false);
        assertThat(store.getResolution("k")).isEmpty();
    }

    @Test
    @DisplayName("본문 기록 왕복: 해시/단어 수는 본문에서 계산, cached_at 기록")
    void content_roundTrip() {
        String body = Pages.words(120);
        ContentRecord in = ContentRecord.builder()
                .url("https://elpais.com/a")
                .title("Título").author("Ana").description("desc")
                .dateRaw("1 de marzo de 2024").dateIso("2024-03-01T00:00:00")
                .content(body).httpStatus(200)
                .extractionMethod("article_parser").confidence(0.82)
                .build();
        store.saveContent("https://elpais.com/a", in);

        ContentRecord out = store.getContent("https://elpais.com/a").orElseThrow();
        assertThat(out.getTitle()).isEqualTo("Título");
        assertThat(out.getAuthor()).isEqualTo("Ana");
        assertThat(out.getDescription()).isEqualTo("desc");
        assertThat(out.getDateRaw()).isEqualTo("1 de marzo de 2024");
        assertThat(out.getDateIso()).isEqualTo("2024-03-01T00:00:00");
        assertThat(out.getContent()).isEqualTo(body);
        assertThat(out.getWordCount()).isEqualTo(120);
        assertThat(out.getContentHash()).isEqualTo(ContentHash.of(body));
        assertThat(out.getHttpStatus()).isEqualTo(200);
        assertThat(out.getExtractionMethod()).isEqualTo("article_parser");
        assertThat(out.getConfidence()).isEqualTo(0.82);
        assertThat(out.getCachedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("정리: 기준일보다 오래된 행만 두 테이블에서 삭제")
    void cleanup_removesOnlyOldRows() {
        store.saveResolution("old", "https://a.com/old", "follow_redirects", true);
        store.saveContent("https://a.com/old", ContentRecord.builder().url("https://a.com/old").content("x y z").build());

        clock.advance(Duration.ofDays(40));
        store.saveResolution("new", "https://a.com/new", "follow_redirects", true);

        int removed = store.cleanup(30);
        assertThat(removed).isEqualTo(2);
        assertThat(store.getResolution("old")).isEmpty();
        assertThat(store.getResolution("new")).isPresent();
        assertThat(store.getContent("https://a.com/old")).isEmpty();

        CacheStats s = store.stats();
        assertThat(s.totalResolutions()).isEqualTo(1);
        assertThat(s.contentRows()).isZero();
    }

    @Test
    @DisplayName("성공한 해석 목록은 최신순")
    void successfulResolutions_newestFirst() {
        store.saveResolution("a", "https://a.com/", "m", true);
        clock.advance(Duration.ofSeconds(5));
        store.saveResolution("b", "https://b.com/", "m", true);
        clock.advance(Duration.ofSeconds(5));
        store.saveResolution("c", "c", "no_resolution", false);

        List<ResolutionRecord> all = store.successfulResolutions();
        assertThat(all).extracting(ResolutionRecord::indirectUrl).containsExactly("b", "a");
    }

    @Test
    @DisplayName("파일을 다시 열어도 기록이 남아 있다")
    void survivesReopen() {
        store.saveResolution("k", "https://a.com/", "m", true);
        store.close();

        SqliteCacheStore reopened = new SqliteCacheStore(dir.resolve("sub/cache.db"), clock);
        assertThat(reopened.getResolution("k")).isPresent();
    }
}

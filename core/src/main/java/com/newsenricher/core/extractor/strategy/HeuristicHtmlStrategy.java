package com.newsenricher.core.extractor.strategy;

import com.newsenricher.core.extractor.ConfidenceScorer;
import com.newsenricher.core.extractor.DateNormalizer;
import com.newsenricher.core.extractor.ExtractionStrategy;
import com.newsenricher.core.extractor.Page;
import com.newsenricher.core.model.ContentRecord;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Objects;
import java.util.Optional;

/**
 * 마지막 폴백. 비본문 요소 제거 → 우선순위 셀렉터의 첫 컨테이너(200자 초과)
 * → 가장 긴 텍스트 블록 → body 전체 텍스트 순.
 */
public final class HeuristicHtmlStrategy implements ExtractionStrategy {

    public static final String NAME = "heuristic_html";

    /** 컨테이너로 인정하는 최소 글자 수(초과) */
    static final int MIN_BLOCK_CHARS = 200;

    private static final String[] TITLE_SELECTORS = {
            "title", "h1", "[property=og:title]", "[name=title]"
    };
    private static final String[] AUTHOR_SELECTORS = {
            "[property=article:author]", "[name=author]", ".author", ".byline", "[rel=author]"
    };
    private static final String[] DATE_SELECTORS = {
            "[property=article:published_time]", "[name=publish_date]", "time[datetime]", ".date", ".published"
    };
    private static final String[] DESCRIPTION_SELECTORS = {
            "[property=og:description]", "[name=description]"
    };
    private static final String[] CONTENT_SELECTORS = {
            "article", "[role=main]", "main", ".article-content",
            ".entry-content", ".post-content", ".content", ".story-body",
            ".article-body", ".post-body", "#content", ".main-content"
    };

    private final ConfidenceScorer scorer;

    public HeuristicHtmlStrategy(ConfidenceScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<ContentRecord> extract(Page page) {
        Document doc = page.parse();

        String title = "";
        for (String selector : TITLE_SELECTORS) {
            Element el = doc.selectFirst(selector);
            if (el == null) continue;
            title = Html.firstNonBlank(el.text(), el.attr("content"));
            if (!title.isEmpty()) break;
        }

        // 이후 메타데이터 조회는 비본문 요소가 제거된 DOM 기준
        String content = mainContent(doc);

        String author = "";
        for (String selector : AUTHOR_SELECTORS) {
            Element el = doc.selectFirst(selector);
            if (el == null) continue;
            author = Html.firstNonBlank(el.text(), el.attr("content"));
            if (!author.isEmpty()) break;
        }

        String dateRaw = "";
        for (String selector : DATE_SELECTORS) {
            Element el = doc.selectFirst(selector);
            if (el == null) continue;
            dateRaw = Html.firstNonBlank(el.attr("datetime"), el.attr("content"), el.text());
            if (!dateRaw.isEmpty()) break;
        }

        String description = "";
        for (String selector : DESCRIPTION_SELECTORS) {
            Element el = doc.selectFirst(selector);
            if (el == null) continue;
            description = el.attr("content").strip();
            if (!description.isEmpty()) break;
        }

        if (content.isEmpty()) return Optional.empty();

        ContentRecord draft = ContentRecord.builder()
                .url(page.url()).title(title).author(author).description(description)
                .dateRaw(dateRaw).dateIso(DateNormalizer.toIso(dateRaw))
                .content(content).httpStatus(page.status())
                .build();
        double confidence = scorer.score(ConfidenceScorer.Weights.HEURISTIC,
                draft.getWordCount(), title, author, dateRaw, description);
        return Optional.of(draft.toBuilder().confidence(confidence).build());
    }

    /** doc을 변형한다(비본문 요소 제거) */
    static String mainContent(Document doc) {
        doc.select("script, style, nav, header, footer, aside").remove();

        for (String selector : CONTENT_SELECTORS) {
            Element el = doc.selectFirst(selector);
            if (el == null) continue;
            String text = el.text();
            if (text.length() > MIN_BLOCK_CHARS) return text;
        }

        Element best = null;
        int max = 0;
        for (Element block : doc.select("div, section, article")) {
            String text = block.text();
            if (text.length() > max && text.length() > MIN_BLOCK_CHARS) {
                max = text.length();
                best = block;
            }
        }
        if (best != null) return best.text();

        Element body = doc.body();
        return body != null ? body.text() : doc.text();
    }
}

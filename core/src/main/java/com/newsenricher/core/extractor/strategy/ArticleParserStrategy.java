package com.newsenricher.core.extractor.strategy;

import com.newsenricher.core.extractor.ConfidenceScorer;
import com.newsenricher.core.extractor.DateNormalizer;
import com.newsenricher.core.extractor.ExtractionStrategy;
import com.newsenricher.core.extractor.Page;
import com.newsenricher.core.model.ContentRecord;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 범용 기사 파서: 알려진 본문 컨테이너의 단락을 모으고,
 * 없으면 단락 텍스트가 가장 많이 모인 부모 요소를 본문으로 본다.
 */
public final class ArticleParserStrategy implements ExtractionStrategy {

    public static final String NAME = "article_parser";

    private static final String[] PARAGRAPH_SELECTORS = {
            "article p",
            "main article p",
            "main p",
            "[itemprop=articleBody] p",
            "section[name=articleBody] p",
            "div[class*=article-body] p",
            "div[class*=articleBody] p",
            "div[class*=article__body] p",
            "div[data-component=text-block] p",
            "div[data-testid*=article] p"
    };

    private static final String[] BYLINE_SELECTORS = {
            "[rel=author]",
            "[itemprop=author]",
            "[class*=byline]",
            "[class*=author]",
            "[data-testid*=byline]",
            "meta[name=author]"
    };

    private final ConfidenceScorer scorer;

    public ArticleParserStrategy(ConfidenceScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<ContentRecord> extract(Page page) {
        Document doc = page.parse();
        doc.select("script, style, noscript, template").remove();

        Element h1 = doc.selectFirst("h1");
        String title = Html.firstNonBlank(h1 == null ? "" : Html.normalize(h1.text()),
                Html.meta(doc, "og:title"), doc.title());

        LinkedHashSet<String> paragraphs = new LinkedHashSet<>();
        for (String selector : PARAGRAPH_SELECTORS) {
            for (Element p : doc.select(selector)) {
                String t = Html.normalize(p.text());
                if (Html.looksLikeParagraph(t, title)) paragraphs.add(t);
            }
        }
        if (paragraphs.isEmpty()) densestBlock(doc, title, paragraphs);
        if (paragraphs.isEmpty()) return Optional.empty();
        String body = String.join("\n\n", paragraphs);

        String author = Html.firstNonBlank(Html.firstByline(doc, BYLINE_SELECTORS, 140),
                Html.cleanAuthor(Html.firstMeta(doc, Html.AUTHOR_META_KEYS)));
        Element time = doc.selectFirst("time[datetime]");
        String dateRaw = Html.firstNonBlank(time == null ? "" : time.attr("datetime"),
                Html.firstMeta(doc, Html.DATE_META_KEYS));
        String description = Html.firstNonBlank(Html.meta(doc, "og:description"), Html.meta(doc, "description"));

        ContentRecord draft = ContentRecord.builder()
                .url(page.url()).title(title).author(author).description(description)
                .dateRaw(dateRaw).dateIso(DateNormalizer.toIso(dateRaw))
                .content(body).httpStatus(page.status())
                .build();
        double confidence = scorer.score(ConfidenceScorer.Weights.ARTICLE,
                draft.getWordCount(), title, author, dateRaw, description);
        return Optional.of(draft.toBuilder().confidence(confidence).build());
    }

    /** 유효 단락 글자 수 합이 가장 큰 부모 요소의 단락들 */
    private static void densestBlock(Document doc, String title, LinkedHashSet<String> out) {
        Map<Element, Integer> weight = new HashMap<>();
        for (Element p : doc.body() == null ? doc.select("p") : doc.body().select("p")) {
            Element parent = p.parent();
            if (parent == null) continue;
            String t = Html.normalize(p.text());
            if (Html.looksLikeParagraph(t, title)) weight.merge(parent, t.length(), Integer::sum);
        }
        Element best = null;
        int max = 0;
        for (Map.Entry<Element, Integer> e : weight.entrySet()) {
            if (e.getValue() > max) {
                max = e.getValue();
                best = e.getKey();
            }
        }
        if (best == null) return;
        for (Element p : best.children()) {
            if (!"p".equals(p.normalName())) continue;
            String t = Html.normalize(p.text());
            if (Html.looksLikeParagraph(t, title)) out.add(t);
        }
    }
}

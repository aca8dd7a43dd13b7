package com.newsenricher.core.extractor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsenricher.core.extractor.ConfidenceScorer;
import com.newsenricher.core.extractor.DateNormalizer;
import com.newsenricher.core.extractor.ExtractionStrategy;
import com.newsenricher.core.extractor.Page;
import com.newsenricher.core.model.ContentRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * 고정밀 추출: schema.org JSON-LD(NewsArticle 등)의 articleBody와 메타데이터,
 * 없으면 itemprop=articleBody 마크업을 본문으로 쓴다.
 * 구조화 마크업이 없는 페이지에서는 아무것도 내지 않는다.
 */
public final class StructuredMetadataStrategy implements ExtractionStrategy {

    public static final String NAME = "structured_metadata";

    private static final Logger LOG = LoggerFactory.getLogger(StructuredMetadataStrategy.class);

    private static final Set<String> ARTICLE_TYPES = Set.of(
            "Article", "NewsArticle", "ReportageNewsArticle", "AnalysisNewsArticle",
            "OpinionNewsArticle", "BackgroundNewsArticle", "BlogPosting", "Report");

    private final ObjectMapper json;
    private final ConfidenceScorer scorer;

    public StructuredMetadataStrategy(ObjectMapper json, ConfidenceScorer scorer) {
        this.json = Objects.requireNonNull(json, "json");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<ContentRecord> extract(Page page) {
        Document doc = page.parse();
        JsonNode article = findArticle(doc);

        String body = plain(text(article, "articleBody"));
        if (body.isEmpty()) body = microdataBody(doc);
        if (body.isEmpty()) return Optional.empty();

        String title = Html.firstNonBlank(text(article, "headline"), text(article, "name"),
                Html.meta(doc, "og:title"), doc.title());
        String author = Html.firstNonBlank(authorOf(article), Html.cleanAuthor(Html.firstMeta(doc, Html.AUTHOR_META_KEYS)));
        String dateRaw = Html.firstNonBlank(text(article, "datePublished"), text(article, "dateCreated"),
                Html.firstMeta(doc, Html.DATE_META_KEYS), timeAttr(doc));
        String description = Html.firstNonBlank(text(article, "description"),
                Html.meta(doc, "og:description"), Html.meta(doc, "description"));

        ContentRecord draft = ContentRecord.builder()
                .url(page.url()).title(title).author(author).description(description)
                .dateRaw(dateRaw).dateIso(DateNormalizer.toIso(dateRaw))
                .content(body).httpStatus(page.status())
                .build();
        double confidence = scorer.score(ConfidenceScorer.Weights.STRUCTURED,
                draft.getWordCount(), title, author, dateRaw, description);
        return Optional.of(draft.toBuilder().confidence(confidence).build());
    }

    // ---------- JSON-LD ----------

    private JsonNode findArticle(Document doc) {
        for (Element script : doc.select("script[type='application/ld+json']")) {
            String data = script.data().strip();
            if (data.isEmpty()) continue;
            try {
                JsonNode hit = walk(json.readTree(data));
                if (hit != null) return hit;
            } catch (JsonProcessingException e) {
                LOG.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }
        return null;
    }

    /** 배열, @graph, mainEntity 안쪽까지 기사 타입 노드를 찾는다 */
    private static JsonNode walk(JsonNode node) {
        if (node == null) return null;
        if (node.isArray()) {
            for (JsonNode child : node) {
                JsonNode hit = walk(child);
                if (hit != null) return hit;
            }
            return null;
        }
        if (!node.isObject()) return null;
        if (isArticleType(node.get("@type"))) return node;
        JsonNode hit = walk(node.get("@graph"));
        return hit != null ? hit : walk(node.get("mainEntity"));
    }

    private static boolean isArticleType(JsonNode type) {
        if (type == null) return false;
        if (type.isTextual()) return ARTICLE_TYPES.contains(type.asText());
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.isTextual() && ARTICLE_TYPES.contains(t.asText())) return true;
            }
        }
        return false;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) return "";
        JsonNode v = node.get(field);
        return (v != null && v.isValueNode()) ? v.asText("").strip() : "";
    }

    /** author: 문자열 / {name} / [{name}, ...] */
    private static String authorOf(JsonNode article) {
        if (article == null) return "";
        JsonNode a = article.get("author");
        if (a == null) return "";
        if (a.isTextual()) return Html.cleanAuthor(a.asText());
        if (a.isObject()) return Html.cleanAuthor(text(a, "name"));
        if (a.isArray()) {
            StringJoiner names = new StringJoiner(", ");
            for (JsonNode each : a) {
                String n = each.isTextual() ? Html.cleanAuthor(each.asText()) : Html.cleanAuthor(text(each, "name"));
                if (!n.isEmpty()) names.add(n);
            }
            return names.toString();
        }
        return "";
    }

    // ---------- microdata ----------

    private static String microdataBody(Document doc) {
        Element body = doc.selectFirst("[itemprop=articleBody]");
        if (body == null) return "";
        StringJoiner out = new StringJoiner("\n\n");
        for (Element p : body.select("p")) {
            String t = Html.normalize(p.text());
            if (!t.isEmpty()) out.add(t);
        }
        String joined = out.toString();
        return joined.isEmpty() ? Html.normalize(body.text()) : joined;
    }

    private static String timeAttr(Document doc) {
        Element t = doc.selectFirst("time[datetime]");
        return t == null ? "" : t.attr("datetime");
    }

    /** articleBody 안에 마크업이 섞여 오는 경우 */
    private static String plain(String s) {
        if (s.indexOf('<') < 0) return Html.normalize(s);
        return Html.normalize(Jsoup.parse(s).text());
    }
}

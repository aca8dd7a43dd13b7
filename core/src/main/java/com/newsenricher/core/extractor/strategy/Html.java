package com.newsenricher.core.extractor.strategy;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Locale;

/** 추출 전략 공용 DOM 헬퍼 */
final class Html {

    static final String[] AUTHOR_META_KEYS = {
            "author", "article:author", "parsely-author", "dc.creator", "dcterms.creator", "byl"
    };

    static final String[] DATE_META_KEYS = {
            "article:published_time",
            "og:published_time",
            "parsely-pub-date",
            "pubdate",
            "publish-date",
            "publish_date",
            "date",
            "dc.date",
            "dcterms.created",
            "article:modified_time",
            "og:updated_time",
            "dcterms.modified"
    };

    private Html() {}

    /** meta property/name/itemprop 순으로 content 값 */
    static String meta(Document doc, String key) {
        return firstNonBlank(
                contentOf(doc.selectFirst("meta[property='" + key + "']")),
                contentOf(doc.selectFirst("meta[name='" + key + "']")),
                contentOf(doc.selectFirst("meta[itemprop='" + key + "']")));
    }

    static String firstMeta(Document doc, String[] keys) {
        for (String key : keys) {
            String v = meta(doc, key);
            if (!v.isEmpty()) return v;
        }
        return "";
    }

    /** 셀렉터 순서대로 첫 번째 의미 있는 바이라인. meta 요소는 content 사용 */
    static String firstByline(Document doc, String[] selectors, int maxLen) {
        for (String selector : selectors) {
            for (Element el : doc.select(selector)) {
                String raw = "meta".equalsIgnoreCase(el.tagName()) ? el.attr("content") : el.text();
                String author = cleanAuthor(raw);
                if (author.isEmpty() || author.length() > maxLen) continue;
                return author;
            }
        }
        return "";
    }

    /** "By ..."/"Por ..." 접두, 파이프 뒤 꼬리 제거. 날짜/링크처럼 보이면 빈 문자열 */
    static String cleanAuthor(String author) {
        String t = normalize(author);
        if (t.isEmpty()) return "";
        t = t.replaceFirst("(?i)^(by|por)\\s+", "");
        t = t.replaceFirst("(?i)^(author|autor):\\s*", "");
        t = t.replaceAll("\\s*\\|\\s*.+$", "").strip();
        if (t.length() > 120) return "";

        String low = t.toLowerCase(Locale.ROOT);
        if (low.startsWith("http://") || low.startsWith("https://")) return "";
        if (low.contains("read more") || low.contains("subscribe")) return "";
        if (low.matches(".*\\d{4}.*")) return "";
        return t;
    }

    /** 본문 단락 후보 필터 (광고/저작권/구독 안내 제외) */
    static boolean looksLikeParagraph(String text, String title) {
        if (text.length() < 35) return false;
        if (!title.isEmpty() && text.equalsIgnoreCase(title.strip())) return false;

        String low = text.toLowerCase(Locale.ROOT);
        if (low.startsWith("by ") || low.startsWith("por ")) return false;
        if (low.startsWith("read more") || low.startsWith("lee también") || low.startsWith("leer más")) return false;
        if (low.startsWith("sign up") || low.startsWith("subscribe") || low.startsWith("suscríbete")) return false;
        if (low.startsWith("advertisement") || low.startsWith("publicidad")) return false;
        if (low.startsWith("copyright") || low.contains("all rights reserved")
                || low.contains("todos los derechos reservados")) return false;
        return !low.contains("cookie policy") && !low.contains("política de cookies");
    }

    static String normalize(String text) {
        if (text == null) return "";
        return text.replace('\u00A0', ' ').replaceAll("\\s+", " ").strip();
    }

    static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.strip();
        }
        return "";
    }

    private static String contentOf(Element el) {
        return el == null ? "" : el.attr("content").strip();
    }
}

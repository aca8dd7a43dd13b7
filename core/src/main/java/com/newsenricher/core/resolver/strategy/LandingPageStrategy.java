package com.newsenricher.core.resolver.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.model.HttpResponseData;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.resolver.ExternalUrlPolicy;
import com.newsenricher.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 집계 서비스의 기사 랜딩 페이지를 받아 우선순위대로 목적지 URL을 찾는다:
 * canonical → og:url → amphtml → JSON-LD(url, mainEntityOfPage, @id) → 인라인 스크립트 URL → 첫 외부 앵커.
 * 앵커가 집계 서비스 자신을 가리키면 그 쿼리 파라미터에서 다시 추출한다.
 */
public final class LandingPageStrategy extends NetworkStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(LandingPageStrategy.class);

    public static final String NAME = "resolve_via_articles";

    static final List<String> LD_KEYS = List.of("url", "mainEntityOfPage", "@id");
    static final Pattern SCRIPT_URL = Pattern.compile("https?://[^\\s\"'<>]+");

    private final String aggregatorBaseUrl;
    private final QueryParamStrategy params;
    private final ObjectMapper json;

    public LandingPageStrategy(IHttpFetcher http, RateLimiter limiter, ExternalUrlPolicy policy,
                               String aggregatorBaseUrl, QueryParamStrategy params, ObjectMapper json) {
        super(http, limiter, policy);
        this.aggregatorBaseUrl = aggregatorBaseUrl;
        this.params = Objects.requireNonNull(params, "params");
        this.json = Objects.requireNonNull(json, "json");
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<String> attempt(String indirectUrl) throws InterruptedException {
        String token = articleToken(indirectUrl);
        if (token == null) return Optional.empty();

        String pageUrl = withQuery(aggregatorBaseUrl + "/articles/" + token, indirectUrl);
        HttpResponseData resp = fetchOk(pageUrl);
        if (resp == null) return Optional.empty();

        return findDestination(Jsoup.parse(resp.getBody(), pageUrl));
    }

    Optional<String> findDestination(Document doc) {
        // 1~3. link/meta 태그
        Optional<String> hit = attr(doc, "link[rel=canonical]", "href")
                .or(() -> attr(doc, "meta[property='og:url']", "content"))
                .or(() -> attr(doc, "link[rel=amphtml]", "href"));
        if (hit.isPresent()) return hit;

        // 4. JSON-LD
        for (Element script : doc.select("script[type='application/ld+json']")) {
            hit = fromLinkedData(script.data());
            if (hit.isPresent()) return hit;
        }

        // 5. 인라인 스크립트에 박힌 URL
        for (Element script : doc.select("script")) {
            Matcher m = SCRIPT_URL.matcher(script.data());
            while (m.find()) {
                String found = UrlUtils.trimTrailingPunctuation(m.group());
                if (policy.isValidExternal(found)) return Optional.of(found);
            }
        }

        // 6. 앵커
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            if (!href.startsWith("http")) href = a.absUrl("href");
            if (policy.isValidExternal(href)) return Optional.of(href);
            if (policy.isBlockedFamily(href)) {
                hit = params.extract(href);
                if (hit.isPresent()) return hit;
            }
        }
        return Optional.empty();
    }

    private Optional<String> attr(Document doc, String css, String attr) {
        Element e = doc.selectFirst(css);
        if (e == null) return Optional.empty();
        String v = e.attr(attr).trim();
        return policy.isValidExternal(v) ? Optional.of(v) : Optional.empty();
    }

    private Optional<String> fromLinkedData(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        final JsonNode root;
        try {
            root = json.readTree(raw);
        } catch (Exception e) {
            LOG.debug("Invalid JSON-LD block skipped: {}", e.getMessage());
            return Optional.empty();
        }
        Iterable<JsonNode> items = root.isArray() ? root : List.of(root);
        for (JsonNode item : items) {
            if (!item.isObject()) continue;
            for (String key : LD_KEYS) {
                JsonNode v = item.get(key);
                if (v != null && v.isTextual() && policy.isValidExternal(v.asText())) {
                    return Optional.of(v.asText());
                }
            }
        }
        return Optional.empty();
    }
}

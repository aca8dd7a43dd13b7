package com.newsenricher.core.resolver.strategy;

import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.model.HttpResponseData;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.resolver.ExternalUrlPolicy;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 토큰으로 피드 URL을 만들어 첫 item의 link를 채택 */
public final class FeedStrategy extends NetworkStrategy {

    public static final String NAME = "resolve_via_rss";

    static final Pattern LINK_TAG = Pattern.compile("<link>(.*?)</link>", Pattern.DOTALL);

    private final String aggregatorBaseUrl;

    public FeedStrategy(IHttpFetcher http, RateLimiter limiter, ExternalUrlPolicy policy, String aggregatorBaseUrl) {
        super(http, limiter, policy);
        this.aggregatorBaseUrl = aggregatorBaseUrl;
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<String> attempt(String indirectUrl) throws InterruptedException {
        String token = articleToken(indirectUrl);
        if (token == null) return Optional.empty();

        String feedUrl = withQuery(aggregatorBaseUrl + "/rss/articles/" + token, indirectUrl);
        HttpResponseData resp = fetchOk(feedUrl);
        if (resp == null) return Optional.empty();

        return firstItemLink(resp.getBody());
    }

    Optional<String> firstItemLink(String xml) {
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        for (Element item : doc.select("item")) {
            Element link = item.selectFirst("link");
            if (link == null) continue;
            String href = link.text().trim();
            if (policy.isValidExternal(href)) return Optional.of(href);
        }
        // 파서가 놓친 경우 정규식 대체
        Matcher m = LINK_TAG.matcher(xml);
        while (m.find()) {
            String href = m.group(1).trim();
            if (policy.isValidExternal(href)) return Optional.of(href);
        }
        return Optional.empty();
    }
}

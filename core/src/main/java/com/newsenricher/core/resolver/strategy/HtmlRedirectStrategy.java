package com.newsenricher.core.resolver.strategy;

import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.model.HttpResponseData;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.resolver.ExternalUrlPolicy;
import com.newsenricher.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 페이지 본문에서 meta refresh → window/document.location 대입 → 본문 텍스트 URL 순으로 찾는다 */
public final class HtmlRedirectStrategy extends NetworkStrategy {

    public static final String NAME = "parse_html_advanced";

    static final Pattern REFRESH_URL = Pattern.compile("url=(.+)", Pattern.CASE_INSENSITIVE);
    static final List<Pattern> LOCATION_ASSIGN = List.of(
            Pattern.compile("window\\.location\\s*=\\s*['\"]([^'\"]+)['\"]"),
            Pattern.compile("document\\.location\\s*=\\s*['\"]([^'\"]+)['\"]"));
    static final Pattern TEXT_URL = Pattern.compile("https?://[^\\s<>\"]+");

    public HtmlRedirectStrategy(IHttpFetcher http, RateLimiter limiter, ExternalUrlPolicy policy) {
        super(http, limiter, policy);
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<String> attempt(String indirectUrl) throws InterruptedException {
        HttpResponseData resp = fetchOk(indirectUrl);
        if (resp == null) return Optional.empty();
        return findRedirect(Jsoup.parse(resp.getBody(), indirectUrl));
    }

    Optional<String> findRedirect(Document doc) {
        // 1. meta refresh
        for (Element meta : doc.select("meta[http-equiv]")) {
            if (!"refresh".equals(meta.attr("http-equiv").toLowerCase(Locale.ROOT))) continue;
            Matcher m = REFRESH_URL.matcher(meta.attr("content"));
            if (m.find()) {
                String target = strip(m.group(1).trim(), "'\"");
                if (policy.isValidExternal(target)) return Optional.of(target);
            }
            break;
        }

        // 2. 스크립트의 location 대입
        for (Element script : doc.select("script")) {
            String code = script.data();
            if (code.isEmpty()) continue;
            for (Pattern p : LOCATION_ASSIGN) {
                Matcher m = p.matcher(code);
                while (m.find()) {
                    if (policy.isValidExternal(m.group(1))) return Optional.of(m.group(1));
                }
            }
        }

        // 3. 본문 텍스트
        Matcher m = TEXT_URL.matcher(doc.text());
        while (m.find()) {
            String found = UrlUtils.trimTrailingPunctuation(m.group());
            if (policy.isValidExternal(found)) return Optional.of(found);
        }
        return Optional.empty();
    }

    private static String strip(String s, String chars) {
        int b = 0, e = s.length();
        while (b < e && chars.indexOf(s.charAt(b)) >= 0) b++;
        while (e > b && chars.indexOf(s.charAt(e - 1)) >= 0) e--;
        return s.substring(b, e);
    }
}

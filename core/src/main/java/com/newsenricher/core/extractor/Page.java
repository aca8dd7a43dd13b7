package com.newsenricher.core.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * 추출 대상 페이지 1회 fetch 결과.
 * 전략마다 DOM을 변형하므로 {@link #parse()}는 호출할 때마다 새 Document를 만든다.
 */
public record Page(String url, String finalUrl, int status, String html) {

    public Page {
        finalUrl = (finalUrl == null || finalUrl.isBlank()) ? url : finalUrl;
        html = (html == null) ? "" : html;
    }

    public boolean isOk() {
        return status >= 200 && status < 300 && !html.isBlank();
    }

    public Document parse() {
        return Jsoup.parse(html, finalUrl);
    }
}

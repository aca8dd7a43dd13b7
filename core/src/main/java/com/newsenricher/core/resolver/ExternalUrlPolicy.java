package com.newsenricher.core.resolver;

import com.newsenricher.core.util.UrlUtils;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * "유효한 외부 URL" 판정: http(s) 스킴 + 호스트가 집계 서비스 계열(동영상/이미지/정적 서브도메인 포함)이 아님.
 */
public final class ExternalUrlPolicy {

    private final List<String> blockedMarkers;

    public ExternalUrlPolicy(List<String> blockedMarkers) {
        Objects.requireNonNull(blockedMarkers, "blockedMarkers");
        this.blockedMarkers = blockedMarkers.stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }

    public boolean isValidExternal(String url) {
        if (url == null || url.isBlank()) return false;
        if (!(url.startsWith("http://") || url.startsWith("https://"))) return false;
        String host = UrlUtils.domainOf(url);
        if (host == null) return false;
        for (String m : blockedMarkers) {
            if (host.contains(m)) return false;
        }
        return true;
    }

    /** 집계 서비스 계열 호스트인지(재귀 파라미터 추출 판단용) */
    public boolean isBlockedFamily(String url) {
        String host = UrlUtils.domainOf(url);
        if (host == null) return false;
        for (String m : blockedMarkers) {
            if (host.contains(m)) return true;
        }
        return false;
    }

    public List<String> blockedMarkers() { return blockedMarkers; }
}

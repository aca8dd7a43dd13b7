package com.newsenricher.core.util;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;

/** URL 형태 판정 + 도메인 추출 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    private static final Pattern URL_SHAPE = Pattern.compile("^https?://[^\\s/$.?#][^\\s]*$", Pattern.CASE_INSENSITIVE);

    /** 텍스트 안에 박혀 있는 URL을 찾을 때 쓰는 패턴(제어문자/따옴표/꺾쇠에서 끊음) */
    public static final Pattern EMBEDDED_URL = Pattern.compile("https?://[^\\s\"'<>\\x00-\\x1f]+");

    /** URL 끝에 딸려 붙은 구두점/괄호를 떼어낸다 */
    public static String trimTrailingPunctuation(String url) {
        if (url == null) return null;
        int end = url.length();
        while (end > 0 && ".,;:)]}'\"".indexOf(url.charAt(end - 1)) >= 0) end--;
        return url.substring(0, end);
    }

    /** http(s) 스킴 + 호스트가 있는 "URL 모양" 문자열인지 */
    public static boolean isUrlShaped(String s) {
        if (s == null || s.isBlank()) return false;
        String t = s.trim();
        if (!URL_SHAPE.matcher(t).matches()) return false;
        return domainOf(t) != null;
    }

    /**
     * 호스트(소문자, 포트 제외). 파싱이 안 되면 스킴 뒤 첫 '/' 전까지를 잘라 쓴다.
     * 호스트를 알 수 없으면 null.
     */
    public static String domainOf(String url) {
        if (url == null || url.isBlank()) return null;
        String t = url.trim();
        try {
            String host = URI.create(t).getHost();
            if (host != null && !host.isBlank()) return host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException ignore) {
            // 인코딩이 깨진 URL도 많으므로 아래 수동 파싱으로 대체
        }
        int p = t.indexOf("://");
        if (p < 0) return null;
        String rest = t.substring(p + 3);
        int end = rest.length();
        for (char c : new char[]{'/', '?', '#'}) {
            int i = rest.indexOf(c);
            if (i >= 0 && i < end) end = i;
        }
        String authority = rest.substring(0, end);
        int at = authority.lastIndexOf('@');
        if (at >= 0) authority = authority.substring(at + 1);
        int colon = authority.indexOf(':');
        if (colon >= 0) authority = authority.substring(0, colon);
        return authority.isBlank() ? null : authority.toLowerCase(Locale.ROOT);
    }

    /** 출처 도메인 표기용: 호스트에서 "www." 제거 */
    public static String sourceDomain(String url) {
        String d = domainOf(url);
        if (d == null) return "";
        return d.startsWith("www.") ? d.substring(4) : d;
    }
}

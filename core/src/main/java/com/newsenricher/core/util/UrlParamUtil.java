package com.newsenricher.core.util;

import java.io.ByteArrayOutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * URL 쿼리 파라미터 유틸 (Java 17)
 * - 리디렉트 링크는 URI 규격을 어기는 경우가 많아 문자열 기준으로 관대하게 파싱한다.
 * - parseQuery: 단일값 맵(첫 값을 채택). parseQueryMulti: 다값 맵.
 * - unquote: '+'는 그대로 두는 퍼센트 디코딩(깨진 시퀀스는 원문 유지).
 */
public final class UrlParamUtil {
    private UrlParamUtil() {}

    /** '?' 뒤 ~ '#' 앞의 원시 쿼리. 없으면 빈 문자열. */
    public static String rawQuery(String url) {
        if (url == null) return "";
        int q = url.indexOf('?');
        if (q < 0) return "";
        int hash = url.indexOf('#', q);
        return hash < 0 ? url.substring(q + 1) : url.substring(q + 1, hash);
    }

    /** 단일값 쿼리 파싱(첫 값을 채택). 입력 순서 유지. */
    public static Map<String, String> parseQuery(String url) {
        Map<String, String> single = new LinkedHashMap<>();
        for (var e : parseQueryMulti(url).entrySet()) {
            List<String> vals = e.getValue();
            single.put(e.getKey(), vals.isEmpty() ? "" : vals.get(0));
        }
        return single;
    }

    /** 다값 쿼리 파싱. 입력 순서 유지. 값이 빈 항목은 버린다. */
    public static Map<String, List<String>> parseQueryMulti(String url) {
        Map<String, List<String>> m = new LinkedHashMap<>();
        String q = rawQuery(url);
        if (q.isEmpty()) return m;

        for (String p : q.split("[&;]")) {
            if (p.isEmpty()) continue;
            int i = p.indexOf('=');
            if (i <= 0 || i == p.length() - 1) continue;
            String k = dec(p.substring(0, i));
            String v = dec(p.substring(i + 1));
            m.computeIfAbsent(k, __ -> new ArrayList<>()).add(v);
        }
        return m;
    }

    /** 퍼센트 시퀀스만 디코딩. '+'는 공백으로 바꾸지 않는다. */
    public static String unquote(String s) {
        if (s == null || s.indexOf('%') < 0) return s;
        ByteArrayOutputStream out = new ByteArrayOutputStream(s.length());
        for (int i = 0; i < s.length(); ) {
            char c = s.charAt(i);
            if (c == '%' && i + 2 < s.length()) {
                int hi = Character.digit(s.charAt(i + 1), 16);
                int lo = Character.digit(s.charAt(i + 2), 16);
                if (hi >= 0 && lo >= 0) {
                    out.write((hi << 4) | lo);
                    i += 3;
                    continue;
                }
            }
            int cp = s.codePointAt(i);
            byte[] raw = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
            out.write(raw, 0, raw.length);
            i += Character.charCount(cp);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /** form 디코딩. 깨진 퍼센트 시퀀스면 unquote로 대체. */
    private static String dec(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return unquote(s.replace('+', ' '));
        }
    }
}

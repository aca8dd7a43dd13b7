package com.newsenricher.core.resolver.strategy;

import com.newsenricher.core.resolver.ExternalUrlPolicy;
import com.newsenricher.core.util.UrlUtils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * base64 후보 문자열을 패딩 4종 × 알파벳 2종(표준/URL-safe)으로 디코딩해 보고,
 * 결과 텍스트에 박힌 외부 URL을 찾는다.
 */
final class Base64Texts {
    private Base64Texts() {}

    static final List<String> PADDINGS = List.of("", "=", "==", "===");

    /** 후보 순서대로 첫 번째 유효 외부 URL */
    static Optional<String> firstExternalUrl(Collection<String> candidates, ExternalUrlPolicy policy) {
        for (String candidate : candidates) {
            if (candidate == null || candidate.isEmpty()) continue;
            for (String padding : PADDINGS) {
                String test = candidate + padding;
                Optional<String> hit = scan(decodeStandard(test), policy);
                if (hit.isPresent()) return hit;
                hit = scan(decodeUrlSafe(test), policy);
                if (hit.isPresent()) return hit;
            }
        }
        return Optional.empty();
    }

    /** 디코딩된 텍스트에서 유효 외부 URL 검색 */
    static Optional<String> scan(String text, ExternalUrlPolicy policy) {
        if (text == null || text.isEmpty()) return Optional.empty();
        Matcher m = UrlUtils.EMBEDDED_URL.matcher(text);
        while (m.find()) {
            String found = UrlUtils.trimTrailingPunctuation(m.group());
            if (policy.isValidExternal(found)) return Optional.of(found);
        }
        return Optional.empty();
    }

    /** 표준 알파벳. 알파벳 밖 문자는 버리고 디코딩, 실패 시 null. URL-safe 문자가 섞이면 null */
    static String decodeStandard(String s) {
        if (s.indexOf('-') >= 0 || s.indexOf('_') >= 0) return null;
        return decode(Base64.getDecoder(), s.replaceAll("[^A-Za-z0-9+/=]", ""));
    }

    /** URL-safe 알파벳('+','/'도 허용해 변환) */
    static String decodeUrlSafe(String s) {
        String t = s.replace('+', '-').replace('/', '_').replaceAll("[^A-Za-z0-9_=-]", "");
        return decode(Base64.getUrlDecoder(), t);
    }

    private static String decode(Base64.Decoder decoder, String s) {
        if (s.isEmpty()) return null;
        try {
            byte[] bytes = decoder.decode(s);
            // 깨진 바이트는 U+FFFD로 바뀌는데, URL 경계로 쓰기 위해 공백 처리
            return new String(bytes, StandardCharsets.UTF_8).replace('\uFFFD', ' ');
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

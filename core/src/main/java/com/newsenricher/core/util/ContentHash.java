package com.newsenricher.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** 본문 다이제스트(MD5 소문자 hex). 빈 본문이면 빈 문자열. */
public final class ContentHash {
    private ContentHash() {}

    public static String of(String content) {
        if (content == null || content.isEmpty()) return "";
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK가 MD5를 제공해야 한다
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /** 공백 기준 단어 수 */
    public static int wordCount(String content) {
        if (content == null) return 0;
        String t = content.strip();
        return t.isEmpty() ? 0 : t.split("\\s+").length;
    }
}

package com.newsenricher.core.resolver.strategy;

import com.newsenricher.core.resolver.ExternalUrlPolicy;
import com.newsenricher.core.resolver.ResolutionStrategy;
import com.newsenricher.core.util.UrlParamUtil;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 알려진 경로 패턴에서 토큰을 뽑아 base64 변형(접두어 제거/알파벳 치환/패딩)으로 디코딩하고
 * 텍스트에 박힌 URL을 찾는다. 네트워크를 쓰지 않는다.
 */
public final class TokenDecodeStrategy implements ResolutionStrategy {

    public static final String NAME = "decode_cbm_advanced";

    static final List<Pattern> TOKEN_PATTERNS = List.of(
            Pattern.compile("/articles/([^?/]+)"),
            Pattern.compile("/read/([^?/]+)"),
            Pattern.compile("(C[AB][MEI0-9][A-Za-z0-9_\\-]+)"),
            Pattern.compile("articles%2F([^&]+)"),
            Pattern.compile("read%2F([^&]+)"));

    static final List<String> PREFIXES = List.of("CBM", "CAE", "CAI", "CB0", "CB1", "CB2");

    private final ExternalUrlPolicy policy;

    public TokenDecodeStrategy(ExternalUrlPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<String> attempt(String indirectUrl) {
        String token = extractToken(indirectUrl);
        if (token == null) return Optional.empty();
        return Base64Texts.firstExternalUrl(variants(token), policy);
    }

    /** 첫 번째로 맞는 패턴의 토큰(퍼센트 디코딩). 없으면 null */
    static String extractToken(String url) {
        if (url == null) return null;
        for (Pattern p : TOKEN_PATTERNS) {
            Matcher m = p.matcher(url);
            if (m.find()) return UrlParamUtil.unquote(m.group(1));
        }
        return null;
    }

    /** 원본, 접두어 제거본, 각각의 URL-safe→표준 치환본, %3D/%2B/%2F 복원본 */
    static Set<String> variants(String token) {
        String clean = token;
        for (String prefix : PREFIXES) {
            if (clean.startsWith(prefix)) clean = clean.substring(prefix.length());
        }
        Set<String> out = new LinkedHashSet<>();
        out.add(token);
        out.add(clean);
        out.add(token.replace('-', '+').replace('_', '/'));
        out.add(clean.replace('-', '+').replace('_', '/'));
        out.add(token.replace("%3D", "=").replace("%2B", "+").replace("%2F", "/"));
        return out;
    }
}

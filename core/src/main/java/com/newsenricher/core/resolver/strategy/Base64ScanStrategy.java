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

/** 최후 수단: URL 어디든 20자 이상 base64 모양 문자열을 모아 디코딩 변형을 시도 */
public final class Base64ScanStrategy implements ResolutionStrategy {

    public static final String NAME = "decode_base64_variations";

    static final List<Pattern> RUN_PATTERNS = List.of(
            Pattern.compile("([A-Za-z0-9+/=]{20,})"),
            Pattern.compile("([A-Za-z0-9_-]{20,})"),
            Pattern.compile("%3D([A-Za-z0-9+/%]+)%3D"));

    private final ExternalUrlPolicy policy;

    public Base64ScanStrategy(ExternalUrlPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<String> attempt(String indirectUrl) {
        return Base64Texts.firstExternalUrl(candidates(indirectUrl), policy);
    }

    static Set<String> candidates(String url) {
        Set<String> out = new LinkedHashSet<>();
        if (url == null) return out;
        for (Pattern p : RUN_PATTERNS) {
            Matcher m = p.matcher(url);
            while (m.find()) {
                String clean = UrlParamUtil.unquote(m.group(1));
                out.add(clean);
                out.add(clean.replace('-', '+').replace('_', '/'));
                out.add(clean.replace('+', '-').replace('/', '_'));
            }
        }
        return out;
    }
}

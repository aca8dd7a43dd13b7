package com.newsenricher.core.resolver.strategy;

import com.newsenricher.core.resolver.ExternalUrlPolicy;
import com.newsenricher.core.resolver.ResolutionStrategy;
import com.newsenricher.core.util.UrlParamUtil;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** 흔한 리다이렉트 파라미터(url, u, q, ...) 값을 디코딩해 외부 URL이면 채택 */
public final class QueryParamStrategy implements ResolutionStrategy {

    public static final String NAME = "extract_url_params";

    static final int MAX_DEPTH = 3;

    private final ExternalUrlPolicy policy;
    private final List<String> paramNames;

    public QueryParamStrategy(ExternalUrlPolicy policy, List<String> paramNames) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.paramNames = List.copyOf(paramNames);
    }

    @Override public String name() { return NAME; }

    @Override
    public Optional<String> attempt(String indirectUrl) {
        return extract(indirectUrl);
    }

    /** 다른 전략(랜딩 페이지의 집계 서비스 링크)에서도 재사용 */
    public Optional<String> extract(String url) {
        return extract(url, 0);
    }

    /** 값이 다시 집계 서비스 URL이면 그 쿼리로 한 단계씩 내려간다(최대 MAX_DEPTH) */
    private Optional<String> extract(String url, int depth) {
        Map<String, List<String>> params = UrlParamUtil.parseQueryMulti(url);
        for (String name : paramNames) {
            List<String> values = params.get(name);
            if (values == null || values.isEmpty()) continue;
            // 파라미터 디코딩 후 한 번 더 unquote (이중 인코딩 링크 대응)
            String candidate = UrlParamUtil.unquote(values.get(0));
            if (policy.isValidExternal(candidate)) return Optional.of(candidate);
            if (depth < MAX_DEPTH && policy.isBlockedFamily(candidate)) {
                Optional<String> nested = extract(candidate, depth + 1);
                if (nested.isPresent()) return nested;
            }
        }
        return Optional.empty();
    }
}

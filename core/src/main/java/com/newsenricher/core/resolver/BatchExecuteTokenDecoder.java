package com.newsenricher.core.resolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.newsenricher.core.api.IHttpFetcher;
import com.newsenricher.core.model.HttpResponseData;
import com.newsenricher.core.ratelimit.RateLimiter;
import com.newsenricher.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 집계 서비스 batchexecute 엔드포인트로 기사 토큰을 디코딩한다.
 * <ol>
 *   <li>기사 페이지(/articles/{token})에서 서명(data-n-a-sg)과 타임스탬프(data-n-a-ts)를 읽고</li>
 *   <li>f.req 폼으로 batchexecute에 POST, 응답 JSON 봉투에서 URL을 꺼낸다.</li>
 * </ol>
 * 두 요청 모두 RateLimiter를 거친다.
 */
public final class BatchExecuteTokenDecoder implements TokenDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(BatchExecuteTokenDecoder.class);

    public static final String NAME = "batchexecute_decoder";

    static final String RPC_ID = "Fbv4je";
    static final String ENDPOINT = "/_/DotsSplashUi/data/batchexecute";

    private final IHttpFetcher http;
    private final RateLimiter limiter;
    private final ExternalUrlPolicy policy;
    private final String aggregatorBaseUrl;
    private final String aggregatorHost;
    private final ObjectMapper json;

    public BatchExecuteTokenDecoder(IHttpFetcher http, RateLimiter limiter, ExternalUrlPolicy policy,
                                    String aggregatorBaseUrl, ObjectMapper json) {
        this.http = Objects.requireNonNull(http, "http");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.aggregatorBaseUrl = Objects.requireNonNull(aggregatorBaseUrl, "aggregatorBaseUrl");
        this.aggregatorHost = UrlUtils.domainOf(aggregatorBaseUrl);
        this.json = Objects.requireNonNull(json, "json");
    }

    @Override public String name() { return NAME; }

    @Override
    public boolean supports(String indirectUrl) {
        return aggregatorHost != null
                && aggregatorHost.equals(UrlUtils.domainOf(indirectUrl))
                && tokenOf(indirectUrl) != null;
    }

    @Override
    public Optional<String> decode(String indirectUrl) throws Exception {
        String token = tokenOf(indirectUrl);
        if (token == null) return Optional.empty();

        // 1) 서명/타임스탬프
        String pageUrl = aggregatorBaseUrl + "/articles/" + token;
        limiter.waitIfNeeded(pageUrl);
        HttpResponseData page = http.get(pageUrl);
        limiter.recordResponse(pageUrl, page);
        if (!page.isOk()) return Optional.empty();

        Document doc = Jsoup.parse(page.getBody(), pageUrl);
        Element holder = doc.selectFirst("[data-n-a-sg][data-n-a-ts]");
        if (holder == null) {
            LOG.debug("Decoding params not found on {}", pageUrl);
            return Optional.empty();
        }
        String signature = holder.attr("data-n-a-sg");
        String timestamp = holder.attr("data-n-a-ts");

        // 2) batchexecute
        String endpoint = aggregatorBaseUrl + ENDPOINT;
        limiter.waitIfNeeded(endpoint);
        HttpResponseData resp = http.postForm(endpoint, Map.of("f.req", requestPayload(token, timestamp, signature)),
                Map.of("Referer", aggregatorBaseUrl + "/"));
        limiter.recordResponse(endpoint, resp);
        if (!resp.isOk()) return Optional.empty();

        return parseResponse(resp.getBody()).filter(policy::isValidExternal);
    }

    /** 경로 끝 토큰: .../articles/{token} 또는 .../read/{token} */
    static String tokenOf(String url) {
        if (url == null) return null;
        String path = url;
        int q = path.indexOf('?');
        if (q >= 0) path = path.substring(0, q);
        int hash = path.indexOf('#');
        if (hash >= 0) path = path.substring(0, hash);
        String[] parts = path.split("/");
        if (parts.length < 2) return null;
        String kind = parts[parts.length - 2];
        String token = parts[parts.length - 1];
        if (!("articles".equals(kind) || "read".equals(kind)) || token.isBlank()) return null;
        return token;
    }

    /** f.req 값: [[["Fbv4je", "<inner json>", null, "generic"]]] */
    String requestPayload(String token, String timestamp, String signature) throws JsonProcessingException {
        ArrayNode inner = json.createArrayNode();
        inner.add("garturlreq");
        inner.add(json.readTree(
                "[[\"X\",\"X\",[\"X\",\"X\"],null,null,1,1,\"US:en\",null,1,null,null,null,null,null,0,1],"
                        + "\"X\",\"X\",1,[1,1,1],1,1,null,0,0,null,0]"));
        inner.add(token);
        inner.add(parseTimestamp(timestamp));
        inner.add(signature);

        ArrayNode call = json.createArrayNode();
        call.add(RPC_ID);
        call.add(json.writeValueAsString(inner));
        call.addNull();
        call.add("generic");

        ArrayNode outer = json.createArrayNode();
        outer.addArray().add(call);
        return json.writeValueAsString(outer);
    }

    /**
     * 응답 형식: ")]}'" + 빈 줄 + JSON 배열. 첫 항목 [2]가 문자열 JSON이고 그 [1]이 URL.
     */
    Optional<String> parseResponse(String body) {
        if (body == null) return Optional.empty();
        String[] chunks = body.split("\n\n", 3);
        if (chunks.length < 2) return Optional.empty();
        try {
            JsonNode envelope = json.readTree(chunks[1]);
            JsonNode first = envelope.path(0);
            JsonNode payload = first.path(2);
            if (!payload.isTextual()) return Optional.empty();
            JsonNode decoded = json.readTree(payload.asText());
            JsonNode url = decoded.path(1);
            return url.isTextual() ? Optional.of(url.asText()) : Optional.empty();
        } catch (Exception e) {
            LOG.debug("Unexpected batchexecute response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static long parseTimestamp(String ts) {
        try {
            return Long.parseLong(ts.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}

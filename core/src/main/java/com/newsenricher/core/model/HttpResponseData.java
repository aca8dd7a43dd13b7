package com.newsenricher.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** HTTP 응답 캡처(본문은 텍스트). 전송 실패는 statusCode -1 + error 메시지. */
public final class HttpResponseData {
    private final String url;
    private final String finalUrl;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;
    private final String error;

    private HttpResponseData(Builder b) {
        this.url = b.url;
        this.finalUrl = (b.finalUrl == null) ? b.url : b.finalUrl;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
        this.error = b.error;
    }

    /** 요청한 URL */
    public String getUrl() { return url; }
    /** 리다이렉트를 모두 따라간 뒤의 URL */
    public String getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public String getError() { return error; }

    /** 2xx 여부 */
    public boolean isOk() { return statusCode >= 200 && statusCode < 300; }

    /** 전송 자체가 실패(-1)했는지 */
    public boolean isTransportFailure() { return statusCode == -1; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    /** 전송 실패 응답 */
    public static HttpResponseData failure(String url, long elapsedMs, String error) {
        return builder().url(url).statusCode(-1).responseTimeMs(elapsedMs).error(error).build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String finalUrl;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private long responseTimeMs;
        private String error;

        public Builder url(String url) { this.url = url; return this; }
        public Builder finalUrl(String finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public HttpResponseData build() {
            Objects.requireNonNull(url, "url");
            return new HttpResponseData(this);
        }
    }
}

package com.newsenricher.core.model;

import com.newsenricher.core.util.UrlUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 입력 URL 한 건의 배치 결과 (direct_url, method, content, metadata) + 부가 정보.
 * metadata 키: title, author, date, confidence. 추출을 하지 않았으면 빈 맵.
 */
public record EnrichmentResult(
        String inputUrl,
        String directUrl,
        String method,
        String content,
        Map<String, Object> metadata,
        ProcessingStatus status,
        ErrorKind errorKind,
        int attempts,
        long processingTimeMs,
        String sourceDomain
) {
    public EnrichmentResult {
        directUrl = (directUrl == null) ? "" : directUrl;
        content = (content == null) ? "" : content;
        metadata = (metadata == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** 해석 결과 + (있으면) 추출 결과로 조립 */
    public static EnrichmentResult of(String inputUrl, ResolvedUrl r, ContentRecord c, long elapsedMs) {
        boolean hasContent = c != null && c.hasContent();
        ProcessingStatus st = ProcessingStatus.of(r.method(), hasContent);
        return new EnrichmentResult(
                inputUrl,
                r.url(),
                r.method(),
                hasContent ? c.getContent() : "",
                c == null ? Map.of() : metadataOf(c),
                st,
                errorKindOf(st),
                r.rounds(),
                elapsedMs,
                UrlUtils.sourceDomain(r.url()));
    }

    /** 항목 단위 예외 → error 센티넬 결과 */
    public static EnrichmentResult error(String inputUrl, ErrorKind kind, long elapsedMs) {
        return new EnrichmentResult(inputUrl, "", ResolvedUrl.ERROR, "", Map.of(),
                ProcessingStatus.ERROR, kind, 0, elapsedMs, "");
    }

    /** 차단기 작동 도메인 → 입력 URL 그대로, domain_aborted 태그 */
    public static EnrichmentResult aborted(String inputUrl, long elapsedMs) {
        return new EnrichmentResult(inputUrl, inputUrl, ResolvedUrl.DOMAIN_ABORTED, "", Map.of(),
                ProcessingStatus.ABORTED, ErrorKind.DOMAIN_ABORTED, 0, elapsedMs,
                UrlUtils.sourceDomain(inputUrl));
    }

    /** 해석은 끝났지만 추출 도메인의 차단기가 작동한 경우: 해석 결과는 보존 */
    public static EnrichmentResult abortedExtraction(String inputUrl, ResolvedUrl r, long elapsedMs) {
        return new EnrichmentResult(inputUrl, r.url(), r.method(), "", Map.of(),
                ProcessingStatus.ABORTED, ErrorKind.DOMAIN_ABORTED, r.rounds(), elapsedMs,
                UrlUtils.sourceDomain(r.url()));
    }

    public boolean isSuccess() { return status == ProcessingStatus.SUCCESS; }

    static Map<String, Object> metadataOf(ContentRecord c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("title", c.getTitle());
        m.put("author", c.getAuthor());
        m.put("date", c.getDateIso());
        m.put("confidence", c.getConfidence());
        return m;
    }

    private static ErrorKind errorKindOf(ProcessingStatus st) {
        switch (st) {
            case INVALID_INPUT: return ErrorKind.INVALID_INPUT;
            case UNRESOLVED:    return ErrorKind.UNRESOLVED;
            case NO_CONTENT:    return ErrorKind.EXTRACTION_FAILED;
            case ABORTED:       return ErrorKind.DOMAIN_ABORTED;
            case ERROR:         return ErrorKind.NETWORK_ERROR;
            default:            return null;
        }
    }
}

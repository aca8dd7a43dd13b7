package com.newsenricher.core.model;

import com.newsenricher.core.util.ContentHash;

import java.time.Instant;
import java.util.Objects;

/**
 * content_cache 테이블 한 행(추출된 기사 구조).
 * wordCount/contentHash는 content에서 파생되므로 빌더에서 계산한다.
 */
public final class ContentRecord {

    /** 모든 추출 전략이 실패했을 때의 태그 */
    public static final String FAILED = "failed";

    private final String url;
    private final String title;
    private final String author;
    private final String description;
    private final String dateRaw;
    private final String dateIso;
    private final String content;
    private final int wordCount;
    private final int httpStatus;
    private final String extractionMethod;
    private final String contentHash;
    private final double confidence;
    private final Instant cachedAt;

    private ContentRecord(Builder b) {
        this.url = b.url;
        this.title = nz(b.title);
        this.author = nz(b.author);
        this.description = nz(b.description);
        this.dateRaw = nz(b.dateRaw);
        this.dateIso = nz(b.dateIso);
        this.content = nz(b.content);
        this.wordCount = ContentHash.wordCount(this.content);
        this.httpStatus = b.httpStatus;
        this.extractionMethod = (b.extractionMethod == null) ? FAILED : b.extractionMethod;
        this.contentHash = ContentHash.of(this.content);
        this.confidence = Math.max(0.0, Math.min(1.0, b.confidence));
        this.cachedAt = b.cachedAt;
    }

    /** 추출 실패 레코드(본문 없음, confidence 0) */
    public static ContentRecord failed(String url) {
        return builder().url(url).extractionMethod(FAILED).confidence(0.0).build();
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getAuthor() { return author; }
    public String getDescription() { return description; }
    public String getDateRaw() { return dateRaw; }
    public String getDateIso() { return dateIso; }
    public String getContent() { return content; }
    public int getWordCount() { return wordCount; }
    public int getHttpStatus() { return httpStatus; }
    public String getExtractionMethod() { return extractionMethod; }
    public String getContentHash() { return contentHash; }
    public double getConfidence() { return confidence; }
    /** 캐시에 저장된 시각. 아직 저장 전이면 null */
    public Instant getCachedAt() { return cachedAt; }

    public boolean isFailed() { return FAILED.equals(extractionMethod); }
    public boolean hasContent() { return !content.isEmpty(); }

    public Builder toBuilder() {
        return builder()
                .url(url).title(title).author(author).description(description)
                .dateRaw(dateRaw).dateIso(dateIso).content(content)
                .httpStatus(httpStatus).extractionMethod(extractionMethod)
                .confidence(confidence).cachedAt(cachedAt);
    }

    private static String nz(String s) { return s == null ? "" : s; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentRecord r)) return false;
        return wordCount == r.wordCount
                && httpStatus == r.httpStatus
                && Double.compare(confidence, r.confidence) == 0
                && url.equals(r.url)
                && title.equals(r.title)
                && author.equals(r.author)
                && description.equals(r.description)
                && dateRaw.equals(r.dateRaw)
                && dateIso.equals(r.dateIso)
                && content.equals(r.content)
                && extractionMethod.equals(r.extractionMethod)
                && Objects.equals(cachedAt, r.cachedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, extractionMethod, contentHash, confidence, cachedAt);
    }

    @Override
    public String toString() {
        return "ContentRecord{url=" + url + ", method=" + extractionMethod
                + ", words=" + wordCount + ", confidence=" + confidence + '}';
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String title;
        private String author;
        private String description;
        private String dateRaw;
        private String dateIso;
        private String content;
        private int httpStatus;
        private String extractionMethod;
        private double confidence;
        private Instant cachedAt;

        public Builder url(String url) { this.url = url; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder dateRaw(String dateRaw) { this.dateRaw = dateRaw; return this; }
        public Builder dateIso(String dateIso) { this.dateIso = dateIso; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder httpStatus(int httpStatus) { this.httpStatus = httpStatus; return this; }
        public Builder extractionMethod(String m) { this.extractionMethod = m; return this; }
        public Builder confidence(double confidence) { this.confidence = confidence; return this; }
        public Builder cachedAt(Instant cachedAt) { this.cachedAt = cachedAt; return this; }

        public ContentRecord build() {
            Objects.requireNonNull(url, "url");
            return new ContentRecord(this);
        }
    }
}

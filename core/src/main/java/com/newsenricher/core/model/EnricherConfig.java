package com.newsenricher.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 인리처 설정 (enricher.yml 매핑 대상): 순수 설정 보관용.
 * CLI 플래그는 App 쪽에서 로드 후 덮어쓴다.
 */
public final class EnricherConfig {

    /** 토큰 디코더 선택 */
    public enum DecoderKind { BATCH_EXECUTE, NONE }

    /** 도메인별 요청 간격/백오프/차단기: YAML `rate:` 섹션 */
    public static final class RateCfg {
        private long minDelayMs = 800;                // 일반 도메인 간격 하한
        private long maxDelayMs = 2000;               // 일반 도메인 간격 상한
        private long aggregatorBaseDelayMs = 2500;    // 집계 도메인 기본 간격
        private long aggregatorJitterMs = 4000;       // [base, base+jitter]
        private long aggregatorInitialMinMs = 2000;   // 첫 요청 대기
        private long aggregatorInitialMaxMs = 4000;
        private long aggregatorGrowthPer = 100;       // 요청 N건마다 기본 간격 +1s
        private int extraPauseEvery = 100;            // N건마다 추가 휴식
        private long extraPauseMinMs = 10_000;
        private long extraPauseMaxMs = 20_000;
        private int backoffAfterErrors = 2;           // 이 값을 넘기면 백오프
        private int abortAfterErrors = 4;             // 이 값을 넘기면 차단기
        private int maxBackoffSeconds = 30;
        private long aggregatorDailyLimit = Long.MAX_VALUE; // 사실상 무제한
        private long dailyLimitPauseMs = 3_600_000;

        public long getMinDelayMs() { return minDelayMs; }
        public RateCfg setMinDelayMs(long v) { this.minDelayMs = Math.max(0, v); return this; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public RateCfg setMaxDelayMs(long v) { this.maxDelayMs = Math.max(0, v); return this; }
        public long getAggregatorBaseDelayMs() { return aggregatorBaseDelayMs; }
        public RateCfg setAggregatorBaseDelayMs(long v) { this.aggregatorBaseDelayMs = Math.max(0, v); return this; }
        public long getAggregatorJitterMs() { return aggregatorJitterMs; }
        public RateCfg setAggregatorJitterMs(long v) { this.aggregatorJitterMs = Math.max(0, v); return this; }
        public long getAggregatorInitialMinMs() { return aggregatorInitialMinMs; }
        public RateCfg setAggregatorInitialMinMs(long v) { this.aggregatorInitialMinMs = Math.max(0, v); return this; }
        public long getAggregatorInitialMaxMs() { return aggregatorInitialMaxMs; }
        public RateCfg setAggregatorInitialMaxMs(long v) { this.aggregatorInitialMaxMs = Math.max(0, v); return this; }
        public long getAggregatorGrowthPer() { return aggregatorGrowthPer; }
        public RateCfg setAggregatorGrowthPer(long v) { this.aggregatorGrowthPer = Math.max(1, v); return this; }
        public int getExtraPauseEvery() { return extraPauseEvery; }
        public RateCfg setExtraPauseEvery(int v) { this.extraPauseEvery = Math.max(0, v); return this; }
        public long getExtraPauseMinMs() { return extraPauseMinMs; }
        public RateCfg setExtraPauseMinMs(long v) { this.extraPauseMinMs = Math.max(0, v); return this; }
        public long getExtraPauseMaxMs() { return extraPauseMaxMs; }
        public RateCfg setExtraPauseMaxMs(long v) { this.extraPauseMaxMs = Math.max(0, v); return this; }
        public int getBackoffAfterErrors() { return backoffAfterErrors; }
        public RateCfg setBackoffAfterErrors(int v) { this.backoffAfterErrors = Math.max(0, v); return this; }
        public int getAbortAfterErrors() { return abortAfterErrors; }
        public RateCfg setAbortAfterErrors(int v) { this.abortAfterErrors = Math.max(1, v); return this; }
        public int getMaxBackoffSeconds() { return maxBackoffSeconds; }
        public RateCfg setMaxBackoffSeconds(int v) { this.maxBackoffSeconds = Math.max(0, v); return this; }
        public long getAggregatorDailyLimit() { return aggregatorDailyLimit; }
        public RateCfg setAggregatorDailyLimit(long v) { this.aggregatorDailyLimit = v <= 0 ? Long.MAX_VALUE : v; return this; }
        public long getDailyLimitPauseMs() { return dailyLimitPauseMs; }
        public RateCfg setDailyLimitPauseMs(long v) { this.dailyLimitPauseMs = Math.max(0, v); return this; }

        /** 지연 없는 설정(테스트/로컬 서버용) */
        public static RateCfg noDelay() {
            return new RateCfg()
                    .setMinDelayMs(0).setMaxDelayMs(0)
                    .setAggregatorBaseDelayMs(0).setAggregatorJitterMs(0)
                    .setAggregatorInitialMinMs(0).setAggregatorInitialMaxMs(0)
                    .setExtraPauseEvery(0);
        }
    }

    /** HTTP 세션: YAML `http:` 섹션 */
    public static final class HttpCfg {
        private Duration timeout = Duration.ofSeconds(20);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int maxRetries = 3;                 // 재시도 횟수(첫 시도 제외)
        private long retryBaseMs = 1000;
        private long retryMaxMs = 30_000;
        private double retryJitter = 0.1;
        private String acceptLanguage = "es-ES,es;q=0.9,en;q=0.8";

        public Duration getTimeout() { return timeout; }
        public HttpCfg setTimeout(Duration v) { if (v != null && !v.isNegative() && !v.isZero()) this.timeout = v; return this; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public HttpCfg setConnectTimeout(Duration v) { if (v != null && !v.isNegative() && !v.isZero()) this.connectTimeout = v; return this; }
        public int getMaxRetries() { return maxRetries; }
        public HttpCfg setMaxRetries(int v) { this.maxRetries = Math.max(0, v); return this; }
        public long getRetryBaseMs() { return retryBaseMs; }
        public HttpCfg setRetryBaseMs(long v) { this.retryBaseMs = Math.max(1, v); return this; }
        public long getRetryMaxMs() { return retryMaxMs; }
        public HttpCfg setRetryMaxMs(long v) { this.retryMaxMs = Math.max(1, v); return this; }
        public double getRetryJitter() { return retryJitter; }
        public HttpCfg setRetryJitter(double v) { this.retryJitter = Math.max(0.0, Math.min(1.0, v)); return this; }
        public String getAcceptLanguage() { return acceptLanguage; }
        public HttpCfg setAcceptLanguage(String v) { if (v != null && !v.isBlank()) this.acceptLanguage = v; return this; }
    }

    /** 해석기: YAML `resolver:` 섹션 */
    public static final class ResolverCfg {
        private String aggregatorBaseUrl = "https://news.google.com";
        private DecoderKind decoder = DecoderKind.BATCH_EXECUTE;
        private long roundPauseMinMs = 2000;
        private long roundPauseMaxMs = 4000;
        private List<String> blockedDomainMarkers = List.of(
                "google.", "gstatic.", "googleusercontent.", "googlevideo.", "youtube.", "youtu.be");
        private List<String> redirectParams = List.of(
                "url", "u", "q", "link", "redirect", "target", "dest", "goto", "out");

        public String getAggregatorBaseUrl() { return aggregatorBaseUrl; }
        public ResolverCfg setAggregatorBaseUrl(String v) {
            if (v != null && !v.isBlank()) this.aggregatorBaseUrl = v.endsWith("/") ? v.substring(0, v.length() - 1) : v;
            return this;
        }
        public DecoderKind getDecoder() { return decoder; }
        public ResolverCfg setDecoder(DecoderKind v) { this.decoder = (v != null ? v : DecoderKind.NONE); return this; }
        public long getRoundPauseMinMs() { return roundPauseMinMs; }
        public ResolverCfg setRoundPauseMinMs(long v) { this.roundPauseMinMs = Math.max(0, v); return this; }
        public long getRoundPauseMaxMs() { return roundPauseMaxMs; }
        public ResolverCfg setRoundPauseMaxMs(long v) { this.roundPauseMaxMs = Math.max(0, v); return this; }
        public List<String> getBlockedDomainMarkers() { return blockedDomainMarkers; }
        public ResolverCfg setBlockedDomainMarkers(List<String> v) { if (v != null && !v.isEmpty()) this.blockedDomainMarkers = List.copyOf(v); return this; }
        public List<String> getRedirectParams() { return redirectParams; }
        public ResolverCfg setRedirectParams(List<String> v) { if (v != null && !v.isEmpty()) this.redirectParams = List.copyOf(v); return this; }
    }

    /** 본문 추출: YAML `extractor:` 섹션 */
    public static final class ExtractorCfg {
        private int minContentWords = 100;  // 이 값 미만 본문은 실패 처리
        private int wordNorm = 500;         // 단어 수 정규화 분모

        public int getMinContentWords() { return minContentWords; }
        public ExtractorCfg setMinContentWords(int v) { this.minContentWords = Math.max(0, v); return this; }
        public int getWordNorm() { return wordNorm; }
        public ExtractorCfg setWordNorm(int v) { this.wordNorm = Math.max(1, v); return this; }
    }

    /** 캐시: YAML `cache:` 섹션 */
    public static final class CacheCfg {
        private boolean enabled = true;
        private Path path = Path.of("news_enrichment_cache.db");
        private int evictDays = 30;

        public boolean isEnabled() { return enabled; }
        public CacheCfg setEnabled(boolean v) { this.enabled = v; return this; }
        public Path getPath() { return path; }
        public CacheCfg setPath(Path v) { if (v != null) this.path = v; return this; }
        public int getEvictDays() { return evictDays; }
        public CacheCfg setEvictDays(int v) { this.evictDays = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private int workers = 3;
    private ProcessingMode mode = ProcessingMode.SEQUENTIAL;
    private int maxResolveAttempts = 3;
    private int progressEvery = 10;

    private final RateCfg rate = new RateCfg();
    private final HttpCfg http = new HttpCfg();
    private final ResolverCfg resolver = new ResolverCfg();
    private final ExtractorCfg extractor = new ExtractorCfg();
    private final CacheCfg cache = new CacheCfg();

    // ---------- getters ----------
    public int getWorkers() { return workers; }
    public ProcessingMode getMode() { return mode; }
    public int getMaxResolveAttempts() { return maxResolveAttempts; }
    public int getProgressEvery() { return progressEvery; }

    public RateCfg rate() { return rate; }
    public HttpCfg http() { return http; }
    public ResolverCfg resolver() { return resolver; }
    public ExtractorCfg extractor() { return extractor; }
    public CacheCfg cache() { return cache; }

    // ---------- fluent setters ----------
    public EnricherConfig setWorkers(int workers) { this.workers = Math.max(1, workers); return this; }
    public EnricherConfig setMode(ProcessingMode mode) { this.mode = (mode != null ? mode : ProcessingMode.SEQUENTIAL); return this; }
    public EnricherConfig setMaxResolveAttempts(int v) { this.maxResolveAttempts = Math.max(1, v); return this; }
    public EnricherConfig setProgressEvery(int v) { this.progressEvery = Math.max(1, v); return this; }

    // ---------- validate ----------
    public void validate() {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        if (maxResolveAttempts < 1) throw new IllegalArgumentException("maxResolveAttempts must be >= 1");
        Objects.requireNonNull(mode, "mode");

        if (rate.getMaxDelayMs() < rate.getMinDelayMs())
            throw new IllegalArgumentException("rate.maxDelayMs must be >= rate.minDelayMs");
        if (rate.getAggregatorInitialMaxMs() < rate.getAggregatorInitialMinMs())
            throw new IllegalArgumentException("rate.aggregatorInitialMaxMs must be >= rate.aggregatorInitialMinMs");
        if (rate.getExtraPauseMaxMs() < rate.getExtraPauseMinMs())
            throw new IllegalArgumentException("rate.extraPauseMaxMs must be >= rate.extraPauseMinMs");
        if (rate.getAbortAfterErrors() < rate.getBackoffAfterErrors())
            throw new IllegalArgumentException("rate.abortAfterErrors must be >= rate.backoffAfterErrors");

        if (http.getRetryMaxMs() < http.getRetryBaseMs())
            throw new IllegalArgumentException("http.retryMaxMs must be >= http.retryBaseMs");
        if (resolver.getRoundPauseMaxMs() < resolver.getRoundPauseMinMs())
            throw new IllegalArgumentException("resolver.roundPauseMaxMs must be >= resolver.roundPauseMinMs");

        Objects.requireNonNull(cache.getPath(), "cache.path");
        if (cache.getEvictDays() < 0) throw new IllegalArgumentException("cache.evictDays must be >= 0");
    }

    // ---------- helpers ----------
    public static EnricherConfig defaults() { return new EnricherConfig(); }
}

package com.newsenricher.core.http;

import com.newsenricher.core.model.EnricherConfig;

import java.time.Duration;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 값 객체 재시도 정책: (maxAttempts, baseDelay, maxDelay, jitterFraction).
 * 429, 5xx 게이트웨이 계열(500/502/503/504, 520~524), 전송 실패(-1)에서만 재시도.
 * 지연 = min(maxDelay, base * 2^(attempt-1)) * (1 ± jitter)
 */
public final class DefaultRetryPolicy implements RetryPolicy {

    static final Set<Integer> RETRYABLE = Set.of(429, 500, 502, 503, 504, 520, 521, 522, 523, 524);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFraction;
    private final Random random;

    /** 첫 시도 + 재시도 3회, 1s → 2s → 4s (±10%) */
    public DefaultRetryPolicy() { this(4, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.1); }

    public DefaultRetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFraction) {
        this(maxAttempts, baseDelay, maxDelay, jitterFraction, null);
    }

    /** random이 null이면 ThreadLocalRandom 사용 */
    public DefaultRetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay,
                              double jitterFraction, Random random) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = (baseDelay == null || baseDelay.isNegative()) ? Duration.ZERO : baseDelay;
        this.maxDelay = (maxDelay == null || maxDelay.compareTo(this.baseDelay) < 0) ? this.baseDelay : maxDelay;
        this.jitterFraction = Math.max(0.0, Math.min(1.0, jitterFraction));
        this.random = random;
    }

    /** http.* 설정에서 생성 */
    public static DefaultRetryPolicy from(EnricherConfig.HttpCfg http) {
        return new DefaultRetryPolicy(
                1 + http.getMaxRetries(),
                Duration.ofMillis(http.getRetryBaseMs()),
                Duration.ofMillis(http.getRetryMaxMs()),
                http.getRetryJitter());
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return statusCode == -1 || RETRYABLE.contains(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long raw = Math.min(maxDelay.toMillis(), baseDelay.toMillis() * (1L << shift)); // 1,2,4...
        double r = (random != null) ? random.nextDouble() : ThreadLocalRandom.current().nextDouble();
        double jitter = 1.0 - jitterFraction + r * (2 * jitterFraction);
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }

    public Duration baseDelay() { return baseDelay; }
    public Duration maxDelay() { return maxDelay; }
    public double jitterFraction() { return jitterFraction; }
}

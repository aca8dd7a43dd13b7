package com.newsenricher.core.http;

import com.newsenricher.core.model.EnricherConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void shouldRetry_onlyOn_429_gateway5xx_or_minus1_and_respect_maxAttempts_4() {
        var p = new DefaultRetryPolicy();

        assertEquals(4, p.maxAttempts(), "maxAttempts must be 4 (1 + 3 retries)");

        int[] retryables = {429, 500, 502, 503, 504, 522, -1};
        for (int sc : retryables) {
            assertTrue(p.shouldRetry(sc, 1), "should retry on first failure for " + sc);
            assertTrue(p.shouldRetry(sc, 3), "should retry on third failure for " + sc);
            assertFalse(p.shouldRetry(sc, 4), "must stop retrying at attempt=4 for " + sc);
        }

        int[] nonRetry = {200, 204, 301, 302, 304, 400, 401, 403, 404, 418, 501};
        for (int sc : nonRetry) {
            assertFalse(p.shouldRetry(sc, 1), "must not retry for non-retryable code " + sc);
        }
    }

    @Test
    void backoff_is_exponential_with_jitter_plus_minus_10_percent() {
        var p = new DefaultRetryPolicy();

        // 1000 → 2000 → 4000 (ms), 각각 ±10%
        assertBetween(p.nextDelay(1).toMillis(), 900, 1100, "attempt=1 backoff");
        assertBetween(p.nextDelay(2).toMillis(), 1800, 2200, "attempt=2 backoff");
        assertBetween(p.nextDelay(3).toMillis(), 3600, 4400, "attempt=3 backoff");
    }

    @Test
    void backoff_is_capped_by_maxDelay() {
        var p = new DefaultRetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(5), 0.0);
        assertEquals(5000, p.nextDelay(8).toMillis());
    }

    @Test
    void from_httpConfig() {
        var http = new EnricherConfig.HttpCfg().setMaxRetries(1).setRetryBaseMs(200).setRetryMaxMs(800).setRetryJitter(0);
        var p = DefaultRetryPolicy.from(http);

        assertEquals(2, p.maxAttempts());
        assertEquals(Duration.ofMillis(200), p.baseDelay());
        assertEquals(200, p.nextDelay(1).toMillis());
        assertFalse(p.shouldRetry(503, 2));
    }

    @Test
    void countingPolicy_counts_only_granted_retries() {
        var counting = new CountingRetryPolicy(new DefaultRetryPolicy());
        counting.shouldRetry(503, 1);
        counting.shouldRetry(404, 2);
        counting.shouldRetry(-1, 2);
        assertEquals(2, counting.getRetryCount());
    }

    // ---- helpers ----
    private static void assertBetween(long actual, long min, long max, String label) {
        assertTrue(actual >= min && actual <= max,
                () -> label + " out of range: " + actual + "ms (expected " + min + "~" + max + "ms)");
    }
}

package com.newsenricher.core.http;

import com.newsenricher.core.util.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * 상태코드 기반 범용 재시도 루프.
 * <pre>
 * HttpResponseData r = Retry.call(policy, sleeper, n -> send(req), HttpResponseData::getStatusCode);
 * </pre>
 */
public final class Retry {
    private Retry() {}

    /** 한 번의 시도. attempt는 1부터. */
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attempt) throws InterruptedException;
    }

    public static <T> T call(RetryPolicy policy, Sleeper sleeper,
                             Attempt<T> attempt, ToIntFunction<T> statusOf) throws InterruptedException {
        return call(policy, sleeper, attempt, statusOf, r -> Optional.empty());
    }

    /**
     * @param delayHint 응답이 직접 지정한 대기 시간(Retry-After 등). 있으면 정책 지연보다 우선.
     * @return 마지막 시도 결과(성공 또는 재시도 예산 소진)
     */
    public static <T> T call(RetryPolicy policy, Sleeper sleeper, Attempt<T> attempt,
                             ToIntFunction<T> statusOf,
                             Function<T, Optional<Duration>> delayHint) throws InterruptedException {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(sleeper, "sleeper");
        int n = 1;
        while (true) {
            T result = attempt.run(n);
            if (!policy.shouldRetry(statusOf.applyAsInt(result), n)) {
                return result;
            }
            final int current = n;
            Duration delay = delayHint.apply(result).orElseGet(() -> policy.nextDelay(current));
            sleeper.sleep(delay);
            n++;
            if (n > policy.maxAttempts()) {
                return result; // 마지막 시도 결과 반환
            }
        }
    }
}

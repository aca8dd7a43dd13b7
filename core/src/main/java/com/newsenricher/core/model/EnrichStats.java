package com.newsenricher.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class EnrichStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);   // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);   // 재시도 횟수 총합
    private final AtomicLong sumWallMs     = new AtomicLong(0);   // 요청별 벽시계 합
    private final AtomicLong cacheHits     = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    /** attempts = (1 + retries) for a request */
    public void addAttempts(long attempts) {
        requestsTotal.addAndGet(attempts);
    }
    public void addRetries(long retries) {
        retriesTotal.addAndGet(retries);
    }
    public void addWallTimeMs(long wallMs) {
        sumWallMs.addAndGet(wallMs);
    }
    public void addCacheHit() {
        cacheHits.incrementAndGet();
    }
    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long req = requestsTotal.get();
        long avg = sumWallMs.get() / Math.max(1, req); // per-attempt 평균(재시도 대기 포함, 근사치)
        return new Snapshot(req, retriesTotal.get(), cacheHits.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long retriesTotal;
        public final long cacheHits;
        public final int  maxObservedConcurrency;
        public final long avgLatencyMs;
        public Snapshot(long r, long t, long h, int c, long a) {
            this.requestsTotal = r;
            this.retriesTotal = t;
            this.cacheHits = h;
            this.maxObservedConcurrency = c;
            this.avgLatencyMs = a;
        }

        @Override public String toString() {
            return "requests=" + requestsTotal + ", retries=" + retriesTotal + ", cacheHits=" + cacheHits
                    + ", maxCC=" + maxObservedConcurrency + ", avgLatencyMs=" + avgLatencyMs;
        }
    }
}

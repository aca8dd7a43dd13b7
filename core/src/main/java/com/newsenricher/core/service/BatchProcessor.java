package com.newsenricher.core.service;

import com.newsenricher.core.api.IContentExtractor;
import com.newsenricher.core.api.IUrlResolver;
import com.newsenricher.core.error.DomainAbortedException;
import com.newsenricher.core.error.EnrichmentException;
import com.newsenricher.core.model.ContentRecord;
import com.newsenricher.core.model.EnrichStats;
import com.newsenricher.core.model.EnrichmentResult;
import com.newsenricher.core.model.ErrorKind;
import com.newsenricher.core.model.ProcessingMode;
import com.newsenricher.core.model.ProcessingStatus;
import com.newsenricher.core.model.ResolvedUrl;
import com.newsenricher.core.util.ProgressListener;
import com.newsenricher.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 배치 오케스트레이터: URL마다 resolve → (URL이 바뀌었으면) extract.
 *  - SEQUENTIAL: 입력 순서대로 처리
 *  - CONCURRENT: 고정 스레드풀(+역압), 결과는 입력 인덱스 슬롯에 기록
 *  - 항목 단위 예외는 error / domain_aborted 결과로 바꾸고 배치는 계속한다
 */
public final class BatchProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(BatchProcessor.class);
    private static final StructuredLog SLOG = StructuredLog.get(BatchProcessor.class);

    private final IUrlResolver resolver;
    private final IContentExtractor extractor;
    private final int maxResolveAttempts;
    private final int progressEvery;
    private final EnrichStats stats;

    public BatchProcessor(IUrlResolver resolver, IContentExtractor extractor,
                          int maxResolveAttempts, int progressEvery, EnrichStats stats) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.maxResolveAttempts = Math.max(1, maxResolveAttempts);
        this.progressEvery = Math.max(1, progressEvery);
        this.stats = (stats != null) ? stats : new EnrichStats();
    }

    /** 입력 순서와 같은 순서의 결과 목록 */
    public List<EnrichmentResult> process(List<String> urls, ProcessingMode mode, int workers) {
        return run(urls, mode, workers, ProgressListener.NONE).results();
    }

    public BatchReport run(List<String> urls, ProcessingMode mode, int workers, ProgressListener listener) {
        Objects.requireNonNull(urls, "urls");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final ProcessingMode m = (mode != null) ? mode : ProcessingMode.SEQUENTIAL;
        final int total = urls.size();
        final int cc = (m == ProcessingMode.CONCURRENT) ? Math.max(1, workers) : 1;
        final long t0 = System.nanoTime();

        LOG.info("Batch start: urls={}, mode={}, workers={}", total, m, cc);
        SLOG.info("batch-start", "urls", total, "mode", m, "workers", cc);
        pl.onProgress(0.0, "resolve", 0, total);

        final EnrichmentResult[] slots = new EnrichmentResult[total];
        final AtomicInteger done = new AtomicInteger(0);

        if (m == ProcessingMode.CONCURRENT && total > 1) {
            runConcurrent(urls, cc, slots, done, pl);
        } else {
            for (int i = 0; i < total; i++) {
                if (Thread.currentThread().isInterrupted()) throw new CancellationException();
                slots[i] = processGuarded(urls.get(i));
                progress(done.incrementAndGet(), total, pl);
            }
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        BatchReport report = BatchReport.of(Arrays.asList(slots), elapsedMs, stats.snapshot());
        pl.onProgress(1.0, "done", done.get(), total);

        LOG.info("Batch done. {} | {}", report.summary(), report.stats());
        SLOG.info("batch-done",
                "total", total,
                "success", report.count(ProcessingStatus.SUCCESS),
                "elapsedMs", elapsedMs,
                "maxObservedCC", report.stats().maxObservedConcurrency);
        return report;
    }

    // ---------- 동시 실행 ----------

    private void runConcurrent(List<String> urls, int cc, EnrichmentResult[] slots,
                               AtomicInteger done, ProgressListener pl) {
        final int total = urls.size();
        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("enrich-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        final AtomicInteger inFlight = new AtomicInteger(0);
        final List<Future<?>> futures = new ArrayList<>(total);

        try {
            for (int i = 0; i < total; i++) {
                final int idx = i;
                final String url = urls.get(i);
                futures.add(exec.submit(() -> {
                    stats.observeConcurrency(inFlight.incrementAndGet());
                    try {
                        slots[idx] = processGuarded(url);
                        progress(done.incrementAndGet(), total, pl);
                    } finally {
                        stats.observeConcurrency(inFlight.decrementAndGet());
                    }
                }));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Enrich task failed: {}", cause.toString());
                    SLOG.error("task-failed", cause, "url", urls.get(i));
                    if (slots[i] == null) slots[i] = EnrichmentResult.error(urls.get(i), ErrorKind.NETWORK_ERROR, 0);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                }
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ---------- 항목 1건 ----------

    /** 항목 단위 예외 → 결과 레코드. 인터럽트만 취소로 올린다 */
    private EnrichmentResult processGuarded(String url) {
        long t0 = System.nanoTime();
        try {
            return processOne(url, t0);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while processing " + url);
        } catch (RuntimeException e) {
            ErrorKind kind = (e instanceof EnrichmentException ee) ? ee.getKind() : ErrorKind.NETWORK_ERROR;
            LOG.warn("Error processing {}: {}", url, e.toString());
            SLOG.error("task-failed", e, "url", url, "kind", kind);
            return EnrichmentResult.error(url, kind, elapsedMs(t0));
        }
    }

    private EnrichmentResult processOne(String url, long t0) throws InterruptedException {
        final ResolvedUrl r;
        try {
            r = resolver.resolve(url, maxResolveAttempts);
        } catch (DomainAbortedException e) {
            LOG.warn("Skipping {}: domain {} aborted", url, e.getDomain());
            return EnrichmentResult.aborted(url, elapsedMs(t0));
        }
        if (r.resolved() && r.rounds() == 0) stats.addCacheHit();

        ContentRecord content = null;
        if (r.resolved() && !r.url().equals(url)) {
            try {
                content = extractor.extract(r.url());
            } catch (DomainAbortedException e) {
                LOG.warn("Extraction skipped for {}: domain {} aborted", r.url(), e.getDomain());
                return EnrichmentResult.abortedExtraction(url, r, elapsedMs(t0));
            }
        }
        return EnrichmentResult.of(url, r, content, elapsedMs(t0));
    }

    private void progress(int done, int total, ProgressListener pl) {
        if (done % progressEvery == 0 || done == total) {
            LOG.info("Progress: {}/{}", done, total);
            SLOG.info("batch-progress", "done", done, "total", total);
        }
        try {
            pl.onProgress(Math.min(1.0, (double) done / Math.max(1, total)), "resolve", done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}

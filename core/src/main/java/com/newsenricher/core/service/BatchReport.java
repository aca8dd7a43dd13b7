package com.newsenricher.core.service;

import com.newsenricher.core.model.EnrichStats;
import com.newsenricher.core.model.EnrichmentResult;
import com.newsenricher.core.model.ProcessingStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** 배치 1회 결과: 입력 순서대로의 결과 + 상태별 집계 */
public record BatchReport(
        List<EnrichmentResult> results,
        Map<ProcessingStatus, Integer> counts,
        long elapsedMs,
        EnrichStats.Snapshot stats
) {
    public BatchReport {
        results = List.copyOf(results);
        counts = Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    static BatchReport of(List<EnrichmentResult> results, long elapsedMs, EnrichStats.Snapshot stats) {
        Map<ProcessingStatus, Integer> counts = new EnumMap<>(ProcessingStatus.class);
        for (EnrichmentResult r : results) counts.merge(r.status(), 1, Integer::sum);
        return new BatchReport(results, counts, elapsedMs, stats);
    }

    public int total() { return results.size(); }

    public int count(ProcessingStatus status) { return counts.getOrDefault(status, 0); }

    public String summary() {
        return "total=" + total()
                + ", success=" + count(ProcessingStatus.SUCCESS)
                + ", noContent=" + count(ProcessingStatus.NO_CONTENT)
                + ", unresolved=" + count(ProcessingStatus.UNRESOLVED)
                + ", invalid=" + count(ProcessingStatus.INVALID_INPUT)
                + ", aborted=" + count(ProcessingStatus.ABORTED)
                + ", error=" + count(ProcessingStatus.ERROR)
                + ", elapsedMs=" + elapsedMs;
    }
}

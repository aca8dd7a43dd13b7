package com.newsenricher.core.model;

import java.time.Instant;

/** url_resolution 테이블 한 행. indirect_url 당 한 건(마지막 쓰기가 이긴다). */
public record ResolutionRecord(
        String indirectUrl,
        String directUrl,
        String method,
        Instant resolvedAt,
        int attempts,
        boolean success
) {}

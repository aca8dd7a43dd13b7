package com.newsenricher.core.model;

/** 캐시 행 수 요약 */
public record CacheStats(long totalResolutions, long successfulResolutions, long contentRows) {}

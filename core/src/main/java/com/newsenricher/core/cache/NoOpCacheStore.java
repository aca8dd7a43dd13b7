package com.newsenricher.core.cache;

import com.newsenricher.core.model.CacheStats;
import com.newsenricher.core.model.ContentRecord;
import com.newsenricher.core.model.ResolutionRecord;

import java.util.List;
import java.util.Optional;

/** 아무것도 저장하지 않는 캐시(--no-cache) */
final class NoOpCacheStore implements CacheStore {
    static final NoOpCacheStore INSTANCE = new NoOpCacheStore();

    private NoOpCacheStore() {}

    @Override public Optional<ResolutionRecord> getResolution(String indirectUrl) { return Optional.empty(); }
    @Override public void saveResolution(String indirectUrl, String directUrl, String method, boolean success) {}
    @Override public Optional<ContentRecord> getContent(String url) { return Optional.empty(); }
    @Override public void saveContent(String url, ContentRecord data) {}
    @Override public int cleanup(int olderThanDays) { return 0; }
    @Override public CacheStats stats() { return new CacheStats(0, 0, 0); }
    @Override public List<ResolutionRecord> successfulResolutions() { return List.of(); }
}

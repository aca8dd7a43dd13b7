package com.newsenricher.app.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.newsenricher.core.model.EnrichmentResult;
import com.newsenricher.core.model.ResolutionRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 결과를 JSON Lines로 기록. 입력 한 줄당 한 객체, 입력과 같은 순서.
 * 키는 snake_case(direct_url, method, content, metadata ...).
 */
public final class ResultWriter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS); // ISO-8601

    public Path write(Path file, List<EnrichmentResult> results, Instant processedAt) throws IOException {
        List<Map<String, Object>> lines = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) lines.add(toLine(i, results.get(i), processedAt));
        return writeLines(file, lines);
    }

    /** 캐시의 해석 기록(indirect_url, direct_url, method, resolved_at) */
    public Path writeResolutions(Path file, List<ResolutionRecord> records) throws IOException {
        List<Map<String, Object>> lines = new ArrayList<>(records.size());
        for (ResolutionRecord r : records) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("indirect_url", r.indirectUrl());
            m.put("direct_url", r.directUrl());
            m.put("method", r.method());
            m.put("resolved_at", r.resolvedAt());
            lines.add(m);
        }
        return writeLines(file, lines);
    }

    private Path writeLines(Path file, List<Map<String, Object>> lines) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (Map<String, Object> line : lines) {
                w.write(om.writeValueAsString(line));
                w.newLine();
            }
        }
        return file;
    }

    static Map<String, Object> toLine(int index, EnrichmentResult r, Instant processedAt) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("index", index);
        m.put("input_url", r.inputUrl());
        m.put("direct_url", r.directUrl());
        m.put("method", r.method());
        m.put("content", r.content());
        m.put("metadata", r.metadata());
        m.put("status", r.status().name());
        m.put("error_kind", r.errorKind() == null ? null : r.errorKind().name());
        m.put("attempts", r.attempts());
        m.put("processing_time_ms", r.processingTimeMs());
        m.put("source_domain", r.sourceDomain());
        m.put("processed_at", processedAt);
        return m;
    }

    public ObjectMapper mapper() { return om; }
}

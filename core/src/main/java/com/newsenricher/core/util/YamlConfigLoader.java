package com.newsenricher.core.util;

import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.EnricherConfig.DecoderKind;
import com.newsenricher.core.model.ProcessingMode;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * enricher.yml → EnricherConfig. 모든 키는 선택이며 빠진 키는 기본값을 유지한다.
 *
 * 예상 YAML 키:
 * workers: 3
 * mode: SEQUENTIAL | CONCURRENT
 * maxResolveAttempts: 3
 * progressEvery: 10
 * cache:
 *   enabled: true
 *   path: "news_enrichment_cache.db"
 *   evictDays: 30
 * http:
 *   timeoutMs: 20000
 *   connectTimeoutMs: 10000
 *   maxRetries: 3
 *   retryBaseMs: 1000
 *   retryMaxMs: 30000
 *   retryJitter: 0.1
 *   acceptLanguage: "es-ES,es;q=0.9,en;q=0.8"
 * rate:
 *   minDelayMs / maxDelayMs / aggregatorBaseDelayMs / aggregatorJitterMs
 *   aggregatorInitialMinMs / aggregatorInitialMaxMs / aggregatorGrowthPer
 *   extraPauseEvery / extraPauseMinMs / extraPauseMaxMs
 *   backoffAfterErrors / abortAfterErrors / maxBackoffSeconds
 *   aggregatorDailyLimit / dailyLimitPauseMs
 * resolver:
 *   aggregatorBaseUrl: "https://news.google.com"
 *   decoder: BATCH_EXECUTE | NONE
 *   roundPauseMinMs: 2000
 *   roundPauseMaxMs: 4000
 *   blockedDomainMarkers: ["google.", "youtube."]
 *   redirectParams: ["url", "u", "q"]
 * extractor:
 *   minContentWords: 100
 *   wordNorm: 500
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static EnricherConfig loadDefault() throws IOException {
        return load(Path.of("enricher.yml"));
    }

    public static EnricherConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("enricher.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromRoot(newYaml().load(in));
        }
    }

    /** 문자열 YAML (테스트/내장 설정용) */
    public static EnricherConfig parse(String yamlText) {
        try (Reader r = new StringReader(yamlText == null ? "" : yamlText)) {
            return fromRoot(newYaml().load(r));
        } catch (IOException e) {
            throw new IllegalStateException("StringReader close failed", e);
        }
    }

    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static EnricherConfig fromRoot(Object root) {
        EnricherConfig cfg = EnricherConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setInt(map, "workers", cfg::setWorkers);
        setEnum(map, "mode", ProcessingMode.class, cfg::setMode);
        setInt(map, "maxResolveAttempts", cfg::setMaxResolveAttempts);
        setInt(map, "progressEvery", cfg::setProgressEvery);

        // 2) cache.*
        Map<String, Object> cache = getMap(map, "cache");
        if (cache != null) {
            var c = cfg.cache();
            setBoolean(cache, "enabled", c::setEnabled);
            setPath(cache, "path", c::setPath);
            setInt(cache, "evictDays", c::setEvictDays);
        }

        // 3) http.*
        Map<String, Object> http = getMap(map, "http");
        if (http != null) {
            var h = cfg.http();
            setIntAsDurationMs(http, "timeoutMs", h::setTimeout);
            setIntAsDurationMs(http, "connectTimeoutMs", h::setConnectTimeout);
            setInt(http, "maxRetries", h::setMaxRetries);
            setLong(http, "retryBaseMs", h::setRetryBaseMs);
            setLong(http, "retryMaxMs", h::setRetryMaxMs);
            setDouble(http, "retryJitter", h::setRetryJitter);
            setString(http, "acceptLanguage", h::setAcceptLanguage);
        }

        // 4) rate.*
        Map<String, Object> rate = getMap(map, "rate");
        if (rate != null) {
            var r = cfg.rate();
            setLong(rate, "minDelayMs", r::setMinDelayMs);
            setLong(rate, "maxDelayMs", r::setMaxDelayMs);
            setLong(rate, "aggregatorBaseDelayMs", r::setAggregatorBaseDelayMs);
            setLong(rate, "aggregatorJitterMs", r::setAggregatorJitterMs);
            setLong(rate, "aggregatorInitialMinMs", r::setAggregatorInitialMinMs);
            setLong(rate, "aggregatorInitialMaxMs", r::setAggregatorInitialMaxMs);
            setLong(rate, "aggregatorGrowthPer", r::setAggregatorGrowthPer);
            setInt(rate, "extraPauseEvery", r::setExtraPauseEvery);
            setLong(rate, "extraPauseMinMs", r::setExtraPauseMinMs);
            setLong(rate, "extraPauseMaxMs", r::setExtraPauseMaxMs);
            setInt(rate, "backoffAfterErrors", r::setBackoffAfterErrors);
            setInt(rate, "abortAfterErrors", r::setAbortAfterErrors);
            setInt(rate, "maxBackoffSeconds", r::setMaxBackoffSeconds);
            setLong(rate, "aggregatorDailyLimit", r::setAggregatorDailyLimit);
            setLong(rate, "dailyLimitPauseMs", r::setDailyLimitPauseMs);
        }

        // 5) resolver.*
        Map<String, Object> resolver = getMap(map, "resolver");
        if (resolver != null) {
            var rs = cfg.resolver();
            setString(resolver, "aggregatorBaseUrl", rs::setAggregatorBaseUrl);
            setEnum(resolver, "decoder", DecoderKind.class, rs::setDecoder);
            setLong(resolver, "roundPauseMinMs", rs::setRoundPauseMinMs);
            setLong(resolver, "roundPauseMaxMs", rs::setRoundPauseMaxMs);
            setStringList(resolver, "blockedDomainMarkers", rs::setBlockedDomainMarkers);
            setStringList(resolver, "redirectParams", rs::setRedirectParams);
        }

        // 6) extractor.*
        Map<String, Object> extractor = getMap(map, "extractor");
        if (extractor != null) {
            var e = cfg.extractor();
            setInt(extractor, "minContentWords", e::setMinContentWords);
            setInt(extractor, "wordNorm", e::setWordNorm);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, Consumer<Double> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().replace('-', '_');
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        // 사용자 오타 시 기본값 유지
    }
}

package com.newsenricher.core.util;

import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.ProcessingMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class YamlConfigLoaderTest {

    @TempDir Path dir;

    @Test
    void nestedSectionsOverrideDefaults() {
        EnricherConfig cfg = YamlConfigLoader.parse(String.join("\n",
                "workers: 5",
                "mode: concurrent",
                "cache:",
                "  enabled: false",
                "  path: data/cache.db",
                "http:",
                "  timeoutMs: 5000",
                "  retryJitter: 0.2",
                "rate:",
                "  minDelayMs: 100",
                "  maxDelayMs: 200",
                "  aggregatorDailyLimit: 500",
                "resolver:",
                "  decoder: none",
                "  blockedDomainMarkers: [\"google.\", \"youtube.\"]",
                "  redirectParams: url, u",
                "extractor:",
                "  minContentWords: 50",
                ""));

        assertThat(cfg.getWorkers()).isEqualTo(5);
        assertThat(cfg.getMode()).isEqualTo(ProcessingMode.CONCURRENT);
        assertThat(cfg.cache().isEnabled()).isFalse();
        assertThat(cfg.cache().getPath()).isEqualTo(Path.of("data/cache.db"));
        assertThat(cfg.http().getTimeout()).isEqualTo(Duration.ofMillis(5000));
        assertThat(cfg.http().getRetryJitter()).isEqualTo(0.2);
        assertThat(cfg.rate().getMinDelayMs()).isEqualTo(100);
        assertThat(cfg.rate().getAggregatorDailyLimit()).isEqualTo(500);
        assertThat(cfg.resolver().getDecoder()).isEqualTo(EnricherConfig.DecoderKind.NONE);
        assertThat(cfg.resolver().getBlockedDomainMarkers()).containsExactly("google.", "youtube.");
        assertThat(cfg.resolver().getRedirectParams()).containsExactly("url", "u");
        assertThat(cfg.extractor().getMinContentWords()).isEqualTo(50);
        // 건드리지 않은 키는 기본값
        assertThat(cfg.getMaxResolveAttempts()).isEqualTo(3);
        assertThat(cfg.rate().getAbortAfterErrors()).isEqualTo(4);
    }

    @Test
    void emptyDocumentGivesDefaults() {
        EnricherConfig cfg = YamlConfigLoader.parse("");
        assertThat(cfg.getWorkers()).isEqualTo(EnricherConfig.defaults().getWorkers());
        assertThat(YamlConfigLoader.parse(null).getMode()).isEqualTo(ProcessingMode.SEQUENTIAL);
    }

    @Test
    void unknownEnumValueKeepsDefault() {
        EnricherConfig cfg = YamlConfigLoader.parse("mode: turbo\n");
        assertThat(cfg.getMode()).isEqualTo(ProcessingMode.SEQUENTIAL);
    }

    @Test
    void invalidRangeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.parse("rate:\n  minDelayMs: 900\n  maxDelayMs: 10\n"));
    }

    @Test
    void loadFromFile() throws IOException {
        Path yml = dir.resolve("enricher.yml");
        Files.writeString(yml, "workers: 2\nprogressEvery: 25\n");

        EnricherConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.getWorkers()).isEqualTo(2);
        assertThat(cfg.getProgressEvery()).isEqualTo(25);
    }

    @Test
    void missingFileFails() {
        assertThrows(IOException.class, () -> YamlConfigLoader.load(dir.resolve("nope.yml")));
    }
}

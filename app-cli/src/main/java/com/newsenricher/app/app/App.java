package com.newsenricher.app.app;

import com.newsenricher.app.io.ResultWriter;
import com.newsenricher.app.io.UrlListReader;
import com.newsenricher.app.logging.LogSetup;
import com.newsenricher.core.model.CacheStats;
import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.ResolutionRecord;
import com.newsenricher.core.service.BatchReport;
import com.newsenricher.core.service.NewsEnricher;
import com.newsenricher.core.util.YamlConfigLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 명령행 진입점: URL 목록 파일 → 해석/추출 → JSON Lines.
 * 종료 코드 0 완료, 1 인자/입력 오류, 2 실행 준비 실패.
 */
public final class App {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FATAL = 2;

    private App() {}

    public static void main(String[] args) {
        // 로그 초기화 (-Dne.out.dir 없으면 "out")
        Path outRoot = Paths.get(System.getProperty("ne.out.dir", "out"));
        LogSetup.init(outRoot.resolve("logs"));

        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        final CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (opts.help) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }
        if (opts.verbose) LogSetup.setLevel(Level.FINE);

        // 1) 설정: 파일 → 플래그 덮어쓰기
        final EnricherConfig cfg;
        try {
            cfg = loadConfig(opts.config);
            opts.applyTo(cfg);
            cfg.validate();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (opts.dumpCache) return dumpCache(cfg, opts.output, out, err);

        // 2) 입력
        final List<String> urls;
        try {
            urls = UrlListReader.read(opts.input);
        } catch (IOException e) {
            err.println("Cannot read input " + opts.input + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        LOG.info(() -> "Loaded " + urls.size() + " URLs from " + opts.input.toAbsolutePath());

        // 3) 처리 + 기록
        try (NewsEnricher enricher = new NewsEnricher(cfg)) {
            BatchReport report = enricher.run(urls, null);
            new ResultWriter().write(opts.output, report.results(), Instant.now());

            CacheStats cs = enricher.cacheStats();
            out.println(report.summary());
            out.println("cache: resolutions=" + cs.totalResolutions()
                    + ", successful=" + cs.successfulResolutions()
                    + ", content=" + cs.contentRows());
            out.println("results: " + opts.output.toAbsolutePath());
            return EXIT_OK;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to write results", e);
            err.println("Cannot write output " + opts.output + ": " + e.getMessage());
            return EXIT_FATAL;
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Enrichment failed", e);
            err.println("Fatal: " + e);
            return EXIT_FATAL;
        }
    }

    /** 중단된 실행 복구용: 캐시의 성공 해석 기록을 그대로 내보낸다 */
    static int dumpCache(EnricherConfig cfg, Path output, PrintStream out, PrintStream err) {
        try (NewsEnricher enricher = new NewsEnricher(cfg)) {
            List<ResolutionRecord> records = enricher.cachedResolutions();
            new ResultWriter().writeResolutions(output, records);
            out.println("cached resolutions: " + records.size() + " -> " + output.toAbsolutePath());
            return EXIT_OK;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to write cached resolutions", e);
            err.println("Cannot write output " + output + ": " + e.getMessage());
            return EXIT_FATAL;
        }
    }

    /** --config 우선, 없으면 작업 디렉터리의 enricher.yml, 그것도 없으면 기본값 */
    static EnricherConfig loadConfig(Path explicit) throws IOException {
        if (explicit != null) return YamlConfigLoader.load(explicit);
        Path local = Path.of("enricher.yml");
        return Files.exists(local) ? YamlConfigLoader.load(local) : EnricherConfig.defaults();
    }
}

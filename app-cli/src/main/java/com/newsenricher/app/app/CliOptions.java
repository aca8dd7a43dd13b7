package com.newsenricher.app.app;

import com.newsenricher.core.model.EnricherConfig;
import com.newsenricher.core.model.ProcessingMode;

import java.nio.file.Path;

/**
 * 명령행 플래그. 설정 파일 값을 덮어쓴다.
 * 잘못된 인자는 IllegalArgumentException(종료 코드 1).
 */
final class CliOptions {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: news-enricher --input <urls.txt> [options]",
            "  --input <file>        one indirect URL per line (# comments allowed)",
            "  --output <file>       JSON Lines output (default: results.jsonl)",
            "  --config <file>       enricher.yml (default: ./enricher.yml if present)",
            "  --workers <n>         worker threads for parallel mode",
            "  --parallel            process URLs concurrently",
            "  --no-cache            disable the SQLite cache",
            "  --max-attempts <n>    resolution rounds per URL",
            "  --cache-days <n>      evict cache rows older than n days at start",
            "  --cache-path <file>   SQLite cache file",
            "  --dump-cache          write cached successful resolutions to --output and exit",
            "  --verbose             debug logging",
            "  --help                show this help");

    Path input;
    Path output = Path.of("results.jsonl");
    Path config;
    Integer workers;
    boolean parallel;
    boolean noCache;
    Integer maxAttempts;
    Integer cacheDays;
    Path cachePath;
    boolean dumpCache;
    boolean verbose;
    boolean help;

    static CliOptions parse(String[] args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--input":        o.input = Path.of(value(args, ++i, a)); break;
                case "--output":       o.output = Path.of(value(args, ++i, a)); break;
                case "--config":       o.config = Path.of(value(args, ++i, a)); break;
                case "--workers":      o.workers = positive(value(args, ++i, a), a); break;
                case "--parallel":     o.parallel = true; break;
                case "--no-cache":     o.noCache = true; break;
                case "--max-attempts": o.maxAttempts = positive(value(args, ++i, a), a); break;
                case "--cache-days":   o.cacheDays = nonNegative(value(args, ++i, a), a); break;
                case "--cache-path":   o.cachePath = Path.of(value(args, ++i, a)); break;
                case "--dump-cache":   o.dumpCache = true; break;
                case "--verbose":
                case "-v":             o.verbose = true; break;
                case "--help":
                case "-h":             o.help = true; break;
                default:
                    throw new IllegalArgumentException("Unknown argument: " + a);
            }
        }
        if (!o.help && !o.dumpCache && o.input == null) throw new IllegalArgumentException("--input is required");
        return o;
    }

    /** 플래그로 준 값만 설정에 덮어쓴다 */
    void applyTo(EnricherConfig cfg) {
        if (workers != null) cfg.setWorkers(workers);
        if (parallel) cfg.setMode(ProcessingMode.CONCURRENT);
        if (noCache) cfg.cache().setEnabled(false);
        if (maxAttempts != null) cfg.setMaxResolveAttempts(maxAttempts);
        if (cacheDays != null) cfg.cache().setEvictDays(cacheDays);
        if (cachePath != null) cfg.cache().setPath(cachePath);
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new IllegalArgumentException(flag + " needs a value");
        }
        return args[i];
    }

    private static int positive(String s, String flag) {
        int n = integer(s, flag);
        if (n < 1) throw new IllegalArgumentException(flag + " must be >= 1");
        return n;
    }

    private static int nonNegative(String s, String flag) {
        int n = integer(s, flag);
        if (n < 0) throw new IllegalArgumentException(flag + " must be >= 0");
        return n;
    }

    private static int integer(String s, String flag) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects an integer: " + s, e);
        }
    }
}

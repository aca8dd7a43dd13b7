package com.newsenricher.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * slf4j는 slf4j-jdk14 바인딩으로 여기 핸들러를 탄다.
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** logDir/app-%g.log 로 저장. System props:
     *  -Dne.log.level=FINE|INFO|WARNING|SEVERE
     *  -Dne.log.sizeMb=2
     *  -Dne.log.files=5
     *  -Dne.log.console=true|false (기본 true)
     */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        try {
            Files.createDirectories(logDir);

            Level level = levelOf(System.getProperty("ne.log.level", "INFO"));
            int sizeMb  = parseInt(System.getProperty("ne.log.sizeMb"), 2);
            int fileCnt = parseInt(System.getProperty("ne.log.files"), 5);
            boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("ne.log.console", "true"));

            LogManager.getLogManager().reset();
            Logger root = Logger.getLogger("");

            if (toConsole) {
                ConsoleHandler console = new ConsoleHandler();
                console.setLevel(level);
                console.setFormatter(LINE_FORMATTER);
                root.addHandler(console);
            }

            String pattern = logDir.resolve("app-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);

            root.setLevel(level);

            Logger.getLogger(LogSetup.class.getName()).log(Level.INFO,
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());

        } catch (IOException e) {
            // 콘솔에만 찍고 진행
            Logger.getAnonymousLogger().log(Level.WARNING, "Log setup failed: " + e.getMessage(), e);
        }
    }

    /** 루트/핸들러 레벨 즉시 변경 */
    public static void setLevel(Level level) {
        Level lv = (level == null) ? Level.INFO : level;
        Logger root = Logger.getLogger("");
        root.setLevel(lv);
        for (Handler h : root.getHandlers()) {
            h.setLevel(lv);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}

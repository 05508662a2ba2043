package com.siteauditor.app.logging;

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
 * SLF4J는 slf4j-jdk14 바인딩으로 여기에 연결된다.
 * System props:
 *  -Dsa.log.level=FINE|INFO|WARNING|SEVERE
 *  -Dsa.log.sizeMb=2
 *  -Dsa.log.files=5
 *  -Dsa.log.console=true|false (기본 true)
 *  -Dsa.log.file=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** outRoot/logs/audit-%g.log */
    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("sa.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("sa.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("sa.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("sa.log.console", "true"));
        boolean toFile    = !"false".equalsIgnoreCase(System.getProperty("sa.log.file", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        // 콘솔은 stderr (stdout은 요약 프리뷰 전용)
        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        if (toFile) {
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("audit-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 없이 진행
                root.log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
            }
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
    }

    /** 런타임 레벨 변경 (--verbose) */
    public static void setLevel(Level level) {
        Level lv = level == null ? Level.INFO : level;
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
        catch (NumberFormatException e) { return def; }
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

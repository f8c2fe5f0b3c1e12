package com.authprobe.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.*;
import java.util.Locale;
import java.util.logging.*;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5)
 * - configure(outRoot): outRoot/logs 기준 초기화
 * - setLevel(Level): 루트/핸들러 레벨 즉시 변경
 *
 * System props:
 *  -Dap.log.level=FINE|INFO|WARNING|SEVERE
 *  -Dap.log.sizeMb=2
 *  -Dap.log.files=5
 *  -Dap.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    /** logs 디렉터리를 직접 넘겨 초기화. 이미 초기화됐으면 no-op. */
    public static synchronized boolean init(Path logDir) {
        if (initialized) return false;
        initialized = true;

        Level level = levelOf(System.getProperty("ap.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("ap.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("ap.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("ap.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("authprobe-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 핸들러 실패 시 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "File logging disabled: " + e.getMessage(), e);
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.CONFIG,
                () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        return true;
    }

    public static void setLevel(Level level) {
        if (level == null) level = Level.INFO;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
        }
    }

    /** 문자열을 Level로(실패 시 INFO). DEBUG/WARN 별칭 허용. */
    public static Level levelOf(String name) {
        String s = String.valueOf(name).trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(s); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
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

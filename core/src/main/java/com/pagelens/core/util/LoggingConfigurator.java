package com.pagelens.core.util;

import java.io.IOException;
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
 * java.util.logging 루트 설정. 콘솔(stderr) + 사이즈 롤링 파일.
 * stdout은 리포트 출력 전용이므로 로그는 stderr로만 보낸다.
 * System props:
 *  -Dpl.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *  -Dpl.log.dir=logs (비우면 파일 로그 끔)
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    private static final Formatter LINE = new Formatter() {
        @Override public String format(LogRecord r) { return formatMessage(r) + System.lineSeparator(); }
    };

    public static void initFromSystemProperties() {
        Level level = parseLevel(System.getProperty("pl.log.level"), Level.INFO);
        String dir = System.getProperty("pl.log.dir", "logs");
        init(dir.isBlank() ? null : Path.of(dir), level, 2 * 1024 * 1024, 5);
    }

    /** logDir가 null이면 콘솔만 */
    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(LINE);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("pagelens-%g.log").toString();
                FileHandler file = new FileHandler(pattern, maxBytes, fileCount, true);
                file.setLevel(rootLevel);
                file.setFormatter(LINE);
                root.addHandler(file);
            } catch (IOException e) {
                System.err.println("Failed to init file handler: " + e.getMessage());
            }
        }
        root.setLevel(rootLevel);
    }

    static Level parseLevel(String s, Level fallback) {
        if (s == null || s.isBlank()) return fallback;
        try {
            return Level.parse(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}

package com.pagelens.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/** JUL 루트 로거에 콘솔 + 롤링 파일 핸들러를 설치. SLF4J(jdk14 바인딩)와 StructuredLog 모두 여기로 흐른다. */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    /** 한 줄 포맷: ts LEVEL logger - message */
    static final class OneLineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(160)
                    .append(Instant.ofEpochMilli(r.getMillis()))
                    .append(' ').append(r.getLevel().getName())
                    .append(' ').append(r.getLoggerName())
                    .append(" - ").append(formatMessage(r));
            if (r.getThrown() != null) sb.append(" | ").append(r.getThrown());
            return sb.append(System.lineSeparator()).toString();
        }
    }

    /**
     * @return 파일 핸들러가 설치되었으면 true
     */
    public static boolean init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        OneLineFormatter fmt = new OneLineFormatter();
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(fmt);
        root.addHandler(console);
        root.setLevel(rootLevel);

        if (logDir == null) return false;
        try {
            Files.createDirectories(logDir);
            String pattern = Paths.get(logDir.toString(), "pagelens-%g.log").toString();
            FileHandler file = new FileHandler(pattern, maxBytes, fileCount, true);
            file.setLevel(rootLevel);
            file.setFormatter(fmt);
            root.addHandler(file);
            return true;
        } catch (IOException e) {
            root.log(Level.WARNING, "Failed to init file handler: " + e.getMessage(), e);
            return false;
        }
    }
}

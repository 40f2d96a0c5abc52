package com.pagelens.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingConfiguratorTest {

    private final Logger root = LogManager.getLogManager().getLogger("");

    @AfterEach
    void resetRoot() {
        for (Handler h : root.getHandlers()) {
            h.close();
            root.removeHandler(h);
        }
        LoggingConfigurator.init(null, Level.INFO, 0, 1);
    }

    @Test
    void console_only_without_directory() {
        assertFalse(LoggingConfigurator.init(null, Level.WARNING, 1024, 1));

        assertThat(root.getHandlers()).hasSize(1);
        assertThat(root.getLevel()).isEqualTo(Level.WARNING);
    }

    @Test
    void file_handler_installed_in_directory(@TempDir Path dir) {
        assertTrue(LoggingConfigurator.init(dir.resolve("logs"), Level.FINE, 1 << 16, 2));

        assertThat(root.getHandlers()).hasAtLeastOneElementOfType(FileHandler.class);
        assertThat(dir.resolve("logs")).isDirectory();
    }

    @Test
    void one_line_format() {
        LogRecord r = new LogRecord(Level.INFO, "fetched {0}");
        r.setParameters(new Object[] {"https://a.example/"});
        r.setLoggerName("com.pagelens.core.http.PageCollector");

        String line = new LoggingConfigurator.OneLineFormatter().format(r);

        assertThat(line).contains(" INFO com.pagelens.core.http.PageCollector - fetched https://a.example/");
        assertThat(line).endsWith(System.lineSeparator());
    }
}

package com.wikicrawler.core.util;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfiguratorTest {

    @Test
    void level_names_are_parsed_leniently() {
        assertThat(LoggingConfigurator.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LoggingConfigurator.levelOf(" WARNING ")).isEqualTo(Level.WARNING);
        assertThat(LoggingConfigurator.levelOf("loud")).isEqualTo(Level.INFO);
        assertThat(LoggingConfigurator.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void line_formatter_writes_level_logger_and_stack() {
        LogRecord r = new LogRecord(Level.SEVERE, "Could not write {0}");
        r.setParameters(new Object[]{"001_A.txt"});
        r.setLoggerName("com.wikicrawler.core.crawler.CrawlLoop");
        r.setThrown(new IllegalStateException("boom"));

        String line = new LoggingConfigurator.LineFormatter().format(r);

        assertThat(line).contains("[SEVERE]")
                .contains("com.wikicrawler.core.crawler.CrawlLoop - Could not write 001_A.txt")
                .contains("java.lang.IllegalStateException: boom");
    }
}

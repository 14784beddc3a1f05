// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.demo;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class LoggerConfigTest {
  final LoggerConfig.TranscriptFormatter formatter = new LoggerConfig.TranscriptFormatter();

  private static LogRecord record(Level level, String logger, String message) {
    final var record = new LogRecord(level, message);
    record.setLoggerName(logger);
    return record;
  }

  @Test
  public void narrationIsPrintedAsIs() {
    final var line = formatter.format(record(Level.INFO, NarrationListener.LOGGER.getName(),
        "Topology BUS for 4 devices with 1 hosts"));
    assertEquals("Topology BUS for 4 devices with 1 hosts" + System.lineSeparator(), line);
  }

  @Test
  public void pipelineLoggingKeepsLevelAndSource() {
    assertEquals("[WARNING] blueshare: session s aborted: no host" + System.lineSeparator(),
        formatter.format(record(Level.WARNING, "com.github.blueshare", "session s aborted: no host")));
    assertEquals("[FINE] PhantomEncoder: join cafe" + System.lineSeparator(),
        formatter.format(record(Level.FINE, "com.github.blueshare.privacy.PhantomEncoder", "join cafe")));
  }

  @Test
  public void levelDefaultsToInfo() {
    assertEquals(Level.INFO, LoggerConfig.level(null));
    assertEquals(Level.INFO, LoggerConfig.level(" "));
    assertEquals(Level.INFO, LoggerConfig.level("chatty"));
    assertEquals(Level.FINE, LoggerConfig.level("fine"));
  }

  @Test
  public void initializeDetachesFromTheRootHandlers() {
    LoggerConfig.initialize();
    LoggerConfig.initialize();
    assertFalse(LoggerConfig.BLUESHARE.getUseParentHandlers());
    assertEquals(1, LoggerConfig.BLUESHARE.getHandlers().length);
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.blueshare.demo;

import java.util.Locale;
import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/// Sends everything logged under `com.github.blueshare` to standard out. Narration lines are printed as they are so
/// that a run reads as a transcript of the session. Pipeline logging keeps its level and the short name of the class
/// that logged it. The level comes from the `LOG_LEVEL` environment variable and is `INFO` when unset or unreadable.
public class LoggerConfig {
  static final String BLUESHARE_LOGGER = "com.github.blueshare";

  /// JUL holds loggers weakly so the configured one is pinned here.
  static final Logger BLUESHARE = Logger.getLogger(BLUESHARE_LOGGER);

  private static boolean configured = false;

  public static synchronized void initialize() {
    if (configured) {
      return;
    }
    final Level level = level(System.getenv("LOG_LEVEL"));
    final ConsoleHandler handler = new ConsoleHandler() {{
      setOutputStream(System.out);
    }};
    handler.setLevel(level);
    handler.setFormatter(new TranscriptFormatter());
    BLUESHARE.setLevel(level);
    BLUESHARE.setUseParentHandlers(false);
    BLUESHARE.addHandler(handler);
    configured = true;
  }

  static Level level(String name) {
    final String trimmed = Optional.ofNullable(name).map(String::trim).orElse("");
    if (trimmed.isEmpty()) {
      return Level.INFO;
    }
    try {
      return Level.parse(trimmed.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      System.err.println("LOG_LEVEL=" + name + " is not a log level so INFO is used");
      return Level.INFO;
    }
  }

  static class TranscriptFormatter extends Formatter {
    @Override
    public String format(LogRecord record) {
      final String message = formatMessage(record);
      if (NarrationListener.LOGGER.getName().equals(record.getLoggerName())) {
        return message + System.lineSeparator();
      }
      final var sb = new StringBuilder()
          .append('[').append(record.getLevel().getName()).append("] ")
          .append(shortName(record.getLoggerName())).append(": ")
          .append(message)
          .append(System.lineSeparator());
      if (record.getThrown() != null) {
        sb.append("  ").append(record.getThrown()).append(System.lineSeparator());
      }
      return sb.toString();
    }

    static String shortName(String loggerName) {
      if (loggerName == null || loggerName.equals(BLUESHARE_LOGGER)) {
        return "blueshare";
      }
      return loggerName.substring(loggerName.lastIndexOf('.') + 1);
    }
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/// Routes all logging to standard error, one line per record, as the harness keeps stderr apart from the protocol
/// on stdout. The level comes from the `LOG_LEVEL` environment variable and defaults to `INFO`. Loading the class
/// configures logging, so callers only need [#initialize()].
public final class LoggerConfig {
  static final Level DEFAULT_LEVEL = Level.INFO;

  static {
    configure(System.getenv("LOG_LEVEL"));
  }

  private LoggerConfig() {
  }

  public static void initialize() {
    // the static block has already run
  }

  /// Replaces every root handler with a single stderr handler at the named level.
  static void configure(String levelName) {
    final var level = parseLevel(levelName);
    final var root = Logger.getLogger("");
    for (java.util.logging.Handler existing : root.getHandlers()) {
      root.removeHandler(existing);
    }
    final var stderr = new ConsoleHandler();
    stderr.setLevel(level);
    stderr.setFormatter(new LineFormatter());
    root.setLevel(level);
    root.addHandler(stderr);
  }

  /// @return the named level, or the default for a missing or unknown name such as `DEBUG`.
  static Level parseLevel(String levelName) {
    return Optional.ofNullable(levelName)
        .map(String::trim)
        .filter(name -> !name.isEmpty())
        .map(name -> {
          try {
            return Level.parse(name.toUpperCase(Locale.ROOT));
          } catch (IllegalArgumentException e) {
            System.err.println("unknown LOG_LEVEL " + name + ", using " + DEFAULT_LEVEL);
            return DEFAULT_LEVEL;
          }
        })
        .orElse(DEFAULT_LEVEL);
  }

  /// `[LEVEL] message` with `{0}` style parameters filled in and any stack trace on the following lines.
  static final class LineFormatter extends Formatter {
    @Override
    public String format(LogRecord record) {
      final var line = new StringBuilder()
          .append('[').append(record.getLevel().getName()).append("] ")
          .append(formatMessage(record))
          .append(System.lineSeparator());
      if (record.getThrown() != null) {
        final var trace = new StringWriter();
        record.getThrown().printStackTrace(new PrintWriter(trace));
        line.append(trace);
      }
      return line.toString();
    }
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.network;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReentrantLock;

import static com.github.trex_glomers.NodeLogger.LOGGER;

/// Writes each line followed by a newline and flushes so the harness sees it immediately. Writes from concurrent
/// threads never interleave within a line.
public class StdoutTransport implements Transport {
  private final Writer out;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile boolean closed = false;

  public StdoutTransport(OutputStream out) {
    this.out = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
  }

  @Override
  public void send(String line) {
    if (closed) {
      LOGGER.fine(() -> "transport closed, dropping " + line);
      return;
    }
    lock.lock();
    try {
      out.write(line);
      out.write('\n');
      out.flush();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write to stdout", e);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    closed = true;
    lock.lock();
    try {
      out.flush();
    } catch (IOException e) {
      LOGGER.warning(() -> "Error flushing stdout on close: " + e.getMessage());
    } finally {
      lock.unlock();
    }
  }
}

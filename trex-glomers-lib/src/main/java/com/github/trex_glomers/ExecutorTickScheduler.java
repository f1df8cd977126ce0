// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

import static com.github.trex_glomers.NodeLogger.LOGGER;

/// A [TickScheduler] on a single daemon timer thread. Tasks must be short as they share the thread. A task that
/// throws is logged and a periodic task keeps its schedule.
public class ExecutorTickScheduler implements TickScheduler {
  private final ScheduledThreadPoolExecutor executor;
  private final AtomicBoolean running = new AtomicBoolean(true);

  public ExecutorTickScheduler(String name) {
    final var count = new AtomicInteger();
    this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
      final var thread = new Thread(runnable, name + "-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    this.executor.setRemoveOnCancelPolicy(true);
    this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
  }

  @Override
  public void schedule(Duration delay, Runnable task) {
    if (!running.get()) {
      return;
    }
    try {
      executor.schedule(guarded(task), delay.toNanos(), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      LOGGER.fine(() -> "scheduler closed, not scheduling task");
    }
  }

  @Override
  public void every(Duration period, Runnable task) {
    if (!running.get()) {
      return;
    }
    LOGGER.fine(() -> "scheduling periodic task every " + period.toMillis() + "ms");
    try {
      executor.scheduleAtFixedRate(guarded(task), period.toNanos(), period.toNanos(), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      LOGGER.fine(() -> "scheduler closed, not scheduling periodic task");
    }
  }

  private Runnable guarded(Runnable task) {
    return () -> {
      if (!running.get()) {
        return;
      }
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.log(Level.SEVERE, "timer task failed: " + e.getMessage(), e);
      }
    };
  }

  @Override
  public void close() {
    if (running.compareAndSet(true, false)) {
      executor.shutdownNow();
    }
  }
}

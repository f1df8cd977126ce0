// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import java.time.Duration;

/// Runs the timer driven work of a node: request resends and the periodic gossip and anti-entropy ticks.
/// Production uses [ExecutorTickScheduler]. Simulations drive time by hand so that runs are repeatable.
public interface TickScheduler extends AutoCloseable {
  /// Runs the task once after the delay.
  void schedule(Duration delay, Runnable task);

  /// Runs the task every period, first after one period, until closed.
  void every(Duration period, Runnable task);

  @Override
  void close();
}

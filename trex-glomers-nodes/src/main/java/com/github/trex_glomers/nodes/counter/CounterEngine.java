// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.counter;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.github.trex_glomers.NodeLogger.LOGGER;

/// The replica of the counter held at one node. Updates replace an immutable [GCounter] atomically so handler
/// threads and the anti-entropy timer never see a partial update.
public class CounterEngine {
  private final String nodeId;
  private final AtomicReference<GCounter> state = new AtomicReference<>(GCounter.empty());

  public CounterEngine(String nodeId) {
    this.nodeId = nodeId;
  }

  /// Adds to this node's own entry.
  ///
  /// @throws IllegalArgumentException if the delta is negative.
  /// @throws ArithmeticException if the entry would overflow.
  public void add(long delta) {
    final var updated = state.updateAndGet(counter -> counter.increment(nodeId, delta));
    LOGGER.finer(() -> nodeId + " added " + delta + " now " + updated.get(nodeId));
  }

  /// Merges a snapshot received from a peer.
  ///
  /// @throws IllegalArgumentException if the snapshot has a negative entry.
  public void merge(Map<String, Long> snapshot) {
    final var incoming = new GCounter(snapshot);
    state.updateAndGet(counter -> counter.merge(incoming));
  }

  /// @return the sum of every entry seen so far, which converges on the cluster total.
  public long value() {
    return state.get().value();
  }

  public GCounter snapshot() {
    return state.get();
  }
}

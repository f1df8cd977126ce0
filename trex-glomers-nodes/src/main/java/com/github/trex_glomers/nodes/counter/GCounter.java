// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.counter;

import java.util.Map;
import java.util.TreeMap;

/// An immutable grow-only counter. Each node only increments its own entry and the value is the sum of all
/// entries. Merging takes the larger of each pair of entries so it is commutative, associative and idempotent and
/// replicas converge whatever order or how many times they see each other's state.
///
/// @param counts node id to the count that node has added. Entries are never negative.
public record GCounter(Map<String, Long> counts) {
  public GCounter {
    counts.forEach((node, count) -> {
      if (node == null || count == null || count < 0) {
        throw new IllegalArgumentException("invalid entry " + node + "=" + count);
      }
    });
    counts = Map.copyOf(counts);
  }

  public static GCounter empty() {
    return new GCounter(Map.of());
  }

  /// @throws IllegalArgumentException if the delta is negative.
  /// @throws ArithmeticException if the entry would overflow.
  public GCounter increment(String node, long delta) {
    if (delta < 0) {
      throw new IllegalArgumentException("a grow-only counter cannot add " + delta);
    }
    if (delta == 0) {
      return this;
    }
    final var next = new TreeMap<>(counts);
    next.put(node, Math.addExact(get(node), delta));
    return new GCounter(next);
  }

  public GCounter merge(GCounter other) {
    final var next = new TreeMap<>(counts);
    other.counts.forEach((node, count) -> next.merge(node, count, Math::max));
    return next.equals(counts) ? this : new GCounter(next);
  }

  public long get(String node) {
    return counts.getOrDefault(node, 0L);
  }

  /// @throws ArithmeticException if the sum overflows.
  public long value() {
    return counts.values().stream().reduce(0L, Math::addExact);
  }
}

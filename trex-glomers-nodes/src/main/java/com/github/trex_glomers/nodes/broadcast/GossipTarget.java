// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.broadcast;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// The values one neighbor has not yet acknowledged. Values leave only when that neighbor acknowledges them or
/// shows it has them by gossiping them to us. Time alone never clears a value so a neighbor that is partitioned away
/// receives everything it missed once the partition heals. Not thread safe, guarded by the [BroadcastEngine].
final class GossipTarget {
  private final String neighbor;
  private final Set<Long> unacknowledged = new LinkedHashSet<>();

  GossipTarget(String neighbor) {
    this.neighbor = neighbor;
  }

  String neighbor() {
    return neighbor;
  }

  void add(long value) {
    unacknowledged.add(value);
  }

  void addAll(Collection<Long> values) {
    unacknowledged.addAll(values);
  }

  /// @return how many of the values were still pending.
  int acknowledge(Collection<Long> values) {
    int removed = 0;
    for (var value : values) {
      if (unacknowledged.remove(value)) {
        removed++;
      }
    }
    return removed;
  }

  boolean isEmpty() {
    return unacknowledged.isEmpty();
  }

  /// @return every pending value in the order it became pending.
  List<Long> batch() {
    return List.copyOf(unacknowledged);
  }

  @Override
  public String toString() {
    return "GossipTarget(" + neighbor + ", pending=" + unacknowledged.size() + ")";
  }
}

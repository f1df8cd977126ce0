// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.unique_ids;

import com.github.f4b6a3.uuid.UuidCreator;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/// Generates ids that are unique across the cluster without talking to any other node.
///
/// An id is `<node id>-<incarnation>-<sequence>`. Node ids are unique within the cluster so two nodes never clash.
/// The sequence is a strictly increasing counter so one process never repeats itself. The incarnation is a time
/// ordered UUID taken when the generator is built so a restarted node does not repeat the ids of its previous
/// process even though its counter starts again from one.
public class UniqueIdGenerator {
  private final String nodeId;
  private final UUID incarnation;
  private final AtomicLong sequence = new AtomicLong();

  public UniqueIdGenerator(String nodeId) {
    this(nodeId, UuidCreator.getTimeOrderedEpoch());
  }

  UniqueIdGenerator(String nodeId, UUID incarnation) {
    this.nodeId = Objects.requireNonNull(nodeId, "nodeId cannot be null");
    this.incarnation = Objects.requireNonNull(incarnation, "incarnation cannot be null");
  }

  public String next() {
    return nodeId + "-" + incarnation + "-" + sequence.incrementAndGet();
  }

  public UUID incarnation() {
    return incarnation;
  }

  /// @return how many ids this generator has handed out.
  public long generated() {
    return sequence.get();
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.broadcast;

import org.jetbrains.annotations.TestOnly;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

import static com.github.trex_glomers.NodeLogger.LOGGER;

/// The state of gossip broadcast at one node: the log of delivered values and, per neighbor, the values that
/// neighbor has not acknowledged.
///
/// The engine does no I/O. Its operations return what should be sent and the [BroadcastWorkload] sends it. Each
/// value moves through `unseen -> delivered -> acknowledged` where acknowledgement is tracked per neighbor:
///
/// - a value delivered here becomes pending for every neighbor other than the one it came from.
/// - a pending value is gossiped to its neighbor on every tick until the neighbor acknowledges it.
/// - the log only grows so a delivered value is never lost.
///
/// Gossip ticks run on a timer thread while messages are handled on handler threads, so state changes are
/// serialized with a single permit semaphore.
public class BroadcastEngine {
  private final Set<Long> delivered = new LinkedHashSet<>();
  private final Map<String, GossipTarget> targets = new LinkedHashMap<>();
  private final Semaphore mutex = new Semaphore(1);

  /// Sets the neighbors gossip is sent to. A new neighbor starts with every value delivered so far pending. A
  /// neighbor that is kept keeps its pending values.
  public void topology(List<String> neighbors) {
    locked(() -> {
      final var retained = new LinkedHashMap<String, GossipTarget>();
      for (var neighbor : neighbors) {
        var target = targets.get(neighbor);
        if (target == null) {
          target = new GossipTarget(neighbor);
          target.addAll(delivered);
        }
        retained.put(neighbor, target);
      }
      targets.clear();
      targets.putAll(retained);
      LOGGER.fine(() -> "gossip neighbors now " + targets.keySet());
      return null;
    });
  }

  /// A value broadcast by a client to this node.
  ///
  /// @return true if the value was new here.
  public boolean broadcast(long value) {
    return locked(() -> deliver(value, null));
  }

  /// A batch of values gossiped by a peer. New values are passed on to every other neighbor. The peer evidently has
  /// every value in the batch so they stop being pending for it.
  ///
  /// @return the values that were new here.
  public List<Long> gossip(String from, Collection<Long> values) {
    return locked(() -> {
      final var fresh = new ArrayList<Long>();
      for (var value : values) {
        if (deliver(value, from)) {
          fresh.add(value);
        }
      }
      final var target = targets.get(from);
      if (target != null) {
        target.acknowledge(values);
      }
      return List.copyOf(fresh);
    });
  }

  /// The peer acknowledged receipt of a batch.
  public void acknowledge(String from, Collection<Long> values) {
    locked(() -> {
      final var target = targets.get(from);
      if (target != null) {
        final var removed = target.acknowledge(values);
        LOGGER.finer(() -> from + " acknowledged " + removed + " of " + values.size());
      }
      return null;
    });
  }

  /// The batches for one gossip tick. Nothing is cleared, values stay pending until acknowledged.
  ///
  /// @return neighbor to every value still pending for it, only for neighbors with something pending.
  public Map<String, List<Long>> pendingBatches() {
    return locked(() -> {
      final var batches = new LinkedHashMap<String, List<Long>>();
      targets.values().stream()
          .filter(target -> !target.isEmpty())
          .forEach(target -> batches.put(target.neighbor(), target.batch()));
      return batches;
    });
  }

  /// @return a snapshot of every delivered value in delivery order.
  public List<Long> read() {
    return locked(() -> List.copyOf(delivered));
  }

  public List<String> neighbors() {
    return locked(() -> List.copyOf(targets.keySet()));
  }

  @TestOnly
  public Set<Long> pending(String neighbor) {
    return locked(() -> {
      final var target = targets.get(neighbor);
      return target == null ? Set.of() : Set.copyOf(target.batch());
    });
  }

  private boolean deliver(long value, String from) {
    if (!delivered.add(value)) {
      return false;
    }
    targets.values().stream()
        .filter(target -> !target.neighbor().equals(from))
        .forEach(target -> target.add(value));
    LOGGER.finer(() -> "delivered " + value + (from == null ? "" : " from " + from));
    return true;
  }

  private <T> T locked(Supplier<T> action) {
    try {
      mutex.acquire();
      try {
        return action.get();
      } finally {
        mutex.release();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("BroadcastEngine was interrupted awaiting the mutex", e);
    }
  }
}

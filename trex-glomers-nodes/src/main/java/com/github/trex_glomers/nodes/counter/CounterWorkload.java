// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.counter;

import com.github.trex_glomers.Node;
import com.github.trex_glomers.Workload;
import com.github.trex_glomers.msg.Body;
import com.github.trex_glomers.msg.ErrorCode;
import com.github.trex_glomers.msg.NodeException;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.github.trex_glomers.NodeLogger.LOGGER;

/// A grow-only counter replicated by anti-entropy. `add` increments this node's entry, `read` answers the sum of
/// the local replica and every anti-entropy tick sends the whole replica to every other node as `replicate`.
/// Lost `replicate` messages need no resend as the next tick carries a newer snapshot.
public class CounterWorkload implements Workload {
  public static final String NAME = "g-counter";

  record Add(long delta) {
  }

  record ReadOk(long value) {
  }

  record Replicate(Map<String, Long> counters) {
  }

  private final AtomicReference<CounterEngine> engine = new AtomicReference<>();

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void install(Node node) {
    node.onInit(identity -> {
      engine.set(new CounterEngine(identity.nodeId()));
      node.every(node.config().antiEntropyInterval(), () -> antiEntropyTick(node));
    });
    node.on("add", request -> {
      final var delta = request.body().payload(Add.class).delta();
      try {
        engine().add(delta);
      } catch (IllegalArgumentException | ArithmeticException e) {
        throw new NodeException(ErrorCode.MALFORMED_REQUEST, "cannot add " + delta + ": " + e.getMessage());
      }
      node.reply(request, Body.of("add_ok"));
    });
    node.on("read", request -> node.reply(request, Body.of("read_ok", new ReadOk(engine().value()))));
    node.on("replicate", message -> {
      try {
        engine().merge(message.body().payload(Replicate.class).counters());
      } catch (IllegalArgumentException e) {
        throw new NodeException(ErrorCode.MALFORMED_REQUEST, "rejecting snapshot from " + message.src() + ": " + e.getMessage());
      }
    });
  }

  void antiEntropyTick(Node node) {
    final var snapshot = engine().snapshot();
    final var others = node.identity().otherNodes();
    LOGGER.finer(() -> node.identity().nodeId() + " replicating " + snapshot + " to " + others);
    others.forEach(peer -> node.send(peer, Body.of("replicate", new Replicate(snapshot.counts()))));
  }

  public CounterEngine engine() {
    final var current = engine.get();
    if (current == null) {
      throw new NodeException(ErrorCode.TEMPORARILY_UNAVAILABLE, "counter is not ready");
    }
    return current;
  }
}

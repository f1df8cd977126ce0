// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.broadcast;

import com.github.trex_glomers.Node;
import com.github.trex_glomers.Workload;
import com.github.trex_glomers.msg.Body;
import com.github.trex_glomers.msg.Message;
import org.jetbrains.annotations.TestOnly;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.github.trex_glomers.NodeLogger.LOGGER;

/// Gossip broadcast. Clients send `broadcast`, `read` and `topology`. Nodes exchange `gossip` batches and answer
/// them with `gossip_ok` naming the values received.
///
/// ```
/// client -> n1  broadcast {message: 5}      n1 -> client  broadcast_ok
/// n1 -> n2      gossip {messages: [5]}      n2 -> n1      gossip_ok {messages: [5]}
/// client -> n2  read                        n2 -> client  read_ok {messages: [5]}
/// ```
///
/// Clients are answered as soon as the value is in the local log. Dissemination happens on the gossip tick.
public class BroadcastWorkload implements Workload {
  public static final String NAME = "broadcast";

  record BroadcastRequest(long message) {
  }

  record Topology(Map<String, List<String>> topology) {
    Topology {
      topology.forEach((node, neighbors) -> {
        if (neighbors == null || neighbors.stream().anyMatch(Objects::isNull)) {
          throw new IllegalArgumentException("topology entry for " + node + " has a null neighbor");
        }
      });
      topology = Map.copyOf(topology);
    }
  }

  /// A batch of values. Bound before the engine sees any of it so a bad batch changes nothing.
  record Messages(List<Long> messages) {
    Messages {
      if (messages.stream().anyMatch(Objects::isNull)) {
        throw new IllegalArgumentException("messages cannot contain null");
      }
      messages = List.copyOf(messages);
    }
  }

  private final BroadcastEngine engine;

  public BroadcastWorkload() {
    this(new BroadcastEngine());
  }

  BroadcastWorkload(BroadcastEngine engine) {
    this.engine = engine;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void install(Node node) {
    node.on("topology", request -> topology(node, request));
    node.on("broadcast", request -> {
      final var value = request.body().payload(BroadcastRequest.class).message();
      if (engine.broadcast(value)) {
        LOGGER.fine(() -> node.identity().nodeId() + " accepted broadcast " + value + " from " + request.src());
      }
      node.reply(request, Body.of("broadcast_ok"));
    });
    node.on("read", request -> node.reply(request, Body.of("read_ok", new Messages(engine.read()))));
    node.on("gossip", request -> {
      final var values = request.body().payload(Messages.class).messages();
      final var fresh = engine.gossip(request.src(), values);
      LOGGER.finer(() -> node.identity().nodeId() + " gossip from " + request.src() + " had " + fresh.size() + " new");
      node.reply(request, Body.of("gossip_ok", new Messages(values)));
    });
    node.on("gossip_ok", reply ->
        engine.acknowledge(reply.src(), reply.body().payload(Messages.class).messages()));
    node.onInit(identity -> {
      // until the harness sends a topology every other node is a neighbor
      engine.topology(identity.otherNodes());
      node.every(node.config().gossipInterval(), () -> gossipTick(node));
    });
  }

  private void topology(Node node, Message request) {
    final var self = node.identity().nodeId();
    final var topology = request.body().payload(Topology.class).topology();
    final var neighbors = topology.get(self);
    if (neighbors == null) {
      LOGGER.warning(() -> "topology has no entry for " + self + ", gossiping to every other node");
      engine.topology(node.identity().otherNodes());
    } else {
      final var peers = neighbors.stream().filter(neighbor -> !neighbor.equals(self)).toList();
      LOGGER.info(() -> self + " neighbors " + peers);
      engine.topology(peers);
    }
    node.reply(request, Body.of("topology_ok"));
  }

  /// Sends every neighbor all the values it has not acknowledged as one batch.
  void gossipTick(Node node) {
    engine.pendingBatches().forEach((neighbor, batch) -> {
      LOGGER.finer(() -> node.identity().nodeId() + " gossiping " + batch.size() + " values to " + neighbor);
      node.send(neighbor, Body.of("gossip", new Messages(batch)));
    });
  }

  @TestOnly
  public BroadcastEngine engine() {
    return engine;
  }
}

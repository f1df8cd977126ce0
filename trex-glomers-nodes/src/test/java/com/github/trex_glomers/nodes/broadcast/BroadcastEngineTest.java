// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.broadcast;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class BroadcastEngineTest {
  final BroadcastEngine engine = new BroadcastEngine();

  @BeforeEach
  void neighbors() {
    engine.topology(List.of("n2", "n3"));
  }

  @Test
  public void broadcastValueIsPendingForEveryNeighborUntilAcknowledged() {
    assertThat(engine.broadcast(5)).isTrue();
    assertThat(engine.read()).containsExactly(5L);
    assertThat(engine.pendingBatches()).isEqualTo(Map.of("n2", List.of(5L), "n3", List.of(5L)));

    engine.acknowledge("n2", List.of(5L));

    assertThat(engine.pending("n2")).isEmpty();
    assertThat(engine.pending("n3")).containsExactlyInAnyOrder(5L);
    assertThat(engine.pendingBatches()).isEqualTo(Map.of("n3", List.of(5L)));
  }

  @Test
  public void batchesRepeatUntilAcknowledged() {
    engine.broadcast(1);
    engine.pendingBatches();

    assertThat(engine.pendingBatches()).containsEntry("n2", List.of(1L));
  }

  @Test
  public void duplicatesAreDeliveredOnce() {
    engine.broadcast(5);

    assertThat(engine.broadcast(5)).isFalse();
    assertThat(engine.gossip("n2", List.of(5L))).isEmpty();
    assertThat(engine.read()).containsExactly(5L);
  }

  @Test
  public void gossipIsPassedOnToEveryoneButTheSender() {
    final var fresh = engine.gossip("n2", List.of(7L, 8L));

    assertThat(fresh).containsExactly(7L, 8L);
    assertThat(engine.pending("n2")).isEmpty();
    assertThat(engine.pending("n3")).containsExactlyInAnyOrder(7L, 8L);
  }

  @Test
  public void gossipFromANeighborShowsItHasThoseValues() {
    engine.broadcast(5);

    engine.gossip("n3", List.of(5L, 6L));

    assertThat(engine.pending("n3")).isEmpty();
    assertThat(engine.pending("n2")).containsExactlyInAnyOrder(5L, 6L);
  }

  @Test
  public void gossipFromOutsideTheTopologyStillSpreads() {
    engine.gossip("n9", List.of(3L));

    assertThat(engine.read()).containsExactly(3L);
    assertThat(engine.pending("n2")).containsExactlyInAnyOrder(3L);
    assertThat(engine.pending("n3")).containsExactlyInAnyOrder(3L);
  }

  @Test
  public void topologyChangeSeedsNewNeighborsAndKeepsRetainedPending() {
    engine.broadcast(1);
    engine.broadcast(2);
    engine.acknowledge("n2", List.of(1L, 2L));
    engine.acknowledge("n3", List.of(1L));

    engine.topology(List.of("n3", "n4"));

    assertThat(engine.neighbors()).containsExactly("n3", "n4");
    assertThat(engine.pending("n3")).containsExactlyInAnyOrder(2L);
    assertThat(engine.pending("n4")).containsExactlyInAnyOrder(1L, 2L);
    assertThat(engine.pending("n2")).isEmpty();
  }

  @Test
  public void acknowledgementsNeverShrinkTheLog() {
    engine.broadcast(1);
    engine.broadcast(2);
    engine.acknowledge("n2", List.of(1L, 2L));
    engine.acknowledge("n3", List.of(1L, 2L, 99L));
    engine.topology(List.of());

    assertThat(engine.read()).containsExactly(1L, 2L);
    assertThat(engine.pendingBatches()).isEmpty();
  }
}

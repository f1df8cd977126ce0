// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.counter;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CounterEngineTest {
  final CounterEngine engine = new CounterEngine("n1");

  @Test
  public void startsAtZero() {
    assertThat(engine.value()).isZero();
    assertThat(engine.snapshot()).isEqualTo(GCounter.empty());
  }

  @Test
  public void addsToOwnEntry() {
    engine.add(2);
    engine.add(0);
    engine.add(3);

    assertThat(engine.value()).isEqualTo(5);
    assertThat(engine.snapshot().counts()).isEqualTo(Map.of("n1", 5L));
  }

  @Test
  public void negativeDeltaIsRejected() {
    engine.add(1);

    assertThatThrownBy(() -> engine.add(-1)).isInstanceOf(IllegalArgumentException.class);
    assertThat(engine.value()).isEqualTo(1);
  }

  @Test
  public void overflowIsRejected() {
    engine.add(Long.MAX_VALUE);

    assertThatThrownBy(() -> engine.add(1)).isInstanceOf(ArithmeticException.class);
    assertThat(engine.value()).isEqualTo(Long.MAX_VALUE);
  }

  @Test
  public void mergeKeepsTheLargerOfEachEntry() {
    engine.add(4);

    engine.merge(Map.of("n1", 1L, "n2", 7L));
    engine.merge(Map.of("n2", 3L));

    assertThat(engine.snapshot().counts()).isEqualTo(Map.of("n1", 4L, "n2", 7L));
    assertThat(engine.value()).isEqualTo(11);
  }

  @Test
  public void mergeRejectsNegativeEntries() {
    assertThatThrownBy(() -> engine.merge(Map.of("n2", -3L))).isInstanceOf(IllegalArgumentException.class);
    assertThat(engine.value()).isZero();
  }
}

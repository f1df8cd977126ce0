// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class WorkloadsTest {

  @Test
  public void everyWorkloadIsNamed() {
    assertThat(Workloads.names()).containsExactly("echo", "unique-ids", "broadcast", "g-counter");
    Workloads.names().forEach(name ->
        assertThat(Workloads.named(name)).hasValueSatisfying(workload -> assertThat(workload.name()).isEqualTo(name)));
  }

  @Test
  public void eachLookupIsAFreshInstance() {
    assertThat(Workloads.named("broadcast").orElseThrow()).isNotSameAs(Workloads.named("broadcast").orElseThrow());
  }

  @Test
  public void unknownNameIsEmpty() {
    assertThat(Workloads.named("kafka")).isEmpty();
  }

  @Test
  public void badUsageExitsWithTwo() {
    assertThat(Main.run(new String[0])).isEqualTo(2);
    assertThat(Main.run(new String[]{"kafka"})).isEqualTo(2);
    assertThat(Main.run(new String[]{"echo", "extra"})).isEqualTo(2);
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.counter;

import net.jqwik.api.*;
import net.jqwik.api.constraints.LongRange;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class GCounterPropertyTests {

  @Property
  void mergeIsCommutative(@ForAll("counters") GCounter a, @ForAll("counters") GCounter b) {
    assertThat(a.merge(b)).isEqualTo(b.merge(a));
  }

  @Property
  void mergeIsAssociative(@ForAll("counters") GCounter a,
                          @ForAll("counters") GCounter b,
                          @ForAll("counters") GCounter c) {
    assertThat(a.merge(b).merge(c)).isEqualTo(a.merge(b.merge(c)));
  }

  @Property
  void mergeIsIdempotent(@ForAll("counters") GCounter a, @ForAll("counters") GCounter b) {
    assertThat(a.merge(a)).isEqualTo(a);
    assertThat(a.merge(b).merge(b)).isEqualTo(a.merge(b));
  }

  @Property
  void mergeNeverLosesAnIncrement(@ForAll("counters") GCounter a, @ForAll("counters") GCounter b) {
    final var merged = a.merge(b);

    assertThat(merged.value()).isGreaterThanOrEqualTo(Math.max(a.value(), b.value()));
    a.counts().forEach((node, count) -> assertThat(merged.get(node)).isGreaterThanOrEqualTo(count));
  }

  @Property
  void replicasAgreeWhateverTheDeliveryOrder(@ForAll("counters") GCounter a,
                                             @ForAll("counters") GCounter b,
                                             @ForAll("counters") GCounter c) {
    final var one = GCounter.empty().merge(c).merge(a).merge(b).merge(a);
    final var two = GCounter.empty().merge(b).merge(c).merge(a);

    assertThat(one).isEqualTo(two);
  }

  @Property
  void incrementAddsToOneEntry(@ForAll("counters") GCounter a,
                               @ForAll("nodes") String node,
                               @ForAll @LongRange(max = 1_000) long delta) {
    final var incremented = a.increment(node, delta);

    assertThat(incremented.value()).isEqualTo(a.value() + delta);
    assertThat(incremented.merge(a)).isEqualTo(incremented);
  }

  @Provide
  Arbitrary<String> nodes() {
    return Arbitraries.of(List.of("n1", "n2", "n3", "n4"));
  }

  @Provide
  Arbitrary<GCounter> counters() {
    return Arbitraries.maps(nodes(), Arbitraries.longs().between(0, 1_000_000))
        .ofMaxSize(4)
        .map(GCounter::new);
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes;

import com.github.trex_glomers.Workload;
import com.github.trex_glomers.nodes.broadcast.BroadcastWorkload;
import com.github.trex_glomers.nodes.counter.CounterWorkload;
import com.github.trex_glomers.nodes.echo.EchoWorkload;
import com.github.trex_glomers.nodes.unique_ids.UniqueIdsWorkload;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/// The workloads a node process can run, by the name used on the command line.
public final class Workloads {
  private static final Map<String, Supplier<Workload>> WORKLOADS = new LinkedHashMap<>();

  static {
    WORKLOADS.put(EchoWorkload.NAME, EchoWorkload::new);
    WORKLOADS.put(UniqueIdsWorkload.NAME, UniqueIdsWorkload::new);
    WORKLOADS.put(BroadcastWorkload.NAME, BroadcastWorkload::new);
    WORKLOADS.put(CounterWorkload.NAME, CounterWorkload::new);
  }

  private Workloads() {
  }

  /// @return a fresh instance of the named workload.
  public static Optional<Workload> named(String name) {
    return Optional.ofNullable(WORKLOADS.get(name)).map(Supplier::get);
  }

  public static Set<String> names() {
    return WORKLOADS.keySet();
  }
}

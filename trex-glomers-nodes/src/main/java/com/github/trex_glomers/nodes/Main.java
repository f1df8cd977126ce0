// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes;

import com.github.trex_glomers.LoggerConfig;
import com.github.trex_glomers.Node;
import com.github.trex_glomers.NodeConfig;
import com.github.trex_glomers.network.StdoutTransport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;

import static com.github.trex_glomers.NodeLogger.LOGGER;

/// Runs one node process for the workload named by the only argument:
///
/// ```
/// maelstrom test -w broadcast --bin ./broadcast.sh --node-count 5 --time-limit 20 --rate 10 --nemesis partition
/// ```
///
/// where `broadcast.sh` runs `java -jar trex-glomers-nodes.jar broadcast`. Exits 0 when the harness closes
/// standard input, 1 on a fatal fault and 2 on bad usage.
public class Main {
  public static void main(String[] args) {
    LoggerConfig.initialize();
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args.length != 1) {
      System.err.println("usage: Main <workload> where workload is one of " + Workloads.names());
      return 2;
    }
    final var workload = Workloads.named(args[0]);
    if (workload.isEmpty()) {
      System.err.println("unknown workload " + args[0] + ", expected one of " + Workloads.names());
      return 2;
    }
    final NodeConfig config;
    try {
      config = NodeConfig.fromEnvironment(System.getenv());
    } catch (IllegalArgumentException e) {
      LOGGER.severe(() -> "invalid configuration: " + e.getMessage());
      return 1;
    }
    LOGGER.info(() -> "starting " + workload.get().name() + " with " + config);
    try (var node = new Node(config, new StdoutTransport(System.out))) {
      workload.get().install(node);
      node.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
      return 0;
    } catch (IOException | RuntimeException e) {
      LOGGER.log(Level.SEVERE, "fatal: " + e.getMessage(), e);
      return 1;
    }
  }
}

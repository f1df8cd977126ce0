// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.echo;

import com.github.trex_glomers.Node;
import com.github.trex_glomers.Workload;

/// Answers `echo` with `echo_ok` carrying every field of the request unchanged.
public class EchoWorkload implements Workload {
  public static final String NAME = "echo";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void install(Node node) {
    node.on("echo", request -> node.reply(request, request.body().withType("echo_ok")));
  }
}

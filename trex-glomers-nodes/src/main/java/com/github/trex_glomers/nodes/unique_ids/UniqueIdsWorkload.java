// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.nodes.unique_ids;

import com.github.trex_glomers.Node;
import com.github.trex_glomers.Workload;
import com.github.trex_glomers.msg.Body;
import com.github.trex_glomers.msg.ErrorCode;
import com.github.trex_glomers.msg.NodeException;

import java.util.concurrent.atomic.AtomicReference;

/// Answers `generate` with `generate_ok` carrying a cluster unique id. A resent `generate` keeps its `msg_id`
/// and is answered from the node's reply cache so one logical request never yields two ids.
public class UniqueIdsWorkload implements Workload {
  public static final String NAME = "unique-ids";

  record GenerateOk(String id) {
  }

  private final AtomicReference<UniqueIdGenerator> generator = new AtomicReference<>();

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void install(Node node) {
    node.onInit(identity -> generator.set(new UniqueIdGenerator(identity.nodeId())));
    node.on("generate", request -> {
      final var ids = generator.get();
      if (ids == null) {
        throw new NodeException(ErrorCode.TEMPORARILY_UNAVAILABLE, "id generator is not ready");
      }
      node.reply(request, Body.of("generate_ok", new GenerateOk(ids.next())));
    });
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import java.util.List;
import java.util.Objects;

/// Who this node is and who else is in the cluster. Delivered once by the `init` handshake and never changed.
///
/// @param nodeId  This node's id such as `n1`.
/// @param nodeIds Every node in the cluster in the order the harness gave them, including this one.
public record NodeIdentity(String nodeId, List<String> nodeIds) {
  public NodeIdentity {
    Objects.requireNonNull(nodeId, "nodeId cannot be null");
    nodeIds = List.copyOf(nodeIds);
    if (!nodeIds.contains(nodeId)) {
      throw new IllegalArgumentException("node_ids " + nodeIds + " does not contain node_id " + nodeId);
    }
  }

  /// @return every node except this one in cluster order.
  public List<String> otherNodes() {
    return nodeIds.stream()
        .filter(node -> !node.equals(nodeId))
        .toList();
  }
}

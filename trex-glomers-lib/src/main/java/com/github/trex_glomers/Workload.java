// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

/// One distributed algorithm a node can run. Installing it registers its handlers and starts any periodic ticks
/// once the node knows its identity.
public interface Workload {
  /// @return the name the workload is selected by on the command line.
  String name();

  void install(Node node);
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.network;

import java.io.Closeable;

/// The node is agnostic to where its encoded lines go. In production they go to standard output where the harness
/// routes them. In tests they go into an in-memory network. Sends are fire-and-forget and must be safe to call
/// from handler threads and timer threads concurrently.
public interface Transport extends Closeable {
  /// @param line one encoded message without a line terminator.
  void send(String line);

  @Override
  void close();
}

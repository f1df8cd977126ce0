// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import com.github.trex_glomers.msg.Message;

/// Handles one inbound message type. A handler reads its fields, updates the state of the component that owns it
/// and sends zero or more messages through the [Node]. Throwing a
/// [com.github.trex_glomers.msg.NodeException] answers the sender with that error.
@FunctionalInterface
public interface Handler {
  void handle(Message message);
}

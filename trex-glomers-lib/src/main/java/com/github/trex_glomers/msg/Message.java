// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.msg;

import java.util.Objects;

/// One line of the protocol: who sent it, who it is for and what it says.
///
/// @param src  The sending node or client id such as `n1` or `c4`.
/// @param dest The destination node, client or harness service id such as `seq-kv`.
/// @param body The typed body.
public record Message(String src, String dest, Body body) {
  public Message {
    Objects.requireNonNull(src, "src cannot be null");
    Objects.requireNonNull(dest, "dest cannot be null");
    Objects.requireNonNull(body, "body cannot be null");
  }

  public String type() {
    return body.type();
  }

  public boolean isReply() {
    return body.inReplyTo() != null;
  }
}

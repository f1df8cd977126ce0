// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.msg;

import java.util.Optional;

/// A failure that is reported to the remote side as an `error` body. Handlers throw it to reject a request and
/// the runtime completes request futures with it when a peer answers with an error or never answers at all.
/// Codes outside the standard table are preserved as plain integers.
public class NodeException extends RuntimeException {
  private final int code;

  public NodeException(ErrorCode errorCode, String text) {
    this(errorCode.code(), text);
  }

  public NodeException(int code, String text) {
    super(text);
    this.code = code;
  }

  public int code() {
    return code;
  }

  public Optional<ErrorCode> errorCode() {
    return ErrorCode.of(code);
  }

  /// Unknown codes are treated as indefinite.
  public boolean definite() {
    return errorCode().map(ErrorCode::definite).orElse(false);
  }

  public Body toBody() {
    return Body.error(code, getMessage());
  }

  public static NodeException fromBody(Body body) {
    final var code = body.field("code");
    final var text = body.field("text");
    return new NodeException(
        code.canConvertToInt() ? code.intValue() : ErrorCode.CRASH.code(),
        text.isTextual() ? text.textValue() : "error reply without text");
  }
}

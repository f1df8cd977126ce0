// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import java.util.logging.Logger;

/// The shared logger. Standard output carries the protocol so nothing may be logged there. See [LoggerConfig].
public final class NodeLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.trex_glomers");

  private NodeLogger() {
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Maps a message type tag to the handler of the algorithm that owns it.
public class HandlerRegistry {
  /// Handled by the runtime itself.
  public static final Set<String> RESERVED = Set.of("init");

  private final Map<String, Handler> handlers = new ConcurrentHashMap<>();

  public void register(String type, Handler handler) {
    if (RESERVED.contains(type)) {
      throw new IllegalArgumentException("message type is reserved by the runtime: " + type);
    }
    if (handlers.putIfAbsent(type, handler) != null) {
      throw new IllegalStateException("a handler is already registered for message type: " + type);
    }
  }

  public Optional<Handler> lookup(String type) {
    return Optional.ofNullable(handlers.get(type));
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.trex_glomers.msg.Body;
import com.github.trex_glomers.msg.ErrorCode;
import com.github.trex_glomers.msg.Message;
import com.github.trex_glomers.msg.NodeException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.github.trex_glomers.NodeLogger.LOGGER;

/// A client of the key/value services the harness runs alongside the nodes. Each operation is a request through the
/// [Node] so it inherits resends with a stable `msg_id` and fails with the harness error code.
///
/// - [#SEQ_KV] is sequentially consistent.
/// - [#LIN_KV] is linearizable.
/// - [#LWW_KV] is last write wins.
///
/// Failed futures carry a [NodeException] such as [ErrorCode#KEY_DOES_NOT_EXIST] or
/// [ErrorCode#PRECONDITION_FAILED] for a `cas` whose expected value did not match.
public class KvClient {
  public static final String SEQ_KV = "seq-kv";
  public static final String LIN_KV = "lin-kv";
  public static final String LWW_KV = "lww-kv";

  record Read(String key) {
  }

  record Write(String key, Object value) {
  }

  record Cas(String key, Object from, Object to, boolean createIfNotExists) {
  }

  private final Node node;
  private final String service;
  private final Duration timeout;

  public KvClient(Node node, String service) {
    this(node, service, node.config().requestTimeout());
  }

  public KvClient(Node node, String service, Duration timeout) {
    this.node = node;
    this.service = service;
    this.timeout = timeout;
  }

  public CompletableFuture<JsonNode> read(String key) {
    return node.request(service, Body.of("read", new Read(key)), timeout)
        .thenApply(reply -> expect(reply, "read_ok").body().field("value"));
  }

  /// Reads an integer, answering the default when the key has never been written.
  public CompletableFuture<Long> readLong(String key, long defaultValue) {
    return read(key).handle((value, error) -> {
      if (error == null) {
        if (!value.canConvertToLong()) {
          throw new NodeException(ErrorCode.MALFORMED_REQUEST, key + " does not hold an integer: " + value);
        }
        return value.longValue();
      }
      final var cause = unwrap(error);
      if (cause instanceof NodeException e && e.code() == ErrorCode.KEY_DOES_NOT_EXIST.code()) {
        LOGGER.finer(() -> service + " has no key " + key + ", using " + defaultValue);
        return defaultValue;
      }
      throw cause instanceof RuntimeException runtime ? runtime : new CompletionException(cause);
    });
  }

  public CompletableFuture<Void> write(String key, Object value) {
    return node.request(service, Body.of("write", new Write(key, value)), timeout)
        .thenAccept(reply -> expect(reply, "write_ok"));
  }

  public CompletableFuture<Void> cas(String key, Object from, Object to, boolean createIfNotExists) {
    return node.request(service, Body.of("cas", new Cas(key, from, to, createIfNotExists)), timeout)
        .thenAccept(reply -> expect(reply, "cas_ok"));
  }

  private Message expect(Message reply, String type) {
    if (!type.equals(reply.type())) {
      throw new NodeException(ErrorCode.MALFORMED_REQUEST,
          service + " answered " + reply.type() + " where " + type + " was expected");
    }
    return reply;
  }

  private static Throwable unwrap(Throwable error) {
    return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
  }
}

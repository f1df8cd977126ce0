// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import com.github.trex_glomers.msg.Body;
import com.github.trex_glomers.msg.Message;
import com.github.trex_glomers.msg.NodeException;
import org.jetbrains.annotations.TestOnly;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/// The table of outstanding requests keyed by message id. The receive loop resolves entries and the timer thread
/// advances or fails them. Every transition is a single atomic map operation so that an entry is resolved at most
/// once and a late or duplicate reply finds nothing to resolve.
class RequestTracker {

  /// An outstanding request.
  ///
  /// @param msgId   The id the request was sent with. Every resend reuses it.
  /// @param dest    Where the request was sent.
  /// @param body    The stamped body, resent unchanged.
  /// @param attempt How many times it has been transmitted.
  /// @param future  Completed by the first reply, or exceptionally on failure.
  record Pending(long msgId, String dest, Body body, int attempt, CompletableFuture<Message> future) {
    Pending nextAttempt() {
      return new Pending(msgId, dest, body, attempt + 1, future);
    }
  }

  private final ConcurrentHashMap<Long, Pending> pending = new ConcurrentHashMap<>();

  void register(Pending request) {
    if (pending.putIfAbsent(request.msgId(), request) != null) {
      throw new IllegalStateException("msg_id reused for an outstanding request: " + request.msgId());
    }
  }

  /// Resolves the request the reply answers. An `error` reply fails the future with the carried code.
  ///
  /// @return false if no request was waiting, which is the case for duplicate and late replies.
  boolean complete(Message reply) {
    final var inReplyTo = reply.body().inReplyTo();
    if (inReplyTo == null) {
      return false;
    }
    final var request = pending.remove(inReplyTo);
    if (request == null) {
      return false;
    }
    if (reply.body().isError()) {
      request.future().completeExceptionally(NodeException.fromBody(reply.body()));
    } else {
      request.future().complete(reply);
    }
    return true;
  }

  /// Moves a request that is still waiting on the given attempt to the next attempt.
  ///
  /// @return the advanced request to retransmit, or empty if it was resolved in the meantime.
  Optional<Pending> advance(long msgId, int attempt) {
    final var advanced = new AtomicReference<Pending>();
    pending.computeIfPresent(msgId, (id, request) -> {
      if (request.attempt() != attempt) {
        return request;
      }
      final var next = request.nextAttempt();
      advanced.set(next);
      return next;
    });
    return Optional.ofNullable(advanced.get());
  }

  /// Fails a request that is still waiting on the given attempt.
  ///
  /// @return false if it was resolved in the meantime.
  boolean fail(long msgId, int attempt, Throwable cause) {
    final var removed = new AtomicReference<Pending>();
    pending.computeIfPresent(msgId, (id, request) -> {
      if (request.attempt() != attempt) {
        return request;
      }
      removed.set(request);
      return null;
    });
    final var request = removed.get();
    if (request == null) {
      return false;
    }
    request.future().completeExceptionally(cause);
    return true;
  }

  void failAll(Throwable cause) {
    pending.keySet().forEach(msgId -> {
      final var request = pending.remove(msgId);
      if (request != null) {
        request.future().completeExceptionally(cause);
      }
    });
  }

  int size() {
    return pending.size();
  }

  @TestOnly
  Set<Long> outstanding() {
    return Set.copyOf(pending.keySet());
  }
}

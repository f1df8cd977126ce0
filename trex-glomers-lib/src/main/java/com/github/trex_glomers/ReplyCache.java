// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import com.github.trex_glomers.msg.Body;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Remembers the replies already sent so that a resent request, which keeps its `msg_id`, is answered with the
/// same reply rather than handled a second time. The idempotency key is the sender and its message id. The least
/// recently used entries are evicted beyond the capacity.
///
/// A key is claimed when its request is dispatched, before any handler runs, and holds an in-flight marker until the
/// reply is remembered. A copy of the request arriving in between finds the marker and is not handled again.
class ReplyCache {
  record Key(String src, long msgId) {
  }

  /// What dispatch should do with a request.
  enum Claim {
    /// First sight of the key, which is now claimed. Run the handler.
    HANDLE,
    /// Another copy is being handled. Its reply will answer the sender.
    IN_FLIGHT,
    /// Already answered. Re-send the remembered reply.
    ANSWERED
  }

  private final int capacity;
  // a null value is the in-flight marker
  private final LinkedHashMap<Key, Body> replies;

  ReplyCache(int capacity) {
    this.capacity = capacity;
    this.replies = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<Key, Body> eldest) {
        return size() > ReplyCache.this.capacity;
      }
    };
  }

  /// Atomically checks and claims the key of an inbound request. A disabled cache always answers [Claim#HANDLE].
  synchronized Claim claim(String src, long msgId) {
    if (capacity == 0) {
      return Claim.HANDLE;
    }
    final var key = new Key(src, msgId);
    if (!replies.containsKey(key)) {
      replies.put(key, null);
      return Claim.HANDLE;
    }
    return replies.get(key) == null ? Claim.IN_FLIGHT : Claim.ANSWERED;
  }

  /// Gives up a claim whose request will never be handled so that a resend is handled afresh.
  synchronized void release(String src, long msgId) {
    final var key = new Key(src, msgId);
    if (replies.containsKey(key) && replies.get(key) == null) {
      replies.remove(key);
    }
  }

  /// @param reply the reply body without its own `msg_id`.
  synchronized void remember(String src, long msgId, Body reply) {
    if (capacity > 0) {
      replies.put(new Key(src, msgId), reply);
    }
  }

  /// @return the remembered reply, empty while the request is still in flight.
  synchronized Optional<Body> lookup(String src, long msgId) {
    return Optional.ofNullable(replies.get(new Key(src, msgId)));
  }

  synchronized int size() {
    return replies.size();
  }
}

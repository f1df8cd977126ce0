// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import com.github.trex_glomers.msg.Body;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ReplyCacheTest {

  @Test
  public void keyIsSenderAndMessageId() {
    final var cache = new ReplyCache(10);
    cache.remember("c1", 1, Body.of("a_ok"));

    assertThat(cache.lookup("c1", 1)).contains(Body.of("a_ok"));
    assertThat(cache.lookup("c2", 1)).isEmpty();
    assertThat(cache.lookup("c1", 2)).isEmpty();
  }

  @Test
  public void evictsLeastRecentlyUsed() {
    final var cache = new ReplyCache(2);
    cache.remember("c1", 1, Body.of("one"));
    cache.remember("c1", 2, Body.of("two"));
    cache.lookup("c1", 1);
    cache.remember("c1", 3, Body.of("three"));

    assertThat(cache.size()).isEqualTo(2);
    assertThat(cache.lookup("c1", 1)).isPresent();
    assertThat(cache.lookup("c1", 2)).isEmpty();
    assertThat(cache.lookup("c1", 3)).isPresent();
  }

  @Test
  public void zeroCapacityDisables() {
    final var cache = new ReplyCache(0);
    cache.remember("c1", 1, Body.of("a_ok"));

    assertThat(cache.lookup("c1", 1)).isEmpty();
  }

  @Test
  public void claimMovesFromHandleToInFlightToAnswered() {
    final var cache = new ReplyCache(10);

    assertThat(cache.claim("c1", 5)).isEqualTo(ReplyCache.Claim.HANDLE);
    assertThat(cache.claim("c1", 5)).isEqualTo(ReplyCache.Claim.IN_FLIGHT);
    assertThat(cache.lookup("c1", 5)).isEmpty();

    cache.remember("c1", 5, Body.of("add_ok"));

    assertThat(cache.claim("c1", 5)).isEqualTo(ReplyCache.Claim.ANSWERED);
    assertThat(cache.lookup("c1", 5)).contains(Body.of("add_ok"));
  }

  @Test
  public void releasedClaimCanBeHandledAgain() {
    final var cache = new ReplyCache(10);
    cache.claim("c1", 5);

    cache.release("c1", 5);

    assertThat(cache.claim("c1", 5)).isEqualTo(ReplyCache.Claim.HANDLE);
  }

  @Test
  public void releaseKeepsRememberedReplies() {
    final var cache = new ReplyCache(10);
    cache.claim("c1", 5);
    cache.remember("c1", 5, Body.of("add_ok"));

    cache.release("c1", 5);

    assertThat(cache.claim("c1", 5)).isEqualTo(ReplyCache.Claim.ANSWERED);
  }

  @Test
  public void disabledCacheAlwaysHandles() {
    final var cache = new ReplyCache(0);

    assertThat(cache.claim("c1", 5)).isEqualTo(ReplyCache.Claim.HANDLE);
    assertThat(cache.claim("c1", 5)).isEqualTo(ReplyCache.Claim.HANDLE);
  }
}

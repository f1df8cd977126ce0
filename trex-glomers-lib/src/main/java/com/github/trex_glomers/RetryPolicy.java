// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import java.time.Duration;

/// Capped exponential backoff for unanswered requests. The first wait is the request timeout and each further wait
/// doubles until it reaches `maxBackoff`. A request is transmitted at most `maxAttempts` times and then fails.
///
/// @param maxBackoff  The longest wait between two transmissions.
/// @param maxAttempts The number of transmissions including the first.
public record RetryPolicy(Duration maxBackoff, int maxAttempts) {
  public RetryPolicy {
    if (maxBackoff == null || maxBackoff.isNegative() || maxBackoff.isZero()) {
      throw new IllegalArgumentException("maxBackoff must be positive: " + maxBackoff);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least one: " + maxAttempts);
    }
  }

  /// @param attempt the number of transmissions made so far, starting at one.
  /// @param timeout the timeout the caller gave for a single attempt.
  /// @return how long to wait for a reply to that transmission.
  public Duration delayAfter(int attempt, Duration timeout) {
    final var shift = Math.min(attempt - 1, 30);
    final var millis = timeout.toMillis() << shift;
    if (millis < 0 || millis > maxBackoff.toMillis()) {
      return timeout.compareTo(maxBackoff) > 0 ? timeout : maxBackoff;
    }
    return Duration.ofMillis(millis);
  }

  /// @return the longest time from first transmission until the request fails.
  public Duration ceiling(Duration timeout) {
    var total = Duration.ZERO;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      total = total.plus(delayAfter(attempt, timeout));
    }
    return total;
  }
}

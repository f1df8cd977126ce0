// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import lombok.With;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/// Immutable timing and sizing configuration of a node.
///
/// Start from [#defaults()] or [#fromEnvironment(Map)] and adjust with the generated `with` methods:
///
/// ```java
/// var config = NodeConfig.defaults().withGossipInterval(Duration.ofMillis(50));
/// ```
///
/// @param requestTimeout      How long a request waits for its first reply before it is resent.
/// @param maxBackoff          The cap on the doubling wait between resends.
/// @param maxAttempts         How many times a request is transmitted before it fails with a timeout.
/// @param gossipInterval      The period of the broadcast gossip tick.
/// @param antiEntropyInterval The period of the counter replication tick.
/// @param replyCacheSize      How many sent replies are remembered to answer retried requests.
/// @param shutdownGrace       How long in-flight handlers may run after input closes.
@With
public record NodeConfig(
    Duration requestTimeout,
    Duration maxBackoff,
    int maxAttempts,
    Duration gossipInterval,
    Duration antiEntropyInterval,
    int replyCacheSize,
    Duration shutdownGrace
) {
  public static final String ENV_PREFIX = "GLOMERS_";

  public NodeConfig {
    requirePositive(requestTimeout, "requestTimeout");
    requirePositive(maxBackoff, "maxBackoff");
    requirePositive(gossipInterval, "gossipInterval");
    requirePositive(antiEntropyInterval, "antiEntropyInterval");
    if (shutdownGrace == null || shutdownGrace.isNegative()) {
      throw new IllegalArgumentException("shutdownGrace must not be negative: " + shutdownGrace);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least one: " + maxAttempts);
    }
    if (replyCacheSize < 0) {
      throw new IllegalArgumentException("replyCacheSize must not be negative: " + replyCacheSize);
    }
  }

  public static NodeConfig defaults() {
    return new NodeConfig(
        Duration.ofMillis(500), // requestTimeout
        Duration.ofSeconds(4),  // maxBackoff
        6,                      // maxAttempts
        Duration.ofMillis(150), // gossipInterval
        Duration.ofMillis(300), // antiEntropyInterval
        10_000,                 // replyCacheSize
        Duration.ofSeconds(2)   // shutdownGrace
    );
  }

  /// Overrides the defaults with any `GLOMERS_*` variables present such as `GLOMERS_GOSSIP_INTERVAL_MS=50`.
  ///
  /// @throws IllegalArgumentException if a variable is present but not a valid number.
  public static NodeConfig fromEnvironment(Map<String, String> env) {
    final var defaults = defaults();
    return new NodeConfig(
        millis(env, "REQUEST_TIMEOUT_MS").orElse(defaults.requestTimeout()),
        millis(env, "MAX_BACKOFF_MS").orElse(defaults.maxBackoff()),
        integer(env, "MAX_ATTEMPTS").orElse(defaults.maxAttempts()),
        millis(env, "GOSSIP_INTERVAL_MS").orElse(defaults.gossipInterval()),
        millis(env, "ANTI_ENTROPY_INTERVAL_MS").orElse(defaults.antiEntropyInterval()),
        integer(env, "REPLY_CACHE_SIZE").orElse(defaults.replyCacheSize()),
        millis(env, "SHUTDOWN_GRACE_MS").orElse(defaults.shutdownGrace())
    );
  }

  public RetryPolicy retryPolicy() {
    return new RetryPolicy(maxBackoff, maxAttempts);
  }

  private static Optional<Duration> millis(Map<String, String> env, String name) {
    return integer(env, name).map(Duration::ofMillis);
  }

  private static Optional<Integer> integer(Map<String, String> env, String name) {
    return Optional.ofNullable(env.get(ENV_PREFIX + name))
        .map(String::trim)
        .map(value -> {
          try {
            return Integer.parseInt(value);
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ENV_PREFIX + name + " is not a number: " + value, e);
          }
        });
  }

  private static void requirePositive(Duration duration, String name) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(name + " must be positive: " + duration);
    }
  }
}

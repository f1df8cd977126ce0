// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The node runtime that workloads run on.
///
/// A node is one process in a cluster run by the Maelstrom harness. It reads one JSON message per line on standard
/// input and writes one per line on standard output. Logging goes to standard error.
///
/// To run a workload an application provides:
/// 1. A [com.github.trex_glomers.Workload] that registers a [com.github.trex_glomers.Handler] per message type and
///    starts any periodic ticks once the [com.github.trex_glomers.NodeIdentity] is known.
/// 2. A [com.github.trex_glomers.NodeConfig] with the timings of requests and ticks.
/// 3. A [com.github.trex_glomers.network.Transport] which is standard output in production.
///
/// Supporting classes:
/// - [com.github.trex_glomers.Node]: the handshake, the receive loop, `send`, `reply` and `request`.
/// - [com.github.trex_glomers.RequestTracker]: outstanding requests keyed by `msg_id`.
/// - [com.github.trex_glomers.RetryPolicy]: capped exponential backoff of unanswered requests.
/// - [com.github.trex_glomers.ReplyCache]: replies already sent, so resent requests are answered identically.
/// - [com.github.trex_glomers.HandlerRegistry]: routes a message type tag to its handler.
/// - [com.github.trex_glomers.KvClient]: the harness key/value services.
package com.github.trex_glomers;

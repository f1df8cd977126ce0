// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.network;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

public class StdoutTransportTest {

  @Test
  public void writesOneLinePerMessage() {
    final var out = new ByteArrayOutputStream();
    final var transport = new StdoutTransport(out);

    transport.send("{\"a\":1}");
    transport.send("{\"b\":\"é\"}");

    assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}\n{\"b\":\"é\"}\n");
  }

  @Test
  public void concurrentWritesDoNotInterleave() throws InterruptedException {
    final var out = new ByteArrayOutputStream();
    final var transport = new StdoutTransport(out);
    final var pool = Executors.newFixedThreadPool(8);
    final var done = new CountDownLatch(400);
    final var payload = "x".repeat(5_000);

    IntStream.range(0, 400).forEach(i -> pool.execute(() -> {
      transport.send("{\"i\":" + i + ",\"p\":\"" + payload + "\"}");
      done.countDown();
    }));
    assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
    pool.shutdown();

    final var lines = out.toString(StandardCharsets.UTF_8).split("\n");
    assertThat(lines).hasSize(400);
    assertThat(lines).allSatisfy(line -> assertThat(line).startsWith("{\"i\":").endsWith(payload + "\"}"));
  }

  @Test
  public void dropsLinesAfterClose() {
    final var out = new ByteArrayOutputStream();
    final var transport = new StdoutTransport(out);

    transport.close();
    transport.send("late");

    assertThat(out.size()).isZero();
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import com.github.trex_glomers.msg.ErrorCode;
import com.github.trex_glomers.msg.Message;
import com.github.trex_glomers.msg.NodeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

public class KvClientTest {
  static {
    LoggerConfig.initialize();
  }

  final RecordingTransport transport = new RecordingTransport();
  final Node node = new Node(NodeConfig.defaults(), transport, Runnable::run, new ManualTickScheduler());
  final KvClient kv = new KvClient(node, KvClient.SEQ_KV);

  @BeforeEach
  void init() {
    node.receive(NodeTest.INIT);
    transport.clear();
  }

  /// Answers the last request the node sent to the service.
  void answer(String body) {
    final Message request = transport.last();
    assertThat(request.dest()).isEqualTo(KvClient.SEQ_KV);
    final var withId = body.replaceFirst("\\{", "{\"in_reply_to\":" + request.body().msgId() + ",");
    node.receive(NodeTest.line(KvClient.SEQ_KV, "n1", withId));
  }

  static NodeException failure(Throwable thrown) {
    assertThat(thrown).isInstanceOf(CompletionException.class).hasCauseInstanceOf(NodeException.class);
    return (NodeException) thrown.getCause();
  }

  @Test
  public void readSendsKeyAndAnswersValue() {
    final var value = kv.read("counter");

    assertThat(transport.last().type()).isEqualTo("read");
    assertThat(transport.last().body().field("key").textValue()).isEqualTo("counter");
    answer("{\"type\":\"read_ok\",\"value\":41}");

    assertThat(value.join().longValue()).isEqualTo(41L);
  }

  @Test
  public void readLongDefaultsWhenKeyIsMissing() {
    final var value = kv.readLong("counter", 0L);
    answer("{\"type\":\"error\",\"code\":20,\"text\":\"not found\"}");

    assertThat(value.join()).isZero();
  }

  @Test
  public void readLongPropagatesOtherErrors() {
    final var value = kv.readLong("counter", 0L);
    answer("{\"type\":\"error\",\"code\":11,\"text\":\"busy\"}");

    assertThat(failure(catchThrowable(value::join)).errorCode()).contains(ErrorCode.TEMPORARILY_UNAVAILABLE);
  }

  @Test
  public void casSendsSnakeCaseFlagAndFailsOnPrecondition() {
    final var swapped = kv.cas("counter", 1, 2, true);

    final var sent = transport.last().body();
    assertThat(sent.type()).isEqualTo("cas");
    assertThat(sent.field("from").intValue()).isEqualTo(1);
    assertThat(sent.field("to").intValue()).isEqualTo(2);
    assertThat(sent.field("create_if_not_exists").booleanValue()).isTrue();
    answer("{\"type\":\"error\",\"code\":22,\"text\":\"expected 1 but had 3\"}");

    assertThat(failure(catchThrowable(swapped::join)).errorCode()).contains(ErrorCode.PRECONDITION_FAILED);
  }

  @Test
  public void writeCompletesOnWriteOk() {
    final var written = kv.write("k", "v");
    answer("{\"type\":\"write_ok\"}");

    assertThat(written).isCompleted();
  }

  @Test
  public void unexpectedReplyTypeIsMalformed() {
    final var written = kv.write("k", "v");
    answer("{\"type\":\"read_ok\",\"value\":1}");

    assertThat(failure(catchThrowable(written::join)).errorCode()).contains(ErrorCode.MALFORMED_REQUEST);
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers;

import com.github.trex_glomers.msg.Body;
import com.github.trex_glomers.msg.DecodeException;
import com.github.trex_glomers.msg.ErrorCode;
import com.github.trex_glomers.msg.Message;
import com.github.trex_glomers.msg.MessageCodec;
import com.github.trex_glomers.msg.NodeException;
import com.github.trex_glomers.network.Transport;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;

import static com.github.trex_glomers.NodeLogger.LOGGER;

/// The runtime of one node process. It owns the node identity, the receive loop, message id assignment, the
/// table of outstanding requests and the cache of sent replies. Workloads register handlers and ticks on it.
///
/// Inbound lines are decoded and routed on the thread that calls [#receive(String)]. Handlers run on the handler
/// executor so a slow handler never stalls intake. Resends and periodic ticks run on the [TickScheduler].
///
/// A reply is matched to its request by `in_reply_to`. Replies nobody waits for go to a handler registered for
/// their type, which is how acknowledgements such as `gossip_ok` reach their algorithm, or are dropped. Replies are
/// never answered with an error.
public final class Node implements AutoCloseable {
  record Init(String nodeId, List<String> nodeIds) {
  }

  private final NodeConfig config;
  private final Transport transport;
  private final Executor handlerExecutor;
  private final TickScheduler scheduler;
  private final MessageCodec codec = new MessageCodec();
  private final HandlerRegistry handlers = new HandlerRegistry();
  private final RequestTracker requests = new RequestTracker();
  private final ReplyCache replies;
  private final RetryPolicy retryPolicy;
  private final AtomicLong lastMsgId = new AtomicLong();
  private final List<Consumer<NodeIdentity>> initListeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private volatile NodeIdentity identity;

  /// Creates a node with its own handler thread pool and timer thread.
  public Node(NodeConfig config, Transport transport) {
    this(config, transport, newHandlerPool(), new ExecutorTickScheduler("glomers-timer"));
  }

  /// @param handlerExecutor runs handlers. A direct executor makes handling synchronous which simulations rely on.
  /// @param scheduler       runs resends and periodic ticks.
  public Node(NodeConfig config, Transport transport, Executor handlerExecutor, TickScheduler scheduler) {
    this.config = config;
    this.transport = transport;
    this.handlerExecutor = handlerExecutor;
    this.scheduler = scheduler;
    this.replies = new ReplyCache(config.replyCacheSize());
    this.retryPolicy = config.retryPolicy();
  }

  private static ExecutorService newHandlerPool() {
    final var count = new AtomicInteger();
    return Executors.newCachedThreadPool(runnable -> {
      final var thread = new Thread(runnable, "glomers-handler-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  public NodeConfig config() {
    return config;
  }

  /// @throws IllegalStateException if the handshake has not happened yet.
  public NodeIdentity identity() {
    final var current = identity;
    if (current == null) {
      throw new IllegalStateException("node has not received init");
    }
    return current;
  }

  public boolean initialized() {
    return identity != null;
  }

  /// Registers the handler for a message type. A handler answers a request with [#reply] before it returns.
  /// Once it returns unanswered the message counts as one-way and a resend of it is handled again.
  public Node on(String type, Handler handler) {
    handlers.register(type, handler);
    return this;
  }

  /// Runs the listener once the identity is known, immediately if it already is.
  public void onInit(Consumer<NodeIdentity> listener) {
    initListeners.add(listener);
    final var current = identity;
    if (current != null) {
      listener.accept(current);
    }
  }

  /// Runs the task every period until the node closes. Ticks before the handshake are skipped.
  public void every(Duration period, Runnable task) {
    scheduler.every(period, () -> {
      if (identity != null && !closed.get()) {
        task.run();
      }
    });
  }

  /// The receive loop. Consumes lines until the input closes, then closes the node.
  ///
  /// @throws IllegalStateException if the handshake is missing or corrupt, which is fatal.
  public void run(BufferedReader input) throws IOException {
    LOGGER.info("node waiting for init");
    try {
      String line;
      while (!closed.get() && (line = input.readLine()) != null) {
        receive(line);
      }
      if (identity == null) {
        throw new IllegalStateException("input closed before init was received");
      }
      LOGGER.info(() -> identity.nodeId() + " input closed, shutting down");
    } finally {
      close();
    }
  }

  /// Handles one inbound line. Lines that do not decode are logged and skipped.
  ///
  /// @throws IllegalStateException if the first decodable message is not a valid `init`.
  public void receive(String line) {
    if (line.isBlank()) {
      return;
    }
    final Message message;
    try {
      message = codec.decode(line);
    } catch (DecodeException e) {
      LOGGER.warning(() -> "skipping undecodable line (" + e.getMessage() + "): " + line);
      return;
    }
    LOGGER.finer(() -> "<- " + line);
    if ("init".equals(message.type())) {
      init(message);
    } else if (identity == null) {
      throw new IllegalStateException("expected init but received " + message.type() + " from " + message.src());
    } else {
      dispatch(message);
    }
  }

  private void init(Message message) {
    final var current = identity;
    if (current != null) {
      LOGGER.warning(() -> current.nodeId() + " ignoring repeated init from " + message.src());
      if (message.body().msgId() != null) {
        reply(message, Body.of("init_ok"));
      }
      return;
    }
    final NodeIdentity assigned;
    try {
      final var init = message.body().payload(Init.class);
      assigned = new NodeIdentity(init.nodeId(), init.nodeIds());
    } catch (NodeException | IllegalArgumentException | NullPointerException e) {
      throw new IllegalStateException("corrupt init handshake: " + e.getMessage(), e);
    }
    identity = assigned;
    LOGGER.info(() -> assigned.nodeId() + " initialized in cluster " + assigned.nodeIds());
    reply(message, Body.of("init_ok"));
    initListeners.forEach(listener -> listener.accept(assigned));
  }

  private void dispatch(Message message) {
    final var body = message.body();
    if (message.isReply()) {
      if (requests.complete(message)) {
        LOGGER.finer(() -> identity.nodeId() + " resolved request " + body.inReplyTo());
        return;
      }
      final var handler = handlers.lookup(body.type());
      if (handler.isPresent()) {
        execute(message, handler.get());
      } else {
        LOGGER.fine(() -> identity.nodeId() + " dropping reply nobody waits for: " + message);
      }
      return;
    }
    if (body.msgId() != null) {
      switch (replies.claim(message.src(), body.msgId())) {
        case ANSWERED -> {
          LOGGER.fine(() -> identity.nodeId() + " answering repeated request from cache: " + message);
          replies.lookup(message.src(), body.msgId()).ifPresent(cached -> send(message.src(), cached));
          return;
        }
        case IN_FLIGHT -> {
          LOGGER.fine(() -> identity.nodeId() + " dropping repeat of a request still being handled: " + message);
          return;
        }
        case HANDLE -> {
          // claimed, handled below
        }
      }
    }
    handlers.lookup(body.type()).ifPresentOrElse(
        handler -> execute(message, handler),
        () -> reject(message, new NodeException(ErrorCode.NOT_SUPPORTED, "unsupported message type: " + body.type()))
    );
  }

  private void execute(Message message, Handler handler) {
    try {
      handlerExecutor.execute(() -> invoke(message, handler));
    } catch (RejectedExecutionException e) {
      LOGGER.warning(() -> "handler executor rejected " + message.type() + ": " + e.getMessage());
      if (!message.isReply() && message.body().msgId() != null) {
        replies.release(message.src(), message.body().msgId());
      }
    }
  }

  private void invoke(Message message, Handler handler) {
    try {
      handler.handle(message);
    } catch (NodeException e) {
      LOGGER.fine(() -> identity.nodeId() + " rejecting " + message + ": " + e.getMessage());
      reject(message, e);
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, identity.nodeId() + " handler for " + message.type() + " failed: " + e.getMessage(), e);
      reject(message, new NodeException(ErrorCode.CRASH, "internal error handling " + message.type()));
    }
    // a handler that returned without answering took a one-way message
    if (!message.isReply() && message.body().msgId() != null) {
      replies.release(message.src(), message.body().msgId());
    }
  }

  private void reject(Message message, NodeException error) {
    if (message.body().msgId() == null || message.isReply()) {
      LOGGER.warning(() -> "dropping " + message + ": " + error.getMessage());
      return;
    }
    reply(message, error.toBody());
  }

  /// Answers a request. The reply is remembered so that a resend of the request gets the same answer.
  public void reply(@NotNull Message request, @NotNull Body body) {
    final var msgId = request.body().msgId();
    if (msgId == null) {
      LOGGER.warning(() -> "cannot reply to a message without msg_id: " + request);
      return;
    }
    final var reply = body.withMsgId(null).withInReplyTo(msgId);
    replies.remember(request.src(), msgId, reply);
    send(request.src(), reply);
  }

  /// Sends a message with a fresh `msg_id` and does not wait for any reply.
  public void send(@NotNull String dest, @NotNull Body body) {
    transmit(dest, body.withMsgId(nextMsgId()));
  }

  /// Sends a request and tracks it until a reply arrives. Unanswered requests are resent with the same `msg_id`
  /// following the [RetryPolicy] until the retry ceiling is reached.
  ///
  /// @return a future completed with the first reply, or completed exceptionally with a [NodeException] carrying
  /// the code of an `error` reply, or [ErrorCode#TIMEOUT] once the retry ceiling is exceeded.
  public CompletableFuture<Message> request(@NotNull String dest, @NotNull Body body, @NotNull Duration timeout) {
    final var future = new CompletableFuture<Message>();
    if (closed.get()) {
      future.completeExceptionally(new NodeException(ErrorCode.TEMPORARILY_UNAVAILABLE, "node is shutting down"));
      return future;
    }
    final var msgId = nextMsgId();
    final var stamped = body.withMsgId(msgId);
    requests.register(new RequestTracker.Pending(msgId, dest, stamped, 1, future));
    transmit(dest, stamped);
    scheduleRetry(msgId, 1, timeout);
    return future;
  }

  public CompletableFuture<Message> request(@NotNull String dest, @NotNull Body body) {
    return request(dest, body, config.requestTimeout());
  }

  private void scheduleRetry(long msgId, int attempt, Duration timeout) {
    scheduler.schedule(retryPolicy.delayAfter(attempt, timeout), () -> retry(msgId, attempt, timeout));
  }

  private void retry(long msgId, int attempt, Duration timeout) {
    if (attempt >= retryPolicy.maxAttempts()) {
      final var failure = new NodeException(ErrorCode.TIMEOUT,
          "no reply to msg_id " + msgId + " after " + attempt + " attempts");
      if (requests.fail(msgId, attempt, failure)) {
        LOGGER.warning(() -> failure.getMessage());
      }
      return;
    }
    requests.advance(msgId, attempt).ifPresent(request -> {
      LOGGER.fine(() -> "resending msg_id " + msgId + " to " + request.dest() + " attempt " + request.attempt());
      transmit(request.dest(), request.body());
      scheduleRetry(msgId, request.attempt(), timeout);
    });
  }

  private long nextMsgId() {
    return lastMsgId.incrementAndGet();
  }

  private void transmit(String dest, Body body) {
    final var line = codec.encode(new Message(identity().nodeId(), dest, body));
    LOGGER.finer(() -> "-> " + line);
    try {
      transport.send(line);
    } catch (UncheckedIOException e) {
      LOGGER.warning(() -> "failed to send to " + dest + ": " + e.getMessage());
    }
  }

  /// Stops ticks and resends, fails outstanding requests, gives in-flight handlers the shutdown grace to finish
  /// and closes the transport.
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    scheduler.close();
    requests.failAll(new NodeException(ErrorCode.TEMPORARILY_UNAVAILABLE, "node is shutting down"));
    if (handlerExecutor instanceof ExecutorService service) {
      service.shutdown();
      try {
        if (!service.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
          LOGGER.warning("handlers still running after shutdown grace");
          service.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        service.shutdownNow();
      }
    }
    transport.close();
    LOGGER.fine("node closed");
  }

  @TestOnly
  int outstandingRequests() {
    return requests.size();
  }

  @TestOnly
  Optional<Body> cachedReply(String src, long msgId) {
    return replies.lookup(src, msgId);
  }
}

package com.scholary.medforce.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered hand-off of work onto a connection's sending side.
 *
 * <p>Any thread may enqueue: the socket handler thread, the engine thread, or the outbox itself.
 * Tasks run strictly in FIFO order, and at most one drain runs at a time on the shared outbound
 * executor. Frames therefore reach the socket in the order they were enqueued, and the channel is
 * never written concurrently. Enqueueing never blocks.
 *
 * <p>After {@link #close()} pending and future tasks are discarded (at-most-once delivery).
 */
public class ConnectionOutbox {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionOutbox.class);

  private final String connectionId;
  private final OutboundChannel channel;
  private final Executor executor;
  private final ObjectMapper objectMapper;

  private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean draining = new AtomicBoolean();
  private volatile boolean closed;

  public ConnectionOutbox(
      String connectionId, OutboundChannel channel, Executor executor, ObjectMapper objectMapper) {
    this.connectionId = connectionId;
    this.channel = channel;
    this.executor = executor;
    this.objectMapper = objectMapper;
  }

  /** Queue a JSON frame for the client. */
  public void send(Map<String, Object> frame) {
    submit(() -> write(frame));
  }

  /** Queue a {@code {"type":"system","message":...}} frame. */
  public void sendSystem(String message) {
    Map<String, Object> frame = new LinkedHashMap<>();
    frame.put("type", "system");
    frame.put("message", message);
    send(frame);
  }

  /** Run a task on the connection's sending context, after everything queued before it. */
  public void submit(Runnable task) {
    if (closed) {
      LOGGER.debug("Outbox closed, discarding task: connectionId={}", connectionId);
      return;
    }
    tasks.add(task);
    scheduleDrain();
  }

  public void close() {
    closed = true;
    tasks.clear();
  }

  public boolean isClosed() {
    return closed;
  }

  private void scheduleDrain() {
    if (!draining.compareAndSet(false, true)) {
      return;
    }
    try {
      executor.execute(this::drain);
    } catch (RejectedExecutionException e) {
      draining.set(false);
      LOGGER.error("Outbound executor rejected drain: connectionId={}", connectionId, e);
    }
  }

  private void drain() {
    try {
      Runnable task;
      while (!closed && (task = tasks.poll()) != null) {
        try {
          task.run();
        } catch (RuntimeException e) {
          LOGGER.error("Outbound task failed: connectionId={}", connectionId, e);
        }
      }
    } finally {
      draining.set(false);
      // a task may have arrived after the last poll but before the flag was cleared
      if (!closed && !tasks.isEmpty()) {
        scheduleDrain();
      }
    }
  }

  private void write(Map<String, Object> frame) {
    if (!channel.isOpen()) {
      LOGGER.debug("Channel closed, dropping frame: connectionId={}", connectionId);
      return;
    }
    try {
      channel.send(objectMapper.writeValueAsString(frame));
    } catch (JsonProcessingException e) {
      LOGGER.error("Frame is not serializable: connectionId={}", connectionId, e);
    } catch (IOException e) {
      LOGGER.warn(
          "Failed to send frame: connectionId={}, error={}", connectionId, e.getMessage());
    }
  }
}

package com.scholary.medforce.testutil;

import com.scholary.medforce.engine.EngineContext;
import com.scholary.medforce.engine.RecognitionEngine;
import com.scholary.medforce.engine.RecognitionEventSink;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable engine for session tests.
 *
 * <p>{@link #run()} emits the initial events, then blocks until {@link #finish()}, {@link
 * #stop()} or {@link #fail(RuntimeException)}. A finish emits a {@code finished} status event;
 * a failure is thrown out of {@code run()}. An engine built with {@code exitOnFinish == false}
 * keeps running after a finish request until it is stopped or failed.
 */
public class FakeRecognitionEngine implements RecognitionEngine {

  private final EngineContext context;
  private final RecognitionEventSink sink;
  private final List<Map<String, Object>> initialEvents;
  private final boolean exitOnFinish;

  private final List<byte[]> received = new CopyOnWriteArrayList<>();
  private final CountDownLatch released = new CountDownLatch(1);
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicInteger stopCalls = new AtomicInteger();
  private volatile boolean finishRequested;
  private final CountDownLatch started = new CountDownLatch(1);
  private volatile RuntimeException pendingFailure;

  public FakeRecognitionEngine(
      EngineContext context,
      RecognitionEventSink sink,
      List<Map<String, Object>> initialEvents,
      boolean exitOnFinish) {
    this.context = context;
    this.sink = sink;
    this.initialEvents = initialEvents;
    this.exitOnFinish = exitOnFinish;
  }

  @Override
  public void run() throws InterruptedException {
    started.countDown();
    try {
      for (Map<String, Object> event : initialEvents) {
        sink.emit(event);
      }
      released.await();
      if (pendingFailure != null) {
        throw pendingFailure;
      }
      if (finishRequested && running.get()) {
        Map<String, Object> done = new LinkedHashMap<>();
        done.put("type", "status");
        done.put("status", "finished");
        sink.emit(done);
      }
    } finally {
      running.set(false);
    }
  }

  @Override
  public boolean feed(byte[] chunk) {
    if (!running.get()) {
      return false;
    }
    received.add(chunk);
    return true;
  }

  @Override
  public void finish() {
    finishRequested = true;
    if (exitOnFinish) {
      released.countDown();
    }
  }

  @Override
  public void stop() {
    stopCalls.incrementAndGet();
    running.set(false);
    released.countDown();
  }

  /** Make {@link #run()} throw the given failure. */
  public void fail(RuntimeException failure) {
    pendingFailure = failure;
    released.countDown();
  }

  /** Emit an event from the calling thread. */
  public void emit(Map<String, Object> event) {
    sink.emit(event);
  }

  public boolean awaitStarted(long millis) throws InterruptedException {
    return started.await(millis, TimeUnit.MILLISECONDS);
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  public List<byte[]> received() {
    return received;
  }

  public int stopCalls() {
    return stopCalls.get();
  }

  public boolean finishRequested() {
    return finishRequested;
  }

  public EngineContext context() {
    return context;
  }
}

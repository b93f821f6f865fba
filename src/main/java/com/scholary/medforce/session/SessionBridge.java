package com.scholary.medforce.session;

import com.scholary.medforce.engine.EngineContext;
import com.scholary.medforce.engine.RecognitionEngine;
import com.scholary.medforce.engine.RecognitionEngineFactory;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one recognition engine and the dedicated thread its ingestion routine runs on.
 *
 * <p>Audio goes in through {@link #feed(byte[])} without blocking. Events come out of the engine
 * thread and are handed to the connection's {@link ConnectionOutbox}, which delivers them in
 * production order. When the engine's routine ends without a {@link #stop()}, because it drained
 * after {@link #finish()} or because it failed, the {@link ExitListener} is notified through the
 * same outbox. Every teardown path then converges on {@link #stop()}, which releases the engine
 * exactly once.
 */
public class SessionBridge {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionBridge.class);

  /** Notified on the connection's sending context when the engine routine ends by itself. */
  @FunctionalInterface
  public interface ExitListener {
    /**
     * @param bridge the bridge whose engine exited
     * @param failure the failure that ended the routine, or null after a normal drain
     */
    void onEngineExited(SessionBridge bridge, Throwable failure);
  }

  private final String patientId;
  private final Map<String, String> options;
  private final RecognitionEngineFactory engineFactory;
  private final ThreadFactory threadFactory;
  private final ConnectionOutbox outbox;
  private final Duration joinTimeout;
  private final ExitListener exitListener;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private volatile RecognitionEngine engine;
  private volatile Thread ingestionThread;

  public SessionBridge(
      String patientId,
      Map<String, String> options,
      RecognitionEngineFactory engineFactory,
      ThreadFactory threadFactory,
      ConnectionOutbox outbox,
      Duration joinTimeout,
      ExitListener exitListener) {
    this.patientId = patientId;
    this.options = options;
    this.engineFactory = engineFactory;
    this.threadFactory = threadFactory;
    this.outbox = outbox;
    this.joinTimeout = joinTimeout;
    this.exitListener = exitListener;
  }

  /**
   * Create the engine and launch its ingestion routine on a dedicated thread.
   *
   * @param seedContext patient context handed to the engine
   * @param readyFrame frame queued for the client once the engine exists, before the thread
   *     starts, so it precedes every engine event; may be null
   * @throws com.scholary.medforce.engine.EngineException if the engine cannot be created
   * @throws IllegalStateException if the bridge was already started
   */
  public void start(String seedContext, Map<String, Object> readyFrame) {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Bridge already started for patient " + patientId);
    }

    RecognitionEngine created =
        engineFactory.create(new EngineContext(patientId, seedContext, options), this::deliver);
    engine = created;

    if (readyFrame != null) {
      outbox.send(readyFrame);
    }

    Thread thread = threadFactory.newThread(this::runIngestion);
    thread.setName("stt-" + patientId);
    thread.setDaemon(true);
    ingestionThread = thread;
    thread.start();

    LOGGER.debug("Engine thread launched: thread={}", thread.getName());
  }

  /**
   * Hand a chunk of audio to the engine. Never blocks.
   *
   * @return false if the engine is not live or refused the chunk
   */
  public boolean feed(byte[] chunk) {
    RecognitionEngine current = engine;
    if (current == null || stopped.get() || !current.isRunning()) {
      return false;
    }
    return current.feed(chunk);
  }

  /** Ask the engine to flush pending audio and end its routine. */
  public void finish() {
    RecognitionEngine current = engine;
    if (current != null && !stopped.get()) {
      current.finish();
    }
  }

  /**
   * Unconditional, idempotent teardown.
   *
   * <p>Signals the engine, interrupts its thread and waits up to the join timeout for it to exit.
   * The thread is a daemon that exits once the engine honours the stop signal, so a slow engine
   * is logged rather than waited on indefinitely. Calls after the first are no-ops.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }

    RecognitionEngine current = engine;
    if (current != null) {
      current.stop();
    }

    Thread thread = ingestionThread;
    if (thread != null && thread != Thread.currentThread()) {
      thread.interrupt();
      try {
        thread.join(joinTimeout.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (thread.isAlive()) {
        LOGGER.warn(
            "Engine thread still running after {}ms, leaving it to exit: thread={}",
            joinTimeout.toMillis(),
            thread.getName());
      }
    }

    LOGGER.info("Session bridge stopped: patientId={}", patientId);
  }

  /** True while the engine exists, has not been stopped and reports itself running. */
  public boolean isEngineLive() {
    RecognitionEngine current = engine;
    return current != null && !stopped.get() && current.isRunning();
  }

  public boolean isStopped() {
    return stopped.get();
  }

  public boolean isThreadAlive() {
    Thread thread = ingestionThread;
    return thread != null && thread.isAlive();
  }

  private void deliver(Map<String, Object> event) {
    if (stopped.get()) {
      LOGGER.debug("Bridge stopped, dropping event: patientId={}", patientId);
      return;
    }
    outbox.send(event);
  }

  private void runIngestion() {
    Throwable failure = null;
    try {
      engine.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (!stopped.get()) {
        failure = e;
      }
    } catch (RuntimeException e) {
      failure = e;
    }

    if (stopped.get()) {
      if (failure != null) {
        LOGGER.debug("Engine failed after stop: patientId={}", patientId, failure);
      }
      return;
    }

    Throwable cause = failure;
    outbox.submit(() -> exitListener.onEngineExited(this, cause));
  }
}

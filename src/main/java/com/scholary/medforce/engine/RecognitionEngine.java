package com.scholary.medforce.engine;

/**
 * A recognition engine bound to one session.
 *
 * <p>The engine is driven from two threads. Its {@link #run()} routine occupies a dedicated thread
 * and may block on its input. {@link #feed(byte[])}, {@link #finish()} and {@link #stop()} are
 * called from the connection side and must never block it. Events flow out through the
 * {@link RecognitionEventSink} the engine was created with.
 */
public interface RecognitionEngine {

  /**
   * The blocking ingestion routine. Returns when the engine has drained after {@link #finish()},
   * or soon after {@link #stop()}.
   *
   * @throws InterruptedException if the thread is interrupted while waiting for input
   * @throws EngineException if recognition fails irrecoverably
   */
  void run() throws InterruptedException;

  /**
   * Hand over one chunk of audio. Never blocks.
   *
   * @return false if the chunk was rejected (engine not live, or input queue full)
   */
  boolean feed(byte[] chunk);

  /** Stop accepting audio, flush whatever is pending, then let {@link #run()} return. */
  void finish();

  /** Unconditional stop signal. Pending input is discarded. */
  void stop();

  /** Liveness flag: true until the engine has stopped or finished draining. */
  boolean isRunning();
}

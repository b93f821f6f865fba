package com.scholary.medforce.engine;

/** Creates one engine per session start. */
@FunctionalInterface
public interface RecognitionEngineFactory {

  /**
   * @throws EngineException if the engine cannot be set up (missing script, bad configuration)
   */
  RecognitionEngine create(EngineContext context, RecognitionEventSink sink);
}

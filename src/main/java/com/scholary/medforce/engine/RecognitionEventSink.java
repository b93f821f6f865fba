package com.scholary.medforce.engine;

import java.util.Map;

/** Where an engine publishes its events. Implementations must tolerate calls from any thread. */
@FunctionalInterface
public interface RecognitionEventSink {

  /** Publish one JSON-serializable event. */
  void emit(Map<String, Object> event);
}

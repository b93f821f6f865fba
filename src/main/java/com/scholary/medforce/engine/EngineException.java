package com.scholary.medforce.engine;

/** A recognition engine could not be created or failed while running. */
public class EngineException extends RuntimeException {

  public EngineException(String message) {
    super(message);
  }

  public EngineException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.medforce.session;

/** A text frame that is not valid JSON. Logged and discarded, never fatal to the session. */
public class MalformedControlFrameException extends RuntimeException {

  public MalformedControlFrameException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.medforce.session;

/** A session could not be started, e.g. because its seed context is unavailable. */
public class SessionStartException extends RuntimeException {

  public SessionStartException(String message) {
    super(message);
  }

  public SessionStartException(String message, Throwable cause) {
    super(message, cause);
  }
}

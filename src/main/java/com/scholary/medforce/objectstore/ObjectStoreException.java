package com.scholary.medforce.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>This is a runtime exception because storage failures are typically unrecoverable at the
 * request level. If the bucket doesn't exist or credentials are wrong, there's not much the
 * caller can do besides reporting it.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

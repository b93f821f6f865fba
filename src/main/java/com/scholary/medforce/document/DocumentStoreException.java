package com.scholary.medforce.document;

/**
 * Base class for document store outcomes that the HTTP layer reports as client errors.
 *
 * <p>Storage outages are not modelled here: they stay as ObjectStoreException and end up as a
 * 500.
 */
public abstract class DocumentStoreException extends RuntimeException {

  private final String path;

  protected DocumentStoreException(String message, String path) {
    super(message);
    this.path = path;
  }

  /** The blob key or prefix the failed operation addressed. */
  public String getPath() {
    return path;
  }
}

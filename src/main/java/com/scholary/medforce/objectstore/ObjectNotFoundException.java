package com.scholary.medforce.objectstore;

/** Thrown when a read targets a key with no object behind it. */
public class ObjectNotFoundException extends ObjectStoreException {

  private final String key;

  public ObjectNotFoundException(String bucket, String key, Throwable cause) {
    super(String.format("Object not found: bucket=%s, key=%s", bucket, key), cause);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}

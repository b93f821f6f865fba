package com.scholary.medforce.objectstore;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Abstraction for object storage operations.
 *
 * <p>This interface decouples the document store from the storage backend (S3, MinIO, the GCS
 * interoperability endpoint). It carries no business logic: keys are opaque strings and
 * "folders" are nothing more than shared key prefixes.
 *
 * <p>All failures surface as {@link ObjectStoreException}. A missing key on a read is reported
 * with the more specific {@link ObjectNotFoundException}.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object fully into memory.
   *
   * <p>Patient documents are small (markdown, JSON, images), so whole-object reads are fine here.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the object bytes
   * @throws ObjectNotFoundException if the object doesn't exist
   * @throws ObjectStoreException if retrieval fails
   */
  byte[] getObject(String bucket, String key);

  /**
   * Check whether an object exists without downloading it.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return true if an object is stored at the key
   */
  boolean exists(String bucket, String key);

  /**
   * Store an object, overwriting whatever was at the key.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param content the object bytes
   * @param contentType the MIME type of the object
   */
  void putObject(String bucket, String key, byte[] content, String contentType);

  /**
   * List every object whose key starts with the prefix.
   *
   * <p>Pagination is followed until the listing is exhausted.
   *
   * @param bucket the bucket name
   * @param prefix the key prefix
   * @return summaries of matching objects, in key order
   */
  List<ObjectSummary> listObjects(String bucket, String prefix);

  /**
   * List the distinct "sub-directories" directly below the prefix.
   *
   * @param bucket the bucket name
   * @param prefix the key prefix
   * @param delimiter the directory delimiter, normally "/"
   * @return the common prefixes, each ending with the delimiter
   */
  List<String> listCommonPrefixes(String bucket, String prefix, String delimiter);

  /**
   * Delete a single object. Deleting a missing key is not an error.
   *
   * @param bucket the bucket name
   * @param key the object key
   */
  void deleteObject(String bucket, String key);

  /**
   * Delete many objects in bulk.
   *
   * <p>Not atomic: per-key failures are logged and excluded from the returned count.
   *
   * @param bucket the bucket name
   * @param keys the keys to delete
   * @return the number of objects reported as deleted
   */
  int deleteObjects(String bucket, Collection<String> keys);

  /** One entry of an object listing. */
  record ObjectSummary(String key, long size, Instant lastModified) {}
}

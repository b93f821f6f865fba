package com.scholary.medforce.testutil;

import com.scholary.medforce.objectstore.ObjectNotFoundException;
import com.scholary.medforce.objectstore.ObjectStoreClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Object store held in memory, with the prefix and delimiter semantics of S3.
 *
 * <p>Keys registered with {@link #failDeletesFor(String...)} survive bulk deletes and are left out
 * of the reported count, the way S3 reports per-key errors.
 */
public class InMemoryObjectStoreClient implements ObjectStoreClient {

  private final Map<String, TreeMap<String, byte[]>> buckets = new TreeMap<>();
  private final Map<String, String> contentTypes = new TreeMap<>();
  private final Set<String> undeletable = new HashSet<>();

  public synchronized void failDeletesFor(String... keys) {
    undeletable.addAll(List.of(keys));
  }

  public synchronized Set<String> keys(String bucket) {
    return new LinkedHashSet<>(bucket(bucket).keySet());
  }

  public synchronized String contentType(String bucket, String key) {
    return contentTypes.get(bucket + "/" + key);
  }

  @Override
  public synchronized byte[] getObject(String bucket, String key) {
    byte[] content = bucket(bucket).get(key);
    if (content == null) {
      throw new ObjectNotFoundException(bucket, key, null);
    }
    return content.clone();
  }

  @Override
  public synchronized boolean exists(String bucket, String key) {
    return bucket(bucket).containsKey(key);
  }

  @Override
  public synchronized void putObject(
      String bucket, String key, byte[] content, String contentType) {
    bucket(bucket).put(key, content.clone());
    contentTypes.put(bucket + "/" + key, contentType);
  }

  @Override
  public synchronized List<ObjectSummary> listObjects(String bucket, String prefix) {
    List<ObjectSummary> summaries = new ArrayList<>();
    bucket(bucket)
        .forEach(
            (key, content) -> {
              if (key.startsWith(prefix)) {
                summaries.add(new ObjectSummary(key, content.length, Instant.EPOCH));
              }
            });
    return summaries;
  }

  @Override
  public synchronized List<String> listCommonPrefixes(
      String bucket, String prefix, String delimiter) {
    Set<String> prefixes = new LinkedHashSet<>();
    for (String key : bucket(bucket).keySet()) {
      if (!key.startsWith(prefix)) {
        continue;
      }
      int at = key.indexOf(delimiter, prefix.length());
      if (at >= 0) {
        prefixes.add(key.substring(0, at + delimiter.length()));
      }
    }
    return new ArrayList<>(prefixes);
  }

  @Override
  public synchronized void deleteObject(String bucket, String key) {
    bucket(bucket).remove(key);
  }

  @Override
  public synchronized int deleteObjects(String bucket, Collection<String> keys) {
    int deleted = 0;
    for (String key : keys) {
      if (undeletable.contains(key)) {
        continue;
      }
      bucket(bucket).remove(key);
      deleted++;
    }
    return deleted;
  }

  private TreeMap<String, byte[]> bucket(String bucket) {
    return buckets.computeIfAbsent(bucket, name -> new TreeMap<>());
  }
}

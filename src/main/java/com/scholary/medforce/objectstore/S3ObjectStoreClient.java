package com.scholary.medforce.objectstore;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3-compatible implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with real S3, MinIO and the Google Cloud Storage XML
 * interoperability endpoint. The difference between them is only the endpoint and path-style
 * access configuration.
 *
 * <p>Retry logic: the SDK retries transient failures (network issues, 5xx, throttling) with
 * backoff. For non-retryable errors (404, 403) we fail fast and translate into
 * ObjectStoreException.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  /** S3 rejects DeleteObjects requests with more keys than this. */
  static final int MAX_DELETE_BATCH = 1000;

  private final S3Client s3Client;
  private volatile boolean bulkDeleteSupported = true;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());
    StaticCredentialsProvider credentialsProvider = StaticCredentialsProvider.create(credentials);

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess())
            .build();

    LOGGER.info("S3 client initialized successfully");
  }

  S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  @Override
  public byte[] getObject(String bucket, String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      byte[] content = s3Client.getObjectAsBytes(request).asByteArray();

      LOGGER.info(
          "Retrieved object: bucket={}, key={}, size={} bytes", bucket, key, content.length);
      return content;

    } catch (NoSuchKeyException e) {
      throw new ObjectNotFoundException(bucket, key, e);

    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        throw new ObjectNotFoundException(bucket, key, e);
      }
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error retrieving object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public boolean exists(String bucket, String key) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;

    } catch (NoSuchKeyException e) {
      return false;

    } catch (S3Exception e) {
      // HEAD responses carry no error body, so a missing key can arrive as a bare 404
      if (e.statusCode() == 404) {
        return false;
      }
      String message =
          String.format(
              "Failed to check object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error checking object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void putObject(String bucket, String key, byte[] content, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        content.length,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength((long) content.length)
              .build();

      s3Client.putObject(request, RequestBody.fromBytes(content));

      LOGGER.info("Uploaded object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public List<ObjectSummary> listObjects(String bucket, String prefix) {
    LOGGER.debug("Listing objects: bucket={}, prefix={}", bucket, prefix);

    try {
      ListObjectsV2Request request =
          ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();

      List<ObjectSummary> summaries = new ArrayList<>();
      for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
        summaries.add(new ObjectSummary(object.key(), object.size(), object.lastModified()));
      }

      LOGGER.debug("Listed {} objects: bucket={}, prefix={}", summaries.size(), bucket, prefix);
      return summaries;

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to list objects: bucket=%s, prefix=%s, statusCode=%s",
              bucket, prefix, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error listing objects: bucket=%s, prefix=%s", bucket, prefix);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public List<String> listCommonPrefixes(String bucket, String prefix, String delimiter) {
    LOGGER.debug(
        "Listing common prefixes: bucket={}, prefix={}, delimiter={}", bucket, prefix, delimiter);

    try {
      ListObjectsV2Request request =
          ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).delimiter(delimiter).build();

      List<String> prefixes = new ArrayList<>();
      for (ListObjectsV2Response page : s3Client.listObjectsV2Paginator(request)) {
        for (CommonPrefix commonPrefix : page.commonPrefixes()) {
          prefixes.add(commonPrefix.prefix());
        }
      }
      return prefixes;

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to list prefixes: bucket=%s, prefix=%s, statusCode=%s",
              bucket, prefix, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format(
              "Unexpected error listing prefixes: bucket=%s, prefix=%s", bucket, prefix);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void deleteObject(String bucket, String key) {
    LOGGER.debug("Deleting object: bucket={}, key={}", bucket, key);

    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Deleted object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to delete object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error deleting object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  /**
   * Delete keys in batches of {@value #MAX_DELETE_BATCH} with the multi-object delete call.
   *
   * <p>Some S3-compatible servers, the Google Cloud Storage XML endpoint among them, answer
   * multi-object delete with 501 NotImplemented. The remaining keys are then deleted one at a
   * time, and later calls go straight to single deletes.
   */
  @Override
  public int deleteObjects(String bucket, Collection<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    LOGGER.debug("Bulk deleting {} objects: bucket={}", keys.size(), bucket);

    List<ObjectIdentifier> identifiers = new ArrayList<>(keys.size());
    for (String key : keys) {
      identifiers.add(ObjectIdentifier.builder().key(key).build());
    }

    int deleted = 0;
    int from = 0;
    try {
      for (; bulkDeleteSupported && from < identifiers.size(); from += MAX_DELETE_BATCH) {
        List<ObjectIdentifier> batch =
            identifiers.subList(from, Math.min(from + MAX_DELETE_BATCH, identifiers.size()));

        DeleteObjectsRequest request =
            DeleteObjectsRequest.builder()
                .bucket(bucket)
                .delete(Delete.builder().objects(batch).quiet(false).build())
                .build();

        DeleteObjectsResponse response;
        try {
          response = s3Client.deleteObjects(request);
        } catch (S3Exception e) {
          if (!isNotImplemented(e)) {
            throw e;
          }
          LOGGER.warn(
              "Multi-object delete not supported, deleting one by one: bucket={}, statusCode={}",
              bucket,
              e.statusCode());
          bulkDeleteSupported = false;
          break;
        }
        deleted += response.deleted().size();

        for (S3Error error : response.errors()) {
          LOGGER.warn(
              "Bulk delete skipped object: bucket={}, key={}, code={}, message={}",
              bucket,
              error.key(),
              error.code(),
              error.message());
        }
      }

      for (ObjectIdentifier identifier : identifiers.subList(from, identifiers.size())) {
        if (deleteSingle(bucket, identifier.key())) {
          deleted++;
        }
      }

      LOGGER.info("Bulk deleted {}/{} objects: bucket={}", deleted, keys.size(), bucket);
      return deleted;

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to bulk delete objects: bucket=%s, deletedSoFar=%d, statusCode=%s",
              bucket, deleted, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format(
              "Unexpected error bulk deleting objects: bucket=%s, deletedSoFar=%d",
              bucket, deleted);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  private boolean deleteSingle(String bucket, String key) {
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      return true;
    } catch (S3Exception e) {
      LOGGER.warn(
          "Delete skipped object: bucket={}, key={}, statusCode={}, message={}",
          bucket,
          key,
          e.statusCode(),
          e.getMessage());
      return false;
    }
  }

  private static boolean isNotImplemented(S3Exception e) {
    if (e.statusCode() == 501) {
      return true;
    }
    return e.awsErrorDetails() != null
        && "NotImplemented".equals(e.awsErrorDetails().errorCode());
  }

  /**
   * Release connections and threads held by the SDK client.
   *
   * <p>Registered as the bean's destroy method.
   */
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}

package com.scholary.medforce.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. Spring Boot binds and validates
 * them at startup.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess) {

  public ObjectStoreProperties {
    if (endpoint == null || endpoint.isBlank()) {
      throw new IllegalArgumentException("objectstore.endpoint must not be blank");
    }
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("objectstore.bucket must not be blank");
    }
  }
}

package com.scholary.medforce.config;

import com.scholary.medforce.document.DocumentStoreProperties;
import com.scholary.medforce.document.PatientDocumentStore;
import com.scholary.medforce.objectstore.ObjectStoreClient;
import com.scholary.medforce.objectstore.ObjectStoreProperties;
import com.scholary.medforce.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage and the patient document store built on it.
 *
 * <p>The document store works against the single bucket named in "objectstore.bucket".
 */
@Configuration
@EnableConfigurationProperties({ObjectStoreProperties.class, DocumentStoreProperties.class})
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public PatientDocumentStore patientDocumentStore(
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties objectStoreProperties,
      DocumentStoreProperties documentStoreProperties) {
    return new PatientDocumentStore(
        objectStoreClient, objectStoreProperties.bucket(), documentStoreProperties);
  }
}

package com.scholary.medforce.document;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the patient document store ("documents.*").
 *
 * <p>{@code rootPrefix} is the fixed key prefix every patient folder lives under.
 * {@code seedFileName} and {@code seedContent} describe the document written when a patient is
 * created.
 */
@ConfigurationProperties(prefix = "documents")
@Validated
public record DocumentStoreProperties(
    @NotBlank String rootPrefix, @NotBlank String seedFileName, String seedContent) {

  public DocumentStoreProperties {
    // keys are joined with '/', so a trailing slash would double up
    while (rootPrefix != null && rootPrefix.endsWith("/")) {
      rootPrefix = rootPrefix.substring(0, rootPrefix.length() - 1);
    }
    if (rootPrefix == null || rootPrefix.isBlank()) {
      rootPrefix = "patient_profile";
    }
    if (seedFileName == null || seedFileName.isBlank()) {
      seedFileName = "patient_info.md";
    }
    if (seedContent == null) {
      seedContent = "# Patient Profile\nName: \nAge: ";
    }
  }

  public static DocumentStoreProperties defaults() {
    return new DocumentStoreProperties(null, null, null);
  }
}

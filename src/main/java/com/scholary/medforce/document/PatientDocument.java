package com.scholary.medforce.document;

import java.nio.charset.StandardCharsets;

/**
 * A patient document loaded from the store.
 *
 * <p>The content is kept as raw bytes; {@link #mediaKind()} tells the caller how to interpret it.
 */
public record PatientDocument(
    String name, String key, byte[] content, MediaKind mediaKind, String contentType) {

  public String asText() {
    return new String(content, StandardCharsets.UTF_8);
  }
}

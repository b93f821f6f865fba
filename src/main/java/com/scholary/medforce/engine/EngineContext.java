package com.scholary.medforce.engine;

import java.util.Map;

/**
 * Everything an engine learns about its session at start.
 *
 * @param patientId the patient the session is for
 * @param seedContext free-form patient context, empty when the variant needs none
 * @param options variant-specific fields of the start frame (e.g. {@code script_file})
 */
public record EngineContext(String patientId, String seedContext, Map<String, String> options) {

  public EngineContext {
    options = options == null ? Map.of() : Map.copyOf(options);
    seedContext = seedContext == null ? "" : seedContext;
  }

  public String option(String name, String defaultValue) {
    String value = options.get(name);
    return value == null || value.isBlank() ? defaultValue : value;
  }
}

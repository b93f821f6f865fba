package com.scholary.medforce.session;

/**
 * Supplies the free-form patient context a session is initialised with.
 *
 * <p>Unavailability must be reported as {@link SessionStartException}. It must not come back as an
 * empty context.
 */
@FunctionalInterface
public interface SeedContextProvider {

  String fetch(String patientId);

  /** For session variants that need no patient context. */
  static SeedContextProvider none() {
    return patientId -> "";
  }
}

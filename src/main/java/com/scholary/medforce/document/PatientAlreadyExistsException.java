package com.scholary.medforce.document;

/** The patient folder already holds at least one document. */
public class PatientAlreadyExistsException extends DocumentStoreException {

  private final String patientId;

  public PatientAlreadyExistsException(String patientId, String prefix) {
    super("Patient already exists", prefix);
    this.patientId = patientId;
  }

  public String getPatientId() {
    return patientId;
  }
}

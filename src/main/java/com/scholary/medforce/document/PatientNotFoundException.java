package com.scholary.medforce.document;

/** The patient folder holds no documents, so the patient does not exist. */
public class PatientNotFoundException extends DocumentStoreException {

  private final String patientId;

  public PatientNotFoundException(String patientId, String prefix) {
    super("Patient not found", prefix);
    this.patientId = patientId;
  }

  public String getPatientId() {
    return patientId;
  }
}

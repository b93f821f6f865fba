package com.scholary.medforce.session;

import com.scholary.medforce.document.DocumentNotFoundException;
import com.scholary.medforce.document.PatientDocumentStore;
import com.scholary.medforce.objectstore.ObjectStoreException;

/** Reads the seed context from a document in the patient's folder (normally patient_info.md). */
public class DocumentSeedContextProvider implements SeedContextProvider {

  private final PatientDocumentStore documentStore;
  private final String fileName;

  public DocumentSeedContextProvider(PatientDocumentStore documentStore, String fileName) {
    this.documentStore = documentStore;
    this.fileName = fileName;
  }

  @Override
  public String fetch(String patientId) {
    try {
      return documentStore.getText(patientId, fileName);
    } catch (DocumentNotFoundException e) {
      throw new SessionStartException("Patient context not found: " + e.getPath(), e);
    } catch (ObjectStoreException | IllegalArgumentException e) {
      throw new SessionStartException("Patient context unavailable for " + patientId, e);
    }
  }
}

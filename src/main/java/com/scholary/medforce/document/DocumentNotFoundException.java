package com.scholary.medforce.document;

/** No blob exists at the key derived from (patientId, fileName). */
public class DocumentNotFoundException extends DocumentStoreException {

  public DocumentNotFoundException(String key) {
    super("File not found", key);
  }
}

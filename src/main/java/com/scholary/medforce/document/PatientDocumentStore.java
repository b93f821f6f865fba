package com.scholary.medforce.document;

import com.scholary.medforce.objectstore.ObjectNotFoundException;
import com.scholary.medforce.objectstore.ObjectStoreClient;
import com.scholary.medforce.objectstore.ObjectStoreClient.ObjectSummary;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-patient document store on top of the blob store.
 *
 * <p>Every document lives at {@code <rootPrefix>/<patientId>/<fileName>}. Patient folders are not
 * stored records: a patient exists exactly when at least one blob sits under its prefix. Creating
 * a patient writes a seed document, and deleting one removes every blob under the prefix. List,
 * create and delete all use the same predicate so they can't disagree about which patients exist.
 *
 * <p>Nothing here is transactional. Concurrent writers to one key race last-write-wins, and a bulk
 * patient delete can fail halfway.
 */
public class PatientDocumentStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(PatientDocumentStore.class);

  private static final String DELIMITER = "/";

  private final ObjectStoreClient objectStoreClient;
  private final String bucket;
  private final DocumentStoreProperties properties;

  public PatientDocumentStore(
      ObjectStoreClient objectStoreClient, String bucket, DocumentStoreProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.bucket = bucket;
    this.properties = properties;
  }

  /**
   * Map (patientId, fileName) to its blob key.
   *
   * @throws IllegalArgumentException if either part is blank or would escape the patient folder
   */
  public String keyFor(String patientId, String fileName) {
    return patientPrefix(patientId) + validateFileName(fileName);
  }

  /** The prefix shared by every document of the patient, ending with "/". */
  public String patientPrefix(String patientId) {
    return rootPrefix() + validatePatientId(patientId) + DELIMITER;
  }

  /**
   * Load one document.
   *
   * @throws DocumentNotFoundException if nothing is stored at the derived key
   */
  public PatientDocument get(String patientId, String fileName) {
    String key = keyFor(patientId, fileName);
    LOGGER.info("Fetching document: bucket={}, key={}", bucket, key);

    try {
      byte[] content = objectStoreClient.getObject(bucket, key);
      return new PatientDocument(
          fileName,
          key,
          content,
          MediaKind.fromFileName(fileName),
          MediaKind.contentTypeFor(fileName));
    } catch (ObjectNotFoundException e) {
      LOGGER.warn("Document not found: {}", key);
      throw new DocumentNotFoundException(key);
    }
  }

  /** Load one document and decode it as UTF-8 text, whatever its extension. */
  public String getText(String patientId, String fileName) {
    return get(patientId, fileName).asText();
  }

  /**
   * Create or overwrite a document.
   *
   * @return the blob key written
   */
  public String put(String patientId, String fileName, byte[] content) {
    String key = keyFor(patientId, fileName);
    objectStoreClient.putObject(bucket, key, content, MediaKind.contentTypeFor(fileName));
    LOGGER.info("Saved document: key={}, size={} bytes", key, content.length);
    return key;
  }

  /** Text convenience for {@link #put(String, String, byte[])}. */
  public String put(String patientId, String fileName, String content) {
    return put(patientId, fileName, content.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * List the documents of a patient.
   *
   * <p>A zero-length "directory marker" object at the prefix itself is skipped. An unknown patient
   * yields an empty list.
   */
  public List<DocumentSummary> list(String patientId) {
    String prefix = patientPrefix(patientId);
    List<DocumentSummary> documents = new ArrayList<>();

    for (ObjectSummary object : objectStoreClient.listObjects(bucket, prefix)) {
      String name = object.key().substring(prefix.length());
      if (name.isEmpty()) {
        continue;
      }
      documents.add(new DocumentSummary(name, object.key(), object.size(), object.lastModified()));
    }
    return documents;
  }

  /**
   * Delete one document.
   *
   * @throws DocumentNotFoundException if nothing is stored at the derived key
   */
  public void delete(String patientId, String fileName) {
    String key = keyFor(patientId, fileName);
    if (!objectStoreClient.exists(bucket, key)) {
      throw new DocumentNotFoundException(key);
    }
    objectStoreClient.deleteObject(bucket, key);
    LOGGER.info("Deleted document: {}", key);
  }

  /** True when at least one blob lives under the patient's prefix. */
  public boolean patientExists(String patientId) {
    return !objectStoreClient.listObjects(bucket, patientPrefix(patientId)).isEmpty();
  }

  /**
   * Create a patient folder by writing the seed document.
   *
   * @return the key of the seed document
   * @throws PatientAlreadyExistsException if the folder already holds a blob
   */
  public String createPatient(String patientId) {
    String prefix = patientPrefix(patientId);
    if (patientExists(patientId)) {
      throw new PatientAlreadyExistsException(patientId, prefix);
    }
    String key = put(patientId, properties.seedFileName(), properties.seedContent());
    LOGGER.info("Created patient folder: {}", prefix);
    return key;
  }

  /**
   * Delete a patient folder and every document in it.
   *
   * @return the number of blobs the store reported deleted
   * @throws PatientNotFoundException if the folder holds no blob
   */
  public int deletePatient(String patientId) {
    String prefix = patientPrefix(patientId);
    List<String> keys =
        objectStoreClient.listObjects(bucket, prefix).stream().map(ObjectSummary::key).toList();

    if (keys.isEmpty()) {
      throw new PatientNotFoundException(patientId, prefix);
    }

    int deleted = objectStoreClient.deleteObjects(bucket, keys);
    if (deleted < keys.size()) {
      LOGGER.warn(
          "Patient folder partially deleted: prefix={}, deleted={}/{}",
          prefix,
          deleted,
          keys.size());
    } else {
      LOGGER.info("Deleted patient folder: prefix={}, files={}", prefix, deleted);
    }
    return deleted;
  }

  /** Names of every patient folder directly under the root prefix. */
  public List<String> listPatients() {
    String root = rootPrefix();
    List<String> patients = new ArrayList<>();

    for (String commonPrefix : objectStoreClient.listCommonPrefixes(bucket, root, DELIMITER)) {
      // "patient_profile/p001/" -> "p001"
      String name = commonPrefix.substring(root.length());
      if (name.endsWith(DELIMITER)) {
        name = name.substring(0, name.length() - 1);
      }
      if (!name.isEmpty()) {
        patients.add(name);
      }
    }
    return patients;
  }

  private String rootPrefix() {
    return properties.rootPrefix() + DELIMITER;
  }

  private static String validatePatientId(String patientId) {
    if (patientId == null || patientId.isBlank()) {
      throw new IllegalArgumentException("Patient id must not be blank");
    }
    if (patientId.contains(DELIMITER) || patientId.equals("..") || patientId.equals(".")) {
      throw new IllegalArgumentException("Illegal patient id: " + patientId);
    }
    return patientId;
  }

  private static String validateFileName(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      throw new IllegalArgumentException("File name must not be blank");
    }
    if (fileName.startsWith(DELIMITER)) {
      throw new IllegalArgumentException("Illegal file name: " + fileName);
    }
    for (String segment : fileName.split(DELIMITER)) {
      if (segment.equals("..")) {
        throw new IllegalArgumentException("Illegal file name: " + fileName);
      }
    }
    return fileName;
  }
}

package com.scholary.medforce.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.medforce.document.PatientDocument;
import com.scholary.medforce.document.PatientDocumentStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves single patient documents to the simulation front end.
 *
 * <p>The response body is typed by file extension: JSON documents are returned as JSON, markdown
 * and text as {@code text/markdown}, images with their image type and everything else as an octet
 * stream.
 */
@RestController
@Tag(name = "Patient files", description = "Read patient documents")
public class PatientFileController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PatientFileController.class);

  private static final MediaType MARKDOWN_UTF8 =
      new MediaType("text", "markdown", StandardCharsets.UTF_8);

  private final PatientDocumentStore documentStore;
  private final ObjectMapper objectMapper;

  public PatientFileController(PatientDocumentStore documentStore, ObjectMapper objectMapper) {
    this.documentStore = documentStore;
    this.objectMapper = objectMapper;
  }

  @PostMapping("/api/get-patient-file")
  @Operation(
      summary = "Fetch a patient file",
      description = "Return one document from the patient's folder, typed by its extension")
  public ResponseEntity<?> getPatientFile(@Valid @RequestBody PatientFileRequest request) {
    LOGGER.info("Fetching patient file: pid={}, file={}", request.pid(), request.fileName());

    PatientDocument document = documentStore.get(request.pid(), request.fileName());

    switch (document.mediaKind()) {
      case JSON:
        JsonNode json;
        try {
          json = objectMapper.readTree(document.content());
        } catch (IOException e) {
          LOGGER.error("Stored JSON document is unreadable: {}", document.key(), e);
          return invalidJson(document, e.getMessage());
        }
        // readTree yields a missing node rather than failing on an empty document
        if (json == null || json.isMissingNode()) {
          LOGGER.error("Stored JSON document is empty: {}", document.key());
          return invalidJson(document, "no content");
        }
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(json);
      case TEXT:
        return ResponseEntity.ok().contentType(MARKDOWN_UTF8).body(document.asText());
      default:
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(document.contentType()))
            .body(document.content());
    }
  }

  private static ResponseEntity<ApiError> invalidJson(PatientDocument document, String detail) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.of("Invalid JSON in " + document.key() + ": " + detail));
  }
}

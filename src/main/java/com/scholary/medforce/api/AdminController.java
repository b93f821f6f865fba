package com.scholary.medforce.api;

import com.scholary.medforce.api.FileListResponse.FileEntry;
import com.scholary.medforce.document.DocumentSummary;
import com.scholary.medforce.document.PatientDocumentStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administration of patient folders and their documents.
 *
 * <p>Failures are thrown as document store exceptions and turned into error bodies by
 * {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin", description = "Manage patient folders and documents")
public class AdminController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AdminController.class);

  private final PatientDocumentStore documentStore;

  public AdminController(PatientDocumentStore documentStore) {
    this.documentStore = documentStore;
  }

  @GetMapping("/list-files/{pid}")
  @Operation(summary = "List files", description = "List every document in a patient's folder")
  public ResponseEntity<FileListResponse> listFiles(@PathVariable String pid) {
    List<FileEntry> files =
        documentStore.list(pid).stream().map(AdminController::toEntry).toList();
    return ResponseEntity.ok(new FileListResponse(files));
  }

  @PostMapping("/save-file")
  @Operation(summary = "Save file", description = "Create or overwrite a text document")
  public ResponseEntity<MessageResponse> saveFile(@Valid @RequestBody SaveFileRequest request) {
    String key = documentStore.put(request.pid(), request.fileName(), request.content());
    LOGGER.info("Saved file via admin API: {}", key);
    return ResponseEntity.ok(MessageResponse.withPath("File saved successfully", key));
  }

  @DeleteMapping("/delete-file")
  @Operation(summary = "Delete file", description = "Delete one document")
  public ResponseEntity<MessageResponse> deleteFile(
      @RequestParam String pid, @RequestParam("file_name") String fileName) {
    documentStore.delete(pid, fileName);
    return ResponseEntity.ok(MessageResponse.of("File deleted successfully"));
  }

  @GetMapping("/list-patients")
  @Operation(summary = "List patients", description = "List every patient folder")
  public ResponseEntity<PatientListResponse> listPatients() {
    return ResponseEntity.ok(new PatientListResponse(documentStore.listPatients()));
  }

  @PostMapping("/create-patient")
  @Operation(summary = "Create patient", description = "Create a folder with a seed profile")
  public ResponseEntity<MessageResponse> createPatient(@Valid @RequestBody PatientRequest request) {
    documentStore.createPatient(request.pid());
    return ResponseEntity.ok(MessageResponse.withPid("Patient created", request.pid()));
  }

  @DeleteMapping("/delete-patient")
  @Operation(summary = "Delete patient", description = "Delete a patient folder and all its files")
  public ResponseEntity<MessageResponse> deletePatient(@RequestParam String pid) {
    int deleted = documentStore.deletePatient(pid);
    return ResponseEntity.ok(
        MessageResponse.of(String.format("Deleted %d files for patient %s", deleted, pid)));
  }

  private static FileEntry toEntry(DocumentSummary summary) {
    return new FileEntry(
        summary.name(),
        summary.fullPath(),
        summary.size(),
        summary.updated() != null ? summary.updated().toString() : null);
  }
}

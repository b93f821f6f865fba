package com.scholary.medforce.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.medforce.testutil.InMemoryObjectStoreClient;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PatientDocumentStoreTest {

  private static final String BUCKET = "clinic_sim_dev";
  private static final byte[] PNG_BYTES = {(byte) 0x89, 'P', 'N', 'G', 0, 1, 2};

  private InMemoryObjectStoreClient objectStore;
  private PatientDocumentStore store;

  @BeforeEach
  void setUp() {
    objectStore = new InMemoryObjectStoreClient();
    store = new PatientDocumentStore(objectStore, BUCKET, DocumentStoreProperties.defaults());
  }

  @Test
  void keyFor_shouldPlaceDocumentsUnderPatientFolder() {
    assertThat(store.keyFor("p001", "notes.md")).isEqualTo("patient_profile/p001/notes.md");
    assertThat(store.keyFor("p001", "labs/cbc.json")).isEqualTo("patient_profile/p001/labs/cbc.json");
  }

  @Test
  void keyFor_shouldRejectNamesThatEscapeTheFolder() {
    assertThatThrownBy(() -> store.keyFor("", "a.md")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.keyFor("p1/p2", "a.md"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.keyFor("p1", "../p2/a.md"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.keyFor("p1", "/a.md"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.keyFor("p1", " ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void put_thenGet_shouldReturnJsonDocument() {
    store.put("p001", "vitals.json", "{\"hr\":72}");

    PatientDocument document = store.get("p001", "vitals.json");

    assertThat(document.mediaKind()).isEqualTo(MediaKind.JSON);
    assertThat(document.contentType()).isEqualTo("application/json");
    assertThat(document.asText()).isEqualTo("{\"hr\":72}");
    assertThat(objectStore.contentType(BUCKET, "patient_profile/p001/vitals.json"))
        .isEqualTo("application/json");
  }

  @Test
  void put_thenGet_shouldReturnMarkdownText() {
    store.put("p001", "history.md", "# History\nAsthma, diagnosed 2019");

    PatientDocument document = store.get("p001", "history.md");

    assertThat(document.mediaKind()).isEqualTo(MediaKind.TEXT);
    assertThat(document.asText()).isEqualTo("# History\nAsthma, diagnosed 2019");
  }

  @Test
  void put_thenGet_shouldReturnImageBytesUntouched() {
    store.put("p001", "xray.png", PNG_BYTES);

    PatientDocument document = store.get("p001", "xray.png");

    assertThat(document.mediaKind()).isEqualTo(MediaKind.IMAGE);
    assertThat(document.contentType()).isEqualTo("image/png");
    assertThat(document.content()).isEqualTo(PNG_BYTES);
  }

  @Test
  void put_shouldOverwriteExistingDocument() {
    store.put("p001", "notes.md", "first");
    store.put("p001", "notes.md", "second");

    assertThat(store.getText("p001", "notes.md")).isEqualTo("second");
  }

  @Test
  void get_shouldReportMissingDocumentWithItsKey() {
    assertThatThrownBy(() -> store.get("p001", "missing.md"))
        .isInstanceOf(DocumentNotFoundException.class)
        .hasMessage("File not found")
        .extracting(e -> ((DocumentNotFoundException) e).getPath())
        .isEqualTo("patient_profile/p001/missing.md");
  }

  @Test
  void list_shouldSkipDirectoryMarker() {
    objectStore.putObject(BUCKET, "patient_profile/p001/", new byte[0], "application/x-directory");
    store.put("p001", "a.md", "a");
    store.put("p001", "b.json", "{}");

    assertThat(store.list("p001"))
        .extracting(DocumentSummary::name)
        .containsExactly("a.md", "b.json");
    assertThat(store.list("p001"))
        .extracting(DocumentSummary::fullPath)
        .containsExactly("patient_profile/p001/a.md", "patient_profile/p001/b.json");
  }

  @Test
  void list_shouldNotLeakNeighbourWithSharedPrefix() {
    store.put("p1", "a.md", "a");
    store.put("p10", "b.md", "b");

    assertThat(store.list("p1")).extracting(DocumentSummary::name).containsExactly("a.md");
  }

  @Test
  void delete_shouldRemoveDocument() {
    store.put("p001", "a.md", "a");

    store.delete("p001", "a.md");

    assertThat(objectStore.keys(BUCKET)).isEmpty();
  }

  @Test
  void delete_shouldFailForMissingDocument() {
    assertThatThrownBy(() -> store.delete("p001", "a.md"))
        .isInstanceOf(DocumentNotFoundException.class);
  }

  @Test
  void createPatient_shouldWriteSeedDocument() {
    String key = store.createPatient("p002");

    assertThat(key).isEqualTo("patient_profile/p002/patient_info.md");
    assertThat(
            new String(objectStore.getObject(BUCKET, key), StandardCharsets.UTF_8))
        .isEqualTo("# Patient Profile\nName: \nAge: ");
    assertThat(store.patientExists("p002")).isTrue();
  }

  @Test
  void createPatient_shouldRejectExistingPatientAndLeaveStoreUnchanged() {
    store.createPatient("p002");
    store.put("p002", "patient_info.md", "edited");

    assertThatThrownBy(() -> store.createPatient("p002"))
        .isInstanceOf(PatientAlreadyExistsException.class)
        .hasMessage("Patient already exists");
    assertThat(store.getText("p002", "patient_info.md")).isEqualTo("edited");
  }

  @Test
  void deletePatient_shouldRemoveEveryDocument() {
    store.put("p003", "a.md", "a");
    store.put("p003", "b.json", "{}");
    store.put("p003", "c.png", PNG_BYTES);
    store.put("p004", "keep.md", "k");

    assertThat(store.deletePatient("p003")).isEqualTo(3);
    assertThat(store.patientExists("p003")).isFalse();
    assertThat(store.patientExists("p004")).isTrue();
  }

  @Test
  void deletePatient_shouldFailForEmptyFolder() {
    assertThatThrownBy(() -> store.deletePatient("ghost"))
        .isInstanceOf(PatientNotFoundException.class)
        .hasMessage("Patient not found");
  }

  @Test
  void deletePatient_shouldReportPartialDeletion() {
    store.put("p005", "a.md", "a");
    store.put("p005", "b.md", "b");
    objectStore.failDeletesFor("patient_profile/p005/b.md");

    assertThat(store.deletePatient("p005")).isEqualTo(1);
    assertThat(store.list("p005")).extracting(DocumentSummary::name).containsExactly("b.md");
  }

  @Test
  void listPatients_shouldReturnFolderNames() {
    store.createPatient("p1");
    store.createPatient("p2");
    store.put("p2", "labs/cbc.json", "{}");
    objectStore.putObject(BUCKET, "other_root/p9/x.md", new byte[] {1}, "text/markdown");

    assertThat(store.listPatients()).containsExactly("p1", "p2");
  }

  @Test
  void listPatients_shouldAgreeWithCreateAndDelete() {
    store.createPatient("p1");
    store.deletePatient("p1");

    assertThat(store.listPatients()).isEmpty();
  }

  @Test
  void customRootPrefix_shouldBeNormalised() {
    PatientDocumentStore custom =
        new PatientDocumentStore(
            objectStore, BUCKET, new DocumentStoreProperties("profiles/", "seed.md", "hi"));

    assertThat(custom.createPatient("p1")).isEqualTo("profiles/p1/seed.md");
    assertThat(custom.listPatients()).containsExactly("p1");
  }

  @Test
  void slashOnlyRootPrefix_shouldFallBackToDefault() {
    DocumentStoreProperties properties = new DocumentStoreProperties("//", null, null);

    assertThat(properties.rootPrefix()).isEqualTo("patient_profile");
    assertThat(new PatientDocumentStore(objectStore, BUCKET, properties).keyFor("p1", "a.md"))
        .isEqualTo("patient_profile/p1/a.md");
  }
}

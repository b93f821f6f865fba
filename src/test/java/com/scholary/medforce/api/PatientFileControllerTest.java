package com.scholary.medforce.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.medforce.document.DocumentStoreProperties;
import com.scholary.medforce.document.PatientDocumentStore;
import com.scholary.medforce.testutil.InMemoryObjectStoreClient;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.RequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class PatientFileControllerTest {

  private static final byte[] PNG_BYTES = {(byte) 0x89, 'P', 'N', 'G', 13, 10};

  private PatientDocumentStore store;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    store =
        new PatientDocumentStore(
            new InMemoryObjectStoreClient(), "clinic_sim_dev", DocumentStoreProperties.defaults());
    mockMvc =
        MockMvcBuilders.standaloneSetup(new PatientFileController(store, new ObjectMapper()))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  @Test
  void jsonDocumentShouldBeReturnedAsJson() throws Exception {
    store.put("p1", "vitals.json", "{\"hr\":72,\"bp\":\"120/80\"}");

    mockMvc
        .perform(request("p1", "vitals.json"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.hr").value(72))
        .andExpect(jsonPath("$.bp").value("120/80"));
  }

  @Test
  void markdownDocumentShouldBeReturnedAsText() throws Exception {
    store.put("p1", "patient_info.md", "# Patient Profile\nName: Jane");

    mockMvc
        .perform(request("p1", "patient_info.md"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith("text/markdown"))
        .andExpect(content().string("# Patient Profile\nName: Jane"));
  }

  @Test
  void imageShouldBeReturnedAsBytes() throws Exception {
    store.put("p1", "xray.png", PNG_BYTES);

    mockMvc
        .perform(request("p1", "xray.png"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.IMAGE_PNG))
        .andExpect(content().bytes(PNG_BYTES));
  }

  @Test
  void missingDocumentShouldBe404WithPath() throws Exception {
    mockMvc
        .perform(request("p1", "missing.md"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("File not found"))
        .andExpect(jsonPath("$.path").value("patient_profile/p1/missing.md"));
  }

  @Test
  void corruptJsonDocumentShouldBe500() throws Exception {
    store.put("p1", "broken.json", "{\"hr\":");

    mockMvc
        .perform(request("p1", "broken.json"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value(Matchers.startsWith("Invalid JSON")));
  }

  @Test
  void emptyJsonDocumentShouldBe500() throws Exception {
    store.put("p1", "empty.json", "  ");

    mockMvc
        .perform(request("p1", "empty.json"))
        .andExpect(status().isInternalServerError())
        .andExpect(
            jsonPath("$.error").value("Invalid JSON in patient_profile/p1/empty.json: no content"));
  }

  @Test
  void blankPatientShouldBe400() throws Exception {
    mockMvc
        .perform(request(" ", "a.md"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").exists());
  }

  @Test
  void pathEscapingFileNameShouldBe400() throws Exception {
    mockMvc.perform(request("p1", "../p2/secret.md")).andExpect(status().isBadRequest());
  }

  private static RequestBuilder request(String pid, String fileName) {
    return post("/api/get-patient-file")
        .contentType(MediaType.APPLICATION_JSON)
        .content(String.format("{\"pid\":\"%s\",\"file_name\":\"%s\"}", pid, fileName));
  }
}

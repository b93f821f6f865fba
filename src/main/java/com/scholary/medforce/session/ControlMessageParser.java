package com.scholary.medforce.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Decodes text frames into {@link ControlMessage}s.
 *
 * <ul>
 *   <li>{@code {"status": true}} is a stop signal (checked first)
 *   <li>{@code {"type": "start", "patient_id": "..."}} starts a session; other scalar fields become
 *       options
 *   <li>any other valid JSON is UNKNOWN
 * </ul>
 */
public class ControlMessageParser {

  static final String TYPE_FIELD = "type";
  static final String STATUS_FIELD = "status";
  static final String PATIENT_ID_FIELD = "patient_id";

  private final ObjectMapper objectMapper;
  private final String defaultPatientId;

  public ControlMessageParser(ObjectMapper objectMapper, String defaultPatientId) {
    this.objectMapper = objectMapper;
    this.defaultPatientId = defaultPatientId;
  }

  /**
   * @throws MalformedControlFrameException if the payload is not valid JSON
   */
  public ControlMessage parse(String payload) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      throw new MalformedControlFrameException("Control frame is not valid JSON", e);
    }

    if (root == null || !root.isObject()) {
      return ControlMessage.unknown();
    }

    JsonNode status = root.get(STATUS_FIELD);
    if (status != null && status.isBoolean() && status.booleanValue()) {
      return ControlMessage.stop();
    }

    JsonNode type = root.get(TYPE_FIELD);
    if (type != null && "start".equals(type.asText())) {
      JsonNode patientId = root.get(PATIENT_ID_FIELD);
      String pid =
          patientId == null || patientId.isNull() || patientId.asText().isBlank()
              ? defaultPatientId
              : patientId.asText();
      return ControlMessage.start(pid, options(root));
    }

    return ControlMessage.unknown();
  }

  private static Map<String, String> options(JsonNode root) {
    Map<String, String> options = new HashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String name = field.getKey();
      JsonNode value = field.getValue();
      if (TYPE_FIELD.equals(name) || PATIENT_ID_FIELD.equals(name)) {
        continue;
      }
      if (value.isValueNode() && !value.isNull()) {
        options.put(name, value.asText());
      }
    }
    return options;
  }
}

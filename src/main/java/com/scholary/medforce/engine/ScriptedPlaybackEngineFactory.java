package com.scholary.medforce.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.medforce.document.DocumentNotFoundException;
import com.scholary.medforce.document.PatientDocumentStore;
import com.scholary.medforce.objectstore.ObjectStoreException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link ScriptedPlaybackEngine} from a script document in the patient's folder.
 *
 * <p>The start frame may name the script with {@code script_file}. The script must be a JSON
 * array of objects.
 */
public class ScriptedPlaybackEngineFactory implements RecognitionEngineFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScriptedPlaybackEngineFactory.class);

  public static final String SCRIPT_OPTION = "script_file";

  private static final TypeReference<List<Map<String, Object>>> SCRIPT_TYPE =
      new TypeReference<>() {};

  private final PatientDocumentStore documentStore;
  private final ObjectMapper objectMapper;
  private final EngineProperties properties;

  public ScriptedPlaybackEngineFactory(
      PatientDocumentStore documentStore, ObjectMapper objectMapper, EngineProperties properties) {
    this.documentStore = documentStore;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public RecognitionEngine create(EngineContext context, RecognitionEventSink sink) {
    String scriptFile = context.option(SCRIPT_OPTION, properties.playback().defaultScript());
    LOGGER.info("Loading playback script: patientId={}, file={}", context.patientId(), scriptFile);

    List<Map<String, Object>> script;
    try {
      byte[] content = documentStore.get(context.patientId(), scriptFile).content();
      script = objectMapper.readValue(content, SCRIPT_TYPE);
    } catch (DocumentNotFoundException e) {
      throw new EngineException("Script not found: " + e.getPath(), e);
    } catch (IOException e) {
      throw new EngineException("Script is not a JSON array of objects: " + scriptFile, e);
    } catch (ObjectStoreException e) {
      throw new EngineException("Script could not be loaded: " + scriptFile, e);
    }

    return new ScriptedPlaybackEngine(context, script, sink, properties.playback().intervalMs());
  }
}

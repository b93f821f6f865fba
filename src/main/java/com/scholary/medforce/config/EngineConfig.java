package com.scholary.medforce.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.medforce.document.DocumentStoreProperties;
import com.scholary.medforce.document.PatientDocumentStore;
import com.scholary.medforce.engine.EngineProperties;
import com.scholary.medforce.engine.ScriptedPlaybackEngineFactory;
import com.scholary.medforce.engine.WhisperRecognitionEngineFactory;
import com.scholary.medforce.session.DocumentSeedContextProvider;
import com.scholary.medforce.session.SeedContextProvider;
import com.scholary.medforce.session.SessionVariant;
import com.scholary.medforce.whisper.WhisperService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the two session variants served over WebSocket.
 *
 * <p>The transcriber seeds its engine with the patient's profile document and streams audio to
 * Whisper. The simulation replays a script from the patient's folder and needs no seed context.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

  public static final String TRANSCRIBER_VARIANT = "transcriber";
  public static final String SIMULATION_VARIANT = "simulation";

  @Bean
  public WhisperRecognitionEngineFactory whisperRecognitionEngineFactory(
      WhisperService whisperService, EngineProperties properties) {
    return new WhisperRecognitionEngineFactory(whisperService, properties);
  }

  @Bean
  public ScriptedPlaybackEngineFactory scriptedPlaybackEngineFactory(
      PatientDocumentStore documentStore, ObjectMapper objectMapper, EngineProperties properties) {
    return new ScriptedPlaybackEngineFactory(documentStore, objectMapper, properties);
  }

  @Bean
  public SessionVariant transcriberVariant(
      WhisperRecognitionEngineFactory engineFactory,
      PatientDocumentStore documentStore,
      DocumentStoreProperties documentProperties) {
    return new SessionVariant(
        TRANSCRIBER_VARIANT,
        engineFactory,
        new DocumentSeedContextProvider(documentStore, documentProperties.seedFileName()),
        "Transcriber initialized for %s");
  }

  @Bean
  public SessionVariant simulationVariant(ScriptedPlaybackEngineFactory engineFactory) {
    return new SessionVariant(
        SIMULATION_VARIANT,
        engineFactory,
        SeedContextProvider.none(),
        "Audio simulation initialized for %s");
  }
}

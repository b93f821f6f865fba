package com.scholary.medforce.engine;

import com.scholary.medforce.whisper.WhisperService;

/** Builds a {@link WhisperRecognitionEngine} per live transcription session. */
public class WhisperRecognitionEngineFactory implements RecognitionEngineFactory {

  private final WhisperService whisperService;
  private final EngineProperties properties;

  public WhisperRecognitionEngineFactory(WhisperService whisperService, EngineProperties properties) {
    this.whisperService = whisperService;
    this.properties = properties;
  }

  @Override
  public RecognitionEngine create(EngineContext context, RecognitionEventSink sink) {
    return new WhisperRecognitionEngine(context, whisperService, sink, properties);
  }
}

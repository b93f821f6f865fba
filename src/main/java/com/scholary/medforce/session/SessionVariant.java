package com.scholary.medforce.session;

import com.scholary.medforce.engine.RecognitionEngineFactory;

/**
 * One flavour of duplex session: live transcription, scripted playback, and so on. All variants
 * share the protocol and differ only in their engine and seed context.
 *
 * @param name short name used in logs
 * @param engineFactory creates the engine on start
 * @param seedContextProvider fetches the context the engine is seeded with
 * @param readyMessage acknowledgment text, formatted with the patient id
 */
public record SessionVariant(
    String name,
    RecognitionEngineFactory engineFactory,
    SeedContextProvider seedContextProvider,
    String readyMessage) {

  public String readyMessageFor(String patientId) {
    return String.format(readyMessage, patientId);
  }
}

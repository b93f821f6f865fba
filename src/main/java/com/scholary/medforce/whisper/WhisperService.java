package com.scholary.medforce.whisper;

/**
 * Interface for transcription services.
 *
 * <p>This abstraction lets the live engine be tested without an HTTP server and allows swapping
 * transcription providers without touching the session code.
 */
public interface WhisperService {

  /**
   * Transcribe one window of audio.
   *
   * @param wavAudio a complete WAV file
   * @param durationSeconds the duration of the window in seconds
   * @param windowIndex the index of this window within the session
   * @param prompt optional context text used to bias vocabulary, may be null
   * @return the transcription response
   * @throws WhisperException if transcription fails
   */
  WhisperResponse transcribe(byte[] wavAudio, double durationSeconds, int windowIndex, String prompt);
}

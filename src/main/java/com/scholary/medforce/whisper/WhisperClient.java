package com.scholary.medforce.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for calling the faster-whisper transcription API.
 *
 * <p>This handles the low-level HTTP communication: building multipart requests, sending audio
 * windows, parsing responses, and retrying on transient failures.
 *
 * <p>Runs on the session's engine thread, never on a WebSocket container thread, so blocking on
 * the HTTP round trip is acceptable here. An interrupt (session teardown) aborts the call and any
 * pending retry.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  /** Whisper conditions on roughly 224 prompt tokens; longer prompts keep their tail. */
  static final int MAX_PROMPT_CHARS = 1000;

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  /**
   * Transcribe one audio window.
   *
   * <p>Sends the WAV bytes to the Whisper API as multipart/form-data and returns the parsed
   * response. Includes retry logic for transient failures.
   *
   * @throws WhisperException if transcription fails after retries or the thread is interrupted
   */
  @Override
  public WhisperResponse transcribe(
      byte[] wavAudio, double durationSeconds, int windowIndex, String prompt) {
    LOGGER.debug(
        "Transcribing window: index={}, duration={}s, bytes={}",
        windowIndex,
        durationSeconds,
        wavAudio.length);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(wavAudio, durationSeconds, windowIndex, prompt);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new WhisperException("Transcription interrupted", e);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new WhisperException("Transcription interrupted", ie);
          }
        }
      }
    }

    throw new WhisperException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private WhisperResponse attemptTranscribe(
      byte[] wavAudio, double durationSeconds, int windowIndex, String prompt)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher =
        buildMultipartBody(wavAudio, durationSeconds, windowIndex, prompt, boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher)
            .build();

    HttpResponse<byte[]> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s",
              response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
    }

    WhisperResponse whisperResponse = objectMapper.readValue(response.body(), WhisperResponse.class);

    LOGGER.debug(
        "Transcription successful: window={}, {} segments, language={}",
        windowIndex,
        whisperResponse.segments() == null ? 0 : whisperResponse.segments().size(),
        whisperResponse.language());

    return whisperResponse;
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no multipart support, so the parts are written by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="window-0.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="chunkDurationSeconds"
   *
   * 5.0
   * --boundary
   * Content-Disposition: form-data; name="chunkIndex"
   *
   * 0
   * --boundary
   * Content-Disposition: form-data; name="prompt"
   *
   * [patient context]
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(
      byte[] wavAudio, double durationSeconds, int windowIndex, String prompt, String boundary) {

    ByteArrayOutputStream body = new ByteArrayOutputStream(wavAudio.length + 1024);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"window-")
        .append(windowIndex)
        .append(".wav\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");
    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));
    body.writeBytes(wavAudio);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "chunkDurationSeconds", String.valueOf(durationSeconds));
    appendField(sb, boundary, "chunkIndex", String.valueOf(windowIndex));
    if (prompt != null && !prompt.isBlank()) {
      appendField(sb, boundary, "prompt", promptTail(prompt));
    }
    sb.append("--").append(boundary).append("--\r\n");
    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));

    return BodyPublishers.ofByteArray(body.toByteArray());
  }

  static String promptTail(String prompt) {
    return prompt.length() > MAX_PROMPT_CHARS
        ? prompt.substring(prompt.length() - MAX_PROMPT_CHARS)
        : prompt;
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}

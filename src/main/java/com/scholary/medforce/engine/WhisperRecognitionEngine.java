package com.scholary.medforce.engine;

import com.scholary.medforce.whisper.TranscriptSegment;
import com.scholary.medforce.whisper.WavEncoder;
import com.scholary.medforce.whisper.WhisperException;
import com.scholary.medforce.whisper.WhisperResponse;
import com.scholary.medforce.whisper.WhisperService;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live transcription engine backed by the Whisper HTTP API.
 *
 * <p>Audio chunks are queued by {@link #feed(byte[])} and accumulated by {@link #run()} into
 * fixed-size windows. Each full window is sent to Whisper, and every returned segment is emitted
 * as a {@code transcript} event with times relative to the start of the session.
 *
 * <p>Event shapes:
 *
 * <pre>
 * {"type":"transcript","window":0,"start":0.0,"end":2.4,"text":"..."}
 * {"type":"status","status":"finished","windows":3}
 * </pre>
 */
public class WhisperRecognitionEngine implements RecognitionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperRecognitionEngine.class);

  private final EngineContext context;
  private final WhisperService whisperService;
  private final RecognitionEventSink sink;
  private final int sampleRate;
  private final int windowBytes;
  private final long pollIntervalMs;

  private final BlockingQueue<byte[]> audioQueue;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private volatile boolean finishRequested;

  // Owned by the run() thread only
  private final ByteArrayOutputStream window = new ByteArrayOutputStream();
  private int windowIndex;
  private double offsetSeconds;

  public WhisperRecognitionEngine(
      EngineContext context,
      WhisperService whisperService,
      RecognitionEventSink sink,
      EngineProperties properties) {
    this.context = context;
    this.whisperService = whisperService;
    this.sink = sink;
    this.sampleRate = properties.sampleRate();
    this.windowBytes = properties.windowBytes();
    this.pollIntervalMs = properties.pollIntervalMs();
    this.audioQueue = new ArrayBlockingQueue<>(properties.queueCapacity());
  }

  @Override
  public void run() throws InterruptedException {
    LOGGER.info(
        "Transcription loop started: patientId={}, windowBytes={}",
        context.patientId(),
        windowBytes);
    try {
      while (running.get()) {
        byte[] chunk = audioQueue.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
        if (chunk != null) {
          window.write(chunk, 0, chunk.length);
          if (window.size() >= windowBytes) {
            transcribeWindow();
          }
          continue;
        }
        // Queue drained: a requested finish can now complete
        if (finishRequested) {
          transcribeWindow();
          emitFinished();
          break;
        }
      }
    } finally {
      running.set(false);
      LOGGER.info(
          "Transcription loop exited: patientId={}, windows={}", context.patientId(), windowIndex);
    }
  }

  @Override
  public boolean feed(byte[] chunk) {
    if (!running.get() || finishRequested) {
      return false;
    }
    if (!audioQueue.offer(chunk)) {
      LOGGER.warn(
          "Audio queue full, dropping chunk: patientId={}, bytes={}",
          context.patientId(),
          chunk.length);
      return false;
    }
    return true;
  }

  @Override
  public void finish() {
    finishRequested = true;
  }

  @Override
  public void stop() {
    running.set(false);
    audioQueue.clear();
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  private void transcribeWindow() {
    byte[] buffered = window.toByteArray();
    window.reset();
    // Windows end on a sample boundary; an odd trailing byte starts the next window
    int sampleAligned = buffered.length - (buffered.length % WavEncoder.BYTES_PER_SAMPLE);
    if (sampleAligned < buffered.length) {
      window.write(buffered, sampleAligned, buffered.length - sampleAligned);
    }
    if (sampleAligned == 0) {
      return;
    }
    byte[] pcm = Arrays.copyOf(buffered, sampleAligned);

    double duration = WavEncoder.durationSeconds(pcm.length, sampleRate);
    WhisperResponse response;
    try {
      response =
          whisperService.transcribe(
              WavEncoder.encodePcm16LeMono(pcm, sampleRate),
              duration,
              windowIndex,
              context.seedContext());
    } catch (WhisperException e) {
      throw new EngineException(
          String.format(
              "Transcription failed: patientId=%s, window=%d", context.patientId(), windowIndex),
          e);
    }

    if (response.segments() != null) {
      for (TranscriptSegment segment : response.segments()) {
        if (segment.text() == null || segment.text().isBlank()) {
          continue;
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", "transcript");
        event.put("window", windowIndex);
        event.put("start", offsetSeconds + segment.start());
        event.put("end", offsetSeconds + segment.end());
        event.put("text", segment.text().strip());
        sink.emit(event);
      }
    }

    offsetSeconds += duration;
    windowIndex++;
  }

  private void emitFinished() {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("type", "status");
    event.put("status", "finished");
    event.put("windows", windowIndex);
    sink.emit(event);
  }
}

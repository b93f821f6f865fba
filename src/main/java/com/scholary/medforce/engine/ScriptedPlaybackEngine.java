package com.scholary.medforce.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a pre-recorded consultation script instead of recognising live audio.
 *
 * <p>Each script entry is emitted as a {@code transcript} event carrying the entry's own fields.
 * Entries are paced by their {@code delay_ms} field, or by the configured interval when absent.
 * Audio sent by the client is accepted and discarded, so the session protocol behaves the same as
 * for live transcription.
 */
public class ScriptedPlaybackEngine implements RecognitionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScriptedPlaybackEngine.class);

  static final String DELAY_FIELD = "delay_ms";

  private final EngineContext context;
  private final List<Map<String, Object>> script;
  private final RecognitionEventSink sink;
  private final long defaultIntervalMs;

  private final AtomicBoolean running = new AtomicBoolean(true);
  private final CountDownLatch wakeUp = new CountDownLatch(1);
  private volatile boolean finishRequested;

  public ScriptedPlaybackEngine(
      EngineContext context,
      List<Map<String, Object>> script,
      RecognitionEventSink sink,
      long defaultIntervalMs) {
    this.context = context;
    this.script = List.copyOf(script);
    this.sink = sink;
    this.defaultIntervalMs = defaultIntervalMs;
  }

  @Override
  public void run() throws InterruptedException {
    LOGGER.info(
        "Playback started: patientId={}, entries={}", context.patientId(), script.size());
    int played = 0;
    try {
      for (Map<String, Object> entry : script) {
        // wakeUp fires on finish() or stop(), cutting the pause short
        if (wakeUp.await(delayOf(entry), TimeUnit.MILLISECONDS) || !running.get()) {
          break;
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", "transcript");
        entry.forEach(
            (field, value) -> {
              if (!DELAY_FIELD.equals(field) && !"type".equals(field)) {
                event.put(field, value);
              }
            });
        event.put("index", played);
        sink.emit(event);
        played++;
      }

      if (running.get() || finishRequested) {
        Map<String, Object> done = new LinkedHashMap<>();
        done.put("type", "status");
        done.put("status", "finished");
        done.put("entries", played);
        sink.emit(done);
      }
    } finally {
      running.set(false);
      LOGGER.info("Playback exited: patientId={}, played={}", context.patientId(), played);
    }
  }

  @Override
  public boolean feed(byte[] chunk) {
    return running.get();
  }

  @Override
  public void finish() {
    finishRequested = true;
    wakeUp.countDown();
  }

  @Override
  public void stop() {
    running.set(false);
    wakeUp.countDown();
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  private long delayOf(Map<String, Object> entry) {
    Object delay = entry.get(DELAY_FIELD);
    if (delay instanceof Number) {
      return Math.max(0L, ((Number) delay).longValue());
    }
    return defaultIntervalMs;
  }
}

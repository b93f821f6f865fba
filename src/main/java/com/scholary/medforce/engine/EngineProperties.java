package com.scholary.medforce.engine;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for recognition engines ("engine.*").
 *
 * <p>Audio arrives as PCM16LE mono at {@code sampleRate}. The live engine transcribes it in
 * windows of {@code windowSeconds}. Incoming chunks wait in a queue of {@code queueCapacity}
 * entries. Once the queue is full, new chunks are dropped rather than blocking the socket.
 */
@ConfigurationProperties(prefix = "engine")
@Validated
public record EngineProperties(
    @Positive int sampleRate,
    @Positive double windowSeconds,
    @Positive int queueCapacity,
    @Positive long pollIntervalMs,
    @Valid PlaybackProperties playback) {

  public EngineProperties {
    if (playback == null) {
      playback = new PlaybackProperties(1500, "scenario_script.json");
    }
  }

  /** Bytes of PCM16LE mono audio making up one transcription window. */
  public int windowBytes() {
    int bytes = (int) Math.round(sampleRate * windowSeconds) * 2;
    return Math.max(bytes, 2);
  }

  public record PlaybackProperties(@Positive long intervalMs, String defaultScript) {}
}

package com.scholary.medforce.session;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for duplex sessions ("session.*").
 *
 * <p>{@code engineJoinTimeout} bounds how long teardown waits for an engine thread to exit.
 * Buffer sizes and the send timeout apply to the WebSocket container.
 */
@ConfigurationProperties(prefix = "session")
@Validated
public record SessionProperties(
    @NotBlank String defaultPatientId,
    Duration engineJoinTimeout,
    @Positive int outboundThreads,
    @Positive int maxTextMessageBytes,
    @Positive int maxBinaryMessageBytes,
    @Positive long asyncSendTimeoutMs,
    List<String> allowedOrigins) {

  public SessionProperties {
    if (defaultPatientId == null || defaultPatientId.isBlank()) {
      defaultPatientId = "P0001";
    }
    if (engineJoinTimeout == null) {
      engineJoinTimeout = Duration.ofSeconds(2);
    }
    if (allowedOrigins == null || allowedOrigins.isEmpty()) {
      allowedOrigins = List.of("*");
    }
  }
}

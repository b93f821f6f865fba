package com.scholary.medforce.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.medforce.session.SessionProperties;
import com.scholary.medforce.session.SessionVariant;
import com.scholary.medforce.websocket.SessionWebSocketHandler;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the duplex session endpoints.
 *
 * <p>{@code /ws/transcriber} carries live audio for transcription and {@code /ws/simulation/audio}
 * replays a scripted consultation. Both speak the same control protocol.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  public static final String TRANSCRIBER_PATH = "/ws/transcriber";
  public static final String SIMULATION_PATH = "/ws/simulation/audio";

  private final SessionWebSocketHandler transcriberHandler;
  private final SessionWebSocketHandler simulationHandler;
  private final SessionProperties properties;

  public WebSocketConfig(
      @Qualifier("transcriberVariant") SessionVariant transcriberVariant,
      @Qualifier("simulationVariant") SessionVariant simulationVariant,
      ObjectMapper objectMapper,
      @Qualifier("outboundExecutor") Executor outboundExecutor,
      @Qualifier("engineThreadFactory") ThreadFactory engineThreadFactory,
      SessionProperties properties) {
    this.properties = properties;
    this.transcriberHandler =
        new SessionWebSocketHandler(
            transcriberVariant, objectMapper, outboundExecutor, engineThreadFactory, properties);
    this.simulationHandler =
        new SessionWebSocketHandler(
            simulationVariant, objectMapper, outboundExecutor, engineThreadFactory, properties);
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    String[] origins = properties.allowedOrigins().toArray(new String[0]);
    registry.addHandler(transcriberHandler, TRANSCRIBER_PATH).setAllowedOriginPatterns(origins);
    registry.addHandler(simulationHandler, SIMULATION_PATH).setAllowedOriginPatterns(origins);
  }

  @Bean
  public ServletServerContainerFactoryBean createWebSocketContainer() {
    ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
    container.setMaxTextMessageBufferSize(properties.maxTextMessageBytes());
    container.setMaxBinaryMessageBufferSize(properties.maxBinaryMessageBytes());
    container.setAsyncSendTimeout(properties.asyncSendTimeoutMs());
    return container;
  }
}

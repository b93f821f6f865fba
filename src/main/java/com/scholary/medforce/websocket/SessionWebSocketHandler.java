package com.scholary.medforce.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.medforce.logging.StructuredLogger;
import com.scholary.medforce.session.ConnectionOutbox;
import com.scholary.medforce.session.ControlMessageParser;
import com.scholary.medforce.session.DuplexSessionProtocol;
import com.scholary.medforce.session.SessionProperties;
import com.scholary.medforce.session.SessionVariant;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

/**
 * WebSocket endpoint for one session variant.
 *
 * <p>Each accepted connection gets its own {@link DuplexSessionProtocol} and
 * {@link ConnectionOutbox}. Text frames are dispatched as control messages and binary frames as
 * audio. Disconnects and transport errors both end in {@link DuplexSessionProtocol#close(String)},
 * and no exception from session logic is rethrown to the container.
 */
public class SessionWebSocketHandler extends AbstractWebSocketHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionWebSocketHandler.class);

  private final SessionVariant variant;
  private final ControlMessageParser parser;
  private final ObjectMapper objectMapper;
  private final Executor outboundExecutor;
  private final ThreadFactory engineThreadFactory;
  private final SessionProperties properties;

  private final Map<String, DuplexSessionProtocol> protocols = new ConcurrentHashMap<>();

  public SessionWebSocketHandler(
      SessionVariant variant,
      ObjectMapper objectMapper,
      Executor outboundExecutor,
      ThreadFactory engineThreadFactory,
      SessionProperties properties) {
    this.variant = variant;
    this.objectMapper = objectMapper;
    this.outboundExecutor = outboundExecutor;
    this.engineThreadFactory = engineThreadFactory;
    this.properties = properties;
    this.parser = new ControlMessageParser(objectMapper, properties.defaultPatientId());
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    ConnectionOutbox outbox =
        new ConnectionOutbox(
            session.getId(), new WebSocketOutboundChannel(session), outboundExecutor, objectMapper);
    DuplexSessionProtocol protocol =
        new DuplexSessionProtocol(
            session.getId(),
            variant,
            parser,
            outbox,
            engineThreadFactory,
            properties.engineJoinTimeout());
    protocols.put(session.getId(), protocol);

    LOGGER.info(
        "Client connected: connectionId={}, variant={}, remote={}",
        session.getId(),
        variant.name(),
        session.getRemoteAddress());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    DuplexSessionProtocol protocol = protocols.get(session.getId());
    if (protocol == null) {
      return;
    }
    try {
      StructuredLogger.setSessionContext(session.getId(), protocol.getPatientId());
      protocol.onControlFrame(message.getPayload());
    } catch (RuntimeException e) {
      LOGGER.error("Control frame failed: connectionId={}", session.getId(), e);
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  @Override
  protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
    DuplexSessionProtocol protocol = protocols.get(session.getId());
    if (protocol == null) {
      return;
    }
    ByteBuffer buffer = message.getPayload();
    byte[] chunk = new byte[buffer.remaining()];
    buffer.get(chunk);
    try {
      protocol.onPayloadFrame(chunk);
    } catch (RuntimeException e) {
      LOGGER.error("Audio frame failed: connectionId={}", session.getId(), e);
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    LOGGER.error(
        "Transport error: connectionId={}, error={}",
        session.getId(),
        exception.getMessage(),
        exception);
    closeProtocol(session.getId(), "transport_error");
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    LOGGER.info("Client disconnected: connectionId={}, status={}", session.getId(), status);
    closeProtocol(session.getId(), "disconnect");
  }

  /** Number of connections currently holding a protocol. */
  public int getActiveConnectionCount() {
    return protocols.size();
  }

  private void closeProtocol(String connectionId, String reason) {
    DuplexSessionProtocol protocol = protocols.remove(connectionId);
    if (protocol == null) {
      return;
    }
    try {
      StructuredLogger.setSessionContext(connectionId, protocol.getPatientId());
      protocol.close(reason);
    } catch (RuntimeException e) {
      LOGGER.error("Session teardown failed: connectionId={}", connectionId, e);
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }
}

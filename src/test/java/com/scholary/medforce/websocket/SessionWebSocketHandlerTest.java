package com.scholary.medforce.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.medforce.session.SeedContextProvider;
import com.scholary.medforce.session.SessionProperties;
import com.scholary.medforce.session.SessionVariant;
import com.scholary.medforce.testutil.FakeRecognitionEngine;
import com.scholary.medforce.testutil.FakeRecognitionEngineFactory;
import com.scholary.medforce.testutil.SyncExecutor;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class SessionWebSocketHandlerTest {

  private FakeRecognitionEngineFactory engineFactory;
  private SessionWebSocketHandler handler;
  private WebSocketSession session;

  @BeforeEach
  void setUp() {
    engineFactory = new FakeRecognitionEngineFactory();
    SessionVariant variant =
        new SessionVariant(
            "simulation", engineFactory, SeedContextProvider.none(), "Audio simulation initialized for %s");
    SessionProperties properties =
        new SessionProperties("P0001", Duration.ofSeconds(2), 1, 65536, 1048576, 30000, List.of("*"));
    handler =
        new SessionWebSocketHandler(
            variant, new ObjectMapper(), new SyncExecutor(), Thread::new, properties);

    session = mock(WebSocketSession.class);
    when(session.getId()).thenReturn("s1");
    when(session.isOpen()).thenReturn(true);
  }

  @Test
  void textFrameShouldStartSessionAndAcknowledge() throws Exception {
    handler.afterConnectionEstablished(session);

    handler.handleMessage(session, new TextMessage("{\"type\":\"start\",\"patient_id\":\"p9\"}"));

    ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
    verify(session).sendMessage(sent.capture());
    assertThat(sent.getValue().getPayload())
        .isEqualTo("{\"type\":\"system\",\"message\":\"Audio simulation initialized for p9\"}");
    assertThat(engineFactory.lastEngine().context().patientId()).isEqualTo("p9");
    handler.afterConnectionClosed(session, CloseStatus.NORMAL);
  }

  @Test
  void binaryFrameShouldBeCopiedToEngine() throws Exception {
    handler.afterConnectionEstablished(session);
    handler.handleMessage(session, new TextMessage("{\"type\":\"start\"}"));

    handler.handleMessage(session, new BinaryMessage(new byte[] {4, 5, 6}));

    FakeRecognitionEngine engine = engineFactory.lastEngine();
    assertThat(engine.received()).hasSize(1);
    assertThat(engine.received().get(0)).isEqualTo(new byte[] {4, 5, 6});
    handler.afterConnectionClosed(session, CloseStatus.NORMAL);
  }

  @Test
  void disconnectShouldTearDownSession() throws Exception {
    handler.afterConnectionEstablished(session);
    handler.handleMessage(session, new TextMessage("{\"type\":\"start\"}"));
    assertThat(handler.getActiveConnectionCount()).isEqualTo(1);

    handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

    assertThat(handler.getActiveConnectionCount()).isZero();
    assertThat(engineFactory.lastEngine().stopCalls()).isEqualTo(1);
    assertThat(engineFactory.lastEngine().isRunning()).isFalse();
  }

  @Test
  void transportErrorShouldTearDownSession() throws Exception {
    handler.afterConnectionEstablished(session);
    handler.handleMessage(session, new TextMessage("{\"type\":\"start\"}"));

    handler.handleTransportError(session, new IOException("connection reset"));
    handler.afterConnectionClosed(session, CloseStatus.SERVER_ERROR);

    assertThat(engineFactory.lastEngine().stopCalls()).isEqualTo(1);
    assertThat(handler.getActiveConnectionCount()).isZero();
  }

  @Test
  void sendFailureShouldNotBreakTheSession() throws Exception {
    doThrow(new IOException("broken pipe")).when(session).sendMessage(any());
    handler.afterConnectionEstablished(session);

    handler.handleMessage(session, new TextMessage("{\"type\":\"start\"}"));
    handler.handleMessage(session, new BinaryMessage(new byte[] {1}));

    assertThat(engineFactory.lastEngine().received()).hasSize(1);
    handler.afterConnectionClosed(session, CloseStatus.NORMAL);
  }

  @Test
  void framesForUnknownConnectionShouldBeIgnored() throws Exception {
    handler.handleMessage(session, new TextMessage("{\"type\":\"start\"}"));
    handler.handleMessage(session, new BinaryMessage(new byte[] {1}));

    assertThat(engineFactory.createdCount()).isZero();
    verify(session, never()).sendMessage(any());
  }
}

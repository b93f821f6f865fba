package com.scholary.medforce.websocket;

import com.scholary.medforce.session.OutboundChannel;
import java.io.IOException;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/** Adapts a Spring WebSocket session to the outbox's sending interface. */
class WebSocketOutboundChannel implements OutboundChannel {

  private final WebSocketSession session;

  WebSocketOutboundChannel(WebSocketSession session) {
    this.session = session;
  }

  @Override
  public void send(String text) throws IOException {
    session.sendMessage(new TextMessage(text));
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }
}

package com.scholary.medforce.session;

import java.io.IOException;

/** The sending half of a connection. Not required to be thread-safe; the outbox serializes calls. */
public interface OutboundChannel {

  void send(String text) throws IOException;

  boolean isOpen();
}

package com.scholary.medforce.testutil;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.medforce.session.OutboundChannel;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Captures every frame written to the client, in write order. */
public class RecordingOutboundChannel implements OutboundChannel {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final List<String> sent = new ArrayList<>();
  private volatile boolean open = true;
  private volatile boolean failWrites;

  @Override
  public synchronized void send(String text) throws IOException {
    if (failWrites) {
      throw new IOException("broken pipe");
    }
    sent.add(text);
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  public void setOpen(boolean open) {
    this.open = open;
  }

  public void setFailWrites(boolean failWrites) {
    this.failWrites = failWrites;
  }

  public synchronized List<String> sent() {
    return new ArrayList<>(sent);
  }

  public List<Map<String, Object>> frames() {
    List<Map<String, Object>> frames = new ArrayList<>();
    for (String text : sent()) {
      try {
        frames.add(MAPPER.readValue(text, new TypeReference<Map<String, Object>>() {}));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return frames;
  }

  /** The {@code message} field of every {@code system} frame. */
  public List<String> systemMessages() {
    List<String> messages = new ArrayList<>();
    for (Map<String, Object> frame : frames()) {
      if ("system".equals(frame.get("type"))) {
        messages.add(String.valueOf(frame.get("message")));
      }
    }
    return messages;
  }
}

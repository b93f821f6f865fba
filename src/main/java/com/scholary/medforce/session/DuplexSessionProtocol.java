package com.scholary.medforce.session;

import com.scholary.medforce.logging.StructuredLogger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The frame dispatch loop of one duplex connection.
 *
 * <p>Text frames are control messages: {@code start} opens a session and {@code {"status": true}}
 * asks it to finish gracefully. Anything else is ignored, and a frame that is not JSON is logged
 * and dropped. Binary frames are audio and reach the engine only while the session is ACTIVE and
 * the engine is live. Otherwise they are silently dropped.
 *
 * <p>At most one engine exists per connection. Teardown on disconnect, on transport error and on
 * engine exit all go through {@link SessionBridge#stop()}. Nothing thrown by session logic
 * escapes to the transport. Methods are synchronized because the transport thread and the
 * outbox both call in.
 */
public class DuplexSessionProtocol {

  private static final Logger LOGGER = LoggerFactory.getLogger(DuplexSessionProtocol.class);
  private static final StructuredLogger EVENTS = new StructuredLogger(LOGGER);

  private final String connectionId;
  private final SessionVariant variant;
  private final ControlMessageParser parser;
  private final ConnectionOutbox outbox;
  private final ThreadFactory engineThreadFactory;
  private final Duration engineJoinTimeout;

  private SessionState state = SessionState.IDLE;
  private SessionBridge bridge;
  private String patientId;
  private boolean disconnected;

  public DuplexSessionProtocol(
      String connectionId,
      SessionVariant variant,
      ControlMessageParser parser,
      ConnectionOutbox outbox,
      ThreadFactory engineThreadFactory,
      Duration engineJoinTimeout) {
    this.connectionId = connectionId;
    this.variant = variant;
    this.parser = parser;
    this.outbox = outbox;
    this.engineThreadFactory = engineThreadFactory;
    this.engineJoinTimeout = engineJoinTimeout;
  }

  /** Dispatch one text frame. */
  public synchronized void onControlFrame(String payload) {
    if (disconnected) {
      return;
    }

    ControlMessage message;
    try {
      message = parser.parse(payload);
    } catch (MalformedControlFrameException e) {
      LOGGER.error(
          "Discarding malformed control frame: connectionId={}, error={}",
          connectionId,
          e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
      return;
    }

    try {
      switch (message.type()) {
        case STOP:
          handleStop();
          break;
        case START:
          handleStart(message);
          break;
        default:
          LOGGER.debug("Ignoring unrecognised control frame: connectionId={}", connectionId);
      }
    } catch (RuntimeException e) {
      LOGGER.error("Control frame handling failed: connectionId={}", connectionId, e);
    }
  }

  /** Dispatch one binary frame. */
  public synchronized void onPayloadFrame(byte[] payload) {
    if (disconnected || state != SessionState.ACTIVE || bridge == null) {
      return;
    }
    if (!bridge.isEngineLive()) {
      return;
    }
    if (!bridge.feed(payload)) {
      LOGGER.debug(
          "Engine refused audio chunk: connectionId={}, bytes={}", connectionId, payload.length);
    }
  }

  /**
   * Tear everything down after a disconnect or transport failure. Idempotent; frames arriving
   * afterwards are ignored.
   */
  public synchronized void close(String reason) {
    if (disconnected) {
      return;
    }
    disconnected = true;
    teardown();
    state = SessionState.CLOSED;
    outbox.close();
    EVENTS.logSessionClosed(connectionId, patientId, reason);
  }

  public synchronized SessionState getState() {
    return state;
  }

  public synchronized String getPatientId() {
    return patientId;
  }

  synchronized SessionBridge currentBridge() {
    return bridge;
  }

  private void handleStart(ControlMessage message) {
    if (state == SessionState.ACTIVE || state == SessionState.FINISHING) {
      EVENTS.logFrameRejected(connectionId, "start", state.name());
      outbox.sendSystem("Session already running for " + patientId);
      return;
    }

    String requestedPatient = message.patientId();
    SessionBridge next = null;
    try {
      String seedContext = variant.seedContextProvider().fetch(requestedPatient);

      next =
          new SessionBridge(
              requestedPatient,
              message.options(),
              variant.engineFactory(),
              engineThreadFactory,
              outbox,
              engineJoinTimeout,
              this::onEngineExited);
      next.start(seedContext, systemFrame(variant.readyMessageFor(requestedPatient)));

    } catch (RuntimeException e) {
      EVENTS.logSessionStartFailed(connectionId, requestedPatient, e);
      if (next != null) {
        next.stop();
      }
      outbox.sendSystem("Failed to start session: " + e.getMessage());
      return;
    }

    bridge = next;
    patientId = requestedPatient;
    state = SessionState.ACTIVE;
    EVENTS.logSessionStarted(connectionId, requestedPatient, variant.name());
  }

  private void handleStop() {
    if (state != SessionState.ACTIVE) {
      LOGGER.warn(
          "Stop signal received but no session is running: connectionId={}, state={}",
          connectionId,
          state);
      outbox.sendSystem("No active session to stop");
      return;
    }
    bridge.finish();
    state = SessionState.FINISHING;
    EVENTS.logSessionFinishing(connectionId, patientId);
  }

  private synchronized void onEngineExited(SessionBridge exited, Throwable failure) {
    if (exited != bridge) {
      return;
    }
    if (failure != null) {
      EVENTS.logEngineFailed(connectionId, patientId, failure);
      outbox.sendSystem("Session ended: " + failure.getMessage());
    }
    teardown();
    state = SessionState.CLOSED;
    EVENTS.logSessionClosed(connectionId, patientId, failure == null ? "finished" : "engine_failure");
  }

  private void teardown() {
    if (bridge != null) {
      bridge.stop();
      bridge = null;
    }
  }

  private static Map<String, Object> systemFrame(String message) {
    Map<String, Object> frame = new LinkedHashMap<>();
    frame.put("type", "system");
    frame.put("message", message);
    return frame;
  }
}

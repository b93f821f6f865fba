package com.scholary.medforce.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Logs session lifecycle events with structured fields so they can be filtered per connection
 * or patient in the log backend.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log session started event. */
  public void logSessionStarted(String connectionId, String patientId, String variant) {
    try {
      MDC.put("event_type", "session_started");
      MDC.put("variant", variant);
      logger.info(
          "Session started: connectionId={}, patientId={}, variant={}",
          connectionId,
          patientId,
          variant);
    } finally {
      clearEventFields();
    }
  }

  /** Log graceful finish requested event. */
  public void logSessionFinishing(String connectionId, String patientId) {
    try {
      MDC.put("event_type", "session_finishing");
      logger.info(
          "Session finishing on client request: connectionId={}, patientId={}",
          connectionId,
          patientId);
    } finally {
      clearEventFields();
    }
  }

  /** Log session closed event. */
  public void logSessionClosed(String connectionId, String patientId, String reason) {
    try {
      MDC.put("event_type", "session_closed");
      MDC.put("reason", reason);
      logger.info(
          "Session closed: connectionId={}, patientId={}, reason={}",
          connectionId,
          patientId,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log session start failure event. */
  public void logSessionStartFailed(String connectionId, String patientId, Throwable cause) {
    try {
      MDC.put("event_type", "session_start_failed");
      MDC.put("errorType", cause.getClass().getSimpleName());
      logger.error(
          "Session start failed: connectionId={}, patientId={}, error={}",
          connectionId,
          patientId,
          cause.getMessage(),
          cause);
    } finally {
      clearEventFields();
    }
  }

  /** Log engine failure event. */
  public void logEngineFailed(String connectionId, String patientId, Throwable cause) {
    try {
      MDC.put("event_type", "engine_failed");
      MDC.put("errorType", cause.getClass().getSimpleName());
      logger.error(
          "Engine failed: connectionId={}, patientId={}, error={}",
          connectionId,
          patientId,
          cause.getMessage(),
          cause);
    } finally {
      clearEventFields();
    }
  }

  /** Log a control frame that was refused in the current state. */
  public void logFrameRejected(String connectionId, String frameType, String state) {
    try {
      MDC.put("event_type", "frame_rejected");
      MDC.put("frameType", frameType);
      MDC.put("state", state);
      logger.warn(
          "Control frame rejected: connectionId={}, frame={}, state={}",
          connectionId,
          frameType,
          state);
    } finally {
      clearEventFields();
    }
  }

  /** Set connection context in MDC. */
  public static void setSessionContext(String connectionId, String patientId) {
    MDC.put("connectionId", connectionId);
    if (patientId != null) {
      MDC.put("patientId", patientId);
    }
  }

  /** Clear connection context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("connectionId");
    MDC.remove("patientId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("variant");
    MDC.remove("reason");
    MDC.remove("errorType");
    MDC.remove("frameType");
    MDC.remove("state");
  }
}

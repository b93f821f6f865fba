package com.scholary.medforce.session;

/**
 * Lifecycle of the session on one connection.
 *
 * <pre>
 * IDLE --start--> ACTIVE --stop signal--> FINISHING --engine drained--> CLOSED
 *                   |                                                     ^
 *                   +-------- engine failure / disconnect ----------------+
 * </pre>
 *
 * <p>Audio is forwarded only in ACTIVE. While the connection stays open, a {@code start} after
 * CLOSED opens a fresh session.
 */
public enum SessionState {
  IDLE,
  ACTIVE,
  FINISHING,
  CLOSED
}

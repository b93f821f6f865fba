package com.scholary.medforce.session;

import java.util.Map;

/**
 * A decoded control frame.
 *
 * <p>{@code patientId} and {@code options} are only meaningful for {@link Type#START}. Options hold
 * the variant-specific fields of the start frame, such as {@code script_file}.
 */
public record ControlMessage(Type type, String patientId, Map<String, String> options) {

  public enum Type {
    START,
    STOP,
    UNKNOWN
  }

  public ControlMessage {
    options = options == null ? Map.of() : Map.copyOf(options);
  }

  public static ControlMessage start(String patientId, Map<String, String> options) {
    return new ControlMessage(Type.START, patientId, options);
  }

  public static ControlMessage stop() {
    return new ControlMessage(Type.STOP, null, Map.of());
  }

  public static ControlMessage unknown() {
    return new ControlMessage(Type.UNKNOWN, null, Map.of());
  }
}

package com.scholary.medforce.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Success body of the admin endpoints. Fields that don't apply are omitted. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponse(String message, String path, String pid) {

  public static MessageResponse of(String message) {
    return new MessageResponse(message, null, null);
  }

  public static MessageResponse withPath(String message, String path) {
    return new MessageResponse(message, path, null);
  }

  public static MessageResponse withPid(String message, String pid) {
    return new MessageResponse(message, null, pid);
  }
}

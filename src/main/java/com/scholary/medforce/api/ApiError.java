package com.scholary.medforce.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Error body: {@code {"error": "...", "path": "..."}}, path only when it helps the caller. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String error, String path) {

  public static ApiError of(String error) {
    return new ApiError(error, null);
  }
}

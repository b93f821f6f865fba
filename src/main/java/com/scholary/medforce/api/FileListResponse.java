package com.scholary.medforce.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Documents of one patient folder. {@code updated} is ISO-8601, or null when unknown. */
public record FileListResponse(List<FileEntry> files) {

  public record FileEntry(
      String name, @JsonProperty("full_path") String fullPath, long size, String updated) {}
}

package com.scholary.medforce.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** Creates or overwrites a text document (markdown, JSON, plain text). */
public record SaveFileRequest(
    @NotBlank String pid,
    @NotBlank @JsonProperty("file_name") String fileName,
    @NotNull String content) {}

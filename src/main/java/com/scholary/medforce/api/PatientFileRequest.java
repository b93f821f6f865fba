package com.scholary.medforce.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/** Identifies one patient document, e.g. {@code {"pid":"p001","file_name":"history.md"}}. */
public record PatientFileRequest(
    @NotBlank String pid, @NotBlank @JsonProperty("file_name") String fileName) {}

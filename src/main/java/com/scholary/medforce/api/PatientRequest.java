package com.scholary.medforce.api;

import jakarta.validation.constraints.NotBlank;

public record PatientRequest(@NotBlank String pid) {}

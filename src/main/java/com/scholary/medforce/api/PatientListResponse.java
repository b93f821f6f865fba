package com.scholary.medforce.api;

import java.util.List;

public record PatientListResponse(List<String> patients) {}

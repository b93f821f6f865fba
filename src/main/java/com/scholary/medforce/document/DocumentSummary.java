package com.scholary.medforce.document;

import java.time.Instant;

/** Listing entry for one document in a patient folder. The name has the folder prefix removed. */
public record DocumentSummary(String name, String fullPath, long size, Instant updated) {}

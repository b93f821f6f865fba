package com.scholary.medforce.document;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MediaKindTest {

  @ParameterizedTest
  @CsvSource({
    "vitals.json, JSON, application/json",
    "History.MD, TEXT, text/markdown",
    "notes.txt, TEXT, text/markdown",
    "xray.png, IMAGE, image/png",
    "photo.JPG, IMAGE, image/jpeg",
    "photo.jpeg, IMAGE, image/jpeg",
    "report.pdf, BINARY, application/octet-stream",
    "README, BINARY, application/octet-stream",
    "archive.tar.json, JSON, application/json",
    "trailing., BINARY, application/octet-stream"
  })
  void shouldClassifyByLastExtension(String fileName, MediaKind kind, String contentType) {
    assertThat(MediaKind.fromFileName(fileName)).isEqualTo(kind);
    assertThat(MediaKind.contentTypeFor(fileName)).isEqualTo(contentType);
  }
}

package com.scholary.medforce.document;

import java.util.Locale;

/**
 * How a patient document is interpreted, decided purely by its file-name extension.
 *
 * <ul>
 *   <li>{@code json} is parsed and returned as a structure
 *   <li>{@code md} and {@code txt} are returned as markdown text
 *   <li>{@code png}, {@code jpg} and {@code jpeg} are returned as image bytes
 *   <li>anything else is returned as opaque bytes
 * </ul>
 */
public enum MediaKind {
  JSON,
  TEXT,
  IMAGE,
  BINARY;

  public static final String JSON_TYPE = "application/json";
  public static final String MARKDOWN_TYPE = "text/markdown";
  public static final String PNG_TYPE = "image/png";
  public static final String JPEG_TYPE = "image/jpeg";
  public static final String OCTET_STREAM_TYPE = "application/octet-stream";

  /** Classify a file name by its last extension. */
  public static MediaKind fromFileName(String fileName) {
    switch (extension(fileName)) {
      case "json":
        return JSON;
      case "md":
      case "txt":
        return TEXT;
      case "png":
      case "jpg":
      case "jpeg":
        return IMAGE;
      default:
        return BINARY;
    }
  }

  /** The content type served (and stored) for a file name. */
  public static String contentTypeFor(String fileName) {
    String extension = extension(fileName);
    switch (fromFileName(fileName)) {
      case JSON:
        return JSON_TYPE;
      case TEXT:
        return MARKDOWN_TYPE;
      case IMAGE:
        return "png".equals(extension) ? PNG_TYPE : JPEG_TYPE;
      default:
        return OCTET_STREAM_TYPE;
    }
  }

  private static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}

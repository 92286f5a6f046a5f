package com.flamingo.ai.constitution.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.constitution.exception.InvalidQueryException;
import java.util.Arrays;
import java.util.Locale;

/** Kinds of content a view can be recorded against. */
public enum ContentType {
  CHAPTER("chapter"),
  ARTICLE("article"),
  PREAMBLE("preamble"),
  SEARCH("search");

  private final String value;

  ContentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Parses a lower-case content type name.
   *
   * @throws InvalidQueryException for unknown names
   */
  public static ContentType fromValue(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.value.equals(normalized))
        .findFirst()
        .orElseThrow(
            () -> new InvalidQueryException("contentType", "unknown content type " + value));
  }
}

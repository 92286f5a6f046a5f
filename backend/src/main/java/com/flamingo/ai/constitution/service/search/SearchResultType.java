package com.flamingo.ai.constitution.service.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** Document level a search hit was found at. */
public enum SearchResultType {
  PREAMBLE("preamble"),
  CHAPTER("chapter"),
  ARTICLE_TITLE("article_title"),
  CLAUSE("clause"),
  SUB_CLAUSE("sub_clause");

  private final String value;

  SearchResultType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}

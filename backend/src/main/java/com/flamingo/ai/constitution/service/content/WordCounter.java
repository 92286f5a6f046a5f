package com.flamingo.ai.constitution.service.content;

import java.util.regex.Pattern;

/** Whitespace-delimited token counting shared by statistics and reading estimates. */
public final class WordCounter {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private WordCounter() {}

  public static int count(String text) {
    if (text == null) {
      return 0;
    }
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
  }
}

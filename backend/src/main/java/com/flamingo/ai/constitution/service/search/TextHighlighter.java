package com.flamingo.ai.constitution.service.search;

/** Case-insensitive matching and {@code **} highlighting. */
public final class TextHighlighter {

  public static final String MARKER = "**";

  private TextHighlighter() {}

  /** Index of the first case-insensitive occurrence at or after {@code from}, or -1. */
  public static int indexOfIgnoreCase(String text, String query, int from) {
    if (text == null || query == null || query.isEmpty()) {
      return -1;
    }
    int last = text.length() - query.length();
    for (int i = Math.max(0, from); i <= last; i++) {
      if (text.regionMatches(true, i, query, 0, query.length())) {
        return i;
      }
    }
    return -1;
  }

  public static boolean containsIgnoreCase(String text, String query) {
    return indexOfIgnoreCase(text, query, 0) >= 0;
  }

  /**
   * Wraps every occurrence of {@code query} in markers, scanning left to right so occurrences never
   * overlap. The original casing of the text is kept.
   */
  public static String highlight(String text, String query) {
    if (text == null || query == null || query.isEmpty()) {
      return text;
    }
    StringBuilder out = new StringBuilder(text.length() + 16);
    int cursor = 0;
    int match = indexOfIgnoreCase(text, query, cursor);
    while (match >= 0) {
      out.append(text, cursor, match)
          .append(MARKER)
          .append(text, match, match + query.length())
          .append(MARKER);
      cursor = match + query.length();
      match = indexOfIgnoreCase(text, query, cursor);
    }
    return out.append(text, cursor, text.length()).toString();
  }

  /** Text around the first occurrence, {@code window} characters on each side. */
  public static String context(String text, String query, int window) {
    int match = indexOfIgnoreCase(text, query, 0);
    if (match < 0) {
      return text;
    }
    int start = Math.max(0, match - window);
    int end = Math.min(text.length(), match + query.length() + window);
    return text.substring(start, end);
  }
}

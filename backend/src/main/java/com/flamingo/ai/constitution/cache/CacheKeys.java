package com.flamingo.ai.constitution.cache;

/** Logical cache keys, relative to the configured namespace prefix. */
public final class CacheKeys {

  /** Whole parsed document. */
  public static final String DOCUMENT = "overview";

  /** Overview metadata derived from the document. */
  public static final String OVERVIEW_METADATA = "overview:metadata";

  public static final String PREAMBLE = "preamble";

  /** Chapter and article tree used for navigation menus. */
  public static final String NAVIGATION = "navigation:structure";

  public static final String SEARCH_PATTERN = "search:*";
  public static final String ALL_PATTERN = "*";
  public static final String HEALTH_CHECK = "health:check";

  private CacheKeys() {}

  public static String chapter(int chapterNumber) {
    return "chapter:" + chapterNumber;
  }

  public static String article(int chapterNumber, int articleNumber) {
    return "article:" + chapterNumber + ":" + articleNumber;
  }

  public static String search(String requestHash) {
    return "search:" + requestHash;
  }

  public static String views(String contentType, String reference) {
    return "views:" + contentType + ":" + reference;
  }

  /** Per-period popularity counter, e.g. {@code popular:daily:2024-05-01:article:2.9}. */
  public static String popularBucket(
      String timeframe, String periodId, String contentType, String reference) {
    return "popular:" + timeframe + ":" + periodId + ":" + contentType + ":" + reference;
  }

  public static String popularRanking(String timeframe, String contentType, int limit) {
    return "popular:rankings:"
        + timeframe
        + ":"
        + (contentType == null ? "all" : contentType)
        + ":"
        + limit;
  }

  public static String userPattern(String userId) {
    return "user:" + userId + ":*";
  }
}

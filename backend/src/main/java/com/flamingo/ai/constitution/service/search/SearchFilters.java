package com.flamingo.ai.constitution.service.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.constitution.exception.InvalidQueryException;

/**
 * Optional chapter and article restrictions, held as received and parsed on use.
 *
 * @param chapter chapter number, or null for all chapters
 * @param article article number, or null for all articles
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchFilters(String chapter, String article) {

  public static SearchFilters none() {
    return new SearchFilters(null, null);
  }

  public static SearchFilters forChapter(int chapterNumber) {
    return new SearchFilters(String.valueOf(chapterNumber), null);
  }

  public static SearchFilters forArticle(int chapterNumber, int articleNumber) {
    return new SearchFilters(String.valueOf(chapterNumber), String.valueOf(articleNumber));
  }

  /**
   * Parsed chapter filter.
   *
   * @throws InvalidQueryException if present but not a positive integer
   */
  public Integer chapterNumber() {
    return parse("chapter", chapter);
  }

  /**
   * Parsed article filter.
   *
   * @throws InvalidQueryException if present but not a positive integer
   */
  public Integer articleNumber() {
    return parse("article", article);
  }

  /** Stable form with keys in sorted order, used in cache keys. */
  public String canonical() {
    return "article=" + articleNumber() + ";chapter=" + chapterNumber();
  }

  private static Integer parse(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      int value = Integer.parseInt(raw.trim());
      if (value <= 0) {
        throw new InvalidQueryException(name, "must be a positive number but was " + raw);
      }
      return value;
    } catch (NumberFormatException e) {
      throw new InvalidQueryException(name, "must be a number but was '" + raw + "'");
    }
  }
}

package com.flamingo.ai.constitution.domain.model;

import java.util.Optional;

/** Article address written as {@code chapter.article}, e.g. {@code 2.9}. */
public record ArticleReference(int chapterNumber, int articleNumber) {

  /** Parses {@code "c.a"}; anything else yields empty. */
  public static Optional<ArticleReference> parse(String reference) {
    if (reference == null) {
      return Optional.empty();
    }
    String[] parts = reference.trim().split("\\.");
    if (parts.length != 2) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new ArticleReference(Integer.parseInt(parts[0]), Integer.parseInt(parts[1])));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  @Override
  public String toString() {
    return chapterNumber + "." + articleNumber;
  }
}

package com.flamingo.ai.constitution.service.content;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Table of contents for navigation menus. Paths are relative to {@code /api/constitution}.
 * Chapters come in ascending order; each lists its direct articles followed by the articles of
 * its parts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NavigationStructure {

  private PreambleNode preamble;

  @Builder.Default private List<ChapterNode> chapters = new ArrayList<>();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class PreambleNode {
    private String title;
    private String path;
    @Builder.Default private String type = "preamble";
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ChapterNode {
    private int chapterNumber;
    private String chapterTitle;
    private String path;
    @Builder.Default private String type = "chapter";
    @Builder.Default private List<ArticleNode> articles = new ArrayList<>();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ArticleNode {
    private int articleNumber;
    private String articleTitle;

    /** Number of the enclosing part, or null for articles placed directly in the chapter. */
    private Integer partNumber;

    private String path;

    /** Dotted {@code chapter.article} reference, as used by view tracking. */
    private String reference;

    @Builder.Default private String type = "article";
  }
}

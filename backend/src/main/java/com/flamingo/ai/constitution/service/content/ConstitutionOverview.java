package com.flamingo.ai.constitution.service.content;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Summary of the document shown on the landing page. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConstitutionOverview {

  private String title;

  /** First characters of the preamble, with an ellipsis when truncated. */
  private String preamblePreview;

  private int totalChapters;

  private List<ChapterSummary> chapters;

  private Statistics statistics;

  private Instant lastLoaded;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ChapterSummary {
    private int chapterNumber;
    private String chapterTitle;
    private int articleCount;
    private int partCount;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Statistics {
    private int parts;
    private int articles;
    private int clauses;
    private int subClauses;
    private long words;
  }
}

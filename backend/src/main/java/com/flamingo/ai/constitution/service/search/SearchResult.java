package com.flamingo.ai.constitution.service.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A single matching unit and where it sits in the document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResult {

  private SearchResultType type;

  private Integer chapterNumber;
  private String chapterTitle;
  private Integer partNumber;
  private String partTitle;
  private Integer articleNumber;
  private String articleTitle;
  private String clauseNumber;

  /** Dotted path for nested items, e.g. {@code a.i}. */
  private String subClauseId;

  /** Matched text; for the preamble only the window around the first match. */
  private String content;

  /** {@link #content} with matches highlighted when requested. */
  private String matchContext;
}

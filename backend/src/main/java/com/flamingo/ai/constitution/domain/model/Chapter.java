package com.flamingo.ai.constitution.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A chapter holding articles directly, through parts, or both. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Chapter {

  private int chapterNumber;

  private String chapterTitle;

  @Builder.Default
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  private List<Article> articles = new ArrayList<>();

  @Builder.Default
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  private List<Part> parts = new ArrayList<>();

  /** Direct articles followed by the articles of each part, in document order. */
  public List<Article> allArticles() {
    return Stream.concat(
            articles.stream(), parts.stream().flatMap(part -> part.getArticles().stream()))
        .toList();
  }

  /** Finds an article by number among direct and part articles. */
  public Optional<Article> article(int articleNumber) {
    return allArticles().stream().filter(a -> a.getArticleNumber() == articleNumber).findFirst();
  }
}

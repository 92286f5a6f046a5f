package com.flamingo.ai.constitution.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The full constitution: title, preamble and ordered chapters. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConstitutionDocument {

  private String title;

  private String preamble;

  @Builder.Default
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  private List<Chapter> chapters = new ArrayList<>();

  /** Finds a chapter by its number. */
  public Optional<Chapter> chapter(int chapterNumber) {
    return chapters.stream().filter(c -> c.getChapterNumber() == chapterNumber).findFirst();
  }
}

package com.flamingo.ai.constitution.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lettered or numbered item under a clause, possibly with nested items of the same shape.
 *
 * <p>Older extracts name the identifier {@code sub_clause_letter} or {@code numeral} and the body
 * {@code text}; these are accepted on input and always written back as {@code sub_clause_id} and
 * {@code content}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubClause {

  @JsonAlias({"sub_clause_letter", "numeral"})
  private String subClauseId;

  @JsonAlias("text")
  private String content;

  @Builder.Default
  @JsonAlias({"nested_sub_clauses", "sub_clauses"})
  @JsonSetter(nulls = Nulls.AS_EMPTY)
  private List<SubClause> subItems = new ArrayList<>();
}

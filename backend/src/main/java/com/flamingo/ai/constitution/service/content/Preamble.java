package com.flamingo.ai.constitution.service.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Full preamble text with the document title. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Preamble {

  private String title;

  /** Preamble text; empty when the document has none. */
  private String content;

  @Builder.Default private String type = "preamble";
}

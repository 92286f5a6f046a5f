package com.flamingo.ai.constitution.service.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One entry of a popularity ranking. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PopularContent {

  private ContentType contentType;
  private String contentReference;

  /** Resolved chapter or article title, when the reference still exists. */
  private String title;

  private long totalViews;
  private long uniqueViewers;
  private LocalDateTime lastViewedAt;

  /** True for the curated list served before any views are recorded. */
  private boolean fallback;
}

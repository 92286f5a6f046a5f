package com.flamingo.ai.constitution.service.analytics;

import com.flamingo.ai.constitution.domain.enums.Timeframe;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Aggregate reading activity over a timeframe. */
@Data
@Builder
public class AnalyticsSummary {

  private Timeframe timeframe;
  private LocalDateTime since;
  private long totalViews;

  /** Identified viewers only; anonymous readers are not counted. */
  private long uniqueViewers;

  private Map<String, Long> viewsByContentType;
}

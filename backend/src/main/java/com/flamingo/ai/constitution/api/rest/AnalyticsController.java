package com.flamingo.ai.constitution.api.rest;

import com.flamingo.ai.constitution.domain.enums.ContentType;
import com.flamingo.ai.constitution.domain.enums.Timeframe;
import com.flamingo.ai.constitution.service.analytics.AnalyticsSummary;
import com.flamingo.ai.constitution.service.analytics.PopularContent;
import com.flamingo.ai.constitution.service.analytics.ViewHistoryEntry;
import com.flamingo.ai.constitution.service.analytics.ViewTracker;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for popularity rankings and view analytics. */
@RestController
@RequestMapping("/api/constitution")
@RequiredArgsConstructor
public class AnalyticsController {

  private final ViewTracker viewTracker;

  /** Gets the most viewed content in a timeframe. */
  @GetMapping("/popular")
  public ResponseEntity<List<PopularContent>> getPopular(
      @RequestParam(defaultValue = "daily") String timeframe,
      @RequestParam(defaultValue = "10") int limit,
      @RequestParam(required = false) String contentType) {
    ContentType type =
        contentType == null || contentType.isBlank() ? null : ContentType.fromValue(contentType);
    return ResponseEntity.ok(viewTracker.popular(Timeframe.fromValue(timeframe), limit, type));
  }

  /** Gets totals and per-type view counts for a timeframe. */
  @GetMapping("/analytics/summary")
  public ResponseEntity<AnalyticsSummary> getSummary(
      @RequestParam(defaultValue = "daily") String timeframe) {
    return ResponseEntity.ok(viewTracker.summary(Timeframe.fromValue(timeframe)));
  }

  /** Gets what a user viewed most recently. */
  @GetMapping("/analytics/users/{userId}/history")
  public ResponseEntity<List<ViewHistoryEntry>> getViewHistory(
      @PathVariable String userId, @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(viewTracker.viewHistory(userId, limit));
  }
}

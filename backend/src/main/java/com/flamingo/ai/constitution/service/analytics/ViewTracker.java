package com.flamingo.ai.constitution.service.analytics;

import com.flamingo.ai.constitution.domain.enums.ContentType;
import com.flamingo.ai.constitution.domain.enums.Timeframe;
import java.util.List;

/** Service for recording content views and reporting on them. */
public interface ViewTracker {

  /**
   * Records a view in the cache counters and the durable store. Never throws; failures are logged.
   *
   * @param contentType what was viewed
   * @param reference chapter number, "chapter.article", or a search query
   * @param viewer who viewed it
   */
  void track(ContentType contentType, String reference, ViewerContext viewer);

  /**
   * Ranks the most viewed items in a timeframe. Falls back to a curated list when nothing has
   * been viewed in the window.
   *
   * @param timeframe the window
   * @param limit maximum number of entries
   * @param contentType restricts the ranking to one type, or null for all
   * @return entries ordered by total views, then most recent view
   */
  List<PopularContent> popular(Timeframe timeframe, int limit, ContentType contentType);

  /**
   * Reads the cached view counter for an item.
   *
   * @return the count, or 0 when unknown or the cache is unavailable
   */
  long viewCount(ContentType contentType, String reference);

  /**
   * Lists what a user viewed most recently.
   *
   * @param userId the user
   * @param limit maximum number of entries
   * @return entries ordered by last view, newest first
   */
  List<ViewHistoryEntry> viewHistory(String userId, int limit);

  /**
   * Summarizes view activity in a timeframe.
   *
   * @param timeframe the window
   * @return totals and per-type breakdown
   */
  AnalyticsSummary summary(Timeframe timeframe);
}

package com.flamingo.ai.constitution.service.analytics;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.constitution.cache.CacheKeys;
import com.flamingo.ai.constitution.cache.CacheManager;
import com.flamingo.ai.constitution.config.ConstitutionProperties;
import com.flamingo.ai.constitution.domain.entity.ContentView;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import com.flamingo.ai.constitution.domain.enums.Timeframe;
import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.ArticleReference;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.repository.ContentViewRepository;
import com.flamingo.ai.constitution.domain.repository.PopularContentRow;
import com.flamingo.ai.constitution.exception.InvalidQueryException;
import com.flamingo.ai.constitution.exception.SourceUnavailableException;
import com.flamingo.ai.constitution.service.content.ContentCache;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/** Implementation of the ViewTracker backed by cache counters and the content_views table. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ViewTrackerImpl implements ViewTracker {

  /** Served before any views exist so the popular list is never empty. */
  static final List<PopularContent> CURATED_POPULAR =
      List.of(
          curated("4.19", "Rights and Fundamental Freedoms", 1245),
          curated("6.73", "Leadership and Integrity", 987),
          curated("11.174", "Devolved Government", 876),
          curated("10.159", "Judicial Authority", 754),
          curated("12.201", "Principles of Public Finance", 632));

  private static final TypeReference<List<PopularContent>> RANKING_TYPE = new TypeReference<>() {};

  private final CacheManager cacheManager;
  private final ContentViewRepository contentViewRepository;
  private final ContentViewRecorder contentViewRecorder;
  private final ContentCache contentCache;
  private final ConstitutionProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  @Timed(value = "constitution.views.track", description = "Time to record a view")
  public void track(ContentType contentType, String reference, ViewerContext viewer) {
    try {
      ViewerContext effectiveViewer = viewer == null ? ViewerContext.anonymous() : viewer;
      LocalDateTime now = LocalDateTime.now(clock);
      String type = contentType.getValue();

      cacheManager.increment(CacheKeys.views(type, reference));
      String bucket =
          CacheKeys.popularBucket(
              Timeframe.DAILY.getValue(), now.toLocalDate().toString(), type, reference);
      if (cacheManager.increment(bucket) == 1L) {
        cacheManager.expire(bucket, properties.getAnalytics().getBucketRetention());
      }

      contentViewRecorder.record(contentType, reference, effectiveViewer, now);
      meterRegistry.counter("constitution.views.tracked", "content_type", type).increment();
    } catch (RuntimeException e) {
      log.error("Failed to track view {}:{}: {}", contentType, reference, e.getMessage(), e);
      meterRegistry.counter("constitution.views.failed").increment();
    }
  }

  @Override
  @Timed(value = "constitution.views.popular", description = "Time to rank popular content")
  public List<PopularContent> popular(Timeframe timeframe, int limit, ContentType contentType) {
    int maxLimit = properties.getAnalytics().getMaxPopularLimit();
    if (limit < 1 || limit > maxLimit) {
      throw new InvalidQueryException("limit", "must be between 1 and " + maxLimit);
    }
    String key =
        CacheKeys.popularRanking(
            timeframe.getValue(), contentType == null ? null : contentType.getValue(), limit);
    Optional<List<PopularContent>> cached = cacheManager.get(key, RANKING_TYPE);
    if (cached.isPresent()) {
      return cached.get();
    }

    LocalDateTime since = timeframe.windowStart(LocalDateTime.now(clock));
    List<PopularContentRow> rows =
        contentViewRepository.findPopularSince(since, contentType, PageRequest.of(0, limit));
    if (rows.isEmpty()) {
      log.debug("No views since {}, serving curated popular list", since);
      return CURATED_POPULAR.stream()
          .filter(entry -> contentType == null || entry.getContentType() == contentType)
          .limit(limit)
          .toList();
    }

    List<PopularContent> ranking = rows.stream().map(this::toPopularContent).toList();
    cacheManager.set(key, ranking, properties.getCache().getTtl().getPopular());
    return ranking;
  }

  @Override
  public long viewCount(ContentType contentType, String reference) {
    return cacheManager.getCounter(CacheKeys.views(contentType.getValue(), reference));
  }

  @Override
  public List<ViewHistoryEntry> viewHistory(String userId, int limit) {
    if (userId == null || userId.isBlank()) {
      throw new InvalidQueryException("userId", "must not be blank");
    }
    if (limit < 1 || limit > properties.getAnalytics().getMaxPopularLimit()) {
      throw new InvalidQueryException(
          "limit", "must be between 1 and " + properties.getAnalytics().getMaxPopularLimit());
    }
    return contentViewRepository
        .findByViewerKeyOrderByLastViewedAtDesc(userId, PageRequest.of(0, limit))
        .stream()
        .map(ViewHistoryEntry::fromEntity)
        .toList();
  }

  @Override
  @Timed(value = "constitution.views.summary", description = "Time to summarize views")
  public AnalyticsSummary summary(Timeframe timeframe) {
    LocalDateTime since = timeframe.windowStart(LocalDateTime.now(clock));
    Map<String, Long> byType = new LinkedHashMap<>();
    for (Object[] row : contentViewRepository.sumViewCountByContentTypeSince(since)) {
      byType.put(((ContentType) row[0]).getValue(), ((Number) row[1]).longValue());
    }
    return AnalyticsSummary.builder()
        .timeframe(timeframe)
        .since(since)
        .totalViews(contentViewRepository.sumViewCountSince(since))
        .uniqueViewers(
            contentViewRepository.countDistinctViewersSince(since, ContentView.ANONYMOUS))
        .viewsByContentType(byType)
        .build();
  }

  private PopularContent toPopularContent(PopularContentRow row) {
    return PopularContent.builder()
        .contentType(row.contentType())
        .contentReference(row.contentReference())
        .title(resolveTitle(row.contentType(), row.contentReference()))
        .totalViews(row.totalViews())
        .uniqueViewers(row.uniqueViewers())
        .lastViewedAt(row.lastViewedAt())
        .build();
  }

  private String resolveTitle(ContentType contentType, String reference) {
    try {
      if (contentType == ContentType.CHAPTER) {
        return contentCache
            .findChapter(Integer.parseInt(reference))
            .map(Chapter::getChapterTitle)
            .orElse(null);
      }
      if (contentType == ContentType.ARTICLE) {
        return ArticleReference.parse(reference)
            .flatMap(ref -> contentCache.findArticle(ref.chapterNumber(), ref.articleNumber()))
            .map(Article::getArticleTitle)
            .orElse(null);
      }
    } catch (NumberFormatException | SourceUnavailableException e) {
      log.debug("Cannot resolve title for {}:{}: {}", contentType, reference, e.getMessage());
    }
    return null;
  }

  private static PopularContent curated(String reference, String title, long views) {
    return PopularContent.builder()
        .contentType(ContentType.ARTICLE)
        .contentReference(reference)
        .title(title)
        .totalViews(views)
        .fallback(true)
        .build();
  }
}

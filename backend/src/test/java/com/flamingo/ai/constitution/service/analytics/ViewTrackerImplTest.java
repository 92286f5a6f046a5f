package com.flamingo.ai.constitution.service.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.ai.constitution.TestDocuments;
import com.flamingo.ai.constitution.cache.CacheKeys;
import com.flamingo.ai.constitution.cache.CacheManager;
import com.flamingo.ai.constitution.cache.InMemoryKeyValueStore;
import com.flamingo.ai.constitution.config.ConstitutionProperties;
import com.flamingo.ai.constitution.domain.entity.ContentView;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import com.flamingo.ai.constitution.domain.enums.Timeframe;
import com.flamingo.ai.constitution.domain.repository.ContentViewRepository;
import com.flamingo.ai.constitution.domain.repository.PopularContentRow;
import com.flamingo.ai.constitution.exception.InvalidQueryException;
import com.flamingo.ai.constitution.exception.SourceUnavailableException;
import com.flamingo.ai.constitution.service.content.ContentCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ViewTrackerImpl")
class ViewTrackerImplTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
  private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

  @Mock private ContentViewRepository contentViewRepository;
  @Mock private ContentCache contentCache;

  private final Map<String, ContentView> rows = new HashMap<>();
  private SimpleMeterRegistry meterRegistry;
  private CacheManager cacheManager;
  private ViewTrackerImpl viewTracker;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ConstitutionProperties properties = new ConstitutionProperties();
    cacheManager =
        new CacheManager(
            new InMemoryKeyValueStore(1_000, System::nanoTime),
            JsonMapper.builder().findAndAddModules().build(),
            meterRegistry,
            properties);
    viewTracker =
        new ViewTrackerImpl(
            cacheManager,
            contentViewRepository,
            new ContentViewRecorder(contentViewRepository),
            contentCache,
            properties,
            meterRegistry,
            CLOCK);

    when(contentViewRepository.findByContentTypeAndContentReferenceAndViewerKey(
            any(), any(), any()))
        .thenAnswer(
            invocation ->
                Optional.ofNullable(
                    rows.get(
                        rowKey(
                            invocation.getArgument(0),
                            invocation.getArgument(1),
                            invocation.getArgument(2)))));
    when(contentViewRepository.save(any(ContentView.class)))
        .thenAnswer(
            invocation -> {
              ContentView view = invocation.getArgument(0);
              rows.put(
                  rowKey(view.getContentType(), view.getContentReference(), view.getViewerKey()),
                  view);
              return view;
            });
  }

  private static String rowKey(ContentType type, String reference, String viewer) {
    return type + "|" + reference + "|" + viewer;
  }

  @Nested
  @DisplayName("track")
  class Track {

    @Test
    @DisplayName("should aggregate repeated anonymous views into one row")
    void shouldAggregateAnonymousViews() {
      for (int i = 0; i < 3; i++) {
        viewTracker.track(ContentType.ARTICLE, "2.9", ViewerContext.anonymous());
      }

      assertThat(rows).hasSize(1);
      ContentView row = rows.values().iterator().next();
      assertThat(row.getViewerKey()).isEqualTo(ContentView.ANONYMOUS);
      assertThat(row.getViewCount()).isEqualTo(3L);
      assertThat(row.getFirstViewedAt()).isEqualTo(NOW);
      assertThat(viewTracker.viewCount(ContentType.ARTICLE, "2.9")).isEqualTo(3);
    }

    @Test
    @DisplayName("should keep separate rows per identified viewer")
    void shouldSeparateViewers() {
      viewTracker.track(ContentType.CHAPTER, "2", new ViewerContext("alice", "mobile", null));
      viewTracker.track(ContentType.CHAPTER, "2", new ViewerContext("bob", null, "10.0.0.2"));
      viewTracker.track(ContentType.CHAPTER, "2", new ViewerContext("alice", null, "10.0.0.1"));

      ContentView alice = rows.get(rowKey(ContentType.CHAPTER, "2", "alice"));
      assertThat(rows).hasSize(2);
      assertThat(alice.getViewCount()).isEqualTo(2L);
      assertThat(alice.getDeviceType()).isEqualTo("mobile");
      assertThat(alice.getIpAddress()).isEqualTo("10.0.0.1");
    }

    @Test
    @DisplayName("should count views in the daily popularity bucket")
    void shouldCountDailyBucket() {
      viewTracker.track(ContentType.ARTICLE, "2.9", null);
      viewTracker.track(ContentType.ARTICLE, "2.9", null);

      String bucket = CacheKeys.popularBucket("daily", "2024-05-01", "article", "2.9");
      assertThat(cacheManager.getCounter(bucket)).isEqualTo(2);
    }

    @Test
    @DisplayName("should never throw when the durable store fails")
    void shouldSwallowStoreFailures() {
      doThrow(new IllegalStateException("database is locked"))
          .when(contentViewRepository)
          .save(any(ContentView.class));

      assertThatCode(() -> viewTracker.track(ContentType.ARTICLE, "2.9", null))
          .doesNotThrowAnyException();
      assertThat(meterRegistry.counter("constitution.views.failed").count()).isEqualTo(1.0);
      assertThat(viewTracker.viewCount(ContentType.ARTICLE, "2.9")).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("popular")
  class Popular {

    @Test
    @DisplayName("should serve the curated list when nothing was viewed")
    void shouldServeCuratedList() {
      when(contentViewRepository.findPopularSince(any(), any(), any())).thenReturn(List.of());

      List<PopularContent> popular = viewTracker.popular(Timeframe.DAILY, 3, null);

      assertThat(popular)
          .extracting(PopularContent::getContentReference)
          .containsExactly("4.19", "6.73", "11.174");
      assertThat(popular).allMatch(PopularContent::isFallback);
      assertThat(cacheManager.exists(CacheKeys.popularRanking("daily", null, 3))).isFalse();
    }

    @Test
    @DisplayName("should filter the curated list by content type")
    void shouldFilterCuratedList() {
      when(contentViewRepository.findPopularSince(any(), any(), any())).thenReturn(List.of());

      assertThat(viewTracker.popular(Timeframe.WEEKLY, 10, ContentType.CHAPTER)).isEmpty();
    }

    @Test
    @DisplayName("should rank recorded views with resolved titles and cache the ranking")
    void shouldRankAndCache() {
      when(contentViewRepository.findPopularSince(
              eq(NOW.toLocalDate().atStartOfDay()), isNull(), any()))
          .thenReturn(
              List.of(
                  new PopularContentRow(ContentType.ARTICLE, "2.9", 7L, 2L, NOW),
                  new PopularContentRow(ContentType.CHAPTER, "4", 3L, 1L, NOW.minusHours(1)),
                  new PopularContentRow(ContentType.SEARCH, "flag", 1L, 1L, NOW)));
      when(contentCache.findArticle(2, 9))
          .thenReturn(TestDocuments.sample().chapter(2).flatMap(c -> c.article(9)));
      when(contentCache.findChapter(4)).thenReturn(TestDocuments.sample().chapter(4));

      List<PopularContent> first = viewTracker.popular(Timeframe.DAILY, 5, null);
      List<PopularContent> second = viewTracker.popular(Timeframe.DAILY, 5, null);

      assertThat(first)
          .extracting(PopularContent::getTitle)
          .containsExactly("National symbols and national days", "The Bill of Rights", null);
      assertThat(first.get(0).getTotalViews()).isEqualTo(7);
      assertThat(first.get(0).isFallback()).isFalse();
      assertThat(second).isEqualTo(first);
      verify(contentViewRepository, times(1)).findPopularSince(any(), any(), any());
    }

    @Test
    @DisplayName("should leave the title empty when the source is unavailable")
    void shouldTolerateMissingSource() {
      when(contentViewRepository.findPopularSince(any(), any(), any()))
          .thenReturn(List.of(new PopularContentRow(ContentType.CHAPTER, "2", 1L, 1L, NOW)));
      when(contentCache.findChapter(2))
          .thenThrow(new SourceUnavailableException("classpath:x.json", "missing"));

      List<PopularContent> popular = viewTracker.popular(Timeframe.MONTHLY, 1, null);

      assertThat(popular).hasSize(1);
      assertThat(popular.get(0).getTitle()).isNull();
    }

    @Test
    @DisplayName("should reject limits outside 1..100")
    void shouldRejectBadLimits() {
      assertThatThrownBy(() -> viewTracker.popular(Timeframe.DAILY, 0, null))
          .isInstanceOf(InvalidQueryException.class);
      assertThatThrownBy(() -> viewTracker.popular(Timeframe.DAILY, 101, null))
          .isInstanceOf(InvalidQueryException.class);
    }
  }

  @Nested
  @DisplayName("history and summary")
  class HistoryAndSummary {

    @Test
    @DisplayName("should map a user's most recent views")
    void shouldMapHistory() {
      ContentView view =
          ContentView.builder()
              .contentType(ContentType.ARTICLE)
              .contentReference("2.9")
              .viewerKey("alice")
              .viewCount(4L)
              .firstViewedAt(NOW.minusDays(2))
              .lastViewedAt(NOW)
              .build();
      when(contentViewRepository.findByViewerKeyOrderByLastViewedAtDesc(eq("alice"), any()))
          .thenReturn(List.of(view));

      List<ViewHistoryEntry> history = viewTracker.viewHistory("alice", 20);

      assertThat(history).hasSize(1);
      assertThat(history.get(0).getContentReference()).isEqualTo("2.9");
      assertThat(history.get(0).getViewCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("should reject a blank user id")
    void shouldRejectBlankUser() {
      assertThatThrownBy(() -> viewTracker.viewHistory(" ", 20))
          .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    @DisplayName("should summarize totals and per-type views")
    void shouldSummarize() {
      LocalDateTime since = NOW.minusDays(7);
      List<Object[]> byType = new ArrayList<>();
      byType.add(new Object[] {ContentType.ARTICLE, 5L});
      byType.add(new Object[] {ContentType.SEARCH, 2L});
      when(contentViewRepository.sumViewCountByContentTypeSince(since)).thenReturn(byType);
      when(contentViewRepository.sumViewCountSince(since)).thenReturn(7L);
      when(contentViewRepository.countDistinctViewersSince(since, ContentView.ANONYMOUS))
          .thenReturn(2L);

      AnalyticsSummary summary = viewTracker.summary(Timeframe.WEEKLY);

      assertThat(summary.getSince()).isEqualTo(since);
      assertThat(summary.getTotalViews()).isEqualTo(7);
      assertThat(summary.getUniqueViewers()).isEqualTo(2);
      assertThat(summary.getViewsByContentType()).containsEntry("article", 5L);
      assertThat(summary.getViewsByContentType()).containsEntry("search", 2L);
    }
  }
}

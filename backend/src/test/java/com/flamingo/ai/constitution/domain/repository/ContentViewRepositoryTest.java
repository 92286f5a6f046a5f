package com.flamingo.ai.constitution.domain.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.constitution.domain.entity.ContentView;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;

@DataJpaTest
@DisplayName("ContentViewRepository")
class ContentViewRepositoryTest {

  private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 10, 0);

  @Autowired private ContentViewRepository repository;

  @BeforeEach
  void setUp() {
    repository.deleteAll();
    save(ContentType.ARTICLE, "2.9", "alice", 5, NOW.minusHours(1));
    save(ContentType.ARTICLE, "2.9", "bob", 2, NOW.minusHours(2));
    save(ContentType.ARTICLE, "4.19", ContentView.ANONYMOUS, 7, NOW.minusMinutes(5));
    save(ContentType.CHAPTER, "2", "alice", 3, NOW.minusHours(3));
    save(ContentType.SEARCH, "flag", "alice", 1, NOW.minusDays(10));
  }

  private ContentView save(
      ContentType type, String reference, String viewer, long count, LocalDateTime lastViewed) {
    return repository.saveAndFlush(
        ContentView.builder()
            .contentType(type)
            .contentReference(reference)
            .viewerKey(viewer)
            .viewCount(count)
            .firstViewedAt(lastViewed.minusDays(1))
            .lastViewedAt(lastViewed)
            .build());
  }

  @Test
  @DisplayName("should find the row for one viewer of one item")
  void shouldFindViewerRow() {
    assertThat(
            repository.findByContentTypeAndContentReferenceAndViewerKey(
                ContentType.ARTICLE, "2.9", "bob"))
        .hasValueSatisfying(view -> assertThat(view.getViewCount()).isEqualTo(2L));
    assertThat(
            repository.findByContentTypeAndContentReferenceAndViewerKey(
                ContentType.CHAPTER, "2.9", "bob"))
        .isEmpty();
  }

  @Test
  @DisplayName("should reject a second row for the same viewer and item")
  void shouldEnforceUniqueViewerRow() {
    assertThatThrownBy(() -> save(ContentType.ARTICLE, "2.9", "alice", 1, NOW))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  @DisplayName("should rank by summed views then by most recent view")
  void shouldRankPopularContent() {
    List<PopularContentRow> rows =
        repository.findPopularSince(NOW.minusDays(1), null, PageRequest.of(0, 10));

    assertThat(rows)
        .extracting(PopularContentRow::contentReference)
        .containsExactly("4.19", "2.9", "2");
    PopularContentRow shared = rows.get(1);
    assertThat(shared.totalViews()).isEqualTo(7L);
    assertThat(shared.uniqueViewers()).isEqualTo(2L);
    assertThat(shared.lastViewedAt()).isEqualTo(NOW.minusHours(1));
  }

  @Test
  @DisplayName("should restrict the ranking to one content type and honour the page size")
  void shouldFilterPopularContent() {
    List<PopularContentRow> chapters =
        repository.findPopularSince(NOW.minusDays(1), ContentType.CHAPTER, PageRequest.of(0, 10));
    List<PopularContentRow> top =
        repository.findPopularSince(NOW.minusDays(30), null, PageRequest.of(0, 1));

    assertThat(chapters).extracting(PopularContentRow::contentReference).containsExactly("2");
    assertThat(top).hasSize(1);
  }

  @Test
  @DisplayName("should list a viewer's history newest first")
  void shouldListHistory() {
    assertThat(repository.findByViewerKeyOrderByLastViewedAtDesc("alice", PageRequest.of(0, 10)))
        .extracting(ContentView::getContentReference)
        .containsExactly("2.9", "2", "flag");
  }

  @Test
  @DisplayName("should summarize totals and identified viewers in a window")
  void shouldSummarize() {
    LocalDateTime since = NOW.minusDays(1);

    assertThat(repository.sumViewCountSince(since)).isEqualTo(17L);
    assertThat(repository.countDistinctViewersSince(since, ContentView.ANONYMOUS)).isEqualTo(2L);
    assertThat(repository.sumViewCountByContentTypeSince(since))
        .extracting(row -> row[0])
        .containsExactlyInAnyOrder(ContentType.ARTICLE, ContentType.CHAPTER);
    assertThat(repository.sumViewCountSince(NOW.plusDays(1))).isZero();
  }
}

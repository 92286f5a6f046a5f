package com.flamingo.ai.constitution;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.constitution.cache.CacheManager;
import com.flamingo.ai.constitution.cache.InMemoryKeyValueStore;
import com.flamingo.ai.constitution.cache.KeyValueStore;
import com.flamingo.ai.constitution.domain.entity.ContentView;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import com.flamingo.ai.constitution.domain.repository.ContentViewRepository;
import com.flamingo.ai.constitution.service.ConstitutionService;
import com.flamingo.ai.constitution.service.analytics.ViewTracker;
import com.flamingo.ai.constitution.service.analytics.ViewerContext;
import com.flamingo.ai.constitution.service.search.SearchEngine;
import com.flamingo.ai.constitution.service.search.SearchRequest;
import com.flamingo.ai.constitution.service.search.SearchResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the Spring application context loads against the test fixture document, the in-memory
 * cache backend and an H2 database.
 */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;
  @Autowired private ConstitutionService constitutionService;
  @Autowired private SearchEngine searchEngine;
  @Autowired private ViewTracker viewTracker;
  @Autowired private ContentViewRepository contentViewRepository;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core beans should be available")
  void coreBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(KeyValueStore.class))
        .isInstanceOf(InMemoryKeyValueStore.class);
    assertThat(applicationContext.getBean(CacheManager.class).healthCheck()).isTrue();
    assertThat(applicationContext.getBean(ConstitutionService.class)).isNotNull();
    assertThat(applicationContext.getBean(SearchEngine.class)).isNotNull();
  }

  @Test
  @DisplayName("Overview should describe the configured document")
  void overviewShouldDescribeDocument() {
    assertThat(constitutionService.getOverview().getTitle()).isEqualTo("Test Constitution");
    assertThat(constitutionService.getOverview().getTotalChapters()).isEqualTo(3);
  }

  @Test
  @DisplayName("Search should reach nested items parsed from legacy field names")
  void searchShouldReachLegacyNestedItems() {
    SearchResponse response =
        searchEngine.search(SearchRequest.builder().query("its supporters").build());

    assertThat(response.getResults()).hasSize(1);
    assertThat(response.getResults().get(0).getSubClauseId()).isEqualTo("c.i");
  }

  @Test
  @DisplayName("Tracked views should be persisted per viewer")
  void trackedViewsShouldBePersisted() {
    ViewerContext viewer = new ViewerContext("context-test-user", "desktop", "127.0.0.1");

    viewTracker.track(ContentType.ARTICLE, "4.19", viewer);
    viewTracker.track(ContentType.ARTICLE, "4.19", viewer);

    assertThat(
            contentViewRepository.findByContentTypeAndContentReferenceAndViewerKey(
                ContentType.ARTICLE, "4.19", "context-test-user"))
        .map(ContentView::getViewCount)
        .hasValue(2L);
  }
}

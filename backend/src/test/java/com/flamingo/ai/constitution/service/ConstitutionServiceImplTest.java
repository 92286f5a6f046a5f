package com.flamingo.ai.constitution.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.constitution.TestDocuments;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.exception.ContentNotFoundException;
import com.flamingo.ai.constitution.service.analytics.ViewTracker;
import com.flamingo.ai.constitution.service.analytics.ViewerContext;
import com.flamingo.ai.constitution.service.content.ContentCache;
import com.flamingo.ai.constitution.service.content.NavigationStructure;
import com.flamingo.ai.constitution.service.content.Preamble;
import com.flamingo.ai.constitution.task.DeferredTaskQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ConstitutionServiceImpl")
class ConstitutionServiceImplTest {

  @Mock private ContentCache contentCache;
  @Mock private ViewTracker viewTracker;

  private ConstitutionServiceImpl constitutionService;

  @BeforeEach
  void setUp() {
    constitutionService =
        new ConstitutionServiceImpl(
            contentCache,
            viewTracker,
            new DeferredTaskQueue(Runnable::run, new SimpleMeterRegistry()));
  }

  @Test
  @DisplayName("should return a chapter and record the view")
  void shouldTrackChapterView() {
    Chapter chapter = TestDocuments.sample().chapter(2).orElseThrow();
    ViewerContext viewer = new ViewerContext("alice", "desktop", "127.0.0.1");
    when(contentCache.getChapter(2, true)).thenReturn(chapter);

    assertThat(constitutionService.getChapter(2, viewer)).isSameAs(chapter);
    verify(viewTracker).track(ContentType.CHAPTER, "2", viewer);
  }

  @Test
  @DisplayName("should return an article and record it as chapter.article")
  void shouldTrackArticleView() {
    Article article = TestDocuments.sample().chapter(2).flatMap(c -> c.article(9)).orElseThrow();
    when(contentCache.getArticle(2, 9, true)).thenReturn(article);

    assertThat(constitutionService.getArticle(2, 9, ViewerContext.anonymous())).isSameAs(article);
    verify(viewTracker).track(ContentType.ARTICLE, "2.9", ViewerContext.anonymous());
  }

  @Test
  @DisplayName("should return the preamble and record a preamble view")
  void shouldTrackPreambleView() {
    Preamble preamble =
        Preamble.builder().title("Constitution").content(TestDocuments.PREAMBLE).build();
    ViewerContext viewer = new ViewerContext("alice", "desktop", "127.0.0.1");
    when(contentCache.getPreamble(true)).thenReturn(preamble);

    assertThat(constitutionService.getPreamble(viewer)).isSameAs(preamble);
    verify(viewTracker).track(ContentType.PREAMBLE, "preamble", viewer);
  }

  @Test
  @DisplayName("should return navigation without recording a view")
  void shouldNotTrackNavigation() {
    NavigationStructure navigation = NavigationStructure.builder().build();
    when(contentCache.getNavigation(true)).thenReturn(navigation);

    assertThat(constitutionService.getNavigation()).isSameAs(navigation);
    verifyNoInteractions(viewTracker);
  }

  @Test
  @DisplayName("should not record a view for content that does not exist")
  void shouldNotTrackMissingContent() {
    when(contentCache.getChapter(99, true)).thenThrow(ContentNotFoundException.chapter(99));

    assertThatThrownBy(() -> constitutionService.getChapter(99, ViewerContext.anonymous()))
        .isInstanceOf(ContentNotFoundException.class);
    verifyNoInteractions(viewTracker);
  }

  @Test
  @DisplayName("should delegate reload to the content cache")
  void shouldReload() {
    when(contentCache.reload()).thenReturn(TestDocuments.sample());

    assertThat(constitutionService.reload().getChapters()).hasSize(3);
    verify(contentCache).reload();
    verify(viewTracker, never()).track(any(), any(), any());
  }
}

package com.flamingo.ai.constitution.service;

import com.flamingo.ai.constitution.domain.enums.ContentType;
import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.ArticleReference;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.ConstitutionDocument;
import com.flamingo.ai.constitution.service.analytics.ViewTracker;
import com.flamingo.ai.constitution.service.analytics.ViewerContext;
import com.flamingo.ai.constitution.service.content.ConstitutionOverview;
import com.flamingo.ai.constitution.service.content.ContentCache;
import com.flamingo.ai.constitution.service.content.NavigationStructure;
import com.flamingo.ai.constitution.service.content.Preamble;
import com.flamingo.ai.constitution.task.DeferredTaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the ConstitutionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConstitutionServiceImpl implements ConstitutionService {

  static final String PREAMBLE_REFERENCE = "preamble";

  private final ContentCache contentCache;
  private final ViewTracker viewTracker;
  private final DeferredTaskQueue deferredTasks;

  @Override
  public ConstitutionOverview getOverview() {
    return contentCache.getOverview(true);
  }

  @Override
  public ConstitutionDocument getDocument() {
    return contentCache.getDocument(true);
  }

  @Override
  public Preamble getPreamble(ViewerContext viewer) {
    Preamble preamble = contentCache.getPreamble(true);
    deferredTasks.submit(
        "track preamble view",
        () -> viewTracker.track(ContentType.PREAMBLE, PREAMBLE_REFERENCE, viewer));
    return preamble;
  }

  @Override
  public NavigationStructure getNavigation() {
    return contentCache.getNavigation(true);
  }

  @Override
  public Chapter getChapter(int chapterNumber, ViewerContext viewer) {
    Chapter chapter = contentCache.getChapter(chapterNumber, true);
    String reference = String.valueOf(chapterNumber);
    deferredTasks.submit(
        "track chapter view", () -> viewTracker.track(ContentType.CHAPTER, reference, viewer));
    return chapter;
  }

  @Override
  public Article getArticle(int chapterNumber, int articleNumber, ViewerContext viewer) {
    Article article = contentCache.getArticle(chapterNumber, articleNumber, true);
    String reference = new ArticleReference(chapterNumber, articleNumber).toString();
    deferredTasks.submit(
        "track article view", () -> viewTracker.track(ContentType.ARTICLE, reference, viewer));
    return article;
  }

  @Override
  public ConstitutionDocument reload() {
    log.info("Constitution reload requested");
    return contentCache.reload();
  }
}

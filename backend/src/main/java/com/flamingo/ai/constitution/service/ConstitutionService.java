package com.flamingo.ai.constitution.service;

import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.ConstitutionDocument;
import com.flamingo.ai.constitution.service.analytics.ViewerContext;
import com.flamingo.ai.constitution.service.content.ConstitutionOverview;
import com.flamingo.ai.constitution.service.content.NavigationStructure;
import com.flamingo.ai.constitution.service.content.Preamble;

/** Reader-facing content access that records what is read. */
public interface ConstitutionService {

  /**
   * Gets the document overview.
   *
   * @return title, preamble preview, chapter summaries and statistics
   */
  ConstitutionOverview getOverview();

  /**
   * Gets the full document.
   *
   * @return the document
   */
  ConstitutionDocument getDocument();

  /**
   * Gets the preamble and records a preamble view.
   *
   * @param viewer who is reading
   * @return the preamble text with the document title
   */
  Preamble getPreamble(ViewerContext viewer);

  /**
   * Gets the navigation tree of chapters and articles.
   *
   * @return the navigation structure
   */
  NavigationStructure getNavigation();

  /**
   * Gets a chapter and records a chapter view.
   *
   * @param chapterNumber the chapter number
   * @param viewer who is reading
   * @return the chapter
   * @throws com.flamingo.ai.constitution.exception.ContentNotFoundException if it does not exist
   */
  Chapter getChapter(int chapterNumber, ViewerContext viewer);

  /**
   * Gets an article and records an article view.
   *
   * @param chapterNumber the chapter number
   * @param articleNumber the article number within the chapter
   * @param viewer who is reading
   * @return the article
   * @throws com.flamingo.ai.constitution.exception.ContentNotFoundException if it does not exist
   */
  Article getArticle(int chapterNumber, int articleNumber, ViewerContext viewer);

  /**
   * Re-reads the document from its source.
   *
   * @return the reloaded document
   */
  ConstitutionDocument reload();
}

package com.flamingo.ai.constitution.service.content;

import com.flamingo.ai.constitution.cache.CacheKeys;
import com.flamingo.ai.constitution.cache.CacheManager;
import com.flamingo.ai.constitution.config.ConstitutionProperties;
import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.ArticleReference;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.Clause;
import com.flamingo.ai.constitution.domain.model.ConstitutionDocument;
import com.flamingo.ai.constitution.domain.model.Part;
import com.flamingo.ai.constitution.domain.model.SubClause;
import com.flamingo.ai.constitution.exception.ContentNotFoundException;
import com.flamingo.ai.constitution.task.DeferredTaskQueue;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read-through cache over the {@link DocumentStore}: whole document, overview, chapters and
 * articles, each under its own key and TTL.
 *
 * <p>When {@code mayDefer} is true, writes after a miss are queued on the {@link DeferredTaskQueue}
 * so they happen after the response; otherwise they are written before returning.
 */
@Service
@Slf4j
public class ContentCache {

  static final int PREAMBLE_PREVIEW_LENGTH = 200;

  private final CacheManager cacheManager;
  private final DocumentStore documentStore;
  private final DeferredTaskQueue deferredTasks;
  private final ConstitutionProperties.Ttl ttl;

  public ContentCache(
      CacheManager cacheManager,
      DocumentStore documentStore,
      DeferredTaskQueue deferredTasks,
      ConstitutionProperties properties) {
    this.cacheManager = cacheManager;
    this.documentStore = documentStore;
    this.deferredTasks = deferredTasks;
    this.ttl = properties.getCache().getTtl();
  }

  public ConstitutionDocument getDocument() {
    return getDocument(false);
  }

  @Timed(value = "constitution.content.document", description = "Time to resolve the document")
  public ConstitutionDocument getDocument(boolean mayDefer) {
    Optional<ConstitutionDocument> cached =
        cacheManager.get(CacheKeys.DOCUMENT, ConstitutionDocument.class);
    if (cached.isPresent()) {
      return cached.get();
    }
    ConstitutionDocument document = documentStore.get();
    populate(CacheKeys.DOCUMENT, document, ttl.getDocument(), mayDefer);
    return document;
  }

  public Chapter getChapter(int chapterNumber) {
    return getChapter(chapterNumber, false);
  }

  /**
   * Returns a chapter.
   *
   * @throws ContentNotFoundException if no chapter has this number
   */
  @Timed(value = "constitution.content.chapter", description = "Time to resolve a chapter")
  public Chapter getChapter(int chapterNumber, boolean mayDefer) {
    return findChapter(chapterNumber, mayDefer)
        .orElseThrow(() -> ContentNotFoundException.chapter(chapterNumber));
  }

  public Optional<Chapter> findChapter(int chapterNumber) {
    return findChapter(chapterNumber, false);
  }

  public Optional<Chapter> findChapter(int chapterNumber, boolean mayDefer) {
    String key = CacheKeys.chapter(chapterNumber);
    Optional<Chapter> cached = cacheManager.get(key, Chapter.class);
    if (cached.isPresent()) {
      return cached;
    }
    Optional<Chapter> chapter = getDocument(mayDefer).chapter(chapterNumber);
    chapter.ifPresent(c -> populate(key, c, ttl.getChapter(), mayDefer));
    return chapter;
  }

  public Article getArticle(int chapterNumber, int articleNumber) {
    return getArticle(chapterNumber, articleNumber, false);
  }

  /**
   * Returns an article, looking through the chapter's parts as well as its direct articles.
   *
   * @throws ContentNotFoundException if the chapter or the article does not exist
   */
  @Timed(value = "constitution.content.article", description = "Time to resolve an article")
  public Article getArticle(int chapterNumber, int articleNumber, boolean mayDefer) {
    return findArticle(chapterNumber, articleNumber, mayDefer)
        .orElseThrow(() -> ContentNotFoundException.article(chapterNumber, articleNumber));
  }

  public Optional<Article> findArticle(int chapterNumber, int articleNumber) {
    return findArticle(chapterNumber, articleNumber, false);
  }

  public Optional<Article> findArticle(int chapterNumber, int articleNumber, boolean mayDefer) {
    String key = CacheKeys.article(chapterNumber, articleNumber);
    Optional<Article> cached = cacheManager.get(key, Article.class);
    if (cached.isPresent()) {
      return cached;
    }
    Optional<Article> article =
        getDocument(mayDefer).chapter(chapterNumber).flatMap(c -> c.article(articleNumber));
    article.ifPresent(a -> populate(key, a, ttl.getArticle(), mayDefer));
    return article;
  }

  /** Returns title, preamble preview, chapter summaries and structure statistics. */
  @Timed(value = "constitution.content.overview", description = "Time to build the overview")
  public ConstitutionOverview getOverview(boolean mayDefer) {
    Optional<ConstitutionOverview> cached =
        cacheManager.get(CacheKeys.OVERVIEW_METADATA, ConstitutionOverview.class);
    if (cached.isPresent()) {
      return cached.get();
    }
    ConstitutionOverview overview = buildOverview(getDocument(mayDefer));
    populate(CacheKeys.OVERVIEW_METADATA, overview, ttl.getOverview(), mayDefer);
    return overview;
  }

  /** Returns the full preamble with the document title. */
  @Timed(value = "constitution.content.preamble", description = "Time to resolve the preamble")
  public Preamble getPreamble(boolean mayDefer) {
    Optional<Preamble> cached = cacheManager.get(CacheKeys.PREAMBLE, Preamble.class);
    if (cached.isPresent()) {
      return cached.get();
    }
    ConstitutionDocument document = getDocument(mayDefer);
    StringBuilder text = new StringBuilder();
    DocumentTreeWalker.walk(
        document,
        new DocumentVisitor() {
          @Override
          public void visitPreamble(String preamble) {
            text.append(preamble);
          }

          @Override
          public boolean visitChapter(Chapter chapter) {
            return false;
          }
        });
    Preamble preamble =
        Preamble.builder().title(document.getTitle()).content(text.toString()).build();
    populate(CacheKeys.PREAMBLE, preamble, ttl.getOverview(), mayDefer);
    return preamble;
  }

  /** Returns the chapter and article tree used for navigation. */
  @Timed(value = "constitution.content.navigation", description = "Time to build navigation")
  public NavigationStructure getNavigation(boolean mayDefer) {
    Optional<NavigationStructure> cached =
        cacheManager.get(CacheKeys.NAVIGATION, NavigationStructure.class);
    if (cached.isPresent()) {
      return cached.get();
    }
    NavigationStructure navigation = buildNavigation(getDocument(mayDefer));
    populate(CacheKeys.NAVIGATION, navigation, ttl.getOverview(), mayDefer);
    return navigation;
  }

  /**
   * Re-reads the source and replaces the cached document. Derived entries (overview, preamble,
   * navigation) are dropped and rebuilt on next read.
   *
   * <p>Chapter and article entries are left to expire on their own TTL; use {@link
   * #invalidateAll()} to drop them immediately.
   */
  public ConstitutionDocument reload() {
    cacheManager.delete(CacheKeys.DOCUMENT);
    cacheManager.delete(CacheKeys.OVERVIEW_METADATA);
    cacheManager.delete(CacheKeys.PREAMBLE);
    cacheManager.delete(CacheKeys.NAVIGATION);
    ConstitutionDocument document = documentStore.reload();
    cacheManager.set(CacheKeys.DOCUMENT, document, ttl.getDocument());
    log.info("Constitution reloaded with {} chapters", document.getChapters().size());
    return document;
  }

  public long invalidateSearch() {
    return cacheManager.clearPattern(CacheKeys.SEARCH_PATTERN);
  }

  public long invalidateUser(String userId) {
    return cacheManager.clearPattern(CacheKeys.userPattern(userId));
  }

  /** Drops every entry in the namespace: document, chapters, articles, searches and counters. */
  public long invalidateAll() {
    return cacheManager.clearPattern(CacheKeys.ALL_PATTERN);
  }

  private void populate(String key, Object value, Duration entryTtl, boolean mayDefer) {
    if (mayDefer) {
      deferredTasks.submit("cache " + key, () -> cacheManager.set(key, value, entryTtl));
    } else {
      cacheManager.set(key, value, entryTtl);
    }
  }

  private ConstitutionOverview buildOverview(ConstitutionDocument document) {
    ConstitutionOverview.Statistics statistics = new ConstitutionOverview.Statistics();
    DocumentTreeWalker.walk(
        document,
        new DocumentVisitor() {
          @Override
          public boolean visitChapter(Chapter chapter) {
            statistics.setWords(
                statistics.getWords() + WordCounter.count(chapter.getChapterTitle()));
            return true;
          }

          @Override
          public void visitPart(NodeLocator locator, Part part) {
            statistics.setParts(statistics.getParts() + 1);
          }

          @Override
          public boolean visitArticle(NodeLocator locator, Article article) {
            statistics.setArticles(statistics.getArticles() + 1);
            statistics.setWords(
                statistics.getWords() + WordCounter.count(article.getArticleTitle()));
            return true;
          }

          @Override
          public void visitClause(NodeLocator locator, Clause clause) {
            statistics.setClauses(statistics.getClauses() + 1);
            statistics.setWords(statistics.getWords() + WordCounter.count(clause.getContent()));
          }

          @Override
          public void visitSubClause(NodeLocator locator, SubClause subClause, String path) {
            statistics.setSubClauses(statistics.getSubClauses() + 1);
            statistics.setWords(statistics.getWords() + WordCounter.count(subClause.getContent()));
          }
        });

    return ConstitutionOverview.builder()
        .title(document.getTitle())
        .preamblePreview(preview(document.getPreamble()))
        .totalChapters(document.getChapters().size())
        .chapters(
            document.getChapters().stream()
                .sorted(Comparator.comparingInt(Chapter::getChapterNumber))
                .map(
                    chapter ->
                        ConstitutionOverview.ChapterSummary.builder()
                            .chapterNumber(chapter.getChapterNumber())
                            .chapterTitle(chapter.getChapterTitle())
                            .articleCount(chapter.allArticles().size())
                            .partCount(chapter.getParts().size())
                            .build())
                .toList())
        .statistics(statistics)
        .lastLoaded(documentStore.lastLoaded().orElse(null))
        .build();
  }

  private static NavigationStructure buildNavigation(ConstitutionDocument document) {
    NavigationStructure navigation =
        NavigationStructure.builder()
            .preamble(
                NavigationStructure.PreambleNode.builder()
                    .title("Preamble")
                    .path("/preamble")
                    .build())
            .build();
    DocumentTreeWalker.walk(
        document,
        new DocumentVisitor() {
          @Override
          public boolean visitChapter(Chapter chapter) {
            navigation
                .getChapters()
                .add(
                    NavigationStructure.ChapterNode.builder()
                        .chapterNumber(chapter.getChapterNumber())
                        .chapterTitle(chapter.getChapterTitle())
                        .path("/chapters/" + chapter.getChapterNumber())
                        .build());
            return true;
          }

          @Override
          public boolean visitArticle(NodeLocator locator, Article article) {
            int chapterNumber = locator.chapter().getChapterNumber();
            List<NavigationStructure.ChapterNode> chapters = navigation.getChapters();
            chapters
                .get(chapters.size() - 1)
                .getArticles()
                .add(
                    NavigationStructure.ArticleNode.builder()
                        .articleNumber(article.getArticleNumber())
                        .articleTitle(article.getArticleTitle())
                        .partNumber(locator.part() == null ? null : locator.part().getPartNumber())
                        .path(
                            "/chapters/"
                                + chapterNumber
                                + "/articles/"
                                + article.getArticleNumber())
                        .reference(
                            new ArticleReference(chapterNumber, article.getArticleNumber())
                                .toString())
                        .build());
            return false;
          }
        });
    return navigation;
  }

  private static String preview(String preamble) {
    if (preamble == null) {
      return null;
    }
    return preamble.length() > PREAMBLE_PREVIEW_LENGTH
        ? preamble.substring(0, PREAMBLE_PREVIEW_LENGTH) + "..."
        : preamble;
  }
}

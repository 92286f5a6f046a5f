package com.flamingo.ai.constitution.service.search;

import com.flamingo.ai.constitution.cache.CacheKeys;
import com.flamingo.ai.constitution.cache.CacheManager;
import com.flamingo.ai.constitution.config.ConstitutionProperties;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.Clause;
import com.flamingo.ai.constitution.domain.model.ConstitutionDocument;
import com.flamingo.ai.constitution.domain.model.SubClause;
import com.flamingo.ai.constitution.exception.InvalidQueryException;
import com.flamingo.ai.constitution.service.analytics.ViewTracker;
import com.flamingo.ai.constitution.service.content.ContentCache;
import com.flamingo.ai.constitution.service.content.DocumentTreeWalker;
import com.flamingo.ai.constitution.service.content.DocumentVisitor;
import com.flamingo.ai.constitution.service.content.NodeLocator;
import com.flamingo.ai.constitution.task.DeferredTaskQueue;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

/**
 * Case-insensitive substring search over every level of the document.
 *
 * <p>Results come back in document order, one per matching unit, paginated after the full walk.
 * Responses are cached per request signature, and every search is recorded as a view after the
 * response has been produced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchEngine {

  private final ContentCache contentCache;
  private final CacheManager cacheManager;
  private final ViewTracker viewTracker;
  private final DeferredTaskQueue deferredTasks;
  private final ConstitutionProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Runs a search.
   *
   * @param request query, filters and paging
   * @return the requested page of results with pagination metadata
   * @throws InvalidQueryException for malformed filters or out-of-range paging
   */
  @Timed(value = "constitution.search", description = "Time to execute a search")
  public SearchResponse search(SearchRequest request) {
    String query = request.getQuery() == null ? "" : request.getQuery();
    if (query.isBlank()) {
      return SearchResponse.empty(
          query, request.getFilters(), request.getLimit(), request.getOffset());
    }

    ConstitutionProperties.Search config = properties.getSearch();
    validate(request, query, config);
    Integer chapterFilter = request.getFilters().chapterNumber();
    Integer articleFilter = request.getFilters().articleNumber();
    String normalized = normalize(query);

    String key = CacheKeys.search(signature(normalized, request));
    Optional<SearchResponse> cached =
        request.isBypassCache() ? Optional.empty() : cacheManager.get(key, SearchResponse.class);

    SearchResponse response;
    if (cached.isPresent()) {
      response = cached.get();
      recordSearch("hit");
    } else {
      ConstitutionDocument document = contentCache.getDocument(true);
      ResultCollector collector =
          new ResultCollector(
              normalized,
              chapterFilter,
              articleFilter,
              request.isHighlight(),
              config.getContextWindow());
      DocumentTreeWalker.walk(document, collector);
      List<SearchResult> all = collector.results;

      int from = Math.min(request.getOffset(), all.size());
      int to = (int) Math.min((long) request.getOffset() + request.getLimit(), all.size());
      response =
          SearchResponse.builder()
              .query(query)
              .normalizedQuery(normalized)
              .filters(request.getFilters())
              .results(new ArrayList<>(all.subList(from, to)))
              .pagination(Pagination.of(all.size(), request.getLimit(), request.getOffset()))
              .build();

      if (request.isBypassCache()) {
        recordSearch("bypass");
      } else {
        cacheManager.set(key, response, properties.getCache().getTtl().getSearch());
        recordSearch("miss");
      }
      log.debug("Search '{}' matched {} units", normalized, all.size());
    }

    String tracked = truncate(normalized, config.getTrackedQueryLength());
    deferredTasks.submit(
        "track search", () -> viewTracker.track(ContentType.SEARCH, tracked, request.getViewer()));
    return response;
  }

  /** Lower-cases and collapses whitespace. */
  static String normalize(String query) {
    return query.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  private static void validate(
      SearchRequest request, String query, ConstitutionProperties.Search config) {
    if (query.length() > config.getMaxQueryLength()) {
      throw new InvalidQueryException(
          "query", "must be at most " + config.getMaxQueryLength() + " characters");
    }
    if (request.getLimit() < 1 || request.getLimit() > config.getMaxLimit()) {
      throw new InvalidQueryException("limit", "must be between 1 and " + config.getMaxLimit());
    }
    if (request.getOffset() < 0 || request.getOffset() > config.getMaxOffset()) {
      throw new InvalidQueryException("offset", "must be between 0 and " + config.getMaxOffset());
    }
  }

  private static String signature(String normalized, SearchRequest request) {
    String raw =
        normalized
            + "|"
            + request.getFilters().canonical()
            + "|"
            + request.getLimit()
            + "|"
            + request.getOffset()
            + "|"
            + request.isHighlight();
    return DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
  }

  private static String truncate(String value, int maxLength) {
    return value.length() <= maxLength ? value : value.substring(0, maxLength);
  }

  private void recordSearch(String cacheResult) {
    meterRegistry.counter("constitution.search.requests", "cache", cacheResult).increment();
  }

  /**
   * Collects one result per matching unit. The chapter filter limits chapters, the article filter
   * limits articles; the preamble is always searched.
   */
  private static final class ResultCollector implements DocumentVisitor {

    private final String query;
    private final Integer chapterFilter;
    private final Integer articleFilter;
    private final boolean highlight;
    private final int contextWindow;
    private final List<SearchResult> results = new ArrayList<>();

    ResultCollector(
        String query,
        Integer chapterFilter,
        Integer articleFilter,
        boolean highlight,
        int contextWindow) {
      this.query = query;
      this.chapterFilter = chapterFilter;
      this.articleFilter = articleFilter;
      this.highlight = highlight;
      this.contextWindow = contextWindow;
    }

    @Override
    public void visitPreamble(String preamble) {
      if (TextHighlighter.containsIgnoreCase(preamble, query)) {
        String context = TextHighlighter.context(preamble, query, contextWindow);
        results.add(
            SearchResult.builder()
                .type(SearchResultType.PREAMBLE)
                .content(context)
                .matchContext(mark(context))
                .build());
      }
    }

    @Override
    public boolean visitChapter(Chapter chapter) {
      if (chapterFilter != null && chapter.getChapterNumber() != chapterFilter) {
        return false;
      }
      if (TextHighlighter.containsIgnoreCase(chapter.getChapterTitle(), query)) {
        results.add(
            SearchResult.builder()
                .type(SearchResultType.CHAPTER)
                .chapterNumber(chapter.getChapterNumber())
                .chapterTitle(chapter.getChapterTitle())
                .content(chapter.getChapterTitle())
                .matchContext(mark(chapter.getChapterTitle()))
                .build());
      }
      return true;
    }

    @Override
    public boolean visitArticle(NodeLocator locator, Article article) {
      if (articleFilter != null && article.getArticleNumber() != articleFilter) {
        return false;
      }
      if (TextHighlighter.containsIgnoreCase(article.getArticleTitle(), query)) {
        results.add(
            located(locator, SearchResultType.ARTICLE_TITLE, article.getArticleTitle()).build());
      }
      return true;
    }

    @Override
    public void visitClause(NodeLocator locator, Clause clause) {
      if (TextHighlighter.containsIgnoreCase(clause.getContent(), query)) {
        results.add(
            located(locator, SearchResultType.CLAUSE, clause.getContent())
                .clauseNumber(clause.getClauseNumber())
                .build());
      }
    }

    @Override
    public void visitSubClause(NodeLocator locator, SubClause subClause, String path) {
      if (TextHighlighter.containsIgnoreCase(subClause.getContent(), query)) {
        results.add(
            located(locator, SearchResultType.SUB_CLAUSE, subClause.getContent())
                .clauseNumber(locator.clause().getClauseNumber())
                .subClauseId(path)
                .build());
      }
    }

    private SearchResult.SearchResultBuilder located(
        NodeLocator locator, SearchResultType type, String text) {
      SearchResult.SearchResultBuilder builder =
          SearchResult.builder()
              .type(type)
              .chapterNumber(locator.chapter().getChapterNumber())
              .chapterTitle(locator.chapter().getChapterTitle())
              .articleNumber(locator.article().getArticleNumber())
              .articleTitle(locator.article().getArticleTitle())
              .content(text)
              .matchContext(mark(text));
      if (locator.part() != null) {
        builder.partNumber(locator.part().getPartNumber()).partTitle(locator.part().getPartTitle());
      }
      return builder;
    }

    private String mark(String text) {
      return highlight ? TextHighlighter.highlight(text, query) : text;
    }
  }
}

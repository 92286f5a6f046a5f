package com.flamingo.ai.constitution.service.search;

import com.flamingo.ai.constitution.config.ConstitutionProperties;
import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.exception.InvalidQueryException;
import com.flamingo.ai.constitution.service.content.ContentCache;
import com.flamingo.ai.constitution.service.content.DocumentTreeWalker;
import com.flamingo.ai.constitution.service.content.DocumentVisitor;
import com.flamingo.ai.constitution.service.content.NodeLocator;
import io.micrometer.core.annotation.Timed;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Type-ahead suggestions for the search box.
 *
 * <p>Suggestions come in three groups, in this order: a spelling-corrected version of the query,
 * common search terms containing the query, then chapter and article titles containing it in
 * document order. Duplicates are dropped and the list is cut to the requested limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchSuggester {

  static final int MIN_PREFIX_LENGTH = 2;

  static final List<String> COMMON_TERMS =
      List.of(
          "fundamental rights",
          "bill of rights",
          "national assembly",
          "president",
          "supreme court",
          "devolution",
          "county government",
          "citizenship",
          "elections",
          "parliament");

  static final Map<String, String> CORRECTIONS =
      Map.ofEntries(
          Map.entry("constution", "constitution"),
          Map.entry("constituton", "constitution"),
          Map.entry("goverment", "government"),
          Map.entry("govenment", "government"),
          Map.entry("parliment", "parliament"),
          Map.entry("parlimant", "parliament"),
          Map.entry("presedent", "president"),
          Map.entry("presidente", "president"),
          Map.entry("rigths", "rights"),
          Map.entry("rihts", "rights"),
          Map.entry("citezen", "citizen"),
          Map.entry("citicen", "citizen"),
          Map.entry("electon", "election"),
          Map.entry("elecction", "election"),
          Map.entry("judical", "judicial"),
          Map.entry("judicary", "judiciary"));

  private final ContentCache contentCache;
  private final ConstitutionProperties properties;

  /**
   * Suggests queries for a partial input.
   *
   * @param query what the reader has typed so far
   * @param limit maximum number of suggestions
   * @return suggestions, best first; empty for a blank query
   * @throws InvalidQueryException if the limit is out of range
   */
  @Timed(value = "constitution.search.suggestions", description = "Time to build suggestions")
  public List<String> suggest(String query, int limit) {
    int maxLimit = properties.getSearch().getMaxLimit();
    if (limit < 1 || limit > maxLimit) {
      throw new InvalidQueryException("limit", "must be between 1 and " + maxLimit);
    }
    String normalized = query == null ? "" : SearchEngine.normalize(query);
    if (normalized.isEmpty()) {
      return List.of();
    }

    Set<String> suggestions = new LinkedHashSet<>();
    correct(normalized).ifPresent(suggestions::add);
    if (normalized.length() >= MIN_PREFIX_LENGTH) {
      COMMON_TERMS.stream().filter(term -> term.contains(normalized)).forEach(suggestions::add);
      if (suggestions.size() < limit) {
        suggestions.addAll(matchingTitles(normalized));
      }
    }
    log.debug("Suggestions for '{}': {}", normalized, suggestions.size());
    return suggestions.stream().limit(limit).toList();
  }

  /** Replaces known misspellings word by word; empty when nothing changed. */
  static Optional<String> correct(String normalized) {
    String corrected =
        Arrays.stream(normalized.split(" "))
            .map(word -> CORRECTIONS.getOrDefault(word, word))
            .collect(Collectors.joining(" "));
    return corrected.equals(normalized) ? Optional.empty() : Optional.of(corrected);
  }

  private Set<String> matchingTitles(String normalized) {
    Set<String> titles = new LinkedHashSet<>();
    DocumentTreeWalker.walk(
        contentCache.getDocument(true),
        new DocumentVisitor() {
          @Override
          public boolean visitChapter(Chapter chapter) {
            addIfMatching(chapter.getChapterTitle());
            return true;
          }

          @Override
          public boolean visitArticle(NodeLocator locator, Article article) {
            addIfMatching(article.getArticleTitle());
            return false;
          }

          private void addIfMatching(String title) {
            if (TextHighlighter.containsIgnoreCase(title, normalized)) {
              titles.add(title.toLowerCase(Locale.ROOT));
            }
          }
        });
    return titles;
  }
}

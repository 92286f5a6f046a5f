package com.flamingo.ai.constitution.service.reading;

import com.flamingo.ai.constitution.config.ConstitutionProperties;
import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.ArticleReference;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.Clause;
import com.flamingo.ai.constitution.domain.model.Part;
import com.flamingo.ai.constitution.domain.model.SubClause;
import com.flamingo.ai.constitution.exception.SourceUnavailableException;
import com.flamingo.ai.constitution.service.content.ContentCache;
import com.flamingo.ai.constitution.service.content.DocumentTreeWalker;
import com.flamingo.ai.constitution.service.content.DocumentVisitor;
import com.flamingo.ai.constitution.service.content.NodeLocator;
import com.flamingo.ai.constitution.service.content.WordCounter;
import java.util.Locale;
import java.util.OptionalLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Minimum reading time before a chapter or article may be marked complete: a fraction of the
 * estimated full reading time, never below a floor.
 */
@Service
@Slf4j
public class ReadingCompletionEstimator {

  public static final String CHAPTER = "chapter";
  public static final String ARTICLE = "article";

  private final ContentCache contentCache;
  private final ConstitutionProperties.Reading config;

  public ReadingCompletionEstimator(ContentCache contentCache, ConstitutionProperties properties) {
    this.contentCache = contentCache;
    this.config = properties.getReading();
  }

  /**
   * Returns the completion threshold in minutes.
   *
   * @param itemType {@code chapter} or {@code article}
   * @param reference chapter number ({@code "2"}) or {@code "chapter.article"} ({@code "2.9"})
   * @return the threshold; the floor when the item cannot be resolved or has no words
   */
  public double thresholdMinutes(String itemType, String reference) {
    OptionalLong words;
    try {
      words = countWords(itemType, reference);
    } catch (SourceUnavailableException e) {
      log.warn("Cannot estimate reading time for {} {}: {}", itemType, reference, e.getMessage());
      return config.getMinimumMinutes();
    }
    if (words.isEmpty() || words.getAsLong() == 0) {
      log.debug("No words resolved for {} {}, using minimum threshold", itemType, reference);
      return config.getMinimumMinutes();
    }
    return thresholdForWords(words.getAsLong());
  }

  /** Threshold for a given word count. */
  public double thresholdForWords(long words) {
    double estimatedMinutes = (double) words / config.getWordsPerMinute();
    return Math.max(config.getMinimumMinutes(), estimatedMinutes * config.getCompletionRatio());
  }

  private OptionalLong countWords(String itemType, String reference) {
    if (itemType == null || reference == null) {
      return OptionalLong.empty();
    }
    switch (itemType.trim().toLowerCase(Locale.ROOT)) {
      case CHAPTER:
        Integer chapterNumber = parseChapter(reference);
        if (chapterNumber == null) {
          return OptionalLong.empty();
        }
        return contentCache
            .findChapter(chapterNumber)
            .map(chapter -> OptionalLong.of(countChapter(chapter)))
            .orElse(OptionalLong.empty());
      case ARTICLE:
        return ArticleReference.parse(reference)
            .flatMap(ref -> contentCache.findArticle(ref.chapterNumber(), ref.articleNumber()))
            .map(article -> OptionalLong.of(countArticle(article)))
            .orElse(OptionalLong.empty());
      default:
        log.debug("Unsupported reading item type: {}", itemType);
        return OptionalLong.empty();
    }
  }

  private static Integer parseChapter(String reference) {
    try {
      return Integer.parseInt(reference.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static long countChapter(Chapter chapter) {
    WordCountingVisitor visitor = new WordCountingVisitor();
    DocumentTreeWalker.walkChapter(chapter, visitor);
    return visitor.words;
  }

  private static long countArticle(Article article) {
    WordCountingVisitor visitor = new WordCountingVisitor();
    DocumentTreeWalker.walkArticle(NodeLocator.root(), article, visitor);
    return visitor.words;
  }

  /** Sums titles, clause contents and sub-clause contents at every depth. */
  private static final class WordCountingVisitor implements DocumentVisitor {

    private long words;

    @Override
    public boolean visitChapter(Chapter chapter) {
      words += WordCounter.count(chapter.getChapterTitle());
      return true;
    }

    @Override
    public void visitPart(NodeLocator locator, Part part) {
      words += WordCounter.count(part.getPartTitle());
    }

    @Override
    public boolean visitArticle(NodeLocator locator, Article article) {
      words += WordCounter.count(article.getArticleTitle());
      return true;
    }

    @Override
    public void visitClause(NodeLocator locator, Clause clause) {
      words += WordCounter.count(clause.getContent());
    }

    @Override
    public void visitSubClause(NodeLocator locator, SubClause subClause, String path) {
      words += WordCounter.count(subClause.getContent());
    }
  }
}

package com.flamingo.ai.constitution.service.content;

import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.Clause;
import com.flamingo.ai.constitution.domain.model.ConstitutionDocument;
import com.flamingo.ai.constitution.domain.model.Part;
import com.flamingo.ai.constitution.domain.model.SubClause;
import java.util.Comparator;

/**
 * Depth-first walk over the document in reading order: preamble, then chapters by ascending
 * number; within a chapter its direct articles, then each part and its articles; within an article
 * its clauses, each followed by its sub-clauses and their nested items.
 */
public final class DocumentTreeWalker {

  private DocumentTreeWalker() {}

  public static void walk(ConstitutionDocument document, DocumentVisitor visitor) {
    if (document.getPreamble() != null) {
      visitor.visitPreamble(document.getPreamble());
    }
    document.getChapters().stream()
        .sorted(Comparator.comparingInt(Chapter::getChapterNumber))
        .forEach(chapter -> walkChapter(chapter, visitor));
  }

  public static void walkChapter(Chapter chapter, DocumentVisitor visitor) {
    if (!visitor.visitChapter(chapter)) {
      return;
    }
    NodeLocator chapterLocator = NodeLocator.of(chapter);
    for (Article article : chapter.getArticles()) {
      walkArticle(chapterLocator, article, visitor);
    }
    for (Part part : chapter.getParts()) {
      NodeLocator partLocator = chapterLocator.withPart(part);
      visitor.visitPart(partLocator, part);
      for (Article article : part.getArticles()) {
        walkArticle(partLocator, article, visitor);
      }
    }
  }

  public static void walkArticle(NodeLocator parent, Article article, DocumentVisitor visitor) {
    NodeLocator articleLocator = parent.withArticle(article);
    if (!visitor.visitArticle(articleLocator, article)) {
      return;
    }
    for (Clause clause : article.getClauses()) {
      NodeLocator clauseLocator = articleLocator.withClause(clause);
      visitor.visitClause(clauseLocator, clause);
      for (SubClause subClause : clause.getSubClauses()) {
        String path = String.valueOf(subClause.getSubClauseId());
        walkSubClause(clauseLocator, subClause, path, visitor);
      }
    }
  }

  private static void walkSubClause(
      NodeLocator locator, SubClause subClause, String path, DocumentVisitor visitor) {
    visitor.visitSubClause(locator, subClause, path);
    for (SubClause child : subClause.getSubItems()) {
      walkSubClause(locator, child, path + "." + child.getSubClauseId(), visitor);
    }
  }
}

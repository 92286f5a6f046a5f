package com.flamingo.ai.constitution.service.content;

import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.Clause;
import com.flamingo.ai.constitution.domain.model.Part;
import com.flamingo.ai.constitution.domain.model.SubClause;

/**
 * Callbacks for {@link DocumentTreeWalker}. Every method has a no-op default so visitors only
 * implement the levels they care about.
 */
public interface DocumentVisitor {

  default void visitPreamble(String preamble) {}

  /**
   * Called before a chapter's articles are walked.
   *
   * @return false to skip the chapter's subtree
   */
  default boolean visitChapter(Chapter chapter) {
    return true;
  }

  default void visitPart(NodeLocator locator, Part part) {}

  /**
   * Called before an article's clauses are walked.
   *
   * @return false to skip the article's clauses
   */
  default boolean visitArticle(NodeLocator locator, Article article) {
    return true;
  }

  default void visitClause(NodeLocator locator, Clause clause) {}

  /**
   * Called for every sub-clause at any depth.
   *
   * @param path dotted identifier path from the top-level sub-clause, e.g. {@code a.i}
   */
  default void visitSubClause(NodeLocator locator, SubClause subClause, String path) {}
}

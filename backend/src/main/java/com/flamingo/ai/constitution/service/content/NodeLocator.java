package com.flamingo.ai.constitution.service.content;

import com.flamingo.ai.constitution.domain.model.Article;
import com.flamingo.ai.constitution.domain.model.Chapter;
import com.flamingo.ai.constitution.domain.model.Clause;
import com.flamingo.ai.constitution.domain.model.Part;

/** Position of a node during a tree walk; fields below the current level are null. */
public record NodeLocator(Chapter chapter, Part part, Article article, Clause clause) {

  public static NodeLocator root() {
    return new NodeLocator(null, null, null, null);
  }

  public static NodeLocator of(Chapter chapter) {
    return new NodeLocator(chapter, null, null, null);
  }

  public NodeLocator withPart(Part part) {
    return new NodeLocator(chapter, part, null, null);
  }

  public NodeLocator withArticle(Article article) {
    return new NodeLocator(chapter, part, article, null);
  }

  public NodeLocator withClause(Clause clause) {
    return new NodeLocator(chapter, part, article, clause);
  }
}

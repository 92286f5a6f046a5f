package com.flamingo.ai.constitution.service.search;

import com.flamingo.ai.constitution.service.analytics.ViewerContext;
import lombok.Builder;
import lombok.Value;

/** Search parameters. */
@Value
@Builder
public class SearchRequest {

  String query;

  @Builder.Default SearchFilters filters = SearchFilters.none();

  @Builder.Default int limit = 10;

  @Builder.Default int offset = 0;

  /** Wrap matches in {@code **} markers in the match context. */
  @Builder.Default boolean highlight = true;

  /** Skip both the cache read and the cache write. */
  @Builder.Default boolean bypassCache = false;

  /** Who is searching; recorded with the search view. */
  @Builder.Default ViewerContext viewer = ViewerContext.anonymous();
}

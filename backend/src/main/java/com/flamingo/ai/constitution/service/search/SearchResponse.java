package com.flamingo.ai.constitution.service.search;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private String query;
  private String normalizedQuery;
  private SearchFilters filters;

  @Builder.Default private List<SearchResult> results = new ArrayList<>();

  private Pagination pagination;

  public static SearchResponse empty(String query, SearchFilters filters, int limit, int offset) {
    return SearchResponse.builder()
        .query(query)
        .normalizedQuery("")
        .filters(filters)
        .results(new ArrayList<>())
        .pagination(Pagination.of(0, limit, offset))
        .build();
  }
}

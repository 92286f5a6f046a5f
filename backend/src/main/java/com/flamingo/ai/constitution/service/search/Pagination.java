package com.flamingo.ai.constitution.service.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pagination {

  private int total;
  private int limit;
  private int offset;
  private boolean hasNext;
  private boolean hasPrevious;
  private Integer nextOffset;
  private Integer previousOffset;

  public static Pagination of(int total, int limit, int offset) {
    long end = (long) offset + limit;
    boolean hasNext = end < total;
    boolean hasPrevious = offset > 0;
    return Pagination.builder()
        .total(total)
        .limit(limit)
        .offset(offset)
        .hasNext(hasNext)
        .hasPrevious(hasPrevious)
        .nextOffset(hasNext ? (int) end : null)
        .previousOffset(hasPrevious ? Math.max(0, offset - limit) : null)
        .build();
  }
}

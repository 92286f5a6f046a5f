package com.flamingo.ai.constitution.service.analytics;

import com.flamingo.ai.constitution.domain.entity.ContentView;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ViewHistoryEntry {

  private ContentType contentType;
  private String contentReference;
  private long viewCount;
  private LocalDateTime firstViewedAt;
  private LocalDateTime lastViewedAt;

  public static ViewHistoryEntry fromEntity(ContentView view) {
    return ViewHistoryEntry.builder()
        .contentType(view.getContentType())
        .contentReference(view.getContentReference())
        .viewCount(view.getViewCount())
        .firstViewedAt(view.getFirstViewedAt())
        .lastViewedAt(view.getLastViewedAt())
        .build();
  }
}

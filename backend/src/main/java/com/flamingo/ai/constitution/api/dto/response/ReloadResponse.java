package com.flamingo.ai.constitution.api.dto.response;

import com.flamingo.ai.constitution.domain.model.ConstitutionDocument;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ReloadResponse {

  private String title;
  private int totalChapters;
  private Instant reloadedAt;

  public static ReloadResponse fromDocument(ConstitutionDocument document) {
    return ReloadResponse.builder()
        .title(document.getTitle())
        .totalChapters(document.getChapters().size())
        .reloadedAt(Instant.now())
        .build();
  }
}

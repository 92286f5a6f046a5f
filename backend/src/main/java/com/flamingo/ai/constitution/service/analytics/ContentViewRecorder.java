package com.flamingo.ai.constitution.service.analytics;

import com.flamingo.ai.constitution.domain.entity.ContentView;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import com.flamingo.ai.constitution.domain.repository.ContentViewRepository;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Upserts the durable per-viewer view row inside its own transaction. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentViewRecorder {

  private final ContentViewRepository contentViewRepository;

  @Transactional
  public ContentView record(
      ContentType contentType, String reference, ViewerContext viewer, LocalDateTime now) {
    String viewerKey = viewer.userId() == null ? ContentView.ANONYMOUS : viewer.userId();
    ContentView view =
        contentViewRepository
            .findByContentTypeAndContentReferenceAndViewerKey(contentType, reference, viewerKey)
            .map(
                existing -> {
                  existing.recordRepeatView(now, viewer.deviceType(), viewer.ipAddress());
                  return existing;
                })
            .orElseGet(
                () ->
                    ContentView.builder()
                        .contentType(contentType)
                        .contentReference(reference)
                        .viewerKey(viewerKey)
                        .viewCount(1L)
                        .firstViewedAt(now)
                        .lastViewedAt(now)
                        .deviceType(viewer.deviceType())
                        .ipAddress(viewer.ipAddress())
                        .build());
    ContentView saved = contentViewRepository.save(view);
    log.debug(
        "Recorded view {}:{} by {} (count={})",
        contentType.getValue(),
        reference,
        viewerKey,
        saved.getViewCount());
    return saved;
  }
}

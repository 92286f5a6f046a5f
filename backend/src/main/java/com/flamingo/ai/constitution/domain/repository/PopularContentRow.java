package com.flamingo.ai.constitution.domain.repository;

import com.flamingo.ai.constitution.domain.enums.ContentType;
import java.time.LocalDateTime;

/** Per-item aggregate of content views. */
public record PopularContentRow(
    ContentType contentType,
    String contentReference,
    Long totalViews,
    Long uniqueViewers,
    LocalDateTime lastViewedAt) {}

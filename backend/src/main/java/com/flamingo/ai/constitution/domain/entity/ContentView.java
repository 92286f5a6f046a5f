package com.flamingo.ai.constitution.domain.entity;

import com.flamingo.ai.constitution.domain.enums.ContentType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Aggregated views of one piece of content by one viewer. */
@Entity
@Table(
    name = "content_views",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"content_type", "content_reference", "viewer_key"}),
    indexes = @Index(name = "idx_content_views_last_viewed", columnList = "last_viewed_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContentView {

  /** Viewer key used when no user id is known. */
  public static final String ANONYMOUS = "anonymous";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "content_type", nullable = false)
  private ContentType contentType;

  /** Chapter number, "chapter.article", or the truncated search query. */
  @Column(name = "content_reference", nullable = false)
  private String contentReference;

  /** User id, or {@link #ANONYMOUS}. */
  @Column(name = "viewer_key", nullable = false)
  private String viewerKey;

  @Builder.Default
  @Column(name = "view_count", nullable = false)
  private Long viewCount = 1L;

  @Column(name = "first_viewed_at", nullable = false, updatable = false)
  private LocalDateTime firstViewedAt;

  @Column(name = "last_viewed_at", nullable = false)
  private LocalDateTime lastViewedAt;

  private String deviceType;

  private String ipAddress;

  /** Counts one more view at {@code now}, refreshing device and address when known. */
  public void recordRepeatView(LocalDateTime now, String device, String address) {
    viewCount = viewCount + 1;
    lastViewedAt = now;
    if (device != null) {
      deviceType = device;
    }
    if (address != null) {
      ipAddress = address;
    }
  }
}

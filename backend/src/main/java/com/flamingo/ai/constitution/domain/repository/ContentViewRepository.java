package com.flamingo.ai.constitution.domain.repository;

import com.flamingo.ai.constitution.domain.entity.ContentView;
import com.flamingo.ai.constitution.domain.enums.ContentType;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ContentView entities. */
@Repository
public interface ContentViewRepository extends JpaRepository<ContentView, UUID> {

  /** Finds the aggregate row for one viewer of one item. */
  Optional<ContentView> findByContentTypeAndContentReferenceAndViewerKey(
      ContentType contentType, String contentReference, String viewerKey);

  /** Most recently viewed items for a viewer. */
  List<ContentView> findByViewerKeyOrderByLastViewedAtDesc(String viewerKey, Pageable pageable);

  /**
   * Ranks items viewed since {@code since} by summed view count, then by most recent view. A null
   * content type means all types.
   */
  @Query(
      "SELECT new com.flamingo.ai.constitution.domain.repository.PopularContentRow("
          + "v.contentType, v.contentReference, SUM(v.viewCount), COUNT(v), MAX(v.lastViewedAt)) "
          + "FROM ContentView v "
          + "WHERE v.lastViewedAt >= :since "
          + "AND (:contentType IS NULL OR v.contentType = :contentType) "
          + "GROUP BY v.contentType, v.contentReference "
          + "ORDER BY SUM(v.viewCount) DESC, MAX(v.lastViewedAt) DESC")
  List<PopularContentRow> findPopularSince(
      @Param("since") LocalDateTime since,
      @Param("contentType") ContentType contentType,
      Pageable pageable);

  /** Total views recorded on rows active since {@code since}. */
  @Query("SELECT COALESCE(SUM(v.viewCount), 0) FROM ContentView v WHERE v.lastViewedAt >= :since")
  long sumViewCountSince(@Param("since") LocalDateTime since);

  /** Distinct identified viewers active since {@code since}. */
  @Query(
      "SELECT COUNT(DISTINCT v.viewerKey) FROM ContentView v "
          + "WHERE v.lastViewedAt >= :since AND v.viewerKey <> :anonymous")
  long countDistinctViewersSince(
      @Param("since") LocalDateTime since, @Param("anonymous") String anonymous);

  /** View totals per content type since {@code since}. */
  @Query(
      "SELECT v.contentType, SUM(v.viewCount) FROM ContentView v "
          + "WHERE v.lastViewedAt >= :since GROUP BY v.contentType")
  List<Object[]> sumViewCountByContentTypeSince(@Param("since") LocalDateTime since);
}

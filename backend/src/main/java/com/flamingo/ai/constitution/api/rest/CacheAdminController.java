package com.flamingo.ai.constitution.api.rest;

import com.flamingo.ai.constitution.api.dto.response.CacheClearResponse;
import com.flamingo.ai.constitution.api.dto.response.CacheHealthResponse;
import com.flamingo.ai.constitution.cache.CacheKeys;
import com.flamingo.ai.constitution.cache.CacheManager;
import com.flamingo.ai.constitution.config.ConstitutionProperties;
import com.flamingo.ai.constitution.service.content.ContentCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for cache invalidation and health. */
@RestController
@RequestMapping("/api/constitution/cache")
@RequiredArgsConstructor
@Slf4j
public class CacheAdminController {

  private final ContentCache contentCache;
  private final CacheManager cacheManager;
  private final ConstitutionProperties properties;

  /** Drops all cached search responses. */
  @DeleteMapping("/search")
  public ResponseEntity<CacheClearResponse> clearSearch() {
    return ResponseEntity.ok(
        new CacheClearResponse(CacheKeys.SEARCH_PATTERN, contentCache.invalidateSearch()));
  }

  /** Drops all cached entries for one user. */
  @DeleteMapping("/users/{userId}")
  public ResponseEntity<CacheClearResponse> clearUser(@PathVariable String userId) {
    return ResponseEntity.ok(
        new CacheClearResponse(CacheKeys.userPattern(userId), contentCache.invalidateUser(userId)));
  }

  /** Drops every cached entry. */
  @DeleteMapping
  public ResponseEntity<CacheClearResponse> clearAll() {
    log.info("Clearing the whole constitution cache");
    return ResponseEntity.ok(
        new CacheClearResponse(CacheKeys.ALL_PATTERN, contentCache.invalidateAll()));
  }

  /** Checks that the cache backend accepts writes and reads. */
  @GetMapping("/health")
  public ResponseEntity<CacheHealthResponse> health() {
    boolean healthy = cacheManager.healthCheck();
    CacheHealthResponse body =
        new CacheHealthResponse(healthy, properties.getCache().getBackend());
    return healthy
        ? ResponseEntity.ok(body)
        : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }
}

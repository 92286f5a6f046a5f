package com.flamingo.ai.constitution.api.dto.response;

/** Number of cache entries removed by an invalidation. */
public record CacheClearResponse(String pattern, long deleted) {}

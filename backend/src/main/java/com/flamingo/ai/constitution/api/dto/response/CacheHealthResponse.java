package com.flamingo.ai.constitution.api.dto.response;

public record CacheHealthResponse(boolean healthy, String backend) {}

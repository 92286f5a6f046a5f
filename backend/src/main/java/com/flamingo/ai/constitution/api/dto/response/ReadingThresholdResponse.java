package com.flamingo.ai.constitution.api.dto.response;

/** Minimum minutes a reader spends on an item before it may be marked complete. */
public record ReadingThresholdResponse(String itemType, String reference, double minutes) {}

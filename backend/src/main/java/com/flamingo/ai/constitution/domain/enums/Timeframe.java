package com.flamingo.ai.constitution.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.constitution.exception.InvalidQueryException;
import java.time.LocalDateTime;
import java.util.Locale;

/** Popularity window. */
public enum Timeframe {
  /** Since local midnight today. */
  DAILY("daily"),
  WEEKLY("weekly"),
  MONTHLY("monthly");

  private final String value;

  Timeframe(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Start of the window ending at {@code now}. */
  public LocalDateTime windowStart(LocalDateTime now) {
    return switch (this) {
      case DAILY -> now.toLocalDate().atStartOfDay();
      case WEEKLY -> now.minusDays(7);
      case MONTHLY -> now.minusDays(30);
    };
  }

  /**
   * Parses a timeframe name; blank means daily.
   *
   * @throws InvalidQueryException for anything other than daily, weekly or monthly
   */
  public static Timeframe fromValue(String value) {
    if (value == null || value.isBlank()) {
      return DAILY;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "daily" -> DAILY;
      case "weekly" -> WEEKLY;
      case "monthly" -> MONTHLY;
      default -> throw new InvalidQueryException(
          "timeframe", "must be one of daily, weekly, monthly but was " + value);
    };
  }
}

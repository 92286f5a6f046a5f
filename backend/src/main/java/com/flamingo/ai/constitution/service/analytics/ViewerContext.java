package com.flamingo.ai.constitution.service.analytics;

/**
 * Who is reading, as far as the request tells us.
 *
 * @param userId authenticated user id, or null for anonymous readers
 * @param deviceType client device hint, may be null
 * @param ipAddress remote address, may be null
 */
public record ViewerContext(String userId, String deviceType, String ipAddress) {

  public static ViewerContext anonymous() {
    return new ViewerContext(null, null, null);
  }
}

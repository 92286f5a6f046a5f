package com.flamingo.ai.constitution.api.rest;

import com.flamingo.ai.constitution.service.analytics.ViewerContext;
import jakarta.servlet.http.HttpServletRequest;

/** Builds the viewer context from request headers and the remote address. */
final class ViewerContextResolver {

  static final String USER_ID_HEADER = "X-User-Id";
  static final String DEVICE_TYPE_HEADER = "X-Device-Type";

  private ViewerContextResolver() {}

  static ViewerContext resolve(HttpServletRequest request) {
    return new ViewerContext(
        blankToNull(request.getHeader(USER_ID_HEADER)),
        blankToNull(request.getHeader(DEVICE_TYPE_HEADER)),
        request.getRemoteAddr());
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}

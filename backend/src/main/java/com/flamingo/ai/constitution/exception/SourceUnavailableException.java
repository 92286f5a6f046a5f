package com.flamingo.ai.constitution.exception;

/** Exception thrown when the constitution source is missing or malformed. */
public class SourceUnavailableException extends ConstitutionException {

  private static final String USER_MESSAGE =
      "Constitution content is temporarily unavailable. Please try again later.";

  private final String location;

  public SourceUnavailableException(String location, String message) {
    super(ErrorKind.SOURCE_UNAVAILABLE, message, USER_MESSAGE);
    this.location = location;
  }

  public SourceUnavailableException(String location, String message, Throwable cause) {
    super(ErrorKind.SOURCE_UNAVAILABLE, message, USER_MESSAGE, cause);
    this.location = location;
  }

  public String getLocation() {
    return location;
  }
}

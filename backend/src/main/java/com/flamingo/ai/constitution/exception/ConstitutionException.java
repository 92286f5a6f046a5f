package com.flamingo.ai.constitution.exception;

/** Base class for constitution domain failures, tagged with an {@link ErrorKind}. */
public abstract class ConstitutionException extends RuntimeException {

  private final ErrorKind kind;
  private final String userMessage;

  protected ConstitutionException(ErrorKind kind, String message, String userMessage) {
    super(message);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  protected ConstitutionException(
      ErrorKind kind, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

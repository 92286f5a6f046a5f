package com.flamingo.ai.constitution.exception;

/** Exception thrown for malformed search parameters, filters or analytics arguments. */
public class InvalidQueryException extends ConstitutionException {

  private final String parameter;

  public InvalidQueryException(String parameter, String message) {
    super(ErrorKind.INVALID_QUERY, parameter + ": " + message, parameter + ": " + message);
    this.parameter = parameter;
  }

  public String getParameter() {
    return parameter;
  }
}

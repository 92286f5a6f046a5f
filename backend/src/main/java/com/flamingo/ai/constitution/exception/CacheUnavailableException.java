package com.flamingo.ai.constitution.exception;

/**
 * Exception raised by key-value backends. Caught by the cache manager and converted into a cache
 * miss or no-op.
 */
public class CacheUnavailableException extends ConstitutionException {

  private final String operation;

  public CacheUnavailableException(String operation, Throwable cause) {
    super(
        ErrorKind.CACHE_UNAVAILABLE,
        "Cache operation '" + operation + "' failed: " + cause.getMessage(),
        "Cache is temporarily unavailable",
        cause);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}

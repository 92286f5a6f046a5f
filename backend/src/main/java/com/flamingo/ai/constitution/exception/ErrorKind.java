package com.flamingo.ai.constitution.exception;

/** Categories of failure that callers branch on. */
public enum ErrorKind {
  /** A requested chapter or article number does not exist. */
  NOT_FOUND,

  /** The document source could not be read or parsed. */
  SOURCE_UNAVAILABLE,

  /** Search parameters or filters are malformed. */
  INVALID_QUERY,

  /** The cache backend failed; never surfaced beyond the cache layer. */
  CACHE_UNAVAILABLE
}

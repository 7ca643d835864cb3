package com.gruelbox.retry;

/** A general-purpose set of {@link FailureCategory}s which covers most remote calls. */
public enum StandardFailureCategory implements FailureCategory {

  /** Something went wrong which may well succeed if tried again, such as a timeout. */
  TRANSIENT,

  /** The caller is not allowed to do this. Retrying won't help. */
  PERMISSION_DENIED,

  /** The request itself was malformed. */
  INVALID,

  /** The remote party is down or refusing connections. */
  UNAVAILABLE,

  /** Used by {@link FailureClassifier#DEFAULT} for exceptions that carry no category. */
  UNCLASSIFIED
}

package com.gruelbox.retry;

import lombok.Value;

/**
 * The classified failure of a single attempt. The {@link #getCause() cause} is exactly what the
 * operation threw.
 */
@Value
public class Failure {

  FailureCategory category;
  String message;
  Exception cause;

  static Failure of(FailureCategory category, Exception cause) {
    return new Failure(category, cause.getMessage(), cause);
  }
}

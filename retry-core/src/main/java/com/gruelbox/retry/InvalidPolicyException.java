package com.gruelbox.retry;

/** Thrown when a {@link RetryPolicy} is constructed with values that break its contract. */
public class InvalidPolicyException extends IllegalArgumentException {

  public InvalidPolicyException(String message) {
    super(message);
  }

  public InvalidPolicyException(String message, Throwable cause) {
    super(message, cause);
  }
}

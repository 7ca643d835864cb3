package com.gruelbox.retry;

/**
 * Thrown when a {@link RetryPolicy} would grow its delay beyond the largest representable {@link
 * java.time.Duration}. Supply a {@link RetryPolicy#getMaxDelay() maxDelay} to clamp instead.
 */
public class PolicyOverflowException extends ArithmeticException {

  public PolicyOverflowException(String message) {
    super(message);
  }

  public PolicyOverflowException(String message, Throwable cause) {
    super(message);
    initCause(cause);
  }
}

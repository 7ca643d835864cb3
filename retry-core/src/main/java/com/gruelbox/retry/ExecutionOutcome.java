package com.gruelbox.retry;

/** Why an execution stopped. */
public enum ExecutionOutcome {

  /** The operation returned a value. */
  SUCCEEDED,

  /** The operation failed with a category the policy does not retry. */
  NON_RETRYABLE,

  /** The operation failed with a retryable category on the final permitted attempt. */
  ATTEMPTS_EXHAUSTED,

  /** A {@link CancellationToken} was cancelled, or the thread interrupted, during a wait. */
  CANCELLED,

  /** Waiting for the next attempt would have overrun the policy's deadline. */
  TIMED_OUT;

  /**
   * @return True for the outcomes caused by the retry policy giving up.
   */
  public boolean isTerminalFailure() {
    return this == NON_RETRYABLE || this == ATTEMPTS_EXHAUSTED;
  }

  /**
   * @return True for the outcomes caused by the caller stopping the execution.
   */
  public boolean isAborted() {
    return this == CANCELLED || this == TIMED_OUT;
  }
}

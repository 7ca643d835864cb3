package com.gruelbox.retry;

import lombok.Getter;

/**
 * Thrown by {@link ExecutionResult#getOrThrow()} when retrying stopped for a reason of the
 * caller's own making ({@link ExecutionOutcome#CANCELLED} or {@link ExecutionOutcome#TIMED_OUT})
 * rather than because of the retry policy. The cause is the failure of the last attempt.
 */
public class RetryAbortedException extends RuntimeException {

  @Getter private final ExecutionOutcome outcome;
  @Getter private final int attemptsUsed;

  RetryAbortedException(ExecutionOutcome outcome, int attemptsUsed, Throwable cause) {
    super("Retry " + outcome.name().toLowerCase() + " after " + attemptsUsed + " attempt(s)", cause);
    this.outcome = outcome;
    this.attemptsUsed = attemptsUsed;
  }
}

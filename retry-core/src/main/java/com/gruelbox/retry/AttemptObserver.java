package com.gruelbox.retry;

import java.time.Duration;

/**
 * A listener for the events fired by a {@link RetryExecutor} during a single execution. Wire
 * logging or metrics in here; the executor itself produces no log output for attempts.
 *
 * <p>All methods default to doing nothing, so only override what you need. Exceptions thrown by an
 * observer are logged by the executor and otherwise ignored: they never change the outcome of the
 * execution.
 */
public interface AttemptObserver {

  AttemptObserver EMPTY = new AttemptObserver() {};

  /**
   * Fired immediately before the operation is invoked.
   *
   * @param attemptNumber The 1-based attempt number.
   */
  default void onAttemptStart(int attemptNumber) {
    // No-op
  }

  /**
   * Fired when an attempt has failed with a retryable failure and there are attempts remaining,
   * immediately before the executor starts waiting.
   *
   * @param attemptNumber The attempt which failed.
   * @param failureCategory How the failure was classified.
   * @param failureMessage The failure's message. May be null.
   * @param nextDelay How long the executor will wait before the next attempt.
   */
  default void onRetryScheduled(
      int attemptNumber, FailureCategory failureCategory, String failureMessage, Duration nextDelay) {
    // No-op
  }

  /**
   * Fired exactly once per execution, when it stops.
   *
   * @param outcome Why it stopped. {@link ExecutionOutcome#NON_RETRYABLE} and {@link
   *     ExecutionOutcome#ATTEMPTS_EXHAUSTED} distinguish the two ways a policy can give up.
   * @param attemptsUsed The number of attempts made.
   * @param failureCategory The category of the last failure, or null on success.
   * @param failureMessage The message of the last failure, or null on success.
   */
  default void onTerminal(
      ExecutionOutcome outcome,
      int attemptsUsed,
      FailureCategory failureCategory,
      String failureMessage) {
    // No-op
  }

  /**
   * Chains this observer with another and returns the result.
   *
   * @param other The other observer. It will always be called after this one.
   * @return The combined observer.
   */
  default AttemptObserver andThen(AttemptObserver other) {
    var self = this;
    return new AttemptObserver() {

      @Override
      public void onAttemptStart(int attemptNumber) {
        self.onAttemptStart(attemptNumber);
        other.onAttemptStart(attemptNumber);
      }

      @Override
      public void onRetryScheduled(
          int attemptNumber,
          FailureCategory failureCategory,
          String failureMessage,
          Duration nextDelay) {
        self.onRetryScheduled(attemptNumber, failureCategory, failureMessage, nextDelay);
        other.onRetryScheduled(attemptNumber, failureCategory, failureMessage, nextDelay);
      }

      @Override
      public void onTerminal(
          ExecutionOutcome outcome,
          int attemptsUsed,
          FailureCategory failureCategory,
          String failureMessage) {
        self.onTerminal(outcome, attemptsUsed, failureCategory, failureMessage);
        other.onTerminal(outcome, attemptsUsed, failureCategory, failureMessage);
      }
    };
  }
}

package com.gruelbox.retry;

import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The result of {@link RetryExecutor#execute(FallibleOperation, AttemptObserver,
 * CancellationToken)}. Holds either the value returned by the operation or the {@link Failure} of
 * the last attempt, never both.
 *
 * @param <T> The operation's result type.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExecutionResult<T> {

  /**
   * @return The value returned by the operation. Null unless {@link #isSuccess()}.
   */
  @SuppressWarnings("JavaDoc")
  T value;

  /**
   * @return The failure of the last attempt. Null if {@link #isSuccess()}.
   */
  @SuppressWarnings("JavaDoc")
  Failure failure;

  /**
   * @return Why the execution stopped.
   */
  @SuppressWarnings("JavaDoc")
  ExecutionOutcome outcome;

  /**
   * @return The number of times the operation was invoked.
   */
  @SuppressWarnings("JavaDoc")
  int attemptsUsed;

  /**
   * @return A record of each attempt, in order.
   */
  @SuppressWarnings("JavaDoc")
  List<AttemptRecord> attempts;

  static <T> ExecutionResult<T> success(T value, List<AttemptRecord> attempts) {
    return new ExecutionResult<>(
        value, null, ExecutionOutcome.SUCCEEDED, attempts.size(), List.copyOf(attempts));
  }

  static <T> ExecutionResult<T> failure(
      Failure failure, ExecutionOutcome outcome, List<AttemptRecord> attempts) {
    if (outcome == ExecutionOutcome.SUCCEEDED) {
      throw new IllegalArgumentException("A failed execution cannot have succeeded");
    }
    return new ExecutionResult<>(null, failure, outcome, attempts.size(), List.copyOf(attempts));
  }

  /**
   * @return True if the operation eventually returned a value.
   */
  public boolean isSuccess() {
    return outcome == ExecutionOutcome.SUCCEEDED;
  }

  /**
   * Returns the value, or throws.
   *
   * <p>If the policy gave up ({@link ExecutionOutcome#NON_RETRYABLE} or {@link
   * ExecutionOutcome#ATTEMPTS_EXHAUSTED}), the exception thrown by the last attempt is rethrown
   * exactly as it was thrown. If the execution was cancelled or timed out, a {@link
   * RetryAbortedException} is thrown with that exception as its cause.
   *
   * @return The value.
   * @throws Exception The operation's own failure.
   * @throws RetryAbortedException If the execution was cancelled or timed out.
   */
  public T getOrThrow() throws Exception {
    if (isSuccess()) {
      return value;
    }
    if (outcome.isAborted()) {
      throw new RetryAbortedException(outcome, attemptsUsed, failure.getCause());
    }
    throw failure.getCause();
  }
}

package com.gruelbox.retry;

import java.time.Duration;

/**
 * The suspension point between attempts. Every wait a {@link RetryExecutor} performs goes through
 * here, so environments with their own scheduling model (or tests that don't want to wait) can
 * substitute their own.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Blocks the calling thread for the duration, returning early if the token is cancelled.
   *
   * @return The default {@link Sleeper}.
   */
  static Sleeper blocking() {
    return (duration, token) -> !token.awaitCancellation(duration);
  }

  /**
   * Waits for the given duration.
   *
   * @param duration How long to wait.
   * @param cancellationToken Cancelling this must end the wait promptly.
   * @return true if the full duration elapsed, false if the wait was cancelled.
   * @throws InterruptedException If the thread was interrupted. Treated as cancellation.
   */
  boolean sleep(Duration duration, CancellationToken cancellationToken)
      throws InterruptedException;
}

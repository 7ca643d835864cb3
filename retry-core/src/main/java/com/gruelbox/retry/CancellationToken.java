package com.gruelbox.retry;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A one-shot signal which stops an execution during its wait between attempts. Cancelling does
 * not interrupt an operation which is already running; it is up to the operation to honour {@link
 * #isCancelled()} if it wants to.
 *
 * <p>Thread safe. Once cancelled, a token stays cancelled.
 */
public final class CancellationToken {

  private final CountDownLatch latch = new CountDownLatch(1);

  /**
   * @return A new, uncancelled token.
   */
  public static CancellationToken create() {
    return new CancellationToken();
  }

  /** Signals cancellation, waking any thread currently waiting on this token. */
  public void cancel() {
    latch.countDown();
  }

  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  /**
   * Blocks until either the timeout elapses or the token is cancelled.
   *
   * @param timeout The maximum time to wait.
   * @return true if the token was cancelled.
   * @throws InterruptedException If the calling thread is interrupted while waiting.
   */
  public boolean awaitCancellation(Duration timeout) throws InterruptedException {
    if (timeout.isZero() || timeout.isNegative()) {
      return isCancelled();
    }
    return latch.await(toNanosSaturated(timeout), TimeUnit.NANOSECONDS);
  }

  private static long toNanosSaturated(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  @Override
  public String toString() {
    return "CancellationToken(cancelled=" + isCancelled() + ")";
  }
}

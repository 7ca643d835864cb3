package com.gruelbox.retry;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable description of how hard to try: how many attempts, how long to wait between them and
 * which failures are worth retrying at all.
 *
 * <p>The delay after attempt {@code n} (for {@code 1 <= n < maxAttempts}) is {@code initialDelay *
 * backoffMultiplier^(n-1)}, clamped to {@link #getMaxDelay()} if one is set. No jitter is applied;
 * if you want it, vary the policies you construct.
 *
 * <p>Usage:
 *
 * <pre>RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(5)
 *     .initialDelay(Duration.ofMillis(200))
 *     .backoffMultiplier(1.5)
 *     .retryOn(StandardFailureCategory.TRANSIENT, StandardFailureCategory.UNAVAILABLE)
 *     .build();</pre>
 *
 * <p>Instances are thread safe and may be shared freely.
 */
@Value
public class RetryPolicy implements Validatable {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
  public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

  /** The longest delay a policy can produce without a {@link #getMaxDelay() maxDelay}. */
  public static final Duration MAX_REPRESENTABLE_DELAY = Duration.ofNanos(Long.MAX_VALUE);

  /**
   * @return The maximum number of times the operation will be invoked, including the first.
   */
  @SuppressWarnings("JavaDoc")
  int maxAttempts;

  /**
   * @return The wait before the second attempt.
   */
  @SuppressWarnings("JavaDoc")
  Duration initialDelay;

  /**
   * @return The factor by which the delay grows after each retryable failure.
   */
  @SuppressWarnings("JavaDoc")
  double backoffMultiplier;

  /**
   * @return The failures which may be retried.
   */
  @SuppressWarnings("JavaDoc")
  RetryableFailures retryableFailures;

  /**
   * @return The ceiling on any single delay, or null for none.
   */
  @SuppressWarnings("JavaDoc")
  Duration maxDelay;

  /**
   * @return The overall time budget for a single execution, or null for none.
   */
  @SuppressWarnings("JavaDoc")
  Duration deadline;

  /**
   * @param maxAttempts Defaults to {@link #DEFAULT_MAX_ATTEMPTS}. Must be at least 1.
   * @param initialDelay Defaults to {@link #DEFAULT_INITIAL_DELAY}. May not be negative.
   * @param backoffMultiplier Defaults to {@link #DEFAULT_BACKOFF_MULTIPLIER}. Must be at least 1.
   * @param retryableFailures Defaults to {@link RetryableFailures#all()}.
   * @param maxDelay Optional. If set, must be at least {@code initialDelay}.
   * @param deadline Optional. If set, must be positive.
   * @throws InvalidPolicyException If any of the above are violated.
   * @throws PolicyOverflowException If the delay would outgrow {@link #MAX_REPRESENTABLE_DELAY}
   *     before {@code maxAttempts} is reached and no {@code maxDelay} is set.
   */
  @Builder(toBuilder = true)
  private RetryPolicy(
      Integer maxAttempts,
      Duration initialDelay,
      Double backoffMultiplier,
      RetryableFailures retryableFailures,
      Duration maxDelay,
      Duration deadline) {
    this.maxAttempts = maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
    this.initialDelay = Utils.firstNonNull(initialDelay, () -> DEFAULT_INITIAL_DELAY);
    this.backoffMultiplier =
        backoffMultiplier == null ? DEFAULT_BACKOFF_MULTIPLIER : backoffMultiplier;
    this.retryableFailures = Utils.firstNonNull(retryableFailures, RetryableFailures::all);
    this.maxDelay = maxDelay;
    this.deadline = deadline;
    new Validator().validate(this);
    if (maxDelay == null && this.maxAttempts > 1) {
      delayAfterAttempt(this.maxAttempts - 1);
    }
  }

  /**
   * @return A policy with all defaults: 3 attempts, 1 second initial delay, doubling, every
   *     failure retryable.
   */
  public static RetryPolicy defaults() {
    return builder().build();
  }

  @Override
  public void validate(Validator validator) {
    validator.min("maxAttempts", maxAttempts, 1);
    validator.notNegative("initialDelay", initialDelay);
    validator.isTrue(
        "initialDelay",
        initialDelay.compareTo(MAX_REPRESENTABLE_DELAY) <= 0,
        "may not exceed %s",
        MAX_REPRESENTABLE_DELAY);
    validator.min("backoffMultiplier", backoffMultiplier, 1.0);
    validator.isTrue(
        "backoffMultiplier",
        !Double.isInfinite(backoffMultiplier),
        "must be finite");
    validator.notNull("retryableFailures", retryableFailures);
    if (maxDelay != null) {
      validator.isTrue(
          "maxDelay",
          maxDelay.compareTo(initialDelay) >= 0,
          "must be at least initialDelay (%s)",
          initialDelay);
    }
    validator.positiveOrNull("deadline", deadline);
  }

  /**
   * @param category The category of a failure.
   * @return True if failures of this category may be retried.
   */
  public boolean isRetryable(FailureCategory category) {
    return retryableFailures.contains(category);
  }

  /**
   * Calculates the wait after a failed attempt, before the next one.
   *
   * @param attempt The 1-based number of the attempt which just failed.
   * @return {@code initialDelay * backoffMultiplier^(attempt-1)}, clamped to {@code maxDelay}.
   * @throws PolicyOverflowException If the result is not representable and there is no {@code
   *     maxDelay}.
   */
  public Duration delayAfterAttempt(int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be at least 1");
    }
    if (initialDelay.isZero()) {
      return Duration.ZERO;
    }
    double nanos = initialDelay.toNanos() * Math.pow(backoffMultiplier, attempt - 1);
    if (Double.isNaN(nanos) || nanos >= Long.MAX_VALUE) {
      if (maxDelay != null) {
        return maxDelay;
      }
      throw new PolicyOverflowException(
          String.format(
              "Delay after attempt %d of %s * %s^%d exceeds %s. Set a maxDelay to clamp it.",
              attempt, initialDelay, backoffMultiplier, attempt - 1, MAX_REPRESENTABLE_DELAY));
    }
    Duration delay = Duration.ofNanos(Math.round(nanos));
    if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
      return maxDelay;
    }
    return delay;
  }

  /** Builder for {@link RetryPolicy}. */
  public static class RetryPolicyBuilder {

    /**
     * Restricts retries to the given categories.
     *
     * @param categories The retryable categories.
     * @return Builder.
     */
    public RetryPolicyBuilder retryOn(FailureCategory... categories) {
      this.retryableFailures = RetryableFailures.of(categories);
      return this;
    }

    /**
     * Retries every failure. This is the default.
     *
     * @return Builder.
     */
    public RetryPolicyBuilder retryOnAll() {
      this.retryableFailures = RetryableFailures.all();
      return this;
    }
  }
}

package com.gruelbox.retry;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Retries actions by name, looking them up in an {@link ActionRegistry}. Useful where the thing to
 * retry is chosen at runtime, such as a step in a test script.
 *
 * <p>Every failure is treated as retryable and the delay doubles after each attempt. Each run is
 * logged through a {@link LoggingAttemptObserver} named {@code action '<name>'}.
 */
@Slf4j
public final class NamedActionRetrier {

  public static final double BACKOFF_MULTIPLIER = 2.0;

  private final ActionRegistry registry;
  private final Sleeper sleeper;
  private final Supplier<Clock> clockProvider;
  private final AttemptObserver observer;

  /**
   * @param registry The actions. Required.
   * @param sleeper Defaults to {@link Sleeper#blocking()}.
   * @param clockProvider Defaults to the system clock.
   * @param observer Notified in addition to the logging observer. Optional.
   */
  @Builder
  private NamedActionRetrier(
      ActionRegistry registry,
      Sleeper sleeper,
      Supplier<Clock> clockProvider,
      AttemptObserver observer) {
    if (registry == null) {
      throw new IllegalArgumentException("registry may not be null");
    }
    this.registry = registry;
    this.sleeper = Utils.firstNonNull(sleeper, Sleeper::blocking);
    this.clockProvider = clockProvider == null ? Clock::systemDefaultZone : clockProvider;
    this.observer = Utils.firstNonNull(observer, () -> AttemptObserver.EMPTY);
  }

  /**
   * Runs the named action with up to {@link RetryPolicy#DEFAULT_MAX_ATTEMPTS} attempts, starting
   * with a {@link RetryPolicy#DEFAULT_INITIAL_DELAY} delay.
   *
   * @param actionName The registered name.
   * @return Whatever the action returned.
   * @throws UnknownActionException If there is no such action. Not retried.
   * @throws Exception Whatever the final attempt threw.
   */
  public Object retry(String actionName) throws Exception {
    return retry(actionName, RetryPolicy.DEFAULT_MAX_ATTEMPTS, RetryPolicy.DEFAULT_INITIAL_DELAY);
  }

  /**
   * Runs the named action until it succeeds or {@code maxAttempts} is reached.
   *
   * @param actionName The registered name.
   * @param maxAttempts The maximum number of attempts.
   * @param initialDelay The wait before the second attempt.
   * @return Whatever the action returned.
   * @throws UnknownActionException If there is no such action. Not retried.
   * @throws InvalidPolicyException If {@code maxAttempts} or {@code initialDelay} are invalid.
   * @throws Exception Whatever the final attempt threw.
   */
  public Object retry(String actionName, int maxAttempts, Duration initialDelay)
      throws Exception {
    FallibleOperation<?> action =
        registry.find(actionName).orElseThrow(() -> new UnknownActionException(actionName));
    RetryPolicy policy =
        RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .initialDelay(initialDelay)
            .backoffMultiplier(BACKOFF_MULTIPLIER)
            .retryOnAll()
            .build();
    RetryExecutor executor =
        RetryExecutor.builder().policy(policy).sleeper(sleeper).clockProvider(clockProvider).build();
    var logging =
        LoggingAttemptObserver.builder()
            .operationName("action '" + actionName + "'")
            .maxAttempts(maxAttempts)
            .build();
    log.debug("Running action '{}' with {}", actionName, policy);
    return executor.execute(action, logging.andThen(observer)).getOrThrow();
  }
}

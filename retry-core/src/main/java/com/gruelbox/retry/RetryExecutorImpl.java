package com.gruelbox.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class RetryExecutorImpl implements RetryExecutor, Validatable {

  @Getter private final RetryPolicy policy;
  private final FailureClassifier failureClassifier;
  private final Sleeper sleeper;
  private final Supplier<Clock> clockProvider;

  static RetryExecutorBuilder builder() {
    return new RetryExecutorBuilderImpl();
  }

  @Override
  public void validate(Validator validator) {
    validator.notNull("policy", policy);
    validator.notNull("failureClassifier", failureClassifier);
    validator.notNull("sleeper", sleeper);
    validator.notNull("clockProvider", clockProvider);
  }

  @Override
  public <T> ExecutionResult<T> execute(
      FallibleOperation<T> operation, AttemptObserver observer, CancellationToken cancellationToken) {
    if (operation == null) {
      throw new IllegalArgumentException("operation may not be null");
    }
    var listener = Utils.firstNonNull(observer, () -> AttemptObserver.EMPTY);
    var token = Utils.firstNonNull(cancellationToken, CancellationToken::create);
    Instant started = clockProvider.get().instant();
    List<AttemptRecord> attempts = new ArrayList<>();
    int attempt = 1;

    while (true) {
      final int attemptNumber = attempt;
      notify("notifying observer of attempt start", () -> listener.onAttemptStart(attemptNumber));

      T value;
      try {
        value = operation.call();
      } catch (Exception e) {
        Failure failure = classify(e);
        log.debug("Attempt {} failed with {}", attempt, failure.getCategory().name());

        if (!policy.isRetryable(failure.getCategory())) {
          attempts.add(AttemptRecord.terminal(attempt));
          return stop(listener, ExecutionOutcome.NON_RETRYABLE, failure, attempts);
        }
        if (attempt >= policy.getMaxAttempts()) {
          attempts.add(AttemptRecord.terminal(attempt));
          return stop(listener, ExecutionOutcome.ATTEMPTS_EXHAUSTED, failure, attempts);
        }

        Duration delay = policy.delayAfterAttempt(attempt);
        if (wouldOverrunDeadline(started, delay)) {
          log.debug("Waiting {} before attempt {} would exceed deadline", delay, attempt + 1);
          attempts.add(AttemptRecord.terminal(attempt));
          return stop(listener, ExecutionOutcome.TIMED_OUT, failure, attempts);
        }

        attempts.add(AttemptRecord.retrying(attempt, delay));
        notify(
            "notifying observer of retry",
            () ->
                listener.onRetryScheduled(
                    attemptNumber, failure.getCategory(), failure.getMessage(), delay));
        if (!await(delay, token)) {
          return stop(listener, ExecutionOutcome.CANCELLED, failure, attempts);
        }
        attempt++;
        continue;
      }

      attempts.add(AttemptRecord.success(attempt));
      notify(
          "notifying observer of success",
          () -> listener.onTerminal(ExecutionOutcome.SUCCEEDED, attemptNumber, null, null));
      return ExecutionResult.success(value, attempts);
    }
  }

  private Failure classify(Exception e) {
    FailureCategory category;
    try {
      category = failureClassifier.classify(e);
    } catch (RuntimeException classifierFailure) {
      log.error("Failure classifier threw on {}. Treating as unclassified.", e, classifierFailure);
      category = null;
    }
    return Failure.of(Utils.firstNonNull(category, () -> StandardFailureCategory.UNCLASSIFIED), e);
  }

  private boolean wouldOverrunDeadline(Instant started, Duration delay) {
    Duration deadline = policy.getDeadline();
    if (deadline == null) {
      return false;
    }
    Duration elapsed = Duration.between(started, clockProvider.get().instant());
    return elapsed.compareTo(deadline.minus(delay)) > 0;
  }

  private boolean await(Duration delay, CancellationToken token) {
    if (token.isCancelled()) {
      return false;
    }
    try {
      return sleeper.sleep(delay, token) && !token.isCancelled();
    } catch (InterruptedException e) {
      log.debug("Interrupted while waiting to retry");
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private <T> ExecutionResult<T> stop(
      AttemptObserver listener,
      ExecutionOutcome outcome,
      Failure failure,
      List<AttemptRecord> attempts) {
    int attemptsUsed = attempts.size();
    notify(
        "notifying observer of " + outcome.name().toLowerCase(),
        () ->
            listener.onTerminal(
                outcome, attemptsUsed, failure.getCategory(), failure.getMessage()));
    return ExecutionResult.failure(failure, outcome, attempts);
  }

  private void notify(String gerund, Runnable notification) {
    Utils.safelyRun(gerund, notification);
  }

  @ToString
  static class RetryExecutorBuilderImpl extends RetryExecutorBuilder {

    RetryExecutorBuilderImpl() {
      super();
    }

    @Override
    public RetryExecutorImpl build() {
      RetryExecutorImpl impl =
          new RetryExecutorImpl(
              policy,
              Utils.firstNonNull(failureClassifier, () -> FailureClassifier.DEFAULT),
              Utils.firstNonNull(sleeper, Sleeper::blocking),
              clockProvider == null ? Clock::systemDefaultZone : clockProvider);
      new Validator().validate(impl);
      return impl;
    }
  }
}

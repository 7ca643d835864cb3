package com.gruelbox.retry;

import java.time.Clock;
import java.util.function.Supplier;
import lombok.ToString;

/**
 * Runs a {@link FallibleOperation}, re-attempting it according to a {@link RetryPolicy}.
 *
 * <p>Usage:
 *
 * <pre>RetryExecutor executor = RetryExecutor.builder()
 *     .policy(RetryPolicy.builder().maxAttempts(5).retryOn(TRANSIENT).build())
 *     .build();
 * ExecutionResult&lt;String&gt; result = executor.execute(() -&gt; client.fetch("foo"), observer);</pre>
 *
 * <p>Executions are synchronous: the calling thread blocks in the {@link Sleeper} between
 * attempts. Instances hold no state between executions, so one executor may be used by any number
 * of threads at once.
 */
public interface RetryExecutor {

  /**
   * @return A builder for creating a new instance of {@link RetryExecutor}.
   */
  static RetryExecutorBuilder builder() {
    return RetryExecutorImpl.builder();
  }

  /**
   * @return The policy applied to every execution.
   */
  RetryPolicy getPolicy();

  /**
   * Calls {@link #execute(FallibleOperation, AttemptObserver, CancellationToken)} with no observer
   * and a token which is never cancelled.
   *
   * @param operation The operation.
   * @param <T> The result type.
   * @return The result.
   */
  default <T> ExecutionResult<T> execute(FallibleOperation<T> operation) {
    return execute(operation, AttemptObserver.EMPTY);
  }

  /**
   * Calls {@link #execute(FallibleOperation, AttemptObserver, CancellationToken)} with a token
   * which is never cancelled.
   *
   * @param operation The operation.
   * @param observer Notified of each attempt. May be null.
   * @param <T> The result type.
   * @return The result.
   */
  default <T> ExecutionResult<T> execute(FallibleOperation<T> operation, AttemptObserver observer) {
    return execute(operation, observer, CancellationToken.create());
  }

  /**
   * Invokes the operation until it succeeds, fails with a non-retryable failure, runs out of
   * attempts, runs out of time or is cancelled.
   *
   * <p>Failures are never thrown from this method. They are returned in the {@link
   * ExecutionResult}, with the original exception untouched; use {@link
   * ExecutionResult#getOrThrow()} if you want it thrown. {@link Error}s thrown by the operation are
   * not caught.
   *
   * @param operation The operation.
   * @param observer Notified of each attempt. May be null.
   * @param cancellationToken Cancelling this during a wait stops the execution with {@link
   *     ExecutionOutcome#CANCELLED}.
   * @param <T> The result type.
   * @return The result.
   */
  <T> ExecutionResult<T> execute(
      FallibleOperation<T> operation, AttemptObserver observer, CancellationToken cancellationToken);

  /**
   * Decorates an operation so that calling it retries transparently.
   *
   * @param operation The operation to decorate.
   * @param <T> The result type.
   * @return An operation which returns the result of a successful attempt, or throws as described
   *     in {@link ExecutionResult#getOrThrow()}.
   */
  default <T> FallibleOperation<T> wrap(FallibleOperation<T> operation) {
    return wrap(operation, AttemptObserver.EMPTY);
  }

  /**
   * Decorates an operation so that calling it retries transparently.
   *
   * @param operation The operation to decorate.
   * @param observer Notified of each attempt of every call.
   * @param <T> The result type.
   * @return An operation which returns the result of a successful attempt, or throws as described
   *     in {@link ExecutionResult#getOrThrow()}.
   */
  default <T> FallibleOperation<T> wrap(FallibleOperation<T> operation, AttemptObserver observer) {
    return () -> execute(operation, observer).getOrThrow();
  }

  /**
   * Returns a proxy of an interface where every method call is retried.
   *
   * <p>Usage:
   *
   * <pre>MessageProducer producer = executor.proxy(MessageProducer.class, kafkaProducer);
   * producer.send("topic", "payload"); // retried</pre>
   *
   * <p>Methods declared by {@link Object} are passed straight through.
   *
   * @param type The interface to proxy.
   * @param target The real implementation.
   * @param <T> The interface type.
   * @return The proxy.
   */
  default <T> T proxy(Class<T> type, T target) {
    return proxy(type, target, AttemptObserver.EMPTY);
  }

  /**
   * As {@link #proxy(Class, Object)}, notifying an observer of every attempt.
   *
   * @param type The interface to proxy.
   * @param target The real implementation.
   * @param observer Notified of each attempt of every call.
   * @param <T> The interface type.
   * @return The proxy.
   */
  default <T> T proxy(Class<T> type, T target, AttemptObserver observer) {
    return RetryingProxyFactory.createProxy(this, type, target, observer);
  }

  /** Builder for {@link RetryExecutor}. */
  @ToString
  abstract class RetryExecutorBuilder {

    protected RetryPolicy policy;
    protected FailureClassifier failureClassifier;
    protected Sleeper sleeper;
    protected Supplier<Clock> clockProvider;

    protected RetryExecutorBuilder() {}

    /**
     * @param policy The policy applied to every execution. Required.
     * @return Builder.
     */
    public RetryExecutorBuilder policy(RetryPolicy policy) {
      this.policy = policy;
      return this;
    }

    /**
     * @param failureClassifier Assigns a {@link FailureCategory} to each exception thrown by an
     *     operation. Defaults to {@link FailureClassifier#DEFAULT}.
     * @return Builder.
     */
    public RetryExecutorBuilder failureClassifier(FailureClassifier failureClassifier) {
      this.failureClassifier = failureClassifier;
      return this;
    }

    /**
     * @param sleeper Performs the waits between attempts. Defaults to {@link Sleeper#blocking()}.
     * @return Builder.
     */
    public RetryExecutorBuilder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * @param clockProvider The {@link Clock} source used to enforce {@link
     *     RetryPolicy#getDeadline()}. Generally only used for testing. Defaults to the system
     *     clock.
     * @return Builder.
     */
    public RetryExecutorBuilder clockProvider(Supplier<Clock> clockProvider) {
      this.clockProvider = clockProvider;
      return this;
    }

    /**
     * Creates and validates the {@link RetryExecutor}.
     *
     * @return The executor.
     */
    public abstract RetryExecutor build();
  }
}

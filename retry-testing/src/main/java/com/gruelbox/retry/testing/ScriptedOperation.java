package com.gruelbox.retry.testing;

import com.gruelbox.retry.FailureCategory;
import com.gruelbox.retry.FallibleOperation;
import com.gruelbox.retry.OperationFailedException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A {@link FallibleOperation} which follows a script: fail in these ways, then return this.
 *
 * <p>Usage:
 *
 * <pre>ScriptedOperation&lt;String&gt; op = ScriptedOperation.&lt;String&gt;failing(TRANSIENT, 2)
 *     .thenReturning("ok");</pre>
 *
 * <p>Each instance keeps its own invocation count and is safe to call from multiple threads,
 * though the order of the script is then shared between them.
 *
 * @param <T> The result type.
 */
public final class ScriptedOperation<T> implements FallibleOperation<T> {

  private final List<FailureCategory> failures;
  private final boolean succeeds;
  private final T value;
  private final AtomicInteger invocations = new AtomicInteger();

  private ScriptedOperation(List<FailureCategory> failures, boolean succeeds, T value) {
    this.failures = List.copyOf(failures);
    this.succeeds = succeeds;
    this.value = value;
  }

  /**
   * @param category The category of the failures.
   * @param times How many times to fail before the rest of the script.
   * @param <T> The result type.
   * @return A script builder.
   */
  public static <T> Script<T> failing(FailureCategory category, int times) {
    return new Script<T>().thenFailing(category, times);
  }

  /**
   * @param value The value to return on the first call.
   * @param <T> The result type.
   * @return An operation which always succeeds.
   */
  public static <T> ScriptedOperation<T> returning(T value) {
    return new Script<T>().thenReturning(value);
  }

  /**
   * @param category The category of every failure.
   * @param <T> The result type.
   * @return An operation which never succeeds.
   */
  public static <T> ScriptedOperation<T> alwaysFailing(FailureCategory category) {
    return new ScriptedOperation<>(List.of(category), false, null);
  }

  @Override
  public T call() throws OperationFailedException {
    int invocation = invocations.incrementAndGet();
    if (invocation <= failures.size()) {
      FailureCategory category = failures.get(invocation - 1);
      throw new OperationFailedException(category, category.name() + " on call " + invocation);
    }
    if (!succeeds) {
      FailureCategory category = failures.get(failures.size() - 1);
      throw new OperationFailedException(category, category.name() + " on call " + invocation);
    }
    return value;
  }

  /**
   * @return The number of times {@link #call()} has been invoked.
   */
  public int getInvocations() {
    return invocations.get();
  }

  /** Builder for {@link ScriptedOperation}. */
  public static final class Script<T> {

    private final List<FailureCategory> failures = new ArrayList<>();

    private Script() {}

    public Script<T> thenFailing(FailureCategory category, int times) {
      for (int i = 0; i < times; i++) {
        failures.add(category);
      }
      return this;
    }

    public ScriptedOperation<T> thenReturning(T value) {
      return new ScriptedOperation<>(failures, true, value);
    }

    public ScriptedOperation<T> thenFailingForever() {
      if (failures.isEmpty()) {
        throw new IllegalStateException("Nothing to repeat");
      }
      return new ScriptedOperation<>(failures, false, null);
    }
  }
}

package com.gruelbox.retry;

/**
 * A zero-argument unit of work which either returns a value or throws.
 *
 * @param <T> The result type.
 */
@FunctionalInterface
public interface FallibleOperation<T> {

  T call() throws Exception;
}

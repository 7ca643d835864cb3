package com.gruelbox.retry;

/**
 * A caller-defined classification of why an operation failed. The library never interprets a
 * category beyond comparing it against {@link RetryPolicy#getRetryableFailures()}, so any
 * enumeration can implement this interface to plug in its own taxonomy.
 *
 * <p>Implementations must have sensible {@code equals}/{@code hashCode}. Enums are ideal.
 */
public interface FailureCategory {

  /**
   * @return A short, stable name for the category, used in logs and configuration files.
   */
  String name();
}

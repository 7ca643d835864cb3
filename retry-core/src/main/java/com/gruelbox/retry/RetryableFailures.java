package com.gruelbox.retry;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

/**
 * The set of {@link FailureCategory}s a {@link RetryPolicy} will retry. Either an explicit set or
 * "everything".
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RetryableFailures {

  private static final RetryableFailures ALL = new RetryableFailures(true, Set.of());

  private final boolean all;
  private final Set<FailureCategory> categories;

  /**
   * @return Every failure is retryable.
   */
  public static RetryableFailures all() {
    return ALL;
  }

  /**
   * @return No failure is retryable. Only one attempt will ever be made.
   */
  public static RetryableFailures none() {
    return new RetryableFailures(false, Set.of());
  }

  /**
   * @param categories The categories to retry.
   * @return Only failures in {@code categories} are retryable.
   */
  public static RetryableFailures of(FailureCategory... categories) {
    return of(Arrays.asList(categories));
  }

  /**
   * @param categories The categories to retry.
   * @return Only failures in {@code categories} are retryable.
   */
  public static RetryableFailures of(Collection<? extends FailureCategory> categories) {
    if (categories.stream().anyMatch(it -> it == null)) {
      throw new InvalidPolicyException("RetryPolicy.retryableFailures may not contain null");
    }
    return new RetryableFailures(false, Set.copyOf(categories));
  }

  /**
   * @param category The category of a failure.
   * @return True if a failure of this category may be retried.
   */
  public boolean contains(FailureCategory category) {
    return all || categories.contains(category);
  }

  /**
   * @return True if this matches everything.
   */
  public boolean isAll() {
    return all;
  }

  /**
   * @return The explicit categories. Empty if {@link #isAll()}.
   */
  public Set<FailureCategory> getCategories() {
    return categories;
  }

  @Override
  public String toString() {
    if (all) {
      return "ALL";
    }
    return categories.stream()
        .map(FailureCategory::name)
        .sorted()
        .collect(Collectors.joining(",", "[", "]"));
  }
}

package com.gruelbox.retry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps an exception thrown by an operation to a {@link FailureCategory}.
 *
 * <p>Use {@link #DEFAULT} when operations throw {@link CategorizedFailure}s, or {@link
 * #byExceptionType()} to classify third-party exceptions by their type.
 */
@FunctionalInterface
public interface FailureClassifier {

  /**
   * Uses the category of any {@link CategorizedFailure}, falling back to {@link
   * StandardFailureCategory#UNCLASSIFIED}.
   */
  FailureClassifier DEFAULT =
      e -> {
        if (e instanceof CategorizedFailure) {
          FailureCategory category = ((CategorizedFailure) e).getCategory();
          if (category != null) {
            return category;
          }
        }
        return StandardFailureCategory.UNCLASSIFIED;
      };

  /**
   * @param failure The exception thrown by the operation.
   * @return The category. Never null.
   */
  FailureCategory classify(Exception failure);

  /**
   * @return A builder for a classifier which matches exception types in the order they were
   *     registered, including subclasses.
   */
  static ByExceptionTypeBuilder byExceptionType() {
    return new ByExceptionTypeBuilder();
  }

  /** Builder for {@link #byExceptionType()}. */
  final class ByExceptionTypeBuilder {

    private final Map<Class<? extends Exception>, FailureCategory> mappings =
        new LinkedHashMap<>();
    private FailureClassifier fallback = DEFAULT;

    private ByExceptionTypeBuilder() {}

    /**
     * @param type The exception type, matched using {@code instanceof} semantics.
     * @param category The category to assign.
     * @return Builder.
     */
    public ByExceptionTypeBuilder map(Class<? extends Exception> type, FailureCategory category) {
      if (type == null || category == null) {
        throw new IllegalArgumentException("type and category may not be null");
      }
      mappings.put(type, category);
      return this;
    }

    /**
     * @param fallback Used when no mapping matches. Defaults to {@link #DEFAULT}.
     * @return Builder.
     */
    public ByExceptionTypeBuilder otherwise(FailureClassifier fallback) {
      this.fallback = fallback;
      return this;
    }

    public FailureClassifier build() {
      var ordered = new LinkedHashMap<>(mappings);
      var otherwise = Utils.firstNonNull(fallback, () -> DEFAULT);
      if (ordered.isEmpty()) {
        return otherwise;
      }
      return e -> {
        for (var mapping : ordered.entrySet()) {
          if (mapping.getKey().isInstance(e)) {
            return mapping.getValue();
          }
        }
        return otherwise.classify(e);
      };
    }
  }
}

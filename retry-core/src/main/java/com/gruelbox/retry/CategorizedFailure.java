package com.gruelbox.retry;

/**
 * Implemented by exceptions which know their own {@link FailureCategory}. {@link
 * FailureClassifier#DEFAULT} uses this to classify failures without any configuration.
 */
public interface CategorizedFailure {

  FailureCategory getCategory();
}

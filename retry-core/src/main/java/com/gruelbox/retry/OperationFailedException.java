package com.gruelbox.retry;

import lombok.Getter;

/**
 * A convenient, checked exception for operations to throw when they want to state explicitly how
 * their failure should be classified.
 */
public class OperationFailedException extends Exception implements CategorizedFailure {

  @Getter private final FailureCategory category;

  public OperationFailedException(FailureCategory category, String message) {
    super(message);
    this.category = category;
  }

  public OperationFailedException(FailureCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = category;
  }
}

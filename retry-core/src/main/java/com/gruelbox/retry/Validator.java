package com.gruelbox.retry;

import java.time.Duration;

final class Validator {

  private final String path;

  Validator() {
    this.path = "";
  }

  private Validator(String className) {
    this.path = className;
  }

  void validate(Validatable validatable) {
    validatable.validate(new Validator(validatable.getClass().getSimpleName()));
  }

  void notNull(String propertyName, Object object) {
    if (object == null) {
      error(propertyName, "may not be null");
    }
  }

  void isTrue(String propertyName, boolean condition, String message, Object... args) {
    if (!condition) {
      error(propertyName, String.format(message, args));
    }
  }

  void min(String propertyName, int object, int minimumValue) {
    if (object < minimumValue) {
      error(propertyName, "must be greater than " + (minimumValue - 1));
    }
  }

  void min(String propertyName, double object, double minimumValue) {
    // Negated so that NaN fails
    if (!(object >= minimumValue)) {
      error(propertyName, "must be at least " + minimumValue);
    }
  }

  void notNegative(String propertyName, Duration object) {
    notNull(propertyName, object);
    if (object.isNegative()) {
      error(propertyName, "may not be negative");
    }
  }

  void positiveOrNull(String propertyName, Duration object) {
    if (object != null && (object.isNegative() || object.isZero())) {
      error(propertyName, "must be positive");
    }
  }

  private void error(String propertyName, String message) {
    throw new InvalidPolicyException(
        (path.isEmpty() ? "" : path + ".") + propertyName + " " + message);
  }
}

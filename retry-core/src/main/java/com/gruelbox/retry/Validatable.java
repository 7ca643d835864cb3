package com.gruelbox.retry;

/** Implemented by configuration objects which check their own invariants using a {@link Validator}. */
interface Validatable {

  void validate(Validator validator);
}

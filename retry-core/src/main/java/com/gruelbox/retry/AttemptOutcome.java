package com.gruelbox.retry;

/** How a single attempt ended. */
public enum AttemptOutcome {
  SUCCESS,
  RETRYABLE_FAILURE,
  TERMINAL_FAILURE
}

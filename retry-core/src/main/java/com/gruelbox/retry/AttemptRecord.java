package com.gruelbox.retry;

import java.time.Duration;
import lombok.Value;

/** What happened on one attempt of an execution. */
@Value
public class AttemptRecord {

  int attemptNumber;
  AttemptOutcome outcome;

  /** The wait scheduled before the next attempt. Only set for {@link AttemptOutcome#RETRYABLE_FAILURE}. */
  Duration nextDelay;

  static AttemptRecord success(int attemptNumber) {
    return new AttemptRecord(attemptNumber, AttemptOutcome.SUCCESS, null);
  }

  static AttemptRecord retrying(int attemptNumber, Duration nextDelay) {
    return new AttemptRecord(attemptNumber, AttemptOutcome.RETRYABLE_FAILURE, nextDelay);
  }

  static AttemptRecord terminal(int attemptNumber) {
    return new AttemptRecord(attemptNumber, AttemptOutcome.TERMINAL_FAILURE, null);
  }
}

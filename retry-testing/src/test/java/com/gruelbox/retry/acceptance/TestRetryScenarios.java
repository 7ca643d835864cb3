package com.gruelbox.retry.acceptance;

import static com.gruelbox.retry.StandardFailureCategory.PERMISSION_DENIED;
import static com.gruelbox.retry.StandardFailureCategory.TRANSIENT;
import static java.time.Duration.ofSeconds;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gruelbox.retry.ExecutionOutcome;
import com.gruelbox.retry.ExecutionResult;
import com.gruelbox.retry.RetryExecutor;
import com.gruelbox.retry.RetryPolicy;
import com.gruelbox.retry.testing.RecordingAttemptObserver;
import com.gruelbox.retry.testing.RecordingSleeper;
import com.gruelbox.retry.testing.ScriptedOperation;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class TestRetryScenarios {

  private static final RetryPolicy POLICY =
      RetryPolicy.builder()
          .maxAttempts(3)
          .initialDelay(ofSeconds(1))
          .backoffMultiplier(2.0)
          .retryOn(TRANSIENT)
          .build();

  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final RecordingAttemptObserver observer = new RecordingAttemptObserver();

  private RetryExecutor executor(RetryPolicy policy) {
    return RetryExecutor.builder().policy(policy).sleeper(sleeper).build();
  }

  @Test
  void transientFailuresThenSuccess() {
    var operation = ScriptedOperation.<String>failing(TRANSIENT, 2).thenReturning("sent");

    ExecutionResult<String> result = executor(POLICY).execute(operation, observer);

    assertTrue(result.isSuccess());
    assertEquals("sent", result.getValue());
    assertEquals(3, result.getAttemptsUsed());
    assertThat(observer.getScheduledDelays(), contains(ofSeconds(1), ofSeconds(2)));
    assertThat(observer.getAttemptStarts(), contains(1, 2, 3));
    assertEquals(ExecutionOutcome.SUCCEEDED, observer.getTerminal().getOutcome());
  }

  @Test
  void alwaysTransient() {
    var operation = ScriptedOperation.<String>alwaysFailing(TRANSIENT);

    ExecutionResult<String> result = executor(POLICY).execute(operation, observer);

    assertEquals(ExecutionOutcome.ATTEMPTS_EXHAUSTED, result.getOutcome());
    assertEquals(3, result.getAttemptsUsed());
    assertEquals(3, operation.getInvocations());
    assertThat(observer.getScheduledDelays(), contains(ofSeconds(1), ofSeconds(2)));
    var terminal = observer.getTerminal();
    assertEquals(TRANSIENT, terminal.getCategory());
    assertEquals("TRANSIENT on call 3", terminal.getMessage());
  }

  @Test
  void permissionDeniedIsNotRetried() {
    var operation = ScriptedOperation.<String>alwaysFailing(PERMISSION_DENIED);

    ExecutionResult<String> result = executor(POLICY).execute(operation, observer);

    assertEquals(ExecutionOutcome.NON_RETRYABLE, result.getOutcome());
    assertEquals(1, result.getAttemptsUsed());
    assertThat(observer.getScheduledDelays(), empty());
    assertThat(sleeper.getSleeps(), empty());
    assertEquals(PERMISSION_DENIED, result.getFailure().getCategory());
  }

  @Test
  void singleAttemptPolicy() {
    var operation = ScriptedOperation.<String>alwaysFailing(TRANSIENT);

    ExecutionResult<String> result =
        executor(POLICY.toBuilder().maxAttempts(1).build()).execute(operation, observer);

    assertEquals(1, operation.getInvocations());
    assertEquals(1, result.getAttemptsUsed());
    assertEquals(ExecutionOutcome.ATTEMPTS_EXHAUSTED, result.getOutcome());
    assertThat(sleeper.getSleeps(), empty());
  }

  @Test
  void observedDelaysMatchTheWaits() {
    RetryPolicy policy =
        RetryPolicy.builder()
            .maxAttempts(6)
            .initialDelay(Duration.ofMillis(10))
            .backoffMultiplier(3.0)
            .build();

    executor(policy).execute(ScriptedOperation.alwaysFailing(TRANSIENT), observer);

    List<Duration> expected =
        List.of(
            Duration.ofMillis(10),
            Duration.ofMillis(30),
            Duration.ofMillis(90),
            Duration.ofMillis(270),
            Duration.ofMillis(810));
    assertEquals(expected, observer.getScheduledDelays());
    assertEquals(expected, sleeper.getSleeps());
  }

  @Test
  void attemptsUsedStaysWithinBounds() {
    for (int maxAttempts = 1; maxAttempts <= 6; maxAttempts++) {
      RetryPolicy policy =
          RetryPolicy.builder().maxAttempts(maxAttempts).initialDelay(Duration.ZERO).build();
      for (int failures = 0; failures <= 7; failures++) {
        var result =
            executor(policy)
                .execute(ScriptedOperation.failing(TRANSIENT, failures).thenReturning("x"));
        assertThat(result.getAttemptsUsed(), greaterThanOrEqualTo(1));
        assertThat(result.getAttemptsUsed(), lessThanOrEqualTo(maxAttempts));
        assertEquals(failures < maxAttempts, result.isSuccess());
      }
    }
  }

  @Test
  void separateExecutorsOverOnePolicyAgree() {
    var first =
        executor(POLICY).execute(ScriptedOperation.<String>failing(TRANSIENT, 5).thenReturning("x"));
    var second =
        executor(POLICY).execute(ScriptedOperation.<String>failing(TRANSIENT, 5).thenReturning("x"));

    assertEquals(first.getOutcome(), second.getOutcome());
    assertEquals(first.getAttemptsUsed(), second.getAttemptsUsed());
    assertEquals(first.getAttempts(), second.getAttempts());
    assertEquals(first.getFailure().getCategory(), second.getFailure().getCategory());
    assertEquals(first.getFailure().getMessage(), second.getFailure().getMessage());
    assertNull(first.getValue());
  }

  @Test
  void oneExecutorRunsIndependentExecutions() {
    RetryExecutor executor = executor(POLICY);

    var failed = executor.execute(ScriptedOperation.<String>alwaysFailing(TRANSIENT));
    var succeeded = executor.execute(ScriptedOperation.returning("fresh"));

    assertEquals(3, failed.getAttemptsUsed());
    assertEquals(1, succeeded.getAttemptsUsed());
    assertEquals("fresh", succeeded.getValue());
  }
}

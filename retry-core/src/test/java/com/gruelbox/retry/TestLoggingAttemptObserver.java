package com.gruelbox.retry;

import static com.gruelbox.retry.StandardFailureCategory.PERMISSION_DENIED;
import static com.gruelbox.retry.StandardFailureCategory.TRANSIENT;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TestLoggingAttemptObserver {

  private final Logger logger = (Logger) LoggerFactory.getLogger("test.retry.logging");
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

  @BeforeEach
  void setUp() {
    appender.start();
    logger.addAppender(appender);
    logger.setLevel(Level.DEBUG);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  private LoggingAttemptObserver observer(org.slf4j.event.Level retryLevel) {
    return LoggingAttemptObserver.builder()
        .operationName("publish")
        .maxAttempts(3)
        .logger(logger)
        .logLevelRetry(retryLevel)
        .build();
  }

  private List<String> lines() {
    return appender.list.stream()
        .map(e -> e.getLevel() + " " + e.getFormattedMessage())
        .collect(Collectors.toList());
  }

  @Test
  void retriedThenSucceeded() {
    var observer = observer(null);
    observer.onAttemptStart(1);
    observer.onRetryScheduled(1, TRANSIENT, "timeout", Duration.ofSeconds(1));
    observer.onAttemptStart(2);
    observer.onTerminal(ExecutionOutcome.SUCCEEDED, 2, null, null);

    assertThat(
        lines(),
        contains(
            "INFO Attempt 1/3 for publish",
            "WARN Attempt 1 failed for publish: [TRANSIENT] timeout. Retrying in PT1S...",
            "INFO Attempt 2/3 for publish",
            "INFO Success on attempt 2 for publish"));
  }

  @Test
  void exhaustedAndNonRetryableAreDistinguishable() {
    var observer = observer(org.slf4j.event.Level.INFO);
    observer.onTerminal(ExecutionOutcome.ATTEMPTS_EXHAUSTED, 3, TRANSIENT, "timeout");
    observer.onTerminal(ExecutionOutcome.NON_RETRYABLE, 1, PERMISSION_DENIED, "forbidden");

    assertThat(
        lines(),
        contains(
            "ERROR All 3 attempts failed for publish. Last error: [TRANSIENT] timeout",
            "ERROR Non-retryable failure for publish on attempt 1: [PERMISSION_DENIED] forbidden"));
  }

  @Test
  void retryLevelIsConfigurable() {
    observer(org.slf4j.event.Level.DEBUG)
        .onRetryScheduled(2, TRANSIENT, "timeout", Duration.ofMillis(500));

    assertThat(
        lines(),
        contains("DEBUG Attempt 2 failed for publish: [TRANSIENT] timeout. Retrying in PT0.5S..."));
  }

  @Test
  void worksAsAnExecutorObserver() {
    RetryExecutor executor =
        RetryExecutor.builder()
            .policy(RetryPolicy.builder().maxAttempts(3).retryOn(TRANSIENT).build())
            .sleeper((duration, token) -> true)
            .build();

    executor.execute(
        () -> {
          throw new OperationFailedException(PERMISSION_DENIED, "forbidden");
        },
        observer(null));

    assertThat(
        lines(),
        contains(
            "INFO Attempt 1/3 for publish",
            "ERROR Non-retryable failure for publish on attempt 1: [PERMISSION_DENIED] forbidden"));
  }
}

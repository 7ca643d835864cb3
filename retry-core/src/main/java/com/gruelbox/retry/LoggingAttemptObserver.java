package com.gruelbox.retry;

import java.time.Duration;
import lombok.Builder;
import lombok.ToString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * An {@link AttemptObserver} which writes each event to SLF4J.
 *
 * <p>Usage:
 *
 * <pre>executor.execute(
 *     () -&gt; producer.send(record),
 *     LoggingAttemptObserver.builder().operationName("send to orders").maxAttempts(5).build());</pre>
 */
@ToString
public final class LoggingAttemptObserver implements AttemptObserver {

  private final String operationName;
  private final int maxAttempts;
  @ToString.Exclude private final Logger logger;
  private final Level logLevelRetry;

  /**
   * @param operationName Included in every message. Defaults to {@code "operation"}.
   * @param maxAttempts Used to render "attempt n/max". Omitted from messages if less than 1.
   * @param logger Where to log. Defaults to this class's logger.
   * @param logLevelRetry The level for retryable failures. Defaults to {@link Level#WARN}.
   */
  @Builder
  private LoggingAttemptObserver(
      String operationName, int maxAttempts, Logger logger, Level logLevelRetry) {
    this.operationName = Utils.firstNonNull(operationName, () -> "operation");
    this.maxAttempts = maxAttempts;
    this.logger =
        Utils.firstNonNull(logger, () -> LoggerFactory.getLogger(LoggingAttemptObserver.class));
    this.logLevelRetry = Utils.firstNonNull(logLevelRetry, () -> Level.WARN);
  }

  /**
   * @param operationName Included in every message.
   * @return An observer with default settings.
   */
  public static LoggingAttemptObserver forOperation(String operationName) {
    return builder().operationName(operationName).build();
  }

  @Override
  public void onAttemptStart(int attemptNumber) {
    if (maxAttempts > 0) {
      logger.info("Attempt {}/{} for {}", attemptNumber, maxAttempts, operationName);
    } else {
      logger.info("Attempt {} for {}", attemptNumber, operationName);
    }
  }

  @Override
  public void onRetryScheduled(
      int attemptNumber, FailureCategory failureCategory, String failureMessage, Duration nextDelay) {
    Utils.logAtLevel(
        logger,
        logLevelRetry,
        "Attempt {} failed for {}: [{}] {}. Retrying in {}...",
        attemptNumber,
        operationName,
        failureCategory.name(),
        failureMessage,
        nextDelay);
  }

  @Override
  public void onTerminal(
      ExecutionOutcome outcome,
      int attemptsUsed,
      FailureCategory failureCategory,
      String failureMessage) {
    switch (outcome) {
      case SUCCEEDED:
        if (attemptsUsed > 1) {
          logger.info("Success on attempt {} for {}", attemptsUsed, operationName);
        } else {
          logger.debug("Success on first attempt for {}", operationName);
        }
        break;
      case ATTEMPTS_EXHAUSTED:
        logger.error(
            "All {} attempts failed for {}. Last error: [{}] {}",
            attemptsUsed,
            operationName,
            failureCategory.name(),
            failureMessage);
        break;
      case NON_RETRYABLE:
        logger.error(
            "Non-retryable failure for {} on attempt {}: [{}] {}",
            operationName,
            attemptsUsed,
            failureCategory.name(),
            failureMessage);
        break;
      case CANCELLED:
        logger.warn("Retry of {} cancelled after {} attempt(s)", operationName, attemptsUsed);
        break;
      case TIMED_OUT:
        logger.warn(
            "Gave up on {} after {} attempt(s): deadline reached. Last error: [{}] {}",
            operationName,
            attemptsUsed,
            failureCategory.name(),
            failureMessage);
        break;
      default:
        logger.warn("Unexpected outcome {} for {}", outcome, operationName);
    }
  }
}

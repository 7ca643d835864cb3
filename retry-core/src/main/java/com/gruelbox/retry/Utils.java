package com.gruelbox.retry;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Utility methods used across the retry modules. These are very firmly {@link NotApi}. Don't use
 * them in your code as they may be modified or removed without warning.
 */
@Slf4j
@NotApi
public final class Utils {

  private Utils() {}

  /**
   * Runs the supplied callback, logging and then discarding anything it throws other than a {@link
   * VirtualMachineError}.
   *
   * @param gerund What the callback does, for the log message ("notifying observer").
   * @param runnable The callback.
   * @return true if the callback completed normally.
   */
  public static boolean safelyRun(String gerund, Runnable runnable) {
    try {
      runnable.run();
      return true;
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Throwable e) {
      log.error("Error when {}", gerund, e);
      return false;
    }
  }

  public static <T> T firstNonNull(T one, Supplier<T> two) {
    if (one == null) return two.get();
    return one;
  }

  public static boolean logAtLevel(Logger logger, Level level, String message, Object... args) {
    switch (level) {
      case ERROR:
        if (logger.isErrorEnabled()) {
          logger.error(message, args);
          return true;
        } else {
          return false;
        }
      case WARN:
        if (logger.isWarnEnabled()) {
          logger.warn(message, args);
          return true;
        } else {
          return false;
        }
      case INFO:
        if (logger.isInfoEnabled()) {
          logger.info(message, args);
          return true;
        } else {
          return false;
        }
      case DEBUG:
        if (logger.isDebugEnabled()) {
          logger.debug(message, args);
          return true;
        } else {
          return false;
        }
      case TRACE:
        if (logger.isTraceEnabled()) {
          logger.trace(message, args);
          return true;
        } else {
          return false;
        }
      default:
        return logAtLevel(logger, Level.WARN, message, args);
    }
  }
}

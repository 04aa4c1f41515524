package io.github.panghy.asynctest.util;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers for the event loop. Messages are routed through JUL with the source class
 * and method of the caller rather than of this helper, and debug messages can be supplied
 * lazily so that per-iteration loop diagnostics cost nothing when FINE is disabled.
 */
public final class LoggingUtil {

  private LoggingUtil() {
  }

  /**
   * Finds the first stack frame that does not belong to this class.
   */
  private static StackTraceElement getCaller() {
    StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // 0=getStackTrace, 1=getCaller, 2=log, 3=debug/warn/error
    for (int i = 3; i < stack.length; i++) {
      StackTraceElement element = stack[i];
      if (!element.getClassName().equals(LoggingUtil.class.getName())) {
        return element;
      }
    }
    return stack[stack.length - 1];
  }

  private static void log(Logger logger, Level level, String message, Throwable throwable) {
    StackTraceElement caller = getCaller();
    if (throwable == null) {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message);
    } else {
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message, throwable);
    }
  }

  /**
   * Logs a debug message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void debug(Logger logger, String message) {
    if (logger.isLoggable(Level.FINE)) {
      log(logger, Level.FINE, message, null);
    }
  }

  /**
   * Logs a lazily built debug message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message Supplier of the message, only invoked when FINE is enabled
   */
  public static void debug(Logger logger, Supplier<String> message) {
    if (logger.isLoggable(Level.FINE)) {
      log(logger, Level.FINE, message.get(), null);
    }
  }

  /**
   * Logs a warning message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void warn(Logger logger, String message) {
    if (logger.isLoggable(Level.WARNING)) {
      log(logger, Level.WARNING, message, null);
    }
  }

  /**
   * Logs an error message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void error(Logger logger, String message) {
    if (logger.isLoggable(Level.SEVERE)) {
      log(logger, Level.SEVERE, message, null);
    }
  }

  /**
   * Logs an error message together with the exception that caused it.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void error(Logger logger, String message, Throwable throwable) {
    if (logger.isLoggable(Level.SEVERE)) {
      log(logger, Level.SEVERE, message, throwable);
    }
  }
}

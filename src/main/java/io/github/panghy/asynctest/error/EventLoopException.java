package io.github.panghy.asynctest.error;

/**
 * Base class of all errors raised by the event loop.
 *
 * <p>Two families derive from it: {@link UsageException} for programming mistakes in the
 * test itself, and {@link ResolutionException} for expectations that the code under test
 * failed to meet.</p>
 */
public class EventLoopException extends RuntimeException {

  /**
   * Creates a new event loop exception with the specified message.
   *
   * @param message The error message
   */
  public EventLoopException(String message) {
    super(message);
  }

  /**
   * Creates a new event loop exception with the specified message and cause.
   *
   * @param message The error message
   * @param cause   The underlying cause
   */
  public EventLoopException(String message, Throwable cause) {
    super(message, cause);
  }
}

package io.github.panghy.asynctest.error;

/**
 * Thrown when the event loop is used incorrectly: an unknown or duplicate done tag, an
 * invalid done specification, or running a loop that has nothing scheduled or has already
 * run. Usage errors are always fatal to the current test.
 */
public class UsageException extends EventLoopException {

  public UsageException(String message) {
    super(message);
  }
}

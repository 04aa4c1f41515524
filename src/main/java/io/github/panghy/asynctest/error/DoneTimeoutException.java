package io.github.panghy.asynctest.error;

/**
 * Raised by the timeout guard of a done item whose deadline elapsed before it was resolved.
 */
public class DoneTimeoutException extends ResolutionException {

  private final long timeoutMs;

  /**
   * Creates a new timeout exception.
   *
   * @param tag       The tag of the done item that timed out
   * @param message   The composed error message
   * @param timeoutMs The timeout that elapsed, in milliseconds
   */
  public DoneTimeoutException(String tag, String message, long timeoutMs) {
    super(Kind.TIMEOUT, tag, message);
    this.timeoutMs = timeoutMs;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }
}

package io.github.panghy.asynctest.loop;

/**
 * Final state of an event loop. A loop starts in {@link #NOT_COMPLETE} and moves to one of
 * the terminal states exactly once.
 */
public enum CompletionState {
  /** The loop has not finished yet. */
  NOT_COMPLETE,
  /** The queue drained without any error being raised. */
  SUCCESS,
  /** An error was raised or a done item timed out. */
  ERROR,
  /** The loop was stopped by {@link EventLoop#abort()}. */
  ABORTED;

  public boolean isTerminal() {
    return this != NOT_COMPLETE;
  }
}

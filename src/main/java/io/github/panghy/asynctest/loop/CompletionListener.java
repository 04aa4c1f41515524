package io.github.panghy.asynctest.loop;

/**
 * Notified once when an event loop run finishes, whatever its outcome. Test harnesses use
 * this to aggregate results across many loops.
 */
@FunctionalInterface
public interface CompletionListener {

  /**
   * Called after the loop has released its lock, on the thread that ran the loop.
   *
   * @param result The outcome of the run
   */
  void onComplete(LoopResult result);
}

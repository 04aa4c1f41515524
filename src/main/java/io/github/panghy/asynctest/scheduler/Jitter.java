package io.github.panghy.asynctest.scheduler;

import java.util.Random;

/**
 * Random perturbation of scheduled fire times, emulating the variance of real asynchronous
 * completions.
 */
public final class Jitter {

  private Jitter() {
  }

  /**
   * Computes the half width of the jitter window for a delay.
   *
   * @param delayMs   The nominal delay, non-negative
   * @param jitterPct Percentage of the delay used as the window
   * @return {@code delayMs * jitterPct / 100}, using integer arithmetic
   */
  public static long window(long delayMs, int jitterPct) {
    return (delayMs * jitterPct) / 100;
  }

  /**
   * Draws a random offset for a delay.
   *
   * @param random    Source of randomness
   * @param delayMs   The nominal delay, non-negative
   * @param jitterPct Percentage of the delay used as the window, 0 disables jitter
   * @return An offset uniformly distributed in {@code [-window, +window)}, or 0 if the window
   *     is empty
   */
  public static long offset(Random random, long delayMs, int jitterPct) {
    long window = window(delayMs, jitterPct);
    if (window <= 0) {
      return 0;
    }
    return random.nextLong(2 * window) - window;
  }
}

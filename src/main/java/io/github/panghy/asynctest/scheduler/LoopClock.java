package io.github.panghy.asynctest.scheduler;

import java.util.concurrent.locks.Condition;

/**
 * Time source of an event loop. Different implementations of this interface provide either
 * real time or simulated time for fully deterministic runs.
 *
 * <p>Besides telling the time, the clock owns the single suspension point of the loop:
 * {@link #park(Condition, long)} is called with the loop's lock held and is the only place
 * where other threads get a chance to acquire that lock.</p>
 */
public interface LoopClock {

  /**
   * Returns the current time in milliseconds.
   *
   * @return Current time in milliseconds
   */
  long currentTimeMillis();

  /**
   * Determines if this clock implementation uses simulated time.
   *
   * @return true if time only moves when the loop parks, false for wall-clock time
   */
  boolean isSimulated();

  /**
   * Suspends the loop for up to {@code millis} milliseconds.
   *
   * <p>The caller holds the lock that owns {@code condition}. A real clock awaits the
   * condition, releasing the lock while blocked and reacquiring it before returning. The
   * wait may end early when the condition is signalled. A simulated clock advances its time
   * instead and never releases the lock.</p>
   *
   * @param condition The condition of the loop lock, signalled on state changes
   * @param millis    The maximum time to park, must be positive
   * @throws InterruptedException if the loop thread is interrupted while parked
   */
  void park(Condition condition, long millis) throws InterruptedException;

  /**
   * Creates a clock backed by the system time.
   *
   * @return A new instance of a real-time clock
   */
  static LoopClock createRealClock() {
    return new RealClock();
  }

  /**
   * Creates a simulated clock starting at time zero.
   *
   * @return A new instance of a simulated clock
   */
  static LoopClock createSimulatedClock() {
    return new SimulatedClock();
  }
}

package io.github.panghy.asynctest.scheduler;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LoopClock with simulated time. Time only moves when it is advanced explicitly or when the
 * loop parks, so a loop driven by this clock never sleeps and fires every scheduled call
 * exactly at its fire time.
 */
public class SimulatedClock implements LoopClock {

  // The current simulated time in milliseconds
  private long currentTimeMillis;

  // Lock for synchronizing time operations
  private final ReentrantLock timeLock = new ReentrantLock();

  /**
   * Creates a simulated clock starting at time zero.
   */
  public SimulatedClock() {
    this(0);
  }

  /**
   * Creates a simulated clock starting at the given time.
   *
   * @param startTimeMillis The initial time in milliseconds
   */
  public SimulatedClock(long startTimeMillis) {
    if (startTimeMillis < 0) {
      throw new IllegalArgumentException("Time cannot be negative");
    }
    this.currentTimeMillis = startTimeMillis;
  }

  @Override
  public long currentTimeMillis() {
    timeLock.lock();
    try {
      return currentTimeMillis;
    } finally {
      timeLock.unlock();
    }
  }

  /**
   * Advances the simulated time by the specified duration.
   *
   * @param millis The number of milliseconds to advance
   * @return The new current time
   */
  public long advanceTime(long millis) {
    if (millis < 0) {
      throw new IllegalArgumentException("Cannot advance time by a negative amount");
    }
    timeLock.lock();
    try {
      currentTimeMillis += millis;
      return currentTimeMillis;
    } finally {
      timeLock.unlock();
    }
  }

  @Override
  public boolean isSimulated() {
    return true;
  }

  @Override
  public void park(Condition condition, long millis) {
    advanceTime(millis);
  }
}

package io.github.panghy.asynctest.scheduler;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;

/**
 * LoopClock backed by the monotonic system timer. Parking waits on the loop condition, which releases
 * the loop lock so that other threads can resolve done items while the loop sleeps.
 */
public class RealClock implements LoopClock {

  @Override
  public long currentTimeMillis() {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
  }

  @Override
  public boolean isSimulated() {
    return false;
  }

  @Override
  public void park(Condition condition, long millis) throws InterruptedException {
    condition.await(millis, TimeUnit.MILLISECONDS);
  }
}

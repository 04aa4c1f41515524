package io.github.panghy.asynctest.done;

import io.github.panghy.asynctest.scheduler.ScheduledCall;

/**
 * Runtime state of a registered done item.
 *
 * <p>The deadline is relative until the loop starts and {@link DoneRegistry#arm(long)}
 * converts it to an absolute time. The item keeps a handle to its timeout guard in the
 * loop's queue so that resolving the item can cancel the guard. The handle does not own the
 * queue entry and may be stale once the guard fired.</p>
 *
 * <p>Instances are mutated only under the event loop lock.</p>
 */
public class DoneItem {

  private final String tag;
  private final long timeoutMs;
  private final int orderRank;
  private DoneState state = DoneState.NOT_COMPLETE;
  private long deadlineMillis = -1;
  private ScheduledCall timeoutCall;

  DoneItem(String tag, long timeoutMs, int orderRank) {
    this.tag = tag;
    this.timeoutMs = timeoutMs;
    this.orderRank = orderRank;
  }

  public String getTag() {
    return tag;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public int getOrderRank() {
    return orderRank;
  }

  public boolean isOrdered() {
    return orderRank != DoneSpec.UNORDERED;
  }

  public DoneState getState() {
    return state;
  }

  public boolean isResolved() {
    return state.isResolved();
  }

  /**
   * Gets the absolute deadline.
   *
   * @return The deadline in milliseconds, or -1 before the loop has armed the item
   */
  public long getDeadlineMillis() {
    return deadlineMillis;
  }

  public ScheduledCall getTimeoutCall() {
    return timeoutCall;
  }

  public void setTimeoutCall(ScheduledCall timeoutCall) {
    this.timeoutCall = timeoutCall;
  }

  void arm(long nowMillis) {
    this.deadlineMillis = nowMillis + timeoutMs;
  }

  /**
   * Moves the item out of {@link DoneState#NOT_COMPLETE}.
   *
   * @param resolution SUCCESS or ERROR
   * @throws IllegalStateException if the item is already resolved
   */
  public void resolve(DoneState resolution) {
    if (resolution == DoneState.NOT_COMPLETE) {
      throw new IllegalArgumentException("Cannot resolve done('" + tag + "') to NOT_COMPLETE");
    }
    if (state.isResolved()) {
      throw new IllegalStateException("done('" + tag + "') is already resolved as " + state);
    }
    this.state = resolution;
  }

  @Override
  public String toString() {
    return "DoneItem{" +
        "tag='" + tag + '\'' +
        ", state=" + state +
        ", timeoutMs=" + timeoutMs +
        ", orderRank=" + orderRank +
        ", deadline=" + deadlineMillis +
        '}';
  }
}

package io.github.panghy.asynctest.scheduler;

import java.util.Objects;

/**
 * A callback scheduled on the event loop. A ScheduledCall is also the handle returned to
 * the code that scheduled it and can be used to cancel it through
 * {@link ScheduledCallQueue#remove(ScheduledCall)}.
 *
 * <p>Calls are ordered by fire time, then by id. Ids are handed out in insertion order by
 * the owning queue, so calls with the same fire time run in the order they were
 * scheduled.</p>
 */
public final class ScheduledCall implements Comparable<ScheduledCall> {

  private final long id;
  private final long fireTimeMillis;
  private final Runnable action;

  /**
   * Creates a new scheduled call.
   *
   * @param id             Sequence number, unique within the owning queue
   * @param fireTimeMillis Absolute time in milliseconds at which the call should run
   * @param action         The callback to invoke
   */
  ScheduledCall(long id, long fireTimeMillis, Runnable action) {
    this.id = id;
    this.fireTimeMillis = fireTimeMillis;
    this.action = Objects.requireNonNull(action, "Action cannot be null");
  }

  public long getId() {
    return id;
  }

  public long getFireTimeMillis() {
    return fireTimeMillis;
  }

  public Runnable getAction() {
    return action;
  }

  /**
   * Runs the action. Anything the action throws propagates to the caller.
   */
  public void invoke() {
    action.run();
  }

  @Override
  public int compareTo(ScheduledCall other) {
    int result = Long.compare(this.fireTimeMillis, other.fireTimeMillis);
    if (result != 0) {
      return result;
    }
    return Long.compare(this.id, other.id);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ScheduledCall that = (ScheduledCall) o;
    return id == that.id && fireTimeMillis == that.fireTimeMillis;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, fireTimeMillis);
  }

  @Override
  public String toString() {
    return "ScheduledCall{" +
        "id=" + id +
        ", fireTime=" + fireTimeMillis +
        '}';
  }
}

package io.github.panghy.asynctest.scheduler;

import java.util.TreeSet;

/**
 * Ordered collection of {@link ScheduledCall}s, always sorted by fire time with ties broken
 * by insertion order.
 *
 * <p>Entries are keyed by {@code (fireTime, sequence)}, so inserting or removing one entry
 * never invalidates the handles of the others. This lets a call that is being invoked
 * schedule further calls, and lets stale handles be removed safely.</p>
 *
 * <p>This class is not thread-safe. The event loop guards it with its own lock.</p>
 */
public class ScheduledCallQueue {

  private final TreeSet<ScheduledCall> calls = new TreeSet<>();

  private long nextId;

  /**
   * Inserts a call.
   *
   * @param fireTimeMillis Absolute fire time in milliseconds
   * @param action         The callback to invoke at that time
   * @return The inserted call, which serves as its handle
   */
  public ScheduledCall insert(long fireTimeMillis, Runnable action) {
    ScheduledCall call = new ScheduledCall(nextId++, fireTimeMillis, action);
    calls.add(call);
    return call;
  }

  /**
   * Returns the earliest call without removing it.
   *
   * @return The earliest call, or null if the queue is empty
   */
  public ScheduledCall peekEarliest() {
    return calls.isEmpty() ? null : calls.first();
  }

  /**
   * Removes and returns the earliest call.
   *
   * @return The earliest call, or null if the queue is empty
   */
  public ScheduledCall pollEarliest() {
    return calls.pollFirst();
  }

  /**
   * Removes a call by its handle. Removing a call that already fired or was already removed
   * is a no-op.
   *
   * @param handle The handle returned by {@link #insert(long, Runnable)}, may be null
   * @return true if the call was still pending and has been removed
   */
  public boolean remove(ScheduledCall handle) {
    return handle != null && calls.remove(handle);
  }

  /**
   * Checks whether a call is still pending.
   *
   * @param handle The handle to check
   * @return true if the call has neither fired nor been removed
   */
  public boolean contains(ScheduledCall handle) {
    return handle != null && calls.contains(handle);
  }

  public boolean isEmpty() {
    return calls.isEmpty();
  }

  public int size() {
    return calls.size();
  }
}

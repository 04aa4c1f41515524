package io.github.panghy.asynctest.done;

import io.github.panghy.asynctest.error.UsageException;

/**
 * Declaration of a done item: a named expectation the test must resolve before the event
 * loop can succeed.
 *
 * <pre>{@code
 * List.of(DoneSpec.of("event 1").withOrder(1),
 *         DoneSpec.of("event 2").withTimeout(4000).withOrder(2));
 * }</pre>
 *
 * @param tag       Unique name of the item
 * @param timeoutMs Time allowed for resolution after the loop starts, or
 *                  {@link #LOOP_DEFAULT_TIMEOUT} to use the loop's default
 * @param orderRank 1-based position in the required resolution order, or 0 if the item may
 *                  be resolved at any point
 */
public record DoneSpec(String tag, long timeoutMs, int orderRank) {

  /** Tag of the item that plain {@code done()} and {@code error(msg)} resolve. */
  public static final String DEFAULT_TAG = "_default";

  /** Timeout value meaning "use the loop's default per-item timeout". */
  public static final long LOOP_DEFAULT_TIMEOUT = -1;

  /** Order rank of items that are not part of the required resolution order. */
  public static final int UNORDERED = 0;

  public DoneSpec {
    if (tag == null || tag.isEmpty()) {
      throw new UsageException("Done tag must not be empty");
    }
    if (orderRank < 0) {
      throw new UsageException("Order rank of done('" + tag + "') must not be negative: " +
          orderRank);
    }
    if (timeoutMs < 0) {
      timeoutMs = LOOP_DEFAULT_TIMEOUT;
    }
  }

  /**
   * Creates an unordered spec using the loop's default timeout.
   *
   * @param tag Unique name of the item
   * @return The spec
   */
  public static DoneSpec of(String tag) {
    return new DoneSpec(tag, LOOP_DEFAULT_TIMEOUT, UNORDERED);
  }

  public DoneSpec withTimeout(long timeoutMs) {
    return new DoneSpec(tag, timeoutMs, orderRank);
  }

  public DoneSpec withOrder(int orderRank) {
    return new DoneSpec(tag, timeoutMs, orderRank);
  }

  public boolean usesLoopDefaultTimeout() {
    return timeoutMs == LOOP_DEFAULT_TIMEOUT;
  }

  public boolean isOrdered() {
    return orderRank != UNORDERED;
  }
}

package io.github.panghy.asynctest.done;

import io.github.panghy.asynctest.error.UsageException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The done items of one event loop, keyed by their unique tag, together with the counter
 * that enforces the required resolution order.
 *
 * <p>The order counter holds the rank of the last ordered item resolved successfully. An
 * ordered item may only be resolved when its rank is the counter's next value. Unordered
 * items never touch the counter, so they can be resolved between ordered ones at any
 * point.</p>
 *
 * <p>This class is not thread-safe. The event loop guards it with its own lock.</p>
 */
public class DoneRegistry {

  private final Map<String, DoneItem> items = new LinkedHashMap<>();
  private final long defaultTimeoutMs;
  private int lastResolvedOrder;

  /**
   * Creates an empty registry.
   *
   * @param defaultTimeoutMs Timeout given to items whose spec does not override it
   */
  public DoneRegistry(long defaultTimeoutMs) {
    if (defaultTimeoutMs < 0) {
      throw new IllegalArgumentException("Default done timeout must not be negative");
    }
    this.defaultTimeoutMs = defaultTimeoutMs;
  }

  /**
   * Registers a done item.
   *
   * @param spec The declaration of the item
   * @return The new item
   * @throws UsageException if an item with the same tag is already registered
   */
  public DoneItem register(DoneSpec spec) {
    if (items.containsKey(spec.tag())) {
      throw new UsageException("addDone: Duplicate done() tag '" + spec.tag() + "'");
    }
    long timeoutMs = spec.usesLoopDefaultTimeout() ? defaultTimeoutMs : spec.timeoutMs();
    DoneItem item = new DoneItem(spec.tag(), timeoutMs, spec.orderRank());
    items.put(spec.tag(), item);
    return item;
  }

  /**
   * Looks up an item.
   *
   * @param tag The tag of the item
   * @return The item, or null if no item has this tag
   */
  public DoneItem find(String tag) {
    return items.get(tag);
  }

  /**
   * Looks up an item that must exist.
   *
   * @param tag The tag of the item
   * @return The item
   * @throws UsageException if no item has this tag
   */
  public DoneItem require(String tag) {
    DoneItem item = items.get(tag);
    if (item == null) {
      throw new UsageException("Unknown done() tag '" + tag + "'");
    }
    return item;
  }

  public boolean contains(String tag) {
    return items.containsKey(tag);
  }

  /**
   * Gets all items in registration order.
   *
   * @return An unmodifiable view of the items
   */
  public Collection<DoneItem> items() {
    return Collections.unmodifiableCollection(items.values());
  }

  public int size() {
    return items.size();
  }

  /**
   * Converts the relative timeouts of all items into absolute deadlines.
   *
   * @param nowMillis The time at which the loop starts
   */
  public void arm(long nowMillis) {
    for (DoneItem item : items.values()) {
      item.arm(nowMillis);
    }
  }

  /**
   * Gets the rank the next ordered resolution must have.
   */
  public int expectedOrder() {
    return lastResolvedOrder + 1;
  }

  public int getLastResolvedOrder() {
    return lastResolvedOrder;
  }

  /**
   * Checks the resolution order of an item and advances the counter if it passes.
   *
   * @param item The item about to be resolved
   * @return true if the item is unordered or has the expected rank; false leaves the
   *     counter unchanged
   */
  public boolean tryAdvanceOrder(DoneItem item) {
    if (!item.isOrdered()) {
      return true;
    }
    if (item.getOrderRank() != expectedOrder()) {
      return false;
    }
    lastResolvedOrder = item.getOrderRank();
    return true;
  }
}

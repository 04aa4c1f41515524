package io.github.panghy.asynctest.done;

import io.github.panghy.asynctest.error.UsageException;
import io.github.panghy.asynctest.scheduler.ScheduledCallQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for DoneRegistry and DoneItem.
 */
class DoneRegistryTest {

  private DoneRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new DoneRegistry(2000);
  }

  @Test
  void testRegisterAppliesDefaultTimeout() {
    DoneItem item = registry.register(DoneSpec.of("e1"));
    DoneItem custom = registry.register(DoneSpec.of("e2").withTimeout(4000).withOrder(2));

    assertThat(item.getTimeoutMs()).isEqualTo(2000);
    assertThat(custom.getTimeoutMs()).isEqualTo(4000);
    assertThat(custom.getOrderRank()).isEqualTo(2);
    assertThat(item.getState()).isEqualTo(DoneState.NOT_COMPLETE);
    assertThat(item.getDeadlineMillis()).isEqualTo(-1);
    assertThat(registry.items()).containsExactly(item, custom);
    assertThat(registry.size()).isEqualTo(2);
  }

  @Test
  void testDuplicateTagRejected() {
    registry.register(DoneSpec.of("e1"));
    assertThatThrownBy(() -> registry.register(DoneSpec.of("e1").withOrder(1)))
        .isInstanceOf(UsageException.class)
        .hasMessageContaining("Duplicate done() tag 'e1'");
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  void testLookup() {
    DoneItem item = registry.register(DoneSpec.of("e1"));
    assertThat(registry.find("e1")).isSameAs(item);
    assertThat(registry.find("missing")).isNull();
    assertThat(registry.require("e1")).isSameAs(item);
    assertThat(registry.contains("e1")).isTrue();
    assertThatThrownBy(() -> registry.require("missing"))
        .isInstanceOf(UsageException.class)
        .hasMessage("Unknown done() tag 'missing'");
  }

  @Test
  void testArmConvertsToAbsoluteDeadline() {
    DoneItem item = registry.register(DoneSpec.of("e1"));
    DoneItem fast = registry.register(DoneSpec.of("e2").withTimeout(50));
    registry.arm(10_000);
    assertThat(item.getDeadlineMillis()).isEqualTo(12_000);
    assertThat(fast.getDeadlineMillis()).isEqualTo(10_050);
  }

  @Test
  void testOrderCounterAdvancesOnlyOnExpectedRank() {
    DoneItem first = registry.register(DoneSpec.of("e1").withOrder(1));
    DoneItem second = registry.register(DoneSpec.of("e2").withOrder(2));

    assertThat(registry.expectedOrder()).isEqualTo(1);
    assertThat(registry.tryAdvanceOrder(second)).isFalse();
    assertThat(registry.getLastResolvedOrder()).isZero();

    assertThat(registry.tryAdvanceOrder(first)).isTrue();
    assertThat(registry.tryAdvanceOrder(second)).isTrue();
    assertThat(registry.getLastResolvedOrder()).isEqualTo(2);
  }

  @Test
  void testUnorderedItemsNeverTouchCounter() {
    DoneItem unordered = registry.register(DoneSpec.of("free"));
    DoneItem first = registry.register(DoneSpec.of("e1").withOrder(1));

    assertThat(registry.tryAdvanceOrder(unordered)).isTrue();
    assertThat(registry.getLastResolvedOrder()).isZero();
    assertThat(registry.tryAdvanceOrder(first)).isTrue();
    assertThat(registry.tryAdvanceOrder(unordered)).isTrue();
    assertThat(registry.getLastResolvedOrder()).isEqualTo(1);
  }

  @Test
  void testItemResolvesAtMostOnce() {
    DoneItem item = registry.register(DoneSpec.of("e1"));
    item.resolve(DoneState.SUCCESS);
    assertThat(item.isResolved()).isTrue();
    assertThatThrownBy(() -> item.resolve(DoneState.ERROR))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> registry.register(DoneSpec.of("e2")).resolve(DoneState.NOT_COMPLETE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(item.getState()).isEqualTo(DoneState.SUCCESS);
  }

  @Test
  void testTimeoutCallHandle() {
    ScheduledCallQueue queue = new ScheduledCallQueue();
    DoneItem item = registry.register(DoneSpec.of("e1"));
    item.setTimeoutCall(queue.insert(2000, () -> { }));
    assertThat(queue.remove(item.getTimeoutCall())).isTrue();
    assertThat(queue.remove(item.getTimeoutCall())).isFalse();
  }

  @Test
  void testNegativeDefaultTimeoutRejected() {
    assertThatThrownBy(() -> new DoneRegistry(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

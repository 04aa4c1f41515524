package io.github.panghy.asynctest.done;

import io.github.panghy.asynctest.error.UsageException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for DoneSpec.
 */
class DoneSpecTest {

  @Test
  void testDefaults() {
    DoneSpec spec = DoneSpec.of("event");
    assertThat(spec.tag()).isEqualTo("event");
    assertThat(spec.usesLoopDefaultTimeout()).isTrue();
    assertThat(spec.isOrdered()).isFalse();
  }

  @Test
  void testWithTimeoutAndOrder() {
    DoneSpec spec = DoneSpec.of("event 2").withTimeout(4000).withOrder(2);
    assertThat(spec.timeoutMs()).isEqualTo(4000);
    assertThat(spec.orderRank()).isEqualTo(2);
    assertThat(spec.isOrdered()).isTrue();
    assertThat(spec.usesLoopDefaultTimeout()).isFalse();
  }

  @Test
  void testNegativeTimeoutMeansLoopDefault() {
    assertThat(DoneSpec.of("event").withTimeout(-25).usesLoopDefaultTimeout()).isTrue();
    assertThat(DoneSpec.of("event").withTimeout(0).timeoutMs()).isZero();
  }

  @Test
  void testInvalidSpecs() {
    assertThatThrownBy(() -> DoneSpec.of(""))
        .isInstanceOf(UsageException.class);
    assertThatThrownBy(() -> DoneSpec.of(null))
        .isInstanceOf(UsageException.class);
    assertThatThrownBy(() -> DoneSpec.of("event").withOrder(-1))
        .isInstanceOf(UsageException.class)
        .hasMessageContaining("event");
  }
}

package io.github.panghy.asynctest.loop;

import io.github.panghy.asynctest.done.DoneSpec;
import io.github.panghy.asynctest.done.DoneState;
import io.github.panghy.asynctest.error.DoneTimeoutException;
import io.github.panghy.asynctest.error.ResolutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for resolution of done items from threads other than the loop thread, on the real
 * clock.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class EventLoopConcurrencyTest {

  private static EventLoopConfig realConfig() {
    return EventLoopConfig.builder().jitterPct(0).build();
  }

  private static Thread startBackground(Runnable body, AtomicReference<Throwable> failure) {
    Thread thread = new Thread(() -> {
      try {
        body.run();
      } catch (Throwable t) {
        failure.set(t);
      }
    }, "background-worker");
    thread.start();
    return thread;
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }

  @Test
  void testForeignThreadResolvesWhileLoopSleeps() throws Exception {
    EventLoop loop = new EventLoop(List.of(DoneSpec.of("bg")), realConfig());
    loop.schedCall(() -> { }, 300);
    AtomicReference<Throwable> failure = new AtomicReference<>();

    Thread worker = startBackground(() -> {
      sleep(50);
      loop.done("bg");
    }, failure);

    LoopResult result = loop.run();
    worker.join(5_000);

    assertThat(failure.get()).isNull();
    assertThat(result.isSuccess()).isTrue();
    assertThat(loop.getDoneState("bg")).isEqualTo(DoneState.SUCCESS);
  }

  @Test
  void testForeignThreadWaitsForRunningCall() throws Exception {
    EventLoop loop = new EventLoop(List.of(DoneSpec.of("bg")), realConfig());
    CountDownLatch callStarted = new CountDownLatch(1);
    AtomicReference<DoneState> stateAtEndOfCall = new AtomicReference<>();
    AtomicReference<Throwable> failure = new AtomicReference<>();

    loop.schedCall(() -> {
      callStarted.countDown();
      sleep(150);
      stateAtEndOfCall.set(loop.getDoneState("bg"));
    }, 10);
    loop.schedCall(() -> { }, 400);

    Thread worker = startBackground(() -> {
      try {
        callStarted.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      loop.done("bg");
    }, failure);

    LoopResult result = loop.run();
    worker.join(5_000);

    assertThat(failure.get()).isNull();
    assertThat(stateAtEndOfCall.get()).isEqualTo(DoneState.NOT_COMPLETE);
    assertThat(result.isSuccess()).isTrue();
    assertThat(loop.getDoneState("bg")).isEqualTo(DoneState.SUCCESS);
  }

  @Test
  void testForeignThreadErrorWakesLoop() throws Exception {
    EventLoop loop = new EventLoop(List.of(DoneSpec.of("bg").withTimeout(10_000)), realConfig());
    loop.schedCall(() -> { }, 5_000);
    AtomicReference<Throwable> failure = new AtomicReference<>();

    Thread worker = startBackground(() -> {
      sleep(50);
      loop.error("bg", "failed in background");
    }, failure);

    long start = System.currentTimeMillis();
    assertThatThrownBy(loop::run)
        .isInstanceOfSatisfying(ResolutionException.class, e ->
            assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.USER_ERROR))
        .hasMessage("done('bg'): failed in background");
    long elapsed = System.currentTimeMillis() - start;
    worker.join(5_000);

    assertThat(elapsed).isLessThan(3_000);
    assertThat(failure.get()).isInstanceOf(ResolutionException.class);
    assertThat(loop.getErrorTag()).isEqualTo("bg");
  }

  @Test
  void testAbortFromOtherThread() throws Exception {
    EventLoop loop = new EventLoop(List.of(), realConfig());
    loop.schedCall(() -> { }, 5_000);
    AtomicReference<Throwable> failure = new AtomicReference<>();

    Thread worker = startBackground(() -> {
      sleep(50);
      loop.abort();
    }, failure);

    long start = System.currentTimeMillis();
    LoopResult result = loop.run();
    long elapsed = System.currentTimeMillis() - start;
    worker.join(5_000);

    assertThat(failure.get()).isNull();
    assertThat(result.state()).isEqualTo(CompletionState.ABORTED);
    assertThat(elapsed).isLessThan(3_000);
    assertThat(loop.getPendingCallCount()).isEqualTo(1);
  }

  @Test
  void testForeignThreadSchedulesEarlierCall() throws Exception {
    EventLoop loop = new EventLoop(List.of(DoneSpec.of("bg")), realConfig());
    loop.schedCall(() -> { }, 3_000);
    AtomicReference<Throwable> failure = new AtomicReference<>();
    AtomicReference<Long> resolvedAt = new AtomicReference<>();

    long start = System.currentTimeMillis();
    Thread worker = startBackground(() -> {
      sleep(20);
      loop.schedCall(() -> {
        loop.done("bg");
        resolvedAt.set(System.currentTimeMillis() - start);
      }, 50);
    }, failure);

    loop.run();
    worker.join(5_000);

    assertThat(failure.get()).isNull();
    assertThat(resolvedAt.get()).isNotNull().isLessThan(2_000L);
  }

  @Test
  void testTimeoutOnRealClock() {
    EventLoop loop = new EventLoop(List.of(DoneSpec.of("e1").withTimeout(50)), realConfig());
    loop.schedCall(() -> { }, 1_000);

    long start = System.currentTimeMillis();
    assertThatThrownBy(loop::run).isInstanceOf(DoneTimeoutException.class);
    long elapsed = System.currentTimeMillis() - start;

    assertThat(elapsed).isBetween(48L, 250L);
  }

  @Test
  void testInterruptWhileParkedAbortsLoop() throws Exception {
    EventLoop loop = new EventLoop(List.of(DoneSpec.of("e1").withTimeout(10_000)), realConfig());
    loop.schedCall(() -> { }, 5_000);
    AtomicReference<LoopResult> result = new AtomicReference<>();
    AtomicReference<Boolean> interruptedAfterRun = new AtomicReference<>();
    AtomicReference<Throwable> failure = new AtomicReference<>();

    Thread loopThread = startBackground(() -> {
      result.set(loop.run());
      interruptedAfterRun.set(Thread.currentThread().isInterrupted());
    }, failure);
    sleep(100);
    loopThread.interrupt();
    loopThread.join(5_000);

    assertThat(loopThread.isAlive()).isFalse();
    assertThat(failure.get()).isNull();
    assertThat(result.get().state()).isEqualTo(CompletionState.ABORTED);
    assertThat(loop.getState()).isEqualTo(CompletionState.ABORTED);
    assertThat(interruptedAfterRun.get()).isTrue();
  }
}

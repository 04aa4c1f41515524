package io.github.panghy.asynctest.loop;

import io.github.panghy.asynctest.done.DoneItem;
import io.github.panghy.asynctest.done.DoneRegistry;
import io.github.panghy.asynctest.done.DoneSpec;
import io.github.panghy.asynctest.done.DoneState;
import io.github.panghy.asynctest.error.DoneTimeoutException;
import io.github.panghy.asynctest.error.ResolutionException;
import io.github.panghy.asynctest.error.UsageException;
import io.github.panghy.asynctest.scheduler.Jitter;
import io.github.panghy.asynctest.scheduler.LoopClock;
import io.github.panghy.asynctest.scheduler.ScheduledCall;
import io.github.panghy.asynctest.scheduler.ScheduledCallQueue;
import io.github.panghy.asynctest.simulation.LoopRandom;
import io.github.panghy.asynctest.util.LoggingUtil;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static io.github.panghy.asynctest.util.LoggingUtil.debug;
import static io.github.panghy.asynctest.util.LoggingUtil.warn;

/**
 * An event loop that runs scheduled calls, added via {@link #schedCall}, and watches for
 * done items, added via {@link #addDone} or the constructor, to be resolved within their
 * timeout and in their required order.
 *
 * <p>A test schedules the calls that drive the code under test, then calls {@link #run()}.
 * The loop arms a timeout guard for every done item, then repeatedly parks until the
 * earliest scheduled call is due and invokes it, until the queue drains or the loop
 * completes with an error or an abort:</p>
 * <pre>{@code
 * EventLoop loop = new EventLoop(List.of(
 *     DoneSpec.of("event 1").withOrder(1),
 *     DoneSpec.of("event 2").withTimeout(4000).withOrder(2)));
 * loop.schedCall(() -> {
 *   loop.done("event 1");
 *   loop.schedCall(() -> loop.done("event 2"));
 * });
 * loop.run();
 * }</pre>
 *
 * <h2>Threading</h2>
 * <p>All scheduled calls run sequentially on the thread that called {@link #run()}. One
 * lock guards the queue, the done items and the completion state. The loop holds it for
 * the whole run except while parked waiting for the next fire time, which is the window
 * in which other threads can call {@link #done(String)}, {@link #error(String, String)},
 * {@link #schedCall} or {@link #abort()}. Such calls block until the loop parks.</p>
 */
public class EventLoop {
  private static final Logger LOGGER = Logger.getLogger(EventLoop.class.getName());

  private static final long NO_ORDERED_CALL = Long.MIN_VALUE;

  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Signalled when another thread changes the state or schedules a call, so that a parked
   * loop re-examines the queue before its sleep is over.
   */
  private final Condition wakeup = lock.newCondition();

  private final ScheduledCallQueue queue = new ScheduledCallQueue();
  private final DoneRegistry registry;
  private final EventLoopConfig config;
  private final LoopClock clock;
  private final Random random;
  private final List<CompletionListener> listeners = new CopyOnWriteArrayList<>();

  private volatile int jitterPct;

  // Fire time of the last ordered call, anchor of the next one
  private long lastOrderedFireTime = NO_ORDERED_CALL;

  // Earliest pending fire time, for diagnostics only
  private long nextWakeupMillis = Long.MAX_VALUE;

  private CompletionState state = CompletionState.NOT_COMPLETE;
  private String errorMessage = "";
  private String errorTag;
  private ResolutionException failure;
  private boolean started;

  /**
   * Creates a loop with the default configuration and a single {@value DoneSpec#DEFAULT_TAG}
   * done item, resolved by {@link #done()}.
   */
  public EventLoop() {
    this(EventLoopConfig.DEFAULT);
  }

  /**
   * Creates a loop with a single {@value DoneSpec#DEFAULT_TAG} done item.
   *
   * @param config The loop configuration
   */
  public EventLoop(EventLoopConfig config) {
    this(List.of(DoneSpec.of(DoneSpec.DEFAULT_TAG)), config);
  }

  /**
   * Creates a loop with the default configuration and the given done items.
   *
   * @param doneSpecs The done items the test must resolve
   */
  public EventLoop(List<DoneSpec> doneSpecs) {
    this(doneSpecs, EventLoopConfig.DEFAULT);
  }

  /**
   * Creates a loop with the given done items. No {@value DoneSpec#DEFAULT_TAG} item is
   * registered unless it is part of {@code doneSpecs}.
   *
   * @param doneSpecs The done items the test must resolve
   * @param config    The loop configuration
   */
  public EventLoop(List<DoneSpec> doneSpecs, EventLoopConfig config) {
    this.config = config;
    this.clock = config.getClock() != null ? config.getClock() : LoopClock.createRealClock();
    this.random = (config.getRandomSource() != null
        ? config.getRandomSource()
        : LoopRandom.currentSource()).getRandom();
    this.jitterPct = config.getJitterPct();
    this.registry = new DoneRegistry(config.getDefaultDoneTimeoutMs());
    for (DoneSpec spec : doneSpecs) {
      registry.register(spec);
    }
  }

  /**
   * Schedules a call 100 ms from now, jittered by the loop's jitter percentage.
   *
   * @param action The callback to run
   * @return The handle of the scheduled call
   */
  public ScheduledCall schedCall(Runnable action) {
    return schedCall(action, 100);
  }

  /**
   * Schedules a call, jittered by the loop's jitter percentage.
   *
   * @param action  The callback to run
   * @param delayMs Delay from now, or if negative, delay from the previous ordered call
   * @return The handle of the scheduled call
   */
  public ScheduledCall schedCall(Runnable action, long delayMs) {
    return schedCall(action, delayMs, jitterPct);
  }

  /**
   * Schedules a call.
   *
   * <p>A non-negative {@code delayMs} is relative to now. A negative one schedules an
   * ordered call, {@code |delayMs|} after the fire time of the previous ordered call (or
   * after now for the first one). In both cases the fire time is then shifted by a random
   * offset in {@code [-w, +w)} where {@code w = |delayMs| * jitterPct / 100}.</p>
   *
   * @param action    The callback to run
   * @param delayMs   Delay in milliseconds, negative for an ordered call
   * @param jitterPct Jitter window as a percentage of the delay, 0 for none
   * @return The handle of the scheduled call
   */
  public ScheduledCall schedCall(Runnable action, long delayMs, int jitterPct) {
    if (jitterPct < 0) {
      throw usageError("schedCall: jitter percentage must not be negative: " + jitterPct);
    }
    lock.lock();
    try {
      long fireTime;
      if (delayMs < 0) {
        long after = -delayMs;
        long anchor = lastOrderedFireTime == NO_ORDERED_CALL
            ? clock.currentTimeMillis()
            : lastOrderedFireTime;
        fireTime = anchor + after + Jitter.offset(random, after, jitterPct);
        lastOrderedFireTime = fireTime;
      } else {
        fireTime = clock.currentTimeMillis() + delayMs + Jitter.offset(random, delayMs, jitterPct);
      }
      return schedule(action, fireTime);
    } finally {
      lock.unlock();
    }
  }

  private ScheduledCall schedule(Runnable action, long fireTime) {
    ScheduledCall call = queue.insert(fireTime, action);
    if (fireTime < nextWakeupMillis) {
      nextWakeupMillis = fireTime;
      debug(LOGGER, () -> "Setting next event after " +
          (fireTime - clock.currentTimeMillis()) + " ms");
    }
    wakeup.signalAll();
    return call;
  }

  /**
   * Registers a done item. Must be called before {@link #run()}.
   *
   * @param spec The declaration of the item
   * @throws UsageException if the loop has already started or the tag is a duplicate
   */
  public void addDone(DoneSpec spec) {
    lock.lock();
    try {
      if (started) {
        throw usageError("addDone('" + spec.tag() + "') must be called before run()");
      }
      registry.register(spec);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Registers a listener notified when the run finishes.
   *
   * @param listener The listener
   */
  public void addCompletionListener(CompletionListener listener) {
    listeners.add(listener);
  }

  /**
   * Resolves the {@value DoneSpec#DEFAULT_TAG} done item.
   */
  public void done() {
    done(DoneSpec.DEFAULT_TAG);
  }

  /**
   * Resolves a done item successfully and cancels its timeout guard.
   *
   * @param tag The tag of the item
   * @throws UsageException       if the tag is unknown or the loop already succeeded
   * @throws ResolutionException if the item was already resolved, is resolved out of its
   *                             required order, or the loop already failed
   */
  public void done(String tag) {
    lock.lock();
    try {
      DoneItem item = registry.find(tag);
      if (item == null) {
        throw usageError("Unknown done() tag '" + tag + "'");
      }
      if (!checkResolvable(tag)) {
        return;
      }
      if (item.isResolved()) {
        fail(new ResolutionException(ResolutionException.Kind.ALREADY_RESOLVED, tag,
            compose(tag, "done() already resolved, can't resolve again")), true);
      }
      queue.remove(item.getTimeoutCall());
      int expected = registry.expectedOrder();
      if (!registry.tryAdvanceOrder(item)) {
        fail(new ResolutionException(ResolutionException.Kind.OUT_OF_ORDER, tag,
            compose(tag, "Did not resolve in expected order. Expected: " + expected +
                ", actual: " + item.getOrderRank())), true);
      }
      item.resolve(DoneState.SUCCESS);
      debug(LOGGER, () -> "done('" + tag + "') -> success");
    } finally {
      lock.unlock();
    }
  }

  /**
   * Fails the loop. The error is attributed to the {@value DoneSpec#DEFAULT_TAG} item if
   * it is registered, otherwise to the loop as a whole.
   *
   * @param message Description of the error
   * @throws ResolutionException always, unless the loop was aborted
   */
  public void error(String message) {
    lock.lock();
    try {
      String tag = registry.contains(DoneSpec.DEFAULT_TAG) ? DoneSpec.DEFAULT_TAG : null;
      if (checkResolvable(tag)) {
        fail(new ResolutionException(ResolutionException.Kind.USER_ERROR, tag,
            compose(tag, message)), true);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Fails a done item and with it the loop.
   *
   * @param tag     The tag of the item
   * @param message Description of the error
   * @throws UsageException       if the tag is empty or unknown
   * @throws ResolutionException always otherwise, unless the loop was aborted
   */
  public void error(String tag, String message) {
    if (tag == null || tag.isEmpty()) {
      throw usageError("error() for a tagged done() item called, but the tag is empty");
    }
    lock.lock();
    try {
      if (!registry.contains(tag)) {
        throw usageError("error() called with unknown tag: " + tag);
      }
      if (checkResolvable(tag)) {
        fail(new ResolutionException(ResolutionException.Kind.USER_ERROR, tag,
            compose(tag, message)), true);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops the loop at the next iteration boundary unless it has already completed. A call
   * that is running is not interrupted.
   */
  public void abort() {
    lock.lock();
    try {
      if (state.isTerminal()) {
        return;
      }
      state = CompletionState.ABORTED;
      debug(LOGGER, "Event loop aborted");
      wakeup.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs the loop until the queue drains, an error is raised or the loop is aborted. Can
   * only be called once per loop.
   *
   * @return The result of a run that ended in SUCCESS or ABORTED
   * @throws UsageException       if nothing has been scheduled or the loop already ran
   * @throws ResolutionException if the run ended in ERROR
   */
  public LoopResult run() {
    Throwable escaped = null;
    lock.lock();
    try {
      if (started) {
        throw usageError("run() can only be called once per event loop");
      }
      if (queue.isEmpty()) {
        throw usageError("Nothing to run: not even a single function call has been scheduled");
      }
      started = true;
      armTimeoutGuards();
      try {
        drain();
      } catch (RuntimeException | Error e) {
        escaped = e;
        recordEscaped(e);
      }
      if (state == CompletionState.NOT_COMPLETE) {
        state = CompletionState.SUCCESS;
      }
    } finally {
      lock.unlock();
    }
    LoopResult result = getResult();
    notifyListeners(result);
    if (escaped instanceof RuntimeException) {
      throw (RuntimeException) escaped;
    }
    if (escaped instanceof Error) {
      throw (Error) escaped;
    }
    if (result.isFailure()) {
      throw result.failure();
    }
    return result;
  }

  private void armTimeoutGuards() {
    long now = clock.currentTimeMillis();
    registry.arm(now);
    for (DoneItem item : registry.items()) {
      if (item.isResolved()) {
        continue;
      }
      String tag = item.getTag();
      item.setTimeoutCall(schedule(() -> onDoneTimeout(tag), item.getDeadlineMillis()));
    }
  }

  private void drain() {
    while (!queue.isEmpty() && state == CompletionState.NOT_COMPLETE) {
      debug(LOGGER, () -> "Pending events: " + queue.size());
      ScheduledCall next = queue.peekEarliest();
      long timeToSleep = next.getFireTimeMillis() - clock.currentTimeMillis();
      if (timeToSleep > 0) {
        debug(LOGGER, () -> "Sleeping " + timeToSleep + " ms before next event");
        try {
          clock.park(wakeup, timeToSleep);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          warn(LOGGER, "Event loop interrupted while sleeping, aborting");
          state = CompletionState.ABORTED;
          return;
        }
        // Other threads may have resolved items or rescheduled while the lock was released
        next = queue.peekEarliest();
        if (next == null || state != CompletionState.NOT_COMPLETE) {
          continue;
        }
        if (next.getFireTimeMillis() - clock.currentTimeMillis() > config.getWakeupToleranceMs()) {
          debug(LOGGER, "Woke up before next event time, will sleep again");
          continue;
        }
      } else {
        debug(LOGGER, () -> "Negative or zero time to next event: " + timeToSleep);
      }
      queue.remove(next);
      ScheduledCall following = queue.peekEarliest();
      nextWakeupMillis = following == null ? Long.MAX_VALUE : following.getFireTimeMillis();
      next.invoke();
    }
  }

  private void onDoneTimeout(String tag) {
    DoneItem item = registry.find(tag);
    if (item == null) {
      LoggingUtil.error(LOGGER, "Internal error: done() timeout handler could not find done item " + tag);
      fail(new ResolutionException(ResolutionException.Kind.INTERNAL, null,
          "Internal error: done() timeout handler could not find done item " + tag), false);
      return;
    }
    long offset = clock.currentTimeMillis() - item.getDeadlineMillis();
    debug(LOGGER, () -> "done('" + tag + "') timeout handler executed with " + offset +
        " ms offset from ideal");
    if (!clock.isSimulated() && Math.abs(offset) > config.getTimeoutSkewWarningMs()) {
      warn(LOGGER, "done('" + tag + "') timeout handler executed with time offset of " +
          offset + " ms (>" + config.getTimeoutSkewWarningMs() + "ms) from required. " +
          "NOTE: This is normal if paused in a debugger");
    }
    if (item.isResolved()) {
      debug(LOGGER, () -> "done('" + tag + "') timeout handler: done is resolved");
      return;
    }
    fail(new DoneTimeoutException(tag, compose(tag, "Timeout"), item.getTimeoutMs()), false);
  }

  /**
   * Checks whether a done() or error() call may still change the state of the loop.
   *
   * @return false if the loop was aborted and the call must be ignored
   */
  private boolean checkResolvable(String tag) {
    switch (state) {
      case ERROR:
        throw failure;
      case ABORTED:
        debug(LOGGER, () -> "Ignoring resolution of '" + tag + "' on aborted event loop");
        return false;
      case SUCCESS:
        throw usageError("done('" + tag + "') resolved after the event loop completed");
      default:
        return true;
    }
  }

  /**
   * Records a resolution failure and moves the loop to ERROR. Only the first failure is
   * recorded.
   *
   * @param resolutionFailure The failure
   * @param raise             Whether to throw the failure to unwind the caller
   */
  private void fail(ResolutionException resolutionFailure, boolean raise) {
    if (state == CompletionState.ERROR) {
      if (raise) {
        throw failure;
      }
      return;
    }
    String tag = resolutionFailure.getTag();
    if (tag != null) {
      DoneItem item = registry.find(tag);
      if (item != null && !item.isResolved()) {
        item.resolve(DoneState.ERROR);
      }
      debug(LOGGER, resolutionFailure.getMessage());
    } else {
      LoggingUtil.error(LOGGER, resolutionFailure.getMessage());
    }
    state = CompletionState.ERROR;
    failure = resolutionFailure;
    errorMessage = resolutionFailure.getMessage();
    errorTag = tag;
    wakeup.signalAll();
    if (raise) {
      throw resolutionFailure;
    }
  }

  /**
   * Converts an exception that escaped a scheduled call into the loop's failure, unless the
   * loop already reached a terminal state.
   */
  private void recordEscaped(Throwable t) {
    if (state.isTerminal()) {
      if (state == CompletionState.ABORTED) {
        warn(LOGGER, "Scheduled call failed after the event loop was aborted: " + t);
      }
      return;
    }
    LoggingUtil.error(LOGGER, "Scheduled call failed: " + t, t);
    state = CompletionState.ERROR;
    failure = t instanceof ResolutionException
        ? (ResolutionException) t
        : new ResolutionException(ResolutionException.Kind.USER_ERROR, null,
            "Scheduled call failed: " + t.getMessage(), t);
    errorMessage = failure.getMessage();
    errorTag = failure.getTag();
  }

  private void notifyListeners(LoopResult result) {
    for (CompletionListener listener : listeners) {
      try {
        listener.onComplete(result);
      } catch (RuntimeException e) {
        LoggingUtil.error(LOGGER, "Completion listener failed", e);
      }
    }
  }

  private static String compose(String tag, String message) {
    return tag == null ? message : "done('" + tag + "'): " + message;
  }

  private static UsageException usageError(String message) {
    LoggingUtil.error(LOGGER, "Usage error: " + message);
    return new UsageException(message);
  }

  /**
   * Gets the outcome of the loop so far.
   *
   * @return The current result
   */
  public LoopResult getResult() {
    lock.lock();
    try {
      return new LoopResult(state, errorMessage, errorTag, failure);
    } finally {
      lock.unlock();
    }
  }

  public CompletionState getState() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gets the composed message of the recorded failure.
   *
   * @return The message, empty if no failure has been recorded
   */
  public String getErrorMessage() {
    lock.lock();
    try {
      return errorMessage;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gets the tag of the done item that failed.
   *
   * @return The tag, or null if no failure was attributed to a done item
   */
  public String getErrorTag() {
    lock.lock();
    try {
      return errorTag;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gets the resolution state of a done item.
   *
   * @param tag The tag of the item
   * @return The state of the item
   * @throws UsageException if the tag is unknown
   */
  public DoneState getDoneState(String tag) {
    lock.lock();
    try {
      return registry.require(tag).getState();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gets the rank of the last ordered done item resolved successfully.
   */
  public int getLastResolvedOrder() {
    lock.lock();
    try {
      return registry.getLastResolvedOrder();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gets the number of calls still waiting in the queue, timeout guards included.
   */
  public int getPendingCallCount() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  public int getJitterPct() {
    return jitterPct;
  }

  /**
   * Sets the jitter percentage used by calls scheduled without an explicit one.
   *
   * @param jitterPct Percentage of the nominal delay used as the jitter window, 0 for none
   */
  public void setJitterPct(int jitterPct) {
    if (jitterPct < 0) {
      throw new IllegalArgumentException("Jitter percentage must not be negative");
    }
    this.jitterPct = jitterPct;
  }

  public LoopClock getClock() {
    return clock;
  }
}

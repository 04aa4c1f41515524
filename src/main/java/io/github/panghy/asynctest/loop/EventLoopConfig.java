package io.github.panghy.asynctest.loop;

import io.github.panghy.asynctest.scheduler.LoopClock;
import io.github.panghy.asynctest.simulation.RandomSource;

/**
 * Configuration options for the {@link EventLoop}.
 */
public class EventLoopConfig {

  /** System property overriding the default per-item done timeout. */
  public static final String DONE_TIMEOUT_PROPERTY = "asynctest.doneTimeoutMs";

  /** Default time allowed to resolve a done item. */
  public static final long DEFAULT_DONE_TIMEOUT_MS = 2000;

  /** Default jitter window, as a percentage of the nominal delay. */
  public static final int DEFAULT_JITTER_PCT = 50;

  /** How far ahead of its fire time a call may still be run after the loop wakes up. */
  public static final long DEFAULT_WAKEUP_TOLERANCE_MS = 2;

  /** Offset of a timeout guard from its deadline above which a warning is logged. */
  public static final long DEFAULT_TIMEOUT_SKEW_WARNING_MS = 10;

  /** The default configuration: real clock, unseeded jitter. */
  public static final EventLoopConfig DEFAULT = builder().build();

  private final long defaultDoneTimeoutMs;
  private final int jitterPct;
  private final long wakeupToleranceMs;
  private final long timeoutSkewWarningMs;
  private final LoopClock clock;
  private final RandomSource randomSource;

  private EventLoopConfig(Builder builder) {
    if (builder.defaultDoneTimeoutMs < 0) {
      throw new IllegalArgumentException("Default done timeout must not be negative");
    }
    if (builder.jitterPct < 0) {
      throw new IllegalArgumentException("Jitter percentage must not be negative");
    }
    if (builder.wakeupToleranceMs < 0) {
      throw new IllegalArgumentException("Wakeup tolerance must not be negative");
    }
    this.defaultDoneTimeoutMs = builder.defaultDoneTimeoutMs;
    this.jitterPct = builder.jitterPct;
    this.wakeupToleranceMs = builder.wakeupToleranceMs;
    this.timeoutSkewWarningMs = builder.timeoutSkewWarningMs;
    this.clock = builder.clock;
    this.randomSource = builder.randomSource;
  }

  public long getDefaultDoneTimeoutMs() {
    return defaultDoneTimeoutMs;
  }

  public int getJitterPct() {
    return jitterPct;
  }

  public long getWakeupToleranceMs() {
    return wakeupToleranceMs;
  }

  public long getTimeoutSkewWarningMs() {
    return timeoutSkewWarningMs;
  }

  /**
   * Gets the clock to use.
   *
   * @return The clock, or null if each loop should create a real clock
   */
  public LoopClock getClock() {
    return clock;
  }

  /**
   * Gets the source of jitter.
   *
   * @return The random source, or null if each loop should use
   *     {@link io.github.panghy.asynctest.simulation.LoopRandom#currentSource()}
   */
  public RandomSource getRandomSource() {
    return randomSource;
  }

  /**
   * Creates a builder initialized from this configuration.
   *
   * @return A new builder
   */
  public Builder toBuilder() {
    return new Builder()
        .defaultDoneTimeoutMs(defaultDoneTimeoutMs)
        .jitterPct(jitterPct)
        .wakeupToleranceMs(wakeupToleranceMs)
        .timeoutSkewWarningMs(timeoutSkewWarningMs)
        .clock(clock)
        .randomSource(randomSource);
  }

  /**
   * Creates a new builder with default values. The default done timeout can be overridden
   * for a whole test run with the {@value #DONE_TIMEOUT_PROPERTY} system property.
   *
   * @return A new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for event loop configuration.
   */
  public static class Builder {
    private long defaultDoneTimeoutMs = Long.getLong(DONE_TIMEOUT_PROPERTY, DEFAULT_DONE_TIMEOUT_MS);
    private int jitterPct = DEFAULT_JITTER_PCT;
    private long wakeupToleranceMs = DEFAULT_WAKEUP_TOLERANCE_MS;
    private long timeoutSkewWarningMs = DEFAULT_TIMEOUT_SKEW_WARNING_MS;
    private LoopClock clock;
    private RandomSource randomSource;

    public Builder defaultDoneTimeoutMs(long defaultDoneTimeoutMs) {
      this.defaultDoneTimeoutMs = defaultDoneTimeoutMs;
      return this;
    }

    /**
     * Sets the initial jitter percentage of the loop. A value of 0 disables jitter.
     *
     * @param jitterPct Percentage of the nominal delay used as the jitter window
     * @return This builder
     */
    public Builder jitterPct(int jitterPct) {
      this.jitterPct = jitterPct;
      return this;
    }

    public Builder wakeupToleranceMs(long wakeupToleranceMs) {
      this.wakeupToleranceMs = wakeupToleranceMs;
      return this;
    }

    public Builder timeoutSkewWarningMs(long timeoutSkewWarningMs) {
      this.timeoutSkewWarningMs = timeoutSkewWarningMs;
      return this;
    }

    public Builder clock(LoopClock clock) {
      this.clock = clock;
      return this;
    }

    public Builder randomSource(RandomSource randomSource) {
      this.randomSource = randomSource;
      return this;
    }

    public EventLoopConfig build() {
      return new EventLoopConfig(this);
    }
  }
}

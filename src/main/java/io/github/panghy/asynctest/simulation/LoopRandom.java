package io.github.panghy.asynctest.simulation;

/**
 * Thread-local default {@link RandomSource} for event loops.
 *
 * <p>An event loop that is not configured with an explicit random source picks up the
 * source installed for the thread that constructs it. Test fixtures install a seeded source
 * before each test so that jitter is reproducible:</p>
 * <pre>{@code
 * LoopRandom.initialize(new DeterministicRandomSource(12345));
 * EventLoop loop = new EventLoop();   // jitter now derived from seed 12345
 * }</pre>
 */
public final class LoopRandom {

  private static final ThreadLocal<RandomSource> randomSource = new ThreadLocal<>();

  private LoopRandom() {
  }

  /**
   * Installs the random source for the current thread.
   *
   * @param source The random source to use
   * @throws NullPointerException if source is null
   */
  public static void initialize(RandomSource source) {
    if (source == null) {
      throw new NullPointerException("RandomSource cannot be null");
    }
    randomSource.set(source);
  }

  /**
   * Gets the random source of the current thread, installing a {@link SystemRandomSource}
   * if none has been initialized.
   *
   * @return The current random source
   */
  public static RandomSource currentSource() {
    RandomSource source = randomSource.get();
    if (source == null) {
      source = new SystemRandomSource();
      randomSource.set(source);
    }
    return source;
  }

  /**
   * Gets the seed of the current thread's source, or 0 if none is installed.
   *
   * @return The seed value
   */
  public static long getCurrentSeed() {
    RandomSource source = randomSource.get();
    return source != null ? source.getSeed() : 0;
  }

  /**
   * Checks if a seeded source is installed for the current thread.
   *
   * @return true if jitter on this thread is reproducible
   */
  public static boolean isDeterministic() {
    return randomSource.get() instanceof DeterministicRandomSource;
  }

  /**
   * Removes the current thread's source. Called in test cleanup to prevent leaks.
   */
  public static void clear() {
    randomSource.remove();
  }
}

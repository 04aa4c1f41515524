package io.github.panghy.asynctest.simulation;

import java.util.Random;

/**
 * A seeded {@link RandomSource}. Two event loops given sources with the same seed and
 * scheduling the same calls in the same order compute the same fire times.
 */
public class DeterministicRandomSource implements RandomSource {

  private final long seed;
  private final Random random;

  /**
   * Creates a new deterministic random source with the given seed.
   *
   * @param seed The seed for the random number generator
   */
  public DeterministicRandomSource(long seed) {
    this.seed = seed;
    this.random = new Random(seed);
  }

  @Override
  public Random getRandom() {
    return random;
  }

  @Override
  public long getSeed() {
    return seed;
  }

  @Override
  public String toString() {
    return "DeterministicRandomSource{seed=" + seed + "}";
  }
}

package io.github.panghy.asynctest.simulation;

import java.util.Random;

/**
 * Supplier of the random numbers used for scheduling jitter.
 *
 * <p>A {@link DeterministicRandomSource} makes every jittered fire time reproducible from a
 * seed. A {@link SystemRandomSource} gives fresh jitter on every run.</p>
 */
public interface RandomSource {

  /**
   * Gets the Random instance of this source.
   *
   * @return The Random instance
   */
  Random getRandom();

  /**
   * Gets the seed used to initialize this source. Sources that are not seeded return a
   * placeholder value that is only useful for logging.
   *
   * @return The seed value
   */
  long getSeed();
}

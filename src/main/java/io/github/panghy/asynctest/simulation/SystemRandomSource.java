package io.github.panghy.asynctest.simulation;

import java.util.Random;

/**
 * An unseeded {@link RandomSource}, giving different jitter on every run.
 */
public class SystemRandomSource implements RandomSource {

  private final Random random;
  private final long creationTime;

  public SystemRandomSource() {
    this.random = new Random();
    this.creationTime = System.currentTimeMillis();
  }

  @Override
  public Random getRandom() {
    return random;
  }

  /**
   * Returns the creation time of this source, which only identifies it in logs.
   */
  @Override
  public long getSeed() {
    return creationTime;
  }

  @Override
  public String toString() {
    return "SystemRandomSource{creationTime=" + creationTime + "}";
  }
}

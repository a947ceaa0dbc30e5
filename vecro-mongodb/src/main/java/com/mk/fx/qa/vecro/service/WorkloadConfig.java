package com.mk.fx.qa.vecro.service;

/**
 * Workload shape of one service instance. Created once at startup and never mutated; changing
 * it requires a restart.
 *
 * @param readOps reads performed per request
 * @param writeOps writes performed per request
 * @param keySpace keys are drawn uniformly from {@code [0, keySpace)}
 * @param valueSize length of the random value written by each write
 * @param randomSeed seed for the content generator, {@code null} to derive one from the clock
 */
public record WorkloadConfig(int readOps, int writeOps, int keySpace, int valueSize, Long randomSeed) {

  public static final int DEFAULT_KEY_SPACE = 1000;
  public static final int DEFAULT_VALUE_SIZE = 128;

  public WorkloadConfig {
    if (readOps < 0) {
      throw new IllegalArgumentException("readOps must be >= 0: " + readOps);
    }
    if (writeOps < 0) {
      throw new IllegalArgumentException("writeOps must be >= 0: " + writeOps);
    }
    if (keySpace <= 0) {
      throw new IllegalArgumentException("keySpace must be > 0: " + keySpace);
    }
    if (valueSize < 0) {
      throw new IllegalArgumentException("valueSize must be >= 0: " + valueSize);
    }
  }

  public static WorkloadConfig of(int readOps, int writeOps) {
    return new WorkloadConfig(readOps, writeOps, DEFAULT_KEY_SPACE, DEFAULT_VALUE_SIZE, null);
  }
}

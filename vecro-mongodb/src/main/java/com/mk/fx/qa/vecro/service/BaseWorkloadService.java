package com.mk.fx.qa.vecro.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.vecro.common.CallCancelledException;
import com.mk.fx.qa.vecro.common.CallContext;
import com.mk.fx.qa.vecro.store.StoreGateway;
import com.mk.fx.qa.vecro.store.StoreOperation;
import com.mk.fx.qa.vecro.store.StoreOperationException;
import com.mk.fx.qa.vecro.store.StoreRecord;
import java.time.Instant;
import java.util.Objects;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/**
 * Performs the configured number of reads followed by the configured number of writes against
 * the {@link StoreGateway} and aggregates their byte sizes.
 *
 * <p>Operations run sequentially on the calling thread. The first failing operation aborts the
 * request; work already done is not rolled back. Keys and written values come from the injected
 * {@link Random}, so a fixed seed reproduces the same content sequence for a single caller.
 * {@link Random} is thread-safe, which is the only state shared between concurrent calls.
 */
@Slf4j
public class BaseWorkloadService implements WorkloadService {

  private static final char[] ALPHABET =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

  private final StoreGateway gateway;
  private final WorkloadConfig config;
  private final Random random;

  @VisibleForTesting
  BaseWorkloadService(StoreGateway gateway, WorkloadConfig config, Random random) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.config = Objects.requireNonNull(config, "config");
    this.random = Objects.requireNonNull(random, "random");
  }

  /** Builds the service, seeding its generator from the config or, if unset, the clock. */
  public static BaseWorkloadService create(StoreGateway gateway, WorkloadConfig config) {
    long seed = config.randomSeed() != null ? config.randomSeed() : System.nanoTime();
    log.info(
        "Workload shape readOps={} writeOps={} keySpace={} valueSize={} seed={}",
        config.readOps(),
        config.writeOps(),
        config.keySpace(),
        config.valueSize(),
        seed);
    return new BaseWorkloadService(gateway, config, new Random(seed));
  }

  @Override
  public WorkloadResponse execute(CallContext ctx, WorkloadRequest request) {
    int position = 0;
    long readBytes = 0;
    for (int i = 0; i < config.readOps(); i++) {
      readBytes += read(ctx, ++position);
    }
    long writeBytes = 0;
    for (int i = 0; i < config.writeOps(); i++) {
      writeBytes += write(ctx, ++position);
    }
    return WorkloadResponse.of(config.readOps(), config.writeOps(), readBytes, writeBytes);
  }

  private long read(CallContext ctx, int position) {
    ctx.ensureActive();
    int key = nextKey();
    try {
      return gateway.readOne(ctx, key);
    } catch (CallCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      throw failure(StoreOperation.READ, position, e);
    }
  }

  private long write(CallContext ctx, int position) {
    ctx.ensureActive();
    StoreRecord record = new StoreRecord(nextKey(), nextValue(), Instant.now());
    try {
      return gateway.writeOne(ctx, record);
    } catch (CallCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      throw failure(StoreOperation.WRITE, position, e);
    }
  }

  private static StoreOperationException failure(
      StoreOperation operation, int position, RuntimeException cause) {
    return new StoreOperationException(
        operation,
        position,
        operation.name().toLowerCase() + " #" + position + " failed: " + cause.getMessage(),
        cause);
  }

  private int nextKey() {
    return random.nextInt(config.keySpace());
  }

  private String nextValue() {
    char[] value = new char[config.valueSize()];
    for (int i = 0; i < value.length; i++) {
      value[i] = ALPHABET[random.nextInt(ALPHABET.length)];
    }
    return new String(value);
  }
}

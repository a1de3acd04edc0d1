package com.codeheadsystems.cipherscore.server.registry;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.model.LendingPool;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link PoolRegistry}.
 * <p>
 * Writers take a single lock; readers work on the copy-on-write list and never block.
 */
public class InMemoryPoolRegistry implements PoolRegistry {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPoolRegistry.class);

  private final CopyOnWriteArrayList<LendingPool> pools = new CopyOnWriteArrayList<>();
  private final ReentrantLock writeLock = new ReentrantLock();

  public InMemoryPoolRegistry() {
    log.warn("Using InMemoryPoolRegistry: pools will NOT survive restarts. "
        + "Replace with a persistent PoolRegistry for production.");
  }

  @Override
  public LendingPool append(Identity operator, OpaqueValue minScore, OpaqueValue maxLoan,
                            int interestRateBps, String name, Instant registeredAt) {
    writeLock.lock();
    try {
      LendingPool pool = new LendingPool(pools.size(), operator, minScore, maxLoan,
          interestRateBps, true, name, registeredAt);
      pools.add(pool);
      log.debug("Appended pool {} '{}'", pool.poolId(), name);
      return pool;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public Optional<LendingPool> get(int poolId) {
    // The list never shrinks, so an index below size() stays valid.
    if (poolId < 0 || poolId >= pools.size()) {
      return Optional.empty();
    }
    return Optional.of(pools.get(poolId));
  }

  @Override
  public boolean deactivate(int poolId) {
    writeLock.lock();
    try {
      if (poolId < 0 || poolId >= pools.size()) {
        throw new IllegalArgumentException("No pool with id " + poolId);
      }
      LendingPool current = pools.get(poolId);
      if (!current.active()) {
        return false;
      }
      pools.set(poolId, current.deactivated());
      return true;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public List<LendingPool> snapshot() {
    return List.copyOf(pools);
  }

  @Override
  public int size() {
    return pools.size();
  }
}

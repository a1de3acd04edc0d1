package com.codeheadsystems.cipherscore.server.registry;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.model.LendingPool;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only arena of lending pools addressed by registration index.
 * <p>
 * Implementations must be thread-safe: appends are serialized so ids are gap-free and
 * monotonic, and {@link #snapshot()} returns a consistent view without waiting for pending
 * appends. Pools are never removed or compacted.
 */
public interface PoolRegistry {

  /**
   * Appends an active pool and assigns the next id.
   *
   * @return the stored pool, carrying its id
   */
  LendingPool append(Identity operator, OpaqueValue minScore, OpaqueValue maxLoan,
                     int interestRateBps, String name, Instant registeredAt);

  /**
   * Loads a pool by id.
   *
   * @return the pool, or empty if the id was never assigned
   */
  Optional<LendingPool> get(int poolId);

  /**
   * Marks a pool inactive in place. The check and the write are atomic.
   *
   * @return true if the pool was active before the call
   * @throws IllegalArgumentException if the id was never assigned
   */
  boolean deactivate(int poolId);

  /**
   * All pools in registration order, as of the call.
   */
  List<LendingPool> snapshot();

  int size();
}

package com.codeheadsystems.cipherscore.server.model;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.model.Identity;
import java.time.Instant;

/**
 * A registered lending pool. The pool id is its registration index and never changes.
 *
 * @param poolId          registration index
 * @param operator        identity that registered the pool and may deactivate it
 * @param minScore        encrypted minimum score
 * @param maxLoan         encrypted maximum loan amount
 * @param interestRateBps interest rate in basis points; a public business term
 * @param active          false once deactivated
 * @param name            display name
 * @param registeredAt    registration time
 */
public record LendingPool(
    int poolId,
    Identity operator,
    OpaqueValue minScore,
    OpaqueValue maxLoan,
    int interestRateBps,
    boolean active,
    String name,
    Instant registeredAt) {

  public LendingPool deactivated() {
    return new LendingPool(poolId, operator, minScore, maxLoan, interestRateBps, false, name, registeredAt);
  }
}

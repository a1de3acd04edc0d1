package com.codeheadsystems.cipherscore.server.exceptions;

import com.codeheadsystems.cipherscore.exceptions.CipherScoreException;

/**
 * Raised when a pool id does not refer to a registered pool.
 */
public class InvalidPoolException extends CipherScoreException {

  private final int poolId;

  public InvalidPoolException(final int poolId) {
    super("No lending pool with id " + poolId);
    this.poolId = poolId;
  }

  public int poolId() {
    return poolId;
  }
}

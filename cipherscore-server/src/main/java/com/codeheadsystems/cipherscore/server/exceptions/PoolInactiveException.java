package com.codeheadsystems.cipherscore.server.exceptions;

import com.codeheadsystems.cipherscore.exceptions.CipherScoreException;

/**
 * Raised when an operation targets a deactivated pool.
 */
public class PoolInactiveException extends CipherScoreException {

  private final int poolId;

  public PoolInactiveException(final int poolId) {
    super("Lending pool " + poolId + " is inactive");
    this.poolId = poolId;
  }

  public int poolId() {
    return poolId;
  }
}

package com.codeheadsystems.cipherscore.auth;

/**
 * Privileges tracked by the {@link AuthorizationGate}.
 */
public enum Capability {
  /**
   * Invoke homomorphic engine operations.
   */
  ENGINE_USE,
  /**
   * Register lending pools.
   */
  POOL_REGISTRATION,
  /**
   * Decrypt opaque values through the engine's privileged escape hatch.
   */
  DECRYPT
}

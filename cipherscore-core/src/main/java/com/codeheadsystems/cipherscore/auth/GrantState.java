package com.codeheadsystems.cipherscore.auth;

/**
 * Per (identity, capability) authorization state.
 * <p>
 * Transitions: {@code UNAUTHORIZED -> AUTHORIZED} by grant, {@code AUTHORIZED -> REVOKED} by the
 * owner. {@code REVOKED} is terminal.
 */
public enum GrantState {
  UNAUTHORIZED,
  AUTHORIZED,
  REVOKED
}

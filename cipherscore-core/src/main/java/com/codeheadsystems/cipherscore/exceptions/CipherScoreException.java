package com.codeheadsystems.cipherscore.exceptions;

/**
 * Base type for every precondition failure raised by the cipherscore engine and its services.
 * <p>
 * All subclasses are deterministic caller errors: none of them is transient and none is retried.
 */
public class CipherScoreException extends RuntimeException {

  /**
   * Instantiates a new cipherscore exception.
   *
   * @param message the message
   */
  public CipherScoreException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new cipherscore exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CipherScoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

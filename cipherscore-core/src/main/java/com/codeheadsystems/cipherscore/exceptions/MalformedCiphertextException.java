package com.codeheadsystems.cipherscore.exceptions;

/**
 * Raised when an opaque blob has the wrong length or fails backend validation.
 * Indicates a caller bug or data corruption; fatal to the call.
 */
public class MalformedCiphertextException extends CipherScoreException {

  /**
   * Instantiates a new malformed ciphertext exception.
   *
   * @param message the message
   */
  public MalformedCiphertextException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new malformed ciphertext exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedCiphertextException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

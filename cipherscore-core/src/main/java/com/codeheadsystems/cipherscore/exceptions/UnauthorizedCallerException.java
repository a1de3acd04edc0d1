package com.codeheadsystems.cipherscore.exceptions;

import com.codeheadsystems.cipherscore.auth.Capability;
import com.codeheadsystems.cipherscore.model.Identity;

/**
 * Raised when the acting identity does not hold the capability an operation requires,
 * or is not the owner of the resource it tries to mutate.
 */
public class UnauthorizedCallerException extends CipherScoreException {

  private final Identity caller;

  /**
   * Instantiates a new unauthorized caller exception for a missing capability.
   *
   * @param caller     the caller
   * @param capability the capability
   */
  public UnauthorizedCallerException(final Identity caller, final Capability capability) {
    super("Caller " + caller + " is not authorized for " + capability);
    this.caller = caller;
  }

  /**
   * Instantiates a new unauthorized caller exception with a custom message.
   *
   * @param caller  the caller
   * @param message the message
   */
  public UnauthorizedCallerException(final Identity caller, final String message) {
    super(message);
    this.caller = caller;
  }

  public Identity caller() {
    return caller;
  }
}

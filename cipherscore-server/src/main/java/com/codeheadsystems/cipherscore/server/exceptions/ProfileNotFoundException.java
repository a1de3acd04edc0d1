package com.codeheadsystems.cipherscore.server.exceptions;

import com.codeheadsystems.cipherscore.exceptions.CipherScoreException;
import com.codeheadsystems.cipherscore.model.Identity;

/**
 * Raised by operations on an owner that has never submitted financial data.
 * Recoverable by submitting data first.
 */
public class ProfileNotFoundException extends CipherScoreException {

  private final Identity owner;

  public ProfileNotFoundException(final Identity owner) {
    super("No credit profile for " + owner);
    this.owner = owner;
  }

  public Identity owner() {
    return owner;
  }
}

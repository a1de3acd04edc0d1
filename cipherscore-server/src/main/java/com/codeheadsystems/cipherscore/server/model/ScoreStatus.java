package com.codeheadsystems.cipherscore.server.model;

/**
 * Freshness of a profile's computed score.
 */
public enum ScoreStatus {
  /**
   * No score has been computed for the profile.
   */
  NONE,
  /**
   * The score was computed from the current attributes.
   */
  FRESH,
  /**
   * Attributes were resubmitted after the score was computed; the score no longer reflects them.
   */
  STALE
}

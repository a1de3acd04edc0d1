package com.codeheadsystems.cipherscore.server.store;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.model.CreditProfile;
import com.codeheadsystems.cipherscore.server.model.FinancialAttributes;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage abstraction for credit profiles, keyed by owner identity.
 * <p>
 * Implementations must be thread-safe, and every write must replace the owner's profile
 * atomically: a concurrent reader sees either the previous complete profile or the new one.
 * Typical production implementations back this with a key-value store using a single-writer
 * conditional update per key.
 */
public interface ProfileStore {

  /**
   * Replaces the owner's attributes wholesale, creating the profile if needed.
   *
   * @param owner      the owner
   * @param attributes the new encrypted attributes
   * @param at         submission time
   * @return the stored profile
   */
  CreditProfile submit(Identity owner, FinancialAttributes attributes, Instant at);

  /**
   * Loads the owner's profile.
   *
   * @param owner the owner
   * @return the profile, or empty if the owner never submitted data
   */
  Optional<CreditProfile> load(Identity owner);

  /**
   * Stores a computed score if the profile is still at {@code revision}.
   *
   * @param owner    the owner
   * @param revision the revision the score was computed from
   * @param score    the encrypted score
   * @param at       computation time
   * @return true if the score was stored; false if the profile changed or vanished meanwhile
   */
  boolean attachScore(Identity owner, long revision, OpaqueValue score, Instant at);
}

package com.codeheadsystems.cipherscore.server.manager;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.codec.OpaqueValueCodec;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.exceptions.ProfileNotFoundException;
import com.codeheadsystems.cipherscore.server.model.CreditProfile;
import com.codeheadsystems.cipherscore.server.model.FinancialAttributes;
import com.codeheadsystems.cipherscore.server.store.ProfileStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Self-service writes and reads of credit profiles.
 * <p>
 * The acting identity is always the owner: a submission can only ever write the caller's own
 * profile, so no grant is required. Every attribute is validated against the codec before the
 * store is touched.
 */
public class CreditProfileManager {

  private static final Logger log = LoggerFactory.getLogger(CreditProfileManager.class);

  private final ProfileStore profileStore;
  private final OpaqueValueCodec codec;
  private final Clock clock;

  public CreditProfileManager(ProfileStore profileStore, OpaqueValueCodec codec, Clock clock) {
    this.profileStore = profileStore;
    this.codec = codec;
    this.clock = clock;
  }

  /**
   * Submits the four core attributes. Credit utilization is recorded as an encryption of zero.
   *
   * @throws com.codeheadsystems.cipherscore.exceptions.MalformedCiphertextException if any value is malformed
   */
  public CreditProfile submit(Identity owner, OpaqueValue income, OpaqueValue assets,
                              OpaqueValue debts, OpaqueValue paymentHistory) {
    return submit(owner, income, assets, debts, paymentHistory, codec.encrypt(0));
  }

  /**
   * Submits all five attributes, replacing any previous submission wholesale.
   *
   * @throws com.codeheadsystems.cipherscore.exceptions.MalformedCiphertextException if any value is malformed
   */
  public CreditProfile submit(Identity owner, OpaqueValue income, OpaqueValue assets,
                              OpaqueValue debts, OpaqueValue paymentHistory,
                              OpaqueValue creditUtilization) {
    if (owner == null) {
      throw new IllegalArgumentException("Missing owner identity");
    }
    FinancialAttributes attributes = new FinancialAttributes(
        codec.requireValid(income),
        codec.requireValid(assets),
        codec.requireValid(debts),
        codec.requireValid(paymentHistory),
        codec.requireValid(creditUtilization));
    CreditProfile profile = profileStore.submit(owner, attributes, clock.instant());
    log.debug("submit() owner={} revision={}", owner, profile.revision());
    return profile;
  }

  /**
   * Encrypts plaintext attributes with the codec and submits them. Mirrors the client-side flow
   * where the data owner encrypts before anything leaves their control.
   */
  public CreditProfile submitPlaintext(Identity owner, long income, long assets, long debts,
                                       long paymentHistory, long creditUtilization) {
    return submit(owner,
        codec.encrypt(income),
        codec.encrypt(assets),
        codec.encrypt(debts),
        codec.encrypt(paymentHistory),
        codec.encrypt(creditUtilization));
  }

  /**
   * Loads the owner's profile.
   *
   * @throws ProfileNotFoundException if the owner never submitted data
   */
  public CreditProfile get(Identity owner) {
    return profileStore.load(owner).orElseThrow(() -> new ProfileNotFoundException(owner));
  }

  public boolean exists(Identity owner) {
    return profileStore.load(owner).isPresent();
  }
}

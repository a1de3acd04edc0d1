package com.codeheadsystems.cipherscore.server.manager;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.engine.HomomorphicEngine;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.exceptions.ProfileNotFoundException;
import com.codeheadsystems.cipherscore.server.model.CreditProfile;
import com.codeheadsystems.cipherscore.server.model.ScoreStatus;
import com.codeheadsystems.cipherscore.server.store.ProfileStore;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes an opaque credit score from a profile entirely through engine operations.
 * <p>
 * <pre>
 *   total = paymentHistory*35 + income*3 + creditUtilization*20 + assets*15
 *   score = total * SCALE_NUMERATOR
 * </pre>
 * The weights approximate a 35/30/20/15 split with integer scalars and are fixed so that two
 * computations over identical attributes produce the same score under a deterministic backend.
 * The score is expressed in hundredths. Debts are stored but do not enter the score.
 */
public class ScoringManager {

  private static final Logger log = LoggerFactory.getLogger(ScoringManager.class);

  public static final long PAYMENT_HISTORY_WEIGHT = 35;
  public static final long INCOME_WEIGHT = 3;
  public static final long UTILIZATION_WEIGHT = 20;
  public static final long ASSET_WEIGHT = 15;
  public static final long SCALE_NUMERATOR = 100;

  private final HomomorphicEngine engine;
  private final ProfileStore profileStore;
  private final Identity serviceIdentity;
  private final Clock clock;

  /**
   * Instantiates a new scoring manager.
   *
   * @param engine          the engine
   * @param profileStore    the profile store
   * @param serviceIdentity identity the pipeline acts as on the engine; needs {@code ENGINE_USE}
   * @param clock           the clock
   */
  public ScoringManager(HomomorphicEngine engine, ProfileStore profileStore,
                        Identity serviceIdentity, Clock clock) {
    this.engine = engine;
    this.profileStore = profileStore;
    this.serviceIdentity = serviceIdentity;
    this.clock = clock;
  }

  /**
   * Computes the owner's score, stores it in the profile and returns it.
   *
   * @throws ProfileNotFoundException if the owner never submitted data
   * @throws com.codeheadsystems.cipherscore.exceptions.UnauthorizedCallerException if the service
   *                                  identity lacks the engine grant
   */
  public OpaqueValue computeScore(Identity owner) {
    CreditProfile profile = profileStore.load(owner).orElseThrow(() -> new ProfileNotFoundException(owner));

    OpaqueValue paymentTerm = engine.scalarMultiply(serviceIdentity, profile.paymentHistory(), PAYMENT_HISTORY_WEIGHT);
    OpaqueValue incomeTerm = engine.scalarMultiply(serviceIdentity, profile.income(), INCOME_WEIGHT);
    OpaqueValue utilizationTerm = engine.scalarMultiply(serviceIdentity, profile.creditUtilization(), UTILIZATION_WEIGHT);
    OpaqueValue assetTerm = engine.scalarMultiply(serviceIdentity, profile.assets(), ASSET_WEIGHT);

    OpaqueValue total = engine.add(serviceIdentity,
        engine.add(serviceIdentity,
            engine.add(serviceIdentity, paymentTerm, incomeTerm),
            utilizationTerm),
        assetTerm);
    OpaqueValue score = engine.scalarMultiply(serviceIdentity, total, SCALE_NUMERATOR);

    if (!profileStore.attachScore(owner, profile.revision(), score, clock.instant())) {
      log.info("Profile for {} changed during scoring; score not stored", owner);
    }
    log.debug("computeScore() owner={} revision={}", owner, profile.revision());
    return score;
  }

  /**
   * The owner's score if it reflects the current attributes.
   *
   * @return the score, or empty if none was computed or it went stale
   * @throws ProfileNotFoundException if the owner never submitted data
   */
  public Optional<OpaqueValue> latestScore(Identity owner) {
    CreditProfile profile = profileStore.load(owner).orElseThrow(() -> new ProfileNotFoundException(owner));
    return profile.scoreStatus() == ScoreStatus.FRESH ? profile.score() : Optional.empty();
  }

  /**
   * Freshness of the owner's score.
   *
   * @throws ProfileNotFoundException if the owner never submitted data
   */
  public ScoreStatus scoreStatus(Identity owner) {
    return profileStore.load(owner).orElseThrow(() -> new ProfileNotFoundException(owner)).scoreStatus();
  }
}

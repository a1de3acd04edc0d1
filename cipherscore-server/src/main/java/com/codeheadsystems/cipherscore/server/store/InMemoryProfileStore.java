package com.codeheadsystems.cipherscore.server.store;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.model.CreditProfile;
import com.codeheadsystems.cipherscore.server.model.FinancialAttributes;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link ProfileStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Profiles are immutable records swapped per key with {@link ConcurrentHashMap#compute}, which
 * serializes writers for the same owner. All profiles are lost on restart. Suitable for
 * development and integration testing only.
 */
public class InMemoryProfileStore implements ProfileStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryProfileStore.class);

  private final ConcurrentHashMap<Identity, CreditProfile> store = new ConcurrentHashMap<>();

  public InMemoryProfileStore() {
    log.warn("Using InMemoryProfileStore: profiles will NOT survive restarts. "
        + "Replace with a persistent ProfileStore for production.");
  }

  @Override
  public CreditProfile submit(Identity owner, FinancialAttributes attributes, Instant at) {
    CreditProfile stored = store.compute(owner, (id, current) -> current == null
        ? CreditProfile.initial(owner, attributes, at)
        : current.resubmit(attributes, at));
    log.debug("Stored profile for {} at revision {}", owner, stored.revision());
    return stored;
  }

  @Override
  public Optional<CreditProfile> load(Identity owner) {
    return Optional.ofNullable(store.get(owner));
  }

  @Override
  public boolean attachScore(Identity owner, long revision, OpaqueValue score, Instant at) {
    boolean[] attached = {false};
    store.computeIfPresent(owner, (id, current) -> {
      if (current.revision() != revision) {
        return current;
      }
      attached[0] = true;
      return current.withScore(score, at);
    });
    if (!attached[0]) {
      log.debug("Discarded score for {}: profile moved past revision {}", owner, revision);
    }
    return attached[0];
  }
}

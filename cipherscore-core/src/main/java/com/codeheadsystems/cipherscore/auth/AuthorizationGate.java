package com.codeheadsystems.cipherscore.auth;

import com.codeheadsystems.cipherscore.audit.AuditTrail;
import com.codeheadsystems.cipherscore.exceptions.UnauthorizedCallerException;
import com.codeheadsystems.cipherscore.model.Identity;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks which principals hold which {@link Capability}.
 * <p>
 * The owner identity supplied at construction is implicitly authorized for every capability and
 * can never be revoked. Any other identity starts {@link GrantState#UNAUTHORIZED}; it becomes
 * authorized through a grant issued by the owner or by an identity already authorized for the same
 * capability. Only the owner revokes, and a revoked grant cannot be re-issued.
 * <p>
 * Thread-safe.
 */
public class AuthorizationGate {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationGate.class);

  private final Identity owner;
  private final AuditTrail auditTrail;
  private final Map<Capability, ConcurrentHashMap<Identity, GrantState>> grants = new ConcurrentHashMap<>();

  /**
   * Instantiates a new authorization gate.
   *
   * @param owner      the deploying owner
   * @param auditTrail the audit trail
   */
  public AuthorizationGate(Identity owner, AuditTrail auditTrail) {
    if (owner == null) {
      throw new IllegalArgumentException("Missing owner identity");
    }
    this.owner = owner;
    this.auditTrail = auditTrail;
    for (Capability capability : Capability.values()) {
      grants.put(capability, new ConcurrentHashMap<>());
    }
  }

  public Identity owner() {
    return owner;
  }

  /**
   * Returns the state of {@code identity} for {@code capability}.
   */
  public GrantState state(Identity identity, Capability capability) {
    if (owner.equals(identity)) {
      return GrantState.AUTHORIZED;
    }
    return grants.get(capability).getOrDefault(identity, GrantState.UNAUTHORIZED);
  }

  /**
   * Returns true if {@code identity} currently holds {@code capability}.
   */
  public boolean isAuthorized(Identity identity, Capability capability) {
    return identity != null && state(identity, capability) == GrantState.AUTHORIZED;
  }

  /**
   * Returns true if {@code identity} may invoke engine operations.
   */
  public boolean isAuthorized(Identity identity) {
    return isAuthorized(identity, Capability.ENGINE_USE);
  }

  /**
   * Precondition gate.
   *
   * @throws UnauthorizedCallerException if {@code identity} does not hold {@code capability}
   */
  public void require(Identity identity, Capability capability) {
    if (!isAuthorized(identity, capability)) {
      log.debug("Rejected {} for {}", identity, capability);
      throw new UnauthorizedCallerException(identity, capability);
    }
  }

  /**
   * Grants {@code capability} to {@code grantee}. Idempotent for already-authorized grantees.
   *
   * @throws UnauthorizedCallerException if the grantor does not hold the capability itself
   * @throws IllegalStateException       if the grantee's grant was revoked
   */
  public void grant(Identity grantor, Identity grantee, Capability capability) {
    require(grantor, capability);
    if (grantee == null) {
      throw new IllegalArgumentException("Missing grantee");
    }
    if (owner.equals(grantee)) {
      return;
    }
    grants.get(capability).compute(grantee, (id, current) -> {
      if (current == GrantState.REVOKED) {
        throw new IllegalStateException("Grant of " + capability + " to " + grantee + " was revoked");
      }
      return GrantState.AUTHORIZED;
    });
    log.debug("Granted {} to {} by {}", capability, grantee, grantor);
    auditTrail.record("auth.grant", grantor, capability + ":" + grantee);
  }

  /**
   * Revokes {@code capability} from {@code identity}. Owner only; idempotent for revoked grants.
   *
   * @throws UnauthorizedCallerException if {@code actor} is not the owner
   * @throws IllegalArgumentException    if {@code identity} is the owner
   * @throws IllegalStateException       if {@code identity} was never granted {@code capability}
   */
  public void revoke(Identity actor, Identity identity, Capability capability) {
    if (!owner.equals(actor)) {
      throw new UnauthorizedCallerException(actor, "Only the owner may revoke grants");
    }
    if (owner.equals(identity)) {
      throw new IllegalArgumentException("The owner cannot be revoked");
    }
    boolean[] changed = {false};
    grants.get(capability).compute(identity, (id, current) -> {
      if (current == null || current == GrantState.UNAUTHORIZED) {
        throw new IllegalStateException(identity + " holds no grant for " + capability);
      }
      changed[0] = current == GrantState.AUTHORIZED;
      return GrantState.REVOKED;
    });
    if (!changed[0]) {
      return;
    }
    log.info("Revoked {} from {}", capability, identity);
    auditTrail.record("auth.revoke", actor, capability + ":" + identity);
  }

  /**
   * Identities currently authorized for {@code capability}, excluding the implicit owner.
   */
  public Set<Identity> authorized(Capability capability) {
    Set<Identity> result = new TreeSet<>();
    grants.get(capability).forEach((id, state) -> {
      if (state == GrantState.AUTHORIZED) {
        result.add(id);
      }
    });
    return result;
  }
}

package com.codeheadsystems.cipherscore.engine;

import com.codeheadsystems.cipherscore.audit.AuditTrail;
import com.codeheadsystems.cipherscore.auth.AuthorizationGate;
import com.codeheadsystems.cipherscore.auth.Capability;
import com.codeheadsystems.cipherscore.codec.HomomorphicBackend;
import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.codec.OpaqueValueCodec;
import com.codeheadsystems.cipherscore.model.Identity;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arithmetic and ordering over {@link OpaqueValue}s without exposing plaintext to the caller.
 * <p>
 * Every operation first checks that the caller holds {@link Capability#ENGINE_USE}, then validates
 * its operands against the codec, then evaluates on the backend and finally emits an audit event
 * carrying only the opaque result. A failed operation emits nothing.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link com.codeheadsystems.cipherscore.exceptions.UnauthorizedCallerException}: missing grant</li>
 *   <li>{@link com.codeheadsystems.cipherscore.exceptions.MalformedCiphertextException}: bad operand</li>
 *   <li>{@link IllegalArgumentException}: negative scalar</li>
 * </ul>
 */
public class HomomorphicEngine {

  private static final Logger log = LoggerFactory.getLogger(HomomorphicEngine.class);

  private final OpaqueValueCodec codec;
  private final HomomorphicBackend backend;
  private final AuthorizationGate gate;
  private final AuditTrail auditTrail;

  /**
   * Instantiates a new homomorphic engine.
   *
   * @param codec      the codec
   * @param gate       the authorization gate
   * @param auditTrail the audit trail
   */
  public HomomorphicEngine(OpaqueValueCodec codec, AuthorizationGate gate, AuditTrail auditTrail) {
    this.codec = codec;
    this.backend = codec.backend();
    this.gate = gate;
    this.auditTrail = auditTrail;
  }

  public OpaqueValueCodec codec() {
    return codec;
  }

  /**
   * Homomorphic addition: the result decrypts to {@code plaintext(a) + plaintext(b)}.
   */
  public OpaqueValue add(Identity caller, OpaqueValue a, OpaqueValue b) {
    gate.require(caller, Capability.ENGINE_USE);
    byte[] left = codec.open(a);
    byte[] right = codec.open(b);
    OpaqueValue result = codec.wrap(backend.add(left, right));
    log.debug("add() by {}", caller);
    auditTrail.record("engine.add", caller, result);
    return result;
  }

  /**
   * Scalar multiplication by a public, non-negative scalar: the result decrypts to
   * {@code plaintext(a) * k}.
   */
  public OpaqueValue scalarMultiply(Identity caller, OpaqueValue a, long k) {
    return scalarMultiply(caller, a, BigInteger.valueOf(k));
  }

  /**
   * Scalar multiplication by a public, non-negative scalar.
   */
  public OpaqueValue scalarMultiply(Identity caller, OpaqueValue a, BigInteger k) {
    gate.require(caller, Capability.ENGINE_USE);
    if (k == null || k.signum() < 0) {
      throw new IllegalArgumentException("Scalar must be a non-negative integer");
    }
    byte[] operand = codec.open(a);
    OpaqueValue result = codec.wrap(backend.multiply(operand, k));
    log.debug("scalarMultiply(k={}) by {}", k, caller);
    auditTrail.record("engine.scalarMultiply", caller, result);
    return result;
  }

  /**
   * Returns true iff {@code plaintext(a) >= plaintext(b)}. Neither plaintext leaves the backend.
   */
  public boolean compareAtLeast(Identity caller, OpaqueValue a, OpaqueValue b) {
    gate.require(caller, Capability.ENGINE_USE);
    byte[] left = codec.open(a);
    byte[] right = codec.open(b);
    boolean result = backend.compare(left, right) >= 0;
    log.debug("compareAtLeast() by {}", caller);
    auditTrail.record("engine.compareAtLeast", caller, "");
    return result;
  }

  /**
   * Privileged decryption for audit and testing. Requires {@link Capability#DECRYPT} in addition
   * to {@link Capability#ENGINE_USE}. Never on the scoring or matching path.
   */
  public BigInteger decrypt(Identity caller, OpaqueValue a) {
    gate.require(caller, Capability.ENGINE_USE);
    gate.require(caller, Capability.DECRYPT);
    BigInteger plaintext = backend.decrypt(codec.open(a));
    log.warn("Privileged decrypt by {}", caller);
    auditTrail.record("engine.decrypt", caller, "");
    return plaintext;
  }
}

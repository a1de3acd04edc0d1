package com.codeheadsystems.cipherscore.audit;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.model.Identity;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stamps and forwards audit events to an {@link AuditSink}, isolating callers from sink failures.
 */
public class AuditTrail {

  private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

  private final AuditSink sink;
  private final Clock clock;

  public AuditTrail(AuditSink sink, Clock clock) {
    this.sink = sink;
    this.clock = clock;
  }

  /**
   * Records an event whose payload is an opaque result.
   */
  public void record(String operation, Identity caller, OpaqueValue result) {
    record(operation, caller, result == null ? "" : result.toHex());
  }

  /**
   * Records an event with a non-plaintext payload.
   */
  public void record(String operation, Identity caller, String payload) {
    try {
      sink.record(new AuditRecord(operation, caller, payload, clock.instant()));
    } catch (RuntimeException e) {
      log.warn("Audit sink rejected {} by {}: {}", operation, caller, e.getMessage());
    }
  }
}

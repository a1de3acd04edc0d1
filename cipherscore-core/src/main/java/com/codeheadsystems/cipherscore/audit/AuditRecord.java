package com.codeheadsystems.cipherscore.audit;

import com.codeheadsystems.cipherscore.model.Identity;
import java.time.Instant;

/**
 * One audit event. Never carries plaintext.
 *
 * @param operation  operation name, e.g. {@code engine.add}
 * @param caller     acting identity
 * @param payloadHex hex of the resulting opaque blob, or empty when the operation has no opaque result
 * @param timestamp  when the operation completed
 */
public record AuditRecord(String operation, Identity caller, String payloadHex, Instant timestamp) {

  public AuditRecord {
    payloadHex = payloadHex == null ? "" : payloadHex;
  }
}

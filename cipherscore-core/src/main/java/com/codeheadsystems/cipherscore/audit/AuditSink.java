package com.codeheadsystems.cipherscore.audit;

/**
 * Append-only consumer of audit events.
 * <p>
 * Callers treat the sink as fire-and-forget: an exception thrown from {@link #record} is logged
 * and never fails the audited operation.
 */
public interface AuditSink {

  /**
   * Sink that discards everything.
   */
  AuditSink NOOP = record -> {
  };

  void record(AuditRecord record);
}

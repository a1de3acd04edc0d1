package com.codeheadsystems.cipherscore.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Non-persistent {@link AuditSink} keeping events in memory. Suitable for development and tests.
 */
public class InMemoryAuditSink implements AuditSink {

  private final CopyOnWriteArrayList<AuditRecord> records = new CopyOnWriteArrayList<>();

  @Override
  public void record(AuditRecord record) {
    records.add(record);
  }

  /**
   * Snapshot of recorded events in arrival order.
   */
  public List<AuditRecord> records() {
    return List.copyOf(records);
  }

  public List<AuditRecord> records(String operation) {
    return records.stream().filter(r -> r.operation().equals(operation)).toList();
  }

  public void clear() {
    records.clear();
  }
}

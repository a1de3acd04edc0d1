package com.codeheadsystems.cipherscore.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AuditSink} writing one JSON object per event to the {@code cipherscore.audit} logger.
 * Route that logger to its own appender to obtain an append-only audit file.
 */
public class Slf4jAuditSink implements AuditSink {

  private static final Logger audit = LoggerFactory.getLogger("cipherscore.audit");

  private final ObjectMapper objectMapper;

  public Slf4jAuditSink() {
    this(new ObjectMapper());
  }

  public Slf4jAuditSink(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void record(AuditRecord record) {
    audit.info(toJson(record));
  }

  /**
   * Renders a record as a single-line JSON object.
   *
   * @param record the record
   * @return the json
   */
  public String toJson(AuditRecord record) {
    ObjectNode node = objectMapper.createObjectNode()
        .put("operation", record.operation())
        .put("caller", record.caller().value())
        .put("payload", record.payloadHex())
        .put("timestamp", record.timestamp().toString());
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize audit record " + record.operation(), e);
    }
  }
}

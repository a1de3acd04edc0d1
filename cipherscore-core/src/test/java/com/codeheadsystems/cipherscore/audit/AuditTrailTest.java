package com.codeheadsystems.cipherscore.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.cipherscore.model.Identity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuditTrailTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  private static final Identity ALICE = Identity.of("0xalice");

  @Mock private AuditSink failingSink;

  @Test
  void record_stampsWithClock() {
    InMemoryAuditSink sink = new InMemoryAuditSink();
    new AuditTrail(sink, CLOCK).record("pool.add", ALICE, "0");

    assertThat(sink.records()).containsExactly(new AuditRecord("pool.add", ALICE, "0", NOW));
  }

  @Test
  void record_sinkFailureIsSwallowedAfterLogging() {
    doThrow(new IllegalStateException("disk full")).when(failingSink).record(any());

    assertThatCode(() -> new AuditTrail(failingSink, CLOCK).record("engine.add", ALICE, "ab"))
        .doesNotThrowAnyException();
    verify(failingSink).record(any());
  }

  @Test
  void inMemorySink_filtersByOperation() {
    InMemoryAuditSink sink = new InMemoryAuditSink();
    AuditTrail trail = new AuditTrail(sink, CLOCK);
    trail.record("engine.add", ALICE, "01");
    trail.record("engine.decrypt", ALICE, (String) null);
    trail.record("engine.add", ALICE, "02");

    assertThat(sink.records("engine.add")).extracting(AuditRecord::payloadHex).containsExactly("01", "02");
    assertThat(sink.records("engine.decrypt")).extracting(AuditRecord::payloadHex).containsExactly("");

    sink.clear();
    assertThat(sink.records()).isEmpty();
  }

  @Test
  void slf4jSink_rendersSingleLineJson() throws Exception {
    Slf4jAuditSink sink = new Slf4jAuditSink();

    String json = sink.toJson(new AuditRecord("engine.scalarMultiply", ALICE, "beef", NOW));

    assertThat(json).doesNotContain("\n");
    JsonNode node = new ObjectMapper().readTree(json);
    assertThat(node.get("operation").asText()).isEqualTo("engine.scalarMultiply");
    assertThat(node.get("caller").asText()).isEqualTo("0xalice");
    assertThat(node.get("payload").asText()).isEqualTo("beef");
    assertThat(node.get("timestamp").asText()).isEqualTo("2024-05-01T12:00:00Z");
  }

  @Test
  void noopSink_acceptsEverything() {
    assertThatCode(() -> AuditSink.NOOP.record(new AuditRecord("x", ALICE, "", NOW)))
        .doesNotThrowAnyException();
  }
}

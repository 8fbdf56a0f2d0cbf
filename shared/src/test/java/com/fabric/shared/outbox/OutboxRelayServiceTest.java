package com.fabric.shared.outbox;

import com.fabric.shared.kafka.EventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxRelayServiceTest {

    @Mock OutboxRepository outboxRepository;
    @Mock EventPublisher eventPublisher;

    SimpleMeterRegistry meterRegistry;
    OutboxRelayService relayService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        relayService = new OutboxRelayService(outboxRepository, eventPublisher, meterRegistry);
    }

    private OutboxRecord record(String id) {
        return OutboxRecord.builder()
                .id(id)
                .aggregateId("exec-1")
                .aggregateType("Execution")
                .eventType("execution.step-completed")
                .topic("runtime.wal-events")
                .payload("{\"id\":\"" + id + "\"}")
                .build();
    }

    // ─── relay ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("relay — publishes keyed by execution id and marks records published")
    void relay_shouldPublishAndMark() {
        OutboxRecord first = record("evt-1");
        OutboxRecord second = record("evt-2");
        when(outboxRepository.findUnpublishedForRelay(any(), eq(OutboxRecord.MAX_ATTEMPTS), anyInt()))
                .thenReturn(List.of(first, second));

        relayService.relay();

        verify(eventPublisher).publishAndWait("runtime.wal-events", "exec-1", "evt-1",
                "execution.step-completed", "{\"id\":\"evt-1\"}");
        verify(eventPublisher).publishAndWait(eq("runtime.wal-events"), eq("exec-1"), eq("evt-2"), any(), any());
        verify(outboxRepository).saveAll(List.of(first, second));
        assertThat(first.isPublished()).isTrue();
        assertThat(second.isPublished()).isTrue();
        assertThat(meterRegistry.counter("outbox.records.relayed").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("relay — a publish failure backs the record off and keeps the rest of the batch going")
    void relay_failureShouldBackOff() {
        OutboxRecord failing = record("evt-1");
        OutboxRecord ok = record("evt-2");
        when(outboxRepository.findUnpublishedForRelay(any(), anyInt(), anyInt()))
                .thenReturn(List.of(failing, ok));
        doThrow(new EventPublisher.EventPublishException("broker down", new RuntimeException()))
                .when(eventPublisher).publishAndWait(any(), any(), eq("evt-1"), any(), any());
        Instant before = Instant.now();

        relayService.relay();

        assertThat(failing.isPublished()).isFalse();
        assertThat(failing.getRetryCount()).isEqualTo(1);
        assertThat(failing.getLastError()).isEqualTo("broker down");
        assertThat(failing.getNextRetryAt()).isAfterOrEqualTo(before.plusSeconds(5));
        assertThat(ok.isPublished()).isTrue();
        assertThat(meterRegistry.counter("outbox.relay.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("relay — nothing pending means no publish and no save")
    void relay_emptyBatchShouldDoNothing() {
        when(outboxRepository.findUnpublishedForRelay(any(), anyInt(), anyInt())).thenReturn(List.of());

        relayService.relay();

        verifyNoInteractions(eventPublisher);
        verify(outboxRepository, never()).saveAll(any());
    }

    // ─── OutboxRecord ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("recordFailure — backoff doubles and the record exhausts after the last attempt")
    void recordFailure_shouldDoubleBackoffUntilExhausted() {
        OutboxRecord record = record("evt-1");
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        record.recordFailure("e", now);
        assertThat(Duration.between(now, record.getNextRetryAt())).isEqualTo(Duration.ofSeconds(5));
        record.recordFailure("e", now);
        assertThat(Duration.between(now, record.getNextRetryAt())).isEqualTo(Duration.ofSeconds(10));
        record.recordFailure("e", now);
        record.recordFailure("e", now);
        assertThat(record.isExhausted()).isFalse();
        record.recordFailure("e", now);

        assertThat(Duration.between(now, record.getNextRetryAt())).isEqualTo(Duration.ofSeconds(80));
        assertThat(record.isExhausted()).isTrue();
    }
}

package com.fabric.shared.outbox;

import com.fabric.shared.kafka.EventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Polls the outbox and publishes pending rows to Kafka, keyed by aggregate (execution) id
 * so one execution's events stay ordered on a partition.
 */
@Slf4j
public class OutboxRelayService {

    private static final int BATCH_SIZE = 50;

    private final OutboxRepository outboxRepository;
    private final EventPublisher eventPublisher;
    private final Counter relayedCounter;
    private final Counter relayErrorCounter;

    public OutboxRelayService(OutboxRepository outboxRepository, EventPublisher eventPublisher,
                              MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.eventPublisher = eventPublisher;
        this.relayedCounter = Counter.builder("outbox.records.relayed")
                .description("Outbox records successfully relayed to Kafka")
                .register(meterRegistry);
        this.relayErrorCounter = Counter.builder("outbox.relay.errors")
                .description("Errors during outbox relay")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${runtime.outbox.relay-interval-ms:1000}")
    @Transactional
    public void relay() {
        List<OutboxRecord> records = outboxRepository
                .findUnpublishedForRelay(Instant.now(), OutboxRecord.MAX_ATTEMPTS, BATCH_SIZE);

        if (records.isEmpty()) return;

        log.debug("Outbox relay: processing {} records", records.size());

        for (OutboxRecord record : records) {
            try {
                eventPublisher.publishAndWait(record.getTopic(), record.getAggregateId(),
                        record.getId(), record.getEventType(), record.getPayload());
                record.markPublished(Instant.now());
                relayedCounter.increment();
            } catch (EventPublisher.EventPublishException ex) {
                log.error("Failed to relay outbox record: id={}, eventType={}, attempt={}",
                        record.getId(), record.getEventType(), record.getRetryCount() + 1, ex);
                record.recordFailure(ex.getMessage(), Instant.now());
                relayErrorCounter.increment();
                if (record.isExhausted()) {
                    log.error("Outbox record exhausted, left for operator review: id={}, aggregateId={}",
                            record.getId(), record.getAggregateId());
                }
            }
        }

        outboxRepository.saveAll(records);
    }
}

package com.fabric.shared.outbox;

import com.fabric.shared.events.CloudEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes outbox rows. Must join the caller's transaction so the row commits or rolls back
 * together with the state it announces.
 */
@Slf4j
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void append(String aggregateId, String aggregateType,
                       String eventType, String topic, CloudEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event to JSON: " + eventType, e);
        }

        outboxRepository.save(OutboxRecord.builder()
                .id(event.getId())
                .aggregateId(aggregateId)
                .aggregateType(aggregateType)
                .eventType(eventType)
                .topic(topic)
                .payload(payload)
                .build());

        log.debug("Outbox record appended: eventId={}, type={}, aggregateId={}",
                event.getId(), eventType, aggregateId);
    }
}

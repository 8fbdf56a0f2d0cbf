package com.fabric.shared.kafka;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka producer for already-serialized CloudEvent envelopes.
 *
 * The underlying KafkaTemplate is an idempotent producer (enable.idempotence=true); event
 * type and id travel as record headers so consumers can route without parsing the body.
 */
@Slf4j
public class EventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public EventPublisher(KafkaTemplate<String, String> kafkaTemplate, MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.publishSuccessCounter = Counter.builder("kafka.messages.published")
                .tag("status", "success")
                .description("Total Kafka messages published successfully")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("kafka.messages.published")
                .tag("status", "error")
                .description("Total Kafka message publish failures")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("kafka.publish.duration")
                .description("Time to publish a message to Kafka")
                .register(meterRegistry);
    }

    public CompletableFuture<SendResult<String, String>> publish(String topic, String partitionKey,
                                                                 String eventId, String eventType,
                                                                 String payload) {
        Timer.Sample sample = Timer.start();
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, partitionKey, payload);
        record.headers()
                .add(new RecordHeader("event-type", eventType.getBytes(StandardCharsets.UTF_8)))
                .add(new RecordHeader("event-id", eventId.getBytes(StandardCharsets.UTF_8)))
                .add(new RecordHeader("correlation-id", partitionKey.getBytes(StandardCharsets.UTF_8)));

        return kafkaTemplate.send(record)
                .whenComplete((result, ex) -> {
                    sample.stop(publishTimer);
                    if (ex == null) {
                        publishSuccessCounter.increment();
                        log.debug("Event published: topic={}, eventId={}, type={}, partition={}, offset={}",
                                topic, eventId, eventType,
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    } else {
                        publishErrorCounter.increment();
                        log.error("Failed to publish event: topic={}, eventId={}, type={}, error={}",
                                topic, eventId, eventType, ex.getMessage());
                    }
                });
    }

    /** Blocks until the broker acknowledges. */
    public void publishAndWait(String topic, String partitionKey, String eventId, String eventType, String payload) {
        try {
            publish(topic, partitionKey, eventId, eventType, payload).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing " + eventType, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new EventPublishException("Failed to publish event synchronously: " + eventType, e);
        }
    }

    public static class EventPublishException extends RuntimeException {
        public EventPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

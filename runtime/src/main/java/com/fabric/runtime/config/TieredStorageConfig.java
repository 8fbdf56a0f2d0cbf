package com.fabric.runtime.config;

import com.fabric.shared.infra.InfraRetry;
import com.fabric.shared.kafka.EventPublisher;
import com.fabric.shared.outbox.OutboxRelayService;
import com.fabric.shared.outbox.OutboxRepository;
import com.fabric.shared.outbox.OutboxService;
import com.fabric.shared.state.DurableStateStore;
import com.fabric.shared.state.StateRecordRepository;
import com.fabric.shared.state.StateSurface;
import com.fabric.shared.state.TieredStateSurface;
import com.fabric.shared.wal.JpaWriteAheadLog;
import com.fabric.shared.wal.RetryingWriteAheadLog;
import com.fabric.shared.wal.WalEventRecordRepository;
import com.fabric.shared.wal.WriteAheadLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * {@code runtime.storage.mode=tiered} (default)
 *
 *   state surface: Redis hot tier over the PostgreSQL state_records table
 *   WAL:           wal_events table, each append enqueueing an outbox row in its transaction
 *   relay:         outbox → Kafka topic {@code runtime.kafka.wal-topic}
 */
@Configuration
@ConditionalOnProperty(name = "runtime.storage.mode", havingValue = "tiered", matchIfMissing = true)
@EnableJpaRepositories(basePackages = "com.fabric.shared")
@EntityScan(basePackages = "com.fabric.shared")
public class TieredStorageConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    // ─── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public InfraRetry infraRetry(@Value("${runtime.retry.max-attempts:3}") int maxAttempts,
                                 @Value("${runtime.retry.initial-backoff:PT0.2S}") Duration initialBackoff,
                                 @Value("${runtime.retry.multiplier:2.0}") double multiplier) {
        return new InfraRetry("state-and-wal", maxAttempts, initialBackoff, multiplier);
    }

    // ─── State Surface ────────────────────────────────────────────────────────

    @Bean
    public DurableStateStore durableStateStore(StateRecordRepository repository) {
        return new DurableStateStore(repository);
    }

    @Bean
    public StateSurface tieredStateSurface(DurableStateStore durableStateStore,
                                           StringRedisTemplate redisTemplate,
                                           ObjectMapper objectMapper,
                                           InfraRetry infraRetry,
                                           @Value("${runtime.state.hot-ttl:PT10M}") Duration hotTtl,
                                           Clock clock) {
        return new TieredStateSurface(durableStateStore, redisTemplate, objectMapper, infraRetry, hotTtl, clock);
    }

    // ─── WAL + Outbox ─────────────────────────────────────────────────────────

    @Bean
    public OutboxService outboxService(OutboxRepository outboxRepository, ObjectMapper objectMapper) {
        return new OutboxService(outboxRepository, objectMapper);
    }

    @Bean
    public JpaWriteAheadLog jpaWriteAheadLog(WalEventRecordRepository repository,
                                             OutboxService outboxService,
                                             ObjectMapper objectMapper,
                                             @Value("${runtime.kafka.wal-topic:runtime.wal-events}") String walTopic) {
        return new JpaWriteAheadLog(repository, outboxService, objectMapper, walTopic);
    }

    /** Retries wrap the transactional append, so each attempt is its own transaction. */
    @Bean
    @Primary
    public WriteAheadLog writeAheadLog(JpaWriteAheadLog jpaWriteAheadLog, InfraRetry infraRetry) {
        return new RetryingWriteAheadLog(jpaWriteAheadLog, infraRetry);
    }

    // ─── Kafka Producer ───────────────────────────────────────────────────────

    @Bean
    public ProducerFactory<String, String> producerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        // Idempotent producer; per-execution order is kept by keying on execution id
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, 1000);
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "gzip");
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> kafkaTemplate(ProducerFactory<String, String> producerFactory) {
        return new KafkaTemplate<>(producerFactory);
    }

    @Bean
    public EventPublisher eventPublisher(KafkaTemplate<String, String> kafkaTemplate, MeterRegistry meterRegistry) {
        return new EventPublisher(kafkaTemplate, meterRegistry);
    }

    @Bean
    public OutboxRelayService outboxRelayService(OutboxRepository outboxRepository,
                                                 EventPublisher eventPublisher,
                                                 MeterRegistry meterRegistry) {
        return new OutboxRelayService(outboxRepository, eventPublisher, meterRegistry);
    }
}

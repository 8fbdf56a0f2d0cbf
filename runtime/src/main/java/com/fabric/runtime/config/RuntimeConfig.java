package com.fabric.runtime.config;

import com.fabric.shared.capability.CapabilityRouter;
import com.fabric.shared.capability.RealmModule;
import com.fabric.shared.saga.ExecutionLocks;
import com.fabric.shared.saga.ExecutionStore;
import com.fabric.shared.saga.InProcessExecutionLocks;
import com.fabric.shared.saga.RedisExecutionLocks;
import com.fabric.shared.saga.SagaCoordinator;
import com.fabric.shared.state.StateSurface;
import com.fabric.shared.wal.WalEventExporter;
import com.fabric.shared.wal.WriteAheadLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runtime Spring Configuration
 *
 * Storage-independent wiring: JSON, executors, capability router, locks and the coordinator.
 * The state surface and WAL come from {@link TieredStorageConfig} or {@link MemoryStorageConfig}.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(ContextDefaultsProperties.class)
public class RuntimeConfig {

    // ─── Jackson ──────────────────────────────────────────────────────────────

    /** Problem bodies render their properties at the top level. */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .addMixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ─── Executors ────────────────────────────────────────────────────────────

    /** Drives executions; one drive occupies a thread until its saga is terminal. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService sagaWorkerExecutor(@Value("${saga.worker-threads:8}") int threads) {
        return Executors.newFixedThreadPool(threads, named("saga-worker-"));
    }

    /** Runs realm handlers and compensations, so a stuck handler can be timed out. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sagaHandlerExecutor(@Value("${saga.handler-threads:32}") int threads) {
        return Executors.newFixedThreadPool(threads, named("saga-handler-"));
    }

    // ─── Capabilities ─────────────────────────────────────────────────────────

    @Bean
    public CapabilityRouter capabilityRouter(List<RealmModule> realms) {
        CapabilityRouter router = new CapabilityRouter(realms);
        log.info("Capability router frozen: realms={}, capabilities={}",
                realms.stream().map(RealmModule::name).toList(), router.registrations().size());
        return router;
    }

    // ─── Locks ────────────────────────────────────────────────────────────────

    @Bean
    @ConditionalOnProperty(name = "runtime.lock.mode", havingValue = "local", matchIfMissing = true)
    public ExecutionLocks inProcessExecutionLocks() {
        return new InProcessExecutionLocks();
    }

    @Bean
    @ConditionalOnProperty(name = "runtime.lock.mode", havingValue = "redis")
    public ExecutionLocks redisExecutionLocks(StringRedisTemplate redisTemplate,
                                              @Value("${runtime.lock.lease:PT30S}") Duration lease) {
        return new RedisExecutionLocks(redisTemplate, lease);
    }

    // ─── Saga ─────────────────────────────────────────────────────────────────

    @Bean
    public ExecutionStore executionStore(StateSurface stateSurface, ObjectMapper objectMapper) {
        return new ExecutionStore(stateSurface, objectMapper);
    }

    @Bean
    public SagaCoordinator sagaCoordinator(WriteAheadLog writeAheadLog,
                                           ExecutionStore executionStore,
                                           CapabilityRouter capabilityRouter,
                                           ExecutionLocks executionLocks,
                                           @Qualifier("sagaWorkerExecutor") ExecutorService workerExecutor,
                                           @Qualifier("sagaHandlerExecutor") ExecutorService handlerExecutor,
                                           @Value("${saga.step-timeout-ms:30000}") long stepTimeoutMs,
                                           ContextDefaultsProperties contextDefaults,
                                           MeterRegistry meterRegistry) {
        return new SagaCoordinator(writeAheadLog, executionStore, capabilityRouter, executionLocks,
                workerExecutor, handlerExecutor, Duration.ofMillis(stepTimeoutMs),
                contextDefaults.getDefaults(), meterRegistry);
    }

    @Bean
    public WalEventExporter walEventExporter(ObjectMapper objectMapper) {
        return new WalEventExporter(objectMapper);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

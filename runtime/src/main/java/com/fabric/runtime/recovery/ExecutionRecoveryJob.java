package com.fabric.runtime.recovery;

import com.fabric.shared.saga.Execution;
import com.fabric.shared.saga.ExecutionLocks;
import com.fabric.shared.saga.ExecutionStatus;
import com.fabric.shared.saga.ExecutionStore;
import com.fabric.shared.saga.SagaCoordinator;
import com.fabric.shared.state.StateSurface;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;

/**
 * Execution Recovery
 *
 * At startup every non-terminal execution is handed back to the coordinator, which folds its
 * WAL and continues from there. Afterwards a periodic pass picks up executions that made no
 * progress for {@code runtime.recovery.stale-after} and that no coordinator currently
 * holds. A resume of an execution already being driven backs off on the lease.
 */
@Slf4j
@Component
public class ExecutionRecoveryJob {

    private final StateSurface stateSurface;
    private final ExecutionStore executionStore;
    private final ExecutionLocks locks;
    private final SagaCoordinator coordinator;
    private final Clock clock;
    private final Duration staleAfter;

    public ExecutionRecoveryJob(StateSurface stateSurface,
                                ExecutionStore executionStore,
                                ExecutionLocks locks,
                                SagaCoordinator coordinator,
                                Clock clock,
                                @Value("${runtime.recovery.stale-after:PT2M}") Duration staleAfter) {
        this.stateSurface = stateSurface;
        this.executionStore = executionStore;
        this.locks = locks;
        this.coordinator = coordinator;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        int resumed = resumeMatching(execution -> true);
        log.info("Startup recovery: resumed={}", resumed);
    }

    @Scheduled(initialDelayString = "${runtime.recovery.interval-ms:30000}",
               fixedDelayString = "${runtime.recovery.interval-ms:30000}")
    public void resumeStalled() {
        Instant cutoff = clock.instant().minus(staleAfter);
        int resumed = resumeMatching(execution -> execution.getUpdatedAt() == null
                || execution.getUpdatedAt().isBefore(cutoff));
        if (resumed > 0) {
            log.info("Stalled executions resumed: count={}, staleAfter={}", resumed, staleAfter);
        }
    }

    int resumeMatching(Predicate<Execution> stale) {
        int resumed = 0;
        for (String tenantId : stateSurface.tenants()) {
            for (Execution execution : executionStore.findByStatus(tenantId,
                    ExecutionStatus.PENDING, ExecutionStatus.RUNNING)) {
                if (!stale.test(execution) || locks.isLeased(tenantId, execution.getExecutionId())) {
                    continue;
                }
                log.info("Resuming execution: executionId={}, tenantId={}, status={}, lastSequenceNo={}",
                        execution.getExecutionId(), tenantId, execution.getStatus().wireName(),
                        execution.getLastSequenceNo());
                coordinator.resume(tenantId, execution.getExecutionId());
                resumed++;
            }
        }
        return resumed;
    }
}

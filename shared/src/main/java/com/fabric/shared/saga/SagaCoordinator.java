package com.fabric.shared.saga;

import com.fabric.shared.capability.CapabilityRegistration;
import com.fabric.shared.capability.CapabilityRouter;
import com.fabric.shared.capability.SagaDefinition;
import com.fabric.shared.capability.StepContext;
import com.fabric.shared.capability.StepDefinition;
import com.fabric.shared.error.CapabilityNotFoundException;
import com.fabric.shared.error.ErrorCode;
import com.fabric.shared.error.NotFoundException;
import com.fabric.shared.error.StateCorruptionException;
import com.fabric.shared.error.StepTimeoutException;
import com.fabric.shared.wal.WalEvent;
import com.fabric.shared.wal.WalEventType;
import com.fabric.shared.wal.WalScope;
import com.fabric.shared.wal.WriteAheadLog;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Saga Coordinator
 *
 * Drives executions through their saga definitions:
 *   EXECUTION_STARTED → EXECUTION_RUNNING → per group: STEP_STARTED … STEP_COMPLETED → EXECUTION_COMPLETED
 *
 * On a step failure, timeout or cancellation, completed steps are compensated in reverse
 * completion order. The execution ends compensated when at least one declared compensation
 * ran and none failed, failed otherwise.
 *
 * Every transition is appended to the WAL first and then folded into the snapshot on the
 * state surface. Only the holder of the execution lease appends: the lease is renewed before
 * every append and while waiting on handlers, and a drive that loses it stops without
 * writing. Handlers run on the handler pool, never inside a WAL write, and the
 * coordinator is the only caller: handlers return or throw.
 *
 * A drive always starts from the folded WAL, so {@link #resume} after a crash and a first
 * drive are the same code path. A step found in flight is re-invoked once if it is declared
 * idempotent and failed otherwise.
 */
@Slf4j
public class SagaCoordinator {

    private final WriteAheadLog wal;
    private final ExecutionStore store;
    private final CapabilityRouter router;
    private final ExecutionLocks locks;
    private final ExecutionFolder folder = new ExecutionFolder();
    private final Executor workerExecutor;
    private final ExecutorService handlerExecutor;
    private final Duration defaultStepTimeout;
    private final Map<String, String> platformDefaults;

    // Metrics
    private final Counter sagasStarted;
    private final Counter sagasCompleted;
    private final Counter sagasCompensated;
    private final Counter sagasFailed;
    private final Timer sagaDuration;

    public SagaCoordinator(WriteAheadLog wal,
                           ExecutionStore store,
                           CapabilityRouter router,
                           ExecutionLocks locks,
                           Executor workerExecutor,
                           ExecutorService handlerExecutor,
                           Duration defaultStepTimeout,
                           Map<String, String> platformDefaults,
                           MeterRegistry meterRegistry) {
        this.wal = wal;
        this.store = store;
        this.router = router;
        this.locks = locks;
        this.workerExecutor = workerExecutor;
        this.handlerExecutor = handlerExecutor;
        this.defaultStepTimeout = defaultStepTimeout;
        this.platformDefaults = Map.copyOf(platformDefaults);

        this.sagasStarted     = Counter.builder("saga.started").register(meterRegistry);
        this.sagasCompleted   = Counter.builder("saga.completed").register(meterRegistry);
        this.sagasCompensated = Counter.builder("saga.compensated").register(meterRegistry);
        this.sagasFailed      = Counter.builder("saga.failed").register(meterRegistry);
        this.sagaDuration     = Timer.builder("saga.duration").register(meterRegistry);
    }

    // ─── Admission ─────────────────────────────────────────────────────────────

    /**
     * Records EXECUTION_STARTED and schedules the drive on the worker pool.
     *
     * Admitting an execution id that already has a WAL is a no-op returning its status, which
     * lets intake complete an interrupted admission safely.
     */
    public Execution admit(ExecutionRequest request) {
        String tenantId = request.getTenantId();
        String executionId = request.getExecutionId();

        Optional<ExecutionLease> lease = locks.tryAcquire(tenantId, executionId);
        if (lease.isEmpty()) {
            return findStatus(tenantId, executionId).orElseGet(() -> pendingView(request));
        }

        Execution execution;
        try (ExecutionLease held = lease.get()) {
            List<WalEvent> existing = wal.replay(tenantId, executionId);
            if (!existing.isEmpty()) {
                log.info("Execution already admitted: executionId={}, events={}", executionId, existing.size());
                return status(tenantId, executionId);
            }
            execution = start(request, held);
        }

        if (!execution.isTerminal()) {
            workerExecutor.execute(() -> drive(tenantId, executionId));
        }
        return execution;
    }

    private Execution start(ExecutionRequest request, ExecutionLease lease) {
        SagaDefinition definition = null;
        CapabilityNotFoundException notFound = null;
        try {
            definition = router.resolve(request.getIntentType()).getDefinition();
        } catch (CapabilityNotFoundException e) {
            notFound = e;
        }

        WalScope scope = new WalScope(request.getTenantId(), request.getSessionId(), request.getExecutionId());
        Execution execution = new Execution();
        record(execution, scope, lease, WalEventType.EXECUTION_STARTED, SagaPayloads.started(request, definition));
        sagasStarted.increment();

        log.info("Execution started: executionId={}, tenantId={}, intentType={}, steps={}",
                request.getExecutionId(), request.getTenantId(), request.getIntentType().wireName(),
                execution.getSteps().size());

        if (notFound != null) {
            log.warn("No capability registered: executionId={}, intentType={}",
                    request.getExecutionId(), request.getIntentType().wireName());
            finish(execution, scope, lease, WalEventType.EXECUTION_FAILED,
                    new Failure(ErrorCode.CAPABILITY_NOT_FOUND, notFound.getMessage()));
        }
        return execution;
    }

    // ─── Drive / Resume ────────────────────────────────────────────────────────

    /** Schedules a drive; used by recovery and after cancellation. */
    public void resume(String tenantId, String executionId) {
        workerExecutor.execute(() -> drive(tenantId, executionId));
    }

    /**
     * Runs the execution from its current WAL position to a terminal state. Returns
     * immediately if another writer holds the execution. Failures of the drive itself are
     * logged and left for the recovery job.
     */
    public void drive(String tenantId, String executionId) {
        Optional<ExecutionLease> lease = locks.tryAcquire(tenantId, executionId);
        if (lease.isEmpty()) {
            log.debug("Execution driven elsewhere: executionId={}", executionId);
            return;
        }
        try (ExecutionLease held = lease.get()) {
            List<WalEvent> events = wal.replay(tenantId, executionId);
            if (events.isEmpty()) {
                log.warn("Nothing to drive, no WAL events: executionId={}", executionId);
                return;
            }
            Execution execution = folder.fold(events);
            if (execution.isTerminal()) {
                store.save(execution);
                return;
            }
            run(execution, held);
        } catch (StateCorruptionException e) {
            freeze(tenantId, executionId, e);
        } catch (LeaseLostException e) {
            log.warn("Drive abandoned, lease lost: executionId={}", executionId);
        } catch (RuntimeException e) {
            log.error("Drive aborted, left for recovery: executionId={}", executionId, e);
        }
    }

    private void run(Execution execution, ExecutionLease lease) {
        WalScope scope = scopeOf(execution);

        CapabilityRegistration registration;
        try {
            registration = router.resolve(execution.getIntentType());
        } catch (CapabilityNotFoundException e) {
            finish(execution, scope, lease, WalEventType.EXECUTION_FAILED,
                    new Failure(ErrorCode.CAPABILITY_NOT_FOUND, e.getMessage()));
            return;
        }
        SagaDefinition definition = registration.getDefinition();

        if (execution.getStatus() == ExecutionStatus.PENDING) {
            record(execution, scope, lease, WalEventType.EXECUTION_RUNNING, SagaPayloads.empty());
        }

        Optional<Failure> failure = resumeInFlight(execution, scope, lease, definition)
                .or(() -> priorFailure(execution));
        if (failure.isEmpty()) {
            failure = runGroups(execution, scope, lease, definition);
        }

        if (failure.isPresent()) {
            compensate(execution, scope, lease, definition, failure.get());
        } else {
            finish(execution, scope, lease, WalEventType.EXECUTION_COMPLETED, null);
        }
    }

    /** Steps found running after a restart: re-invoke idempotent ones, fail the rest. */
    private Optional<Failure> resumeInFlight(Execution execution, WalScope scope, ExecutionLease lease,
                                             SagaDefinition definition) {
        Failure failure = null;
        for (SagaStep step : execution.getSteps()) {
            if (step.getStatus() != StepStatus.RUNNING) continue;

            boolean idempotent = definition.step(step.getCapabilityName())
                    .map(StepDefinition::isIdempotent)
                    .orElse(false);
            if (idempotent) {
                log.info("Resuming in-flight step: executionId={}, step={}, attempt={}",
                        execution.getExecutionId(), step.getCapabilityName(), step.getAttemptCount() + 1);
                record(execution, scope, lease, WalEventType.STEP_RESUMED, SagaPayloads.step(step));
            } else {
                String message = "Step " + step.getCapabilityName() + " was interrupted and is not idempotent";
                log.warn("Failing in-flight step: executionId={}, step={}",
                        execution.getExecutionId(), step.getCapabilityName());
                record(execution, scope, lease, WalEventType.STEP_FAILED,
                        SagaPayloads.stepFailed(step, ErrorCode.STEP_EXECUTION, message));
                if (failure == null) failure = new Failure(ErrorCode.STEP_EXECUTION, message);
            }
        }
        return Optional.ofNullable(failure);
    }

    /** A failure or cancellation already recorded before this drive started. */
    private Optional<Failure> priorFailure(Execution execution) {
        if (execution.isCancelRequested()) {
            return Optional.of(new Failure(ErrorCode.CANCELLED, "Execution cancelled"));
        }
        return execution.getSteps().stream()
                .filter(s -> s.getStatus() == StepStatus.FAILED
                        || s.getStatus() == StepStatus.COMPENSATING
                        || s.getStatus() == StepStatus.COMPENSATED)
                .findFirst()
                .map(s -> new Failure(ErrorCode.STEP_EXECUTION,
                        s.getError() != null ? s.getError() : "Compensation in progress"));
    }

    private Optional<Failure> runGroups(Execution execution, WalScope scope, ExecutionLease lease,
                                        SagaDefinition definition) {
        int groupCount = definition.getGroups().size();
        for (int g = 0; g < groupCount; g++) {
            int groupIndex = g;
            List<SagaStep> pending = execution.getSteps().stream()
                    .filter(s -> s.getGroupIndex() == groupIndex && s.getStatus() == StepStatus.PENDING)
                    .toList();
            if (pending.isEmpty()) continue;

            if (store.isCancelRequested(execution.getTenantId(), execution.getExecutionId())) {
                log.info("Cancellation observed: executionId={}, beforeGroup={}", execution.getExecutionId(), g);
                record(execution, scope, lease, WalEventType.EXECUTION_CANCELLED, SagaPayloads.empty());
                return Optional.of(new Failure(ErrorCode.CANCELLED, "Execution cancelled"));
            }

            Optional<Failure> failure = runGroup(execution, scope, lease, definition, pending);
            if (failure.isPresent()) return failure;
        }
        return Optional.empty();
    }

    /** Starts every step of the group, then waits until each one is completed or failed. */
    private Optional<Failure> runGroup(Execution execution, WalScope scope, ExecutionLease lease,
                                       SagaDefinition definition, List<SagaStep> steps) {
        Map<SagaStep, Future<JsonNode>> inFlight = new LinkedHashMap<>();
        Map<SagaStep, Instant> deadlines = new LinkedHashMap<>();
        Map<SagaStep, Duration> timeouts = new LinkedHashMap<>();

        for (SagaStep step : steps) {
            Optional<StepDefinition> stepDefinition = definition.step(step.getCapabilityName());
            if (stepDefinition.isEmpty()) {
                return Optional.of(new Failure(ErrorCode.CAPABILITY_NOT_FOUND,
                        "Step " + step.getCapabilityName() + " is no longer declared"));
            }
            StepDefinition declared = stepDefinition.get();
            int attempt = step.getAttemptCount() + 1;
            record(execution, scope, lease, WalEventType.STEP_STARTED,
                    SagaPayloads.stepStarted(step, attempt, execution.getParameters()));

            StepContext context = contextFor(execution, step.getCapabilityName(), attempt);
            Duration timeout = timeoutOf(declared);
            timeouts.put(step, timeout);
            deadlines.put(step, Instant.now().plus(timeout));
            inFlight.put(step, handlerExecutor.submit(() -> declared.getHandler().handle(context)));
        }

        Failure failure = null;
        for (Map.Entry<SagaStep, Future<JsonNode>> entry : inFlight.entrySet()) {
            SagaStep step = entry.getKey();
            Future<JsonNode> future = entry.getValue();
            try {
                JsonNode output = await(future, deadlines.get(step), lease);
                record(execution, scope, lease, WalEventType.STEP_COMPLETED, SagaPayloads.stepCompleted(step, output));
                log.info("Step completed: executionId={}, step={}", execution.getExecutionId(), step.getCapabilityName());
            } catch (TimeoutException e) {
                future.cancel(true);
                StepTimeoutException timeout = new StepTimeoutException(step.getCapabilityName(), timeouts.get(step));
                log.warn("Step timed out: executionId={}, step={}, timeout={}",
                        execution.getExecutionId(), step.getCapabilityName(), timeouts.get(step));
                record(execution, scope, lease, WalEventType.STEP_FAILED,
                        SagaPayloads.stepFailed(step, ErrorCode.STEP_TIMEOUT, timeout.getMessage()));
                if (failure == null) failure = new Failure(ErrorCode.STEP_TIMEOUT, timeout.getMessage());
            } catch (ExecutionException e) {
                String message = describe(e.getCause());
                log.warn("Step failed: executionId={}, step={}, error={}",
                        execution.getExecutionId(), step.getCapabilityName(), message);
                record(execution, scope, lease, WalEventType.STEP_FAILED,
                        SagaPayloads.stepFailed(step, ErrorCode.STEP_EXECUTION, message));
                if (failure == null) failure = new Failure(ErrorCode.STEP_EXECUTION,
                        "Step " + step.getCapabilityName() + " failed: " + message);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted waiting for step " + step.getCapabilityName(), e);
            } catch (LeaseLostException e) {
                inFlight.values().forEach(f -> f.cancel(true));
                throw e;
            }
        }
        return Optional.ofNullable(failure);
    }

    // ─── Compensation ──────────────────────────────────────────────────────────

    private void compensate(Execution execution, WalScope scope, ExecutionLease lease,
                            SagaDefinition definition, Failure failure) {
        List<SagaStep> toUndo = execution.getSteps().stream()
                .filter(s -> s.getStatus() == StepStatus.COMPLETED || s.getStatus() == StepStatus.COMPENSATING)
                .sorted(Comparator.comparingLong(SagaStep::getCompletedSequenceNo).reversed())
                .toList();

        log.warn("Compensating execution: executionId={}, cause={}, steps={}",
                execution.getExecutionId(), failure.code, toUndo.size());

        for (SagaStep step : toUndo) {
            record(execution, scope, lease, WalEventType.STEP_COMPENSATING, SagaPayloads.step(step));
            Optional<StepDefinition> declared = definition.step(step.getCapabilityName());
            if (declared.isEmpty() || !declared.get().hasCompensation()) {
                record(execution, scope, lease, WalEventType.STEP_COMPENSATED, SagaPayloads.step(step));
                continue;
            }
            try {
                invokeCompensation(execution, step, declared.get(), lease);
                record(execution, scope, lease, WalEventType.STEP_COMPENSATED, SagaPayloads.step(step));
                log.info("Step compensated: executionId={}, step={}", execution.getExecutionId(), step.getCapabilityName());
            } catch (CompensationFailure e) {
                log.error("Compensation failed: executionId={}, step={}, error={}",
                        execution.getExecutionId(), step.getCapabilityName(), e.getMessage());
                record(execution, scope, lease, WalEventType.STEP_COMPENSATION_FAILED,
                        SagaPayloads.stepFailed(step, ErrorCode.STEP_EXECUTION, e.getMessage()));
            }
        }

        boolean anyCompensationFailed = execution.getSteps().stream().anyMatch(SagaStep::isCompensationFailed);
        boolean anyCompensationRan = execution.getSteps().stream()
                .filter(s -> s.getStatus() == StepStatus.COMPENSATED)
                .anyMatch(s -> definition.step(s.getCapabilityName())
                        .map(StepDefinition::hasCompensation)
                        .orElse(false));

        if (anyCompensationRan && !anyCompensationFailed) {
            finish(execution, scope, lease, WalEventType.EXECUTION_COMPENSATED, failure);
        } else {
            finish(execution, scope, lease, WalEventType.EXECUTION_FAILED, failure);
        }
    }

    private void invokeCompensation(Execution execution, SagaStep step, StepDefinition declared,
                                    ExecutionLease lease) {
        StepContext context = contextFor(execution, step.getCapabilityName(), step.getAttemptCount());
        JsonNode output = step.getOutput();
        Future<Void> future = handlerExecutor.submit(() -> {
            declared.getCompensation().compensate(context, output);
            return null;
        });
        Duration timeout = timeoutOf(declared);
        try {
            await(future, Instant.now().plus(timeout), lease);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CompensationFailure(new StepTimeoutException(step.getCapabilityName(), timeout).getMessage());
        } catch (ExecutionException e) {
            throw new CompensationFailure(describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted compensating " + step.getCapabilityName(), e);
        }
    }

    // ─── Cancel / Status ───────────────────────────────────────────────────────

    /**
     * Flags the execution for cancellation. The flag is checked before the next group is
     * dispatched; handlers already running are not interrupted. Terminal executions are
     * returned unchanged.
     */
    public Execution cancel(String tenantId, String executionId) {
        Execution execution = status(tenantId, executionId);
        if (execution.isTerminal()) {
            return execution;
        }
        store.requestCancel(tenantId, executionId);
        log.info("Cancellation requested: executionId={}, tenantId={}", executionId, tenantId);
        resume(tenantId, executionId);
        return status(tenantId, executionId);
    }

    public Execution status(String tenantId, String executionId) {
        return findStatus(tenantId, executionId)
                .orElseThrow(() -> new NotFoundException("execution", executionId));
    }

    public List<WalEvent> history(String tenantId, String executionId) {
        List<WalEvent> events = wal.replay(tenantId, executionId);
        if (events.isEmpty()) {
            throw new NotFoundException("execution", executionId);
        }
        return events;
    }

    public List<Execution> activeExecutions(String tenantId, String sessionId) {
        return store.findBySession(tenantId, sessionId, ExecutionStatus.PENDING, ExecutionStatus.RUNNING);
    }

    /** Snapshot, or the folded WAL when no snapshot was written yet. Empty if never started. */
    public Optional<Execution> findStatus(String tenantId, String executionId) {
        Optional<Execution> snapshot = store.load(tenantId, executionId);
        if (snapshot.isEmpty()) {
            List<WalEvent> events = wal.replay(tenantId, executionId);
            if (events.isEmpty()) return Optional.empty();
            try {
                snapshot = Optional.of(folder.fold(events));
            } catch (StateCorruptionException e) {
                return Optional.of(freeze(tenantId, executionId, e));
            }
        }
        Execution execution = snapshot.get();
        if (!execution.isTerminal() && !execution.isCancelRequested()
                && store.isCancelRequested(tenantId, executionId)) {
            execution.setCancelRequested(true);
        }
        return Optional.of(execution);
    }

    // ─── Helpers ───────────────────────────────────────────────────────────────

    private void record(Execution execution, WalScope scope, ExecutionLease lease,
                        WalEventType type, JsonNode payload) {
        if (!lease.renew()) {
            throw new LeaseLostException();
        }
        WalEvent event = wal.append(scope, type, payload);
        folder.apply(execution, event);
        store.save(execution);
    }

    /** Waits for a handler in slices, renewing the lease between them. */
    private <T> T await(Future<T> future, Instant deadline, ExecutionLease lease)
            throws ExecutionException, TimeoutException, InterruptedException {
        long slice = Math.max(1L, locks.renewInterval().toMillis());
        while (true) {
            try {
                return future.get(Math.min(slice, remaining(deadline)), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (remaining(deadline) == 0L) {
                    throw e;
                }
                if (!lease.renew()) {
                    future.cancel(true);
                    throw new LeaseLostException();
                }
            }
        }
    }

    private void finish(Execution execution, WalScope scope, ExecutionLease lease,
                        WalEventType type, Failure failure) {
        JsonNode payload = failure == null
                ? SagaPayloads.empty()
                : SagaPayloads.executionFailed(failure.code, failure.message);
        record(execution, scope, lease, type, payload);

        switch (type) {
            case EXECUTION_COMPLETED -> sagasCompleted.increment();
            case EXECUTION_COMPENSATED -> sagasCompensated.increment();
            default -> sagasFailed.increment();
        }
        if (execution.getStartedAt() != null && execution.getCompletedAt() != null) {
            sagaDuration.record(Duration.between(execution.getStartedAt(), execution.getCompletedAt()));
        }
        log.info("Execution finished: executionId={}, status={}, errorCode={}",
                execution.getExecutionId(), execution.getStatus().wireName(), execution.getErrorCode());
    }

    /** Corrupt WAL: mark the snapshot failed for operator review and never touch the log again. */
    private Execution freeze(String tenantId, String executionId, StateCorruptionException e) {
        log.error("STATE_CORRUPTION: execution frozen for operator review: executionId={}, tenantId={}, sequenceNo={}, error={}",
                executionId, tenantId, e.getSequenceNo(), e.getMessage());
        Execution frozen = store.load(tenantId, executionId).orElseGet(() -> Execution.builder()
                .executionId(executionId)
                .tenantId(tenantId)
                .build());
        frozen.setStatus(ExecutionStatus.FAILED);
        frozen.setErrorCode(ErrorCode.STATE_CORRUPTION);
        frozen.setError(e.getMessage());
        frozen.setUpdatedAt(Instant.now());
        store.save(frozen);
        sagasFailed.increment();
        return frozen;
    }

    private StepContext contextFor(Execution execution, String stepName, int attempt) {
        Map<String, JsonNode> outputs = new LinkedHashMap<>();
        for (SagaStep step : execution.getSteps()) {
            if (step.getOutput() != null && !step.getOutput().isNull()) {
                outputs.put(step.getCapabilityName(), step.getOutput());
            }
        }
        return StepContext.builder()
                .tenantId(execution.getTenantId())
                .sessionId(execution.getSessionId())
                .userId(execution.getUserId())
                .solutionId(execution.getSolutionId())
                .executionId(execution.getExecutionId())
                .intentId(execution.getIntentId())
                .intentType(execution.getIntentType())
                .stepName(stepName)
                .attempt(attempt)
                .parameters(execution.getParameters())
                .sessionContext(execution.getSessionContext())
                .platformDefaults(platformDefaults)
                .previousOutputs(outputs)
                .build();
    }

    private Execution pendingView(ExecutionRequest request) {
        return Execution.builder()
                .executionId(request.getExecutionId())
                .intentId(request.getIntentId())
                .intentType(request.getIntentType())
                .tenantId(request.getTenantId())
                .sessionId(request.getSessionId())
                .status(ExecutionStatus.PENDING)
                .build();
    }

    private Duration timeoutOf(StepDefinition step) {
        return step.getTimeout() != null ? step.getTimeout() : defaultStepTimeout;
    }

    private static long remaining(Instant deadline) {
        return Math.max(0L, Duration.between(Instant.now(), deadline).toMillis());
    }

    private static WalScope scopeOf(Execution execution) {
        return new WalScope(execution.getTenantId(), execution.getSessionId(), execution.getExecutionId());
    }

    private static String describe(Throwable error) {
        if (error == null) return "unknown error";
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static final class Failure {
        private final ErrorCode code;
        private final String message;

        private Failure(ErrorCode code, String message) {
            this.code = code;
            this.message = message;
        }
    }

    private static class LeaseLostException extends RuntimeException {
        LeaseLostException() {
            super("Execution lease lost");
        }
    }

    private static class CompensationFailure extends RuntimeException {
        CompensationFailure(String message) {
            super(message);
        }
    }
}

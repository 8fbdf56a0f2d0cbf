package com.fabric.runtime.intake;

import com.fabric.runtime.identity.CallerIdentity;
import com.fabric.runtime.session.Session;
import com.fabric.runtime.session.SessionManager;
import com.fabric.shared.capability.IntentType;
import com.fabric.shared.error.ValidationException;
import com.fabric.shared.error.VersionConflictException;
import com.fabric.shared.saga.Execution;
import com.fabric.shared.saga.ExecutionRequest;
import com.fabric.shared.saga.SagaCoordinator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Intent Intake
 *
 * Public entry point: validate → replay by idempotency key → check the given session →
 * reserve key → create the session if none was given → admit to the coordinator.
 *
 * A keyed submission costs exactly one state write for the reservation. A repeated key
 * returns the existing execution's status without dispatching anything. A reservation whose
 * execution was never started (crash between the two writes) is completed under the
 * reserved ids on the next submission with that key. A session is only created once the
 * reservation is won, under the id the reservation already carries.
 */
@Slf4j
@Service
public class IntentIntake {

    private final SessionManager sessions;
    private final IdempotencyRegistry idempotency;
    private final SagaCoordinator coordinator;
    private final Clock clock;

    private final Counter admittedCounter;
    private final Counter replayedCounter;

    public IntentIntake(SessionManager sessions,
                        IdempotencyRegistry idempotency,
                        SagaCoordinator coordinator,
                        Clock clock,
                        MeterRegistry meterRegistry) {
        this.sessions = sessions;
        this.idempotency = idempotency;
        this.coordinator = coordinator;
        this.clock = clock;
        this.admittedCounter = Counter.builder("intake.admitted")
                .description("Intents admitted as new executions")
                .register(meterRegistry);
        this.replayedCounter = Counter.builder("intake.replayed")
                .description("Submissions collapsed onto an existing execution by idempotency key")
                .register(meterRegistry);
    }

    public Admission submit(IntentSubmission submission, CallerIdentity caller) {
        IntentType type = validate(submission, caller);
        String tenantId = caller.getTenantId();
        String key = blankToNull(submission.getIdempotencyKey());

        if (key != null) {
            Optional<IdempotencyReservation> existing = idempotency.find(tenantId, key);
            if (existing.isPresent()) {
                return replay(tenantId, existing.get());
            }
        }

        Optional<Session> given = givenSession(submission, caller);
        String sessionId = given.map(Session::getSessionId).orElseGet(() -> UUID.randomUUID().toString());
        String executionId = UUID.randomUUID().toString();
        String intentId = UUID.randomUUID().toString();
        JsonNode parameters = submission.getParameters() != null
                ? submission.getParameters()
                : JsonNodeFactory.instance.objectNode();

        if (key != null) {
            IdempotencyReservation candidate = IdempotencyReservation.builder()
                    .idempotencyKey(key)
                    .executionId(executionId)
                    .intentId(intentId)
                    .intentType(type.wireName())
                    .sessionId(sessionId)
                    .userId(caller.getUserId())
                    .solutionId(submission.getSolutionId())
                    .parameters(parameters)
                    .reservedAt(clock.instant())
                    .build();
            IdempotencyReservation holder = idempotency.reserve(tenantId, candidate);
            if (!holder.getExecutionId().equals(executionId)) {
                return replay(tenantId, holder);
            }
        }

        Session session = given.orElseGet(() -> sessions.create(tenantId, sessionId, caller.getUserId(), null));

        ExecutionRequest request = ExecutionRequest.builder()
                .executionId(executionId)
                .intentId(intentId)
                .intentType(type)
                .tenantId(tenantId)
                .sessionId(session.getSessionId())
                .userId(caller.getUserId())
                .solutionId(submission.getSolutionId())
                .idempotencyKey(key)
                .parameters(parameters)
                .sessionContext(session.getContext())
                .build();
        coordinator.admit(request);
        sessions.touch(tenantId, session.getSessionId());
        admittedCounter.increment();

        log.info("Intent admitted: executionId={}, intentId={}, tenantId={}, sessionId={}, type={}",
                executionId, intentId, tenantId, session.getSessionId(), type.wireName());
        return Admission.builder()
                .executionId(executionId)
                .intentId(intentId)
                .sessionId(session.getSessionId())
                .status(Admission.ADMITTED)
                .replayed(false)
                .build();
    }

    // ─── Replay ───────────────────────────────────────────────────────────────

    private Admission replay(String tenantId, IdempotencyReservation reservation) {
        replayedCounter.increment();
        Execution execution = coordinator.findStatus(tenantId, reservation.getExecutionId())
                .orElseGet(() -> completeOrphan(tenantId, reservation));

        log.info("Intent replayed: executionId={}, tenantId={}, key={}, status={}",
                reservation.getExecutionId(), tenantId, reservation.getIdempotencyKey(),
                execution.getStatus().wireName());
        return Admission.builder()
                .executionId(reservation.getExecutionId())
                .intentId(reservation.getIntentId())
                .sessionId(reservation.getSessionId())
                .status(execution.getStatus().wireName())
                .replayed(true)
                .build();
    }

    /** The key was reserved but the execution never started. */
    private Execution completeOrphan(String tenantId, IdempotencyReservation reservation) {
        log.warn("Completing interrupted admission: executionId={}, tenantId={}, key={}",
                reservation.getExecutionId(), tenantId, reservation.getIdempotencyKey());
        JsonNode sessionContext = sessions.find(tenantId, reservation.getSessionId())
                .orElseGet(() -> createReservedSession(tenantId, reservation))
                .getContext();
        ExecutionRequest request = ExecutionRequest.builder()
                .executionId(reservation.getExecutionId())
                .intentId(reservation.getIntentId())
                .intentType(IntentType.fromWire(reservation.getIntentType())
                        .orElseThrow(() -> new IllegalStateException(
                                "Reserved intent type is unknown: " + reservation.getIntentType())))
                .tenantId(tenantId)
                .sessionId(reservation.getSessionId())
                .userId(reservation.getUserId())
                .solutionId(reservation.getSolutionId())
                .idempotencyKey(reservation.getIdempotencyKey())
                .parameters(reservation.getParameters())
                .sessionContext(sessionContext)
                .build();
        return coordinator.admit(request);
    }

    /** The reservation was won but its auto-created session was never written. */
    private Session createReservedSession(String tenantId, IdempotencyReservation reservation) {
        try {
            return sessions.create(tenantId, reservation.getSessionId(), reservation.getUserId(), null);
        } catch (VersionConflictException e) {
            return sessions.get(tenantId, reservation.getSessionId());
        }
    }

    // ─── Validation ───────────────────────────────────────────────────────────

    private IntentType validate(IntentSubmission submission, CallerIdentity caller) {
        if (caller == null || !caller.hasTenant()) {
            throw new ValidationException("Caller identity carries no tenant_id");
        }
        if (submission == null) {
            throw new ValidationException("Intent body is required");
        }
        String type = blankToNull(submission.getType());
        if (type == null) {
            throw new ValidationException("type is required");
        }
        IntentType intentType = IntentType.fromWire(type)
                .orElseThrow(() -> new ValidationException("Unknown intent type: " + type));

        String bodyTenant = blankToNull(submission.getTenantId());
        if (bodyTenant != null && !bodyTenant.equals(caller.getTenantId())) {
            throw new ValidationException("tenant_id does not match the caller's tenant");
        }
        JsonNode parameters = submission.getParameters();
        if (parameters != null && !parameters.isNull() && !parameters.isObject()) {
            throw new ValidationException("parameters must be a JSON object");
        }
        return intentType;
    }

    /** The session named by the body or the caller; empty when neither names one. */
    private Optional<Session> givenSession(IntentSubmission submission, CallerIdentity caller) {
        String sessionId = blankToNull(submission.getSessionId());
        if (sessionId == null) {
            sessionId = caller.getSessionId();
        }
        if (sessionId == null) {
            return Optional.empty();
        }
        String requested = sessionId;
        Session session = sessions.find(caller.getTenantId(), sessionId)
                .orElseThrow(() -> new ValidationException("Unknown session: " + requested));
        if (!session.isActive()) {
            throw new ValidationException("Session " + requested + " is invalid");
        }
        return Optional.of(session);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

package com.fabric.shared.saga;

import com.fabric.shared.capability.IntentType;
import com.fabric.shared.error.ErrorCode;
import com.fabric.shared.error.StateCorruptionException;
import com.fabric.shared.wal.WalEvent;
import com.fabric.shared.wal.WalEventType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds an {@link Execution} from its WAL.
 *
 * Impossible histories are never repaired: a sequence gap, a first event other than
 * EXECUTION_STARTED, anything after a terminal execution event, a step start without a
 * preceding resume, or a terminal step event without a start all raise
 * {@link StateCorruptionException}.
 */
public class ExecutionFolder {

    public Execution fold(List<WalEvent> events) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Cannot fold an empty log");
        }
        Execution execution = new Execution();
        for (WalEvent event : events) {
            apply(execution, event);
        }
        return execution;
    }

    /** Applies one event on top of an already folded prefix. */
    public void apply(Execution execution, WalEvent event) {
        long expected = execution.getLastSequenceNo() + 1;
        if (event.getSequenceNo() != expected) {
            throw corruption(event, "sequence gap: expected " + expected);
        }
        if (expected == 1 && event.getType() != WalEventType.EXECUTION_STARTED) {
            throw corruption(event, "log does not begin with EXECUTION_STARTED");
        }
        if (expected > 1 && event.getType() == WalEventType.EXECUTION_STARTED) {
            throw corruption(event, "second EXECUTION_STARTED");
        }
        if (execution.isTerminal()) {
            throw corruption(event, "event after terminal status " + execution.getStatus().wireName());
        }

        JsonNode payload = event.getPayload();
        switch (event.getType()) {
            case EXECUTION_STARTED -> start(execution, event);
            case EXECUTION_RUNNING -> execution.setStatus(ExecutionStatus.RUNNING);
            case STEP_STARTED -> {
                SagaStep step = requireStep(execution, event);
                if (step.getStatus() != StepStatus.PENDING) {
                    throw corruption(event, "step " + step.getCapabilityName() + " started while "
                            + step.getStatus().wireName());
                }
                step.setStatus(StepStatus.RUNNING);
                step.setAttemptCount(step.getAttemptCount() + 1);
                step.setInput(payload.get("input"));
                step.setError(null);
            }
            case STEP_RESUMED -> {
                SagaStep step = requireStatus(execution, event, StepStatus.RUNNING);
                step.setStatus(StepStatus.PENDING);
            }
            case STEP_COMPLETED -> {
                SagaStep step = requireStatus(execution, event, StepStatus.RUNNING);
                step.setStatus(StepStatus.COMPLETED);
                step.setOutput(payload.get("output"));
                step.setCompletedSequenceNo(event.getSequenceNo());
            }
            case STEP_FAILED -> {
                SagaStep step = requireStatus(execution, event, StepStatus.RUNNING);
                step.setStatus(StepStatus.FAILED);
                step.setError(text(payload, "error"));
            }
            case STEP_COMPENSATING -> {
                SagaStep step = requireStep(execution, event);
                if (step.getStatus() != StepStatus.COMPLETED && step.getStatus() != StepStatus.COMPENSATING) {
                    throw corruption(event, "compensating step " + step.getCapabilityName()
                            + " that is " + step.getStatus().wireName());
                }
                step.setStatus(StepStatus.COMPENSATING);
            }
            case STEP_COMPENSATED -> requireStatus(execution, event, StepStatus.COMPENSATING)
                    .setStatus(StepStatus.COMPENSATED);
            case STEP_COMPENSATION_FAILED -> {
                SagaStep step = requireStatus(execution, event, StepStatus.COMPENSATING);
                step.setStatus(StepStatus.FAILED);
                step.setCompensationFailed(true);
                step.setError("compensation failed: " + text(payload, "error"));
            }
            case EXECUTION_CANCELLED -> execution.setCancelRequested(true);
            case EXECUTION_COMPLETED -> finish(execution, event, ExecutionStatus.COMPLETED);
            case EXECUTION_FAILED -> finish(execution, event, ExecutionStatus.FAILED);
            case EXECUTION_COMPENSATED -> finish(execution, event, ExecutionStatus.COMPENSATED);
        }
        execution.setLastSequenceNo(event.getSequenceNo());
        execution.setUpdatedAt(event.getRecordedAt());
    }

    private void start(Execution execution, WalEvent event) {
        JsonNode intent = event.getPayload().path("intent");
        execution.setExecutionId(event.getExecutionId());
        execution.setTenantId(event.getTenantId());
        execution.setSessionId(event.getSessionId());
        execution.setIntentId(text(intent, "intent_id"));
        execution.setIntentType(IntentType.fromWire(text(intent, "intent_type"))
                .orElseThrow(() -> corruption(event, "unknown intent type " + text(intent, "intent_type"))));
        execution.setUserId(text(intent, "user_id"));
        execution.setSolutionId(text(intent, "solution_id"));
        execution.setIdempotencyKey(text(intent, "idempotency_key"));
        execution.setParameters(intent.get("parameters"));
        execution.setSessionContext(intent.get("session_context"));
        execution.setStatus(ExecutionStatus.PENDING);
        execution.setStartedAt(event.getRecordedAt());

        List<SagaStep> steps = new ArrayList<>();
        for (JsonNode planned : event.getPayload().path("plan")) {
            steps.add(SagaStep.builder()
                    .stepId(text(planned, "step_id"))
                    .executionId(event.getExecutionId())
                    .capabilityName(text(planned, "capability_name"))
                    .groupIndex(planned.path("group_index").asInt())
                    .status(StepStatus.PENDING)
                    .build());
        }
        execution.setSteps(steps);
    }

    private void finish(Execution execution, WalEvent event, ExecutionStatus status) {
        execution.setStatus(status);
        execution.setCompletedAt(event.getRecordedAt());
        String code = text(event.getPayload(), "error_code");
        if (code != null) {
            execution.setErrorCode(ErrorCode.valueOf(code));
            execution.setError(text(event.getPayload(), "error"));
        }
    }

    private SagaStep requireStep(Execution execution, WalEvent event) {
        String stepId = event.stepId();
        return execution.step(stepId == null ? "" : stepId)
                .orElseThrow(() -> corruption(event, "unknown step " + stepId));
    }

    private SagaStep requireStatus(Execution execution, WalEvent event, StepStatus required) {
        SagaStep step = requireStep(execution, event);
        if (step.getStatus() != required) {
            throw corruption(event, event.getType() + " for step " + step.getCapabilityName()
                    + " that is " + step.getStatus().wireName());
        }
        return step;
    }

    private static StateCorruptionException corruption(WalEvent event, String message) {
        return new StateCorruptionException(event.getExecutionId(), event.getSequenceNo(), message);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

package com.fabric.shared.saga;

import com.fabric.shared.capability.IntentType;
import com.fabric.shared.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot of one saga run, folded from its WAL and cached on the state surface under
 * {@code tenant/{tenantId}/execution/{executionId}}.
 *
 * The WAL stays authoritative; this snapshot can always be rebuilt from it.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Execution {

    private String executionId;
    private String intentId;
    private IntentType intentType;
    private String tenantId;
    private String sessionId;
    private String userId;
    private String solutionId;
    private String idempotencyKey;
    private JsonNode parameters;
    private JsonNode sessionContext;

    private ExecutionStatus status;

    @Builder.Default
    private List<SagaStep> steps = new ArrayList<>();

    private boolean cancelRequested;
    private ErrorCode errorCode;
    private String error;
    private long lastSequenceNo;

    private Instant startedAt;
    private Instant completedAt;
    private Instant updatedAt;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public Optional<SagaStep> step(String stepId) {
        return steps.stream().filter(s -> s.getStepId().equals(stepId)).findFirst();
    }

    public Optional<SagaStep> stepNamed(String capabilityName) {
        return steps.stream().filter(s -> s.getCapabilityName().equals(capabilityName)).findFirst();
    }
}

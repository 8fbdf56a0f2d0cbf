package com.fabric.runtime.intake;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * {@code (tenant, idempotency key) → execution} mapping, stored under
 * {@code tenant/{tenantId}/idempotency/{key}}. Carries everything needed to finish an
 * admission that crashed between reserving the key and starting the execution.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IdempotencyReservation {

    private String idempotencyKey;
    private String executionId;
    private String intentId;
    private String intentType;
    private String sessionId;
    private String userId;
    private String solutionId;
    private JsonNode parameters;
    private Instant reservedAt;
}

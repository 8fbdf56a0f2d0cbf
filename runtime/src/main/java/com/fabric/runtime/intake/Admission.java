package com.fabric.runtime.intake;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a submission. {@code status} is {@code admitted} for a new execution; a replayed
 * idempotency key reports the existing execution's current status instead.
 */
@Getter
@Builder
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Admission {

    public static final String ADMITTED = "admitted";

    private final String executionId;
    private final String intentId;
    private final String sessionId;
    private final String status;
    private final boolean replayed;
}

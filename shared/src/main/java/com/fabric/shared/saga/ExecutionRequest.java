package com.fabric.shared.saga;

import com.fabric.shared.capability.IntentType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * An admitted intent handed to the coordinator. Ids are minted by intake so that an
 * interrupted admission can be completed later under the same ids.
 *
 * {@code sessionContext} is the session's context at admission time; it is recorded in the
 * WAL so replays see the same values.
 */
@Getter
@Builder
@ToString(exclude = {"parameters", "sessionContext"})
public class ExecutionRequest {

    @NonNull
    private final String executionId;
    @NonNull
    private final String intentId;
    @NonNull
    private final IntentType intentType;
    @NonNull
    private final String tenantId;
    private final String sessionId;
    private final String userId;
    private final String solutionId;
    private final String idempotencyKey;
    private final JsonNode parameters;
    private final JsonNode sessionContext;
}

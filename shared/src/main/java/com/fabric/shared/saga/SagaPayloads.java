package com.fabric.shared.saga;

import com.fabric.shared.capability.SagaDefinition;
import com.fabric.shared.capability.StepDefinition;
import com.fabric.shared.error.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Payload shapes of the WAL events the coordinator writes and the folder reads.
 */
final class SagaPayloads {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private SagaPayloads() {
    }

    static ObjectNode started(ExecutionRequest request, SagaDefinition definition) {
        ObjectNode intent = JSON.objectNode()
                .put("intent_id", request.getIntentId())
                .put("intent_type", request.getIntentType().wireName())
                .put("user_id", request.getUserId())
                .put("solution_id", request.getSolutionId())
                .put("idempotency_key", request.getIdempotencyKey());
        intent.set("parameters", orEmpty(request.getParameters()));
        intent.set("session_context", orEmpty(request.getSessionContext()));

        ArrayNode plan = JSON.arrayNode();
        if (definition != null) {
            List<List<StepDefinition>> groups = definition.getGroups();
            for (int g = 0; g < groups.size(); g++) {
                for (StepDefinition step : groups.get(g)) {
                    plan.addObject()
                            .put("step_id", SagaStep.stepId(request.getExecutionId(), step.getName()))
                            .put("capability_name", step.getName())
                            .put("group_index", g);
                }
            }
        }
        ObjectNode payload = JSON.objectNode();
        payload.set("intent", intent);
        payload.set("plan", plan);
        return payload;
    }

    static ObjectNode step(SagaStep step) {
        return JSON.objectNode().put("step_id", step.getStepId());
    }

    static ObjectNode stepStarted(SagaStep step, int attempt, JsonNode input) {
        ObjectNode payload = step(step).put("attempt", attempt);
        payload.set("input", orEmpty(input));
        return payload;
    }

    static ObjectNode stepCompleted(SagaStep step, JsonNode output) {
        ObjectNode payload = step(step);
        payload.set("output", output == null ? JSON.nullNode() : output);
        return payload;
    }

    static ObjectNode stepFailed(SagaStep step, ErrorCode code, String error) {
        return step(step).put("error_code", code.name()).put("error", error);
    }

    static ObjectNode executionFailed(ErrorCode code, String error) {
        return JSON.objectNode().put("error_code", code == null ? null : code.name()).put("error", error);
    }

    static ObjectNode empty() {
        return JSON.objectNode();
    }

    private static JsonNode orEmpty(JsonNode node) {
        return node == null || node.isNull() ? JSON.objectNode() : node;
    }
}

package com.fabric.shared.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;
import java.util.Optional;

/**
 * Everything a handler may know about the call it serves. Passed explicitly; there is no
 * ambient tenant or session state.
 */
@Getter
@Builder
public class StepContext {

    private final String tenantId;
    private final String sessionId;
    private final String userId;
    private final String solutionId;
    private final String executionId;
    private final String intentId;
    private final IntentType intentType;
    private final String stepName;
    private final int attempt;

    private final JsonNode parameters;
    private final JsonNode sessionContext;
    @Singular
    private final Map<String, String> platformDefaults;
    @Singular
    private final Map<String, JsonNode> previousOutputs;

    /**
     * Looks a value up by name: intent parameters first, then session context, then the
     * configured platform defaults.
     */
    public Optional<JsonNode> resolve(String name) {
        JsonNode fromParameters = field(parameters, name);
        if (fromParameters != null) return Optional.of(fromParameters);
        JsonNode fromSession = field(sessionContext, name);
        if (fromSession != null) return Optional.of(fromSession);
        String fallback = platformDefaults.get(name);
        return fallback == null ? Optional.empty() : Optional.of(JsonNodeFactory.instance.textNode(fallback));
    }

    public Optional<String> resolveText(String name) {
        return resolve(name).map(JsonNode::asText);
    }

    /** Output of an earlier completed step of the same execution, if any. */
    public Optional<JsonNode> previousOutput(String stepName) {
        return Optional.ofNullable(previousOutputs.get(stepName));
    }

    private static JsonNode field(JsonNode node, String name) {
        if (node == null) return null;
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value;
    }
}

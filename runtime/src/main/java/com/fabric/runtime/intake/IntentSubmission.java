package com.fabric.runtime.intake;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /intent/submit}. Validated by {@link IntentIntake}, not by bean
 * validation, so direct callers get the same checks as HTTP callers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IntentSubmission {

    private String type;
    private String tenantId;
    private String sessionId;
    private String idempotencyKey;
    private String solutionId;
    private JsonNode parameters;
}

package com.fabric.shared.saga;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SagaStep {

    private String stepId;
    private String executionId;
    private String capabilityName;
    private int groupIndex;
    private StepStatus status;
    private JsonNode input;
    private JsonNode output;
    private String error;
    private int attemptCount;
    /** WAL sequence of STEP_COMPLETED; compensation walks these in descending order */
    private long completedSequenceNo;
    private boolean compensationFailed;

    public static String stepId(String executionId, String capabilityName) {
        return executionId + ":" + capabilityName;
    }
}

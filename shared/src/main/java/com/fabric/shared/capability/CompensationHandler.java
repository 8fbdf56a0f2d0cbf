package com.fabric.shared.capability;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Undo action of a completed step. Receives the output the forward action produced.
 */
@FunctionalInterface
public interface CompensationHandler {

    void compensate(StepContext context, JsonNode output) throws Exception;
}

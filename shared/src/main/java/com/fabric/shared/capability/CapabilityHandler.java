package com.fabric.shared.capability;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Forward action of one saga step. Returns the step output or throws; never calls back into
 * the coordinator.
 */
@FunctionalInterface
public interface CapabilityHandler {

    JsonNode handle(StepContext context) throws Exception;
}

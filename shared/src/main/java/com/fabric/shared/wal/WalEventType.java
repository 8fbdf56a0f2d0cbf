package com.fabric.shared.wal;

/**
 * Every state transition of an execution, in the order the coordinator may emit them.
 */
public enum WalEventType {
    EXECUTION_STARTED,
    EXECUTION_RUNNING,
    STEP_STARTED,
    STEP_COMPLETED,
    STEP_FAILED,
    STEP_RESUMED,
    STEP_COMPENSATING,
    STEP_COMPENSATED,
    STEP_COMPENSATION_FAILED,
    EXECUTION_CANCELLED,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED,
    EXECUTION_COMPENSATED;

    /** Dot-notation name used for the relayed Kafka envelope, e.g. "execution.step-completed" */
    public String cloudEventType() {
        return "execution." + name().toLowerCase().replace("execution_", "").replace('_', '-');
    }
}

package com.fabric.shared.error;

/**
 * WAL replay found a transition that cannot happen. Fatal for the execution: it is frozen
 * in a failed state for operator review and never repaired automatically.
 */
public class StateCorruptionException extends PlatformException {

    private static final long serialVersionUID = 1L;

    private final String executionId;
    private final long sequenceNo;

    public StateCorruptionException(String executionId, long sequenceNo, String message) {
        super(ErrorCode.STATE_CORRUPTION,
                "Corrupt WAL for execution " + executionId + " at sequence " + sequenceNo + ": " + message);
        this.executionId = executionId;
        this.sequenceNo = sequenceNo;
    }

    public String getExecutionId() {
        return executionId;
    }

    public long getSequenceNo() {
        return sequenceNo;
    }
}

package com.fabric.shared.error;

/**
 * A realm handler failed. Absorbed by the saga coordinator into the compensation chain;
 * only visible to callers through the execution status.
 */
public class StepExecutionException extends PlatformException {

    private static final long serialVersionUID = 1L;

    public StepExecutionException(String message, Throwable cause) {
        super(ErrorCode.STEP_EXECUTION, message, cause);
    }

    protected StepExecutionException(ErrorCode code, String message) {
        super(code, message);
    }
}

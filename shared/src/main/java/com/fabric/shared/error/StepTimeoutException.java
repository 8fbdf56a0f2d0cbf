package com.fabric.shared.error;

import java.time.Duration;

public class StepTimeoutException extends StepExecutionException {

    private static final long serialVersionUID = 1L;

    public StepTimeoutException(String stepName, Duration timeout) {
        super(ErrorCode.STEP_TIMEOUT, "Step " + stepName + " exceeded timeout of " + timeout.toMillis() + "ms");
    }
}

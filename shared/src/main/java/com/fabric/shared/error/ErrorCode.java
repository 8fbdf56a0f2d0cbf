package com.fabric.shared.error;

/**
 * Stable error codes surfaced in execution status summaries and API problem bodies.
 * Changing a code is a breaking change for status consumers.
 */
public enum ErrorCode {
    VALIDATION,
    NOT_FOUND,
    CAPABILITY_NOT_FOUND,
    AUTHORIZATION,
    STEP_EXECUTION,
    STEP_TIMEOUT,
    CANCELLED,
    TRANSIENT_INFRA,
    VERSION_CONFLICT,
    STATE_CORRUPTION
}

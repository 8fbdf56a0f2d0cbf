package com.fabric.shared.error;

/**
 * Malformed or missing intent fields. Rejected at intake, never admitted, never WAL-logged.
 */
public class ValidationException extends PlatformException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}

package com.fabric.shared.error;

/**
 * Root of the execution core's error taxonomy.
 *
 * Every subclass maps to exactly one {@link ErrorCode}, which is what callers see;
 * exception messages and stack traces stay in the logs.
 */
public abstract class PlatformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;

    protected PlatformException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected PlatformException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}

package com.fabric.shared.error;

/**
 * Boundary contract not active, or requester scope mismatch. Surfaced to the caller, never retried.
 */
public class AuthorizationException extends PlatformException {

    private static final long serialVersionUID = 1L;

    public AuthorizationException(String message) {
        super(ErrorCode.AUTHORIZATION, message);
    }
}

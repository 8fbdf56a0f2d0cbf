package com.fabric.shared.error;

/**
 * The underlying store is temporarily unavailable. Retried with bounded backoff at the
 * state surface / WAL boundary; thrown further only once the retry budget is spent.
 */
public class TransientInfraException extends PlatformException {

    private static final long serialVersionUID = 1L;

    public TransientInfraException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_INFRA, message, cause);
    }
}

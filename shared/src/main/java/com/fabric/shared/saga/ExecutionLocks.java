package com.fabric.shared.saga;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-execution single-writer locks. There is no global lock.
 */
public interface ExecutionLocks {

    /** Non-blocking; empty when another writer holds the execution. */
    Optional<ExecutionLease> tryAcquire(String tenantId, String executionId);

    boolean isLeased(String tenantId, String executionId);

    /** Longest wait between renewals while a drive blocks on a handler. */
    default Duration renewInterval() {
        return Duration.ofSeconds(1);
    }
}

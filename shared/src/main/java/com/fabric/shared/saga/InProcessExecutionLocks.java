package com.fabric.shared.saga;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutex per execution id, valid for a single instance ({@code runtime.lock.mode=local}).
 * Ownership is a token rather than a thread, so a lease may be released by whichever worker
 * thread finishes the drive.
 */
public class InProcessExecutionLocks implements ExecutionLocks {

    private final Map<String, Object> owners = new ConcurrentHashMap<>();

    @Override
    public Optional<ExecutionLease> tryAcquire(String tenantId, String executionId) {
        String key = tenantId + "/" + executionId;
        Object token = new Object();
        if (owners.putIfAbsent(key, token) != null) {
            return Optional.empty();
        }
        return Optional.of(new ExecutionLease() {
            @Override
            public boolean renew() {
                return owners.get(key) == token;
            }

            @Override
            public void close() {
                owners.remove(key, token);
            }
        });
    }

    @Override
    public boolean isLeased(String tenantId, String executionId) {
        return owners.containsKey(tenantId + "/" + executionId);
    }
}

package com.fabric.runtime.identity;

import com.fabric.runtime.contract.MaterializationScope;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Already-authenticated caller, taken from the {@code X-Tenant-Id}, {@code X-User-Id} and
 * {@code X-Session-Id} headers. Passed explicitly into every call; nothing reads tenant or
 * session from a thread-local.
 */
@Getter
@Builder
@ToString
public class CallerIdentity {

    private final String tenantId;
    private final String userId;
    private final String sessionId;

    public static CallerIdentity of(String tenantId, String userId, String sessionId) {
        return new CallerIdentity(blankToNull(tenantId), blankToNull(userId), blankToNull(sessionId));
    }

    public boolean hasTenant() {
        return tenantId != null;
    }

    /** Requester side of a contract scope check. */
    public MaterializationScope toScope(String solutionId) {
        return MaterializationScope.builder()
                .userId(userId)
                .sessionId(sessionId)
                .solutionId(solutionId)
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

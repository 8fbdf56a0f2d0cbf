package com.fabric.runtime.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Tenant-scoped context container, stored under {@code tenant/{tenantId}/session/{sessionId}}.
 * Never deleted: invalidation flips the status and keeps the record.
 *
 * {@code version} is the state-record version the session was read at; callers pass it back
 * to make a context update conditional.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Session {

    private String sessionId;
    private String tenantId;
    private String userId;
    private SessionStatus status;
    private ObjectNode context;
    private Instant createdAt;
    private Instant lastActiveAt;
    private Instant invalidatedAt;
    private long version;

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }
}

package com.fabric.shared.state;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * One versioned value on the state surface. Last writer wins; {@code version} increments
 * on every write and is what optimistic callers hand back to {@code compareAndSet}.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
public class StateRecord {

    private final StateKey key;
    private final JsonNode value;
    private final long version;
    private final Instant expiresAt;
    private final Instant updatedAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}

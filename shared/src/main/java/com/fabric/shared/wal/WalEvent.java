package com.fabric.shared.wal;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One immutable WAL entry. {@code sequenceNo} is the sole ordering authority within an
 * execution and starts at 1.
 *
 * Wire format (one object per NDJSON line):
 * {event_id, execution_id, tenant_id, session_id, sequence_no, type, payload, recorded_at}
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"event_id", "execution_id", "tenant_id", "session_id", "sequence_no", "type", "payload", "recorded_at"})
public class WalEvent {

    private String eventId;
    private String executionId;
    private String tenantId;
    private String sessionId;
    private long sequenceNo;
    private WalEventType type;
    private JsonNode payload;
    private Instant recordedAt;

    /** Step id carried by STEP_* payloads, null otherwise */
    public String stepId() {
        return payload != null && payload.hasNonNull("step_id") ? payload.get("step_id").asText() : null;
    }
}

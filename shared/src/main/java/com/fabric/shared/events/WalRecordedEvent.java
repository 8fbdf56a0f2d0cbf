package com.fabric.shared.events;

import com.fabric.shared.wal.WalEvent;
import lombok.Getter;

/** A committed WAL entry, relayed to audit consumers. */
@Getter
public class WalRecordedEvent extends CloudEvent {

    private final WalEvent data;

    public WalRecordedEvent(WalEvent data) {
        super(data.getEventId(), data.getType().cloudEventType(), EventTopics.SOURCE,
                data.getTenantId(), data.getRecordedAt(), data.getExecutionId(), 1);
        this.data = data;
    }
}

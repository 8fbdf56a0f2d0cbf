package com.fabric.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * CloudEvents v1.0 envelope for everything the runtime publishes.
 *
 *  - id:            unique event id (the WAL event id for relayed WAL entries)
 *  - type:          dot-notation name, e.g. "execution.step-completed"
 *  - source:        originating service URI
 *  - subject:       tenant the event belongs to
 *  - time:          when the event was recorded
 *  - correlationId: execution id; all events of one saga share it
 */
@Getter
@ToString
public abstract class CloudEvent {

    private final String id;
    private final String type;
    private final String source;
    private final String subject;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private final Instant time;

    private final String correlationId;
    private final int version;
    private final String specversion = "1.0";
    private final String datacontenttype = "application/json";

    protected CloudEvent(String id, String type, String source, String subject,
                         Instant time, String correlationId, int version) {
        this.id = id;
        this.type = type;
        this.source = source;
        this.subject = subject;
        this.time = time;
        this.correlationId = correlationId;
        this.version = version;
    }
}

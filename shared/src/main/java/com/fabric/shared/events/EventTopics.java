package com.fabric.shared.events;

public final class EventTopics {

    private EventTopics() {
    }

    public static final String SOURCE = "/services/execution-core";

    /** Default topic of relayed WAL entries; overridable with runtime.kafka.wal-topic */
    public static final String WAL_EVENTS = "runtime.wal-events";
}

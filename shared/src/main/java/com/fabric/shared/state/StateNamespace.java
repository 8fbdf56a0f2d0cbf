package com.fabric.shared.state;

/**
 * Logical namespaces of the state surface. The path segment is part of the persisted key
 * layout {@code tenant/{tenantId}/{segment}/{scopeId}[/{name}]} and must not change.
 */
public enum StateNamespace {
    SESSION("session"),
    EXECUTION("execution"),
    CONTRACT("contract"),
    MATERIALIZATION("materialization"),
    IDEMPOTENCY("idempotency");

    private final String segment;

    StateNamespace(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }
}

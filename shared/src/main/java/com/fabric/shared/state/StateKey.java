package com.fabric.shared.state;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Fully qualified state surface key.
 *
 * Every key is rooted at a tenant, so a key can never address another tenant's record.
 * Components are opaque: '%' and '/' are percent-escaped when the key is rendered, so a
 * component can never add a path level.
 *
 * Layout:
 *   tenant/{tenantId}/session/{sessionId}[/{name}]
 *   tenant/{tenantId}/execution/{executionId}[/{name}]
 *   tenant/{tenantId}/contract/{contractId}
 *   tenant/{tenantId}/materialization/{recordId}
 *   tenant/{tenantId}/idempotency/{idempotencyKey}
 */
@Getter
@EqualsAndHashCode
public final class StateKey {

    private final String tenantId;
    private final StateNamespace namespace;
    private final String scopeId;
    /** Optional sub-record name; null addresses the primary record of the scope */
    private final String name;

    private StateKey(String tenantId, StateNamespace namespace, String scopeId, String name) {
        this.tenantId = requireSegment("tenantId", tenantId);
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.scopeId = requireSegment("scopeId", scopeId);
        this.name = name == null ? null : requireSegment("name", name);
    }

    public static StateKey of(String tenantId, StateNamespace namespace, String scopeId) {
        return new StateKey(tenantId, namespace, scopeId, null);
    }

    public static StateKey of(String tenantId, StateNamespace namespace, String scopeId, String name) {
        return new StateKey(tenantId, namespace, scopeId, name);
    }

    public static StateKey session(String tenantId, String sessionId) {
        return of(tenantId, StateNamespace.SESSION, sessionId);
    }

    public static StateKey sessionValue(String tenantId, String sessionId, String name) {
        return of(tenantId, StateNamespace.SESSION, sessionId, name);
    }

    public static StateKey execution(String tenantId, String executionId) {
        return of(tenantId, StateNamespace.EXECUTION, executionId);
    }

    public static StateKey contract(String tenantId, String contractId) {
        return of(tenantId, StateNamespace.CONTRACT, contractId);
    }

    public static StateKey materialization(String tenantId, String recordId) {
        return of(tenantId, StateNamespace.MATERIALIZATION, recordId);
    }

    public static StateKey idempotency(String tenantId, String idempotencyKey) {
        return of(tenantId, StateNamespace.IDEMPOTENCY, idempotencyKey);
    }

    public StateKey child(String childName) {
        return new StateKey(tenantId, namespace, scopeId, childName);
    }

    public String render() {
        String base = "tenant/" + escape(tenantId) + "/" + namespace.segment() + "/" + escape(scopeId);
        return name == null ? base : base + "/" + escape(name);
    }

    @Override
    public String toString() {
        return render();
    }

    private static String requireSegment(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    private static String escape(String segment) {
        if (segment.indexOf('%') < 0 && segment.indexOf('/') < 0) {
            return segment;
        }
        return segment.replace("%", "%25").replace("/", "%2F");
    }
}

package com.fabric.shared.state;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Bulk lookup filter, always evaluated inside one tenant.
 *
 * Matches records of a namespace, optionally narrowed to a sub-record name (primary records
 * only by default) and equality on top-level fields of the JSON value. At most
 * {@link #MAX_RESULTS} records are returned.
 */
@Getter
public final class StateQuery {

    public static final int MAX_RESULTS = 1000;

    private final StateNamespace namespace;
    private String name;
    private final Map<String, Set<String>> fieldValues = new LinkedHashMap<>();

    private StateQuery(StateNamespace namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    public static StateQuery in(StateNamespace namespace) {
        return new StateQuery(namespace);
    }

    public StateQuery named(String name) {
        this.name = name;
        return this;
    }

    public StateQuery where(String field, String value) {
        fieldValues.put(field, Set.of(value));
        return this;
    }

    public StateQuery whereAnyOf(String field, List<String> values) {
        fieldValues.put(field, new LinkedHashSet<>(values));
        return this;
    }

    public boolean matches(StateKey key, JsonNode value) {
        if (key.getNamespace() != namespace) return false;
        if (!Objects.equals(name, key.getName())) return false;
        for (Map.Entry<String, Set<String>> entry : fieldValues.entrySet()) {
            JsonNode field = value == null ? null : value.get(entry.getKey());
            if (field == null || field.isNull() || !entry.getValue().contains(field.asText())) {
                return false;
            }
        }
        return true;
    }
}

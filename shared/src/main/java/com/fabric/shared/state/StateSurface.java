package com.fabric.shared.state;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Versioned key/value storage with query, over a fast volatile tier and a durable tier.
 *
 * Writes are last-writer-wins. Callers needing compare-and-swap pass the version they last
 * read to {@link #compareAndSet} and get a {@code VersionConflictException} if it moved.
 * Writes to different keys never block each other; the surface serializes nothing beyond
 * that optimistic check.
 */
public interface StateSurface {

    /** Expired records are reported as absent. */
    Optional<StateRecord> get(StateKey key);

    /**
     * Unconditional write.
     *
     * @param ttl optional; null keeps the record until overwritten
     * @return the version assigned to this write
     */
    long set(StateKey key, JsonNode value, Duration ttl);

    default long set(StateKey key, JsonNode value) {
        return set(key, value, null);
    }

    /**
     * Conditional write. {@code expectedVersion == 0} means "create only if absent".
     *
     * @return the version assigned to this write
     * @throws com.fabric.shared.error.VersionConflictException if the stored version differs
     */
    long compareAndSet(StateKey key, JsonNode value, long expectedVersion, Duration ttl);

    /** Bulk lookup inside one tenant. */
    List<StateRecord> query(String tenantId, StateQuery query);

    /**
     * Tenants that own at least one record. System jobs (expiry sweep, recovery) iterate
     * this and then read per tenant, so no single read spans tenants.
     */
    Set<String> tenants();
}

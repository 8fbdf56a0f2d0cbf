package com.fabric.shared.state;

import com.fabric.shared.error.VersionConflictException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local state surface for tests and single-node runs ({@code runtime.storage.mode=memory}).
 *
 * Per-key atomicity comes from {@link ConcurrentHashMap#compute}; nothing survives a restart.
 */
@Slf4j
public class InMemoryStateSurface implements StateSurface {

    private final Map<String, StateRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryStateSurface() {
        this(Clock.systemUTC());
    }

    public InMemoryStateSurface(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<StateRecord> get(StateKey key) {
        StateRecord record = records.get(key.render());
        if (record == null || record.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public long set(StateKey key, JsonNode value, Duration ttl) {
        Instant now = clock.instant();
        StateRecord written = records.compute(key.render(), (k, existing) -> {
            long previous = live(existing, now) ? existing.getVersion() : versionOf(existing);
            return newRecord(key, value, previous + 1, ttl, now);
        });
        log.debug("State set: key={}, version={}", key, written.getVersion());
        return written.getVersion();
    }

    @Override
    public long compareAndSet(StateKey key, JsonNode value, long expectedVersion, Duration ttl) {
        Instant now = clock.instant();
        StateRecord written = records.compute(key.render(), (k, existing) -> {
            long actual = live(existing, now) ? existing.getVersion() : 0L;
            if (actual != expectedVersion) {
                throw new VersionConflictException(key.render(), expectedVersion, actual);
            }
            return newRecord(key, value, Math.max(actual, versionOf(existing)) + 1, ttl, now);
        });
        return written.getVersion();
    }

    @Override
    public List<StateRecord> query(String tenantId, StateQuery query) {
        Instant now = clock.instant();
        return records.values().stream()
                .filter(r -> r.getKey().getTenantId().equals(tenantId))
                .filter(r -> !r.isExpired(now))
                .filter(r -> query.matches(r.getKey(), r.getValue()))
                .sorted(Comparator.comparing(r -> r.getKey().render()))
                .limit(StateQuery.MAX_RESULTS)
                .toList();
    }

    @Override
    public Set<String> tenants() {
        return records.values().stream()
                .map(r -> r.getKey().getTenantId())
                .collect(Collectors.toSet());
    }

    private StateRecord newRecord(StateKey key, JsonNode value, long version, Duration ttl, Instant now) {
        return StateRecord.builder()
                .key(key)
                .value(value.deepCopy())
                .version(version)
                .expiresAt(ttl == null ? null : now.plus(ttl))
                .updatedAt(now)
                .build();
    }

    private static boolean live(StateRecord record, Instant now) {
        return record != null && !record.isExpired(now);
    }

    private static long versionOf(StateRecord record) {
        return record == null ? 0L : record.getVersion();
    }
}

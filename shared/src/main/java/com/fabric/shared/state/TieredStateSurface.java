package com.fabric.shared.state;

import com.fabric.shared.error.VersionConflictException;
import com.fabric.shared.infra.InfraRetry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * State surface over Redis (hot tier) and PostgreSQL (durable tier).
 *
 * The durable tier is authoritative: a write returns only once it committed there. The hot
 * tier is write-through and best-effort; Redis failures are logged and reads fall back to
 * the durable tier. A lost compare-and-set evicts the cached copy so the retrying caller
 * re-reads from the durable tier.
 *
 * Redis key: "state:" + rendered state key, value {value, version, expires_at, updated_at}.
 */
@Slf4j
public class TieredStateSurface implements StateSurface {

    private static final String CACHE_PREFIX = "state:";

    private final DurableStateStore durable;
    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final InfraRetry retry;
    private final Duration hotTtl;
    private final Clock clock;

    public TieredStateSurface(DurableStateStore durable, StringRedisTemplate redis, ObjectMapper objectMapper,
                              InfraRetry retry, Duration hotTtl, Clock clock) {
        this.durable = durable;
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.retry = retry;
        this.hotTtl = hotTtl;
        this.clock = clock;
    }

    @Override
    public Optional<StateRecord> get(StateKey key) {
        Instant now = clock.instant();
        Optional<StateRecord> cached = readHot(key);
        if (cached.isPresent()) {
            return cached.filter(r -> !r.isExpired(now));
        }
        Optional<StateRecord> record = retry.call("state.get", () -> durable.find(key.render()))
                .map(this::toRecord)
                .filter(r -> !r.isExpired(now));
        record.ifPresent(this::writeHot);
        return record;
    }

    @Override
    public long set(StateKey key, JsonNode value, Duration ttl) {
        Instant now = clock.instant();
        Instant expiresAt = ttl == null ? null : now.plus(ttl);
        String json = serialize(value);
        long version = retry.call("state.set", () -> {
            try {
                return durable.upsert(key, json, expiresAt, now);
            } catch (DataIntegrityViolationException raced) {
                // concurrent first insert of the same key; the row exists now
                return durable.upsert(key, json, expiresAt, now);
            }
        });
        writeHot(new StateRecord(key, value, version, expiresAt, now));
        log.debug("State set: key={}, version={}", key, version);
        return version;
    }

    @Override
    public long compareAndSet(StateKey key, JsonNode value, long expectedVersion, Duration ttl) {
        Instant now = clock.instant();
        Instant expiresAt = ttl == null ? null : now.plus(ttl);
        String json = serialize(value);
        long version;
        try {
            version = retry.call("state.compareAndSet",
                    () -> durable.compareAndSet(key, json, expectedVersion, expiresAt, now));
        } catch (VersionConflictException e) {
            evictHot(key);
            throw e;
        }
        writeHot(new StateRecord(key, value, version, expiresAt, now));
        return version;
    }

    @Override
    public List<StateRecord> query(String tenantId, StateQuery query) {
        Instant now = clock.instant();
        return retry.call("state.query",
                        () -> durable.findLive(tenantId, query.getNamespace(), now))
                .stream()
                .map(this::toRecord)
                .filter(r -> query.matches(r.getKey(), r.getValue()))
                .limit(StateQuery.MAX_RESULTS)
                .toList();
    }

    @Override
    public Set<String> tenants() {
        return new HashSet<>(retry.call("state.tenants", durable::tenants));
    }

    // ─── Hot tier ────────────────────────────────────────────────────────────

    private Optional<StateRecord> readHot(StateKey key) {
        try {
            String json = redis.opsForValue().get(CACHE_PREFIX + key.render());
            if (json == null) return Optional.empty();
            JsonNode node = objectMapper.readTree(json);
            return Optional.of(StateRecord.builder()
                    .key(key)
                    .value(node.get("value"))
                    .version(node.get("version").asLong())
                    .expiresAt(node.hasNonNull("expires_at") ? Instant.parse(node.get("expires_at").asText()) : null)
                    .updatedAt(Instant.parse(node.get("updated_at").asText()))
                    .build());
        } catch (Exception e) {
            log.warn("Hot tier read failed, falling back to durable tier: key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeHot(StateRecord record) {
        try {
            ObjectNode node = objectMapper.createObjectNode();
            node.set("value", record.getValue());
            node.put("version", record.getVersion());
            node.put("expires_at", record.getExpiresAt() == null ? null : record.getExpiresAt().toString());
            node.put("updated_at", record.getUpdatedAt().toString());
            Duration ttl = hotTtl;
            if (record.getExpiresAt() != null) {
                Duration remaining = Duration.between(clock.instant(), record.getExpiresAt());
                if (remaining.isNegative() || remaining.isZero()) return;
                if (remaining.compareTo(ttl) < 0) ttl = remaining;
            }
            redis.opsForValue().set(CACHE_PREFIX + record.getKey().render(), objectMapper.writeValueAsString(node), ttl);
        } catch (Exception e) {
            log.warn("Hot tier write failed: key={}, error={}", record.getKey(), e.getMessage());
        }
    }

    private void evictHot(StateKey key) {
        try {
            redis.delete(CACHE_PREFIX + key.render());
        } catch (Exception e) {
            log.warn("Hot tier evict failed: key={}, error={}", key, e.getMessage());
        }
    }

    // ─── Mapping ─────────────────────────────────────────────────────────────

    private StateRecord toRecord(StateRecordEntity row) {
        try {
            return StateRecord.builder()
                    .key(row.toKey())
                    .value(objectMapper.readTree(row.getValue()))
                    .version(row.getVersion())
                    .expiresAt(row.getExpiresAt())
                    .updatedAt(row.getUpdatedAt())
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable state record: key=" + row.getStateKey(), e);
        }
    }

    private String serialize(JsonNode value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("State value is not serializable", e);
        }
    }
}

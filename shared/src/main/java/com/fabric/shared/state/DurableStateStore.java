package com.fabric.shared.state;

import com.fabric.shared.error.VersionConflictException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Transactional durable tier (PostgreSQL). Every write runs in its own transaction, and
 * the returned version is read back while the row lock from the write is still held.
 */
@RequiredArgsConstructor
public class DurableStateStore {

    private final StateRecordRepository repository;

    @Transactional(readOnly = true)
    public Optional<StateRecordEntity> find(String key) {
        return repository.findById(key);
    }

    /**
     * Last-writer-wins. A concurrent first insert of the same key surfaces as
     * {@link DataIntegrityViolationException}; the caller retries, which then takes the update path.
     */
    @Transactional
    public long upsert(StateKey key, String json, Instant expiresAt, Instant now) {
        if (repository.overwrite(key.render(), json, expiresAt, now) == 1) {
            return currentVersion(key);
        }
        repository.saveAndFlush(newRow(key, json, 1L, expiresAt, now));
        return 1L;
    }

    @Transactional
    public long compareAndSet(StateKey key, String json, long expected, Instant expiresAt, Instant now) {
        if (expected == 0L) {
            return createIfAbsent(key, json, expiresAt, now);
        }
        if (repository.overwriteIfVersion(key.render(), json, expected, expiresAt, now) == 1) {
            return currentVersion(key);
        }
        Optional<StateRecordEntity> actual = repository.findById(key.render())
                .filter(row -> row.getExpiresAt() == null || row.getExpiresAt().isAfter(now));
        throw new VersionConflictException(key.render(), expected, actual.map(StateRecordEntity::getVersion).orElse(0L));
    }

    @Transactional(readOnly = true)
    public List<StateRecordEntity> findLive(String tenantId, StateNamespace namespace, Instant now) {
        return repository.findLive(tenantId, namespace, now);
    }

    @Transactional(readOnly = true)
    public List<String> tenants() {
        return repository.findDistinctTenants();
    }

    private long createIfAbsent(StateKey key, String json, Instant expiresAt, Instant now) {
        if (repository.replaceExpired(key.render(), json, expiresAt, now) == 1) {
            return currentVersion(key);
        }
        Optional<Long> existing = repository.findVersion(key.render());
        if (existing.isPresent()) {
            throw new VersionConflictException(key.render(), 0L, existing.get());
        }
        try {
            repository.saveAndFlush(newRow(key, json, 1L, expiresAt, now));
        } catch (DataIntegrityViolationException e) {
            // lost the insert race; the winner's version is unknown until its commit
            throw new VersionConflictException(key.render(), 0L, -1L);
        }
        return 1L;
    }

    private long currentVersion(StateKey key) {
        return repository.findVersion(key.render())
                .orElseThrow(() -> new IllegalStateException("Row vanished after write: " + key));
    }

    private static StateRecordEntity newRow(StateKey key, String json, long version, Instant expiresAt, Instant now) {
        return StateRecordEntity.builder()
                .stateKey(key.render())
                .tenantId(key.getTenantId())
                .namespace(key.getNamespace())
                .scopeId(key.getScopeId())
                .name(key.getName())
                .value(json)
                .version(version)
                .expiresAt(expiresAt)
                .updatedAt(now)
                .build();
    }
}

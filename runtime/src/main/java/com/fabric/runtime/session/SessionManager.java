package com.fabric.runtime.session;

import com.fabric.shared.error.NotFoundException;
import com.fabric.shared.error.ValidationException;
import com.fabric.shared.error.VersionConflictException;
import com.fabric.shared.state.StateKey;
import com.fabric.shared.state.StateRecord;
import com.fabric.shared.state.StateSurface;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Session Manager
 *
 * Sessions live on the state surface under {@code tenant/{tenantId}/session/{sessionId}}.
 * Every mutation is a compare-and-set against the version just read: concurrent updates are
 * re-read and retried up to {@code runtime.session.update-retries} times, unless the caller
 * pinned an expected version, in which case the conflict is returned to the caller.
 *
 * A session id that exists under another tenant is reported as not found.
 */
@Slf4j
@Service
public class SessionManager {

    private final StateSurface stateSurface;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int updateRetries;

    public SessionManager(StateSurface stateSurface,
                          ObjectMapper objectMapper,
                          Clock clock,
                          @Value("${runtime.session.update-retries:5}") int updateRetries) {
        this.stateSurface = stateSurface;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.updateRetries = Math.max(1, updateRetries);
    }

    // ─── Create / Read ────────────────────────────────────────────────────────

    public Session create(String tenantId, String userId, JsonNode context) {
        return create(tenantId, UUID.randomUUID().toString(), userId, context);
    }

    /** Creates under an id minted by the caller; a taken id is a version conflict. */
    public Session create(String tenantId, String sessionId, String userId, JsonNode context) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenant_id is required");
        }
        if (context != null && !context.isNull() && !context.isObject()) {
            throw new ValidationException("context must be a JSON object");
        }
        Instant now = clock.instant();
        Session session = Session.builder()
                .sessionId(sessionId)
                .tenantId(tenantId)
                .userId(userId)
                .status(SessionStatus.ACTIVE)
                .context(context != null && context.isObject()
                        ? ((ObjectNode) context).deepCopy()
                        : objectMapper.createObjectNode())
                .createdAt(now)
                .lastActiveAt(now)
                .build();

        long version = stateSurface.compareAndSet(key(session.getTenantId(), session.getSessionId()),
                objectMapper.valueToTree(session), 0L, null);
        session.setVersion(version);

        log.info("Session created: sessionId={}, tenantId={}, userId={}", session.getSessionId(), tenantId, userId);
        return session;
    }

    public Session get(String tenantId, String sessionId) {
        return find(tenantId, sessionId).orElseThrow(() -> new NotFoundException("session", sessionId));
    }

    public Optional<Session> find(String tenantId, String sessionId) {
        if (tenantId == null || sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        StateKey key;
        try {
            key = key(tenantId, sessionId);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return stateSurface.get(key).map(this::toSession);
    }

    // ─── Mutations ────────────────────────────────────────────────────────────

    /**
     * Shallow-merges {@code patch} into the session context. A null field in the patch
     * removes the key.
     *
     * @param expectedVersion optional; when given, the update fails with
     *                        {@link VersionConflictException} unless the session is still at
     *                        that version
     */
    public Session updateContext(String tenantId, String sessionId, JsonNode patch, Long expectedVersion) {
        if (patch == null || !patch.isObject()) {
            throw new ValidationException("context patch must be a JSON object");
        }
        Session updated = mutate(tenantId, sessionId, expectedVersion, session -> {
            if (!session.isActive()) {
                throw new ValidationException("Session " + sessionId + " is invalid");
            }
            ObjectNode context = session.getContext() != null
                    ? session.getContext()
                    : objectMapper.createObjectNode();
            patch.fields().forEachRemaining(field -> {
                if (field.getValue().isNull()) {
                    context.remove(field.getKey());
                } else {
                    context.set(field.getKey(), field.getValue().deepCopy());
                }
            });
            session.setContext(context);
            session.setLastActiveAt(clock.instant());
        });
        log.info("Session context updated: sessionId={}, tenantId={}, keys={}, version={}",
                sessionId, tenantId, patch.size(), updated.getVersion());
        return updated;
    }

    /** Marks the session invalid. Idempotent; the record is kept for audit. */
    public Session invalidate(String tenantId, String sessionId) {
        Session session = get(tenantId, sessionId);
        if (!session.isActive()) {
            return session;
        }
        Session invalidated = mutate(tenantId, sessionId, null, s -> {
            if (s.isActive()) {
                s.setStatus(SessionStatus.INVALID);
                s.setInvalidatedAt(clock.instant());
            }
        });
        log.info("Session invalidated: sessionId={}, tenantId={}", sessionId, tenantId);
        return invalidated;
    }

    /** Records activity on admission. Losing a race to a concurrent writer is harmless. */
    public void touch(String tenantId, String sessionId) {
        Optional<StateRecord> record = stateSurface.get(key(tenantId, sessionId));
        if (record.isEmpty()) return;
        Session session = toSession(record.get());
        session.setLastActiveAt(clock.instant());
        try {
            stateSurface.compareAndSet(key(tenantId, sessionId), objectMapper.valueToTree(session),
                    record.get().getVersion(), null);
        } catch (VersionConflictException e) {
            log.debug("Session touch lost a race: sessionId={}, tenantId={}", sessionId, tenantId);
        }
    }

    private Session mutate(String tenantId, String sessionId, Long expectedVersion, Consumer<Session> change) {
        StateKey key = key(tenantId, sessionId);
        VersionConflictException lastConflict = null;

        for (int attempt = 1; attempt <= updateRetries; attempt++) {
            StateRecord record = stateSurface.get(key)
                    .orElseThrow(() -> new NotFoundException("session", sessionId));
            if (expectedVersion != null && record.getVersion() != expectedVersion) {
                throw new VersionConflictException(key.render(), expectedVersion, record.getVersion());
            }
            Session session = toSession(record);
            change.accept(session);
            try {
                long version = stateSurface.compareAndSet(key, objectMapper.valueToTree(session),
                        record.getVersion(), null);
                session.setVersion(version);
                return session;
            } catch (VersionConflictException e) {
                if (expectedVersion != null) throw e;
                lastConflict = e;
                log.debug("Session update conflict, retrying: sessionId={}, attempt={}", sessionId, attempt);
            }
        }
        log.warn("Session update gave up after {} conflicts: sessionId={}, tenantId={}",
                updateRetries, sessionId, tenantId);
        throw lastConflict;
    }

    private Session toSession(StateRecord record) {
        try {
            Session session = objectMapper.treeToValue(record.getValue(), Session.class);
            session.setVersion(record.getVersion());
            return session;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable session record: key=" + record.getKey(), e);
        }
    }

    private static StateKey key(String tenantId, String sessionId) {
        return StateKey.session(tenantId, sessionId);
    }
}

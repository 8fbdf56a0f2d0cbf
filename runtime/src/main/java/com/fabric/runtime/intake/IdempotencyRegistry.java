package com.fabric.runtime.intake;

import com.fabric.shared.error.VersionConflictException;
import com.fabric.shared.state.StateKey;
import com.fabric.shared.state.StateRecord;
import com.fabric.shared.state.StateSurface;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Idempotency keys on the state surface. A reservation is a create-if-absent write, so of two
 * concurrent submissions with the same key exactly one wins; the loser reads and returns the
 * winner's reservation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyRegistry {

    private final StateSurface stateSurface;
    private final ObjectMapper objectMapper;

    public Optional<IdempotencyReservation> find(String tenantId, String idempotencyKey) {
        return stateSurface.get(StateKey.idempotency(tenantId, idempotencyKey)).map(this::toReservation);
    }

    /**
     * Reserves the key for {@code candidate}. Returns the reservation now holding the key: the
     * candidate itself if this call won, otherwise the earlier one.
     */
    public IdempotencyReservation reserve(String tenantId, IdempotencyReservation candidate) {
        StateKey key = StateKey.idempotency(tenantId, candidate.getIdempotencyKey());
        try {
            stateSurface.compareAndSet(key, objectMapper.valueToTree(candidate), 0L, null);
            log.debug("Idempotency key reserved: tenantId={}, key={}, executionId={}",
                    tenantId, candidate.getIdempotencyKey(), candidate.getExecutionId());
            return candidate;
        } catch (VersionConflictException e) {
            IdempotencyReservation winner = stateSurface.get(key)
                    .map(this::toReservation)
                    .orElseThrow(() -> e);
            log.info("Idempotency key already reserved: tenantId={}, key={}, executionId={}",
                    tenantId, candidate.getIdempotencyKey(), winner.getExecutionId());
            return winner;
        }
    }

    private IdempotencyReservation toReservation(StateRecord record) {
        try {
            return objectMapper.treeToValue(record.getValue(), IdempotencyReservation.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable idempotency record: key=" + record.getKey(), e);
        }
    }
}

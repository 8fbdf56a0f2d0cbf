package com.fabric.runtime.contract;

import com.fabric.shared.error.AuthorizationException;
import com.fabric.shared.error.NotFoundException;
import com.fabric.shared.error.ValidationException;
import com.fabric.shared.error.VersionConflictException;
import com.fabric.shared.state.StateKey;
import com.fabric.shared.state.StateNamespace;
import com.fabric.shared.state.StateQuery;
import com.fabric.shared.state.StateRecord;
import com.fabric.shared.state.StateSurface;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Boundary Contract Store
 *
 * Lifecycle of the contracts governing materialization. Transitions are compare-and-set on
 * the contract record; a transition that loses a race is re-evaluated against the fresh
 * record, so concurrent authorize and revoke calls resolve to exactly one outcome.
 */
@Slf4j
@Service
public class BoundaryContractStore {

    private static final int MAX_TRANSITION_ATTEMPTS = 3;

    private final StateSurface stateSurface;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration contractTtl;

    public BoundaryContractStore(StateSurface stateSurface,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 @Value("${runtime.contracts.ttl:P30D}") Duration contractTtl) {
        this.stateSurface = stateSurface;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.contractTtl = contractTtl;
    }

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    public BoundaryContract createPending(String tenantId, String artifactReference) {
        if (artifactReference == null || artifactReference.isBlank()) {
            throw new ValidationException("artifact_reference is required");
        }
        Instant now = clock.instant();
        BoundaryContract contract = BoundaryContract.builder()
                .contractId(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .artifactReference(artifactReference)
                .status(ContractStatus.PENDING)
                .scope(MaterializationScope.any())
                .createdAt(now)
                .expiresAt(now.plus(contractTtl))
                .build();
        stateSurface.compareAndSet(key(tenantId, contract.getContractId()),
                objectMapper.valueToTree(contract), 0L, null);

        log.info("Contract created: contractId={}, tenantId={}, artifact={}",
                contract.getContractId(), tenantId, artifactReference);
        return contract;
    }

    /** pending → active with the given scope. Anything else is an authorization error. */
    public BoundaryContract authorize(String tenantId, String contractId, MaterializationScope scope) {
        BoundaryContract authorized = transition(tenantId, contractId, contract -> {
            Instant now = clock.instant();
            ContractStatus current = contract.effectiveStatus(now);
            if (current != ContractStatus.PENDING) {
                throw new AuthorizationException("Contract " + contractId + " is " + current.wireName()
                        + ", only pending contracts can be authorized");
            }
            contract.setStatus(ContractStatus.ACTIVE);
            contract.setScope(scope != null ? scope : MaterializationScope.any());
            contract.setAuthorizedAt(now);
            return true;
        });
        if (authorized.getScope().isUnrestricted()) {
            log.warn("Contract authorized without scope restriction: contractId={}, tenantId={}", contractId, tenantId);
        } else {
            log.info("Contract authorized: contractId={}, tenantId={}, scope={}", contractId, tenantId, authorized.getScope());
        }
        return authorized;
    }

    /** pending | active → revoked. Revoking twice is a no-op; an expired contract cannot be revoked. */
    public BoundaryContract revoke(String tenantId, String contractId) {
        return transition(tenantId, contractId, contract -> {
            Instant now = clock.instant();
            ContractStatus current = contract.effectiveStatus(now);
            if (current == ContractStatus.REVOKED) {
                return false;
            }
            if (current == ContractStatus.EXPIRED) {
                throw new AuthorizationException("Contract " + contractId + " has expired and cannot be revoked");
            }
            contract.setStatus(ContractStatus.REVOKED);
            contract.setRevokedAt(now);
            log.info("Contract revoked: contractId={}, tenantId={}, was={}", contractId, tenantId, current.wireName());
            return true;
        });
    }

    // ─── Reads ────────────────────────────────────────────────────────────────

    public BoundaryContract get(String tenantId, String contractId) {
        return find(tenantId, contractId).orElseThrow(() -> new NotFoundException("contract", contractId));
    }

    public Optional<BoundaryContract> find(String tenantId, String contractId) {
        return stateSurface.get(key(tenantId, contractId)).map(this::toContract);
    }

    /**
     * True only if the contract is active right now and every dimension of its scope matches
     * the requester. Evaluated fresh on every call.
     */
    public boolean checkAccess(String tenantId, String contractId, MaterializationScope requester) {
        Optional<BoundaryContract> contract = find(tenantId, contractId);
        if (contract.isEmpty()) {
            return false;
        }
        boolean granted = contract.get().isActiveAt(clock.instant()) && contract.get().getScope().admits(requester);
        if (!granted) {
            log.debug("Contract access denied: contractId={}, tenantId={}, status={}",
                    contractId, tenantId, contract.get().getStatus().wireName());
        }
        return granted;
    }

    // ─── Expiry ───────────────────────────────────────────────────────────────

    /** Persists EXPIRED for every pending or active contract past its TTL. Returns how many changed. */
    public int sweepExpired() {
        Instant now = clock.instant();
        int expired = 0;
        for (String tenantId : stateSurface.tenants()) {
            StateQuery query = StateQuery.in(StateNamespace.CONTRACT)
                    .whereAnyOf("status", List.of(ContractStatus.PENDING.wireName(), ContractStatus.ACTIVE.wireName()));
            for (StateRecord record : stateSurface.query(tenantId, query)) {
                BoundaryContract contract = toContract(record);
                if (contract.effectiveStatus(now) != ContractStatus.EXPIRED) continue;

                contract.setStatus(ContractStatus.EXPIRED);
                try {
                    stateSurface.compareAndSet(record.getKey(), objectMapper.valueToTree(contract),
                            record.getVersion(), null);
                    expired++;
                    log.info("Contract expired: contractId={}, tenantId={}", contract.getContractId(), tenantId);
                } catch (VersionConflictException e) {
                    log.debug("Contract changed during sweep, skipped: contractId={}", contract.getContractId());
                }
            }
        }
        return expired;
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Applies {@code change} to the current contract and writes it back if it returned true.
     * On a version conflict the contract is re-read and the change re-evaluated.
     */
    private BoundaryContract transition(String tenantId, String contractId,
                                        Function<BoundaryContract, Boolean> change) {
        StateKey key = key(tenantId, contractId);
        VersionConflictException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_TRANSITION_ATTEMPTS; attempt++) {
            StateRecord record = stateSurface.get(key)
                    .orElseThrow(() -> new NotFoundException("contract", contractId));
            BoundaryContract contract = toContract(record);
            if (!change.apply(contract)) {
                return contract;
            }
            try {
                stateSurface.compareAndSet(key, objectMapper.valueToTree(contract), record.getVersion(), null);
                return contract;
            } catch (VersionConflictException e) {
                lastConflict = e;
                log.debug("Contract transition conflict, re-reading: contractId={}, attempt={}", contractId, attempt);
            }
        }
        throw lastConflict;
    }

    private BoundaryContract toContract(StateRecord record) {
        try {
            return objectMapper.treeToValue(record.getValue(), BoundaryContract.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable contract record: key=" + record.getKey(), e);
        }
    }

    private static StateKey key(String tenantId, String contractId) {
        return StateKey.contract(tenantId, contractId);
    }
}

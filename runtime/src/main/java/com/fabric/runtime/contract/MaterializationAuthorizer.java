package com.fabric.runtime.contract;

import com.fabric.shared.error.AuthorizationException;
import com.fabric.shared.error.NotFoundException;
import com.fabric.shared.error.ValidationException;
import com.fabric.shared.state.StateKey;
import com.fabric.shared.state.StateNamespace;
import com.fabric.shared.state.StateQuery;
import com.fabric.shared.state.StateRecord;
import com.fabric.shared.state.StateSurface;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Materialization Authorizer
 *
 * Writes materialization records under an active contract and gates every read through
 * {@link BoundaryContractStore#checkAccess}. Nothing is cached between calls: a contract
 * revoked after a record was written makes that record unreadable on the next read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaterializationAuthorizer {

    private final BoundaryContractStore contracts;
    private final StateSurface stateSurface;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MaterializationRecord materialize(String tenantId, String contractId, String representationType) {
        if (representationType == null || representationType.isBlank()) {
            throw new ValidationException("representation_type is required");
        }
        BoundaryContract contract = contracts.get(tenantId, contractId);
        Instant now = clock.instant();
        if (!contract.isActiveAt(now)) {
            log.warn("Materialization refused: contractId={}, tenantId={}, status={}",
                    contractId, tenantId, contract.effectiveStatus(now).wireName());
            throw new AuthorizationException("Contract " + contractId + " is "
                    + contract.effectiveStatus(now).wireName() + ", materialization requires an active contract");
        }

        MaterializationRecord record = MaterializationRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .contractId(contractId)
                .artifactReference(contract.getArtifactReference())
                .representationType(representationType)
                .storedAt(now)
                .build();
        stateSurface.compareAndSet(StateKey.materialization(tenantId, record.getRecordId()),
                objectMapper.valueToTree(record), 0L, null);

        log.info("Artifact materialized: recordId={}, contractId={}, tenantId={}, representation={}",
                record.getRecordId(), contractId, tenantId, representationType);
        return record;
    }

    /** Re-checks the owning contract against the requester on every call. */
    public MaterializationRecord read(String tenantId, String recordId, MaterializationScope requester) {
        MaterializationRecord record = stateSurface.get(StateKey.materialization(tenantId, recordId))
                .map(this::toRecord)
                .orElseThrow(() -> new NotFoundException("materialization", recordId));

        if (!contracts.checkAccess(tenantId, record.getContractId(), requester)) {
            log.warn("Materialization read denied: recordId={}, contractId={}, tenantId={}",
                    recordId, record.getContractId(), tenantId);
            throw new AuthorizationException("Access to materialization " + recordId + " is not permitted");
        }
        return record;
    }

    /** Records of the tenant the requester may read right now. */
    public List<MaterializationRecord> list(String tenantId, MaterializationScope requester) {
        Map<String, Boolean> access = new HashMap<>();
        return stateSurface.query(tenantId, StateQuery.in(StateNamespace.MATERIALIZATION)).stream()
                .map(this::toRecord)
                .filter(r -> access.computeIfAbsent(r.getContractId(),
                        id -> contracts.checkAccess(tenantId, id, requester)))
                .toList();
    }

    private MaterializationRecord toRecord(StateRecord record) {
        try {
            return objectMapper.treeToValue(record.getValue(), MaterializationRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable materialization record: key=" + record.getKey(), e);
        }
    }
}

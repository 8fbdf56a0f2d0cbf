package com.fabric.shared.saga;

import com.fabric.shared.state.StateKey;
import com.fabric.shared.state.StateNamespace;
import com.fabric.shared.state.StateQuery;
import com.fabric.shared.state.StateRecord;
import com.fabric.shared.state.StateSurface;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Execution snapshots and cancel flags on the state surface.
 *
 * Snapshot:    tenant/{tenantId}/execution/{executionId}
 * Cancel flag: tenant/{tenantId}/execution/{executionId}/cancel
 *
 * The flag lives under its own key so a cancel request never races the single writer's
 * snapshot updates.
 */
@Slf4j
@RequiredArgsConstructor
public class ExecutionStore {

    private static final String CANCEL = "cancel";

    private final StateSurface stateSurface;
    private final ObjectMapper objectMapper;

    public void save(Execution execution) {
        StateKey key = StateKey.execution(execution.getTenantId(), execution.getExecutionId());
        stateSurface.set(key, objectMapper.valueToTree(execution));
        log.debug("Execution snapshot saved: executionId={}, status={}, lastSequenceNo={}",
                execution.getExecutionId(), execution.getStatus(), execution.getLastSequenceNo());
    }

    public Optional<Execution> load(String tenantId, String executionId) {
        return stateSurface.get(StateKey.execution(tenantId, executionId)).map(this::toExecution);
    }

    public void requestCancel(String tenantId, String executionId) {
        stateSurface.set(StateKey.execution(tenantId, executionId).child(CANCEL), BooleanNode.TRUE);
    }

    public boolean isCancelRequested(String tenantId, String executionId) {
        return stateSurface.get(StateKey.execution(tenantId, executionId).child(CANCEL))
                .map(r -> r.getValue().asBoolean())
                .orElse(false);
    }

    public List<Execution> findBySession(String tenantId, String sessionId, ExecutionStatus... statuses) {
        StateQuery query = StateQuery.in(StateNamespace.EXECUTION).where("session_id", sessionId);
        return find(tenantId, query, statuses);
    }

    public List<Execution> findByStatus(String tenantId, ExecutionStatus... statuses) {
        return find(tenantId, StateQuery.in(StateNamespace.EXECUTION), statuses);
    }

    private List<Execution> find(String tenantId, StateQuery query, ExecutionStatus... statuses) {
        if (statuses.length > 0) {
            query.whereAnyOf("status", Arrays.stream(statuses).map(ExecutionStatus::wireName).toList());
        }
        return stateSurface.query(tenantId, query).stream()
                .map(this::toExecution)
                .toList();
    }

    private Execution toExecution(StateRecord record) {
        try {
            return objectMapper.treeToValue(record.getValue(), Execution.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable execution snapshot: key=" + record.getKey(), e);
        }
    }
}

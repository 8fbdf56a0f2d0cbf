package com.fabric.runtime.api;

import com.fabric.shared.saga.Execution;
import com.fabric.shared.saga.SagaCoordinator;
import com.fabric.shared.wal.WalEventExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execution REST Controller
 *
 * GET  /execution/{id}/status   snapshot with steps
 * POST /execution/{id}/cancel   flags the execution; takes effect before the next step group
 * GET  /execution/{id}/events   WAL as NDJSON, one event per line in sequence order
 */
@Slf4j
@RestController
@RequestMapping("/execution")
@RequiredArgsConstructor
public class ExecutionController {

    static final String NDJSON = "application/x-ndjson";

    private final SagaCoordinator coordinator;
    private final WalEventExporter exporter;

    @GetMapping("/{executionId}/status")
    public Execution status(@PathVariable String executionId, @RequestHeader(Headers.TENANT) String tenantId) {
        return coordinator.status(tenantId, executionId);
    }

    @PostMapping("/{executionId}/cancel")
    public Map<String, Object> cancel(@PathVariable String executionId,
                                      @RequestHeader(Headers.TENANT) String tenantId) {
        Execution execution = coordinator.cancel(tenantId, executionId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("execution_id", executionId);
        body.put("status", execution.getStatus().wireName());
        body.put("cancel_requested", execution.isCancelRequested());
        return body;
    }

    @GetMapping(value = "/{executionId}/events", produces = NDJSON)
    public ResponseEntity<String> events(@PathVariable String executionId,
                                         @RequestHeader(Headers.TENANT) String tenantId) throws IOException {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(NDJSON))
                .body(exporter.export(coordinator.history(tenantId, executionId)));
    }
}

package com.fabric.runtime.api;

import com.fabric.runtime.session.Session;
import com.fabric.runtime.session.SessionManager;
import com.fabric.shared.error.ValidationException;
import com.fabric.shared.saga.Execution;
import com.fabric.shared.saga.SagaCoordinator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

/**
 * Session REST Controller
 *
 * POST  /session/create
 * GET   /session/{id}              invalid sessions are returned too; callers check status
 * PATCH /session/{id}/context      shallow merge, optionally conditional on expected_version
 * POST  /session/{id}/invalidate
 * GET   /session/{id}/executions   executions of the session still pending or running
 */
@Slf4j
@RestController
@RequestMapping("/session")
@RequiredArgsConstructor
public class SessionController {

    private final SessionManager sessions;
    private final SagaCoordinator coordinator;

    @PostMapping("/create")
    public ResponseEntity<Session> create(
            @RequestBody(required = false) CreateSessionRequest request,
            @RequestHeader(Headers.TENANT) String tenantId,
            @RequestHeader(value = Headers.USER, required = false) String userId) {

        CreateSessionRequest body = request != null ? request : new CreateSessionRequest();
        if (body.getTenantId() != null && !body.getTenantId().equals(tenantId)) {
            throw new ValidationException("tenant_id does not match the caller's tenant");
        }
        String owner = body.getUserId() != null ? body.getUserId() : userId;
        Session session = sessions.create(tenantId, owner, body.getContext());
        return ResponseEntity
                .created(URI.create("/session/" + session.getSessionId()))
                .body(session);
    }

    @GetMapping("/{sessionId}")
    public Session get(@PathVariable String sessionId, @RequestHeader(Headers.TENANT) String tenantId) {
        return sessions.get(tenantId, sessionId);
    }

    @PatchMapping("/{sessionId}/context")
    public Session updateContext(@PathVariable String sessionId,
                                 @RequestHeader(Headers.TENANT) String tenantId,
                                 @RequestBody UpdateContextRequest request) {
        return sessions.updateContext(tenantId, sessionId, request.getContext(), request.getExpectedVersion());
    }

    @PostMapping("/{sessionId}/invalidate")
    public Session invalidate(@PathVariable String sessionId, @RequestHeader(Headers.TENANT) String tenantId) {
        return sessions.invalidate(tenantId, sessionId);
    }

    @GetMapping("/{sessionId}/executions")
    public List<Execution> activeExecutions(@PathVariable String sessionId,
                                            @RequestHeader(Headers.TENANT) String tenantId) {
        sessions.get(tenantId, sessionId);
        return coordinator.activeExecutions(tenantId, sessionId);
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class CreateSessionRequest {
    private String tenantId;
    private String userId;
    private JsonNode context;
}

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class UpdateContextRequest {
    private JsonNode context;
    private Long expectedVersion;
}

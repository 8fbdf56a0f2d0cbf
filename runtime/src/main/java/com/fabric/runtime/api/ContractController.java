package com.fabric.runtime.api;

import com.fabric.runtime.contract.BoundaryContract;
import com.fabric.runtime.contract.BoundaryContractStore;
import com.fabric.runtime.contract.MaterializationAuthorizer;
import com.fabric.runtime.contract.MaterializationRecord;
import com.fabric.runtime.contract.MaterializationScope;
import com.fabric.runtime.identity.CallerIdentity;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

/**
 * Boundary Contract REST Controller
 *
 * Lifecycle:      POST /contracts, POST /contracts/{id}/authorize, POST /contracts/{id}/revoke,
 *                 GET /contracts/{id}
 * Materialization: POST /contracts/{id}/materializations, GET /materializations/{id},
 *                 GET /materializations
 *
 * Materialization reads are checked against the caller's user and session headers plus the
 * optional {@code solution_id} query parameter.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ContractController {

    private final BoundaryContractStore contracts;
    private final MaterializationAuthorizer authorizer;

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    @PostMapping("/contracts")
    public ResponseEntity<BoundaryContract> create(@Valid @RequestBody CreateContractRequest request,
                                                   @RequestHeader(Headers.TENANT) String tenantId) {
        BoundaryContract contract = contracts.createPending(tenantId, request.getArtifactReference());
        return ResponseEntity
                .created(URI.create("/contracts/" + contract.getContractId()))
                .body(contract);
    }

    @PostMapping("/contracts/{contractId}/authorize")
    public BoundaryContract authorize(@PathVariable String contractId,
                                      @RequestHeader(Headers.TENANT) String tenantId,
                                      @RequestBody(required = false) AuthorizeContractRequest request) {
        MaterializationScope scope = request != null && request.getScope() != null
                ? request.getScope()
                : MaterializationScope.any();
        return contracts.authorize(tenantId, contractId, scope);
    }

    @PostMapping("/contracts/{contractId}/revoke")
    public BoundaryContract revoke(@PathVariable String contractId, @RequestHeader(Headers.TENANT) String tenantId) {
        return contracts.revoke(tenantId, contractId);
    }

    @GetMapping("/contracts/{contractId}")
    public BoundaryContract get(@PathVariable String contractId, @RequestHeader(Headers.TENANT) String tenantId) {
        return contracts.get(tenantId, contractId);
    }

    // ─── Materialization ──────────────────────────────────────────────────────

    @PostMapping("/contracts/{contractId}/materializations")
    public ResponseEntity<MaterializationRecord> materialize(@PathVariable String contractId,
                                                             @RequestHeader(Headers.TENANT) String tenantId,
                                                             @Valid @RequestBody MaterializeRequest request) {
        MaterializationRecord record = authorizer.materialize(tenantId, contractId, request.getRepresentationType());
        return ResponseEntity
                .created(URI.create("/materializations/" + record.getRecordId()))
                .body(record);
    }

    @GetMapping("/materializations/{recordId}")
    public MaterializationRecord read(@PathVariable String recordId,
                                      @RequestHeader(Headers.TENANT) String tenantId,
                                      @RequestHeader(value = Headers.USER, required = false) String userId,
                                      @RequestHeader(value = Headers.SESSION, required = false) String sessionId,
                                      @RequestParam(value = "solution_id", required = false) String solutionId) {
        CallerIdentity caller = CallerIdentity.of(tenantId, userId, sessionId);
        return authorizer.read(tenantId, recordId, caller.toScope(solutionId));
    }

    @GetMapping("/materializations")
    public List<MaterializationRecord> list(@RequestHeader(Headers.TENANT) String tenantId,
                                            @RequestHeader(value = Headers.USER, required = false) String userId,
                                            @RequestHeader(value = Headers.SESSION, required = false) String sessionId,
                                            @RequestParam(value = "solution_id", required = false) String solutionId) {
        CallerIdentity caller = CallerIdentity.of(tenantId, userId, sessionId);
        return authorizer.list(tenantId, caller.toScope(solutionId));
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class CreateContractRequest {
    @NotBlank private String artifactReference;
}

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class AuthorizeContractRequest {
    private MaterializationScope scope;
}

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class MaterializeRequest {
    @NotBlank private String representationType;
}

package com.fabric.runtime.realm.content;

import com.fabric.runtime.contract.BoundaryContract;
import com.fabric.runtime.contract.BoundaryContractStore;
import com.fabric.runtime.contract.ContractStatus;
import com.fabric.runtime.contract.MaterializationAuthorizer;
import com.fabric.runtime.contract.MaterializationRecord;
import com.fabric.runtime.contract.MaterializationScope;
import com.fabric.shared.capability.CapabilityRouter;
import com.fabric.shared.capability.IntentType;
import com.fabric.shared.capability.RealmModule;
import com.fabric.shared.capability.SagaDefinition;
import com.fabric.shared.capability.StepContext;
import com.fabric.shared.capability.StepDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Content realm
 *
 * Runs the two-phase materialization protocol through the saga engine:
 *
 *   ingest_file:          register_artifact (pending contract; undo = revoke)
 *   save_materialization: authorize_contract (pending → active; undo = revoke if this execution activated it)
 *                         → materialize
 *
 * The scope granted on authorization is the {@code scope} parameter when given, otherwise the
 * submitting user and solution.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentRealm implements RealmModule {

    static final String REGISTER_ARTIFACT = "register_artifact";
    static final String AUTHORIZE_CONTRACT = "authorize_contract";
    static final String MATERIALIZE = "materialize";

    private static final String DEFAULT_REPRESENTATION = "parsed";

    private final BoundaryContractStore contracts;
    private final MaterializationAuthorizer authorizer;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "content";
    }

    @Override
    public void registerCapabilities(CapabilityRouter router) {
        router.register(IntentType.INGEST_FILE, name(), SagaDefinition.builder()
                .step(StepDefinition.builder()
                        .name(REGISTER_ARTIFACT)
                        .handler(this::registerArtifact)
                        .compensation(this::revoke)
                        .build())
                .build());

        router.register(IntentType.SAVE_MATERIALIZATION, name(), SagaDefinition.builder()
                .step(StepDefinition.builder()
                        .name(AUTHORIZE_CONTRACT)
                        .handler(this::authorizeContract)
                        .compensation(this::revokeIfActivated)
                        .idempotent(true)
                        .build())
                .step(StepDefinition.builder()
                        .name(MATERIALIZE)
                        .handler(this::materialize)
                        .build())
                .build());
    }

    // ─── Steps ────────────────────────────────────────────────────────────────

    private JsonNode registerArtifact(StepContext ctx) {
        String artifact = ctx.resolveText("artifact_reference")
                .or(() -> ctx.resolveText("file_id"))
                .orElseThrow(() -> new IllegalArgumentException("artifact_reference or file_id is required"));

        BoundaryContract contract = contracts.createPending(ctx.getTenantId(), artifact);
        return contractOutput(contract);
    }

    /**
     * Already active under the same scope counts as done, so a resumed attempt succeeds. The
     * output's {@code activated} flag is true only when this call made the transition.
     */
    private JsonNode authorizeContract(StepContext ctx) throws Exception {
        String contractId = requireContractId(ctx);
        MaterializationScope scope = requestedScope(ctx);

        BoundaryContract current = contracts.get(ctx.getTenantId(), contractId);
        if (current.getStatus() == ContractStatus.ACTIVE && sameScope(current.getScope(), scope)) {
            log.info("Contract already authorized: contractId={}, executionId={}", contractId, ctx.getExecutionId());
            return contractOutput(current).put("activated", false);
        }
        return contractOutput(contracts.authorize(ctx.getTenantId(), contractId, scope)).put("activated", true);
    }

    private JsonNode materialize(StepContext ctx) {
        String contractId = requireContractId(ctx);
        String representation = ctx.resolveText("representation_type").orElse(DEFAULT_REPRESENTATION);

        MaterializationRecord record = authorizer.materialize(ctx.getTenantId(), contractId, representation);
        return objectMapper.createObjectNode()
                .put("record_id", record.getRecordId())
                .put("contract_id", contractId)
                .put("representation_type", representation);
    }

    private void revoke(StepContext ctx, JsonNode output) {
        if (output == null || !output.hasNonNull("contract_id")) return;
        contracts.revoke(ctx.getTenantId(), output.get("contract_id").asText());
    }

    /** A contract that was active before this execution is left alone. */
    private void revokeIfActivated(StepContext ctx, JsonNode output) {
        if (output == null || !output.path("activated").asBoolean(false)) {
            log.info("Contract not activated by this execution, keeping it: executionId={}", ctx.getExecutionId());
            return;
        }
        revoke(ctx, output);
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static String requireContractId(StepContext ctx) {
        return ctx.resolveText("contract_id")
                .or(() -> ctx.previousOutput(AUTHORIZE_CONTRACT).map(o -> o.path("contract_id").asText(null)))
                .orElseThrow(() -> new IllegalArgumentException("contract_id is required"));
    }

    private MaterializationScope requestedScope(StepContext ctx) throws Exception {
        JsonNode requested = ctx.getParameters() != null ? ctx.getParameters().get("scope") : null;
        if (requested != null && requested.isObject()) {
            return objectMapper.treeToValue(requested, MaterializationScope.class);
        }
        return MaterializationScope.builder()
                .userId(ctx.getUserId())
                .solutionId(ctx.getSolutionId())
                .build();
    }

    private static boolean sameScope(MaterializationScope a, MaterializationScope b) {
        return a.admits(b) && b.admits(a);
    }

    private ObjectNode contractOutput(BoundaryContract contract) {
        return objectMapper.createObjectNode()
                .put("contract_id", contract.getContractId())
                .put("artifact_reference", contract.getArtifactReference())
                .put("status", contract.getStatus().wireName());
    }
}

package com.fabric.runtime.api;

import com.fabric.runtime.contract.BoundaryContract;
import com.fabric.runtime.contract.BoundaryContractStore;
import com.fabric.runtime.contract.ContractStatus;
import com.fabric.runtime.contract.MaterializationAuthorizer;
import com.fabric.runtime.contract.MaterializationRecord;
import com.fabric.runtime.contract.MaterializationScope;
import com.fabric.shared.error.AuthorizationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class ContractControllerTest {

    @Mock BoundaryContractStore contracts;
    @Mock MaterializationAuthorizer authorizer;

    MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = ApiTestSupport.mockMvc(new ContractController(contracts, authorizer));
    }

    private BoundaryContract contract(ContractStatus status, MaterializationScope scope) {
        return BoundaryContract.builder()
                .contractId("c-1")
                .tenantId("t1")
                .artifactReference("file-1")
                .status(status)
                .scope(scope)
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }

    private MaterializationRecord record(String id) {
        return MaterializationRecord.builder()
                .recordId(id)
                .tenantId("t1")
                .contractId("c-1")
                .artifactReference("file-1")
                .representationType("parsed")
                .build();
    }

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /contracts — 201 with a pending contract")
    void create_shouldReturnCreated() throws Exception {
        when(contracts.createPending("t1", "file-1")).thenReturn(contract(ContractStatus.PENDING, MaterializationScope.any()));

        mockMvc.perform(post("/contracts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, "t1")
                        .content("{\"artifact_reference\": \"file-1\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/contracts/c-1"))
                .andExpect(jsonPath("$.status").value("pending"));
    }

    @Test
    @DisplayName("POST /contracts — a blank artifact reference fails bean validation")
    void create_blankArtifactShouldBe400() throws Exception {
        mockMvc.perform(post("/contracts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, "t1")
                        .content("{\"artifact_reference\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("artifactReference")));

        verifyNoInteractions(contracts);
    }

    @Test
    @DisplayName("POST /contracts/{id}/authorize — the body scope is granted; no body means any")
    void authorize_shouldPassScope() throws Exception {
        when(contracts.authorize(eq("t1"), eq("c-1"), any()))
                .thenReturn(contract(ContractStatus.ACTIVE, MaterializationScope.builder().userId("u1").build()));

        mockMvc.perform(post("/contracts/c-1/authorize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, "t1")
                        .content("{\"scope\": {\"user_id\": \"u1\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.scope.user_id").value("u1"));
        mockMvc.perform(post("/contracts/c-1/authorize").header(Headers.TENANT, "t1"))
                .andExpect(status().isOk());

        ArgumentCaptor<MaterializationScope> scopes = ArgumentCaptor.forClass(MaterializationScope.class);
        verify(contracts, times(2)).authorize(eq("t1"), eq("c-1"), scopes.capture());
        assertThat(scopes.getAllValues().get(0).getUserId()).isEqualTo("u1");
        assertThat(scopes.getAllValues().get(1).isUnrestricted()).isTrue();
    }

    @Test
    @DisplayName("POST /contracts/{id}/authorize — a non-pending contract is 403")
    void authorize_nonPendingShouldBe403() throws Exception {
        when(contracts.authorize(eq("t1"), eq("c-1"), any()))
                .thenThrow(new AuthorizationException("Contract c-1 is revoked, only pending contracts can be authorized"));

        mockMvc.perform(post("/contracts/c-1/authorize").header(Headers.TENANT, "t1"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("AUTHORIZATION"));
    }

    // ─── Materialization ──────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /contracts/{id}/materializations — 201 with the stored record")
    void materialize_shouldReturnCreated() throws Exception {
        when(authorizer.materialize("t1", "c-1", "parsed")).thenReturn(record("r-1"));

        mockMvc.perform(post("/contracts/c-1/materializations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, "t1")
                        .content("{\"representation_type\": \"parsed\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/materializations/r-1"))
                .andExpect(jsonPath("$.record_id").value("r-1"));
    }

    @Test
    @DisplayName("GET /materializations/{id} — requester scope built from headers and solution_id")
    void read_shouldBuildRequesterScope() throws Exception {
        when(authorizer.read(eq("t1"), eq("r-1"), any())).thenReturn(record("r-1"));

        mockMvc.perform(get("/materializations/r-1")
                        .header(Headers.TENANT, "t1")
                        .header(Headers.USER, "u1")
                        .header(Headers.SESSION, "s1")
                        .param("solution_id", "sol-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contract_id").value("c-1"));

        ArgumentCaptor<MaterializationScope> requester = ArgumentCaptor.forClass(MaterializationScope.class);
        verify(authorizer).read(eq("t1"), eq("r-1"), requester.capture());
        assertThat(requester.getValue().getUserId()).isEqualTo("u1");
        assertThat(requester.getValue().getSessionId()).isEqualTo("s1");
        assertThat(requester.getValue().getSolutionId()).isEqualTo("sol-1");
    }

    @Test
    @DisplayName("GET /materializations/{id} — a denied read is 403")
    void read_deniedShouldBe403() throws Exception {
        when(authorizer.read(eq("t1"), eq("r-1"), any()))
                .thenThrow(new AuthorizationException("Contract c-1 does not admit the requester"));

        mockMvc.perform(get("/materializations/r-1").header(Headers.TENANT, "t1").header(Headers.USER, "u2"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("GET /materializations — only what the requester may read")
    void list_shouldDelegateToAuthorizer() throws Exception {
        when(authorizer.list(eq("t1"), any())).thenReturn(List.of(record("r-1"), record("r-2")));

        mockMvc.perform(get("/materializations").header(Headers.TENANT, "t1").header(Headers.USER, "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].record_id").value("r-2"));
    }
}

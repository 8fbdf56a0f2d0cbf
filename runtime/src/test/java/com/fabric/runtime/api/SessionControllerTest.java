package com.fabric.runtime.api;

import com.fabric.runtime.session.Session;
import com.fabric.runtime.session.SessionManager;
import com.fabric.runtime.session.SessionStatus;
import com.fabric.shared.capability.IntentType;
import com.fabric.shared.error.NotFoundException;
import com.fabric.shared.error.VersionConflictException;
import com.fabric.shared.saga.Execution;
import com.fabric.shared.saga.ExecutionStatus;
import com.fabric.shared.saga.SagaCoordinator;
import com.fasterxml.jackson.databind.JsonNode;
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
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock SessionManager sessions;
    @Mock SagaCoordinator coordinator;

    MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = ApiTestSupport.mockMvc(new SessionController(sessions, coordinator));
    }

    private Session session(String id, long version) {
        Session session = new Session();
        session.setSessionId(id);
        session.setTenantId("t1");
        session.setUserId("u1");
        session.setStatus(SessionStatus.ACTIVE);
        session.setContext(ApiTestSupport.OBJECT_MAPPER.createObjectNode().put("tone", "formal"));
        session.setCreatedAt(Instant.parse("2026-03-01T10:00:00Z"));
        session.setVersion(version);
        return session;
    }

    @Test
    @DisplayName("POST /session/create — 201 with Location, owner from body over header")
    void create_shouldReturnCreated() throws Exception {
        when(sessions.create(eq("t1"), eq("u-body"), any())).thenReturn(session("s1", 1));

        mockMvc.perform(post("/session/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, "t1")
                        .header(Headers.USER, "u-header")
                        .content("""
                                {"user_id": "u-body", "context": {"tone": "formal"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/session/s1"))
                .andExpect(jsonPath("$.session_id").value("s1"))
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.context.tone").value("formal"));
    }

    @Test
    @DisplayName("POST /session/create — a body tenant other than the header is rejected")
    void create_tenantMismatchShouldBe400() throws Exception {
        mockMvc.perform(post("/session/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, "t1")
                        .content("{\"tenant_id\": \"t2\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"));

        verifyNoInteractions(sessions);
    }

    @Test
    @DisplayName("GET /session/{id} — missing tenant header is a 400, unknown session a 404")
    void get_shouldMapErrors() throws Exception {
        when(sessions.get("t1", "nope")).thenThrow(new NotFoundException("session", "nope"));

        mockMvc.perform(get("/session/s1"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/session/nope").header(Headers.TENANT, "t1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("PATCH /session/{id}/context — passes patch and expected version through")
    void updateContext_shouldPassExpectedVersion() throws Exception {
        when(sessions.updateContext(eq("t1"), eq("s1"), any(), eq(3L))).thenReturn(session("s1", 4));

        mockMvc.perform(patch("/session/s1/context")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, "t1")
                        .content("""
                                {"context": {"tone": null, "locale": "de"}, "expected_version": 3}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(4));

        ArgumentCaptor<JsonNode> patch = ArgumentCaptor.forClass(JsonNode.class);
        verify(sessions).updateContext(eq("t1"), eq("s1"), patch.capture(), eq(3L));
        assertThat(patch.getValue().get("tone").isNull()).isTrue();
        assertThat(patch.getValue().get("locale").asText()).isEqualTo("de");
    }

    @Test
    @DisplayName("PATCH /session/{id}/context — a stale version is a 409 carrying both versions")
    void updateContext_conflictShouldBe409() throws Exception {
        when(sessions.updateContext(eq("t1"), eq("s1"), any(), eq(1L)))
                .thenThrow(new VersionConflictException("tenant/t1/session/s1", 1, 2));

        mockMvc.perform(patch("/session/s1/context")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, "t1")
                        .content("{\"context\": {\"a\": 1}, \"expected_version\": 1}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("VERSION_CONFLICT"))
                .andExpect(jsonPath("$.expected_version").value(1))
                .andExpect(jsonPath("$.actual_version").value(2));
    }

    @Test
    @DisplayName("GET /session/{id}/executions — active executions of an existing session")
    void activeExecutions_shouldListFromCoordinator() throws Exception {
        when(sessions.get("t1", "s1")).thenReturn(session("s1", 1));
        when(coordinator.activeExecutions("t1", "s1")).thenReturn(List.of(Execution.builder()
                .executionId("exec-1")
                .tenantId("t1")
                .sessionId("s1")
                .intentType(IntentType.INGEST_FILE)
                .status(ExecutionStatus.RUNNING)
                .build()));

        mockMvc.perform(get("/session/s1/executions").header(Headers.TENANT, "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].execution_id").value("exec-1"))
                .andExpect(jsonPath("$[0].intent_type").value("ingest_file"))
                .andExpect(jsonPath("$[0].status").value("running"));
    }
}

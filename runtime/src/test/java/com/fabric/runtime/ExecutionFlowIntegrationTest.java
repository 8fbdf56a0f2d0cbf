package com.fabric.runtime;

import com.fabric.runtime.api.Headers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full HTTP flow against the in-memory storage profile: no PostgreSQL, Redis or Kafka needed.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("memory")
class ExecutionFlowIntegrationTest {

    @Autowired MockMvc mockMvc;
    @Autowired ObjectMapper objectMapper;

    private final String tenant = "tenant-" + UUID.randomUUID();

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private JsonNode body(ResultActions actions) throws Exception {
        return objectMapper.readTree(actions.andReturn().getResponse().getContentAsString());
    }

    private JsonNode submit(String json) throws Exception {
        return body(mockMvc.perform(post("/intent/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, tenant)
                        .header(Headers.USER, "u1")
                        .content(json))
                .andExpect(status().isAccepted()));
    }

    private JsonNode awaitTerminal(String executionId) {
        JsonNode[] last = new JsonNode[1];
        await().atMost(Duration.ofSeconds(10)).until(() -> {
            last[0] = body(mockMvc.perform(get("/execution/{id}/status", executionId).header(Headers.TENANT, tenant))
                    .andExpect(status().isOk()));
            String status = last[0].path("status").asText();
            return status.equals("completed") || status.equals("failed") || status.equals("compensated");
        });
        return last[0];
    }

    private static JsonNode stepOutput(JsonNode execution, String capability) {
        for (JsonNode step : execution.path("steps")) {
            if (step.path("capability_name").asText().equals(capability)) {
                return step.path("output");
            }
        }
        throw new AssertionError("no step " + capability + " in " + execution);
    }

    // ─── Flows ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("ingest then materialize — the record is readable by the submitter only")
    void ingestAndMaterialize_shouldGateReadsByContract() throws Exception {
        JsonNode ingest = submit("""
                {"type": "ingest_file", "parameters": {"artifact_reference": "s3://bucket/a.csv"}}
                """);
        JsonNode ingested = awaitTerminal(ingest.get("execution_id").asText());
        assertThat(ingested.get("status").asText()).isEqualTo("completed");
        String contractId = stepOutput(ingested, "register_artifact").get("contract_id").asText();

        JsonNode save = submit("""
                {"type": "save_materialization", "session_id": "%s", "parameters": {"contract_id": "%s"}}
                """.formatted(ingest.get("session_id").asText(), contractId));
        JsonNode saved = awaitTerminal(save.get("execution_id").asText());
        assertThat(saved.get("status").asText()).isEqualTo("completed");
        assertThat(stepOutput(saved, "materialize").get("representation_type").asText()).isEqualTo("parsed");
        String recordId = stepOutput(saved, "materialize").get("record_id").asText();

        mockMvc.perform(get("/materializations/{id}", recordId).header(Headers.TENANT, tenant).header(Headers.USER, "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contract_id").value(contractId));
        mockMvc.perform(get("/materializations/{id}", recordId).header(Headers.TENANT, tenant).header(Headers.USER, "u2"))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/contracts/{id}/revoke", contractId).header(Headers.TENANT, tenant))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("revoked"));
        mockMvc.perform(get("/materializations/{id}", recordId).header(Headers.TENANT, tenant).header(Headers.USER, "u1"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("idempotency key — a repeated submission replays the first execution")
    void repeatedKey_shouldReplay() throws Exception {
        String json = """
                {"type": "ingest_file", "idempotency_key": "k-1", "parameters": {"file_id": "f-1"}}
                """;
        JsonNode first = submit(json);
        awaitTerminal(first.get("execution_id").asText());

        JsonNode second = submit(json);

        assertThat(second.get("execution_id").asText()).isEqualTo(first.get("execution_id").asText());
        assertThat(second.get("replayed").asBoolean()).isTrue();
        assertThat(second.get("status").asText()).isEqualTo("completed");
    }

    @Test
    @DisplayName("events — the WAL of a finished execution as NDJSON")
    void events_shouldExportWal() throws Exception {
        JsonNode admission = submit("""
                {"type": "ingest_file", "parameters": {"file_id": "f-1"}}
                """);
        String executionId = admission.get("execution_id").asText();
        awaitTerminal(executionId);

        String ndjson = mockMvc.perform(get("/execution/{id}/events", executionId).header(Headers.TENANT, tenant))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        String[] lines = ndjson.trim().split("\n");
        assertThat(objectMapper.readTree(lines[0]).get("type").asText()).isEqualTo("EXECUTION_STARTED");
        assertThat(objectMapper.readTree(lines[lines.length - 1]).get("type").asText()).isEqualTo("EXECUTION_COMPLETED");
    }

    @Test
    @DisplayName("intent without a registered capability — admitted, then failed")
    void unregisteredIntent_shouldFail() throws Exception {
        JsonNode admission = submit("""
                {"type": "generate_sop", "parameters": {}}
                """);

        JsonNode execution = awaitTerminal(admission.get("execution_id").asText());

        assertThat(execution.get("status").asText()).isEqualTo("failed");
        assertThat(execution.get("error_code").asText()).isEqualTo("CAPABILITY_NOT_FOUND");
    }

    @Test
    @DisplayName("errors — unknown intent type 400, missing tenant 400, foreign execution 404")
    void errors_shouldMapToProblems() throws Exception {
        mockMvc.perform(post("/intent/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(Headers.TENANT, tenant)
                        .content("{\"type\": \"launch_rocket\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"));
        mockMvc.perform(post("/intent/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"ingest_file\"}"))
                .andExpect(status().isBadRequest());

        JsonNode admission = submit("""
                {"type": "ingest_file", "parameters": {"file_id": "f-1"}}
                """);
        mockMvc.perform(get("/execution/{id}/status", admission.get("execution_id").asText())
                        .header(Headers.TENANT, "someone-else"))
                .andExpect(status().isNotFound());
    }
}

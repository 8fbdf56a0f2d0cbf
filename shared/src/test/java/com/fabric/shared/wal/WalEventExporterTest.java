package com.fabric.shared.wal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WalEventExporterTest {

    final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    @DisplayName("export — one snake_case JSON object per line in sequence order")
    void export_shouldWriteNdjson() throws Exception {
        InMemoryWriteAheadLog wal = new InMemoryWriteAheadLog();
        WalScope scope = new WalScope("t1", "s1", "e1");
        wal.append(scope, WalEventType.EXECUTION_STARTED, null);
        wal.append(scope, WalEventType.EXECUTION_RUNNING, null);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new WalEventExporter(objectMapper).export(wal.replay("t1", "e1"), out);

        String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
        assertThat(lines).hasSize(2);

        JsonNode first = objectMapper.readTree(lines[0]);
        assertThat(first.fieldNames()).toIterable().containsExactly(
                "event_id", "execution_id", "tenant_id", "session_id",
                "sequence_no", "type", "payload", "recorded_at");
        assertThat(first.get("sequence_no").asLong()).isEqualTo(1L);
        assertThat(first.get("type").asText()).isEqualTo("EXECUTION_STARTED");
        assertThat(objectMapper.readTree(lines[1]).get("sequence_no").asLong()).isEqualTo(2L);
    }

    @Test
    @DisplayName("export — exported lines read back into identical events")
    void export_linesShouldReadBack() throws Exception {
        InMemoryWriteAheadLog wal = new InMemoryWriteAheadLog();
        wal.append(new WalScope("t1", "s1", "e1"), WalEventType.EXECUTION_STARTED, null);
        List<WalEvent> events = wal.replay("t1", "e1");

        String ndjson = new WalEventExporter(objectMapper).export(events);
        WalEvent parsed = objectMapper.readValue(ndjson.trim(), WalEvent.class);

        assertThat(parsed.getEventId()).isEqualTo(events.get(0).getEventId());
        assertThat(parsed.getRecordedAt()).isEqualTo(events.get(0).getRecordedAt());
    }
}

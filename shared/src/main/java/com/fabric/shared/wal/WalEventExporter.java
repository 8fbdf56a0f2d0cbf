package com.fabric.shared.wal;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * NDJSON export of an execution's WAL: one JSON object per line, sequence order.
 */
@RequiredArgsConstructor
public class WalEventExporter {

    private final ObjectMapper objectMapper;

    public void export(List<WalEvent> events, OutputStream out) throws IOException {
        for (WalEvent event : events) {
            out.write(objectMapper.writeValueAsBytes(event));
            out.write('\n');
        }
        out.flush();
    }

    public String export(List<WalEvent> events) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        export(events, out);
        return out.toString(StandardCharsets.UTF_8);
    }
}

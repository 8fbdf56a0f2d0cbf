package com.fabric.shared.capability;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of intent types the platform accepts. Anything else is rejected at intake.
 * Whether a type can actually run depends on a realm having registered a saga for it.
 */
public enum IntentType {
    INGEST_FILE,
    BULK_INGEST_FILES,
    PARSE_CONTENT,
    SAVE_MATERIALIZATION,
    EXTRACT_EMBEDDINGS,
    ANALYZE_STRUCTURED_DATA,
    ANALYZE_UNSTRUCTURED_DATA,
    ASSESS_DATA_QUALITY,
    INTERPRET_DATA,
    VISUALIZE_LINEAGE,
    GENERATE_SOP,
    CREATE_WORKFLOW,
    CREATE_BLUEPRINT,
    CREATE_SOLUTION,
    GENERATE_ROADMAP,
    SYNTHESIZE_OUTCOME,
    EXPORT_ARTIFACT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<IntentType> fromWire(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.name().equals(normalized))
                .findFirst();
    }
}

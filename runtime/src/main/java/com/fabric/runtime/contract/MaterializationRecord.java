package com.fabric.runtime.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An artifact persisted under an active contract, stored under
 * {@code tenant/{tenantId}/materialization/{recordId}}. Readable only while that contract is
 * still active and admits the reader.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MaterializationRecord {

    private String recordId;
    private String tenantId;
    private String contractId;
    private String artifactReference;
    private String representationType;
    private Instant storedAt;
}

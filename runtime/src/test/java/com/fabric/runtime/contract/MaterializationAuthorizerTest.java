package com.fabric.runtime.contract;

import com.fabric.shared.error.AuthorizationException;
import com.fabric.shared.error.NotFoundException;
import com.fabric.shared.state.InMemoryStateSurface;
import com.fabric.shared.state.StateSurface;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class MaterializationAuthorizerTest {

    final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    final Clock clock = Clock.systemUTC();

    BoundaryContractStore contracts;
    MaterializationAuthorizer authorizer;

    static final MaterializationScope U1 = MaterializationScope.builder().userId("u1").build();
    static final MaterializationScope U2 = MaterializationScope.builder().userId("u2").build();

    @BeforeEach
    void setUp() {
        StateSurface stateSurface = new InMemoryStateSurface(clock);
        contracts = new BoundaryContractStore(stateSurface, objectMapper, clock, Duration.ofDays(1));
        authorizer = new MaterializationAuthorizer(contracts, stateSurface, objectMapper, clock);
    }

    private String activeContract(String tenantId, MaterializationScope scope) {
        BoundaryContract contract = contracts.createPending(tenantId, "file-" + tenantId);
        contracts.authorize(tenantId, contract.getContractId(), scope);
        return contract.getContractId();
    }

    @Test
    @DisplayName("materialize — a pending contract cannot be materialized")
    void materialize_pendingShouldBeRefused() {
        BoundaryContract contract = contracts.createPending("t1", "file-1");

        assertThatThrownBy(() -> authorizer.materialize("t1", contract.getContractId(), "parsed"))
                .isInstanceOf(AuthorizationException.class)
                .hasMessageContaining("pending");
    }

    @Test
    @DisplayName("materialize — stores the contract's artifact under the record")
    void materialize_shouldStoreRecord() {
        String contractId = activeContract("t1", U1);

        MaterializationRecord record = authorizer.materialize("t1", contractId, "embeddings");

        assertThat(record.getArtifactReference()).isEqualTo("file-t1");
        assertThat(record.getRepresentationType()).isEqualTo("embeddings");
        assertThat(authorizer.read("t1", record.getRecordId(), U1).getContractId()).isEqualTo(contractId);
    }

    @Test
    @DisplayName("read — gated by scope, and by the contract's status at read time")
    void read_shouldRecheckContractEveryTime() {
        String contractId = activeContract("t1", U1);
        MaterializationRecord record = authorizer.materialize("t1", contractId, "parsed");

        assertThatThrownBy(() -> authorizer.read("t1", record.getRecordId(), U2))
                .isInstanceOf(AuthorizationException.class);

        contracts.revoke("t1", contractId);

        assertThatThrownBy(() -> authorizer.read("t1", record.getRecordId(), U1))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("read — another tenant's record is not found")
    void read_otherTenantShouldBeNotFound() {
        String contractId = activeContract("t1", MaterializationScope.any());
        MaterializationRecord record = authorizer.materialize("t1", contractId, "parsed");

        assertThatThrownBy(() -> authorizer.read("t2", record.getRecordId(), U1))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("list — only records whose contract currently admits the requester")
    void list_shouldFilterByAccess() {
        String mine = activeContract("t1", U1);
        String theirs = activeContract("t1", U2);
        String open = activeContract("t1", MaterializationScope.any());
        authorizer.materialize("t1", mine, "parsed");
        authorizer.materialize("t1", theirs, "parsed");
        authorizer.materialize("t1", open, "parsed");
        activeContract("t2", MaterializationScope.any());

        assertThat(authorizer.list("t1", U1))
                .extracting(MaterializationRecord::getContractId)
                .containsExactlyInAnyOrder(mine, open);

        contracts.revoke("t1", open);

        assertThat(authorizer.list("t1", U1))
                .extracting(MaterializationRecord::getContractId)
                .containsExactly(mine);
        assertThat(authorizer.list("t2", U1)).isEmpty();
    }
}

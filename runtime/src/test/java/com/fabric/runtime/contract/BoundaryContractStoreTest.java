package com.fabric.runtime.contract;

import com.fabric.shared.error.AuthorizationException;
import com.fabric.shared.error.NotFoundException;
import com.fabric.shared.error.ValidationException;
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
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class BoundaryContractStoreTest {

    static final Duration TTL = Duration.ofHours(1);

    final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    StateSurface stateSurface;
    BoundaryContractStore contracts;

    @BeforeEach
    void setUp() {
        stateSurface = new InMemoryStateSurface(clock);
        contracts = new BoundaryContractStore(stateSurface, objectMapper, clock, TTL);
    }

    private BoundaryContractStore later(Duration by) {
        return new BoundaryContractStore(stateSurface, objectMapper, Clock.offset(clock, by), TTL);
    }

    private static MaterializationScope user(String userId) {
        return MaterializationScope.builder().userId(userId).build();
    }

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("createPending — starts pending with the configured TTL")
    void createPending_shouldStartPending() {
        BoundaryContract contract = contracts.createPending("t1", "s3://bucket/file.csv");

        assertThat(contract.getStatus()).isEqualTo(ContractStatus.PENDING);
        assertThat(contract.getExpiresAt()).isEqualTo(clock.instant().plus(TTL));
        assertThat(contracts.get("t1", contract.getContractId()).getArtifactReference())
                .isEqualTo("s3://bucket/file.csv");
    }

    @Test
    @DisplayName("createPending — an artifact reference is required")
    void createPending_blankArtifactShouldFail() {
        assertThatThrownBy(() -> contracts.createPending("t1", " ")).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("authorize — pending becomes active with the given scope")
    void authorize_shouldActivate() {
        BoundaryContract contract = contracts.createPending("t1", "file-1");

        BoundaryContract active = contracts.authorize("t1", contract.getContractId(), user("u1"));

        assertThat(active.getStatus()).isEqualTo(ContractStatus.ACTIVE);
        assertThat(active.getAuthorizedAt()).isEqualTo(clock.instant());
        assertThat(contracts.get("t1", contract.getContractId()).getScope().getUserId()).isEqualTo("u1");
    }

    @Test
    @DisplayName("authorize — anything but pending is an authorization error")
    void authorize_nonPendingShouldFail() {
        BoundaryContract contract = contracts.createPending("t1", "file-1");
        contracts.authorize("t1", contract.getContractId(), user("u1"));

        assertThatThrownBy(() -> contracts.authorize("t1", contract.getContractId(), user("u2")))
                .isInstanceOf(AuthorizationException.class)
                .hasMessageContaining("active");

        contracts.revoke("t1", contract.getContractId());
        assertThatThrownBy(() -> contracts.authorize("t1", contract.getContractId(), user("u1")))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("revoke — active and pending contracts are revoked, repeating is a no-op")
    void revoke_shouldBeIdempotent() {
        BoundaryContract pending = contracts.createPending("t1", "file-1");
        BoundaryContract active = contracts.createPending("t1", "file-2");
        contracts.authorize("t1", active.getContractId(), user("u1"));

        assertThat(contracts.revoke("t1", pending.getContractId()).getStatus()).isEqualTo(ContractStatus.REVOKED);
        BoundaryContract revoked = contracts.revoke("t1", active.getContractId());
        BoundaryContract again = contracts.revoke("t1", active.getContractId());

        assertThat(revoked.getStatus()).isEqualTo(ContractStatus.REVOKED);
        assertThat(again.getRevokedAt()).isEqualTo(revoked.getRevokedAt());
    }

    @Test
    @DisplayName("revoke — an expired contract cannot be revoked")
    void revoke_expiredShouldFail() {
        BoundaryContract contract = contracts.createPending("t1", "file-1");

        assertThatThrownBy(() -> later(TTL.plusMinutes(1)).revoke("t1", contract.getContractId()))
                .isInstanceOf(AuthorizationException.class)
                .hasMessageContaining("expired");
    }

    @Test
    @DisplayName("get — a contract of another tenant is not found")
    void get_otherTenantShouldBeNotFound() {
        BoundaryContract contract = contracts.createPending("t1", "file-1");

        assertThatThrownBy(() -> contracts.get("t2", contract.getContractId()))
                .isInstanceOf(NotFoundException.class);
        assertThat(contracts.checkAccess("t2", contract.getContractId(), user("u1"))).isFalse();
    }

    // ─── checkAccess ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("checkAccess — pending is unreadable; after authorize only the scoped user passes")
    void checkAccess_shouldGateOnStatusAndScope() {
        BoundaryContract contract = contracts.createPending("t1", "file-1");
        String id = contract.getContractId();

        assertThat(contracts.checkAccess("t1", id, user("u1"))).isFalse();

        contracts.authorize("t1", id, user("u1"));

        assertThat(contracts.checkAccess("t1", id, user("u1"))).isTrue();
        assertThat(contracts.checkAccess("t1", id, user("u2"))).isFalse();
        assertThat(contracts.checkAccess("t1", id, MaterializationScope.any())).isFalse();
    }

    @Test
    @DisplayName("checkAccess — missing contract dimensions are wildcards")
    void checkAccess_missingDimensionsShouldMatchAnything() {
        BoundaryContract contract = contracts.createPending("t1", "file-1");
        contracts.authorize("t1", contract.getContractId(),
                MaterializationScope.builder().solutionId("sol-1").build());

        MaterializationScope requester = MaterializationScope.builder()
                .userId("anyone").sessionId("s9").solutionId("sol-1").build();

        assertThat(contracts.checkAccess("t1", contract.getContractId(), requester)).isTrue();
        assertThat(contracts.checkAccess("t1", contract.getContractId(),
                MaterializationScope.builder().userId("anyone").solutionId("sol-2").build())).isFalse();
    }

    @Test
    @DisplayName("checkAccess — revocation and expiry take effect on the next call")
    void checkAccess_shouldNotCacheDecisions() {
        BoundaryContract revoked = contracts.createPending("t1", "file-1");
        contracts.authorize("t1", revoked.getContractId(), user("u1"));
        BoundaryContract expiring = contracts.createPending("t1", "file-2");
        contracts.authorize("t1", expiring.getContractId(), user("u1"));

        assertThat(contracts.checkAccess("t1", revoked.getContractId(), user("u1"))).isTrue();
        contracts.revoke("t1", revoked.getContractId());

        assertThat(contracts.checkAccess("t1", revoked.getContractId(), user("u1"))).isFalse();
        assertThat(later(TTL).checkAccess("t1", expiring.getContractId(), user("u1"))).isFalse();
    }

    // ─── sweepExpired ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("sweepExpired — persists expired for live contracts past their TTL only")
    void sweepExpired_shouldExpireLiveContractsPastTtl() {
        BoundaryContract pending = contracts.createPending("t1", "file-1");
        BoundaryContract active = contracts.createPending("t2", "file-2");
        contracts.authorize("t2", active.getContractId(), user("u1"));
        BoundaryContract revoked = contracts.createPending("t1", "file-3");
        contracts.revoke("t1", revoked.getContractId());

        assertThat(contracts.sweepExpired()).isZero();
        int expired = later(TTL.plusSeconds(1)).sweepExpired();

        assertThat(expired).isEqualTo(2);
        assertThat(contracts.get("t1", pending.getContractId()).getStatus()).isEqualTo(ContractStatus.EXPIRED);
        assertThat(contracts.get("t2", active.getContractId()).getStatus()).isEqualTo(ContractStatus.EXPIRED);
        assertThat(contracts.get("t1", revoked.getContractId()).getStatus()).isEqualTo(ContractStatus.REVOKED);
    }
}

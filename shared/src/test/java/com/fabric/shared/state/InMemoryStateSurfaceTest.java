package com.fabric.shared.state;

import com.fabric.shared.error.VersionConflictException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryStateSurfaceTest {

    MutableClock clock;
    InMemoryStateSurface surface;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        surface = new InMemoryStateSurface(clock);
    }

    private static ObjectNode value(String field, String value) {
        return JsonNodeFactory.instance.objectNode().put(field, value);
    }

    // ─── set / get ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("set — bumps the version on every write, last writer wins")
    void set_shouldIncrementVersion() {
        StateKey key = StateKey.contract("t1", "c1");

        assertThat(surface.set(key, value("status", "pending"))).isEqualTo(1L);
        assertThat(surface.set(key, value("status", "active"))).isEqualTo(2L);

        StateRecord record = surface.get(key).orElseThrow();
        assertThat(record.getVersion()).isEqualTo(2L);
        assertThat(record.getValue().get("status").asText()).isEqualTo("active");
    }

    @Test
    @DisplayName("get — expired records are absent")
    void get_shouldHideExpiredRecords() {
        StateKey key = StateKey.idempotency("t1", "k1");
        surface.set(key, value("execution_id", "e1"), Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4));
        assertThat(surface.get(key)).isPresent();

        clock.advance(Duration.ofMinutes(2));
        assertThat(surface.get(key)).isEmpty();
    }

    @Test
    @DisplayName("set — stored value is isolated from later caller mutation")
    void set_shouldCopyValue() {
        StateKey key = StateKey.session("t1", "s1");
        ObjectNode node = value("a", "1");
        surface.set(key, node);

        node.put("a", "2");

        assertThat(surface.get(key).orElseThrow().getValue().get("a").asText()).isEqualTo("1");
    }

    // ─── compareAndSet ────────────────────────────────────────────────────────

    @Test
    @DisplayName("compareAndSet — expected 0 creates only if absent")
    void compareAndSet_zeroShouldCreateIfAbsent() {
        StateKey key = StateKey.idempotency("t1", "k1");

        assertThat(surface.compareAndSet(key, value("execution_id", "e1"), 0L, null)).isEqualTo(1L);

        assertThatThrownBy(() -> surface.compareAndSet(key, value("execution_id", "e2"), 0L, null))
                .isInstanceOf(VersionConflictException.class)
                .satisfies(e -> assertThat(((VersionConflictException) e).getActualVersion()).isEqualTo(1L));
        assertThat(surface.get(key).orElseThrow().getValue().get("execution_id").asText()).isEqualTo("e1");
    }

    @Test
    @DisplayName("compareAndSet — stale expected version is rejected and nothing is written")
    void compareAndSet_staleVersionShouldConflict() {
        StateKey key = StateKey.session("t1", "s1");
        surface.set(key, value("v", "1"));
        surface.set(key, value("v", "2"));

        assertThatThrownBy(() -> surface.compareAndSet(key, value("v", "3"), 1L, null))
                .isInstanceOf(VersionConflictException.class);
        assertThat(surface.compareAndSet(key, value("v", "3"), 2L, null)).isEqualTo(3L);
    }

    @Test
    @DisplayName("compareAndSet — an expired record counts as absent")
    void compareAndSet_expiredRecordCountsAsAbsent() {
        StateKey key = StateKey.idempotency("t1", "k1");
        surface.set(key, value("execution_id", "e1"), Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        long version = surface.compareAndSet(key, value("execution_id", "e2"), 0L, null);

        assertThat(version).isGreaterThan(1L);
        assertThat(surface.get(key).orElseThrow().getValue().get("execution_id").asText()).isEqualTo("e2");
    }

    // ─── query / tenants ──────────────────────────────────────────────────────

    @Test
    @DisplayName("query — never returns another tenant's records")
    void query_shouldStayInsideTenant() {
        surface.set(StateKey.execution("t1", "e1"), value("session_id", "s1").put("status", "running"));
        surface.set(StateKey.execution("t1", "e2"), value("session_id", "s1").put("status", "completed"));
        surface.set(StateKey.execution("t2", "e3"), value("session_id", "s1").put("status", "running"));

        List<StateRecord> running = surface.query("t1", StateQuery.in(StateNamespace.EXECUTION)
                .where("session_id", "s1")
                .whereAnyOf("status", List.of("pending", "running")));

        assertThat(running).extracting(r -> r.getKey().getScopeId()).containsExactly("e1");
    }

    @Test
    @DisplayName("query — primary records only unless a sub-record name is asked for")
    void query_shouldSkipSubRecordsByDefault() {
        surface.set(StateKey.execution("t1", "e1"), value("status", "running"));
        surface.set(StateKey.execution("t1", "e1").child("cancel"), JsonNodeFactory.instance.booleanNode(true));

        assertThat(surface.query("t1", StateQuery.in(StateNamespace.EXECUTION))).hasSize(1);
        assertThat(surface.query("t1", StateQuery.in(StateNamespace.EXECUTION).named("cancel"))).hasSize(1);
    }

    @Test
    @DisplayName("tenants — lists every tenant with data")
    void tenants_shouldListDistinctTenants() {
        surface.set(StateKey.contract("t1", "c1"), value("a", "b"));
        surface.set(StateKey.contract("t2", "c2"), value("a", "b"));
        surface.set(StateKey.session("t2", "s1"), value("a", "b"));

        assertThat(surface.tenants()).containsExactlyInAnyOrder("t1", "t2");
    }
}

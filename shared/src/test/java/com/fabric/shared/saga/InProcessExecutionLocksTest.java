package com.fabric.shared.saga;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class InProcessExecutionLocksTest {

    private final InProcessExecutionLocks locks = new InProcessExecutionLocks();

    @Test
    @DisplayName("tryAcquire — second acquire fails until the first lease is closed")
    void tryAcquire_shouldBeExclusive() {
        Optional<ExecutionLease> first = locks.tryAcquire("t1", "e1");

        assertThat(first).isPresent();
        assertThat(locks.tryAcquire("t1", "e1")).isEmpty();
        assertThat(locks.isLeased("t1", "e1")).isTrue();

        first.get().close();

        assertThat(locks.isLeased("t1", "e1")).isFalse();
        assertThat(locks.tryAcquire("t1", "e1")).isPresent();
    }

    @Test
    @DisplayName("tryAcquire — same execution id under another tenant is a different lock")
    void tryAcquire_shouldScopeByTenant() {
        assertThat(locks.tryAcquire("t1", "e1")).isPresent();
        assertThat(locks.tryAcquire("t2", "e1")).isPresent();
    }

    @Test
    @DisplayName("close — a stale lease cannot release or renew the next owner's lease")
    void close_staleLeaseShouldNotReleaseNewOwner() {
        ExecutionLease stale = locks.tryAcquire("t1", "e1").orElseThrow();
        stale.close();
        ExecutionLease current = locks.tryAcquire("t1", "e1").orElseThrow();

        stale.close();

        assertThat(stale.renew()).isFalse();
        assertThat(current.renew()).isTrue();
        assertThat(locks.isLeased("t1", "e1")).isTrue();
    }
}

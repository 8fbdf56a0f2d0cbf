package com.fabric.shared.capability;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;

/**
 * One named step of a saga.
 *
 * {@code idempotent} is the resume policy: a step interrupted mid-flight by a crash is
 * re-invoked once when idempotent, otherwise it is failed and the saga compensates.
 */
@Getter
@Builder
@ToString(of = {"name", "idempotent", "timeout"})
public class StepDefinition {

    @NonNull
    private final String name;

    @NonNull
    private final CapabilityHandler handler;

    /** Null when the step has nothing to undo */
    private final CompensationHandler compensation;

    private final boolean idempotent;

    /** Null falls back to saga.step-timeout-ms */
    private final Duration timeout;

    public boolean hasCompensation() {
        return compensation != null;
    }
}

package com.fabric.shared.wal;

final class WalEvents {

    private WalEvents() {
    }

    /** An event id reused under another execution is a caller bug, not a retry. */
    static void requireSameScope(WalEvent stored, WalScope scope) {
        if (!stored.getTenantId().equals(scope.getTenantId())
                || !stored.getExecutionId().equals(scope.getExecutionId())) {
            throw new IllegalStateException("Event id " + stored.getEventId()
                    + " already recorded for another execution");
        }
    }
}

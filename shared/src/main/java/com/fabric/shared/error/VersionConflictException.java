package com.fabric.shared.error;

/**
 * An optimistic write lost a race. Callers re-read and retry; nothing is merged automatically.
 */
public class VersionConflictException extends PlatformException {

    private static final long serialVersionUID = 1L;

    private final String key;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String key, long expectedVersion, long actualVersion) {
        super(ErrorCode.VERSION_CONFLICT, String.format(
                "Version conflict on %s: expected=%d, actual=%d", key, expectedVersion, actualVersion));
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getKey() {
        return key;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}

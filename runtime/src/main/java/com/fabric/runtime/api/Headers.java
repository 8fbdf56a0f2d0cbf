package com.fabric.runtime.api;

/** Caller identity headers set by the authenticating gateway. */
public final class Headers {

    public static final String TENANT = "X-Tenant-Id";
    public static final String USER = "X-User-Id";
    public static final String SESSION = "X-Session-Id";

    private Headers() {
    }
}

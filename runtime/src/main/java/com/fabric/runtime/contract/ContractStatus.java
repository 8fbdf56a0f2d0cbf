package com.fabric.runtime.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContractStatus {
    PENDING,
    ACTIVE,
    REVOKED,
    EXPIRED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContractStatus fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}

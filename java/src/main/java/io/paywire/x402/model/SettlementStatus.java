package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle of a settlement as reported by the facilitator. */
public enum SettlementStatus {
    PENDING,
    CONFIRMED,
    SETTLED,
    FAILED;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SettlementStatus fromWire(String value) {
        if (value == null) {
            return PENDING;
        }
        return valueOf(value.trim().toUpperCase());
    }
}

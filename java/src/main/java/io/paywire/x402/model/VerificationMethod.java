package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a payment proof was checked. */
public enum VerificationMethod {
    ON_CHAIN("on-chain"),
    SIGNATURE("signature"),
    FACILITATOR("facilitator"),
    CACHED("cached");

    private final String wire;

    VerificationMethod(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static VerificationMethod fromWire(String value) {
        for (VerificationMethod m : values()) {
            if (m.wire.equalsIgnoreCase(value)) {
                return m;
            }
        }
        // facilitators that report nothing more specific
        return FACILITATOR;
    }
}

package io.paywire.x402.config;

/** Where a resource server sends payment proofs for verification and settlement. */
public enum VerificationMode {
    /** An external facilitator service over HTTP. */
    FACILITATOR("facilitator"),
    /** In-process facilitator schemes reading the chain directly. */
    ON_CHAIN("on-chain");

    private final String key;

    VerificationMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /** @throws IllegalArgumentException for an unknown mode */
    public static VerificationMode fromKey(String value) {
        for (VerificationMode m : values()) {
            if (m.key.equalsIgnoreCase(value.trim()) || m.name().equalsIgnoreCase(value.trim())) {
                return m;
            }
        }
        throw new IllegalArgumentException("unknown x402 verification mode: " + value);
    }
}

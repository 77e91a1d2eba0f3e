package io.paywire.x402.scheme;

/** The capability a {@link Scheme} instance provides. */
public enum SchemeRole {
    /** Signs payment payloads. */
    CLIENT,
    /** Builds requirements and checks payload shape before forwarding. */
    SERVER,
    /** Verifies and settles payloads. */
    FACILITATOR
}

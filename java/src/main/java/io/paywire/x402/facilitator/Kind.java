package io.paywire.x402.facilitator;

import java.util.Objects;

/** Identifies a payment scheme+network pair that a facilitator supports. */
public class Kind {
    public final String scheme;    // e.g. "exact"
    public final String network;   // e.g. "eip155:84532" or "eip155:*"

    public Kind() {
        this.scheme = null;
        this.network = null;
    }

    public Kind(String scheme, String network) {
        this.scheme = scheme;
        this.network = network;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Kind)) {
            return false;
        }
        Kind k = (Kind) o;
        return Objects.equals(scheme, k.scheme) && Objects.equals(network, k.network);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, network);
    }

    @Override
    public String toString() {
        return scheme + "@" + network;
    }
}

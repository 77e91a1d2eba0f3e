package io.paywire.x402.scheme;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A CAIP-2 network identifier ({@code eip155:8453}), a namespace wildcard
 * ({@code eip155:*}) or the global wildcard ({@code *}).
 */
public final class NetworkPattern {
    private static final Pattern NAMESPACE = Pattern.compile("[-a-z0-9]{3,8}");
    private static final Pattern REFERENCE = Pattern.compile("[-_a-zA-Z0-9]{1,32}");
    private static final String WILDCARD = "*";

    private final String namespace;   // null = any namespace
    private final String reference;   // null = any reference

    private NetworkPattern(String namespace, String reference) {
        this.namespace = namespace;
        this.reference = reference;
    }

    /**
     * @throws IllegalArgumentException if {@code pattern} is not CAIP-2 or a supported wildcard
     */
    public static NetworkPattern parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("network pattern must not be empty");
        }
        String p = pattern.trim();
        if (WILDCARD.equals(p)) {
            return new NetworkPattern(null, null);
        }
        int colon = p.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("not a CAIP-2 network pattern: " + pattern);
        }
        String ns = p.substring(0, colon);
        String ref = p.substring(colon + 1);
        if (!NAMESPACE.matcher(ns).matches()) {
            throw new IllegalArgumentException("invalid CAIP-2 namespace in " + pattern);
        }
        if (WILDCARD.equals(ref)) {
            return new NetworkPattern(ns, null);
        }
        if (!REFERENCE.matcher(ref).matches()) {
            throw new IllegalArgumentException("invalid CAIP-2 reference in " + pattern);
        }
        return new NetworkPattern(ns, ref);
    }

    /** True if {@code network}, an exact CAIP-2 id, falls under this pattern. */
    public boolean matches(String network) {
        if (network == null) {
            return false;
        }
        if (namespace == null) {
            return true;
        }
        int colon = network.indexOf(':');
        if (colon < 0 || !namespace.equals(network.substring(0, colon))) {
            return false;
        }
        return reference == null || reference.equals(network.substring(colon + 1));
    }

    /** 2 for an exact id, 1 for a namespace wildcard, 0 for {@code *}. */
    public int specificity() {
        if (namespace == null) {
            return 0;
        }
        return reference == null ? 1 : 2;
    }

    public boolean isWildcard() {
        return specificity() < 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NetworkPattern)) {
            return false;
        }
        NetworkPattern other = (NetworkPattern) o;
        return Objects.equals(namespace, other.namespace) && Objects.equals(reference, other.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, reference);
    }

    @Override
    public String toString() {
        if (namespace == null) {
            return WILDCARD;
        }
        return namespace + ":" + (reference == null ? WILDCARD : reference);
    }
}

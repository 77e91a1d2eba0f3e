package io.paywire.x402.scheme;

/**
 * A pluggable payment mechanism bound to one or more networks through a
 * {@link SchemeRegistry}. Each instance implements exactly one role.
 */
public interface Scheme {
    /** Scheme identifier as it appears in {@code PaymentRequirements.scheme}, e.g. "exact". */
    String schemeId();

    SchemeRole role();
}

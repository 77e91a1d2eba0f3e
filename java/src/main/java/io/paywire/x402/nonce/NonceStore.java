package io.paywire.x402.nonce;

import java.time.Duration;

/**
 * Remembers consumed payment proofs so that each can be settled at most once.
 * Implementations must make {@link #add} a single atomic check-and-set.
 */
public interface NonceStore {

    /** True if {@code nonce} has been consumed and has not yet expired. */
    boolean has(String nonce);

    /**
     * Marks {@code nonce} consumed for {@code ttl}.
     *
     * @return true if the nonce was absent or expired, false if another caller already holds it
     */
    boolean add(String nonce, Duration ttl);

    /** Forgets {@code nonce}; used only when settlement was never attempted. */
    void release(String nonce);

    /** Drops expired entries. */
    void cleanup();
}

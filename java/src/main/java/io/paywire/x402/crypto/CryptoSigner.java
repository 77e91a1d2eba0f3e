package io.paywire.x402.crypto;

import java.util.Map;

/** Minimal abstraction for creating cryptographic proofs over a payload.
 *  Implement with web3j, Solana-J, a KMS or a remote signer, depending on your payment scheme.
 */
public interface CryptoSigner {
    /**
     * Returns a hex-encoded signature covering the given payload map.
     * Implementations must be deterministic: equal maps yield equal signatures.
     *
     * @throws CryptoSignException if the key is unavailable or signing fails
     */
    String sign(Map<String, Object> payload) throws CryptoSignException;
}

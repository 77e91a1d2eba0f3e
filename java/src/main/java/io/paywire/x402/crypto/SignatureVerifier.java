package io.paywire.x402.crypto;

import java.util.Map;

/** Counterpart of {@link CryptoSigner}: checks that {@code signer} produced {@code signature}. */
@FunctionalInterface
public interface SignatureVerifier {
    boolean verify(Map<String, Object> payload, String signature, String signer);
}

package io.paywire.x402.scheme;

import io.paywire.x402.crypto.CryptoSignException;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.ResourceInfo;

import java.util.Map;

/** Client role: turns a selected requirement into signed, scheme-specific payload data. */
public interface ClientScheme extends Scheme {

    @Override
    default SchemeRole role() {
        return SchemeRole.CLIENT;
    }

    /**
     * Produces the {@code PaymentPayload.payload} map for {@code requirements}.
     *
     * @param requirements the entry picked from the server's {@code accepts}
     * @param resource the resource being paid for, may be null
     * @return scheme-specific signed data
     * @throws CryptoSignException if signing fails
     */
    Map<String, Object> createPayload(PaymentRequirements requirements, ResourceInfo resource)
            throws CryptoSignException;
}

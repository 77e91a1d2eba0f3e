package io.paywire.x402.server.pricing;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** What a {@link PriceCalculator} may look at when quoting a request. */
public class PricingContext {
    public final String path;
    public final String method;
    public final String clientIp;
    /** Payer address, when the client has already identified itself. */
    public final String clientAddress;
    public final long bodySize;
    public final Map<String, Object> metadata;

    public PricingContext(String path, String method, String clientIp, String clientAddress,
                          long bodySize, Map<String, Object> metadata) {
        this.path = path;
        this.method = method;
        this.clientIp = clientIp;
        this.clientAddress = clientAddress;
        this.bodySize = bodySize;
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Numeric metadata entry; strings are parsed, anything else is ignored. */
    public Optional<BigDecimal> number(String key) {
        Object v = metadata.get(key);
        if (v instanceof BigDecimal) {
            return Optional.of((BigDecimal) v);
        }
        if (v instanceof Number) {
            return Optional.of(new BigDecimal(v.toString()));
        }
        if (v instanceof String) {
            try {
                return Optional.of(new BigDecimal(((String) v).trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}

package io.paywire.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HTTP 402 response body returned by an x402-enabled server.
 * {@code accepts} is ordered by server preference, most preferred first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentRequired {
    public int x402Version;
    public ResourceInfo resource;
    public List<PaymentRequirements> accepts = new ArrayList<>();
    public String error;
    public Map<String, Object> extensions;

    /** Default constructor for Jackson. */
    public PaymentRequired() {}

    public PaymentRequired(int x402Version, ResourceInfo resource, List<PaymentRequirements> accepts) {
        this.x402Version = x402Version;
        this.resource = resource;
        this.accepts = new ArrayList<>(accepts);
    }

    /**
     * A challenge is usable only when it offers at least one requirement and
     * every entry names its scheme and network.
     */
    public boolean isWellFormed() {
        if (x402Version <= 0 || accepts == null || accepts.isEmpty()) {
            return false;
        }
        for (PaymentRequirements r : accepts) {
            if (r == null || r.scheme == null || r.network == null) {
                return false;
            }
        }
        return true;
    }
}

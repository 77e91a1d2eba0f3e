package io.paywire.x402.server;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/** One way a route can be paid for; becomes one entry of {@code accepts}. */
public class AcceptOption {
    public String scheme = "exact";
    public String network;             // CAIP-2, e.g. "eip155:8453"
    public String asset;               // token contract address
    public int assetDecimals = 6;
    /** Static price in whole token units; ignored when the route has a price calculator. */
    public BigDecimal price;
    /** Defaults to the configured wallet address. */
    public String payTo;
    public int maxTimeoutSeconds;      // 0 = configured default
    public Map<String, Object> extra = new LinkedHashMap<>();

    public AcceptOption() {}

    public AcceptOption(String scheme, String network, String asset, String price) {
        this.scheme = scheme;
        this.network = network;
        this.asset = asset;
        this.price = price == null ? null : new BigDecimal(price);
    }

    public AcceptOption payTo(String payTo) {
        this.payTo = payTo;
        return this;
    }

    public AcceptOption decimals(int assetDecimals) {
        this.assetDecimals = assetDecimals;
        return this;
    }

    public AcceptOption maxTimeoutSeconds(int maxTimeoutSeconds) {
        this.maxTimeoutSeconds = maxTimeoutSeconds;
        return this;
    }

    public AcceptOption extra(String key, Object value) {
        this.extra.put(key, value);
        return this;
    }
}

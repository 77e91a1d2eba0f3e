package io.paywire.x402.server.pricing;

import java.math.BigDecimal;

/** A quoted price in whole token units, with the parts it was built from. */
public class PriceResult {
    public BigDecimal price;
    public BigDecimal basePrice;
    public BigDecimal sizePrice;
    public BigDecimal computePrice;
    public BigDecimal surgeMultiplier;
    public BigDecimal discountMultiplier;
    /** Human-readable summary, e.g. {@code Base: 0.01 | Surge: 1.5x}. */
    public String breakdown;

    public PriceResult() {}

    public PriceResult(BigDecimal price, BigDecimal basePrice, String breakdown) {
        this.price = price;
        this.basePrice = basePrice;
        this.breakdown = breakdown;
    }
}

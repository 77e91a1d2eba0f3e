package io.paywire.x402.server.pricing;

import java.math.BigDecimal;
import java.util.Objects;

public class FixedPriceCalculator implements PriceCalculator {
    private final BigDecimal price;

    public FixedPriceCalculator(BigDecimal price) {
        this.price = Objects.requireNonNull(price, "price");
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price must not be negative: " + price);
        }
    }

    public FixedPriceCalculator(String price) {
        this(new BigDecimal(price));
    }

    @Override
    public PriceResult calculate(PricingContext context) {
        return new PriceResult(price, price, "Fixed: " + price.toPlainString());
    }
}

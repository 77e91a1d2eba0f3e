package io.paywire.x402.server.pricing;

/** Quotes the price of one request. Implementations must be thread-safe. */
@FunctionalInterface
public interface PriceCalculator {
    PriceResult calculate(PricingContext context);
}

package io.paywire.x402.server.pricing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@code base + perKB * size + perSecond * computeSeconds}, then multiplied by
 * the surge and discount factors and clamped to {@code [minPrice, maxPrice]}.
 * A surge or discount function that throws is skipped.
 */
public class DynamicPriceCalculator implements PriceCalculator {
    private static final Logger log = LoggerFactory.getLogger(DynamicPriceCalculator.class);
    private static final BigDecimal KB = BigDecimal.valueOf(1024);

    /** Metadata key holding the compute time of the request, in seconds. */
    public static final String COMPUTE_SECONDS = "computeSeconds";

    private final BigDecimal base;
    private final BigDecimal perKB;
    private final BigDecimal perSecond;
    private final Function<PricingContext, BigDecimal> surge;
    private final Function<PricingContext, BigDecimal> discount;
    private final BigDecimal minPrice;
    private final BigDecimal maxPrice;

    private DynamicPriceCalculator(Builder b) {
        this.base = Objects.requireNonNull(b.base, "base");
        this.perKB = b.perKB;
        this.perSecond = b.perSecond;
        this.surge = b.surge;
        this.discount = b.discount;
        this.minPrice = b.minPrice;
        this.maxPrice = b.maxPrice;
    }

    public static Builder builder(BigDecimal base) {
        return new Builder(base);
    }

    @Override
    public PriceResult calculate(PricingContext ctx) {
        List<String> breakdown = new ArrayList<>();
        PriceResult result = new PriceResult();
        result.basePrice = base;
        BigDecimal total = base;
        breakdown.add("Base: " + base.toPlainString());

        if (perKB != null && ctx.bodySize > 0) {
            BigDecimal kb = BigDecimal.valueOf(ctx.bodySize).divide(KB, MathContext.DECIMAL64);
            result.sizePrice = kb.multiply(perKB);
            total = total.add(result.sizePrice);
            breakdown.add("Size (" + kb.stripTrailingZeros().toPlainString() + "KB): "
                    + result.sizePrice.stripTrailingZeros().toPlainString());
        }

        if (perSecond != null) {
            BigDecimal seconds = ctx.number(COMPUTE_SECONDS).orElse(null);
            if (seconds != null && seconds.signum() > 0) {
                result.computePrice = seconds.multiply(perSecond);
                total = total.add(result.computePrice);
                breakdown.add("Compute (" + seconds.toPlainString() + "s): "
                        + result.computePrice.stripTrailingZeros().toPlainString());
            }
        }

        BigDecimal s = factor("Surge", surge, ctx);
        if (s != null && s.compareTo(BigDecimal.ONE) != 0) {
            total = total.multiply(s);
            result.surgeMultiplier = s;
            breakdown.add("Surge: " + s.toPlainString() + "x");
        }

        BigDecimal d = factor("Discount", discount, ctx);
        if (d != null && d.compareTo(BigDecimal.ONE) != 0) {
            total = total.multiply(d);
            result.discountMultiplier = d;
            breakdown.add("Discount: " + d.toPlainString() + "x");
        }

        if (minPrice != null && total.compareTo(minPrice) < 0) {
            total = minPrice;
            breakdown.add("Min price applied: " + minPrice.toPlainString());
        }
        if (maxPrice != null && total.compareTo(maxPrice) > 0) {
            total = maxPrice;
            breakdown.add("Max price applied: " + maxPrice.toPlainString());
        }

        result.price = total;
        result.breakdown = String.join(" | ", breakdown);
        return result;
    }

    private static BigDecimal factor(String name, Function<PricingContext, BigDecimal> fn, PricingContext ctx) {
        if (fn == null) {
            return null;
        }
        try {
            BigDecimal v = fn.apply(ctx);
            if (v == null || v.signum() < 0) {
                log.warn("x402 {} multiplier ignored: {}", name.toLowerCase(), v);
                return null;
            }
            return v;
        } catch (RuntimeException e) {
            log.warn("x402 {} calculation failed, ignoring it: {}", name.toLowerCase(), e.toString());
            return null;
        }
    }

    public static final class Builder {
        private final BigDecimal base;
        private BigDecimal perKB;
        private BigDecimal perSecond;
        private Function<PricingContext, BigDecimal> surge;
        private Function<PricingContext, BigDecimal> discount;
        private BigDecimal minPrice;
        private BigDecimal maxPrice;

        private Builder(BigDecimal base) {
            this.base = base;
        }

        public Builder perKB(BigDecimal perKB) {
            this.perKB = perKB;
            return this;
        }

        public Builder perSecond(BigDecimal perSecond) {
            this.perSecond = perSecond;
            return this;
        }

        public Builder surge(Function<PricingContext, BigDecimal> surge) {
            this.surge = surge;
            return this;
        }

        public Builder discount(Function<PricingContext, BigDecimal> discount) {
            this.discount = discount;
            return this;
        }

        public Builder minPrice(BigDecimal minPrice) {
            this.minPrice = minPrice;
            return this;
        }

        public Builder maxPrice(BigDecimal maxPrice) {
            this.maxPrice = maxPrice;
            return this;
        }

        public DynamicPriceCalculator build() {
            if (minPrice != null && maxPrice != null && minPrice.compareTo(maxPrice) > 0) {
                throw new IllegalArgumentException("minPrice " + minPrice + " exceeds maxPrice " + maxPrice);
            }
            return new DynamicPriceCalculator(this);
        }
    }
}

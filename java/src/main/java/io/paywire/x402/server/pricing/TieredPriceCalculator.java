package io.paywire.x402.server.pricing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * Volume pricing: the first tier whose {@code maxRequests} exceeds the
 * client's request count applies. A tier without a limit catches the rest.
 */
public class TieredPriceCalculator implements PriceCalculator {

    /** Metadata key read when no request counter is supplied. */
    public static final String REQUEST_COUNT = "requestCount";

    private final List<Tier> tiers;
    private final ToLongFunction<PricingContext> requestCount;

    public TieredPriceCalculator(List<Tier> tiers) {
        this(tiers, ctx -> ctx.number(REQUEST_COUNT).map(BigDecimal::longValue).orElse(0L));
    }

    public TieredPriceCalculator(List<Tier> tiers, ToLongFunction<PricingContext> requestCount) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("at least one tier is required");
        }
        List<Tier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingLong(t -> t.maxRequests == null ? Long.MAX_VALUE : t.maxRequests));
        this.tiers = List.copyOf(sorted);
        this.requestCount = requestCount;
    }

    @Override
    public PriceResult calculate(PricingContext ctx) {
        long count = requestCount.applyAsLong(ctx);
        Tier selected = tiers.get(tiers.size() - 1);
        for (Tier t : tiers) {
            if (t.maxRequests == null || count < t.maxRequests) {
                selected = t;
                break;
            }
        }
        return new PriceResult(selected.price, selected.price,
                "Tier: " + selected.label() + " (" + selected.price.toPlainString() + "/req) | Requests: " + count);
    }

    public static class Tier {
        /** Exclusive upper bound on the request count, or null for unlimited. */
        public final Long maxRequests;
        public final BigDecimal price;
        public final String name;

        public Tier(Long maxRequests, BigDecimal price, String name) {
            this.maxRequests = maxRequests;
            this.price = price;
            this.name = name;
        }

        public Tier(Long maxRequests, String price) {
            this(maxRequests, new BigDecimal(price), null);
        }

        String label() {
            if (name != null) {
                return name;
            }
            return maxRequests == null ? "Unlimited" : "Up to " + maxRequests;
        }
    }
}

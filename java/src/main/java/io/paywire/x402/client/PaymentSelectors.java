package io.paywire.x402.client;

import io.paywire.x402.model.PaymentRequirements;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public final class PaymentSelectors {

    private PaymentSelectors() {}

    /** The server's most preferred entry. */
    public static PaymentSelector first() {
        return candidates -> candidates.stream().findFirst();
    }

    /**
     * First entry on the earliest listed network, falling back to the server's
     * preference when none of the networks is offered.
     */
    public static PaymentSelector preferNetworks(String... networks) {
        List<String> preferred = Arrays.asList(networks);
        return candidates -> {
            for (String network : preferred) {
                Optional<PaymentRequirements> hit = candidates.stream()
                        .filter(r -> network.equals(r.network))
                        .findFirst();
                if (hit.isPresent()) {
                    return hit;
                }
            }
            return candidates.stream().findFirst();
        };
    }

    /**
     * Cheapest entry by atomic amount; ties keep the server's order. Entries
     * whose amount is not an integer are never chosen.
     */
    public static PaymentSelector cheapest() {
        return candidates -> {
            PaymentRequirements best = null;
            BigInteger lowest = null;
            for (PaymentRequirements r : candidates) {
                BigInteger amount = atomic(r.amount);
                if (amount != null && (lowest == null || amount.compareTo(lowest) < 0)) {
                    best = r;
                    lowest = amount;
                }
            }
            return Optional.ofNullable(best);
        };
    }

    static BigInteger atomic(String amount) {
        if (amount == null) {
            return null;
        }
        try {
            return new BigInteger(amount);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

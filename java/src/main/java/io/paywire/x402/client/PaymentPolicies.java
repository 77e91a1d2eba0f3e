package io.paywire.x402.client;

import java.math.BigInteger;
import java.util.Set;
import java.util.stream.Collectors;

public final class PaymentPolicies {

    private PaymentPolicies() {}

    /** Drops entries asking for more than {@code max} atomic units, or with an unreadable amount. */
    public static PaymentPolicy maxAmount(BigInteger max) {
        return candidates -> candidates.stream()
                .filter(r -> {
                    if (r.amount == null) {
                        return false;
                    }
                    try {
                        return new BigInteger(r.amount).compareTo(max) <= 0;
                    } catch (NumberFormatException e) {
                        return false;
                    }
                })
                .collect(Collectors.toList());
    }

    /** Keeps only entries paying in one of {@code assets} (compared case-insensitively). */
    public static PaymentPolicy assets(Set<String> assets) {
        Set<String> lower = assets.stream().map(String::toLowerCase).collect(Collectors.toSet());
        return candidates -> candidates.stream()
                .filter(r -> r.asset != null && lower.contains(r.asset.toLowerCase()))
                .collect(Collectors.toList());
    }
}

package io.paywire.x402.client;

import io.paywire.x402.model.PaymentRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Restricts payments to approved hosts. A host is approved by exact name or
 * by a {@code *.example.com} wildcard covering its parent domains, optionally
 * with its own cap in atomic units. Unknown hosts are paid only when
 * {@code allowUnknown} is set.
 */
public class ServiceAllowlist implements PaymentPolicy {
    private static final Logger log = LoggerFactory.getLogger(ServiceAllowlist.class);

    private final Map<String, Approval> approved = new ConcurrentHashMap<>();
    private final boolean allowUnknown;

    public ServiceAllowlist(boolean allowUnknown) {
        this.allowUnknown = allowUnknown;
    }

    public ServiceAllowlist approve(String host) {
        return approve(host, null);
    }

    /** @param maxAmount cap for this host in atomic units, or null for none */
    public ServiceAllowlist approve(String host, BigInteger maxAmount) {
        approved.put(host.toLowerCase(Locale.ROOT), new Approval(maxAmount));
        log.info("x402 approved service {}{}", host, maxAmount != null ? " up to " + maxAmount : "");
        return this;
    }

    public boolean remove(String host) {
        return approved.remove(host.toLowerCase(Locale.ROOT)) != null;
    }

    public boolean isApproved(URI resource) {
        return lookup(resource).isPresent();
    }

    /** Without a resource every host is unknown. */
    @Override
    public List<PaymentRequirements> apply(List<PaymentRequirements> candidates) {
        return allowUnknown ? candidates : Collections.emptyList();
    }

    @Override
    public List<PaymentRequirements> apply(List<PaymentRequirements> candidates, URI resource) {
        Optional<Approval> approval = lookup(resource);
        if (approval.isEmpty()) {
            if (!allowUnknown) {
                log.warn("x402 refusing to pay unapproved service {}", resource);
                return Collections.emptyList();
            }
            return candidates;
        }
        BigInteger cap = approval.get().maxAmount;
        if (cap == null) {
            return candidates;
        }
        List<PaymentRequirements> kept = new ArrayList<>();
        for (PaymentRequirements r : candidates) {
            BigInteger amount = PaymentSelectors.atomic(r.amount);
            if (amount != null && amount.compareTo(cap) <= 0) {
                kept.add(r);
            }
        }
        return kept;
    }

    private Optional<Approval> lookup(URI resource) {
        if (resource == null || resource.getHost() == null) {
            return Optional.empty();
        }
        String host = resource.getHost().toLowerCase(Locale.ROOT);
        Approval exact = approved.get(host);
        if (exact != null) {
            return Optional.of(exact);
        }
        String[] labels = host.split("\\.");
        for (int i = 1; i < labels.length; i++) {
            Approval wildcard = approved.get("*." + String.join(".", Arrays.copyOfRange(labels, i, labels.length)));
            if (wildcard != null) {
                return Optional.of(wildcard);
            }
        }
        return Optional.empty();
    }

    private static final class Approval {
        final BigInteger maxAmount;

        Approval(BigInteger maxAmount) {
            this.maxAmount = maxAmount;
        }
    }
}

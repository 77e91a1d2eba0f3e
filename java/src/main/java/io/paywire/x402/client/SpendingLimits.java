package io.paywire.x402.client;

import io.paywire.x402.model.PaymentRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Caps what the client pays: per payment and per UTC day, in atomic units
 * of each asset. Entries with an unreadable amount are dropped. The daily
 * total resets when the UTC date changes.
 */
public class SpendingLimits implements PaymentPolicy {
    private static final Logger log = LoggerFactory.getLogger(SpendingLimits.class);

    private final BigInteger maxSingle;
    private final BigInteger maxDaily;
    private final BigInteger largePayment;
    private final Clock clock;

    private LocalDate day;
    private final Map<String, BigInteger> spent = new HashMap<>();
    private final Map<String, Integer> counts = new HashMap<>();

    public SpendingLimits(BigInteger maxSingle, BigInteger maxDaily) {
        this(maxSingle, maxDaily, null, Clock.systemUTC());
    }

    /**
     * @param largePayment payments of at least this amount are logged at warn; null to disable
     * @throws IllegalArgumentException if a limit is not positive
     */
    public SpendingLimits(BigInteger maxSingle, BigInteger maxDaily, BigInteger largePayment, Clock clock) {
        if (maxSingle.signum() <= 0 || maxDaily.signum() <= 0) {
            throw new IllegalArgumentException("spending limits must be positive");
        }
        if (largePayment != null && largePayment.signum() <= 0) {
            throw new IllegalArgumentException("largePayment must be positive");
        }
        this.maxSingle = maxSingle;
        this.maxDaily = maxDaily;
        this.largePayment = largePayment;
        this.clock = Objects.requireNonNull(clock);
        this.day = today();
    }

    @Override
    public synchronized List<PaymentRequirements> apply(List<PaymentRequirements> candidates) {
        rollover();
        List<PaymentRequirements> kept = new ArrayList<>();
        for (PaymentRequirements r : candidates) {
            BigInteger amount = PaymentSelectors.atomic(r.amount);
            if (amount == null || amount.compareTo(maxSingle) > 0) {
                log.debug("x402 {} {} exceeds the single payment limit {}", r.amount, r.asset, maxSingle);
                continue;
            }
            BigInteger projected = spent.getOrDefault(key(r.asset), BigInteger.ZERO).add(amount);
            if (projected.compareTo(maxDaily) > 0) {
                log.warn("x402 {} {} would exceed the daily limit {} ({} spent today)", r.amount, r.asset,
                        maxDaily, projected.subtract(amount));
                continue;
            }
            kept.add(r);
        }
        return kept;
    }

    @Override
    public synchronized void paid(PaymentRequirements paid, URI resource) {
        BigInteger amount = PaymentSelectors.atomic(paid.amount);
        if (amount == null) {
            return;
        }
        rollover();
        spent.merge(key(paid.asset), amount, BigInteger::add);
        counts.merge(key(paid.asset), 1, Integer::sum);
        if (largePayment != null && amount.compareTo(largePayment) >= 0) {
            log.warn("x402 large payment of {} {} to {} for {}", paid.amount, paid.asset, paid.payTo, resource);
        }
    }

    /** What has been spent in {@code asset} since the start of the current UTC day. */
    public synchronized DailySpending today(String asset) {
        rollover();
        BigInteger total = spent.getOrDefault(key(asset), BigInteger.ZERO);
        return new DailySpending(day, total, maxDaily.subtract(total).max(BigInteger.ZERO),
                counts.getOrDefault(key(asset), 0));
    }

    private void rollover() {
        LocalDate now = today();
        if (!now.equals(day)) {
            log.debug("x402 new day {}, resetting daily spending", now);
            day = now;
            spent.clear();
            counts.clear();
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static String key(String asset) {
        return asset == null ? "" : asset.toLowerCase(Locale.ROOT);
    }

    /** Snapshot of one asset's spending for one day. */
    public static class DailySpending {
        public final LocalDate date;
        public final BigInteger total;
        public final BigInteger remaining;
        public final int count;

        DailySpending(LocalDate date, BigInteger total, BigInteger remaining, int count) {
            this.date = date;
            this.total = total;
            this.remaining = remaining;
            this.count = count;
        }
    }
}

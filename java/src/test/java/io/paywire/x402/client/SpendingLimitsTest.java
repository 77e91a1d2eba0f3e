package io.paywire.x402.client;

import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.testing.Fixtures;
import io.paywire.x402.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpendingLimitsTest {

    private static final URI RESOURCE = URI.create("https://api.example.com/report");

    private final MutableClock clock = new MutableClock(Fixtures.NOW);
    private final SpendingLimits limits = new SpendingLimits(BigInteger.valueOf(1_000), BigInteger.valueOf(2_500),
            BigInteger.valueOf(900), clock);

    private static PaymentRequirements usdc(String amount) {
        return Fixtures.baseRequirement(amount);
    }

    @Test
    void singlePaymentCapDropsLargerEntries() {
        PaymentRequirements small = usdc("1000");
        PaymentRequirements large = usdc("1001");
        PaymentRequirements garbled = usdc("1e3");

        assertEquals(List.of(small), limits.apply(List.of(large, small, garbled)));
    }

    @Test
    void dailyTotalIsPerAssetAndCaseInsensitive() {
        limits.paid(usdc("1000"), RESOURCE);
        limits.paid(usdc("1000"), RESOURCE);

        assertTrue(limits.apply(List.of(usdc("600"))).isEmpty());
        assertEquals(1, limits.apply(List.of(usdc("500"))).size());

        PaymentRequirements other = new PaymentRequirements("exact", Fixtures.BASE, "0xdai", "1000",
                Fixtures.MERCHANT, 300);
        assertEquals(1, limits.apply(List.of(other)).size());

        SpendingLimits.DailySpending today = limits.today(Fixtures.USDC_BASE.toUpperCase());
        assertEquals(LocalDate.of(2026, 3, 1), today.date);
        assertEquals(BigInteger.valueOf(2_000), today.total);
        assertEquals(BigInteger.valueOf(500), today.remaining);
        assertEquals(2, today.count);
    }

    @Test
    void totalsResetAtUtcMidnight() {
        limits.paid(usdc("1000"), RESOURCE);
        limits.paid(usdc("1000"), RESOURCE);
        clock.advance(Duration.ofHours(12));

        SpendingLimits.DailySpending today = limits.today(Fixtures.USDC_BASE);
        assertEquals(LocalDate.of(2026, 3, 2), today.date);
        assertEquals(BigInteger.ZERO, today.total);
        assertEquals(0, today.count);
        assertEquals(1, limits.apply(List.of(usdc("1000"))).size());
    }

    @Test
    void limitsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SpendingLimits(BigInteger.ZERO, BigInteger.TEN));
        assertThrows(IllegalArgumentException.class,
                () -> new SpendingLimits(BigInteger.TEN, BigInteger.TEN, BigInteger.valueOf(-1), clock));
    }
}

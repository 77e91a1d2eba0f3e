package io.paywire.x402.testing;

import io.paywire.x402.model.PaymentRequirements;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public final class Fixtures {
    public static final String PAYER = "0x1111111111111111111111111111111111111111";
    public static final String MERCHANT = "0x2222222222222222222222222222222222222222";
    public static final String USDC_BASE = "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913";
    public static final String BASE = "eip155:8453";
    public static final String SOLANA = "solana:5eykt4UsFv8P8NJdTREpY1vzqKqZKvdp";
    public static final String USDC_SOLANA = "EPjFWdd5AufqSNqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private Fixtures() {}

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static PaymentRequirements baseRequirement(String amount) {
        return new PaymentRequirements("exact", BASE, USDC_BASE, amount, MERCHANT, 300);
    }
}

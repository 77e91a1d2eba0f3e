package io.paywire.x402.server.pricing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/** Conversions between whole token units and the integer units tokens are transferred in. */
public final class AtomicAmounts {

    private AtomicAmounts() {}

    /**
     * {@code price * 10^decimals}, rounded down.
     *
     * @throws IllegalArgumentException for a negative price
     */
    public static String toAtomic(BigDecimal price, int decimals) {
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price must not be negative: " + price);
        }
        return price.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toPlainString();
    }

    public static BigDecimal fromAtomic(String amount, int decimals) {
        return new BigDecimal(new BigInteger(amount), decimals);
    }
}

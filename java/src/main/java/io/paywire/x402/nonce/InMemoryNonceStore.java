package io.paywire.x402.nonce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link NonceStore}. Entries expire after their TTL and are
 * treated as absent from then on. Suitable for a single server instance only.
 */
public class InMemoryNonceStore implements NonceStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryNonceStore.class);

    private final ConcurrentMap<String, Instant> expiries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;

    public InMemoryNonceStore() {
        this(Clock.systemUTC(), Duration.ofHours(1));
    }

    public InMemoryNonceStore(Clock clock, Duration defaultTtl) {
        this.clock = Objects.requireNonNull(clock);
        this.defaultTtl = Objects.requireNonNull(defaultTtl);
    }

    @Override
    public boolean has(String nonce) {
        Instant expiry = expiries.get(nonce);
        if (expiry == null) {
            return false;
        }
        if (!expiry.isAfter(clock.instant())) {
            expiries.remove(nonce, expiry);
            return false;
        }
        return true;
    }

    @Override
    public boolean add(String nonce, Duration ttl) {
        Objects.requireNonNull(nonce, "nonce");
        Instant now = clock.instant();
        Instant expiry = now.plus(ttl == null || ttl.isNegative() || ttl.isZero() ? defaultTtl : ttl);
        boolean[] added = new boolean[1];
        expiries.compute(nonce, (k, current) -> {
            if (current != null && current.isAfter(now)) {
                return current;
            }
            added[0] = true;
            return expiry;
        });
        return added[0];
    }

    @Override
    public void release(String nonce) {
        expiries.remove(nonce);
    }

    @Override
    public void cleanup() {
        Instant now = clock.instant();
        int before = expiries.size();
        expiries.entrySet().removeIf(e -> !e.getValue().isAfter(now));
        int removed = before - expiries.size();
        if (removed > 0) {
            log.debug("x402 nonce cleanup removed {} expired entries", removed);
        }
    }

    /** Number of tracked entries, expired ones included until cleaned up. */
    public int size() {
        return expiries.size();
    }
}

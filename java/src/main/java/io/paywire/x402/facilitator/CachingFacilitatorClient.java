package io.paywire.x402.facilitator;

import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.SettlementResult;
import io.paywire.x402.model.VerificationMethod;
import io.paywire.x402.model.VerificationResult;
import io.paywire.x402.util.Hashes;
import io.paywire.x402.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Remembers successful verifications for {@code ttl} so that a repeated
 * check of the same payload against the same requirements skips the
 * delegate. Hits come back with method {@link VerificationMethod#CACHED}.
 * Rejections are never cached. Settling a payload evicts its entry.
 */
public class CachingFacilitatorClient implements FacilitatorClient {
    private static final Logger log = LoggerFactory.getLogger(CachingFacilitatorClient.class);

    private final FacilitatorClient delegate;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Entry> cache = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public CachingFacilitatorClient(FacilitatorClient delegate, Duration ttl) {
        this(delegate, ttl, Clock.systemUTC());
    }

    public CachingFacilitatorClient(FacilitatorClient delegate, Duration ttl, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive: " + ttl);
        }
        this.delegate = Objects.requireNonNull(delegate);
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public VerificationResult verify(PaymentPayload paymentPayload, PaymentRequirements req)
            throws IOException, InterruptedException {
        String key = key(paymentPayload, req);
        Instant now = clock.instant();
        Entry entry = cache.get(key);
        if (entry != null) {
            if (now.isBefore(entry.expiresAt)) {
                hits.incrementAndGet();
                log.debug("x402 verification cache hit for {}", key);
                return cached(entry.result);
            }
            cache.remove(key, entry);
        }
        misses.incrementAndGet();
        VerificationResult result = delegate.verify(paymentPayload, req);
        if (result.valid) {
            cache.put(key, new Entry(result, now.plus(ttl)));
        }
        return result;
    }

    @Override
    public SettlementResult settle(PaymentPayload paymentPayload, PaymentRequirements req)
            throws IOException, InterruptedException {
        cache.remove(key(paymentPayload, req));
        return delegate.settle(paymentPayload, req);
    }

    @Override
    public Set<Kind> supported() throws IOException, InterruptedException {
        return delegate.supported();
    }

    /** Number of entries, expired ones included until they are next looked up. */
    public int size() {
        return cache.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public void clear() {
        cache.clear();
    }

    private static String key(PaymentPayload payload, PaymentRequirements req) {
        return req.scheme + ":" + req.network + ":"
                + Hashes.sha256Hex(Json.canonicalString(payload) + "\n" + Json.canonicalString(req));
    }

    private static VerificationResult cached(VerificationResult original) {
        VerificationResult r = new VerificationResult();
        r.valid = original.valid;
        r.method = VerificationMethod.CACHED;
        r.paidAmount = original.paidAmount;
        r.payer = original.payer;
        r.txHash = original.txHash;
        r.blockNumber = original.blockNumber;
        r.timestamp = original.timestamp;
        r.error = original.error;
        r.isReplay = original.isReplay;
        r.intentTrace = original.intentTrace;
        return r;
    }

    private static final class Entry {
        final VerificationResult result;
        final Instant expiresAt;

        Entry(VerificationResult result, Instant expiresAt) {
            this.result = result;
            this.expiresAt = expiresAt;
        }
    }
}

package io.paywire.x402.server.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.paywire.x402.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * In-memory payment log with revenue queries. Holds at most
 * {@code capacity} records and drops the oldest beyond that. Revenue is
 * reported per asset in atomic units; amounts that are not integers are
 * left out of the sums.
 */
public class PaymentAnalytics implements PaymentListener {
    private static final Logger log = LoggerFactory.getLogger(PaymentAnalytics.class);

    static final String CSV_HEADER = "id,txHash,network,asset,amount,payer,resource,method,timestamp";

    private final int capacity;
    private final Deque<PaymentRecord> records = new ArrayDeque<>();

    public PaymentAnalytics() {
        this(10_000);
    }

    public PaymentAnalytics(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void onPayment(PaymentRecord record) {
        if (records.size() == capacity) {
            records.removeFirst();
        }
        records.addLast(record);
        log.debug("x402 recorded payment {}: {} {} for {}", record.id, record.amount, record.asset, record.resource);
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized void clear() {
        records.clear();
    }

    /** Newest first. */
    public synchronized List<PaymentRecord> recent(int limit) {
        List<PaymentRecord> out = new ArrayList<>();
        Iterator<PaymentRecord> it = records.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized RevenueSummary revenueSummary(String asset) {
        BigInteger total = BigInteger.ZERO;
        int count = 0;
        Set<String> payers = new HashSet<>();
        for (PaymentRecord r : forAsset(asset)) {
            BigInteger amount = amount(r);
            if (amount == null) {
                continue;
            }
            total = total.add(amount);
            count++;
            if (r.payer != null) {
                payers.add(r.payer.toLowerCase(Locale.ROOT));
            }
        }
        BigInteger average = count == 0 ? BigInteger.ZERO : total.divide(BigInteger.valueOf(count));
        return new RevenueSummary(asset, total, count, average, payers.size());
    }

    /** Revenue per request path, largest first. */
    public synchronized List<EndpointRevenue> revenueByEndpoint(String asset) {
        Map<String, BigInteger> totals = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        BigInteger grand = BigInteger.ZERO;
        for (PaymentRecord r : forAsset(asset)) {
            BigInteger amount = amount(r);
            if (amount == null) {
                continue;
            }
            totals.merge(r.resource, amount, BigInteger::add);
            counts.merge(r.resource, 1, Integer::sum);
            grand = grand.add(amount);
        }
        List<EndpointRevenue> out = new ArrayList<>();
        for (Map.Entry<String, BigInteger> e : totals.entrySet()) {
            double share = grand.signum() == 0 ? 0
                    : new BigDecimal(e.getValue()).multiply(BigDecimal.valueOf(100))
                            .divide(new BigDecimal(grand), MathContext.DECIMAL64).doubleValue();
            out.add(new EndpointRevenue(e.getKey(), e.getValue(), counts.get(e.getKey()), share));
        }
        out.sort(Comparator.comparing((EndpointRevenue r) -> r.total).reversed());
        return out;
    }

    /** Payers by total paid in {@code asset}, largest first. Addresses compare case-insensitively. */
    public synchronized List<PayerTotal> topPayers(String asset, int limit) {
        Map<String, BigInteger> totals = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PaymentRecord r : forAsset(asset)) {
            BigInteger amount = amount(r);
            if (amount == null || r.payer == null) {
                continue;
            }
            String payer = r.payer.toLowerCase(Locale.ROOT);
            totals.merge(payer, amount, BigInteger::add);
            counts.merge(payer, 1, Integer::sum);
        }
        List<PayerTotal> out = new ArrayList<>();
        for (Map.Entry<String, BigInteger> e : totals.entrySet()) {
            out.add(new PayerTotal(e.getKey(), e.getValue(), counts.get(e.getKey())));
        }
        out.sort(Comparator.comparing((PayerTotal p) -> p.total).reversed());
        return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    /** All records, oldest first, as CSV with a header row. */
    public synchronized String exportCsv() {
        StringBuilder csv = new StringBuilder(CSV_HEADER);
        for (PaymentRecord r : records) {
            csv.append('\n')
                    .append(csvValue(r.id)).append(',')
                    .append(csvValue(r.txHash)).append(',')
                    .append(csvValue(r.network)).append(',')
                    .append(csvValue(r.asset)).append(',')
                    .append(csvValue(r.amount)).append(',')
                    .append(csvValue(r.payer)).append(',')
                    .append(csvValue(r.resource)).append(',')
                    .append(csvValue(r.method)).append(',')
                    .append(Instant.ofEpochMilli(r.timestamp));
        }
        return csv.toString();
    }

    /** All records, oldest first, as a JSON array. */
    public synchronized String exportJson() {
        try {
            return Json.MAPPER.writeValueAsString(new ArrayList<>(records));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode payment records", e);
        }
    }

    private List<PaymentRecord> forAsset(String asset) {
        List<PaymentRecord> out = new ArrayList<>();
        for (PaymentRecord r : records) {
            if (r.asset != null && r.asset.equalsIgnoreCase(asset)) {
                out.add(r);
            }
        }
        return out;
    }

    private static BigInteger amount(PaymentRecord r) {
        if (r.amount == null) {
            return null;
        }
        try {
            return new BigInteger(r.amount);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String csvValue(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    public static class RevenueSummary {
        public final String asset;
        public final BigInteger total;
        public final int count;
        /** Rounded down. */
        public final BigInteger average;
        public final int uniquePayers;

        RevenueSummary(String asset, BigInteger total, int count, BigInteger average, int uniquePayers) {
            this.asset = asset;
            this.total = total;
            this.count = count;
            this.average = average;
            this.uniquePayers = uniquePayers;
        }
    }

    public static class EndpointRevenue {
        public final String resource;
        public final BigInteger total;
        public final int count;
        public final double percentage;

        EndpointRevenue(String resource, BigInteger total, int count, double percentage) {
            this.resource = resource;
            this.total = total;
            this.count = count;
            this.percentage = percentage;
        }
    }

    public static class PayerTotal {
        public final String payer;
        public final BigInteger total;
        public final int count;

        PayerTotal(String payer, BigInteger total, int count) {
            this.payer = payer;
            this.total = total;
            this.count = count;
        }
    }
}

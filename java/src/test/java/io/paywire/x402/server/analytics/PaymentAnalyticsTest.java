package io.paywire.x402.server.analytics;

import io.paywire.x402.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaymentAnalyticsTest {

    private static final String USDC = Fixtures.USDC_BASE;
    private static final String ALICE = "0xAAAA000000000000000000000000000000000001";
    private static final String BOB = "0xbbbb000000000000000000000000000000000002";

    private final PaymentAnalytics analytics = new PaymentAnalytics();

    private static PaymentRecord paid(String amount, String payer, String resource, long at) {
        return new PaymentRecord("0xtx" + at, Fixtures.BASE, USDC, amount, payer, resource, "GET", at);
    }

    private void recordSample() {
        analytics.onPayment(paid("300", ALICE, "/api/joke", 1));
        analytics.onPayment(paid("100", ALICE.toLowerCase(), "/api/joke", 2));
        analytics.onPayment(paid("600", BOB, "/api/summary", 3));
        analytics.onPayment(paid("not-a-number", BOB, "/api/summary", 4));
    }

    @Test
    void summaryIsPerAsset() {
        recordSample();
        analytics.onPayment(new PaymentRecord("0xsol", Fixtures.SOLANA, Fixtures.USDC_SOLANA, "999", BOB,
                "/api/joke", "GET", 5));

        PaymentAnalytics.RevenueSummary s = analytics.revenueSummary(USDC.toLowerCase());
        assertEquals(BigInteger.valueOf(1000), s.total);
        assertEquals(3, s.count);
        assertEquals(BigInteger.valueOf(333), s.average);
        assertEquals(2, s.uniquePayers);
    }

    @Test
    void endpointsAreSortedByRevenue() {
        recordSample();

        List<PaymentAnalytics.EndpointRevenue> byEndpoint = analytics.revenueByEndpoint(USDC);
        assertEquals("/api/summary", byEndpoint.get(0).resource);
        assertEquals(60.0, byEndpoint.get(0).percentage, 1e-9);
        assertEquals("/api/joke", byEndpoint.get(1).resource);
        assertEquals(BigInteger.valueOf(400), byEndpoint.get(1).total);
        assertEquals(2, byEndpoint.get(1).count);
    }

    @Test
    void topPayersMergeAddressCase() {
        recordSample();

        List<PaymentAnalytics.PayerTotal> top = analytics.topPayers(USDC, 1);
        assertEquals(1, top.size());
        assertEquals(BOB, top.get(0).payer);
        assertEquals(BigInteger.valueOf(600), analytics.topPayers(USDC, 5).get(0).total);
        assertEquals(BigInteger.valueOf(400), analytics.topPayers(USDC, 5).get(1).total);
    }

    @Test
    void capacityDropsOldestRecords() {
        PaymentAnalytics small = new PaymentAnalytics(2);
        small.onPayment(paid("1", ALICE, "/a", 1));
        small.onPayment(paid("2", ALICE, "/b", 2));
        small.onPayment(paid("3", ALICE, "/c", 3));

        assertEquals(2, small.size());
        List<PaymentRecord> recent = small.recent(10);
        assertEquals("/c", recent.get(0).resource);
        assertEquals("/b", recent.get(1).resource);
    }

    @Test
    void csvEscapesAndFormatsTimestamps() {
        analytics.onPayment(paid("5", ALICE, "/search?q=a,b", 0));

        String[] lines = analytics.exportCsv().split("\n");
        assertEquals(PaymentAnalytics.CSV_HEADER, lines[0]);
        assertTrue(lines[1].endsWith(",\"/search?q=a,b\",GET,1970-01-01T00:00:00Z"), lines[1]);
        assertEquals("\"say \"\"hi\"\"\"", PaymentAnalytics.csvValue("say \"hi\""));
        assertEquals("", PaymentAnalytics.csvValue(null));
    }

    @Test
    void jsonExportListsEveryRecord() {
        recordSample();
        String json = analytics.exportJson();
        assertTrue(json.startsWith("[{"), json);
        assertTrue(json.contains("\"id\":\"pay_"), json);
        assertTrue(json.contains("\"resource\":\"/api/summary\""), json);
    }
}

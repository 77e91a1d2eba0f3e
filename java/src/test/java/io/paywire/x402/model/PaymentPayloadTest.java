package io.paywire.x402.model;

import io.paywire.x402.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PaymentPayloadTest {

    private static PaymentPayload sample() {
        PaymentRequirements req = Fixtures.baseRequirement("10000");
        req.extra.put("name", "USDC");
        return new PaymentPayload(2, new ResourceInfo("https://api.example.com/data", "data", "application/json"),
                req, Map.of("signature", "0xabc"));
    }

    @Test
    void headerCarriesTheSameRequirement() {
        PaymentPayload p = sample();
        PaymentPayload decoded = PaymentPayload.fromHeader(p.toHeader());

        assertEquals(2, decoded.x402Version);
        assertTrue(decoded.accepted.sameAs(p.accepted));
        assertEquals("0xabc", decoded.payload.get("signature"));
        assertEquals("https://api.example.com/data", decoded.resource.url);
    }

    @Test
    void rawJsonHeaderIsAccepted() {
        String json = "{\"x402Version\":2,"
                + "\"accepted\":{\"scheme\":\"exact\",\"network\":\"eip155:8453\",\"amount\":\"1\"},"
                + "\"payload\":{\"signature\":\"0x1\"}}";
        PaymentPayload p = PaymentPayload.fromHeader(json);
        assertEquals("exact", p.accepted.scheme);
    }

    @Test
    void rejectsMissingMembers() {
        assertThrows(IllegalArgumentException.class, () -> PaymentPayload.fromHeader(encode(
                "{\"accepted\":{\"scheme\":\"exact\",\"network\":\"eip155:8453\"},\"payload\":{\"a\":1}}")));
        assertThrows(IllegalArgumentException.class, () -> PaymentPayload.fromHeader(encode(
                "{\"x402Version\":2,\"payload\":{\"a\":1}}")));
        assertThrows(IllegalArgumentException.class, () -> PaymentPayload.fromHeader(encode(
                "{\"x402Version\":2,\"accepted\":{\"scheme\":\"exact\",\"network\":\"eip155:8453\"},\"payload\":{}}")));
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> PaymentPayload.fromHeader("not base64 !!"));
        assertThrows(IllegalArgumentException.class, () -> PaymentPayload.fromHeader(encode("[1,2]")));
        assertThrows(IllegalArgumentException.class, () -> PaymentPayload.fromHeader(encode("null")));
        assertThrows(IllegalArgumentException.class, () -> PaymentPayload.fromHeader(""));
    }

    @Test
    void sameAsDetectsAnyAlteredField() {
        PaymentRequirements offered = Fixtures.baseRequirement("10000");
        offered.extra.put("version", "2");

        PaymentRequirements cheaper = offered.copy();
        cheaper.amount = "9999";
        assertFalse(offered.sameAs(cheaper));

        PaymentRequirements extraChanged = offered.copy();
        extraChanged.extra.put("version", "3");
        assertFalse(offered.sameAs(extraChanged));

        assertTrue(offered.sameAs(offered.copy()));
        assertFalse(offered.sameAs(null));
    }

    @Test
    void sameAsIgnoresNumericBoxingAndKeyOrder() {
        PaymentRequirements a = Fixtures.baseRequirement("1");
        a.extra.put("decimals", 6);
        a.extra.put("name", "USDC");
        PaymentRequirements b = Fixtures.baseRequirement("1");
        b.extra.put("name", "USDC");
        b.extra.put("decimals", 6L);

        assertTrue(a.sameAs(b));
    }

    @Test
    void copyIsDeep() {
        PaymentRequirements a = Fixtures.baseRequirement("1");
        a.extra.put("name", "USDC");
        PaymentRequirements b = a.copy();
        b.extra.put("name", "EURC");
        assertEquals("USDC", a.extra.get("name"));
    }

    private static String encode(String json) {
        return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}

package io.paywire.x402.client;

import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServiceAllowlistTest {

    private final PaymentRequirements cheap = Fixtures.baseRequirement("100");
    private final PaymentRequirements dear = Fixtures.baseRequirement("5000");
    private final List<PaymentRequirements> offers = List.of(cheap, dear);

    @Test
    void strictListPaysOnlyApprovedHosts() {
        ServiceAllowlist list = new ServiceAllowlist(false).approve("API.example.com");

        assertEquals(offers, list.apply(offers, URI.create("https://api.example.com/v1/report")));
        assertTrue(list.apply(offers, URI.create("https://evil.example.net/v1/report")).isEmpty());
        assertTrue(list.apply(offers, null).isEmpty());
        assertTrue(list.apply(offers).isEmpty());
    }

    @Test
    void wildcardCoversSubdomainsButNotTheApex() {
        ServiceAllowlist list = new ServiceAllowlist(false).approve("*.example.com");

        assertTrue(list.isApproved(URI.create("https://a.b.example.com/x")));
        assertFalse(list.isApproved(URI.create("https://example.com/x")));
    }

    @Test
    void perHostCapFiltersEntries() {
        ServiceAllowlist list = new ServiceAllowlist(true).approve("api.example.com", BigInteger.valueOf(1000));

        assertEquals(List.of(cheap), list.apply(offers, URI.create("https://api.example.com/x")));
        assertEquals(offers, list.apply(offers, URI.create("https://other.example.org/x")));
    }

    @Test
    void removedHostIsUnknownAgain() {
        ServiceAllowlist list = new ServiceAllowlist(false).approve("api.example.com");

        assertTrue(list.remove("api.example.com"));
        assertFalse(list.remove("api.example.com"));
        assertFalse(list.isApproved(URI.create("https://api.example.com/x")));
    }
}

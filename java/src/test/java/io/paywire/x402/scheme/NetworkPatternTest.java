package io.paywire.x402.scheme;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NetworkPatternTest {

    @Test
    void exactIdMatchesOnlyItself() {
        NetworkPattern p = NetworkPattern.parse("eip155:8453");
        assertTrue(p.matches("eip155:8453"));
        assertFalse(p.matches("eip155:84532"));
        assertFalse(p.matches("solana:8453"));
        assertEquals(2, p.specificity());
        assertFalse(p.isWildcard());
    }

    @Test
    void namespaceWildcardMatchesAnyReference() {
        NetworkPattern p = NetworkPattern.parse("eip155:*");
        assertTrue(p.matches("eip155:1"));
        assertTrue(p.matches("eip155:42161"));
        assertFalse(p.matches("solana:5eykt4UsFv8P8NJdTREpY1vzqKqZKvdp"));
        assertFalse(p.matches("eip155"));
        assertEquals(1, p.specificity());
        assertEquals("eip155:*", p.toString());
    }

    @Test
    void globalWildcardMatchesEverything() {
        NetworkPattern p = NetworkPattern.parse("*");
        assertTrue(p.matches("eip155:1"));
        assertTrue(p.matches("solana:devnet"));
        assertFalse(p.matches(null));
        assertEquals(0, p.specificity());
    }

    @Test
    void malformedPatternsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> NetworkPattern.parse(""));
        assertThrows(IllegalArgumentException.class, () -> NetworkPattern.parse("base-sepolia"));
        assertThrows(IllegalArgumentException.class, () -> NetworkPattern.parse("EIP155:1"));
        assertThrows(IllegalArgumentException.class, () -> NetworkPattern.parse("eip155:"));
        assertThrows(IllegalArgumentException.class, () -> NetworkPattern.parse("eip155:1:2"));
    }

    @Test
    void equalityIgnoresSurroundingWhitespace() {
        assertEquals(NetworkPattern.parse("eip155:*"), NetworkPattern.parse(" eip155:* "));
        assertNotEquals(NetworkPattern.parse("eip155:*"), NetworkPattern.parse("*"));
    }
}

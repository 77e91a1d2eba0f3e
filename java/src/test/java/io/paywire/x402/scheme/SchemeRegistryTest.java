package io.paywire.x402.scheme;

import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.error.X402Exception;
import io.paywire.x402.model.PaymentPayload;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.ResourceInfo;
import io.paywire.x402.scheme.exact.ExactServerScheme;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemeRegistryTest {

    /** Client scheme that only remembers its label. */
    static class LabelledClient implements ClientScheme {
        final String label;

        LabelledClient(String label) {
            this.label = label;
        }

        @Override
        public String schemeId() {
            return "exact";
        }

        @Override
        public Map<String, Object> createPayload(PaymentRequirements requirements, ResourceInfo resource) {
            return Map.of("label", label);
        }
    }

    @Test
    void mostSpecificPatternWins() {
        SchemeRegistry registry = new SchemeRegistry()
                .register("*", new LabelledClient("global"))
                .register("eip155:*", new LabelledClient("evm"))
                .register("eip155:8453", new LabelledClient("base"));

        assertEquals("base", label(registry, "eip155:8453"));
        assertEquals("evm", label(registry, "eip155:1"));
        assertEquals("global", label(registry, "solana:devnet"));
    }

    @Test
    void registrationOrderDoesNotAffectResolution() {
        SchemeRegistry registry = new SchemeRegistry()
                .register("eip155:8453", new LabelledClient("base"))
                .register("eip155:*", new LabelledClient("evm"));

        assertEquals("base", label(registry, "eip155:8453"));
    }

    @Test
    void lastRegistrationForSamePatternWins() {
        SchemeRegistry registry = new SchemeRegistry()
                .register("eip155:*", new LabelledClient("first"))
                .register("eip155:*", new LabelledClient("second"));

        assertEquals("second", label(registry, "eip155:10"));
        assertEquals(1, registry.registrations(SchemeRole.CLIENT).size());
    }

    @Test
    void rolesAreResolvedIndependently() {
        SchemeRegistry registry = new SchemeRegistry()
                .register("eip155:*", new LabelledClient("evm"));

        assertTrue(registry.resolveClient("exact", "eip155:1").isPresent());
        assertTrue(registry.resolveServer("exact", "eip155:1").isEmpty());
        assertTrue(registry.resolveFacilitator("exact", "eip155:1").isEmpty());
        assertFalse(registry.supports(SchemeRole.SERVER, "exact", "eip155:1"));
    }

    @Test
    void schemeIdMustMatch() {
        SchemeRegistry registry = new SchemeRegistry()
                .register("eip155:*", new LabelledClient("evm"));

        assertTrue(registry.resolveClient("transfer", "eip155:1").isEmpty());
        assertTrue(registry.resolveClient(null, "eip155:1").isEmpty());
    }

    @Test
    void requireReportsNoMatchingScheme() {
        SchemeRegistry registry = new SchemeRegistry();

        X402Exception e = assertThrows(X402Exception.class,
                () -> registry.require(SchemeRole.SERVER, "exact", "eip155:1", ServerScheme.class));
        assertEquals(ErrorKind.NO_MATCHING_SCHEME, e.kind());
    }

    @Test
    void malformedPatternFailsRegistration() {
        SchemeRegistry registry = new SchemeRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register("base", new ExactServerScheme()));
    }

    @Test
    void registrationsAreListedMostSpecificFirst() {
        SchemeRegistry registry = new SchemeRegistry()
                .register("*", new LabelledClient("global"))
                .register("eip155:8453", new LabelledClient("base"))
                .register("eip155:*", new LabelledClient("evm"))
                .register("eip155:*", new ExactServerScheme());

        List<SchemeRegistry.Registration> regs = registry.registrations(SchemeRole.CLIENT);
        assertEquals(3, regs.size());
        assertEquals("eip155:8453", regs.get(0).pattern.toString());
        assertEquals("eip155:*", regs.get(1).pattern.toString());
        assertEquals("*", regs.get(2).pattern.toString());
    }

    @Test
    void serverSchemeDefaultsAreUsable() throws Exception {
        ServerScheme noop = new ServerScheme() {
            @Override
            public String schemeId() {
                return "noop";
            }

            @Override
            public void validate(PaymentPayload payload, PaymentRequirements requirements) {
            }

            @Override
            public Instant deadline(PaymentPayload payload, PaymentRequirements requirements) {
                return Instant.MAX;
            }

            @Override
            public String proofNonce(PaymentPayload payload) {
                return "n";
            }
        };
        SchemeRegistry registry = new SchemeRegistry().register("*", noop);
        ServerScheme resolved = registry.require(SchemeRole.SERVER, "noop", "eip155:1", ServerScheme.class);
        PaymentRequirements req = new PaymentRequirements("noop", "eip155:1", "0xA", "1", "0xB", 60);
        assertSame(req, resolved.enhance(req));
    }

    private static String label(SchemeRegistry registry, String network) {
        return ((LabelledClient) registry.resolveClient("exact", network).orElseThrow()).label;
    }
}

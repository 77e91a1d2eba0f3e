package io.paywire.x402.client;

import io.paywire.x402.config.X402Config;
import io.paywire.x402.crypto.CryptoSignException;
import io.paywire.x402.error.ErrorKind;
import io.paywire.x402.facilitator.LocalFacilitatorClient;
import io.paywire.x402.model.PaymentRequirements;
import io.paywire.x402.model.ResourceInfo;
import io.paywire.x402.nonce.InMemoryNonceStore;
import io.paywire.x402.scheme.ClientScheme;
import io.paywire.x402.scheme.SchemeRegistry;
import io.paywire.x402.scheme.exact.ExactClientScheme;
import io.paywire.x402.scheme.exact.ExactFacilitatorScheme;
import io.paywire.x402.scheme.exact.ExactServerScheme;
import io.paywire.x402.server.AcceptOption;
import io.paywire.x402.server.HttpRequestContext;
import io.paywire.x402.server.ProcessResult;
import io.paywire.x402.server.ResourceServer;
import io.paywire.x402.server.RouteConfig;
import io.paywire.x402.testing.FakeSigner;
import io.paywire.x402.testing.Fixtures;
import io.paywire.x402.testing.MutableClock;
import io.paywire.x402.testing.RecordingBackend;
import io.paywire.x402.testing.StubResponse;
import io.paywire.x402.util.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/** Client engine talking to a resource server in the same process. */
class ClientServerFlowTest {

    private static final URI REPORT = URI.create("http://api.example.com/api/premium/report");

    private MutableClock clock;
    private RecordingBackend backend;
    private ResourceServer server;
    private HttpClient http;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Fixtures.NOW);
        backend = new RecordingBackend();
        SchemeRegistry serverSchemes = new SchemeRegistry()
                .register("eip155:*", new ExactServerScheme())
                .register("eip155:*", new ExactFacilitatorScheme(FakeSigner.VERIFIER, backend, clock));
        X402Config config = X402Config.builder().walletAddress(Fixtures.MERCHANT).build();
        server = new ResourceServer(config, serverSchemes, new LocalFacilitatorClient(serverSchemes, clock),
                new InMemoryNonceStore(clock, Duration.ofHours(1)), clock)
                .addRoute(new RouteConfig("/api/premium/*",
                        new AcceptOption("exact", Fixtures.BASE, Fixtures.USDC_BASE, "0.01"),
                        new AcceptOption("exact", Fixtures.SOLANA, Fixtures.USDC_SOLANA, "0.01")));

        http = mock(HttpClient.class);
        when(http.send(any(HttpRequest.class), any())).thenAnswer(inv -> serve(inv.getArgument(0)));
    }

    private HttpResponse<String> serve(HttpRequest request) throws Exception {
        HttpRequestContext ctx = new HttpRequestContext(request.method(), request.uri().getPath(),
                request.uri().toString(), firstValues(request), "127.0.0.1", 0);
        ProcessResult result = server.processRequest(ctx);
        if (result.allowed()) {
            return new StubResponse(request, 200, result.headers(), "{\"report\":\"q3\"}");
        }
        return new StubResponse(request, result.status(), result.headers(),
                Json.MAPPER.writeValueAsString(result.body()));
    }

    private static Map<String, String> firstValues(HttpRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        request.headers().map().forEach((k, v) -> headers.put(k, v.get(0)));
        return headers;
    }

    private SchemeRegistry wallet(String pattern, ClientScheme scheme) {
        return new SchemeRegistry().register(pattern, scheme);
    }

    private ExactClientScheme signer() {
        return new ExactClientScheme(new FakeSigner(Fixtures.PAYER), Fixtures.PAYER, clock);
    }

    @Test
    void payingClientGetsResourceAndReceipt() throws Exception {
        PaymentResult r = ClientPaymentEngine.builder(wallet("eip155:*", signer())).httpClient(http).build()
                .execute(HttpRequest.newBuilder(REPORT).build());

        assertTrue(r.paid(), r.error());
        assertEquals("{\"report\":\"q3\"}", r.response().body());
        assertEquals(Fixtures.BASE, r.selected().network);
        assertEquals(Fixtures.PAYER, r.settlement().payer);
        assertEquals(1, backend.submissions.get());
    }

    @Test
    void resentPaymentIsRejectedAsReplay() throws Exception {
        PaymentResult first = ClientPaymentEngine.builder(wallet("eip155:*", signer())).httpClient(http).build()
                .execute(HttpRequest.newBuilder(REPORT).build());
        assertTrue(first.paid());

        HttpResponse<String> replay = serve(HttpRequest.newBuilder(REPORT)
                .header("X-PAYMENT", first.payment().toHeader()).build());
        assertEquals(402, replay.statusCode());
        assertTrue(replay.body().contains("already used"), replay.body());
        assertEquals(1, backend.submissions.get());
    }

    @Test
    void failedSettlementIsNotServed() throws Exception {
        backend.failWith = "transfer reverted";

        PaymentResult r = ClientPaymentEngine.builder(wallet("eip155:*", signer())).httpClient(http).build()
                .execute(HttpRequest.newBuilder(REPORT).build());

        assertTrue(r.failed());
        assertEquals(ErrorKind.PAYMENT_REJECTED, r.failure());
        assertEquals("transfer reverted", r.error());
        assertFalse(r.response().body().contains("q3"));
    }

    @Test
    void slowSignerMissesDeadline() throws Exception {
        ExactClientScheme exact = signer();
        ClientScheme slow = new ClientScheme() {
            @Override
            public String schemeId() {
                return exact.schemeId();
            }

            @Override
            public Map<String, Object> createPayload(PaymentRequirements requirements, ResourceInfo resource)
                    throws CryptoSignException {
                Map<String, Object> payload = exact.createPayload(requirements, resource);
                clock.advance(Duration.ofSeconds(requirements.maxTimeoutSeconds));
                return payload;
            }
        };

        PaymentResult r = ClientPaymentEngine.builder(wallet("eip155:*", slow)).httpClient(http).build()
                .execute(HttpRequest.newBuilder(REPORT).build());

        assertEquals(ErrorKind.PAYMENT_REJECTED, r.failure());
        assertTrue(r.error().contains("deadline"), r.error());
        assertEquals(0, backend.submissions.get());
    }

    @Test
    void clientWithoutServerSupportedSchemeGetsTypedFailure() throws Exception {
        PaymentResult r = ClientPaymentEngine.builder(wallet("solana:*", signer())).httpClient(http).build()
                .execute(HttpRequest.newBuilder(REPORT).build());

        // the server has no solana scheme, so the signed payment cannot be processed
        assertEquals(Fixtures.SOLANA, r.selected().network);
        assertEquals(ErrorKind.PAYMENT_REJECTED, r.failure());
        assertEquals(List.of(NegotiationState.UNPAID, NegotiationState.CHALLENGED, NegotiationState.SELECTING,
                NegotiationState.SIGNING, NegotiationState.RETRYING, NegotiationState.FAILED), r.transitions());
    }
}

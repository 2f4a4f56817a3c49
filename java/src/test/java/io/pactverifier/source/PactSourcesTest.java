package io.pactverifier.source;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.pactverifier.ErrorCode;
import io.pactverifier.PactUriConfig;
import io.pactverifier.VerifierConfig;
import io.pactverifier.VerifierException;
import io.pactverifier.model.PactDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PactSourcesTest {

    private HttpServer server;
    private URI baseUri;
    private volatile String lastAuthorization;
    private final AtomicInteger brokerCalls = new AtomicInteger();
    private final DelegatingHandler brokerHandler = new DelegatingHandler();

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        brokerHandler.delegate = exchange -> {
            brokerCalls.incrementAndGet();
            lastAuthorization = exchange.getRequestHeaders().getFirst("Authorization");
            respond(exchange, 200, new String(resource("/pacts/orders.json"), StandardCharsets.UTF_8));
        };
        server.createContext("/pacts/provider/OrderService/consumer/OrderWeb/latest", brokerHandler);
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        lastAuthorization = null;
        brokerCalls.set(0);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void detectsWebUris() {
        assertTrue(PactSources.isWebUri("http://broker/pacts/latest"));
        assertTrue(PactSources.isWebUri("HTTPS://broker/pacts/latest"));
        assertFalse(PactSources.isWebUri("file:///tmp/pact.json"));
        assertFalse(PactSources.isWebUri("./pacts/orders.json"));
        assertFalse(PactSources.isWebUri(""));
        assertFalse(PactSources.isWebUri(null));
    }

    @Test
    void selectsSourceVariantByUriShape() throws Exception {
        assertInstanceOf(UrlPactSource.class, PactSources.forUri(baseUri + "/pacts/x", null, null));
        assertInstanceOf(FilePactSource.class, PactSources.forUri("pacts/orders.json", null, null));
        assertInstanceOf(FilePactSource.class, PactSources.forUri(tempDir.toUri().toString(), null, null));
    }

    @Test
    void rejectsEmptyUri() {
        VerifierException ex = assertThrows(VerifierException.class, () -> PactSources.forUri(" ", null, null));
        assertEquals(ErrorCode.SOURCE_UNAVAILABLE, ex.getCode());
    }

    @Test
    void rejectsPathsTheFilesystemCannotRepresent() {
        VerifierException ex = assertThrows(VerifierException.class,
            () -> PactSources.forUri("pacts/orders\u0000.json", null, null));
        assertEquals(ErrorCode.SOURCE_UNAVAILABLE, ex.getCode());
        assertTrue(ex.getMessage().startsWith("invalid pact path"), ex.getMessage());
    }

    @Test
    void readsLocalFileAndValidates() throws Exception {
        Path pact = tempDir.resolve("orders.json");
        Files.write(pact, resource("/pacts/orders.json"));

        PactDocument document = PactSources.fetch(pact.toString(), null, VerifierConfig.defaults());

        assertEquals("OrderService", document.provider());
        assertEquals(2, document.interactions().size());
    }

    @Test
    void missingLocalFileIsUnavailable() {
        Path missing = tempDir.resolve("nope.json");
        VerifierException ex = assertThrows(VerifierException.class,
            () -> PactSources.fetch(missing.toString(), null, null));
        assertEquals(ErrorCode.SOURCE_UNAVAILABLE, ex.getCode());
        assertTrue(ex.getMessage().contains("nope.json"));
    }

    @Test
    void structurallyInvalidFileFailsValidation() throws Exception {
        Path pact = tempDir.resolve("missing-provider.json");
        Files.write(pact, resource("/pacts/missing-provider.json"));

        VerifierException ex = assertThrows(VerifierException.class,
            () -> PactSources.fetch(pact.toString(), null, null));
        assertEquals(ErrorCode.INVALID_DOCUMENT, ex.getCode());
    }

    @Test
    void fetchesRemotePactWithBasicAuth() throws Exception {
        String uri = baseUri + "/pacts/provider/OrderService/consumer/OrderWeb/latest";

        PactDocument document = PactSources.fetch(uri, new PactUriConfig("broker", "s3cret"), null);

        assertEquals("OrderWeb", document.consumer());
        String expected = "Basic " + Base64.getEncoder().encodeToString("broker:s3cret".getBytes(StandardCharsets.UTF_8));
        assertEquals(expected, lastAuthorization);
        assertEquals(1, brokerCalls.get());
    }

    @Test
    void fetchesRemotePactWithoutCredentials() throws Exception {
        String uri = baseUri + "/pacts/provider/OrderService/consumer/OrderWeb/latest";

        PactSources.fetch(uri, PactUriConfig.NONE, null);

        assertNull(lastAuthorization);
    }

    @Test
    void remoteErrorStatusIsUnavailableWithoutRetry() {
        brokerHandler.delegate = exchange -> {
            brokerCalls.incrementAndGet();
            respond(exchange, 401, "{\"error\":\"unauthorized\"}");
        };
        String uri = baseUri + "/pacts/provider/OrderService/consumer/OrderWeb/latest";

        VerifierException ex = assertThrows(VerifierException.class,
            () -> PactSources.fetch(uri, new PactUriConfig("broker", "wrong"), null));
        assertEquals(ErrorCode.SOURCE_UNAVAILABLE, ex.getCode());
        assertTrue(ex.getMessage().contains("401"));
        assertEquals(1, brokerCalls.get());
    }

    @Test
    void remoteGarbageIsMalformed() {
        brokerHandler.delegate = exchange -> respond(exchange, 200, "<html>not a pact</html>");
        String uri = baseUri + "/pacts/provider/OrderService/consumer/OrderWeb/latest";

        VerifierException ex = assertThrows(VerifierException.class, () -> PactSources.fetch(uri, null, null));
        assertEquals(ErrorCode.MALFORMED_DOCUMENT, ex.getCode());
    }

    @Test
    void unreachableRemoteIsUnavailable() {
        String uri = baseUri + "/pacts/latest";
        server.stop(0);
        server = null;

        VerifierConfig config = VerifierConfig.builder().httpTimeout(Duration.ofSeconds(2)).build();
        VerifierException ex = assertThrows(VerifierException.class, () -> PactSources.fetch(uri, null, config));
        assertEquals(ErrorCode.SOURCE_UNAVAILABLE, ex.getCode());
    }

    @Test
    void locationHidesUserInfo() {
        UrlPactSource source = new UrlPactSource(java.net.http.HttpClient.newHttpClient(),
            URI.create("https://user:pw@broker.example.com/pacts/latest"), null, null);

        assertEquals("https://broker.example.com/pacts/latest", source.location());
    }

    private static class DelegatingHandler implements HttpHandler {
        volatile HttpHandler delegate;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (delegate == null) {
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            } else {
                delegate.handle(exchange);
            }
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static byte[] resource(String name) throws IOException {
        try (InputStream in = PactSourcesTest.class.getResourceAsStream(name)) {
            assertNotNull(in, "missing test resource " + name);
            return in.readAllBytes();
        }
    }
}

package io.codescalpel.license;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HttpVerifierTransport} against a loopback HTTP server.
 */
class HttpVerifierTransportTest {

    @TempDir
    Path tempDir;

    private HttpServer server;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> contentType = new AtomicReference<>();
    private final AtomicReference<String> userAgent = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = FakeTransport.verifierJson(true, 1_800_000_000L, "pro", null);

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/verify", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            if (status == 302) {
                exchange.getResponseHeaders().add("Location", "https://evil.example.com/verify");
            }
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private RemoteLicenseVerifier verifier(String baseUrl) {
        LicenseConfig config = LicenseConfig.from(Map.of(
            LicenseConfig.ENV_VERIFIER_URL, baseUrl,
            LicenseConfig.ENV_VERIFY_RETRIES, "0",
            LicenseConfig.ENV_VERIFY_TIMEOUT_SECONDS, "2"
        ), tempDir);
        return RemoteLicenseVerifier.fromConfig(config);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @Test
    @DisplayName("POSTs JSON to /verify and parses the response")
    void verify_roundTrip() {
        var result = verifier(baseUrl()).verify("tok.en.value", "production");

        assertTrue(result.succeeded());
        assertEquals(Tier.PRO, result.entitlements().tier());
        assertEquals("{\"token\":\"tok.en.value\",\"environment\":\"production\"}", requestBody.get());
        assertEquals("application/json", contentType.get());
        assertEquals(HttpVerifierTransport.USER_AGENT, userAgent.get());
    }

    @Test
    @DisplayName("Server errors are protocol failures")
    void serverError_isProtocolFailure() {
        status = 500;
        responseBody = "boom";

        var result = verifier(baseUrl()).verify("tok.en.value", null);

        assertEquals(RemoteVerificationResult.Failure.PROTOCOL, result.failure());
    }

    @Test
    @DisplayName("Redirects are not followed")
    void redirect_notFollowed() {
        status = 302;
        responseBody = "";

        var result = verifier(baseUrl()).verify("tok.en.value", null);

        assertEquals(RemoteVerificationResult.Failure.PROTOCOL, result.failure());
        assertTrue(result.message().contains("HTTP 302"));
    }

    @Test
    @DisplayName("Connection refused is a network failure")
    void connectionRefused_isNetworkFailure() {
        String url = baseUrl();
        server.stop(0);
        server = null;

        var result = verifier(url).verify("tok.en.value", null);

        assertEquals(RemoteVerificationResult.Failure.NETWORK, result.failure());
    }
}

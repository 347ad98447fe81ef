package io.codescalpel.license;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link VerifierTransport} over {@link HttpClient}.
 *
 * <p>Redirects are never followed, so the request can only reach the URL that
 * passed {@link VerifierEndpoint}'s checks.
 */
public class HttpVerifierTransport implements VerifierTransport {

    static final String USER_AGENT = "code-scalpel/remote-verifier";

    private final HttpClient httpClient;

    public HttpVerifierTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build());
    }

    public HttpVerifierTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Response post(URI uri, String jsonBody, Duration timeout) throws IOException, InterruptedException {
        if (!VerifierEndpoint.isHttpScheme(uri.getScheme())) {
            throw new UntrustedVerifierException(uri.toString(), "Unsupported verifier URL scheme: " + uri.getScheme());
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8))
            .timeout(timeout)
            .build();

        HttpResponse<String> response = httpClient.send(
            request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)
        );
        return new Response(response.statusCode(), response.body());
    }
}

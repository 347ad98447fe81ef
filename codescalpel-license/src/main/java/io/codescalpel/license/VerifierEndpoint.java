package io.codescalpel.license;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * A remote license verifier base URL that has passed the trust checks.
 *
 * <p>Only URLs on {@link #TRUSTED_URLS}, or HTTP(S) URLs on a loopback host
 * (any port, for local development and test harnesses), are accepted. Every
 * other URL is rejected with {@link UntrustedVerifierException} before any
 * request is made.
 */
public final class VerifierEndpoint {

    private static final Logger LOG = Logger.getLogger(VerifierEndpoint.class.getName());

    /**
     * Verifier base URLs trusted in every environment.
     */
    public static final Set<String> TRUSTED_URLS = Set.of(
        "https://verifier.codescalpel.dev",
        "http://scalpel-verifier:8000",
        "http://127.0.0.1:8003",
        "http://localhost:8003",
        "http://127.0.0.1:8000",
        "http://localhost:8000"
    );

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "::1", "[::1]");

    private final String baseUrl;

    private VerifierEndpoint(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * Validate a configured verifier base URL.
     *
     * @param rawUrl the configured URL, trailing slashes allowed
     * @return the endpoint
     * @throws UntrustedVerifierException if the URL is untrusted or not HTTP(S)
     */
    public static VerifierEndpoint of(String rawUrl) {
        String url = stripTrailingSlashes(rawUrl.strip());
        URI uri = parse(url);
        if (!isHttpScheme(uri.getScheme())) {
            throw new UntrustedVerifierException(url,
                "Unsupported verifier URL scheme: " + uri.getScheme() + ". Only http and https are allowed.");
        }
        if (!TRUSTED_URLS.contains(url) && !isLoopback(uri)) {
            LOG.severe("SECURITY: untrusted verifier URL rejected: " + url);
            throw new UntrustedVerifierException(url,
                "Untrusted verifier URL: " + url + ". Only trusted verifiers are allowed: "
                    + new TreeSet<>(TRUSTED_URLS));
        }
        return new VerifierEndpoint(url);
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * The {@code POST /verify} endpoint.
     *
     * @throws UntrustedVerifierException if the resolved URL is not HTTP(S)
     */
    public URI verifyUri() {
        URI uri = parse(baseUrl + "/verify");
        if (!isHttpScheme(uri.getScheme())) {
            throw new UntrustedVerifierException(uri.toString(),
                "Unsupported verifier URL scheme: " + uri.getScheme());
        }
        return uri;
    }

    static boolean isHttpScheme(String scheme) {
        if (scheme == null) {
            return false;
        }
        String s = scheme.toLowerCase(Locale.ROOT);
        return s.equals("http") || s.equals("https");
    }

    private static boolean isLoopback(URI uri) {
        String host = uri.getHost();
        return host != null && LOOPBACK_HOSTS.contains(host.toLowerCase(Locale.ROOT));
    }

    private static URI parse(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new UntrustedVerifierException(url, "Malformed verifier URL: " + url);
        }
    }

    private static String stripTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }

    @Override
    public String toString() {
        return baseUrl;
    }
}

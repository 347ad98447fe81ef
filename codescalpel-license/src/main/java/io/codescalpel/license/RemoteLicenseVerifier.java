package io.codescalpel.license;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Client for the remote license verifier.
 *
 * <p>Wire protocol:
 * <pre>{@code
 * POST {base}/verify
 * {"token": "...", "environment": "production"}
 *
 * 200 OK
 * {"valid": true, "error": null,
 *  "license": {"exp": 1767225600, "tier": "pro", "features": ["..."],
 *              "customer_id": "cus_123", "organization": "Acme", "seats": 5}}
 * }</pre>
 * {@code customer} and {@code org} are accepted as aliases of {@code customer_id}
 * and {@code organization}.
 *
 * <p>Each call makes at most {@code retries + 1} attempts with a linear backoff
 * between them, so a caller blocks for at most about {@code timeout × (retries + 1)}.
 * Verification has no side effects on the server, so retries are safe.
 */
public class RemoteLicenseVerifier {

    private static final Logger LOG = Logger.getLogger(RemoteLicenseVerifier.class.getName());

    public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(50);

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final VerifierEndpoint endpoint;
    private final VerifierTransport transport;
    private final Duration timeout;
    private final int retries;
    private final Duration backoff;

    public RemoteLicenseVerifier(
            VerifierEndpoint endpoint,
            VerifierTransport transport,
            Duration timeout,
            int retries,
            Duration backoff) {
        this.endpoint = endpoint;
        this.transport = transport;
        this.timeout = timeout;
        this.retries = Math.max(0, retries);
        this.backoff = backoff;
    }

    /**
     * Create a verifier from configuration using the HTTP transport.
     *
     * @throws IllegalStateException if no verifier is configured
     */
    public static RemoteLicenseVerifier fromConfig(LicenseConfig config) {
        if (!config.remoteVerifierConfigured()) {
            throw new IllegalStateException(
                "Remote verifier URL not configured. Set " + LicenseConfig.ENV_VERIFIER_URL);
        }
        return new RemoteLicenseVerifier(
            config.verifierEndpoint(),
            new HttpVerifierTransport(config.verifyTimeout()),
            config.verifyTimeout(),
            config.verifyRetries(),
            DEFAULT_BACKOFF
        );
    }

    /**
     * Verify a token with the remote verifier.
     *
     * @param token the license token
     * @param environment environment tag, may be null
     * @return the verifier's entitlements, or a failure; never a default-valid record
     */
    public RemoteVerificationResult verify(String token, String environment) {
        String stripped = token == null ? "" : token.strip();
        String hint = LicenseTokens.hintFor(stripped);

        URI uri;
        try {
            uri = endpoint.verifyUri();
        } catch (UntrustedVerifierException e) {
            return RemoteVerificationResult.failure(RemoteVerificationResult.Failure.UNTRUSTED_URL, e.getMessage());
        }

        JsonObject payload = new JsonObject();
        payload.addProperty("token", stripped);
        payload.add("environment", environment != null ? new JsonPrimitive(environment) : JsonNull.INSTANCE);
        String body = GSON.toJson(payload);

        RemoteVerificationResult.Failure lastFailure = RemoteVerificationResult.Failure.NETWORK;
        String lastError = "UnknownError";

        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                VerifierTransport.Response response = transport.post(uri, body, timeout);
                if (!response.isSuccess()) {
                    lastFailure = RemoteVerificationResult.Failure.PROTOCOL;
                    lastError = "HTTP " + response.statusCode();
                } else {
                    return RemoteVerificationResult.success(parseResponse(response.body()));
                }
            } catch (UntrustedVerifierException e) {
                return RemoteVerificationResult.failure(RemoteVerificationResult.Failure.UNTRUSTED_URL, e.getMessage());
            } catch (IOException e) {
                lastFailure = RemoteVerificationResult.Failure.NETWORK;
                lastError = e.getClass().getSimpleName();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastFailure = RemoteVerificationResult.Failure.NETWORK;
                lastError = "Interrupted";
                break;
            } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                     | NumberFormatException e) {
                lastFailure = RemoteVerificationResult.Failure.PROTOCOL;
                lastError = e.getClass().getSimpleName();
            }

            if (attempt < retries && !sleepBeforeRetry(attempt)) {
                lastFailure = RemoteVerificationResult.Failure.NETWORK;
                lastError = "Interrupted";
                break;
            }
        }

        LOG.warning("Remote verify failed (hash=" + hint + ", failure=" + lastFailure + ", error=" + lastError + ")");
        return RemoteVerificationResult.failure(
            lastFailure, "Remote verify failed (hash=" + hint + ", error=" + lastError + ")");
    }

    /**
     * Parse a verifier response body into entitlements.
     *
     * @throws JsonParseException if the body is not JSON
     * @throws IllegalStateException if the body is not a JSON object
     */
    static VerifiedEntitlements parseResponse(String body) {
        JsonElement root = JsonParser.parseString(body == null ? "" : body);
        if (!root.isJsonObject()) {
            throw new IllegalStateException("Verifier response is not an object");
        }
        JsonObject json = root.getAsJsonObject();

        boolean valid = isTrue(json.get("valid"));
        String error = stringOrNull(json.get("error"));

        JsonElement licenseElement = json.get("license");
        JsonObject license = licenseElement != null && licenseElement.isJsonObject()
            ? licenseElement.getAsJsonObject()
            : new JsonObject();

        long exp = longOrZero(license.get("exp"));
        Tier tier = Tier.fromClaim(stringOrNull(license.get("tier")));
        List<String> features = stringList(license.get("features"));

        String customerId = stringOrNull(license.get("customer_id"));
        if (customerId == null) {
            customerId = stringOrNull(license.get("customer"));
        }
        String organization = stringOrNull(license.get("organization"));
        if (organization == null) {
            organization = stringOrNull(license.get("org"));
        }

        return new VerifiedEntitlements(
            valid, exp, tier, features, customerId, organization, intOrNull(license.get("seats")), error
        );
    }

    private boolean sleepBeforeRetry(int attempt) {
        long millis = backoff.toMillis() * (attempt + 1);
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean isTrue(JsonElement e) {
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean() && e.getAsBoolean();
    }

    private static String stringOrNull(JsonElement e) {
        if (e == null || !e.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive p = e.getAsJsonPrimitive();
        return p.isString() ? p.getAsString() : null;
    }

    private static long longOrZero(JsonElement e) {
        if (e == null || !e.isJsonPrimitive()) {
            return 0;
        }
        JsonPrimitive p = e.getAsJsonPrimitive();
        if (p.isNumber()) {
            return p.getAsNumber().longValue();
        }
        if (p.isString()) {
            try {
                return (long) Double.parseDouble(p.getAsString().strip());
            } catch (NumberFormatException ex) {
                return 0;
            }
        }
        return 0;
    }

    private static Integer intOrNull(JsonElement e) {
        if (e == null || !e.isJsonPrimitive()) {
            return null;
        }
        JsonPrimitive p = e.getAsJsonPrimitive();
        if (p.isNumber()) {
            return p.getAsNumber().intValue();
        }
        if (p.isString()) {
            try {
                return Integer.parseInt(p.getAsString().strip());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static List<String> stringList(JsonElement e) {
        List<String> out = new ArrayList<>();
        if (e == null || !e.isJsonArray()) {
            return out;
        }
        JsonArray array = e.getAsJsonArray();
        for (JsonElement item : array) {
            if (item.isJsonPrimitive() && !item.getAsJsonPrimitive().isBoolean()) {
                out.add(item.getAsString());
            }
        }
        return out;
    }
}

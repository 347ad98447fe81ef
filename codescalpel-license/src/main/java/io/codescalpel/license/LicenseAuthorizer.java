package io.codescalpel.license;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * Decides whether a license token is authorized, using the remote verifier as the
 * authority and the verification cache to ride out short outages.
 *
 * <p>Policy, measured from the last successful verification of the same token:
 * <ul>
 *   <li>no usable cached verification for this token: call the verifier</li>
 *   <li>license expired: deny, whatever the cache age</li>
 *   <li>age up to {@link #REFRESH_INTERVAL}: reuse the cached verdict without a network call</li>
 *   <li>older: call the verifier; if that fails, allow only while the age is within
 *       {@link #REFRESH_INTERVAL} plus {@link #OFFLINE_GRACE} and the cached verdict was valid</li>
 * </ul>
 *
 * <p>Calls block for at most the verifier's timeout times its attempt count.
 * Callers that cannot block should run this on a worker thread.
 */
public class LicenseAuthorizer {

    private static final Logger LOG = Logger.getLogger(LicenseAuthorizer.class.getName());

    public static final Duration REFRESH_INTERVAL = Duration.ofHours(24);
    public static final Duration OFFLINE_GRACE = Duration.ofHours(24);

    private final RemoteLicenseVerifier verifier;
    private final VerificationCache cache;
    private final String environment;
    private final Clock clock;

    public LicenseAuthorizer(RemoteLicenseVerifier verifier, VerificationCache cache, String environment, Clock clock) {
        this.verifier = verifier;
        this.cache = cache;
        this.environment = environment;
        this.clock = clock;
    }

    public VerificationCache getCache() {
        return cache;
    }

    /**
     * Authorize a license token.
     *
     * @param token the license token
     * @return the decision, never null
     */
    public AuthorizationDecision authorizeToken(String token) {
        String stripped = token == null ? "" : token.strip();
        String tokenHash = LicenseTokens.sha256(stripped);
        Instant now = clock.instant();

        CacheRecord cached = cache.load();
        if (!cached.isComplete()) {
            return verifyAndDecide(stripped, tokenHash, now, null, null);
        }
        if (!cached.matchesToken(tokenHash)) {
            LOG.info("Cached verification is for a different license (cached=" + LicenseTokens.hashHint(cached.licenseHash())
                + ", current=" + LicenseTokens.hashHint(tokenHash) + "); verifying remotely");
            return verifyAndDecide(stripped, tokenHash, now, null, null);
        }

        if (now.getEpochSecond() >= cached.exp()) {
            return AuthorizationDecision.denied(
                cached.toEntitlements(false, "License expired"), AuthorizationReason.LICENSE_EXPIRED);
        }

        Duration age = Duration.between(cached.lastVerifiedInstant(), now);
        if (!age.isNegative() && age.compareTo(REFRESH_INTERVAL) <= 0) {
            return new AuthorizationDecision(
                cached.isValid(), cached.toEntitlements(), AuthorizationReason.CACHE_FRESH);
        }

        return verifyAndDecide(stripped, tokenHash, now, cached, age);
    }

    /**
     * Verify remotely and update the cache regardless of cache age.
     *
     * <p>For background refresh loops. Nothing is cached when verification fails.
     */
    public RemoteVerificationResult refreshCache(String token) {
        String stripped = token == null ? "" : token.strip();
        RemoteVerificationResult result = verifier.verify(stripped, environment);
        if (result.succeeded()) {
            cache.save(result.entitlements(), LicenseTokens.sha256(stripped));
        }
        return result;
    }

    private AuthorizationDecision verifyAndDecide(
            String token, String tokenHash, Instant now, CacheRecord cached, Duration age) {
        RemoteVerificationResult result = verifier.verify(token, environment);
        return switch (result.failure()) {
            case NONE -> {
                VerifiedEntitlements ent = result.entitlements();
                cache.save(ent, tokenHash);
                if (ent.isExpiredAt(now)) {
                    yield AuthorizationDecision.denied(ent, AuthorizationReason.LICENSE_EXPIRED);
                }
                yield new AuthorizationDecision(ent.valid(), ent, AuthorizationReason.REMOTE_VERIFIED);
            }
            case NETWORK, PROTOCOL -> offlineDecision(tokenHash, now, cached, age);
            case UNTRUSTED_URL -> {
                LOG.severe("Verifier endpoint rejected: " + result.message());
                yield AuthorizationDecision.denied(
                    cached != null ? cached.toEntitlements(false, result.message()) : null,
                    AuthorizationReason.OFFLINE_DENIED);
            }
        };
    }

    private AuthorizationDecision offlineDecision(String tokenHash, Instant now, CacheRecord cached, Duration age) {
        if (cached == null) {
            LOG.warning("Remote verification unavailable and no cached verification for this license");
            return AuthorizationDecision.denied(null, AuthorizationReason.OFFLINE_DENIED);
        }

        boolean withinGrace = age != null
            && !age.isNegative()
            && age.compareTo(REFRESH_INTERVAL.plus(OFFLINE_GRACE)) <= 0;
        if (withinGrace
                && cached.isValid()
                && cached.matchesToken(tokenHash)
                && now.getEpochSecond() < cached.exp()) {
            LOG.warning("Remote verification unavailable; using offline grace (last verified "
                + age.toHours() + "h ago)");
            return AuthorizationDecision.allowed(cached.toEntitlements(true, null), AuthorizationReason.OFFLINE_GRACE);
        }

        LOG.warning("Remote verification unavailable and offline grace does not apply");
        // A cached revocation notice outlives the outage.
        String error = cached.error() != null ? cached.error() : "Remote verification unavailable and grace expired";
        return AuthorizationDecision.denied(
            cached.toEntitlements(false, error),
            AuthorizationReason.OFFLINE_DENIED);
    }
}

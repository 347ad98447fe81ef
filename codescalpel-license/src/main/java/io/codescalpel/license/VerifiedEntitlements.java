package io.codescalpel.license;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Entitlements reported by the remote verifier, or restored from the verification cache.
 *
 * @param valid whether the verifier accepted the token
 * @param exp license expiry, epoch seconds
 * @param tier licensed tier
 * @param features feature flags
 * @param customerId customer ID, may be null
 * @param organization organization name, may be null
 * @param seats licensed seats, may be null
 * @param error verifier or cache error message, may be null
 */
public record VerifiedEntitlements(
    boolean valid,
    long exp,
    Tier tier,
    List<String> features,
    String customerId,
    String organization,
    Integer seats,
    String error
) {

    public VerifiedEntitlements {
        tier = tier != null ? tier : Tier.COMMUNITY;
        features = features != null ? List.copyOf(features) : List.of();
    }

    public boolean isExpiredAt(Instant now) {
        return now.getEpochSecond() >= exp;
    }

    /**
     * Whether the verifier reported the license as revoked.
     */
    public boolean isRevoked() {
        return error != null && error.toLowerCase(Locale.ROOT).contains("revoked");
    }

    /**
     * Copy with a different validity and error, used when a cached record is reported
     * back to callers.
     */
    public VerifiedEntitlements withValidity(boolean newValid, String newError) {
        return new VerifiedEntitlements(newValid, exp, tier, features, customerId, organization, seats, newError);
    }
}

package io.codescalpel.license;

import java.time.Instant;
import java.util.List;

/**
 * Last successful remote verification, as persisted in the verification cache.
 *
 * <p>A record is bound to the token it verified through {@code licenseHash}; it
 * says nothing about any other token. All fields are null in {@link #EMPTY}.
 *
 * @param lastVerifiedAt ISO-8601 UTC time of the verification
 * @param lastVerifiedAtEpoch the same instant in fractional epoch seconds
 * @param licenseHash SHA-256 of the verified token
 * @param valid the verifier's verdict
 * @param exp license expiry, epoch seconds
 * @param tier licensed tier
 * @param features feature flags
 * @param customerId customer ID, may be null
 * @param organization organization name, may be null
 * @param seats licensed seats, may be null
 * @param error the verifier's error (e.g. a revocation notice), may be null
 */
public record CacheRecord(
    String lastVerifiedAt,
    Double lastVerifiedAtEpoch,
    String licenseHash,
    Boolean valid,
    Long exp,
    Tier tier,
    List<String> features,
    String customerId,
    String organization,
    Integer seats,
    String error
) {

    public static final CacheRecord EMPTY = new CacheRecord(
        null, null, null, null, null, null, null, null, null, null, null
    );

    public CacheRecord {
        features = features != null ? List.copyOf(features) : List.of();
    }

    /**
     * Record a successful verification of the token with the given hash.
     */
    public static CacheRecord of(Instant verifiedAt, String tokenHash, VerifiedEntitlements entitlements) {
        return new CacheRecord(
            verifiedAt.toString(),
            verifiedAt.toEpochMilli() / 1000.0,
            tokenHash,
            entitlements.valid(),
            entitlements.exp(),
            entitlements.tier(),
            entitlements.features(),
            entitlements.customerId(),
            entitlements.organization(),
            entitlements.seats(),
            entitlements.error()
        );
    }

    /**
     * Whether the record has the fields needed to make a decision from it.
     */
    public boolean isComplete() {
        return lastVerifiedAtEpoch != null && lastVerifiedAtEpoch > 0
            && exp != null && exp > 0
            && licenseHash != null && !licenseHash.isBlank();
    }

    public boolean matchesToken(String tokenHash) {
        return licenseHash != null && licenseHash.equals(tokenHash);
    }

    public boolean isValid() {
        return Boolean.TRUE.equals(valid);
    }

    /**
     * Instant of the last verification, or null if unknown.
     */
    public Instant lastVerifiedInstant() {
        return lastVerifiedAtEpoch != null ? Instant.ofEpochMilli(Math.round(lastVerifiedAtEpoch * 1000)) : null;
    }

    /**
     * Entitlements exactly as the verifier reported them, including its error.
     */
    public VerifiedEntitlements toEntitlements() {
        return new VerifiedEntitlements(
            isValid(),
            exp != null ? exp : 0L,
            tier,
            features,
            customerId,
            organization,
            seats,
            error
        );
    }

    /**
     * Cached entitlements reported with a different verdict.
     */
    public VerifiedEntitlements toEntitlements(boolean reportedValid, String reportedError) {
        return toEntitlements().withValidity(reportedValid, reportedError);
    }
}

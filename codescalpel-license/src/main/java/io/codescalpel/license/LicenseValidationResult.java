package io.codescalpel.license;

import java.util.Set;

/**
 * Result of validating a license token locally.
 *
 * <p>{@code valid} is false whenever the signature fails, the token is malformed
 * or the token has expired. The grace flag only changes messaging: an expired
 * license never grants its tier, see {@link #effectiveTier()}.
 *
 * @param valid whether the token grants its tier
 * @param expired whether the token's {@code exp} has passed
 * @param inGracePeriod expired no more than {@link #GRACE_PERIOD_DAYS} days ago
 * @param tier tier claimed by the token (COMMUNITY when unknown)
 * @param customerId the token subject, empty when unknown
 * @param organization organization name, may be null
 * @param seats licensed seats, may be null
 * @param features feature flags claimed by the token
 * @param errorMessage why the token is not valid, null when valid
 * @param daysUntilExpiration days until {@code exp}, negative once expired, null when unknown
 * @param claims verified claims, null when the signature could not be verified
 */
public record LicenseValidationResult(
    boolean valid,
    boolean expired,
    boolean inGracePeriod,
    Tier tier,
    String customerId,
    String organization,
    Integer seats,
    Set<String> features,
    String errorMessage,
    Integer daysUntilExpiration,
    LicenseClaims claims
) {

    /**
     * Days after expiry during which the user is warned rather than told the
     * license is gone.
     */
    public static final int GRACE_PERIOD_DAYS = 7;

    public LicenseValidationResult {
        tier = tier != null ? tier : Tier.COMMUNITY;
        customerId = customerId != null ? customerId : "";
        features = features != null ? Set.copyOf(features) : Set.of();
    }

    /**
     * Tier this result actually grants.
     */
    public Tier effectiveTier() {
        return valid ? tier : Tier.COMMUNITY;
    }

    /**
     * Signature and claims verified, not expired.
     */
    public static LicenseValidationResult valid(LicenseClaims claims, int daysUntilExpiration) {
        return new LicenseValidationResult(
            true, false, false,
            claims.tier(), claims.subject(), claims.organization(), claims.seats(),
            claims.features(), null, daysUntilExpiration, claims
        );
    }

    /**
     * Signature verified but the token has expired.
     *
     * @param daysSinceExpiry whole days since expiry, rounded up
     */
    public static LicenseValidationResult expired(LicenseClaims claims, int daysSinceExpiry) {
        boolean grace = daysSinceExpiry > 0 && daysSinceExpiry <= GRACE_PERIOD_DAYS;
        String message = grace
            ? String.format("License expired %d days ago (grace period: %d days remaining)",
                daysSinceExpiry, GRACE_PERIOD_DAYS - daysSinceExpiry)
            : String.format("License expired %d days ago", daysSinceExpiry);
        return new LicenseValidationResult(
            false, true, grace,
            claims.tier(), claims.subject(), claims.organization(), claims.seats(),
            claims.features(), message, -daysSinceExpiry, claims
        );
    }

    /**
     * Token rejected: malformed, bad signature, wrong issuer or audience, etc.
     */
    public static LicenseValidationResult invalid(String errorMessage) {
        return new LicenseValidationResult(
            false, false, false, Tier.COMMUNITY, "", null, null, Set.of(),
            errorMessage, null, null
        );
    }

    /**
     * No license present. Community needs no license, so this is valid.
     */
    public static LicenseValidationResult noLicense() {
        return new LicenseValidationResult(
            true, false, false, Tier.COMMUNITY, "", null, null, Set.of(),
            null, null, null
        );
    }
}

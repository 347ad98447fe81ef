package io.codescalpel.license;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Summary of the current license, for status displays.
 *
 * @param tier licensed tier (community when nothing is licensed)
 * @param customerId customer ID, may be empty
 * @param organization organization name, may be null
 * @param features feature flags, sorted
 * @param expiresAt license expiry, null when unknown
 * @param issuedAt issue time, null when unknown
 * @param seats licensed seats, may be null
 * @param valid whether the license currently grants its tier
 * @param expired whether the license has expired
 * @param inGracePeriod expired but still within the warning window
 * @param daysUntilExpiration days until expiry, negative once expired, null when unknown
 * @param errorMessage why the license is not valid, null when valid
 * @param source "local" or "remote"
 * @param reason remote authorization reason, null in local mode
 */
public record LicenseStatus(
    Tier tier,
    String customerId,
    String organization,
    List<String> features,
    Instant expiresAt,
    Instant issuedAt,
    Integer seats,
    boolean valid,
    boolean expired,
    boolean inGracePeriod,
    Integer daysUntilExpiration,
    String errorMessage,
    String source,
    AuthorizationReason reason
) {

    public static final String SOURCE_LOCAL = "local";
    public static final String SOURCE_REMOTE = "remote";

    public LicenseStatus {
        tier = tier != null ? tier : Tier.COMMUNITY;
        customerId = customerId != null ? customerId : "";
        features = features != null ? List.copyOf(features) : List.of();
    }

    static LicenseStatus fromLocal(LicenseValidationResult result) {
        LicenseClaims claims = result.claims();
        return new LicenseStatus(
            result.tier(),
            result.customerId(),
            result.organization(),
            sorted(result.features()),
            claims != null ? claims.expiresAt() : null,
            claims != null ? claims.issuedAt() : null,
            result.seats(),
            result.valid(),
            result.expired(),
            result.inGracePeriod(),
            result.daysUntilExpiration(),
            result.errorMessage(),
            SOURCE_LOCAL,
            null
        );
    }

    static LicenseStatus fromRemote(AuthorizationDecision decision, Instant now) {
        VerifiedEntitlements ent = decision.entitlements();
        if (ent == null) {
            return new LicenseStatus(
                Tier.COMMUNITY, "", null, List.of(), null, null, null,
                false, false, false, null,
                "Remote verification unavailable", SOURCE_REMOTE, decision.reason()
            );
        }
        Instant expiresAt = ent.exp() > 0 ? Instant.ofEpochSecond(ent.exp()) : null;
        Integer days = expiresAt != null ? (int) ChronoUnit.DAYS.between(now, expiresAt) : null;
        String error = decision.allowed() ? null : (ent.error() != null ? ent.error() : decision.reason().wireName());
        return new LicenseStatus(
            ent.tier(),
            ent.customerId(),
            ent.organization(),
            sorted(ent.features()),
            expiresAt,
            null,
            ent.seats(),
            decision.allowed(),
            ent.isExpiredAt(now),
            false,
            days,
            error,
            SOURCE_REMOTE,
            decision.reason()
        );
    }

    private static List<String> sorted(Collection<String> features) {
        Set<String> set = new TreeSet<>(features);
        return List.copyOf(set);
    }
}

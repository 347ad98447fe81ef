package io.codescalpel.license;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Claims carried by a signed license token.
 *
 * <p>Only produced after the token's signature has been verified.
 *
 * @param issuer the {@code iss} claim
 * @param audience the {@code aud} claim values
 * @param subject the {@code sub} claim, which is the customer ID
 * @param jti the token ID, may be null
 * @param tier the licensed tier
 * @param features feature flags granted beyond the tier defaults
 * @param organization organization name, may be null
 * @param seats licensed seats, may be null
 * @param issuedAt the {@code iat} claim
 * @param expiresAt the {@code exp} claim
 */
public record LicenseClaims(
    String issuer,
    List<String> audience,
    String subject,
    String jti,
    Tier tier,
    Set<String> features,
    String organization,
    Integer seats,
    Instant issuedAt,
    Instant expiresAt
) {

    public LicenseClaims {
        audience = audience != null ? List.copyOf(audience) : List.of();
        features = features != null ? Set.copyOf(features) : Set.of();
    }

    public String customerId() {
        return subject;
    }
}

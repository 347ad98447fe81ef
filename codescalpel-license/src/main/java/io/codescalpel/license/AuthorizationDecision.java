package io.codescalpel.license;

/**
 * Result of authorizing a license token.
 *
 * @param allowed whether the token's entitlements may be used
 * @param entitlements entitlements behind the decision, null if nothing is known about the token
 * @param reason why the decision was made
 */
public record AuthorizationDecision(
    boolean allowed,
    VerifiedEntitlements entitlements,
    AuthorizationReason reason
) {

    public static AuthorizationDecision allowed(VerifiedEntitlements entitlements, AuthorizationReason reason) {
        return new AuthorizationDecision(true, entitlements, reason);
    }

    public static AuthorizationDecision denied(VerifiedEntitlements entitlements, AuthorizationReason reason) {
        return new AuthorizationDecision(false, entitlements, reason);
    }

    /**
     * Tier this decision grants: the entitled tier when allowed, community otherwise.
     */
    public Tier authorizedTier() {
        return allowed && entitlements != null ? entitlements.tier() : Tier.COMMUNITY;
    }
}

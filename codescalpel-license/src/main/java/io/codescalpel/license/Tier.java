package io.codescalpel.license;

import java.util.Locale;

/**
 * Code Scalpel feature tiers.
 *
 * <p>Tiers are ordered: a higher rank grants a superset of the capabilities of
 * every lower rank. The capability tables themselves live outside this module and
 * are indexed by {@link #wireName()}.
 */
public enum Tier {

    /**
     * Free tier - no license required.
     */
    COMMUNITY("community", "Community", 0),

    /**
     * Pro - individual developers and small teams.
     */
    PRO("pro", "Pro", 1),

    /**
     * Enterprise - organization-wide features.
     */
    ENTERPRISE("enterprise", "Enterprise", 2);

    private final String wireName;
    private final String displayName;
    private final int rank;

    Tier(String wireName, String displayName, int rank) {
        this.wireName = wireName;
        this.displayName = displayName;
        this.rank = rank;
    }

    /**
     * Lower-case name used in tokens, the verifier protocol and the cache file.
     */
    public String wireName() {
        return wireName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isPaid() {
        return this != COMMUNITY;
    }

    public boolean isAtLeast(Tier other) {
        return rank >= other.rank;
    }

    /**
     * Return the lower of two tiers.
     */
    public static Tier min(Tier a, Tier b) {
        return a.rank <= b.rank ? a : b;
    }

    /**
     * Parse a tier name, accepting the legacy aliases {@code free} and {@code all}.
     *
     * @param value tier name in any case, may be null
     * @return the tier, or null if the value is blank or not a known tier
     */
    public static Tier normalize(String value) {
        if (value == null) {
            return null;
        }
        String v = value.strip().toLowerCase(Locale.ROOT);
        if (v.isEmpty()) {
            return null;
        }
        return switch (v) {
            case "community", "free" -> COMMUNITY;
            case "pro" -> PRO;
            case "enterprise", "all" -> ENTERPRISE;
            default -> null;
        };
    }

    /**
     * Parse a tier name coming from a license or verifier, resolving anything
     * unrecognised to {@link #COMMUNITY}.
     */
    public static Tier fromClaim(String value) {
        Tier tier = normalize(value);
        return tier != null ? tier : COMMUNITY;
    }

    @Override
    public String toString() {
        return wireName;
    }
}

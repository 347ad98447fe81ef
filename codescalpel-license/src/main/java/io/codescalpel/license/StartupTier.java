package io.codescalpel.license;

/**
 * Tier a process runs at, decided once at startup.
 *
 * @param tier the effective tier
 * @param warning message for the operator (e.g. license revoked), null if none
 */
public record StartupTier(Tier tier, String warning) {

    public static StartupTier of(Tier tier) {
        return new StartupTier(tier, null);
    }

    public boolean hasWarning() {
        return warning != null;
    }
}

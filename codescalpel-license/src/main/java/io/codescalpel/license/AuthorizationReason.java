package io.codescalpel.license;

/**
 * Why an authorization decision was made.
 */
public enum AuthorizationReason {

    /** The verifier was called and answered. */
    REMOTE_VERIFIED("remote_verified"),

    /** A recent verification of the same token was reused without a network call. */
    CACHE_FRESH("cache_fresh"),

    /** The verifier was unreachable; a recent valid verification of the same token was honoured. */
    OFFLINE_GRACE("offline_grace"),

    /** The license has expired. */
    LICENSE_EXPIRED("license_expired"),

    /** The verifier was unreachable and no cached verification could be honoured. */
    OFFLINE_DENIED("offline_denied");

    private final String wireName;

    AuthorizationReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}

package io.codescalpel.license;

/**
 * A paid tier was requested at startup but no license substantiates it.
 *
 * <p>The startup path should print the message and exit with a non-zero status.
 */
public class LicenseStartupException extends RuntimeException {

    private final Tier requestedTier;
    private final String reason;

    public LicenseStartupException(Tier requestedTier, String reason) {
        super(String.format(
            "Tier '%s' was requested but is not licensed: %s. Get a license at %s",
            requestedTier.wireName(), reason, LicenseConfig.PURCHASE_URL));
        this.requestedTier = requestedTier;
        this.reason = reason;
    }

    public Tier getRequestedTier() {
        return requestedTier;
    }

    public String getReason() {
        return reason;
    }
}

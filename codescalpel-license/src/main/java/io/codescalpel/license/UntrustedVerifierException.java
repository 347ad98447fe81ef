package io.codescalpel.license;

/**
 * The configured verifier URL is not on the trusted list or does not use HTTP(S).
 *
 * <p>A verifier that is not ours could approve every token at any tier, so this is
 * a configuration error rather than a per-request failure.
 */
public class UntrustedVerifierException extends LicenseConfigurationException {

    private final String url;

    public UntrustedVerifierException(String url, String message) {
        super(message);
        this.url = url;
    }

    /**
     * The rejected URL.
     */
    public String getUrl() {
        return url;
    }
}

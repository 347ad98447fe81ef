package io.codescalpel.license;

/**
 * Licensing is configured in a way that cannot be used safely.
 *
 * <p>Raised while configuration is being built, before any license is checked.
 */
public class LicenseConfigurationException extends RuntimeException {

    public LicenseConfigurationException(String message) {
        super(message);
    }

    public LicenseConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

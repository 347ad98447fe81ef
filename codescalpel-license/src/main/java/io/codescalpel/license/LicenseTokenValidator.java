package io.codescalpel.license;

/**
 * Validates a license token without side effects.
 *
 * <p>Implementations must never throw for malformed or empty input; problems are
 * reported through {@link LicenseValidationResult#errorMessage()}.
 */
@FunctionalInterface
public interface LicenseTokenValidator {

    /**
     * Validate a license token.
     *
     * @param token the compact token, may be null or blank
     * @return the validation result, never null
     */
    LicenseValidationResult validateToken(String token);
}

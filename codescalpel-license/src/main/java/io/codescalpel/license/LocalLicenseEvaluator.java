package io.codescalpel.license;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.logging.Logger;

/**
 * Determines the current tier from a license file, without a remote verifier.
 *
 * <p>License file locations, in priority order:
 * <ol>
 *   <li>{@link LicenseConfig#ENV_LICENSE_PATH}</li>
 *   <li>{@code <project root>/.scalpel-license}</li>
 *   <li>{@code <config home>/code-scalpel/license}</li>
 *   <li>{@code /etc/code-scalpel/license}</li>
 * </ol>
 * Locations 2 to 4 are skipped when discovery is disabled.
 *
 * <p>Validation results are kept for up to {@link #REVALIDATION_TTL}, keyed by the
 * license file's path and a hash of its content. Any change to the file forces a
 * fresh validation, and a cached valid result is never served past the license's
 * own expiry.
 */
public class LocalLicenseEvaluator {

    private static final Logger LOG = Logger.getLogger(LocalLicenseEvaluator.class.getName());

    public static final Duration REVALIDATION_TTL = Duration.ofHours(24);

    static final String PROJECT_LICENSE_FILE = ".scalpel-license";
    static final Path SYSTEM_LICENSE_FILE = Path.of("/etc", "code-scalpel", "license");

    private final LicenseConfig config;
    private final LicenseTokenValidator validator;
    private final Clock clock;

    private final Object lock = new Object();
    private CachedValidation cached;

    public LocalLicenseEvaluator(LicenseConfig config, LicenseTokenValidator validator, Clock clock) {
        this.config = config;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Find the license file to use.
     *
     * @return the first existing candidate, or null if there is none
     */
    public Path findLicenseFile() {
        for (Path candidate : candidates()) {
            if (Files.isRegularFile(candidate)) {
                LOG.fine("Found license file: " + candidate);
                return candidate;
            }
        }
        LOG.fine("No license file found");
        return null;
    }

    /**
     * Load the license token from the license file.
     *
     * @return the stripped token, or null if no readable, non-empty license file exists
     */
    public String loadLicenseToken() {
        Path file = findLicenseFile();
        if (file == null) {
            return null;
        }
        try {
            String token = Files.readString(file, StandardCharsets.UTF_8).strip();
            return token.isEmpty() ? null : token;
        } catch (IOException e) {
            LOG.warning("Failed to read license file " + file + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Validate the current license file.
     *
     * <p>Returns {@link LicenseValidationResult#noLicense()} when there is no license.
     */
    public LicenseValidationResult validate() {
        Path file = findLicenseFile();
        if (file == null) {
            return LicenseValidationResult.noLicense();
        }

        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            LOG.warning("Failed to read license file " + file + ": " + e.getMessage());
            return LicenseValidationResult.invalid("Failed to read license file");
        }

        String fingerprint = fingerprint(content);
        Instant now = clock.instant();

        synchronized (lock) {
            if (cached != null && cached.isUsable(file, fingerprint, now)) {
                return cached.result();
            }
        }

        String token = new String(content, StandardCharsets.UTF_8).strip();
        LicenseValidationResult result = token.isEmpty()
            ? LicenseValidationResult.invalid("License file is empty")
            : validator.validateToken(token);

        synchronized (lock) {
            cached = new CachedValidation(file, fingerprint, now, result);
        }
        return result;
    }

    /**
     * Tier granted by the current license file.
     *
     * <p>Expired licenses resolve to community, including during the grace period.
     */
    public Tier getCurrentTier() {
        LicenseValidationResult result = validate();
        if (result.valid()) {
            return result.tier();
        }
        if (result.inGracePeriod()) {
            LOG.warning("License expired " + Math.abs(result.daysUntilExpiration())
                + " days ago. Running as community; renew at " + LicenseConfig.PURCHASE_URL);
        } else {
            LOG.info("Defaulting to community tier: " + result.errorMessage());
        }
        return Tier.COMMUNITY;
    }

    /**
     * Drop the cached validation so the next call re-verifies.
     */
    public void invalidate() {
        synchronized (lock) {
            cached = null;
        }
    }

    private List<Path> candidates() {
        List<Path> paths = new ArrayList<>();
        if (config.licensePath() != null) {
            paths.add(config.licensePath());
        }
        if (!config.licenseDiscoveryDisabled()) {
            if (config.projectRoot() != null) {
                paths.add(config.projectRoot().resolve(PROJECT_LICENSE_FILE));
            }
            paths.add(config.configHome().resolve("code-scalpel").resolve("license"));
            paths.add(SYSTEM_LICENSE_FILE);
        }
        return paths;
    }

    private static String fingerprint(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record CachedValidation(Path file, String fingerprint, Instant validatedAt, LicenseValidationResult result) {

        boolean isUsable(Path currentFile, String currentFingerprint, Instant now) {
            if (!file.equals(currentFile) || !fingerprint.equals(currentFingerprint)) {
                return false;
            }
            if (now.isBefore(validatedAt) || !now.isBefore(validatedAt.plus(REVALIDATION_TTL))) {
                return false;
            }
            // A valid result must not outlive the license itself.
            LicenseClaims claims = result.claims();
            return !(result.valid() && claims != null && !now.isBefore(claims.expiresAt()));
        }
    }
}

package io.codescalpel.license;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Configuration for Code Scalpel licensing.
 *
 * <p>An immutable snapshot read from environment variables. Production code uses
 * {@link #fromEnvironment()}; tests build one from a map with {@link #from(Map, Path)}.
 *
 * <p>Building a configuration validates the verifier URL. An untrusted verifier
 * fails here, before any license is checked or any request is sent.
 */
public final class LicenseConfig {

    private static final Logger LOG = Logger.getLogger(LicenseConfig.class.getName());

    /**
     * Remote verifier base URL. Unset means local (offline) validation only.
     */
    public static final String ENV_VERIFIER_URL = "CODE_SCALPEL_LICENSE_VERIFIER_URL";

    /**
     * Environment tag sent to the verifier (e.g. "production", "ci").
     */
    public static final String ENV_VERIFIER_ENVIRONMENT = "CODE_SCALPEL_LICENSE_ENVIRONMENT";

    /**
     * Override for the persisted verification cache file.
     */
    public static final String ENV_CACHE_PATH = "CODE_SCALPEL_LICENSE_CACHE_PATH";

    /**
     * Per-attempt verifier timeout, in (fractional) seconds.
     */
    public static final String ENV_VERIFY_TIMEOUT_SECONDS = "CODE_SCALPEL_LICENSE_VERIFY_TIMEOUT_SECONDS";

    /**
     * Number of verifier retries after the first attempt.
     */
    public static final String ENV_VERIFY_RETRIES = "CODE_SCALPEL_LICENSE_VERIFY_RETRIES";

    /**
     * Explicit license file path.
     */
    public static final String ENV_LICENSE_PATH = "CODE_SCALPEL_LICENSE_PATH";

    /**
     * Set to "1" to skip well-known license file locations.
     */
    public static final String ENV_DISABLE_LICENSE_DISCOVERY = "CODE_SCALPEL_DISABLE_LICENSE_DISCOVERY";

    /**
     * HS256 shared secret (development only).
     */
    public static final String ENV_SECRET_KEY = "CODE_SCALPEL_SECRET_KEY";

    /**
     * Opt-in for HS256 license tokens.
     */
    public static final String ENV_ALLOW_HS256 = "CODE_SCALPEL_ALLOW_HS256";

    /**
     * PEM-encoded RSA public key overriding the bundled one.
     */
    public static final String ENV_PUBLIC_KEY = "CODE_SCALPEL_LICENSE_PUBLIC_KEY";

    /**
     * Requested tier. Can only lower the licensed tier.
     */
    public static final String ENV_TIER = "CODE_SCALPEL_TIER";

    /**
     * Legacy alias for {@link #ENV_TIER}.
     */
    public static final String ENV_TIER_LEGACY = "SCALPEL_TIER";

    /**
     * Forces enterprise at startup, bypassing license checks.
     */
    public static final String ENV_TIER_UNIFICATION_OVERRIDE = "CODE_SCALPEL_TIER_UNIFICATION_OVERRIDE";

    /**
     * Upgrade URL for license purchase.
     */
    public static final String PURCHASE_URL = "https://codescalpel.dev/pricing";

    public static final Duration DEFAULT_VERIFY_TIMEOUT = Duration.ofMillis(2000);
    public static final int DEFAULT_VERIFY_RETRIES = 2;

    private static final Duration MIN_VERIFY_TIMEOUT = Duration.ofMillis(100);

    private final VerifierEndpoint verifierEndpoint;
    private final String verifierEnvironment;
    private final Path cachePath;
    private final Duration verifyTimeout;
    private final int verifyRetries;
    private final Path licensePath;
    private final boolean licenseDiscoveryDisabled;
    private final String secretKey;
    private final boolean allowHs256;
    private final String publicKeyPem;
    private final Tier requestedTier;
    private final boolean tierUnificationOverride;
    private final Path configHome;
    private final Path projectRoot;

    private LicenseConfig(Map<String, String> env, Path projectRoot) {
        String home = System.getProperty("user.home");
        this.projectRoot = projectRoot;
        this.configHome = resolveConfigHome(env.get("XDG_CONFIG_HOME"), home);

        String verifierUrl = trimToNull(env.get(ENV_VERIFIER_URL));
        this.verifierEndpoint = verifierUrl != null ? VerifierEndpoint.of(verifierUrl) : null;
        this.verifierEnvironment = trimToNull(env.get(ENV_VERIFIER_ENVIRONMENT));

        String cacheOverride = trimToNull(env.get(ENV_CACHE_PATH));
        this.cachePath = cacheOverride != null
            ? expandHome(cacheOverride, home)
            : configHome.resolve("code-scalpel").resolve("license_cache.json");

        this.verifyTimeout = parseTimeout(env.get(ENV_VERIFY_TIMEOUT_SECONDS));
        this.verifyRetries = parseRetries(env.get(ENV_VERIFY_RETRIES));

        String licenseOverride = trimToNull(env.get(ENV_LICENSE_PATH));
        this.licensePath = licenseOverride != null ? expandHome(licenseOverride, home) : null;
        this.licenseDiscoveryDisabled = "1".equals(trimToNull(env.get(ENV_DISABLE_LICENSE_DISCOVERY)));

        this.secretKey = trimToNull(env.get(ENV_SECRET_KEY));
        this.allowHs256 = isTruthy(env.get(ENV_ALLOW_HS256));
        this.publicKeyPem = trimToNull(env.get(ENV_PUBLIC_KEY));

        String requested = trimToNull(env.get(ENV_TIER));
        if (requested == null) {
            requested = trimToNull(env.get(ENV_TIER_LEGACY));
        }
        this.requestedTier = Tier.normalize(requested);
        if (requested != null && requestedTier == null) {
            LOG.warning("Ignoring unknown requested tier '" + requested + "'");
        }

        this.tierUnificationOverride = isTruthy(env.get(ENV_TIER_UNIFICATION_OVERRIDE));
    }

    /**
     * Read configuration from the process environment.
     *
     * @throws UntrustedVerifierException if the verifier URL is not trusted
     */
    public static LicenseConfig fromEnvironment() {
        return from(System.getenv(), Path.of(System.getProperty("user.dir")));
    }

    /**
     * Build configuration from an explicit variable map.
     *
     * @param env variable name to value
     * @param projectRoot directory searched for the project license file
     * @throws UntrustedVerifierException if the verifier URL is not trusted
     */
    public static LicenseConfig from(Map<String, String> env, Path projectRoot) {
        return new LicenseConfig(env, projectRoot);
    }

    /**
     * Whether a remote verifier is configured. When it is, the verifier is the
     * authority on license validity.
     */
    public boolean remoteVerifierConfigured() {
        return verifierEndpoint != null;
    }

    /**
     * The trusted verifier, or null when running in local mode.
     */
    public VerifierEndpoint verifierEndpoint() {
        return verifierEndpoint;
    }

    public String verifierEnvironment() {
        return verifierEnvironment;
    }

    public Path cachePath() {
        return cachePath;
    }

    public Duration verifyTimeout() {
        return verifyTimeout;
    }

    public int verifyRetries() {
        return verifyRetries;
    }

    /**
     * Explicit license file, or null.
     */
    public Path licensePath() {
        return licensePath;
    }

    public boolean licenseDiscoveryDisabled() {
        return licenseDiscoveryDisabled;
    }

    public String secretKey() {
        return secretKey;
    }

    public boolean allowHs256() {
        return allowHs256;
    }

    public String publicKeyPem() {
        return publicKeyPem;
    }

    /**
     * Tier requested through {@link #ENV_TIER}, or null.
     */
    public Tier requestedTier() {
        return requestedTier;
    }

    public boolean tierUnificationOverride() {
        return tierUnificationOverride;
    }

    /**
     * Base directory for user configuration ({@code $XDG_CONFIG_HOME} or {@code ~/.config}).
     */
    public Path configHome() {
        return configHome;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    private static Path resolveConfigHome(String xdg, String home) {
        String value = trimToNull(xdg);
        if (value != null) {
            return expandHome(value, home);
        }
        return Path.of(home, ".config");
    }

    private static Duration parseTimeout(String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return DEFAULT_VERIFY_TIMEOUT;
        }
        try {
            double seconds = Double.parseDouble(value);
            if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                return DEFAULT_VERIFY_TIMEOUT;
            }
            Duration timeout = Duration.ofMillis(Math.round(seconds * 1000));
            return timeout.compareTo(MIN_VERIFY_TIMEOUT) < 0 ? MIN_VERIFY_TIMEOUT : timeout;
        } catch (NumberFormatException e) {
            LOG.warning("Invalid " + ENV_VERIFY_TIMEOUT_SECONDS + "='" + value + "', using default");
            return DEFAULT_VERIFY_TIMEOUT;
        }
    }

    private static int parseRetries(String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return DEFAULT_VERIFY_RETRIES;
        }
        try {
            return Math.max(0, Integer.parseInt(value));
        } catch (NumberFormatException e) {
            LOG.warning("Invalid " + ENV_VERIFY_RETRIES + "='" + value + "', using default");
            return DEFAULT_VERIFY_RETRIES;
        }
    }

    private static Path expandHome(String path, String home) {
        if (path.equals("~")) {
            return Path.of(home);
        }
        if (path.startsWith("~/")) {
            return Path.of(home, path.substring(2));
        }
        return Path.of(path);
    }

    private static boolean isTruthy(String raw) {
        String value = trimToNull(raw);
        return value != null && (value.equals("1") || value.equalsIgnoreCase("true"));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String v = value.strip();
        return v.isEmpty() ? null : v;
    }
}

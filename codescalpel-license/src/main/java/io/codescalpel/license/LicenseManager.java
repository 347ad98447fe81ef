package io.codescalpel.license;

import java.time.Clock;
import java.util.logging.Logger;

/**
 * Main entry point for Code Scalpel licensing.
 *
 * <p>Usage:
 * <pre>{@code
 * LicenseManager license = LicenseManager.getInstance();
 *
 * // Once, at startup
 * StartupTier startup = license.computeEffectiveTierForStartup();
 * if (startup.hasWarning()) {
 *     System.err.println(startup.warning());
 * }
 *
 * // Before a privileged operation
 * Tier tier = license.getCurrentTier();
 * }</pre>
 *
 * <p>When {@link LicenseConfig#ENV_VERIFIER_URL} is set the remote verifier is the
 * authority; otherwise the license file is validated offline with the bundled key.
 */
public class LicenseManager {

    private static final Logger LOG = Logger.getLogger(LicenseManager.class.getName());

    private static volatile LicenseManager instance;

    private final LicenseConfig config;
    private final LocalLicenseEvaluator local;
    private final LicenseAuthorizer authorizer;
    private final TierResolver resolver;
    private final Clock clock;

    public LicenseManager(LicenseConfig config) {
        this(config, Clock.systemUTC());
    }

    public LicenseManager(LicenseConfig config, Clock clock) {
        this(
            config,
            new LocalLicenseEvaluator(config, JwtLicenseValidator.fromConfig(config, clock), clock),
            config.remoteVerifierConfigured()
                ? new LicenseAuthorizer(
                    RemoteLicenseVerifier.fromConfig(config),
                    new VerificationCache(config.cachePath(), clock),
                    config.verifierEnvironment(),
                    clock)
                : null,
            clock
        );
    }

    /**
     * @param authorizer remote authorization, null for local-only validation
     */
    public LicenseManager(LicenseConfig config, LocalLicenseEvaluator local, LicenseAuthorizer authorizer, Clock clock) {
        this.config = config;
        this.local = local;
        this.authorizer = authorizer;
        this.resolver = new TierResolver(config, local, authorizer);
        this.clock = clock;
    }

    /**
     * Get the singleton instance, configured from the process environment.
     *
     * @throws UntrustedVerifierException if the configured verifier URL is not trusted
     */
    public static LicenseManager getInstance() {
        if (instance == null) {
            synchronized (LicenseManager.class) {
                if (instance == null) {
                    instance = new LicenseManager(LicenseConfig.fromEnvironment());
                }
            }
        }
        return instance;
    }

    /**
     * Reset the singleton (for testing).
     */
    static void resetInstance() {
        synchronized (LicenseManager.class) {
            instance = null;
        }
    }

    public boolean isRemoteVerification() {
        return authorizer != null;
    }

    /**
     * Tier for a privileged operation: the licensed tier, lowered to the requested
     * tier when one is configured.
     */
    public Tier getCurrentTier() {
        return resolver.currentTier(config.requestedTier());
    }

    /**
     * Decide the process tier from the configured requested tier.
     *
     * @throws LicenseStartupException if a paid tier was requested without a license proving it
     */
    public StartupTier computeEffectiveTierForStartup() {
        return computeEffectiveTierForStartup(config.requestedTier());
    }

    /**
     * Decide the process tier.
     *
     * @param requestedTier tier asked for, null to run at whatever is licensed
     * @throws LicenseStartupException if a paid tier was requested without a license proving it
     */
    public StartupTier computeEffectiveTierForStartup(Tier requestedTier) {
        StartupTier startup = resolver.computeEffectiveTierForStartup(requestedTier);
        LOG.info("Running as " + startup.tier().getDisplayName());
        return startup;
    }

    /**
     * Describe the current license.
     */
    public LicenseStatus getLicenseInfo() {
        if (authorizer != null) {
            String token = local.loadLicenseToken();
            if (token == null) {
                return LicenseStatus.fromLocal(LicenseValidationResult.noLicense());
            }
            return LicenseStatus.fromRemote(authorizer.authorizeToken(token), clock.instant());
        }
        return LicenseStatus.fromLocal(local.validate());
    }

    /**
     * Re-verify the license with the remote verifier, ignoring cache age. In local
     * mode this forces the license file to be validated again.
     *
     * @return true if the license was verified
     */
    public boolean refreshCache() {
        if (authorizer == null) {
            local.invalidate();
            return local.validate().valid();
        }
        String token = local.loadLicenseToken();
        if (token == null) {
            return false;
        }
        RemoteVerificationResult result = authorizer.refreshCache(token);
        if (!result.succeeded()) {
            LOG.warning("License refresh failed: " + result.message());
        }
        return result.succeeded();
    }
}

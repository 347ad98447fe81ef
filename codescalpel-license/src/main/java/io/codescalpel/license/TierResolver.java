package io.codescalpel.license;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Turns license state into the tier a process or operation runs at.
 *
 * <p>With a remote verifier configured, the verifier (through {@link LicenseAuthorizer})
 * is the authority. Otherwise the local license file is validated offline.
 *
 * <p>A requested tier can only lower the licensed tier. Revocation drops to
 * community with a warning. Requesting a paid tier at startup without a license
 * that proves it is fatal.
 */
public class TierResolver {

    private static final Logger LOG = Logger.getLogger(TierResolver.class.getName());

    private final LicenseConfig config;
    private final LocalLicenseEvaluator local;
    private final LicenseAuthorizer authorizer;

    /**
     * @param config licensing configuration
     * @param local license file discovery and offline validation
     * @param authorizer remote authorization, null when no verifier is configured
     */
    public TierResolver(LicenseConfig config, LocalLicenseEvaluator local, LicenseAuthorizer authorizer) {
        this.config = config;
        this.local = local;
        this.authorizer = authorizer;
    }

    /**
     * Decide the tier to run at for the lifetime of the process.
     *
     * @param requestedTier tier asked for on the command line or in the environment, may be null
     * @return the effective tier and an optional warning for the operator
     * @throws LicenseStartupException if a paid tier was requested and cannot be substantiated
     */
    public StartupTier computeEffectiveTierForStartup(Tier requestedTier) {
        if (config.tierUnificationOverride()) {
            String warning = "Tier unification override is enabled: license checks are bypassed and all "
                + "enterprise features are available";
            LOG.warning(warning);
            return new StartupTier(Tier.ENTERPRISE, warning);
        }

        LicenseState state = evaluate();

        if (state.revoked()) {
            String warning = "License revoked (" + state.detail() + "). Running as community. "
                + "Contact support or get a new license at " + LicenseConfig.PURCHASE_URL;
            LOG.warning(warning);
            return new StartupTier(Tier.COMMUNITY, warning);
        }

        if (requestedTier == null) {
            if (state.detail() != null && state.licensed() == Tier.COMMUNITY && state.licensePresent()) {
                String warning = "License not accepted (" + state.detail() + "). Running as community.";
                LOG.warning(warning);
                return new StartupTier(Tier.COMMUNITY, warning);
            }
            return StartupTier.of(state.licensed());
        }

        if (requestedTier.isPaid() && !state.licensed().isPaid()) {
            String reason = state.detail() != null ? state.detail() : "no paid license found";
            throw new LicenseStartupException(requestedTier, reason);
        }

        Tier effective = Tier.min(requestedTier, state.licensed());
        if (effective != requestedTier) {
            String warning = "Requested tier '" + requestedTier + "' exceeds the licensed tier '"
                + state.licensed() + "'. Running as " + effective + ".";
            LOG.warning(warning);
            return new StartupTier(effective, warning);
        }
        return StartupTier.of(effective);
    }

    /**
     * Tier for a privileged operation, clamped by the requested tier.
     *
     * @param requestedTier tier asked for, may be null
     */
    public Tier currentTier(Tier requestedTier) {
        Tier licensed = evaluate().licensed();
        return requestedTier != null ? Tier.min(requestedTier, licensed) : licensed;
    }

    /**
     * Evaluate the current license against whichever authority is configured.
     */
    LicenseState evaluate() {
        String token = local.loadLicenseToken();
        if (authorizer != null) {
            if (token == null) {
                return new LicenseState(Tier.COMMUNITY, false, false, "no license found");
            }
            AuthorizationDecision decision = authorizer.authorizeToken(token);
            VerifiedEntitlements ent = decision.entitlements();
            if (decision.allowed()) {
                return new LicenseState(decision.authorizedTier(), false, true, null);
            }
            if (ent != null && ent.isRevoked()) {
                return new LicenseState(Tier.COMMUNITY, true, true, ent.error());
            }
            String detail = ent != null && ent.error() != null
                ? decision.reason() + ": " + ent.error()
                : decision.reason().wireName();
            return new LicenseState(Tier.COMMUNITY, false, true, detail);
        }

        LicenseValidationResult result = local.validate();
        if (token == null && result.valid()) {
            return new LicenseState(Tier.COMMUNITY, false, false, "no license found");
        }
        if (result.valid()) {
            return new LicenseState(result.tier(), false, true, null);
        }
        String error = result.errorMessage() != null ? result.errorMessage() : "license invalid";
        boolean revoked = error.toLowerCase(Locale.ROOT).contains("revoked");
        return new LicenseState(Tier.COMMUNITY, revoked, true, error);
    }

    /**
     * What the configured authority proves about the current license.
     *
     * @param licensed tier the license proves (community if none)
     * @param revoked the license was revoked
     * @param licensePresent a license token was found
     * @param detail why no paid tier is proven, null when the license is accepted
     */
    record LicenseState(Tier licensed, boolean revoked, boolean licensePresent, String detail) {
    }
}

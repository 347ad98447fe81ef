package io.codescalpel.license;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Validates signed JWT license tokens offline.
 *
 * <p>Token claims:
 * <pre>{@code
 * {
 *   "iss": "code-scalpel-licensing",
 *   "aud": "code-scalpel",
 *   "sub": "customer_id_12345",
 *   "jti": "lic_8f2c...",
 *   "tier": "pro",
 *   "features": ["cognitive_complexity", "context_aware_scanning"],
 *   "organization": "Acme Corp",
 *   "seats": 10,
 *   "iat": 1704153600,
 *   "exp": 1735689600
 * }
 * }</pre>
 *
 * <p>RS256 is the production mode: licenses are signed offline and verified here
 * against a public key. HS256 exists for development and is rejected unless
 * {@link LicenseConfig#ENV_ALLOW_HS256} is set, so a development secret can never
 * unlock paid tiers in a release build by accident.
 *
 * <p>The signature is checked before any temporal claim, so a tampered token is
 * always reported as a signature failure, never as expired.
 */
public class JwtLicenseValidator implements LicenseTokenValidator {

    private static final Logger LOG = Logger.getLogger(JwtLicenseValidator.class.getName());

    public static final String DEFAULT_ISSUER = "code-scalpel-licensing";
    public static final String DEFAULT_AUDIENCE = "code-scalpel";

    /**
     * Classpath location of the public key matching the offline license signer.
     */
    public static final String BUNDLED_PUBLIC_KEY_RESOURCE = "/license-public-key.pem";

    private static final List<String> REQUIRED_CLAIMS = List.of("tier", "exp", "iat", "sub");
    private static final Duration NOT_BEFORE_LEEWAY = Duration.ofSeconds(60);
    private static final long SECONDS_PER_DAY = 24 * 3600;

    private final RSAPublicKey publicKey;
    private final String secretKey;
    private final boolean allowHs256;
    private final String issuer;
    private final String audience;
    private final Clock clock;

    /**
     * Create a validator with explicit keys.
     *
     * @param publicKey RS256 verification key, may be null (RS256 tokens are then rejected)
     * @param secretKey HS256 secret, may be null
     * @param allowHs256 whether HS256 tokens may be accepted at all
     * @param clock time source for expiry checks
     */
    public JwtLicenseValidator(RSAPublicKey publicKey, String secretKey, boolean allowHs256, Clock clock) {
        this(publicKey, secretKey, allowHs256, DEFAULT_ISSUER, DEFAULT_AUDIENCE, clock);
    }

    public JwtLicenseValidator(
            RSAPublicKey publicKey,
            String secretKey,
            boolean allowHs256,
            String issuer,
            String audience,
            Clock clock) {
        this.publicKey = publicKey;
        this.secretKey = secretKey;
        this.allowHs256 = allowHs256;
        this.issuer = issuer;
        this.audience = audience;
        this.clock = clock;
    }

    /**
     * Create a validator from configuration.
     *
     * <p>Uses the PEM key from {@link LicenseConfig#publicKeyPem()} when set,
     * otherwise the bundled key.
     *
     * @throws LicenseConfigurationException if a configured public key cannot be parsed
     */
    public static JwtLicenseValidator fromConfig(LicenseConfig config, Clock clock) {
        RSAPublicKey key = config.publicKeyPem() != null
            ? parsePublicKeyPem(config.publicKeyPem())
            : loadBundledPublicKey();
        if (config.allowHs256()) {
            LOG.warning("HS256 license tokens are enabled. This mode is for development only.");
        }
        return new JwtLicenseValidator(key, config.secretKey(), config.allowHs256(), clock);
    }

    @Override
    public LicenseValidationResult validateToken(String token) {
        if (token == null || token.isBlank()) {
            return LicenseValidationResult.invalid("License token is empty");
        }

        DecodedJWT jwt;
        try {
            jwt = JWT.decode(token.strip());
        } catch (JWTDecodeException e) {
            LOG.warning("License token could not be decoded (token=" + LicenseTokens.hintFor(token) + ")");
            return LicenseValidationResult.invalid("Invalid token format: not a well-formed JWT");
        }

        JwtAlgorithm alg = JwtAlgorithm.fromHeader(jwt.getAlgorithm());
        if (alg == null) {
            LOG.warning("Rejected license token with unsupported algorithm " + jwt.getAlgorithm());
            return LicenseValidationResult.invalid("Unsupported token algorithm: " + jwt.getAlgorithm());
        }

        Algorithm verifier;
        switch (alg) {
            case RS256 -> {
                if (publicKey == null) {
                    return LicenseValidationResult.invalid("RS256 token requires a configured public key");
                }
                verifier = Algorithm.RSA256(publicKey, (RSAPrivateKey) null);
            }
            case HS256 -> {
                if (!allowHs256) {
                    LOG.warning("Rejected HS256 license token: HS256 is disabled");
                    return LicenseValidationResult.invalid(
                        "HS256 tokens are disabled; set " + LicenseConfig.ENV_ALLOW_HS256
                            + "=1 to allow them in development");
                }
                if (secretKey == null || secretKey.isBlank()) {
                    return LicenseValidationResult.invalid(
                        "HS256 token requires " + LicenseConfig.ENV_SECRET_KEY);
                }
                verifier = Algorithm.HMAC256(secretKey);
            }
            default -> throw new IllegalStateException("Unhandled algorithm " + alg);
        }

        try {
            verifier.verify(jwt);
        } catch (JWTVerificationException e) {
            LOG.warning("License signature verification failed (alg=" + alg
                + ", token=" + LicenseTokens.hintFor(token) + ")");
            return LicenseValidationResult.invalid("Invalid signature - license may be tampered");
        }

        for (String name : REQUIRED_CLAIMS) {
            Claim claim = jwt.getClaim(name);
            if (claim.isMissing() || claim.isNull()) {
                return LicenseValidationResult.invalid("Missing required claim: " + name);
            }
        }

        if (!issuer.equals(jwt.getIssuer())) {
            return LicenseValidationResult.invalid("Invalid token issuer");
        }
        List<String> aud = jwt.getAudience();
        if (aud == null || !aud.contains(audience)) {
            return LicenseValidationResult.invalid("Invalid token audience");
        }

        Tier tier = Tier.normalize(jwt.getClaim("tier").asString());
        if (tier == null) {
            return LicenseValidationResult.invalid("Unknown license tier");
        }

        Date exp = jwt.getExpiresAt();
        Date iat = jwt.getIssuedAt();
        if (exp == null || iat == null) {
            return LicenseValidationResult.invalid("Invalid exp or iat claim");
        }

        LicenseClaims claims = new LicenseClaims(
            jwt.getIssuer(),
            aud,
            jwt.getSubject(),
            jwt.getId(),
            tier,
            readFeatures(jwt.getClaim("features")),
            jwt.getClaim("organization").asString(),
            jwt.getClaim("seats").asInt(),
            iat.toInstant(),
            exp.toInstant()
        );

        Instant now = clock.instant();
        Date nbf = jwt.getNotBefore();
        if (nbf != null && now.plus(NOT_BEFORE_LEEWAY).isBefore(nbf.toInstant())) {
            return LicenseValidationResult.invalid("License is not yet valid");
        }

        if (!now.isBefore(claims.expiresAt())) {
            long secondsSince = Duration.between(claims.expiresAt(), now).getSeconds();
            int daysSince = (int) Math.max(1, (secondsSince + SECONDS_PER_DAY - 1) / SECONDS_PER_DAY);
            LicenseValidationResult result = LicenseValidationResult.expired(claims, daysSince);
            if (result.inGracePeriod()) {
                LOG.warning("License expired " + daysSince + " days ago - renew within the grace period");
            } else {
                LOG.info("License expired " + daysSince + " days ago");
            }
            return result;
        }

        int daysUntil = (int) Duration.between(now, claims.expiresAt()).toDays();
        return LicenseValidationResult.valid(claims, daysUntil);
    }

    private static Set<String> readFeatures(Claim claim) {
        if (claim.isMissing() || claim.isNull()) {
            return Set.of();
        }
        try {
            List<String> list = claim.asList(String.class);
            return list != null ? new HashSet<>(list) : Set.of();
        } catch (JWTDecodeException e) {
            return Set.of();
        }
    }

    /**
     * Parse an X.509 SubjectPublicKeyInfo PEM block into an RSA public key.
     *
     * @throws LicenseConfigurationException if the PEM is not a valid RSA public key
     */
    public static RSAPublicKey parsePublicKeyPem(String pem) {
        try {
            String base64 = pem
                .replaceAll("-----(BEGIN|END) PUBLIC KEY-----", "")
                .replaceAll("\\s+", "");
            byte[] der = Base64.getDecoder().decode(base64);
            return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (Exception e) {
            throw new LicenseConfigurationException("Invalid RSA public key for license verification", e);
        }
    }

    /**
     * Load the public key shipped with the distribution.
     *
     * @return the key, or null if the resource is missing (RS256 tokens will then be rejected)
     */
    public static RSAPublicKey loadBundledPublicKey() {
        try (InputStream in = JwtLicenseValidator.class.getResourceAsStream(BUNDLED_PUBLIC_KEY_RESOURCE)) {
            if (in == null) {
                LOG.severe("Bundled license public key not found: " + BUNDLED_PUBLIC_KEY_RESOURCE);
                return null;
            }
            return parsePublicKeyPem(new String(in.readAllBytes(), StandardCharsets.US_ASCII));
        } catch (IOException e) {
            LOG.severe("Failed to read bundled license public key: " + e.getMessage());
            return null;
        }
    }
}

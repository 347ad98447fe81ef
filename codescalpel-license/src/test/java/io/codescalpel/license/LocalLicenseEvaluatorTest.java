package io.codescalpel.license;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LocalLicenseEvaluator}.
 */
class LocalLicenseEvaluatorTest {

    @TempDir
    Path tempDir;

    private Path projectRoot;
    private Path configHome;
    private MutableClock clock;
    private CountingValidator validator;

    @BeforeEach
    void setUp() throws IOException {
        projectRoot = Files.createDirectories(tempDir.resolve("project"));
        configHome = Files.createDirectories(tempDir.resolve("config"));
        clock = new MutableClock(TestTokens.NOW);
        validator = new CountingValidator(TestTokens.validator(clock));
    }

    private LocalLicenseEvaluator evaluator(Map<String, String> extraEnv) {
        Map<String, String> env = new HashMap<>(extraEnv);
        env.put("XDG_CONFIG_HOME", configHome.toString());
        return new LocalLicenseEvaluator(LicenseConfig.from(env, projectRoot), validator, clock);
    }

    private LocalLicenseEvaluator evaluator() {
        return evaluator(Map.of());
    }

    private Path writeProjectLicense(String token) throws IOException {
        return Files.writeString(projectRoot.resolve(LocalLicenseEvaluator.PROJECT_LICENSE_FILE), token + "\n");
    }

    @Test
    @DisplayName("Valid pro license grants pro")
    void validLicense_grantsTier() throws IOException {
        writeProjectLicense(TestTokens.token().signRs256());

        assertEquals(Tier.PRO, evaluator().getCurrentTier());
    }

    @Test
    @DisplayName("Tampered license resolves to community")
    void tamperedLicense_isCommunity() throws IOException {
        writeProjectLicense(TestTokens.tamperPayload(TestTokens.token().signRs256(), "\"pro\"", "\"enterprise\""));
        var evaluator = evaluator();

        var result = evaluator.validate();

        assertFalse(result.valid());
        assertTrue(result.errorMessage().toLowerCase().contains("signature"));
        assertEquals(Tier.COMMUNITY, evaluator.getCurrentTier());
    }

    @Test
    @DisplayName("License expired three days ago is in grace but grants community")
    void expiredInGrace_isCommunity() throws IOException {
        writeProjectLicense(TestTokens.token().expiresAt(TestTokens.NOW.minus(Duration.ofDays(3))).signRs256());
        var evaluator = evaluator();

        var result = evaluator.validate();

        assertTrue(result.inGracePeriod());
        assertEquals(Tier.COMMUNITY, evaluator.getCurrentTier());
    }

    @Test
    @DisplayName("No license file is a valid community result")
    void noLicense_isCommunity() {
        var evaluator = evaluator(Map.of(LicenseConfig.ENV_DISABLE_LICENSE_DISCOVERY, "1"));

        var result = evaluator.validate();

        assertTrue(result.valid());
        assertEquals(Tier.COMMUNITY, evaluator.getCurrentTier());
        assertNull(evaluator.loadLicenseToken());
        assertEquals(0, validator.calls);
    }

    @Test
    @DisplayName("Repeated checks within the TTL verify the signature once")
    void repeatedChecks_verifyOnce() throws IOException {
        writeProjectLicense(TestTokens.token().signRs256());
        var evaluator = evaluator();

        var first = evaluator.validate();
        clock.advance(Duration.ofHours(23));
        var second = evaluator.validate();
        evaluator.getCurrentTier();

        assertEquals(1, validator.calls);
        assertSame(first, second);
    }

    @Test
    @DisplayName("Cached result is re-verified after the TTL")
    void ttlElapsed_reverifies() throws IOException {
        writeProjectLicense(TestTokens.token().signRs256());
        var evaluator = evaluator();

        evaluator.validate();
        clock.advance(LocalLicenseEvaluator.REVALIDATION_TTL);
        evaluator.validate();

        assertEquals(2, validator.calls);
    }

    @Test
    @DisplayName("Changing the license file forces re-verification")
    void changedFile_reverifies() throws IOException {
        writeProjectLicense(TestTokens.token().signRs256());
        var evaluator = evaluator();
        assertEquals(Tier.PRO, evaluator.getCurrentTier());

        writeProjectLicense(TestTokens.token().tier("enterprise").signRs256());

        assertEquals(Tier.ENTERPRISE, evaluator.getCurrentTier());
        assertEquals(2, validator.calls);
    }

    @Test
    @DisplayName("Cached valid result is not served past license expiry")
    void cachedValid_notServedPastExpiry() throws IOException {
        writeProjectLicense(TestTokens.token().expiresAt(TestTokens.NOW.plus(Duration.ofHours(1))).signRs256());
        var evaluator = evaluator();
        assertTrue(evaluator.validate().valid());

        clock.advance(Duration.ofHours(2));
        var result = evaluator.validate();

        assertFalse(result.valid());
        assertTrue(result.expired());
        assertEquals(2, validator.calls);
    }

    @Test
    @DisplayName("Clock moving backwards forces re-verification")
    void clockBackwards_reverifies() throws IOException {
        writeProjectLicense(TestTokens.token().signRs256());
        var evaluator = evaluator();

        evaluator.validate();
        clock.set(TestTokens.NOW.minus(Duration.ofMinutes(5)));
        evaluator.validate();

        assertEquals(2, validator.calls);
    }

    @Test
    @DisplayName("invalidate drops the cached result")
    void invalidate_forcesReverify() throws IOException {
        writeProjectLicense(TestTokens.token().signRs256());
        var evaluator = evaluator();

        evaluator.validate();
        evaluator.invalidate();
        evaluator.validate();

        assertEquals(2, validator.calls);
    }

    @Test
    @DisplayName("Explicit license path wins over the project license")
    void explicitPath_hasPriority() throws IOException {
        writeProjectLicense(TestTokens.token().signRs256());
        Path explicit = Files.writeString(tempDir.resolve("explicit.jwt"),
            TestTokens.token().tier("enterprise").signRs256());
        var evaluator = evaluator(Map.of(LicenseConfig.ENV_LICENSE_PATH, explicit.toString()));

        assertEquals(explicit, evaluator.findLicenseFile());
        assertEquals(Tier.ENTERPRISE, evaluator.getCurrentTier());
    }

    @Test
    @DisplayName("Project license wins over the user config license")
    void projectLicense_beatsUserConfig() throws IOException {
        Path userLicense = Files.createDirectories(configHome.resolve("code-scalpel")).resolve("license");
        Files.writeString(userLicense, TestTokens.token().tier("enterprise").signRs256());
        Path project = writeProjectLicense(TestTokens.token().signRs256());

        assertEquals(project, evaluator().findLicenseFile());
    }

    @Test
    @DisplayName("User config license is found when there is no project license")
    void userConfigLicense_isDiscovered() throws IOException {
        Path userLicense = Files.createDirectories(configHome.resolve("code-scalpel")).resolve("license");
        Files.writeString(userLicense, TestTokens.token().tier("enterprise").signRs256());

        var evaluator = evaluator();

        assertEquals(userLicense, evaluator.findLicenseFile());
        assertEquals(Tier.ENTERPRISE, evaluator.getCurrentTier());
    }

    @Test
    @DisplayName("Disabled discovery ignores well-known locations")
    void disabledDiscovery_ignoresProjectLicense() throws IOException {
        writeProjectLicense(TestTokens.token().signRs256());

        var evaluator = evaluator(Map.of(LicenseConfig.ENV_DISABLE_LICENSE_DISCOVERY, "1"));

        assertNull(evaluator.findLicenseFile());
        assertEquals(Tier.COMMUNITY, evaluator.getCurrentTier());
    }

    @Test
    @DisplayName("Empty license file is invalid")
    void emptyFile_isInvalid() throws IOException {
        writeProjectLicense("   ");
        var evaluator = evaluator();

        var result = evaluator.validate();

        assertFalse(result.valid());
        assertEquals("License file is empty", result.errorMessage());
        assertNull(evaluator.loadLicenseToken());
    }

    private static final class CountingValidator implements LicenseTokenValidator {
        private final LicenseTokenValidator delegate;
        int calls;

        CountingValidator(LicenseTokenValidator delegate) {
            this.delegate = delegate;
        }

        @Override
        public LicenseValidationResult validateToken(String token) {
            calls++;
            return delegate.validateToken(token);
        }
    }
}

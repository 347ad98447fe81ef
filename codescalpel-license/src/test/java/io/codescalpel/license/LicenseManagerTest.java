package io.codescalpel.license;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LicenseManager}.
 */
class LicenseManagerTest {

    private static final long FAR_EXP = TestTokens.NOW.plus(Duration.ofDays(365)).getEpochSecond();

    @TempDir
    Path tempDir;

    private Path licenseFile;
    private MutableClock clock;
    private FakeTransport transport;

    @BeforeEach
    void setUp() {
        licenseFile = tempDir.resolve("license.jwt");
        clock = new MutableClock(TestTokens.NOW);
        transport = new FakeTransport();
    }

    @AfterEach
    void tearDown() {
        LicenseManager.resetInstance();
    }

    private LicenseConfig config(Map<String, String> extra) {
        Map<String, String> env = new HashMap<>(extra);
        env.put(LicenseConfig.ENV_LICENSE_PATH, licenseFile.toString());
        env.put(LicenseConfig.ENV_DISABLE_LICENSE_DISCOVERY, "1");
        env.put(LicenseConfig.ENV_CACHE_PATH, tempDir.resolve("cache.json").toString());
        return LicenseConfig.from(env, tempDir);
    }

    private LicenseManager localManager(Map<String, String> extra) {
        LicenseConfig config = config(extra);
        return new LicenseManager(
            config, new LocalLicenseEvaluator(config, TestTokens.validator(clock), clock), null, clock);
    }

    private LicenseManager remoteManager() {
        LicenseConfig config = config(Map.of());
        RemoteLicenseVerifier verifier = new RemoteLicenseVerifier(
            VerifierEndpoint.of("http://127.0.0.1:8003"), transport, Duration.ofSeconds(1), 0, Duration.ZERO);
        LicenseAuthorizer authorizer = new LicenseAuthorizer(
            verifier, new VerificationCache(config.cachePath(), clock), null, clock);
        return new LicenseManager(
            config, new LocalLicenseEvaluator(config, TestTokens.validator(clock), clock), authorizer, clock);
    }

    private void license(String token) throws IOException {
        Files.writeString(licenseFile, token);
    }

    @Test
    @DisplayName("getInstance returns the same instance")
    void getInstance_returnsSameInstance() {
        assertSame(LicenseManager.getInstance(), LicenseManager.getInstance());
    }

    @Test
    @DisplayName("Configured verifier URL switches to remote verification")
    void verifierUrl_enablesRemote() {
        var manager = new LicenseManager(config(Map.of(LicenseConfig.ENV_VERIFIER_URL, "http://127.0.0.1:8003")));

        assertTrue(manager.isRemoteVerification());
        assertFalse(localManager(Map.of()).isRemoteVerification());
    }

    @Test
    @DisplayName("getCurrentTier applies the configured requested tier")
    void getCurrentTier_clampedByEnvironment() throws IOException {
        license(TestTokens.token().tier("enterprise").signRs256());

        assertEquals(Tier.ENTERPRISE, localManager(Map.of()).getCurrentTier());
        assertEquals(Tier.COMMUNITY, localManager(Map.of(LicenseConfig.ENV_TIER, "community")).getCurrentTier());
    }

    @Test
    @DisplayName("Startup uses the configured requested tier")
    void startup_usesConfiguredRequest() throws IOException {
        license(TestTokens.token().tier("enterprise").signRs256());

        var startup = localManager(Map.of(LicenseConfig.ENV_TIER, "pro")).computeEffectiveTierForStartup();

        assertEquals(Tier.PRO, startup.tier());
    }

    @Test
    @DisplayName("Local license info describes the license file")
    void getLicenseInfo_local() throws IOException {
        license(TestTokens.token().signRs256());

        var info = localManager(Map.of()).getLicenseInfo();

        assertEquals(LicenseStatus.SOURCE_LOCAL, info.source());
        assertTrue(info.valid());
        assertEquals(Tier.PRO, info.tier());
        assertEquals("cus_123", info.customerId());
        assertEquals(List.of("cognitive_complexity", "context_aware_scanning"), info.features());
        assertEquals(TestTokens.NOW.plus(Duration.ofDays(30)), info.expiresAt());
        assertEquals(30, info.daysUntilExpiration());
        assertNull(info.reason());
    }

    @Test
    @DisplayName("Local license info reports expiry and grace")
    void getLicenseInfo_localExpired() throws IOException {
        license(TestTokens.token().expiresAt(TestTokens.NOW.minus(Duration.ofDays(3))).signRs256());

        var info = localManager(Map.of()).getLicenseInfo();

        assertFalse(info.valid());
        assertTrue(info.expired());
        assertTrue(info.inGracePeriod());
        assertEquals(-3, info.daysUntilExpiration());
    }

    @Test
    @DisplayName("Remote license info carries the authorization reason")
    void getLicenseInfo_remote() throws IOException {
        license("opaque.remote.token");
        transport.respond(200, FakeTransport.verifierJson(true, FAR_EXP, "pro", null));

        var info = remoteManager().getLicenseInfo();

        assertEquals(LicenseStatus.SOURCE_REMOTE, info.source());
        assertEquals(AuthorizationReason.REMOTE_VERIFIED, info.reason());
        assertTrue(info.valid());
        assertEquals(List.of("a_feature", "b_feature"), info.features());
        assertEquals(365, info.daysUntilExpiration());
    }

    @Test
    @DisplayName("Remote license info when the verifier is down and nothing is cached")
    void getLicenseInfo_remoteUnavailable() throws IOException {
        license("opaque.remote.token");
        transport.fail(new ConnectException("refused"));

        var info = remoteManager().getLicenseInfo();

        assertFalse(info.valid());
        assertEquals(Tier.COMMUNITY, info.tier());
        assertEquals(AuthorizationReason.OFFLINE_DENIED, info.reason());
    }

    @Test
    @DisplayName("refreshCache re-verifies even when the cache is fresh")
    void refreshCache_remote() throws IOException {
        license("opaque.remote.token");
        transport.respond(200, FakeTransport.verifierJson(true, FAR_EXP, "pro", null));
        var manager = remoteManager();
        manager.getCurrentTier();

        assertTrue(manager.refreshCache());
        assertEquals(2, transport.calls());
    }

    @Test
    @DisplayName("refreshCache without a license does nothing")
    void refreshCache_noLicense() {
        assertFalse(remoteManager().refreshCache());
        assertEquals(0, transport.calls());
    }
}

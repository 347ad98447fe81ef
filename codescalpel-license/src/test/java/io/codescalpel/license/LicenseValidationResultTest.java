package io.codescalpel.license;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LicenseValidationResult}.
 */
class LicenseValidationResultTest {

    private static final LicenseClaims CLAIMS = new LicenseClaims(
        "code-scalpel-licensing", List.of("code-scalpel"), "cus_1", null, Tier.PRO,
        Set.of("x"), "Acme", 3, Instant.EPOCH, Instant.EPOCH.plusSeconds(60)
    );

    @Test
    @DisplayName("Expired within seven days is in the grace period")
    void expired_withinGrace() {
        var result = LicenseValidationResult.expired(CLAIMS, 7);

        assertFalse(result.valid());
        assertTrue(result.expired());
        assertTrue(result.inGracePeriod());
        assertEquals(-7, result.daysUntilExpiration());
        assertTrue(result.errorMessage().contains("grace period: 0 days remaining"));
    }

    @Test
    @DisplayName("Expired beyond seven days is out of grace")
    void expired_beyondGrace() {
        var result = LicenseValidationResult.expired(CLAIMS, 8);

        assertFalse(result.inGracePeriod());
        assertEquals("License expired 8 days ago", result.errorMessage());
    }

    @Test
    @DisplayName("An expired license never grants its tier")
    void effectiveTier_expired_isCommunity() {
        var result = LicenseValidationResult.expired(CLAIMS, 1);

        assertEquals(Tier.PRO, result.tier());
        assertEquals(Tier.COMMUNITY, result.effectiveTier());
    }

    @Test
    @DisplayName("No license is a valid community result")
    void noLicense_isValidCommunity() {
        var result = LicenseValidationResult.noLicense();

        assertTrue(result.valid());
        assertEquals(Tier.COMMUNITY, result.effectiveTier());
        assertNull(result.errorMessage());
        assertEquals("", result.customerId());
    }
}

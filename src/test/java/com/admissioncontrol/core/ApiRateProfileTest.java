package com.admissioncontrol.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApiRateProfileTest {

    @Test
    @DisplayName("Should convert published per-minute limits to per-second rates")
    void shouldConvertPresets() {
        assertEquals(10.0, ApiRateProfile.instantly().getRequestsPerSecond(), 1e-9);
        assertEquals(5.0, ApiRateProfile.closeCrm().getRequestsPerSecond(), 1e-9);
        assertEquals(2.5, ApiRateProfile.custom(150, 0.9).getRequestsPerSecond(), 1e-9);
    }

    @Test
    @DisplayName("Should resolve presets by name, ignoring case")
    void shouldResolveByName() {
        assertEquals(ApiRateProfile.instantly(), ApiRateProfile.named("Instantly"));
        assertEquals(ApiRateProfile.closeCrm(), ApiRateProfile.named("close_crm"));
        assertThrows(IllegalArgumentException.class, () -> ApiRateProfile.named("unknown"));
    }

    @Test
    @DisplayName("Should build a bucket at the profile's rate and safety factor")
    void shouldBuildBucketFromProfile() {
        BucketConfig config = BucketConfig.forProfile(ApiRateProfile.closeCrm());

        assertEquals(5.0, config.getNominalRatePerSecond(), 1e-9);
        assertEquals(4.0, config.getEffectiveRate(), 1e-9);
        config.validate();
    }
}

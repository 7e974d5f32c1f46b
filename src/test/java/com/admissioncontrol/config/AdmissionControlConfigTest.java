package com.admissioncontrol.config;

import com.admissioncontrol.core.BucketConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionControlConfigTest {

    private AdmissionControlConfig config;

    @BeforeEach
    void setUp() {
        config = new AdmissionControlConfig();
        ReflectionTestUtils.setField(config, "bucketProfile", "");
        ReflectionTestUtils.setField(config, "nominalRatePerSecond", 20.0);
        ReflectionTestUtils.setField(config, "safetyFactor", 0.5);
        ReflectionTestUtils.setField(config, "windowSizeSeconds", 90L);
        ReflectionTestUtils.setField(config, "maxAccumulatedTokens", 0.0);
        ReflectionTestUtils.setField(config, "fallbackOnStoreError", false);
    }

    @Test
    @DisplayName("Should build the bucket from explicit rate and safety factor")
    void shouldUseExplicitRate() {
        BucketConfig bucket = config.bucketConfig();

        assertEquals(20.0, bucket.getNominalRatePerSecond());
        assertEquals(0.5, bucket.getSafetyFactor());
        assertEquals(Duration.ofSeconds(90), bucket.getWindowSize());
        assertFalse(bucket.isFallbackOnStoreError());
    }

    @Test
    @DisplayName("Should take rate and safety factor from a named profile")
    void shouldUseNamedProfile() {
        ReflectionTestUtils.setField(config, "bucketProfile", "instantly");

        BucketConfig bucket = config.bucketConfig();

        assertEquals(10.0, bucket.getNominalRatePerSecond(), 1e-9);
        assertEquals(0.8, bucket.getSafetyFactor());
        assertEquals(8.0, bucket.getEffectiveRate(), 1e-9);
        // the remaining settings still come from properties
        assertEquals(Duration.ofSeconds(90), bucket.getWindowSize());
        assertFalse(bucket.isFallbackOnStoreError());
    }

    @Test
    @DisplayName("Should reject an unknown profile name")
    void shouldRejectUnknownProfile() {
        ReflectionTestUtils.setField(config, "bucketProfile", "twitter");

        assertThrows(IllegalArgumentException.class, () -> config.bucketConfig());
    }
}

package com.admissioncontrol.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a leaky-bucket limiter.
 * Immutable to prevent accidental modifications after creation.
 */
@Value
@Builder(toBuilder = true)
public class BucketConfig {

    /**
     * Advertised limit of the dependency, in requests per second
     */
    double nominalRatePerSecond;

    /**
     * Permanent haircut applied to the nominal rate (0 < f <= 1)
     */
    @Builder.Default
    double safetyFactor = 0.8;

    /**
     * TTL of idle bucket keys
     */
    @Builder.Default
    Duration windowSize = Duration.ofSeconds(60);

    /**
     * Degrade to a process-local bucket when the store is unreachable.
     * When false the limiter fails closed.
     */
    @Builder.Default
    boolean fallbackOnStoreError = true;

    /**
     * Upper bound on accumulated tokens. Zero or less means unbounded,
     * so an idle bucket keeps accruing credit.
     */
    @Builder.Default
    double maxAccumulatedTokens = 0.0;

    public double getEffectiveRate() {
        return nominalRatePerSecond * safetyFactor;
    }

    public boolean isBurstCapped() {
        return maxAccumulatedTokens > 0;
    }

    public void validate() {
        if (nominalRatePerSecond <= 0) {
            throw new IllegalArgumentException("nominalRatePerSecond must be positive");
        }
        if (safetyFactor <= 0 || safetyFactor > 1) {
            throw new IllegalArgumentException("safetyFactor must be in (0, 1]");
        }
        if (windowSize == null || windowSize.toSeconds() < 1) {
            throw new IllegalArgumentException("windowSize must be at least one second");
        }
    }

    public static BucketConfig forProfile(ApiRateProfile profile) {
        return BucketConfig.builder()
                .nominalRatePerSecond(profile.getRequestsPerSecond())
                .safetyFactor(profile.getRecommendedSafetyFactor())
                .build();
    }

    public static BucketConfig perSecond(double requestsPerSecond) {
        return BucketConfig.builder()
                .nominalRatePerSecond(requestsPerSecond)
                .build();
    }
}

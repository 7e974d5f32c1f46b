package com.admissioncontrol.endpoint;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Settings of the endpoint-aware limiter and its URL normalization.
 */
@Value
@Builder(toBuilder = true)
public class EndpointLimitConfig {

    /**
     * Rate used for an endpoint whose limit has not been discovered yet.
     * Applied as is, without the safety factor.
     */
    @Builder.Default
    double conservativeDefaultRps = 1.0;

    /**
     * Lifetime of a discovered limit in the shared store
     */
    @Builder.Default
    Duration cacheExpiration = Duration.ofMinutes(5);

    /**
     * Host every endpoint URL must point at (compared case-insensitively)
     */
    @Builder.Default
    String apiHost = "api.close.com";

    @Builder.Default
    String supportedVersion = "v1";

    /**
     * Name of the response header carrying the limit
     */
    @Builder.Default
    String headerName = "ratelimit";

    /**
     * Prefixes identifying a path segment as a specific resource id
     */
    @Singular
    List<String> resourceIdPrefixes;

    /**
     * Roots whose second segment names a distinct endpoint (e.g. data/search)
     */
    @Singular
    List<String> compoundRoots;

    public void validate() {
        if (conservativeDefaultRps <= 0) {
            throw new IllegalArgumentException("conservativeDefaultRps must be positive");
        }
        if (cacheExpiration == null || cacheExpiration.toSeconds() < 1) {
            throw new IllegalArgumentException("cacheExpiration must be at least one second");
        }
        if (apiHost == null || apiHost.isBlank()) {
            throw new IllegalArgumentException("apiHost is required");
        }
    }

    /**
     * Defaults for the Close API.
     */
    public static EndpointLimitConfig close() {
        return EndpointLimitConfig.builder()
                .resourceIdPrefix("lead_")
                .resourceIdPrefix("task_")
                .resourceIdPrefix("cont_")
                .resourceIdPrefix("acti_")
                .resourceIdPrefix("user_")
                .resourceIdPrefix("org_")
                .compoundRoot("data")
                .build();
    }
}

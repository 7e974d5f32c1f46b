package com.admissioncontrol.core;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of one bucket, for diagnostics.
 */
@Value
@Builder
public class BucketStatus {
    String key;
    double storedTokens;
    double effectiveTokens;
    double secondsSinceRefill;
    double lastRefill;
    double effectiveRate;
    double safetyFactor;
    long windowSizeSeconds;
}

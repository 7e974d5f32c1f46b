package com.admissioncontrol.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class CircuitBreakerConfig {

    /**
     * Consecutive failures (while closed) that open the circuit
     */
    @Builder.Default
    int failureThreshold = 5;

    /**
     * Time after the last failure before a probe is allowed (OPEN -> HALF_OPEN).
     * Also bounds how long a single probe may stay unanswered.
     */
    @Builder.Default
    Duration recoveryTimeout = Duration.ofSeconds(60);

    @Builder.Default
    boolean enableBackoff = false;

    @Builder.Default
    Duration maxBackoff = Duration.ofMinutes(5);

    /**
     * Lifetime of the backoff level once failures stop
     */
    @Builder.Default
    Duration backoffExpiration = Duration.ofHours(1);

    /**
     * Fail open when the store is unreachable; otherwise the store error propagates
     */
    @Builder.Default
    boolean fallbackOnStoreError = true;

    /**
     * Optimistic transaction attempts when recording an outcome
     */
    @Builder.Default
    int maxTransitionAttempts = 3;

    public void validate() {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException("recoveryTimeout must be a positive duration");
        }
        if (maxBackoff == null || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("maxBackoff cannot be negative");
        }
        if (maxTransitionAttempts < 1) {
            throw new IllegalArgumentException("maxTransitionAttempts must be at least 1");
        }
    }
}

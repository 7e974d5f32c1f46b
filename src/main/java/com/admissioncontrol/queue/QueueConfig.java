package com.admissioncontrol.queue;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class QueueConfig {

    @Builder.Default
    String queueName = "requests";

    @Builder.Default
    int maxWorkers = 5;

    /**
     * Longest a worker blocks waiting for an entry; bounds how fast stop() is observed
     */
    @Builder.Default
    Duration pollTimeout = Duration.ofSeconds(1);

    /**
     * Permit attempts per entry before it fails with a rate-limit error
     */
    @Builder.Default
    int maxTokenAttempts = 10;

    @Builder.Default
    Duration tokenRetryDelay = Duration.ofMillis(500);

    /**
     * Extra executions granted to an entry whose call failed with a retryable outcome
     */
    @Builder.Default
    int maxRetries = 2;

    /**
     * Pause before re-running a retryable failure when the breaker has no backoff to offer
     */
    @Builder.Default
    Duration retryDelay = Duration.ofSeconds(1);

    /**
     * How long finished results stay readable by id
     */
    @Builder.Default
    Duration resultTtl = Duration.ofHours(1);

    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(30);

    public void validate() {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName is required");
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1");
        }
        if (maxTokenAttempts < 1) {
            throw new IllegalArgumentException("maxTokenAttempts must be at least 1");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        if (pollTimeout == null || pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be a positive duration");
        }
        if (resultTtl == null || resultTtl.toSeconds() < 1) {
            throw new IllegalArgumentException("resultTtl must be at least one second");
        }
    }
}

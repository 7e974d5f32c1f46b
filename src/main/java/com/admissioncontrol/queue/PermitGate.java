package com.admissioncontrol.queue;

import com.admissioncontrol.algorithms.CloseRateLimiter;
import com.admissioncontrol.core.RateLimiter;

/**
 * Decides whether a worker may execute an entry now. Must not block.
 */
@FunctionalInterface
public interface PermitGate {

    boolean tryAcquire(QueueEntry entry);

    /**
     * Every entry draws from the same bucket.
     */
    static PermitGate forKey(RateLimiter limiter, String key) {
        return entry -> limiter.tryAcquire(key);
    }

    /**
     * Entries draw from the bucket of the endpoint named by their payload's {@code url}.
     */
    static PermitGate perEndpoint(CloseRateLimiter limiter) {
        return entry -> {
            if (entry.getPayload() == null || !entry.getPayload().hasNonNull("url")) {
                throw new IllegalArgumentException("Queued request " + entry.getId() + " has no url");
            }
            return limiter.acquireForEndpoint(entry.getPayload().get("url").asText());
        };
    }
}

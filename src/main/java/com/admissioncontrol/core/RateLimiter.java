package com.admissioncontrol.core;

/**
 * Core interface for rate limiting operations.
 * Implementations keep their state in shared storage so that every
 * process enforces the same global limit.
 */
public interface RateLimiter {

    /**
     * Try to acquire a single permit for the given key.
     * Returns immediately without blocking; waiting and retrying is up to the caller.
     *
     * @param key bucket identifier (e.g. "instantly_api")
     * @return true if permit acquired, false if denied (empty bucket or contention)
     */
    boolean tryAcquire(String key);

    /**
     * Get whole permits currently available for a key.
     * Feedback only, the value may be stale by the time it is used.
     *
     * @param key bucket identifier
     * @return number of permits available, or -1 if unable to determine
     */
    long getAvailablePermits(String key);

    /**
     * Drop the bucket of a key; the next acquire starts from an empty bucket.
     * Meant for tests and admin overrides.
     *
     * @param key bucket identifier
     */
    void reset(String key);
}

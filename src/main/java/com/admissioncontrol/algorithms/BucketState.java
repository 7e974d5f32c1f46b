package com.admissioncontrol.algorithms;

import lombok.Value;

/**
 * Token count and last refill time of one leaky bucket.
 * Times are unix seconds; tokens may be fractional or negative.
 */
@Value
public class BucketState {

    double tokens;
    double lastRefill;

    /**
     * A bucket seen for the first time starts empty: no burst credit.
     */
    public static BucketState empty(double now) {
        return new BucketState(0.0, now);
    }

    public static BucketState parse(String tokens, String lastRefill, double now) {
        if (tokens == null) {
            return empty(now);
        }
        double refill = lastRefill != null ? Double.parseDouble(lastRefill) : now;
        return new BucketState(Double.parseDouble(tokens), refill);
    }

    /**
     * Add the tokens accrued since the last refill. A cap of zero or less
     * leaves the count unbounded.
     */
    public BucketState refill(double now, double ratePerSecond, double cap) {
        double candidate = tokens + (now - lastRefill) * ratePerSecond;
        if (cap > 0 && candidate > cap) {
            candidate = cap;
        }
        return new BucketState(candidate, now);
    }

    public boolean hasPermit() {
        return tokens >= 1.0;
    }

    public BucketState consume() {
        return new BucketState(tokens - 1.0, lastRefill);
    }

    public String encodedTokens() {
        return String.valueOf(tokens);
    }

    public String encodedLastRefill() {
        return String.valueOf(lastRefill);
    }
}

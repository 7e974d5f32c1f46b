package com.admissioncontrol.core;

/**
 * No permit was granted within the bounded number of acquisition attempts.
 */
public class RateLimitExceededException extends AdmissionControlException {

    private final String identifier;
    private final int attempts;

    public RateLimitExceededException(String identifier, int attempts) {
        super(String.format("Rate limit exceeded for %s after %d attempts", identifier, attempts));
        this.identifier = identifier;
        this.attempts = attempts;
    }

    public String getIdentifier() {
        return identifier;
    }

    public int getAttempts() {
        return attempts;
    }
}

package com.admissioncontrol.core;

import lombok.Value;

import java.util.Locale;

/**
 * Published rate limits of the APIs this service talks to.
 */
@Value
public class ApiRateProfile {

    String name;
    int requestsPerMinute;
    double recommendedSafetyFactor;

    public double getRequestsPerSecond() {
        return requestsPerMinute / 60.0;
    }

    /**
     * Instantly: 600 requests/minute = 10 requests/second
     */
    public static ApiRateProfile instantly() {
        return new ApiRateProfile("instantly", 600, 0.8);
    }

    /**
     * Close CRM: 300 requests/minute = 5 requests/second
     */
    public static ApiRateProfile closeCrm() {
        return new ApiRateProfile("close_crm", 300, 0.8);
    }

    /**
     * Resolve a preset by name, e.g. from configuration.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static ApiRateProfile named(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "instantly":
                return instantly();
            case "close_crm":
            case "close":
                return closeCrm();
            default:
                throw new IllegalArgumentException("Unknown API rate profile: " + name);
        }
    }

    public static ApiRateProfile custom(int requestsPerMinute, double safetyFactor) {
        return new ApiRateProfile("custom", requestsPerMinute, safetyFactor);
    }

    @Override
    public String toString() {
        return String.format("%s: %d requests/minute = %.1f requests/second",
                name, requestsPerMinute, getRequestsPerSecond());
    }
}

package com.admissioncontrol.endpoint;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses the dependency's rate-limit header:
 *
 * <pre>limit=160; remaining=159; reset=8</pre>
 *
 * Keys are case-insensitive, whitespace is tolerated, floats are truncated
 * and unknown fields are ignored.
 */
public final class RateLimitHeaderParser {

    private static final List<String> REQUIRED_FIELDS = List.of("limit", "remaining", "reset");

    private RateLimitHeaderParser() {
    }

    public static EndpointLimits parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            throw new MalformedRateLimitHeaderException("Invalid ratelimit header format: header is empty");
        }

        Map<String, Integer> fields = new HashMap<>();
        boolean pairFound = false;

        for (String part : headerValue.split(";")) {
            part = part.trim();
            int separator = part.indexOf('=');
            if (separator < 0) {
                continue;
            }

            String key = part.substring(0, separator).trim().toLowerCase(Locale.ROOT);
            String value = part.substring(separator + 1).trim();
            if (value.isEmpty()) {
                throw new MalformedRateLimitHeaderException(
                        "Invalid ratelimit header format: empty value for " + key);
            }
            pairFound = true;

            if (REQUIRED_FIELDS.contains(key)) {
                fields.put(key, toInt(key, value));
            }
        }

        if (!pairFound) {
            throw new MalformedRateLimitHeaderException(
                    "Invalid ratelimit header format: no key=value pairs found");
        }

        List<String> missing = REQUIRED_FIELDS.stream()
                .filter(field -> !fields.containsKey(field))
                .toList();
        if (!missing.isEmpty()) {
            throw new MalformedRateLimitHeaderException(
                    "Missing required fields: " + missing.stream().collect(Collectors.joining(", ")));
        }

        return new EndpointLimits(fields.get("limit"), fields.get("remaining"), fields.get("reset"));
    }

    private static int toInt(String key, String value) {
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw new NumberFormatException(value);
            }
            return (int) parsed;
        } catch (NumberFormatException e) {
            throw new MalformedRateLimitHeaderException(
                    "Invalid ratelimit header format: non-numeric value '" + value + "' for " + key);
        }
    }
}

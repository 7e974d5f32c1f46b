package com.admissioncontrol.algorithms;

import com.admissioncontrol.core.BucketConfig;
import com.admissioncontrol.core.BucketStatus;
import com.admissioncontrol.endpoint.EndpointKeyExtractor;
import com.admissioncontrol.endpoint.EndpointLimitConfig;
import com.admissioncontrol.endpoint.EndpointLimits;
import com.admissioncontrol.endpoint.MalformedRateLimitHeaderException;
import com.admissioncontrol.endpoint.RateLimitHeaderParser;
import com.admissioncontrol.storage.StateStorage;
import com.admissioncontrol.storage.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Endpoint-aware limiter for the Close API.
 *
 * Each endpoint key gets its own bucket. Until the API has told us the
 * limit of an endpoint (through the {@code ratelimit} response header) the
 * bucket runs at the conservative default rate; afterwards it runs at
 * {@code limit * safety_factor / 60} per second.
 */
@Slf4j
public class CloseRateLimiter extends LeakyBucketRateLimiter {

    static final String LIMITS_KEY_PREFIX = "close_rate_limit:limits:";
    static final String ENDPOINT_BUCKET_PREFIX = "close_endpoint:";

    private final EndpointLimitConfig endpointConfig;
    private final EndpointKeyExtractor extractor;
    private final ObjectMapper objectMapper;

    public CloseRateLimiter(
            StateStorage storage,
            BucketConfig bucketConfig,
            EndpointLimitConfig endpointConfig,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this(storage, bucketConfig, endpointConfig, objectMapper, meterRegistry, Clock.systemUTC());
    }

    public CloseRateLimiter(
            StateStorage storage,
            BucketConfig bucketConfig,
            EndpointLimitConfig endpointConfig,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            Clock clock) {

        super(storage, bucketConfig, meterRegistry, clock);
        endpointConfig.validate();
        this.endpointConfig = endpointConfig;
        this.extractor = new EndpointKeyExtractor(endpointConfig);
        this.objectMapper = objectMapper;

        log.info("CloseRateLimiter initialized: conservative_default={}/s, safety_factor={}, cache_expiration={}s",
                endpointConfig.getConservativeDefaultRps(),
                bucketConfig.getSafetyFactor(),
                endpointConfig.getCacheExpiration().toSeconds());
    }

    /**
     * Acquire a permit for the endpoint the URL belongs to.
     *
     * @param url full API URL, e.g. https://api.close.com/api/v1/lead/lead_123/
     * @return true if the request may proceed now
     * @throws com.admissioncontrol.endpoint.InvalidEndpointUrlException if the URL is not an API URL
     */
    public boolean acquireForEndpoint(String url) {
        String endpointKey = extractor.extract(url);
        return tryAcquire(endpointBucket(endpointKey), rateFor(endpointKey));
    }

    /**
     * Record the limit carried by a response. Header names are matched
     * case-insensitively; a missing or malformed header leaves any cached
     * limit untouched.
     */
    public void updateFromResponse(String url, Map<String, String> responseHeaders) {
        if (responseHeaders == null) {
            return;
        }
        String headerValue = responseHeaders.entrySet().stream()
                .filter(header -> endpointConfig.getHeaderName().equalsIgnoreCase(header.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
        updateFromHeader(url, headerValue);
    }

    public void updateFromHeader(String url, String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return;
        }
        String endpointKey = extractor.extract(url);

        EndpointLimits limits;
        try {
            limits = RateLimitHeaderParser.parse(headerValue);
        } catch (MalformedRateLimitHeaderException e) {
            log.warn("Failed to parse rate limit header '{}' for {}: {}", headerValue, endpointKey, e.getMessage());
            return;
        }

        cacheLimits(endpointKey, limits);
        log.info("Updated rate limits for {}: limit={}, remaining={}, reset={}",
                endpointKey, limits.getLimit(), limits.getRemaining(), limits.getReset());
    }

    /**
     * @param endpointKey normalized key, e.g. /api/v1/lead/
     * @return the cached limit, empty while the endpoint is undiscovered
     */
    public Optional<EndpointLimits> getEndpointLimits(String endpointKey) {
        String cached;
        try {
            cached = storage.get(LIMITS_KEY_PREFIX + endpointKey);
        } catch (StorageException e) {
            log.warn("Error retrieving cached limits for {}: {}", endpointKey, e.getMessage());
            return Optional.empty();
        }
        if (cached == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(cached, EndpointLimits.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable cached limits for {}: {}", endpointKey, e.getMessage());
            return Optional.empty();
        }
    }

    public String extractEndpointKey(String url) {
        return extractor.extract(url);
    }

    public BucketStatus getEndpointBucketStatus(String endpointKey) {
        return describe(endpointBucket(endpointKey), rateFor(endpointKey));
    }

    /**
     * Drop the bucket and the discovered limit of an endpoint.
     */
    public void resetEndpoint(String endpointKey) {
        reset(endpointBucket(endpointKey));
        storage.delete(LIMITS_KEY_PREFIX + endpointKey);
    }

    double rateFor(String endpointKey) {
        return getEndpointLimits(endpointKey)
                .filter(limits -> limits.getLimit() > 0)
                .map(limits -> limits.getLimit() * config.getSafetyFactor() / 60.0)
                .orElse(endpointConfig.getConservativeDefaultRps());
    }

    private void cacheLimits(String endpointKey, EndpointLimits limits) {
        String json;
        try {
            json = objectMapper.writeValueAsString(limits);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize endpoint limits", e);
        }

        try {
            storage.set(LIMITS_KEY_PREFIX + endpointKey, json, endpointConfig.getCacheExpiration());
        } catch (StorageException e) {
            if (!config.isFallbackOnStoreError()) {
                throw e;
            }
            log.warn("Could not cache limits for {}, keeping conservative rate: {}", endpointKey, e.getMessage());
        }
    }

    static String endpointBucket(String endpointKey) {
        return ENDPOINT_BUCKET_PREFIX + endpointKey;
    }

    @Override
    public String toString() {
        if (endpointConfig == null) {
            return super.toString();
        }
        return String.format("CloseRateLimiter(conservative_default=%s/s, safety_factor=%s, cache_expiration=%ss)",
                endpointConfig.getConservativeDefaultRps(),
                config.getSafetyFactor(),
                endpointConfig.getCacheExpiration().toSeconds());
    }
}

package com.admissioncontrol.client;

import com.admissioncontrol.algorithms.CloseRateLimiter;
import com.admissioncontrol.breaker.CircuitBreaker;
import com.admissioncontrol.breaker.CircuitOpenException;
import com.admissioncontrol.core.RateLimitExceededException;
import com.admissioncontrol.queue.CallOutcome;
import com.admissioncontrol.storage.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Locale;

/**
 * RestTemplate wrapper that only calls the API when the circuit is closed
 * and the endpoint's bucket grants a permit, and that feeds the
 * {@code ratelimit} response header back into the limiter.
 */
@Slf4j
public class GovernedHttpClient {

    private final RestTemplate restTemplate;
    private final CloseRateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;
    private final int maxPermitAttempts;
    private final Duration permitRetryDelay;

    /**
     * @param circuitBreaker may be null to skip circuit checks
     */
    public GovernedHttpClient(
            RestTemplate restTemplate,
            CloseRateLimiter rateLimiter,
            CircuitBreaker circuitBreaker,
            ObjectMapper objectMapper,
            int maxPermitAttempts,
            Duration permitRetryDelay) {

        if (maxPermitAttempts < 1) {
            throw new IllegalArgumentException("maxPermitAttempts must be at least 1");
        }
        this.restTemplate = restTemplate;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.objectMapper = objectMapper;
        this.maxPermitAttempts = maxPermitAttempts;
        this.permitRetryDelay = permitRetryDelay;
        // status codes are classified here, not turned into exceptions
        this.restTemplate.setErrorHandler(new PassThroughErrorHandler());
    }

    /**
     * Wait (bounded) for a permit, check the circuit, call, and report the
     * outcome to the breaker.
     *
     * @throws CircuitOpenException if the circuit is open
     * @throws RateLimitExceededException if no permit was granted in time
     * @throws com.admissioncontrol.endpoint.InvalidEndpointUrlException if the URL is not an API URL
     */
    public CallOutcome execute(OutboundRequest request) {
        String endpointKey = rateLimiter.extractEndpointKey(request.getUrl());

        if (!acquirePermit(request.getUrl())) {
            throw new RateLimitExceededException(endpointKey, maxPermitAttempts);
        }
        if (circuitBreaker != null && !circuitBreaker.canExecute()) {
            throw new CircuitOpenException(circuitBreaker.getName());
        }

        CallOutcome outcome = send(request);
        if (circuitBreaker != null) {
            if (outcome.getKind() == CallOutcome.Kind.SUCCEEDED) {
                circuitBreaker.recordSuccess();
            } else if (outcome.getKind() == CallOutcome.Kind.RETRYABLE) {
                circuitBreaker.recordFailure(new IllegalStateException(outcome.getError()));
            } else {
                circuitBreaker.releaseHalfOpenSlot();
            }
        }
        return outcome;
    }

    /**
     * Perform the call without admission checks; for callers that already
     * hold a permit. Learns the endpoint's limit from the response.
     */
    public CallOutcome send(OutboundRequest request) {
        try {
            rateLimiter.extractEndpointKey(request.getUrl());
        } catch (IllegalArgumentException e) {
            return CallOutcome.fatal(e.getMessage());
        }
        if (request.getMethod() == null || request.getMethod().isBlank()) {
            return CallOutcome.fatal("HTTP method is required for " + request.getUrl());
        }

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(
                    request.getUrl(),
                    HttpMethod.valueOf(request.getMethod().toUpperCase(Locale.ROOT)),
                    toEntity(request),
                    String.class);
        } catch (ResourceAccessException e) {
            log.warn("{} {} failed: {}", request.getMethod(), request.getUrl(), e.getMessage());
            return CallOutcome.retryable("I/O error: " + e.getMessage());
        }

        try {
            rateLimiter.updateFromResponse(request.getUrl(), response.getHeaders().toSingleValueMap());
        } catch (StorageException e) {
            // the API already answered; losing the learned limit must not change the outcome
            log.warn("Could not record rate limit of {}: {}", request.getUrl(), e.getMessage());
        }
        return classify(request, response);
    }

    private boolean acquirePermit(String url) {
        for (int attempt = 1; attempt <= maxPermitAttempts; attempt++) {
            if (rateLimiter.acquireForEndpoint(url)) {
                return true;
            }
            if (attempt < maxPermitAttempts) {
                try {
                    Thread.sleep(permitRetryDelay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    private HttpEntity<String> toEntity(OutboundRequest request) {
        HttpHeaders headers = new HttpHeaders();
        if (request.getHeaders() != null) {
            request.getHeaders().forEach(headers::set);
        }
        if (request.getBody() == null || request.getBody().isNull()) {
            return new HttpEntity<>(headers);
        }
        if (headers.getContentType() == null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        return new HttpEntity<>(request.getBody().toString(), headers);
    }

    private CallOutcome classify(OutboundRequest request, ResponseEntity<String> response) {
        HttpStatusCode status = response.getStatusCode();
        if (!status.isError()) {
            return CallOutcome.succeeded(readBody(response.getBody()));
        }

        String error = "HTTP " + status.value() + " from " + request.getMethod() + " " + request.getUrl();
        if (status.is5xxServerError() || status.value() == 429) {
            log.warn("Dependency failure: {}", error);
            return CallOutcome.retryable(error);
        }
        log.info("Request rejected by the API: {}", error);
        return CallOutcome.fatal(error);
    }

    private JsonNode readBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    private static final class PassThroughErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // never called, hasError is always false
        }
    }
}

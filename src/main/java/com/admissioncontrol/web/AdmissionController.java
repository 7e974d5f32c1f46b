package com.admissioncontrol.web;

import com.admissioncontrol.algorithms.CloseRateLimiter;
import com.admissioncontrol.algorithms.LeakyBucketRateLimiter;
import com.admissioncontrol.breaker.CircuitBreaker;
import com.admissioncontrol.breaker.CircuitBreakerMetrics;
import com.admissioncontrol.breaker.CircuitBreakerRegistry;
import com.admissioncontrol.core.BucketStatus;
import com.admissioncontrol.endpoint.EndpointLimits;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;

/**
 * Admission decisions for callers that cannot embed the library:
 * plain buckets, endpoint buckets with limit discovery, and circuit breakers.
 */
@RestController
@RequestMapping("/api/admission")
public class AdmissionController {

    private final LeakyBucketRateLimiter bucketRateLimiter;
    private final CloseRateLimiter closeRateLimiter;
    private final CircuitBreakerRegistry circuitBreakers;

    public AdmissionController(
            @Qualifier("bucketRateLimiter") LeakyBucketRateLimiter bucketRateLimiter,
            CloseRateLimiter closeRateLimiter,
            CircuitBreakerRegistry circuitBreakers) {
        this.bucketRateLimiter = bucketRateLimiter;
        this.closeRateLimiter = closeRateLimiter;
        this.circuitBreakers = circuitBreakers;
    }

    public record EndpointRequest(String url) {}

    public record ObservedResponse(String url, Map<String, String> headers) {}

    public record FailureReport(String reason) {}

    /**
     * Take one permit from a named bucket; 429 when none is available.
     */
    @PostMapping("/buckets/{key}/acquire")
    public ResponseEntity<Map<String, Object>> acquire(@PathVariable String key) {
        boolean allowed = bucketRateLimiter.tryAcquire(key);

        Map<String, Object> response = new HashMap<>();
        response.put("key", key);
        response.put("allowed", allowed);
        response.put("remaining", bucketRateLimiter.getAvailablePermits(key));

        return ResponseEntity.status(allowed ? HttpStatus.OK : HttpStatus.TOO_MANY_REQUESTS).body(response);
    }

    @GetMapping("/buckets/{key}")
    public BucketStatus bucketStatus(@PathVariable String key) {
        return bucketRateLimiter.getBucketStatus(key);
    }

    @DeleteMapping("/buckets/{key}")
    public ResponseEntity<Void> resetBucket(@PathVariable String key) {
        bucketRateLimiter.reset(key);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/endpoints/acquire")
    public ResponseEntity<Map<String, Object>> acquireForEndpoint(@RequestBody EndpointRequest request) {
        String endpointKey = closeRateLimiter.extractEndpointKey(request.url());
        boolean allowed = closeRateLimiter.acquireForEndpoint(request.url());

        Map<String, Object> response = new HashMap<>();
        response.put("endpointKey", endpointKey);
        response.put("allowed", allowed);

        return ResponseEntity.status(allowed ? HttpStatus.OK : HttpStatus.TOO_MANY_REQUESTS).body(response);
    }

    /**
     * Feed back the headers of a response the caller received from the API.
     */
    @PostMapping("/endpoints/observe")
    public ResponseEntity<Void> observe(@RequestBody ObservedResponse observed) {
        closeRateLimiter.updateFromResponse(observed.url(), observed.headers());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/endpoints/limits")
    public EndpointLimits endpointLimits(@RequestParam String key) {
        return closeRateLimiter.getEndpointLimits(key)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No limits discovered for " + key));
    }

    @GetMapping("/breakers/{name}")
    public CircuitBreakerMetrics breaker(@PathVariable String name) {
        return circuitBreakers.get(name).getMetrics();
    }

    /**
     * Ask whether a call may go out; 503 while the circuit is open.
     */
    @PostMapping("/breakers/{name}/acquire")
    public ResponseEntity<Map<String, Object>> canExecute(@PathVariable String name) {
        CircuitBreaker breaker = circuitBreakers.get(name);
        boolean allowed = breaker.canExecute();

        Map<String, Object> response = new HashMap<>();
        response.put("breaker", name);
        response.put("allowed", allowed);
        response.put("state", breaker.getState());

        return ResponseEntity.status(allowed ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @PostMapping("/breakers/{name}/success")
    public CircuitBreakerMetrics recordSuccess(@PathVariable String name) {
        CircuitBreaker breaker = circuitBreakers.get(name);
        breaker.recordSuccess();
        return breaker.getMetrics();
    }

    @PostMapping("/breakers/{name}/failure")
    public CircuitBreakerMetrics recordFailure(
            @PathVariable String name,
            @RequestBody(required = false) FailureReport report) {
        CircuitBreaker breaker = circuitBreakers.get(name);
        breaker.recordFailure(report == null || report.reason() == null ? null : new IllegalStateException(report.reason()));
        return breaker.getMetrics();
    }

    @DeleteMapping("/breakers/{name}")
    public ResponseEntity<Void> resetBreaker(@PathVariable String name) {
        circuitBreakers.get(name).reset();
        return ResponseEntity.noContent().build();
    }
}

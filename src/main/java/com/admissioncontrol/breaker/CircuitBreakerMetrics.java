package com.admissioncontrol.breaker;

import lombok.Builder;
import lombok.Value;

/**
 * Cumulative counters of a breaker; state transitions never reset them.
 */
@Value
@Builder
public class CircuitBreakerMetrics {
    String name;
    long totalRequests;
    long successfulRequests;
    long failedRequests;
    CircuitState state;
    long failureCount;
    double successRate;
}

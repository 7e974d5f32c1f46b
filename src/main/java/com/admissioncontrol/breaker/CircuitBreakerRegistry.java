package com.admissioncontrol.breaker;

import com.admissioncontrol.storage.StateStorage;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link CircuitBreaker} per name, all sharing the same
 * store and configuration. Breakers hold no state of their own, so two
 * registries (or two processes) naming the same breaker see the same circuit.
 */
public class CircuitBreakerRegistry {

    private final StateStorage storage;
    private final CircuitBreakerConfig config;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(
            StateStorage storage,
            CircuitBreakerConfig config,
            MeterRegistry meterRegistry,
            Clock clock) {
        config.validate();
        this.storage = storage;
        this.config = config;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public CircuitBreaker get(String name) {
        return breakers.computeIfAbsent(name,
                breakerName -> new CircuitBreaker(breakerName, storage, config, meterRegistry, clock));
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }
}

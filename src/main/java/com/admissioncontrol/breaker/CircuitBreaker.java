package com.admissioncontrol.breaker;

import com.admissioncontrol.storage.StateStorage;
import com.admissioncontrol.storage.StorageException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Three-state circuit breaker (CLOSED -> OPEN -> HALF_OPEN -> CLOSED) with
 * its state kept in shared storage, so every process sees the same circuit.
 *
 * The breaker does not classify outcomes: callers decide what counts as a
 * failure of the dependency. It is independent of rate limiting; check
 * both before a call.
 */
@Slf4j
public class CircuitBreaker {

    private static final String TOTAL = "total_requests";
    private static final String SUCCESSFUL = "successful_requests";
    private static final String FAILED = "failed_requests";

    private final String name;
    private final StateStorage storage;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final String stateKey;
    private final String failureCountKey;
    private final String lastFailureKey;
    private final String metricsKey;
    private final String backoffKey;
    private final String probeKey;

    public CircuitBreaker(String name, StateStorage storage, CircuitBreakerConfig config, MeterRegistry meterRegistry) {
        this(name, storage, config, meterRegistry, Clock.systemUTC());
    }

    public CircuitBreaker(
            String name,
            StateStorage storage,
            CircuitBreakerConfig config,
            MeterRegistry meterRegistry,
            Clock clock) {

        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Circuit breaker name is required");
        }
        config.validate();
        this.name = name;
        this.storage = storage;
        this.config = config;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        this.stateKey = "circuit_breaker_state:" + name;
        this.failureCountKey = "circuit_breaker_failures:" + name;
        this.lastFailureKey = "circuit_breaker_last_failure:" + name;
        this.metricsKey = "circuit_breaker_metrics:" + name;
        this.backoffKey = "circuit_breaker_backoff:" + name;
        this.probeKey = "circuit_breaker_probe:" + name;
    }

    /**
     * Whether a call may be attempted now. Moves an OPEN circuit to
     * HALF_OPEN once the recovery timeout has passed; the caller that sees
     * that transition owns the single probe.
     */
    public boolean canExecute() {
        try {
            if (getState() == CircuitState.CLOSED) {
                return true;
            }

            Optional<Admission> admission = storage.watchAndCommit(
                    List.of(stateKey, lastFailureKey, probeKey), (snapshot, writer) -> {
                        double now = nowSeconds();
                        switch (parseState(snapshot.get(stateKey))) {
                            case CLOSED:
                                return Admission.ALLOWED;
                            case OPEN:
                                if (!recoveryTimeoutElapsed(snapshot.get(lastFailureKey), now)) {
                                    return Admission.DENIED;
                                }
                                writer.set(stateKey, CircuitState.HALF_OPEN.name(), null);
                                writer.set(probeKey, String.valueOf(now), config.getRecoveryTimeout());
                                return Admission.PROBE_AFTER_TRANSITION;
                            case HALF_OPEN:
                            default:
                                if (snapshot.containsKey(probeKey)) {
                                    return Admission.DENIED;
                                }
                                // previous probe never reported back within its window
                                writer.set(probeKey, String.valueOf(now), config.getRecoveryTimeout());
                                return Admission.PROBE;
                        }
                    });

            if (admission.isEmpty()) {
                log.debug("Circuit breaker '{}' changed concurrently, denying", name);
                return false;
            }
            if (admission.get() == Admission.PROBE_AFTER_TRANSITION) {
                transitioned(CircuitState.HALF_OPEN);
                log.info("Circuit breaker '{}' entered HALF_OPEN, allowing probe request", name);
            }
            return admission.get() != Admission.DENIED;
        } catch (StorageException e) {
            if (!config.isFallbackOnStoreError()) {
                throw e;
            }
            log.warn("Circuit breaker '{}' cannot reach the store, allowing request: {}", name, e.getMessage());
            return true;
        }
    }

    /**
     * Record a successful call. Closes a HALF_OPEN circuit and clears the
     * failure count of a CLOSED one.
     */
    public void recordSuccess() {
        try {
            updateMetrics(true);
            if (config.isEnableBackoff()) {
                storage.delete(backoffKey);
            }

            transact("success", context -> {
                if (context.previous == CircuitState.HALF_OPEN) {
                    context.writer.set(stateKey, CircuitState.CLOSED.name(), null);
                    context.writer.delete(failureCountKey);
                    context.writer.delete(lastFailureKey);
                    context.writer.delete(probeKey);
                    context.target = CircuitState.CLOSED;
                } else if (context.previous == CircuitState.CLOSED && context.snapshot.containsKey(failureCountKey)) {
                    context.writer.delete(failureCountKey);
                }
            }).ifPresent(context -> {
                if (context.target == CircuitState.CLOSED) {
                    transitioned(CircuitState.CLOSED);
                    log.info("Circuit breaker '{}' closed after successful recovery", name);
                }
            });
        } catch (StorageException e) {
            onStoreErrorWhileRecording("success", e);
        }
    }

    /**
     * Record a failed call.
     *
     * @param cause what went wrong, may be null
     */
    public void recordFailure(Throwable cause) {
        try {
            updateMetrics(false);
            if (config.isEnableBackoff()) {
                storage.incrementAndExpire(backoffKey, config.getBackoffExpiration());
            }

            transact("failure", context -> {
                long failures = parseLong(context.snapshot.get(failureCountKey)) + 1;
                context.failures = failures;
                context.writer.set(failureCountKey, String.valueOf(failures), null);
                context.writer.set(lastFailureKey, String.valueOf(nowSeconds()), null);

                boolean trips = context.previous == CircuitState.CLOSED && failures >= config.getFailureThreshold();
                if (trips || context.previous == CircuitState.HALF_OPEN) {
                    context.writer.set(stateKey, CircuitState.OPEN.name(), null);
                    context.writer.delete(probeKey);
                    context.target = CircuitState.OPEN;
                }
            }).ifPresent(context -> {
                if (context.target != CircuitState.OPEN) {
                    return;
                }
                transitioned(CircuitState.OPEN);
                if (context.previous == CircuitState.HALF_OPEN) {
                    log.warn("Circuit breaker '{}' returned to OPEN after failed probe{}", name, describe(cause));
                } else {
                    log.warn("Circuit breaker '{}' opened after {} failures{}", name, context.failures, describe(cause));
                }
            });
        } catch (StorageException e) {
            onStoreErrorWhileRecording("failure", e);
        }
    }

    /**
     * Give back a HALF_OPEN probe slot without reporting an outcome, for an
     * admitted caller whose call said nothing about the dependency (for
     * example a request the API rejected as invalid). No-op otherwise.
     */
    public void releaseHalfOpenSlot() {
        try {
            if (getState() == CircuitState.HALF_OPEN) {
                storage.delete(probeKey);
                log.debug("Circuit breaker '{}' probe slot released without an outcome", name);
            }
        } catch (StorageException e) {
            onStoreErrorWhileRecording("probe release", e);
        }
    }

    public CircuitState getState() {
        return parseState(storage.get(stateKey));
    }

    public long getFailureCount() {
        return parseLong(storage.get(failureCountKey));
    }

    /**
     * Exponential backoff: 2^level seconds, capped, zero when backoff is
     * disabled or the last outcome was a success.
     */
    public Duration getBackoffDelay() {
        if (!config.isEnableBackoff()) {
            return Duration.ZERO;
        }
        long level = parseLong(storage.get(backoffKey));
        if (level <= 0) {
            return Duration.ZERO;
        }
        long capSeconds = config.getMaxBackoff().toSeconds();
        long seconds = level >= 31 ? capSeconds : Math.min(1L << level, capSeconds);
        return Duration.ofSeconds(seconds);
    }

    public CircuitBreakerMetrics getMetrics() {
        Map<String, String> counters = storage.hashGetAll(metricsKey);
        long total = parseLong(counters.get(TOTAL));
        long successful = parseLong(counters.get(SUCCESSFUL));

        return CircuitBreakerMetrics.builder()
                .name(name)
                .totalRequests(total)
                .successfulRequests(successful)
                .failedRequests(parseLong(counters.get(FAILED)))
                .state(getState())
                .failureCount(getFailureCount())
                .successRate(total > 0 ? (double) successful / total : 0.0)
                .build();
    }

    /**
     * Force the circuit back to CLOSED. Cumulative metrics are kept.
     */
    public void reset() {
        storage.delete(stateKey, failureCountKey, lastFailureKey, backoffKey, probeKey);
        log.info("Circuit breaker '{}' reset to CLOSED", name);
    }

    public String getName() {
        return name;
    }

    /**
     * Run a transition against the breaker keys, retrying a bounded number
     * of times when another writer commits first.
     */
    private Optional<TransitionContext> transact(String outcome, TransitionBody body) {
        for (int attempt = 1; attempt <= config.getMaxTransitionAttempts(); attempt++) {
            Optional<TransitionContext> committed = storage.watchAndCommit(
                    List.of(stateKey, failureCountKey, lastFailureKey, probeKey), (snapshot, writer) -> {
                        TransitionContext context =
                                new TransitionContext(snapshot, writer, parseState(snapshot.get(stateKey)));
                        body.apply(context);
                        return context;
                    });
            if (committed.isPresent()) {
                return committed;
            }
            log.debug("Circuit breaker '{}' changed concurrently while recording {} (attempt {}/{})",
                    name, outcome, attempt, config.getMaxTransitionAttempts());
        }
        log.warn("Circuit breaker '{}' could not record {} after {} attempts",
                name, outcome, config.getMaxTransitionAttempts());
        return Optional.empty();
    }

    private void updateMetrics(boolean success) {
        storage.hashIncrement(metricsKey, TOTAL, 1);
        storage.hashIncrement(metricsKey, success ? SUCCESSFUL : FAILED, 1);
    }

    private void onStoreErrorWhileRecording(String outcome, StorageException e) {
        if (!config.isFallbackOnStoreError()) {
            throw e;
        }
        log.warn("Circuit breaker '{}' could not record {}: {}", name, outcome, e.getMessage());
    }

    private boolean recoveryTimeoutElapsed(String lastFailure, double now) {
        if (lastFailure == null) {
            return true;
        }
        double elapsed = now - Double.parseDouble(lastFailure);
        return elapsed * 1000.0 >= config.getRecoveryTimeout().toMillis();
    }

    private void transitioned(CircuitState target) {
        Counter.builder("admission.breaker.transitions")
                .description("Circuit breaker state transitions")
                .tag("breaker", name)
                .tag("state", target.name())
                .register(meterRegistry)
                .increment();
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    private static CircuitState parseState(String value) {
        if (value == null) {
            return CircuitState.CLOSED;
        }
        try {
            return CircuitState.valueOf(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown circuit state '{}', treating as CLOSED", value);
            return CircuitState.CLOSED;
        }
    }

    private static long parseLong(String value) {
        return value == null ? 0L : Long.parseLong(value);
    }

    private static String describe(Throwable cause) {
        return cause == null ? "" : ": " + cause.getMessage();
    }

    private enum Admission {
        ALLOWED,
        DENIED,
        PROBE,
        PROBE_AFTER_TRANSITION
    }

    @FunctionalInterface
    private interface TransitionBody {
        void apply(TransitionContext context);
    }

    private static final class TransitionContext {
        final Map<String, String> snapshot;
        final StateStorage.TransactionWriter writer;
        final CircuitState previous;
        CircuitState target;
        long failures;

        TransitionContext(Map<String, String> snapshot, StateStorage.TransactionWriter writer, CircuitState previous) {
            this.snapshot = snapshot;
            this.writer = writer;
            this.previous = previous;
        }
    }
}

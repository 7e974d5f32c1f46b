package com.admissioncontrol.algorithms;

import com.admissioncontrol.core.BucketConfig;
import com.admissioncontrol.core.BucketStatus;
import com.admissioncontrol.core.RateLimiter;
import com.admissioncontrol.storage.InMemoryStateStorage;
import com.admissioncontrol.storage.StateStorage;
import com.admissioncontrol.storage.StorageException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Leaky bucket with a safety factor and no artificial burst limit.
 *
 * Tokens accumulate at effective_rate = nominal_rate * safety_factor and
 * each permit consumes one. Buckets start empty and, unless a cap is
 * configured, keep accruing while idle; sustained throughput converges to
 * the effective rate regardless of idle history.
 *
 * On Redis the refill-compare-write runs as one Lua script. Stores without
 * scripting run the same arithmetic inside an optimistic transaction; a
 * transaction lost to a concurrent writer is a denial, not a retry.
 */
@Slf4j
public class LeakyBucketRateLimiter implements RateLimiter {

    static final String KEY_PREFIX = "rate_limit:";

    // Returns {granted, tokens_after}; tokens are returned as a string since
    // Redis truncates Lua numbers to integers
    private static final String LUA_SCRIPT =
            "local tokens = tonumber(redis.call('GET', KEYS[1]))\n" +
            "local last_refill = tonumber(redis.call('GET', KEYS[2]))\n" +
            "local rate = tonumber(ARGV[1])\n" +
            "local now = tonumber(ARGV[2])\n" +
            "local ttl = tonumber(ARGV[3])\n" +
            "local cap = tonumber(ARGV[4])\n" +
            "\n" +
            "if tokens == nil then\n" +
            "  tokens = 0\n" +
            "  last_refill = now\n" +
            "elseif last_refill == nil then\n" +
            "  last_refill = now\n" +
            "end\n" +
            "\n" +
            "tokens = tokens + (now - last_refill) * rate\n" +
            "if cap > 0 and tokens > cap then\n" +
            "  tokens = cap\n" +
            "end\n" +
            "\n" +
            "local granted = 0\n" +
            "if tokens >= 1.0 then\n" +
            "  tokens = tokens - 1.0\n" +
            "  granted = 1\n" +
            "end\n" +
            "\n" +
            "redis.call('SET', KEYS[1], tostring(tokens), 'EX', ttl)\n" +
            "redis.call('SET', KEYS[2], tostring(now), 'EX', ttl)\n" +
            "return {granted, tostring(tokens)}";

    protected final StateStorage storage;
    protected final BucketConfig config;
    protected final Clock clock;

    // Non-authoritative, used only while the shared store is unreachable
    private final StateStorage fallbackStorage;

    private final Counter allowedRequests;
    private final Counter rejectedRequests;
    private final Counter degradedDecisions;

    public LeakyBucketRateLimiter(StateStorage storage, BucketConfig config, MeterRegistry meterRegistry) {
        this(storage, config, meterRegistry, Clock.systemUTC());
    }

    public LeakyBucketRateLimiter(
            StateStorage storage,
            BucketConfig config,
            MeterRegistry meterRegistry,
            Clock clock) {

        config.validate();
        this.storage = storage;
        this.config = config;
        this.clock = clock;
        this.fallbackStorage = new InMemoryStateStorage(clock);

        String limiter = getClass().getSimpleName();
        this.allowedRequests = Counter.builder("admission.bucket.allowed")
                .description("Permits granted")
                .tag("limiter", limiter)
                .register(meterRegistry);

        this.rejectedRequests = Counter.builder("admission.bucket.rejected")
                .description("Permits denied")
                .tag("limiter", limiter)
                .register(meterRegistry);

        this.degradedDecisions = Counter.builder("admission.bucket.degraded")
                .description("Decisions taken without the shared store")
                .tag("limiter", limiter)
                .register(meterRegistry);

        log.info("Rate limiter initialized: {}", this);
    }

    @Override
    public boolean tryAcquire(String key) {
        return tryAcquire(key, config.getEffectiveRate());
    }

    /**
     * Acquire one permit from the bucket {@code key}, replenished at the
     * given rate (tokens per second, safety factor already applied).
     */
    protected boolean tryAcquire(String key, double effectiveRate) {
        boolean allowed;
        try {
            allowed = acquire(storage, key, effectiveRate);
        } catch (StorageException e) {
            allowed = acquireDegraded(key, effectiveRate, e);
        }

        if (allowed) {
            allowedRequests.increment();
        } else {
            rejectedRequests.increment();
        }
        return allowed;
    }

    private boolean acquireDegraded(String key, double effectiveRate, StorageException cause) {
        degradedDecisions.increment();
        if (!config.isFallbackOnStoreError()) {
            log.error("Shared store unavailable, denying permit for '{}': {}", key, cause.getMessage());
            return false;
        }
        log.warn("Shared store unavailable, using process-local bucket for '{}' (degraded, not coordinated): {}",
                key, cause.getMessage());
        return acquire(fallbackStorage, key, effectiveRate);
    }

    private boolean acquire(StateStorage store, String key, double effectiveRate) {
        String bucketKey = bucketKey(key);
        String timestampKey = timestampKey(key);
        double now = nowSeconds();

        if (store.supportsScripting()) {
            Object result = store.evalScript(
                    LUA_SCRIPT,
                    List.of(bucketKey, timestampKey),
                    List.of(
                            String.valueOf(effectiveRate),
                            String.valueOf(now),
                            String.valueOf(config.getWindowSize().toSeconds()),
                            String.valueOf(config.getMaxAccumulatedTokens())));
            return interpretScriptResult(key, result);
        }

        return store.watchAndCommit(List.of(bucketKey, timestampKey), (snapshot, writer) -> {
            BucketState state = BucketState.parse(snapshot.get(bucketKey), snapshot.get(timestampKey), now)
                    .refill(now, effectiveRate, config.getMaxAccumulatedTokens());
            boolean granted = state.hasPermit();
            if (granted) {
                state = state.consume();
            }
            writer.set(bucketKey, state.encodedTokens(), config.getWindowSize());
            writer.set(timestampKey, state.encodedLastRefill(), config.getWindowSize());

            log.trace("Token {} for key '{}': tokens={}, effective_rate={}",
                    granted ? "acquired" : "denied", key, state.getTokens(), effectiveRate);
            return granted;
        }).orElseGet(() -> {
            log.debug("Concurrent update on bucket '{}', denying", key);
            return false;
        });
    }

    private boolean interpretScriptResult(String key, Object result) {
        if (!(result instanceof List<?> response) || response.size() < 2) {
            throw new StorageException("Unexpected bucket script result: " + result);
        }
        boolean granted = Long.parseLong(String.valueOf(response.get(0))) == 1L;
        log.trace("Token {} for key '{}': tokens={}", granted ? "acquired" : "denied", key, response.get(1));
        return granted;
    }

    @Override
    public long getAvailablePermits(String key) {
        try {
            return (long) Math.max(0, Math.floor(peek(key, config.getEffectiveRate()).getTokens()));
        } catch (StorageException e) {
            log.warn("Unable to read bucket '{}': {}", key, e.getMessage());
            return -1;
        }
    }

    /**
     * Current state of a bucket without consuming anything.
     */
    public BucketStatus getBucketStatus(String key) {
        return describe(key, config.getEffectiveRate());
    }

    protected BucketStatus describe(String key, double effectiveRate) {
        double now = nowSeconds();
        BucketState stored = load(key, now);
        BucketState refilled = stored.refill(now, effectiveRate, config.getMaxAccumulatedTokens());

        return BucketStatus.builder()
                .key(key)
                .storedTokens(stored.getTokens())
                .effectiveTokens(refilled.getTokens())
                .secondsSinceRefill(now - stored.getLastRefill())
                .lastRefill(stored.getLastRefill())
                .effectiveRate(effectiveRate)
                .safetyFactor(config.getSafetyFactor())
                .windowSizeSeconds(config.getWindowSize().toSeconds())
                .build();
    }

    protected BucketState peek(String key, double effectiveRate) {
        double now = nowSeconds();
        return load(key, now).refill(now, effectiveRate, config.getMaxAccumulatedTokens());
    }

    private BucketState load(String key, double now) {
        return BucketState.parse(storage.get(bucketKey(key)), storage.get(timestampKey(key)), now);
    }

    @Override
    public void reset(String key) {
        storage.delete(bucketKey(key), timestampKey(key));
        fallbackStorage.delete(bucketKey(key), timestampKey(key));
        log.info("Rate limit bucket reset for key '{}'", key);
    }

    public BucketConfig getConfig() {
        return config;
    }

    protected double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    static String bucketKey(String key) {
        return KEY_PREFIX + key;
    }

    static String timestampKey(String key) {
        return KEY_PREFIX + key + ":timestamp";
    }

    @Override
    public String toString() {
        return String.format("%s(api_limit=%s/s, safety_factor=%s, effective_rate=%s/s, window=%ss, burst_cap=%s)",
                getClass().getSimpleName(),
                config.getNominalRatePerSecond(),
                config.getSafetyFactor(),
                config.getEffectiveRate(),
                config.getWindowSize().toSeconds(),
                config.isBurstCapped() ? config.getMaxAccumulatedTokens() : "none");
    }
}

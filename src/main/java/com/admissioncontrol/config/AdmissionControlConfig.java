package com.admissioncontrol.config;

import com.admissioncontrol.algorithms.CloseRateLimiter;
import com.admissioncontrol.algorithms.LeakyBucketRateLimiter;
import com.admissioncontrol.breaker.CircuitBreakerConfig;
import com.admissioncontrol.breaker.CircuitBreakerRegistry;
import com.admissioncontrol.client.GovernedHttpClient;
import com.admissioncontrol.client.OutboundRequestHandler;
import com.admissioncontrol.core.ApiRateProfile;
import com.admissioncontrol.core.BucketConfig;
import com.admissioncontrol.endpoint.EndpointLimitConfig;
import com.admissioncontrol.queue.PermitGate;
import com.admissioncontrol.queue.QueueConfig;
import com.admissioncontrol.queue.RequestQueue;
import com.admissioncontrol.storage.RedisStateStorage;
import com.admissioncontrol.storage.StateStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the admission components from {@code application.yml}.
 */
@Slf4j
@Configuration
public class AdmissionControlConfig {

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    /**
     * Named preset (instantly, close_crm); when set it supplies the nominal
     * rate and safety factor instead of the two properties below
     */
    @Value("${admission.bucket.profile:}")
    private String bucketProfile;

    @Value("${admission.bucket.nominal-rate-per-second:10.0}")
    private double nominalRatePerSecond;

    @Value("${admission.bucket.safety-factor:0.8}")
    private double safetyFactor;

    @Value("${admission.bucket.window-size-seconds:60}")
    private long windowSizeSeconds;

    @Value("${admission.bucket.max-accumulated-tokens:0}")
    private double maxAccumulatedTokens;

    @Value("${admission.fallback-on-store-error:true}")
    private boolean fallbackOnStoreError;

    @Value("${admission.endpoint.conservative-default-rps:1.0}")
    private double conservativeDefaultRps;

    @Value("${admission.endpoint.cache-expiration-seconds:300}")
    private long cacheExpirationSeconds;

    @Value("${admission.endpoint.api-host:api.close.com}")
    private String apiHost;

    @Value("${admission.breaker.failure-threshold:5}")
    private int failureThreshold;

    @Value("${admission.breaker.recovery-timeout-seconds:60}")
    private long recoveryTimeoutSeconds;

    @Value("${admission.breaker.enable-backoff:false}")
    private boolean enableBackoff;

    @Value("${admission.queue.name:close_api}")
    private String queueName;

    @Value("${admission.queue.breaker:close_api}")
    private String queueBreakerName;

    @Value("${admission.queue.max-workers:5}")
    private int maxWorkers;

    @Value("${admission.queue.max-token-attempts:10}")
    private int maxTokenAttempts;

    @Value("${admission.queue.token-retry-delay-ms:500}")
    private long tokenRetryDelayMs;

    @Value("${admission.queue.max-retries:2}")
    private int maxRetries;

    @Value("${admission.queue.result-ttl-seconds:3600}")
    private long resultTtlSeconds;

    @Value("${admission.client.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${admission.client.read-timeout-ms:30000}")
    private long readTimeoutMs;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public RedisStateStorage stateStorage() {
        log.info("Initializing Redis storage at {}:{}", redisHost, redisPort);
        return new RedisStateStorage(redisHost, redisPort);
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public BucketConfig bucketConfig() {
        BucketConfig base;
        if (bucketProfile == null || bucketProfile.isBlank()) {
            base = BucketConfig.builder()
                    .nominalRatePerSecond(nominalRatePerSecond)
                    .safetyFactor(safetyFactor)
                    .build();
        } else {
            ApiRateProfile profile = ApiRateProfile.named(bucketProfile);
            log.info("Using rate profile {}", profile);
            base = BucketConfig.forProfile(profile);
        }
        return base.toBuilder()
                .windowSize(Duration.ofSeconds(windowSizeSeconds))
                .maxAccumulatedTokens(maxAccumulatedTokens)
                .fallbackOnStoreError(fallbackOnStoreError)
                .build();
    }

    @Bean
    public EndpointLimitConfig endpointLimitConfig() {
        return EndpointLimitConfig.close().toBuilder()
                .conservativeDefaultRps(conservativeDefaultRps)
                .cacheExpiration(Duration.ofSeconds(cacheExpirationSeconds))
                .apiHost(apiHost)
                .build();
    }

    @Bean
    public CircuitBreakerConfig circuitBreakerConfig() {
        return CircuitBreakerConfig.builder()
                .failureThreshold(failureThreshold)
                .recoveryTimeout(Duration.ofSeconds(recoveryTimeoutSeconds))
                .enableBackoff(enableBackoff)
                .fallbackOnStoreError(fallbackOnStoreError)
                .build();
    }

    @Bean
    public QueueConfig queueConfig() {
        return QueueConfig.builder()
                .queueName(queueName)
                .maxWorkers(maxWorkers)
                .maxTokenAttempts(maxTokenAttempts)
                .tokenRetryDelay(Duration.ofMillis(tokenRetryDelayMs))
                .maxRetries(maxRetries)
                .resultTtl(Duration.ofSeconds(resultTtlSeconds))
                .build();
    }

    /**
     * Plain buckets addressed by caller-chosen keys
     */
    @Bean
    public LeakyBucketRateLimiter bucketRateLimiter(
            StateStorage storage,
            BucketConfig bucketConfig,
            MeterRegistry meterRegistry,
            Clock clock) {
        return new LeakyBucketRateLimiter(storage, bucketConfig, meterRegistry, clock);
    }

    @Bean
    public CloseRateLimiter closeRateLimiter(
            StateStorage storage,
            BucketConfig bucketConfig,
            EndpointLimitConfig endpointLimitConfig,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            Clock clock) {
        return new CloseRateLimiter(storage, bucketConfig, endpointLimitConfig, objectMapper, meterRegistry, clock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            StateStorage storage,
            CircuitBreakerConfig circuitBreakerConfig,
            MeterRegistry meterRegistry,
            Clock clock) {
        return new CircuitBreakerRegistry(storage, circuitBreakerConfig, meterRegistry, clock);
    }

    @Bean
    public GovernedHttpClient governedHttpClient(
            RestTemplateBuilder restTemplateBuilder,
            CloseRateLimiter closeRateLimiter,
            CircuitBreakerRegistry circuitBreakerRegistry,
            ObjectMapper objectMapper,
            QueueConfig queueConfig) {

        return new GovernedHttpClient(
                restTemplateBuilder
                        .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                        .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                        .build(),
                closeRateLimiter,
                circuitBreakerRegistry.get(queueBreakerName),
                objectMapper,
                queueConfig.getMaxTokenAttempts(),
                queueConfig.getTokenRetryDelay());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RequestQueue requestQueue(
            StateStorage storage,
            QueueConfig queueConfig,
            CloseRateLimiter closeRateLimiter,
            CircuitBreakerRegistry circuitBreakerRegistry,
            GovernedHttpClient governedHttpClient,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            Clock clock) {

        return new RequestQueue(
                storage,
                queueConfig,
                PermitGate.perEndpoint(closeRateLimiter),
                new OutboundRequestHandler(governedHttpClient, objectMapper),
                circuitBreakerRegistry.get(queueBreakerName),
                objectMapper,
                meterRegistry,
                clock);
    }
}

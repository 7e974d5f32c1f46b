package com.admissioncontrol.web;

import com.admissioncontrol.algorithms.CloseRateLimiter;
import com.admissioncontrol.algorithms.LeakyBucketRateLimiter;
import com.admissioncontrol.breaker.CircuitBreakerConfig;
import com.admissioncontrol.breaker.CircuitBreakerRegistry;
import com.admissioncontrol.core.BucketConfig;
import com.admissioncontrol.endpoint.EndpointLimitConfig;
import com.admissioncontrol.storage.InMemoryStateStorage;
import com.admissioncontrol.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AdmissionControllerTest {

    private static final String LEAD_URL = "https://api.close.com/api/v1/lead/lead_123/";

    private MutableClock clock;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        InMemoryStateStorage storage = new InMemoryStateStorage(clock);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        BucketConfig bucketConfig = BucketConfig.builder()
                .nominalRatePerSecond(1)
                .safetyFactor(1.0)
                .build();

        AdmissionController controller = new AdmissionController(
                new LeakyBucketRateLimiter(storage, bucketConfig, meterRegistry, clock),
                new CloseRateLimiter(storage, bucketConfig, EndpointLimitConfig.close(),
                        new ObjectMapper(), meterRegistry, clock),
                new CircuitBreakerRegistry(storage,
                        CircuitBreakerConfig.builder().failureThreshold(2).build(), meterRegistry, clock));

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should answer 429 until the bucket has a token")
    void shouldAcquireFromBucket() throws Exception {
        mockMvc.perform(post("/api/admission/buckets/user-1/acquire"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.allowed").value(false));

        clock.advance(Duration.ofSeconds(1));

        mockMvc.perform(post("/api/admission/buckets/user-1/acquire"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true))
                .andExpect(jsonPath("$.remaining").value(0));
    }

    @Test
    @DisplayName("Should describe and reset a bucket")
    void shouldDescribeAndResetBucket() throws Exception {
        mockMvc.perform(post("/api/admission/buckets/user-1/acquire"));
        clock.advance(Duration.ofSeconds(3));

        mockMvc.perform(get("/api/admission/buckets/user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key").value("user-1"))
                .andExpect(jsonPath("$.effectiveTokens").value(3.0))
                .andExpect(jsonPath("$.effectiveRate").value(1.0));

        mockMvc.perform(delete("/api/admission/buckets/user-1"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/admission/buckets/user-1"))
                .andExpect(jsonPath("$.effectiveTokens").value(0.0));
    }

    @Test
    @DisplayName("Should map URLs to endpoint buckets")
    void shouldAcquireForEndpoint() throws Exception {
        mockMvc.perform(post("/api/admission/endpoints/acquire")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"" + LEAD_URL + "\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.endpointKey").value("/api/v1/lead/"));
    }

    @Test
    @DisplayName("Should answer 400 for URLs outside the API")
    void shouldRejectInvalidUrl() throws Exception {
        mockMvc.perform(post("/api/admission/endpoints/acquire")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.com/api/v1/lead/\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/api/admission/endpoints/acquire"));
    }

    @Test
    @DisplayName("Should learn limits from observed responses")
    void shouldObserveLimits() throws Exception {
        mockMvc.perform(get("/api/admission/endpoints/limits").param("key", "/api/v1/lead/"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/admission/endpoints/observe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"" + LEAD_URL + "\",\"headers\":{\"RateLimit\":\"limit=160; remaining=159; reset=8\"}}"))
                .andExpect(status().isAccepted());

        mockMvc.perform(get("/api/admission/endpoints/limits").param("key", "/api/v1/lead/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.limit").value(160))
                .andExpect(jsonPath("$.remaining").value(159))
                .andExpect(jsonPath("$.reset").value(8));
    }

    @Test
    @DisplayName("Should drive a circuit breaker over HTTP")
    void shouldDriveBreaker() throws Exception {
        mockMvc.perform(post("/api/admission/breakers/crm/failure")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"HTTP 503\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failureCount").value(1));
        mockMvc.perform(post("/api/admission/breakers/crm/failure"))
                .andExpect(jsonPath("$.state").value("OPEN"));

        mockMvc.perform(post("/api/admission/breakers/crm/acquire"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.allowed").value(false));

        mockMvc.perform(delete("/api/admission/breakers/crm"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/admission/breakers/crm"))
                .andExpect(jsonPath("$.state").value("CLOSED"))
                .andExpect(jsonPath("$.failedRequests").value(2));

        mockMvc.perform(post("/api/admission/breakers/crm/success"))
                .andExpect(jsonPath("$.successfulRequests").value(1));
    }
}

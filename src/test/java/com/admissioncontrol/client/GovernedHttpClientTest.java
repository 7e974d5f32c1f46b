package com.admissioncontrol.client;

import com.admissioncontrol.algorithms.CloseRateLimiter;
import com.admissioncontrol.breaker.CircuitBreaker;
import com.admissioncontrol.breaker.CircuitBreakerConfig;
import com.admissioncontrol.breaker.CircuitOpenException;
import com.admissioncontrol.core.BucketConfig;
import com.admissioncontrol.core.RateLimitExceededException;
import com.admissioncontrol.endpoint.EndpointLimitConfig;
import com.admissioncontrol.endpoint.InvalidEndpointUrlException;
import com.admissioncontrol.queue.CallOutcome;
import com.admissioncontrol.storage.InMemoryStateStorage;
import com.admissioncontrol.storage.StorageException;
import com.admissioncontrol.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class GovernedHttpClientTest {

    private static final String LEAD_URL = "https://api.close.com/api/v1/lead/lead_123/";
    private static final String LEAD_KEY = "/api/v1/lead/";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private MockRestServiceServer server;
    private CloseRateLimiter limiter;
    private CircuitBreaker breaker;
    private GovernedHttpClient client;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        InMemoryStateStorage storage = new InMemoryStateStorage(clock);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

        limiter = new CloseRateLimiter(storage,
                BucketConfig.builder().nominalRatePerSecond(5).build(),
                EndpointLimitConfig.close(), objectMapper, meterRegistry, clock);
        breaker = new CircuitBreaker("close", storage,
                CircuitBreakerConfig.builder().failureThreshold(2).build(), meterRegistry, clock);

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new GovernedHttpClient(restTemplate, limiter, breaker, objectMapper, 2, Duration.ZERO);
    }

    /**
     * A new bucket starts empty; touch it and let one token accrue.
     */
    private void earnPermit() {
        limiter.acquireForEndpoint(LEAD_URL);
        clock.advance(Duration.ofSeconds(1));
    }

    private static OutboundRequest get(String url) {
        return OutboundRequest.builder().url(url).build();
    }

    @Test
    @DisplayName("Should call the API and learn the endpoint limit from the response")
    void shouldCallAndLearnLimit() {
        earnPermit();
        server.expect(requestTo(LEAD_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"id\":\"lead_123\"}", MediaType.APPLICATION_JSON)
                        .header("ratelimit", "limit=160; remaining=159; reset=8"));

        CallOutcome outcome = client.execute(get(LEAD_URL));

        server.verify();
        assertEquals(CallOutcome.Kind.SUCCEEDED, outcome.getKind());
        assertEquals("lead_123", outcome.getValue().get("id").asText());
        assertEquals(160, limiter.getEndpointLimits(LEAD_KEY).orElseThrow().getLimit());
        assertEquals(1, breaker.getMetrics().getSuccessfulRequests());
    }

    @Test
    @DisplayName("Should send method, headers and JSON body")
    void shouldSendRequestDetails() throws Exception {
        earnPermit();
        server.expect(requestTo("https://api.close.com/api/v1/lead/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Basic abc"))
                .andExpect(content().json("{\"name\":\"Acme\"}"))
                .andRespond(withStatus(HttpStatus.CREATED));

        CallOutcome outcome = client.execute(OutboundRequest.builder()
                .method("post")
                .url("https://api.close.com/api/v1/lead/")
                .header("Authorization", "Basic abc")
                .body(objectMapper.readTree("{\"name\":\"Acme\"}"))
                .build());

        server.verify();
        assertEquals(CallOutcome.Kind.SUCCEEDED, outcome.getKind());
        assertNull(outcome.getValue());
    }

    @Test
    @DisplayName("Should report server errors to the breaker as retryable")
    void shouldClassifyServerError() {
        earnPermit();
        server.expect(requestTo(LEAD_URL)).andRespond(withServerError());

        CallOutcome outcome = client.execute(get(LEAD_URL));

        assertEquals(CallOutcome.Kind.RETRYABLE, outcome.getKind());
        assertTrue(outcome.getError().contains("500"));
        assertEquals(1, breaker.getFailureCount());
    }

    @Test
    @DisplayName("Should treat 429 as a dependency failure")
    void shouldClassifyTooManyRequests() {
        earnPermit();
        server.expect(requestTo(LEAD_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .header("RateLimit", "limit=60; remaining=0; reset=30"));

        CallOutcome outcome = client.execute(get(LEAD_URL));

        assertEquals(CallOutcome.Kind.RETRYABLE, outcome.getKind());
        assertEquals(60, limiter.getEndpointLimits(LEAD_KEY).orElseThrow().getLimit());
    }

    @Test
    @DisplayName("Should not blame the dependency for client errors")
    void shouldClassifyClientError() {
        earnPermit();
        server.expect(requestTo(LEAD_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        CallOutcome outcome = client.execute(get(LEAD_URL));

        assertEquals(CallOutcome.Kind.FATAL, outcome.getKind());
        assertEquals(0, breaker.getFailureCount());
        assertEquals(0, breaker.getMetrics().getTotalRequests());
    }

    @Test
    @DisplayName("Should treat I/O errors as retryable")
    void shouldClassifyIoError() {
        earnPermit();
        server.expect(requestTo(LEAD_URL)).andRespond(request -> {
            throw new IOException("connection reset");
        });

        CallOutcome outcome = client.execute(get(LEAD_URL));

        assertEquals(CallOutcome.Kind.RETRYABLE, outcome.getKind());
        assertTrue(outcome.getError().contains("connection reset"));
    }

    @Test
    @DisplayName("Should refuse to call while the circuit is open")
    void shouldRefuseWhenCircuitOpen() {
        earnPermit();
        breaker.recordFailure(null);
        breaker.recordFailure(null);

        assertThrows(CircuitOpenException.class, () -> client.execute(get(LEAD_URL)));
        server.verify();
    }

    @Test
    @DisplayName("Should give up when no permit is granted within the attempt budget")
    void shouldGiveUpWithoutPermit() {
        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
                () -> client.execute(get(LEAD_URL)));

        assertEquals(LEAD_KEY, e.getIdentifier());
        assertEquals(2, e.getAttempts());
        server.verify();
    }

    @Test
    @DisplayName("Should reject URLs outside the API before anything else")
    void shouldRejectInvalidUrl() {
        assertThrows(InvalidEndpointUrlException.class, () -> client.execute(get("https://example.com/")));
        assertEquals(CallOutcome.Kind.FATAL, client.send(get("https://example.com/")).getKind());
    }

    @Test
    @DisplayName("Should keep a successful outcome when the learned limit cannot be stored")
    void shouldKeepSuccessWhenLimitCannotBeStored() {
        InMemoryStateStorage failingWrites = new InMemoryStateStorage(clock) {
            @Override
            public synchronized void set(String key, String value, Duration ttl) {
                throw new StorageException("write refused");
            }
        };
        CloseRateLimiter failClosed = new CloseRateLimiter(failingWrites,
                BucketConfig.builder().nominalRatePerSecond(5).fallbackOnStoreError(false).build(),
                EndpointLimitConfig.close(), objectMapper, new SimpleMeterRegistry(), clock);
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer failingServer = MockRestServiceServer.bindTo(restTemplate).build();
        GovernedHttpClient failingClient =
                new GovernedHttpClient(restTemplate, failClosed, breaker, objectMapper, 1, Duration.ZERO);
        failingServer.expect(requestTo(LEAD_URL))
                .andRespond(withSuccess("{\"id\":\"lead_123\"}", MediaType.APPLICATION_JSON)
                        .header("ratelimit", "limit=160; remaining=159; reset=8"));

        CallOutcome outcome = failingClient.send(get(LEAD_URL));

        failingServer.verify();
        assertEquals(CallOutcome.Kind.SUCCEEDED, outcome.getKind());
        assertEquals("lead_123", outcome.getValue().get("id").asText());
    }

    @Test
    @DisplayName("Should reject a request without method as a caller error")
    void shouldRejectMissingMethod() {
        earnPermit();
        OutboundRequest noMethod = OutboundRequest.builder().method(null).url(LEAD_URL).build();

        CallOutcome outcome = client.execute(noMethod);

        server.verify();
        assertEquals(CallOutcome.Kind.FATAL, outcome.getKind());
        assertEquals(0, breaker.getFailureCount());
    }
}

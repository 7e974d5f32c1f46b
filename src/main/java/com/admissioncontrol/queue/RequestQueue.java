package com.admissioncontrol.queue;

import com.admissioncontrol.breaker.CircuitBreaker;
import com.admissioncontrol.breaker.CircuitOpenException;
import com.admissioncontrol.core.AdmissionControlException;
import com.admissioncontrol.core.RateLimitExceededException;
import com.admissioncontrol.storage.StateStorage;
import com.admissioncontrol.storage.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Durable request queue whose workers only call out once they hold a permit.
 *
 * Entries move atomically from {@code queue:<name>} to
 * {@code processing:<name>} when a worker takes them, and from there to
 * {@code completed:<name>} or {@code failed:<name>}. Results are also stored
 * under {@code result:<name>:<id>} for a limited time so any process can
 * look them up; the caller's future is resolved by the enqueuing process.
 *
 * Entries left in processing by a crashed worker are not reclaimed
 * automatically, see {@link #requeueProcessing()}. A future whose entry is
 * finished by another instance fails once the result TTL has passed.
 */
@Slf4j
public class RequestQueue {

    private final StateStorage storage;
    private final QueueConfig config;
    private final PermitGate permitGate;
    private final RequestHandler handler;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final String queueKey;
    private final String processingKey;
    private final String completedKey;
    private final String failedKey;

    // futures of entries another instance may finish; expire with the result
    private final Cache<String, CompletableFuture<RequestResult>> pending;

    private final Counter completedRequests;
    private final Counter failedRequests;

    private ExecutorService workers;
    private volatile boolean running;

    /**
     * @param circuitBreaker consulted before every execution, may be null
     */
    public RequestQueue(
            StateStorage storage,
            QueueConfig config,
            PermitGate permitGate,
            RequestHandler handler,
            CircuitBreaker circuitBreaker,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this(storage, config, permitGate, handler, circuitBreaker, objectMapper, meterRegistry, Clock.systemUTC());
    }

    public RequestQueue(
            StateStorage storage,
            QueueConfig config,
            PermitGate permitGate,
            RequestHandler handler,
            CircuitBreaker circuitBreaker,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            Clock clock) {

        config.validate();
        this.storage = storage;
        this.config = config;
        this.permitGate = permitGate;
        this.handler = handler;
        this.circuitBreaker = circuitBreaker;
        this.objectMapper = objectMapper;
        this.clock = clock;

        long origin = clock.millis();
        this.pending = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis() - origin))
                .expireAfterWrite(config.getResultTtl())
                .<String, CompletableFuture<RequestResult>>evictionListener((id, future, cause) -> {
                    if (future != null && cause == RemovalCause.EXPIRED) {
                        future.completeExceptionally(new AdmissionControlException(
                                "Request " + id + " was not finished by this process within " + config.getResultTtl()
                                        + ", look it up with findResult"));
                    }
                })
                .build();

        String name = config.getQueueName();
        this.queueKey = "queue:" + name;
        this.processingKey = "processing:" + name;
        this.completedKey = "completed:" + name;
        this.failedKey = "failed:" + name;

        this.completedRequests = Counter.builder("admission.queue.completed")
                .description("Queued requests that completed")
                .tag("queue", name)
                .register(meterRegistry);

        this.failedRequests = Counter.builder("admission.queue.failed")
                .description("Queued requests that failed")
                .tag("queue", name)
                .register(meterRegistry);
    }

    /**
     * Append a request to the queue.
     *
     * @param payload anything Jackson can turn into a tree
     * @return the request id and a future resolved when a worker of this
     *         process finishes the request
     * @throws StorageException if the entry could not be persisted
     */
    public QueuedRequest enqueue(Object payload) {
        QueueEntry entry = newEntry(payload);
        CompletableFuture<RequestResult> future = new CompletableFuture<>();
        // registered first, a worker may finish the entry before leftPush returns
        pending.put(entry.getId(), future);
        try {
            push(entry);
        } catch (StorageException e) {
            pending.invalidate(entry.getId());
            throw e;
        }
        return new QueuedRequest(entry.getId(), future);
    }

    /**
     * Append a request without tracking it locally; the outcome is only
     * available through {@link #findResult}.
     *
     * @return the request id
     */
    public String submit(Object payload) {
        QueueEntry entry = newEntry(payload);
        push(entry);
        return entry.getId();
    }

    private QueueEntry newEntry(Object payload) {
        return QueueEntry.builder()
                .id(UUID.randomUUID().toString())
                .payload(objectMapper.valueToTree(payload))
                .enqueuedAt(clock.millis())
                .build();
    }

    private void push(QueueEntry entry) {
        storage.leftPush(queueKey, toJson(entry));
        log.debug("Enqueued request {} on {}", entry.getId(), queueKey);
    }

    public synchronized void start() {
        if (running) {
            log.warn("Queue '{}' is already running", config.getQueueName());
            return;
        }
        running = true;
        workers = Executors.newFixedThreadPool(config.getMaxWorkers(), workerThreads(config.getQueueName()));
        for (int i = 0; i < config.getMaxWorkers(); i++) {
            int workerId = i;
            workers.submit(() -> workerLoop(workerId));
        }
        log.info("Started {} workers for queue '{}'", config.getMaxWorkers(), config.getQueueName());
    }

    /**
     * Stop taking new entries and wait for in-flight ones to finish.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers of queue '{}' did not stop within {}, interrupting",
                        config.getQueueName(), config.getShutdownTimeout());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stopped queue '{}'", config.getQueueName());
    }

    public boolean isRunning() {
        return running;
    }

    public QueueStatus status() {
        return QueueStatus.builder()
                .queueName(config.getQueueName())
                .queued(storage.listLength(queueKey))
                .processing(storage.listLength(processingKey))
                .completed(storage.listLength(completedKey))
                .failed(storage.listLength(failedKey))
                .running(running)
                .build();
    }

    /**
     * Look up a finished request by id, from any process, until its result expires.
     */
    public Optional<RequestResult> findResult(String requestId) {
        String stored = storage.get(resultKey(requestId));
        if (stored == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(stored, RequestResult.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable result stored for request {}: {}", requestId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Put every entry of the processing list back on the queue. Meant for
     * recovery after a crash, while no worker of this queue is running
     * anywhere; otherwise an in-flight entry would be executed twice.
     *
     * @return number of entries moved
     */
    public int requeueProcessing() {
        int moved = 0;
        for (String raw : storage.listRange(processingKey)) {
            if (storage.listRemove(processingKey, raw) > 0) {
                storage.leftPush(queueKey, raw);
                moved++;
            }
        }
        if (moved > 0) {
            log.warn("Requeued {} entries left in {}", moved, processingKey);
        }
        return moved;
    }

    /**
     * Drop all lists of this queue. Futures still waiting in this process
     * are failed.
     */
    public void purge() {
        storage.delete(queueKey, processingKey, completedKey, failedKey);
        pending.asMap().forEach((id, future) ->
                future.completeExceptionally(new AdmissionControlException("Queue '" + config.getQueueName() + "' was purged")));
        pending.invalidateAll();
        log.info("Purged queue '{}'", config.getQueueName());
    }

    /**
     * Futures of this process still waiting for a result.
     */
    long pendingCount() {
        pending.cleanUp();
        return pending.estimatedSize();
    }

    public QueueConfig getConfig() {
        return config;
    }

    private void workerLoop(int workerId) {
        log.debug("Worker {} of queue '{}' started", workerId, config.getQueueName());
        while (running && !Thread.currentThread().isInterrupted()) {
            String raw;
            try {
                raw = storage.blockingMove(queueKey, processingKey, config.getPollTimeout());
            } catch (StorageException e) {
                log.error("Worker {} cannot read queue '{}': {}", workerId, config.getQueueName(), e.getMessage());
                if (!pause(config.getPollTimeout())) {
                    break;
                }
                continue;
            }
            if (raw == null) {
                continue;
            }
            try {
                process(raw, workerId);
            } catch (RuntimeException e) {
                log.error("Worker {} failed while processing an entry of queue '{}'", workerId, config.getQueueName(), e);
            }
        }
        log.debug("Worker {} of queue '{}' stopped", workerId, config.getQueueName());
    }

    void process(String raw, int workerId) {
        QueueEntry entry;
        try {
            entry = objectMapper.readValue(raw, QueueEntry.class);
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable entry from {}: {}", processingKey, e.getMessage());
            storage.leftPush(failedKey, raw);
            storage.listRemove(processingKey, raw);
            failedRequests.increment();
            return;
        }

        RequestResult result;
        try {
            result = execute(entry, workerId);
        } catch (StorageException e) {
            // breaker store down with fail-closed policy
            result = failure(entry, workerId, 1, FailureKind.DEPENDENCY_FAILURE, e.getMessage());
        }
        finish(raw, entry, result);
    }

    private RequestResult execute(QueueEntry entry, int workerId) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                if (!acquirePermit(entry)) {
                    log.warn("Request {} not executed, no permit after {} attempts",
                            entry.getId(), config.getMaxTokenAttempts());
                    return failure(entry, workerId, attempt, FailureKind.RATE_LIMITED,
                            "No permit after " + config.getMaxTokenAttempts() + " attempts");
                }
            } catch (IllegalArgumentException e) {
                return failure(entry, workerId, attempt, FailureKind.REJECTED, e.getMessage());
            }

            // checked last so a HALF_OPEN probe is only taken by a worker that will call
            if (circuitBreaker != null && !circuitBreaker.canExecute()) {
                log.warn("Request {} not executed, circuit breaker '{}' is open",
                        entry.getId(), circuitBreaker.getName());
                return failure(entry, workerId, attempt, FailureKind.CIRCUIT_OPEN,
                        "Circuit breaker '" + circuitBreaker.getName() + "' is open");
            }

            CallOutcome outcome = call(entry);
            switch (outcome.getKind()) {
                case SUCCEEDED:
                    if (circuitBreaker != null) {
                        circuitBreaker.recordSuccess();
                    }
                    return RequestResult.builder()
                            .id(entry.getId())
                            .status(RequestResult.Status.COMPLETED)
                            .value(outcome.getValue())
                            .attempts(attempt)
                            .workerId(workerId)
                            .enqueuedAt(entry.getEnqueuedAt())
                            .finishedAt(clock.millis())
                            .build();
                case FATAL:
                    if (circuitBreaker != null) {
                        circuitBreaker.releaseHalfOpenSlot();
                    }
                    log.warn("Request {} rejected: {}", entry.getId(), outcome.getError());
                    return failure(entry, workerId, attempt, FailureKind.REJECTED, outcome.getError());
                case RETRYABLE:
                default:
                    if (circuitBreaker != null) {
                        circuitBreaker.recordFailure(new RequestFailedException(
                                entry.getId(), FailureKind.DEPENDENCY_FAILURE, outcome.getError()));
                    }
                    if (attempt > config.getMaxRetries()) {
                        log.error("Request {} failed after {} attempts: {}", entry.getId(), attempt, outcome.getError());
                        return failure(entry, workerId, attempt, FailureKind.DEPENDENCY_FAILURE, outcome.getError());
                    }
                    log.warn("Request {} failed (attempt {}/{}), retrying: {}",
                            entry.getId(), attempt, config.getMaxRetries() + 1, outcome.getError());
                    if (!pause(retryDelay())) {
                        return failure(entry, workerId, attempt, FailureKind.DEPENDENCY_FAILURE, outcome.getError());
                    }
            }
        }
    }

    private boolean acquirePermit(QueueEntry entry) {
        for (int attempt = 1; attempt <= config.getMaxTokenAttempts(); attempt++) {
            if (permitGate.tryAcquire(entry)) {
                return true;
            }
            if (attempt < config.getMaxTokenAttempts() && !pause(config.getTokenRetryDelay())) {
                return false;
            }
        }
        return false;
    }

    private CallOutcome call(QueueEntry entry) {
        try {
            CallOutcome outcome = handler.handle(entry);
            return outcome != null ? outcome : CallOutcome.succeeded(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallOutcome.retryable("Interrupted");
        } catch (Exception e) {
            log.warn("Handler failed for request {}", entry.getId(), e);
            return CallOutcome.retryable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Duration retryDelay() {
        if (circuitBreaker != null) {
            try {
                Duration backoff = circuitBreaker.getBackoffDelay();
                if (!backoff.isZero()) {
                    return backoff;
                }
            } catch (StorageException e) {
                log.debug("No backoff available: {}", e.getMessage());
            }
        }
        return config.getRetryDelay();
    }

    private void finish(String raw, QueueEntry entry, RequestResult result) {
        if (result.isSuccess()) {
            completedRequests.increment();
        } else {
            failedRequests.increment();
        }

        try {
            String record = toJson(result);
            storage.leftPush(result.isSuccess() ? completedKey : failedKey, record);
            storage.set(resultKey(entry.getId()), record, config.getResultTtl());
            storage.listRemove(processingKey, raw);
        } catch (StorageException e) {
            log.error("Could not record result of request {}, entry stays in {}: {}",
                    entry.getId(), processingKey, e.getMessage());
        }

        CompletableFuture<RequestResult> future = pending.asMap().remove(entry.getId());
        if (future == null) {
            return;
        }
        if (result.isSuccess()) {
            future.complete(result);
        } else {
            future.completeExceptionally(toException(result));
        }
    }

    private RuntimeException toException(RequestResult result) {
        switch (result.getFailure()) {
            case RATE_LIMITED:
                return new RateLimitExceededException(config.getQueueName(), config.getMaxTokenAttempts());
            case CIRCUIT_OPEN:
                return new CircuitOpenException(circuitBreaker.getName());
            default:
                return new RequestFailedException(result.getId(), result.getFailure(), result.getError());
        }
    }

    private RequestResult failure(QueueEntry entry, int workerId, int attempts, FailureKind kind, String error) {
        return RequestResult.builder()
                .id(entry.getId())
                .status(RequestResult.Status.FAILED)
                .failure(kind)
                .error(error)
                .attempts(attempts)
                .workerId(workerId)
                .enqueuedAt(entry.getEnqueuedAt())
                .finishedAt(clock.millis())
                .build();
    }

    private String resultKey(String requestId) {
        return "result:" + config.getQueueName() + ":" + requestId;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory workerThreads(String queueName) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "queue-" + queueName + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}

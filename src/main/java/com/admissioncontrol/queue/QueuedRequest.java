package com.admissioncontrol.queue;

import lombok.Value;

import java.util.concurrent.CompletableFuture;

/**
 * Handle returned to the caller of {@link RequestQueue#enqueue}.
 *
 * The future is resolved only by a worker of the enqueuing process; other
 * processes can read the outcome through {@link RequestQueue#findResult}.
 */
@Value
public class QueuedRequest {
    String id;
    CompletableFuture<RequestResult> future;
}

package com.admissioncontrol.queue;

/**
 * Executes the external call behind a queue entry. Called by a worker
 * only after a permit was granted. A thrown exception counts as a
 * retryable failure of the dependency.
 */
@FunctionalInterface
public interface RequestHandler {

    CallOutcome handle(QueueEntry entry) throws Exception;
}

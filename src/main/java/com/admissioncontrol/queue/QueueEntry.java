package com.admissioncontrol.queue;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A unit of work as persisted in the queue lists.
 */
@Value
@Builder
@Jacksonized
public class QueueEntry {

    /**
     * Correlation id, also the key of the stored result
     */
    String id;

    JsonNode payload;

    /**
     * Epoch milliseconds
     */
    long enqueuedAt;
}

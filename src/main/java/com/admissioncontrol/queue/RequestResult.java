package com.admissioncontrol.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Final outcome of a queued request, stored under its id and delivered
 * through the caller's future.
 */
@Value
@Builder
@Jacksonized
public class RequestResult {

    public enum Status {
        COMPLETED,
        FAILED
    }

    String id;
    Status status;
    FailureKind failure;
    JsonNode value;
    String error;
    int attempts;
    int workerId;
    long enqueuedAt;
    long finishedAt;

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }
}

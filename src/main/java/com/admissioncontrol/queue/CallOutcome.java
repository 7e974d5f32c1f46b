package com.admissioncontrol.queue;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What a {@link RequestHandler} reports back for one execution.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CallOutcome {

    public enum Kind {
        SUCCEEDED,
        /**
         * The dependency failed (5xx, 429, timeout, connection error); worth retrying
         */
        RETRYABLE,
        /**
         * The request itself is wrong; retrying cannot help
         */
        FATAL
    }

    Kind kind;
    JsonNode value;
    String error;

    public static CallOutcome succeeded(JsonNode value) {
        return new CallOutcome(Kind.SUCCEEDED, value, null);
    }

    public static CallOutcome retryable(String error) {
        return new CallOutcome(Kind.RETRYABLE, null, error);
    }

    public static CallOutcome fatal(String error) {
        return new CallOutcome(Kind.FATAL, null, error);
    }
}

package com.admissioncontrol.endpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Last rate limit the dependency reported for one endpoint.
 */
@Value
public class EndpointLimits {

    /**
     * Requests allowed per minute
     */
    int limit;

    int remaining;

    /**
     * Seconds until the dependency resets its window
     */
    int reset;

    @JsonCreator
    public EndpointLimits(
            @JsonProperty("limit") int limit,
            @JsonProperty("remaining") int remaining,
            @JsonProperty("reset") int reset) {
        this.limit = limit;
        this.remaining = remaining;
        this.reset = reset;
    }
}

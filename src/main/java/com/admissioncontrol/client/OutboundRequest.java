package com.admissioncontrol.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A call to the rate-limited API, in a form that can also travel through
 * the request queue as a JSON payload.
 */
@Value
@Builder
@Jacksonized
public class OutboundRequest {

    @Builder.Default
    String method = "GET";

    String url;

    @Singular
    Map<String, String> headers;

    JsonNode body;
}
